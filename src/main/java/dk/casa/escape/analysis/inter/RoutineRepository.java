package dk.casa.escape.analysis.inter;

import dk.casa.escape.ir.MethodIdentifier;
import dk.casa.escape.ir.Routine;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** The routine bodies available to the inter-procedural analysis. */
public class RoutineRepository {
	private final Map<MethodIdentifier, Routine> routines = new ConcurrentHashMap<>();

	public RoutineRepository register(Routine routine) {
		routines.put(routine.getMethod(), routine);
		return this;
	}

	public RoutineRepository registerAll(Routine... routines) {
		for(Routine routine : routines) register(routine);
		return this;
	}

	public Optional<Routine> lookup(MethodIdentifier method) {
		return Optional.ofNullable(routines.get(method));
	}

	public int size() {
		return routines.size();
	}
}

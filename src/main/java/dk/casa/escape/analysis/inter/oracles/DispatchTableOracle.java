package dk.casa.escape.analysis.inter.oracles;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import dk.casa.escape.ir.CallInstruction;
import dk.casa.escape.ir.MethodIdentifier;
import dk.casa.escape.ir.Routine;

import java.util.Optional;
import java.util.Set;

/**
 * Resolves calls through a table from a generic target to the implementations it may dispatch
 * to, e.g. the methods selected by splitting a union-typed argument. Targets missing from the
 * table are left to another oracle.
 */
public class DispatchTableOracle implements ResolutionOracle {
	private final SetMultimap<MethodIdentifier, MethodIdentifier> table = LinkedHashMultimap.create();
	private final ResolutionOracle fallback;

	public DispatchTableOracle(ResolutionOracle fallback) {
		this.fallback = fallback;
	}

	public DispatchTableOracle() {
		this(new DirectCallOracle());
	}

	public DispatchTableOracle addCandidate(MethodIdentifier target, MethodIdentifier implementation) {
		table.put(target, implementation);
		return this;
	}

	@Override
	public Optional<Set<MethodIdentifier>> resolveCandidates(Routine caller, CallInstruction call) {
		MethodIdentifier target = call.getTarget();
		if(call.isDynamic() || target == null || !table.containsKey(target))
			return fallback.resolveCandidates(caller, call);
		return Optional.of(ImmutableSet.copyOf(table.get(target)));
	}
}

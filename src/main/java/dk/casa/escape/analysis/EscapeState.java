package dk.casa.escape.analysis;

import com.google.common.collect.ImmutableMap;
import dk.casa.escape.ir.BitTypes;
import dk.casa.escape.ir.Routine;
import dk.casa.escape.ir.ValueId;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The escape element of every value of one routine. There is a single element per value for
 * the whole routine. Elements only grow, and values of a bit type never leave
 * {@link EscapeElement#NO_ESCAPE}.
 */
public class EscapeState {
	private final Routine routine;
	private final Map<ValueId, EscapeElement> elements = new HashMap<>();
	private final Map<ValueId, Boolean> exempt = new HashMap<>();
	private final Set<ValueId> changed = new LinkedHashSet<>();

	public EscapeState(Routine routine) {
		this.routine = routine;
	}

	public Routine getRoutine() {
		return routine;
	}

	public EscapeElement get(ValueId id) {
		checkValue(id);
		return elements.getOrDefault(id, EscapeElement.NO_ESCAPE);
	}

	/**
	 * Joins {@code element} onto the element of {@code id}.
	 * @return whether the stored element changed
	 */
	public boolean merge(ValueId id, EscapeElement element) {
		if(isExempt(id) || element.isNoEscape()) return false;

		EscapeElement old = elements.getOrDefault(id, EscapeElement.NO_ESCAPE);
		EscapeElement res = old.merge(element);
		if(res.equals(old)) return false;

		elements.put(id, res);
		changed.add(id);
		return true;
	}

	/** Whether the static type of {@code id} rules out heap references */
	public boolean isExempt(ValueId id) {
		checkValue(id);
		return exempt.computeIfAbsent(id, v -> BitTypes.isBitType(routine.typeOf(v)));
	}

	/** The values that changed since the last call, in the order they changed */
	Set<ValueId> drainChanged() {
		Set<ValueId> res = new LinkedHashSet<>(changed);
		changed.clear();
		return res;
	}

	public ImmutableMap<ValueId, EscapeElement> snapshot() {
		return ImmutableMap.copyOf(elements);
	}

	private void checkValue(ValueId id) {
		if(!routine.contains(id))
			throw new IllegalArgumentException("Value " + id + " does not belong to " + routine.getMethod());
	}
}

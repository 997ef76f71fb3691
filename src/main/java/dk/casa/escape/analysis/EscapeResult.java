package dk.casa.escape.analysis;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import dk.casa.escape.analysis.inter.CallSummary;
import dk.casa.escape.ir.Routine;
import dk.casa.escape.ir.ValueId;
import dk.casa.escape.utils.Dotable;
import org.apache.commons.math3.util.Pair;

import java.util.ArrayList;
import java.util.List;

/** The finished classification of every value of a routine. */
public class EscapeResult implements Dotable {
	private final Routine routine;
	private final ImmutableMap<ValueId, EscapeElement> elements;
	private final ImmutableSortedMap<String, Integer> statistics;

	public EscapeResult(Routine routine, ImmutableMap<ValueId, EscapeElement> elements, ImmutableSortedMap<String, Integer> statistics) {
		this.routine = routine;
		this.elements = elements;
		this.statistics = statistics;
	}

	public Routine getRoutine() {
		return routine;
	}

	public EscapeElement classificationOf(ValueId id) {
		if(!routine.contains(id))
			throw new IllegalArgumentException("Value " + id + " does not belong to " + routine.getMethod());
		return elements.getOrDefault(id, EscapeElement.NO_ESCAPE);
	}

	public EscapeElement getArgument(int slot) {
		return classificationOf(ValueId.argument(slot));
	}

	public EscapeElement getSsaValue(int pc) {
		return classificationOf(ValueId.ssa(pc));
	}

	public boolean isNoEscape(ValueId id) {
		return classificationOf(id).isNoEscape();
	}

	public boolean hasReturnEscape(ValueId id) {
		return classificationOf(id).hasReturnEscape();
	}

	public boolean hasThrownEscape(ValueId id) {
		return classificationOf(id).hasThrownEscape();
	}

	public boolean hasGlobalEscape(ValueId id) {
		return classificationOf(id).hasGlobalEscape();
	}

	public boolean hasAllEscape(ValueId id) {
		return classificationOf(id).hasAllEscape();
	}

	/** Counters collected while analysing, e.g. summary cache hits and conservative fallbacks */
	public ImmutableSortedMap<String, Integer> getStatistics() {
		return statistics;
	}

	/**
	 * The summary of this routine for callers: the element of each argument slot and the join
	 * of the elements of all returned values.
	 */
	public CallSummary getSummary() {
		List<EscapeElement> args = new ArrayList<>();
		for(int i = 0; i < routine.getArgumentCount(); i++) args.add(getArgument(i));

		EscapeElement ret = EscapeElement.NO_ESCAPE;
		for(Pair<Integer, ValueId> exit : routine.getReturns())
			ret = ret.merge(classificationOf(exit.getSecond()));
		return new CallSummary(args, ret);
	}

	@Override
	public String toDot(String label) {
		return routine.toDot(label, pc -> {
			EscapeElement element = getSsaValue(pc);
			return element.isNoEscape() ? "" : "[" + element + "]";
		});
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(routine.getMethod().toString()).append('\n');
		for(int i = 0; i < routine.getArgumentCount(); i++)
			sb.append(String.format("  _%d: %s%n", i, getArgument(i)));
		for(int pc = 0; pc < routine.size(); pc++)
			sb.append(String.format("  %%%d: %s  # %s%n", pc, getSsaValue(pc), routine.getInstruction(pc)));
		return sb.toString();
	}
}

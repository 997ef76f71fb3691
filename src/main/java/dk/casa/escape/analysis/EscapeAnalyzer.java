package dk.casa.escape.analysis;

import com.google.common.base.Stopwatch;
import dk.casa.escape.ir.BasicBlock;
import dk.casa.escape.ir.Routine;
import dk.casa.escape.ir.ValueId;
import dk.casa.escape.utils.Counter;
import org.apache.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs the escape effects of a routine's reachable instructions until no element changes.
 *
 * The state is a single map for the whole routine, so the element of a value at a
 * control-flow merge is the join over all incoming paths. A block is queued again whenever a
 * value it defines or uses changes, which also revisits loop bodies until they are stable.
 * Terminates since every effect is monotone and each element can grow only finitely often.
 */
public class EscapeAnalyzer {
	private static final Logger logger = Logger.getLogger(EscapeAnalyzer.class);

	private final CallHandler callHandler;
	private final EscapeAnalysisConfig config;

	public EscapeAnalyzer(CallHandler callHandler, EscapeAnalysisConfig config) {
		this.callHandler = callHandler;
		this.config = config;
	}

	/** An analyzer that treats every call as unresolvable */
	public EscapeAnalyzer() {
		this(CallHandler.CONSERVATIVE, EscapeAnalysisConfig.DEFAULT);
	}

	public EscapeResult analyze(Routine routine) {
		return analyze(routine, new Counter<>());
	}

	public EscapeResult analyze(Routine routine, Counter<String> statistics) {
		Stopwatch stopwatch = Stopwatch.createStarted();

		EscapeState state = new EscapeState(routine);
		EscapeInterpreter interpreter = new EscapeInterpreter(state, callHandler, statistics);

		if(config.seedArgumentReturnEscape())
			for(int i = 0; i < routine.getArgumentCount(); i++)
				state.merge(ValueId.argument(i), EscapeElement.argumentEscape());

		boolean[] reachable = reachableBlocks(routine);
		List<Set<ValueId>> regionUses = regionUses(routine, reachable);
		int numBlocks = routine.getBlocks().size();
		boolean[] queued = new boolean[numBlocks];
		ArrayDeque<Integer> Q = new ArrayDeque<>();
		for(int b = 0; b < numBlocks; b++)
			if(reachable[b]) {
				Q.add(b);
				queued[b] = true;
			}

		int visits = 0;
		while(!Q.isEmpty()) {
			int b = Q.remove();
			queued[b] = false;
			visits++;

			BasicBlock block = routine.getBlock(b);
			execute(block, interpreter, state, regionUses.get(b));

			for(ValueId changed : state.drainChanged())
				for(int dependent : dependentBlocks(routine, changed))
					if(reachable[dependent] && !queued[dependent]) {
						queued[dependent] = true;
						Q.add(dependent);
					}
		}

		statistics.inc("solver.blockVisits", visits);
		if(logger.isDebugEnabled())
			logger.debug(String.format("Analysed %s in %s (%d block visits)", routine.getMethod(), stopwatch, visits));

		return new EscapeResult(routine, state.snapshot(), statistics.snapshot());
	}

	private static void execute(BasicBlock block, EscapeInterpreter interpreter, EscapeState state, Set<ValueId> earlierUses) {
		// Exceptions are not tracked per throw point: in a protected region everything used
		// before an instruction that may throw is assumed to reach the handler.
		Set<ValueId> used = block.isProtected() ? new LinkedHashSet<>(earlierUses) : null;

		for(int pc = block.start; pc < block.end; pc++) {
			interpreter.execute(pc);

			if(used != null) {
				used.addAll(state.getRoutine().getInstruction(pc).getOperands());
				if(interpreter.mayThrow(pc))
					for(ValueId value : used) state.merge(value, EscapeElement.THROWN_ESCAPE);
			}
		}
	}

	/** Blocks whose effects read or write the element of {@code id} */
	private static Set<Integer> dependentBlocks(Routine routine, ValueId id) {
		Set<Integer> res = new LinkedHashSet<>();
		if(id.isSsa()) res.add(routine.blockOf(id.index).index);
		for(int user : routine.getUsers(id)) res.add(routine.blockOf(user).index);
		return res;
	}

	/**
	 * For each protected block, the operands of the blocks of the same protected region that may
	 * run before it without leaving the region. Empty for unprotected blocks.
	 */
	static List<Set<ValueId>> regionUses(Routine routine, boolean[] reachable) {
		int numBlocks = routine.getBlocks().size();
		List<List<Integer>> predecessors = new ArrayList<>();
		for(int b = 0; b < numBlocks; b++) predecessors.add(new ArrayList<>());
		for(BasicBlock block : routine.getBlocks()) {
			if(!reachable[block.index] || !block.isProtected()) continue;
			for(int succ : block.getSuccessors())
				if(routine.getBlock(succ).getHandler() == block.getHandler())
					predecessors.get(succ).add(block.index);
		}

		List<Set<ValueId>> res = new ArrayList<>();
		for(BasicBlock block : routine.getBlocks()) {
			Set<ValueId> uses = new LinkedHashSet<>();
			if(reachable[block.index] && block.isProtected()) {
				boolean[] seen = new boolean[numBlocks];
				ArrayDeque<Integer> stack = new ArrayDeque<>(predecessors.get(block.index));
				while(!stack.isEmpty()) {
					int pred = stack.pop();
					if(seen[pred]) continue;
					seen[pred] = true;
					BasicBlock earlier = routine.getBlock(pred);
					for(int pc = earlier.start; pc < earlier.end; pc++)
						uses.addAll(routine.getInstruction(pc).getOperands());
					stack.addAll(predecessors.get(pred));
				}
			}
			res.add(uses);
		}
		return res;
	}

	static boolean[] reachableBlocks(Routine routine) {
		boolean[] reachable = new boolean[routine.getBlocks().size()];
		ArrayDeque<Integer> stack = new ArrayDeque<>();
		stack.push(0);
		reachable[0] = true;
		while(!stack.isEmpty()) {
			BasicBlock block = routine.getBlock(stack.pop());
			for(int succ : block.getSuccessors())
				if(!reachable[succ]) {
					reachable[succ] = true;
					stack.push(succ);
				}
			if(block.isProtected() && !reachable[block.getHandler()]) {
				reachable[block.getHandler()] = true;
				stack.push(block.getHandler());
			}
		}
		return reachable;
	}
}

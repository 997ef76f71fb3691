package dk.casa.escape.analysis.inter;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;
import dk.casa.escape.analysis.*;
import dk.casa.escape.analysis.inter.oracles.ResolutionOracle;
import dk.casa.escape.ir.CallInstruction;
import dk.casa.escape.ir.MethodIdentifier;
import dk.casa.escape.ir.Routine;
import dk.casa.escape.ir.ValueId;
import dk.casa.escape.utils.Counter;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maps callee summaries onto call sites. Summaries come from the shared {@link SummaryCache} or
 * are computed by analysing the callee with this propagator, so one instance serves exactly one
 * top-level analysis run and tracks the callees currently being summarised.
 */
public class CallPropagator implements CallHandler {
	private static final Logger logger = Logger.getLogger(CallPropagator.class);

	private final RoutineRepository repository;
	private final ResolutionOracle oracle;
	private final EscapeAnalysisConfig config;
	private final SummaryCache cache;
	private final Counter<String> statistics;

	// Call sites already counted, by statistics key. Instructions compare by identity
	private final SetMultimap<String, CallInstruction> counted = HashMultimap.create();

	// Callees being summarised, outermost first
	private final List<InProgress> stack = new ArrayList<>();

	private static class InProgress {
		final CallSignature signature;
		final int depth;
		CallSummary placeholder;
		// Whether the current iteration read its own placeholder
		boolean recursive = false;
		// Smallest depth of an enclosing placeholder this summary depends on
		int lowlink = Integer.MAX_VALUE;

		InProgress(CallSignature signature, int depth, CallSummary placeholder) {
			this.signature = signature;
			this.depth = depth;
			this.placeholder = placeholder;
		}
	}

	public CallPropagator(RoutineRepository repository, ResolutionOracle oracle, EscapeAnalysisConfig config,
	                      SummaryCache cache, Counter<String> statistics) {
		this.repository = repository;
		this.oracle = oracle;
		this.config = config;
		this.cache = cache;
		this.statistics = statistics;
	}

	@Override
	public void handleCall(int pc, CallInstruction call, EscapeState state) {
		Optional<Set<MethodIdentifier>> candidates = oracle.resolveCandidates(state.getRoutine(), call);
		if(!candidates.isPresent() || candidates.get().isEmpty()) {
			countOnce("call.unresolved", call);
			EscapeInterpreter.escapeEverything(pc, call, state);
			return;
		}

		CallSummary summary;
		try {
			summary = summarize(call, candidates.get());
		} catch(UnanalyzableCallException exc) {
			if(countOnce("call.unanalyzable", call))
				logger.warn(exc.getMessage() + (exc.getCause() != null ? " (" + exc.getCause() + ")" : ""));
			EscapeInterpreter.escapeEverything(pc, call, state);
			return;
		}

		applySummary(pc, call, summary, state);
	}

	/** Counts {@code key} for the first visit of {@code call} only, the solver may revisit its block */
	private boolean countOnce(String key, CallInstruction call) {
		if(!counted.put(key, call)) return false;
		statistics.add(key);
		return true;
	}

	/** Joins the summaries of all candidates */
	CallSummary summarize(CallInstruction call, Set<MethodIdentifier> candidates) throws UnanalyzableCallException {
		if(candidates.size() > config.getMaxCandidates())
			throw new UnanalyzableCallException(call, candidates.size() + " dispatch candidates");
		if(candidates.size() > 1) countOnce("call.split", call);

		CallSummary res = null;
		for(MethodIdentifier candidate : candidates) {
			Routine callee = repository.lookup(candidate)
					.orElseThrow(() -> new UnanalyzableCallException(call, "no body for " + candidate));
			CallSummary summary = summaryOf(call, callee);
			res = res == null ? summary : res.merge(summary);
		}
		return res;
	}

	private CallSummary summaryOf(CallInstruction call, Routine callee) throws UnanalyzableCallException {
		CallSignature signature = CallSignature.of(callee);
		Optional<CallSummary> cached = cache.get(signature);
		if(cached.isPresent()) {
			statistics.add("summary.hit");
			return cached.get();
		}

		for(InProgress frame : stack)
			if(frame.signature.equals(signature)) {
				statistics.add("summary.placeholder");
				dependOn(stack.get(stack.size() - 1), frame.depth);
				return frame.placeholder;
			}

		if(stack.size() >= config.getMaxCallDepth())
			throw new UnanalyzableCallException(call, "call depth limit of " + config.getMaxCallDepth() + " reached");

		InProgress frame = new InProgress(signature, stack.size(), CallSummary.bottom(callee.getArgumentCount()));
		stack.add(frame);
		CallSummary result;
		try {
			result = solveRecursively(call, callee, frame);
		} finally {
			stack.remove(stack.size() - 1);
		}

		if(frame.lowlink < frame.depth) {
			// Computed against an enclosing placeholder that may still grow
			dependOn(stack.get(stack.size() - 1), frame.lowlink);
			statistics.add("summary.transient");
			return result;
		}

		statistics.add("summary.computed");
		return cache.publish(signature, result);
	}

	private static void dependOn(InProgress frame, int depth) {
		if(depth == frame.depth) frame.recursive = true;
		else frame.lowlink = Math.min(frame.lowlink, depth);
	}

	/** Re-analyses {@code callee} until its summary agrees with the placeholder recursive calls saw */
	private CallSummary solveRecursively(CallInstruction call, Routine callee, InProgress frame) throws UnanalyzableCallException {
		EscapeAnalyzer analyzer = new EscapeAnalyzer(this, config);
		for(int iteration = 1; ; iteration++) {
			frame.recursive = false;

			CallSummary computed;
			try {
				computed = analyzer.analyze(callee, statistics).getSummary();
			} catch(RuntimeException exc) {
				throw new UnanalyzableCallException(call, "analysis of " + callee.getMethod() + " failed", exc);
			}

			if(!frame.recursive || computed.leq(frame.placeholder)) return computed;

			if(iteration >= config.getMaxRecursionIterations()) {
				logger.warn(String.format("Summary of %s did not stabilise after %d iterations", callee.getMethod(), iteration));
				return CallSummary.top(callee.getArgumentCount());
			}
			frame.placeholder = frame.placeholder.merge(computed);
		}
	}

	/**
	 * Joins the callee's view of each argument onto the matching operand and the callee's view of
	 * its return value onto the call result. Return sites of the callee mean nothing here, except
	 * that an argument the callee may return is an alias of the result.
	 */
	void applySummary(int pc, CallInstruction call, CallSummary summary, EscapeState state) {
		ValueId result = ValueId.ssa(pc);
		EscapeElement resultElement = state.get(result);

		List<ValueId> operands = call.getOperands();
		for(int i = 0; i < operands.size(); i++) {
			EscapeElement calleeArg = summary.getArgument(i);
			EscapeElement mapped = calleeArg.withoutReturnSites();
			// Pass-through: the argument may come back as the result.
			// TODO: a points-to summary of the return value would avoid this for unrelated results
			if(calleeArg.isReturnedByRoutine())
				mapped = mapped.merge(resultElement);
			state.merge(operands.get(i), mapped);
		}

		state.merge(result, summary.getReturnValue().withoutReturnSites());
	}
}

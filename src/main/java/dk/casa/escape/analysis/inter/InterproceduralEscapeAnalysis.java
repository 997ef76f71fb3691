package dk.casa.escape.analysis.inter;

import dk.casa.escape.analysis.EscapeAnalysisConfig;
import dk.casa.escape.analysis.EscapeAnalyzer;
import dk.casa.escape.analysis.EscapeResult;
import dk.casa.escape.analysis.inter.oracles.DirectCallOracle;
import dk.casa.escape.analysis.inter.oracles.ResolutionOracle;
import dk.casa.escape.ir.Routine;
import dk.casa.escape.utils.Counter;
import org.apache.log4j.Logger;

import java.util.Optional;

/**
 * Entry point of the inter-procedural analysis. Each {@link #analyze(Routine)} call is an
 * independent run; the {@link SummaryCache} is the only state shared between runs and may be
 * shared between threads.
 */
public class InterproceduralEscapeAnalysis {
	private static final Logger logger = Logger.getLogger(InterproceduralEscapeAnalysis.class);

	private final RoutineRepository repository;
	private final ResolutionOracle oracle;
	private final EscapeAnalysisConfig config;
	private final SummaryCache cache;

	public InterproceduralEscapeAnalysis(RoutineRepository repository, ResolutionOracle oracle,
	                                     EscapeAnalysisConfig config, SummaryCache cache) {
		this.repository = repository;
		this.oracle = oracle;
		this.config = config;
		this.cache = cache;
	}

	public InterproceduralEscapeAnalysis(RoutineRepository repository, ResolutionOracle oracle, EscapeAnalysisConfig config) {
		this(repository, oracle, config, new SummaryCache());
	}

	public InterproceduralEscapeAnalysis(RoutineRepository repository) {
		this(repository, new DirectCallOracle(), EscapeAnalysisConfig.fromSystemProperties());
	}

	public EscapeResult analyze(Routine routine) {
		Counter<String> statistics = new Counter<>();
		CallPropagator propagator = new CallPropagator(repository, oracle, config, cache, statistics);
		EscapeResult result = new EscapeAnalyzer(propagator, config).analyze(routine, statistics);

		if(logger.isDebugEnabled())
			logger.debug(routine.getMethod() + " statistics: " + result.getStatistics());
		return result;
	}

	/** The summary of {@code routine}, computed and published unless it is cached already */
	public CallSummary summarize(Routine routine) {
		CallSignature signature = CallSignature.of(routine);
		Optional<CallSummary> cached = cache.get(signature);
		if(cached.isPresent()) return cached.get();
		return cache.publish(signature, analyze(routine).getSummary());
	}

	public SummaryCache getSummaryCache() {
		return cache;
	}

	public EscapeAnalysisConfig getConfig() {
		return config;
	}
}

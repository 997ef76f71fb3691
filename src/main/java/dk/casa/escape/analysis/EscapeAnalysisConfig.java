package dk.casa.escape.analysis;

import java.util.Properties;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Tuning knobs of the analysis. Instances are immutable, use the {@code with} methods to derive
 * variants. {@link #fromSystemProperties()} reads overrides from {@code -Descape.*} switches.
 */
public final class EscapeAnalysisConfig {
	public static final EscapeAnalysisConfig DEFAULT = new EscapeAnalysisConfig(32, Integer.MAX_VALUE, 16, false);

	private final int maxCallDepth;
	private final int maxCandidates;
	private final int maxRecursionIterations;
	private final boolean seedArgumentReturnEscape;

	private EscapeAnalysisConfig(int maxCallDepth, int maxCandidates, int maxRecursionIterations, boolean seedArgumentReturnEscape) {
		checkArgument(maxCallDepth >= 0, "maxCallDepth must be non-negative");
		checkArgument(maxCandidates >= 1, "maxCandidates must be positive");
		checkArgument(maxRecursionIterations >= 1, "maxRecursionIterations must be positive");
		this.maxCallDepth = maxCallDepth;
		this.maxCandidates = maxCandidates;
		this.maxRecursionIterations = maxRecursionIterations;
		this.seedArgumentReturnEscape = seedArgumentReturnEscape;
	}

	public static EscapeAnalysisConfig fromSystemProperties() {
		return fromProperties(System.getProperties());
	}

	public static EscapeAnalysisConfig fromProperties(Properties props) {
		return new EscapeAnalysisConfig(
				intProperty(props, "escape.maxCallDepth", DEFAULT.maxCallDepth),
				intProperty(props, "escape.maxCandidates", DEFAULT.maxCandidates),
				intProperty(props, "escape.maxRecursionIterations", DEFAULT.maxRecursionIterations),
				Boolean.parseBoolean(props.getProperty("escape.seedArgumentReturnEscape",
						String.valueOf(DEFAULT.seedArgumentReturnEscape))));
	}

	private static int intProperty(Properties props, String key, int def) {
		String value = props.getProperty(key);
		if(value == null) return def;
		try {
			return Integer.parseInt(value.trim());
		} catch(NumberFormatException exc) {
			throw new IllegalArgumentException("Invalid value for " + key + ": " + value, exc);
		}
	}

	/** Nesting of callee analyses beyond which calls are treated as unanalysable */
	public int getMaxCallDepth() {
		return maxCallDepth;
	}

	/** Largest dispatch set whose summaries are joined instead of giving up, unbounded by default */
	public int getMaxCandidates() {
		return maxCandidates;
	}

	/** Re-analyses of a recursive routine before its summary is widened to all-escape */
	public int getMaxRecursionIterations() {
		return maxRecursionIterations;
	}

	/** Whether arguments start out as return escaping, since the caller can observe them */
	public boolean seedArgumentReturnEscape() {
		return seedArgumentReturnEscape;
	}

	public EscapeAnalysisConfig withMaxCallDepth(int maxCallDepth) {
		return new EscapeAnalysisConfig(maxCallDepth, maxCandidates, maxRecursionIterations, seedArgumentReturnEscape);
	}

	public EscapeAnalysisConfig withMaxCandidates(int maxCandidates) {
		return new EscapeAnalysisConfig(maxCallDepth, maxCandidates, maxRecursionIterations, seedArgumentReturnEscape);
	}

	public EscapeAnalysisConfig withMaxRecursionIterations(int maxRecursionIterations) {
		return new EscapeAnalysisConfig(maxCallDepth, maxCandidates, maxRecursionIterations, seedArgumentReturnEscape);
	}

	public EscapeAnalysisConfig withSeedArgumentReturnEscape(boolean seedArgumentReturnEscape) {
		return new EscapeAnalysisConfig(maxCallDepth, maxCandidates, maxRecursionIterations, seedArgumentReturnEscape);
	}

	@Override
	public String toString() {
		return String.format("EscapeAnalysisConfig[maxCallDepth=%d, maxCandidates=%d, maxRecursionIterations=%d, seedArgumentReturnEscape=%b]",
				maxCallDepth, maxCandidates, maxRecursionIterations, seedArgumentReturnEscape);
	}
}

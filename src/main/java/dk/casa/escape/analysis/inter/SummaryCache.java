package dk.casa.escape.analysis.inter;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Summaries shared between analysis runs. Only complete summaries are published, and the first
 * summary published for a signature is the one every later lookup sees.
 */
public class SummaryCache {
	private final ConcurrentMap<CallSignature, CallSummary> summaries = new ConcurrentHashMap<>();

	public Optional<CallSummary> get(CallSignature signature) {
		return Optional.ofNullable(summaries.get(signature));
	}

	/** @return the summary that ends up in the cache, which is {@code summary} unless another run won the race */
	public CallSummary publish(CallSignature signature, CallSummary summary) {
		CallSummary existing = summaries.putIfAbsent(signature, summary);
		return existing == null ? summary : existing;
	}

	public boolean contains(CallSignature signature) {
		return summaries.containsKey(signature);
	}

	public int size() {
		return summaries.size();
	}

	public void clear() {
		summaries.clear();
	}
}

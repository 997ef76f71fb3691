package dk.casa.escape.analysis;

/** An element of a join semi-lattice. {@code merge} is the join. */
public interface Element<V> {
	V merge(V other);

	default boolean leq(V other) {
		return merge(other).equals(other);
	}

	/** Joins all {@code elements} onto {@code bottom} */
	static <V extends Element<V>> V mergeAll(V bottom, Iterable<? extends V> elements) {
		V res = bottom;
		for(V element : elements) res = res.merge(element);
		return res;
	}
}

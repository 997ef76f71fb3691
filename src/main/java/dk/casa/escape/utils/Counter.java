package dk.casa.escape.utils;

import com.google.common.collect.ImmutableSortedMap;

import java.util.HashMap;

/** Counts occurrences of keys, missing keys count as zero. */
public class Counter<T extends Comparable<T>> extends HashMap<T, Integer> {
	@Override
	public Integer get(Object key) {
		return getOrDefault(key, 0);
	}

	public void inc(T key, int value) {
		merge(key, value, Integer::sum);
	}

	public void add(T key) {
		inc(key, 1);
	}

	public ImmutableSortedMap<T, Integer> snapshot() {
		return ImmutableSortedMap.copyOf(this);
	}
}

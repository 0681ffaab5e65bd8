package io.vena.drift.local;

import lombok.Value;

/**
 * Decides whether a query that fell back to a full collection scan deserves a client-side index.
 */
public interface IndexingPolicy {
	boolean shouldCreateIndex(int documentsRead, int resultCount);

	static IndexingPolicy disabled() {
		return (documentsRead, resultCount) -> false;
	}

	/**
	 * Indexes a query once the scan read at least <code>minCollectionSize</code> documents,
	 * and more than <code>relativeReadCost</code> documents per result.
	 */
	@Value
	class Adaptive implements IndexingPolicy {
		public static final int DEFAULT_MIN_COLLECTION_SIZE = 100;
		public static final double DEFAULT_RELATIVE_READ_COST = 2.0;

		int minCollectionSize;
		double relativeReadCost;

		public static Adaptive defaults() {
			return new Adaptive(DEFAULT_MIN_COLLECTION_SIZE, DEFAULT_RELATIVE_READ_COST);
		}

		@Override
		public boolean shouldCreateIndex(int documentsRead, int resultCount) {
			return documentsRead >= minCollectionSize
				&& documentsRead > relativeReadCost * resultCount;
		}
	}
}

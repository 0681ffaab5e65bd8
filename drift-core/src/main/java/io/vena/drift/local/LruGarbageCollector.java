package io.vena.drift.local;

import io.vena.drift.util.AsyncQueue;
import io.vena.drift.util.AsyncQueue.DelayedTask;
import io.vena.drift.util.AsyncQueue.TimerId;
import java.time.Duration;
import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.Set;
import lombok.Value;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes the least recently used targets and documents once the cache grows past a threshold.
 *
 * <p>
 * A run removes roughly {@link Params#percentileToCollect()} percent of the sequence numbers
 * (one per target plus one per orphaned document), capped at
 * {@link Params#maximumSequenceNumbersToCollect()}. Targets in use and documents they or
 * pending mutations reference are never removed.
 */
public class LruGarbageCollector {
	public static final long COLLECTION_DISABLED = -1;

	private static final Duration INITIAL_GC_DELAY = Duration.ofMinutes(1);
	private static final Duration REGULAR_GC_DELAY = Duration.ofMinutes(5);

	private final LruDelegate delegate;
	private final Params params;

	@Value
	public static class Params {
		public static final long DEFAULT_CACHE_SIZE_BYTES = 100L * 1024 * 1024;
		public static final int DEFAULT_COLLECTION_PERCENTILE = 10;
		public static final int DEFAULT_MAX_SEQUENCE_NUMBERS_TO_COLLECT = 1000;

		/**
		 * Collection is skipped while the cache is smaller than this; {@link #COLLECTION_DISABLED} turns it off.
		 */
		long minBytesThreshold;
		int percentileToCollect;
		int maximumSequenceNumbersToCollect;

		public static Params defaults() {
			return new Params(DEFAULT_CACHE_SIZE_BYTES, DEFAULT_COLLECTION_PERCENTILE, DEFAULT_MAX_SEQUENCE_NUMBERS_TO_COLLECT);
		}

		public static Params disabled() {
			return new Params(COLLECTION_DISABLED, 0, 0);
		}

		public static Params withCacheSizeBytes(long cacheSizeBytes) {
			return new Params(cacheSizeBytes, DEFAULT_COLLECTION_PERCENTILE, DEFAULT_MAX_SEQUENCE_NUMBERS_TO_COLLECT);
		}
	}

	@Value
	public static class Results {
		boolean hasRun;
		int sequenceNumbersCollected;
		int targetsRemoved;
		int documentsRemoved;

		static Results didNotRun() {
			return new Results(false, 0, 0, 0);
		}
	}

	LruGarbageCollector(LruDelegate delegate, Params params) {
		this.delegate = delegate;
		this.params = params;
	}

	public Params params() {
		return params;
	}

	/**
	 * Runs a collection if the cache is big enough. Must run inside a transaction.
	 */
	public Results collect(Set<Integer> activeTargetIds) {
		if (params.minBytesThreshold() == COLLECTION_DISABLED) {
			LOGGER.debug("Garbage collection skipped; disabled");
			return Results.didNotRun();
		}
		long cacheSize = delegate.getByteSize();
		if (cacheSize < params.minBytesThreshold()) {
			LOGGER.debug("Garbage collection skipped; cache size {} is lower than threshold {}", cacheSize, params.minBytesThreshold());
			return Results.didNotRun();
		}
		return runGarbageCollection(activeTargetIds);
	}

	Results runGarbageCollection(Set<Integer> activeTargetIds) {
		long startTime = System.currentTimeMillis();
		int sequenceNumbers = calculateQueryCount(params.percentileToCollect());
		if (sequenceNumbers > params.maximumSequenceNumbersToCollect()) {
			LOGGER.debug("Capping sequence numbers to collect down to the maximum of {} from {}",
				params.maximumSequenceNumbersToCollect(), sequenceNumbers);
			sequenceNumbers = params.maximumSequenceNumbersToCollect();
		}
		long upperBound = getNthSequenceNumber(sequenceNumbers);
		int targetsRemoved = delegate.removeTargets(upperBound, activeTargetIds);
		int documentsRemoved = delegate.removeOrphanedDocuments(upperBound);
		LOGGER.debug("LRU garbage collection: counted {} sequence numbers, upper bound {}, removed {} targets and {} documents in {}ms",
			sequenceNumbers, upperBound, targetsRemoved, documentsRemoved, System.currentTimeMillis() - startTime);
		return new Results(true, sequenceNumbers, targetsRemoved, documentsRemoved);
	}

	int calculateQueryCount(int percentile) {
		long count = delegate.getSequenceNumberCount();
		return (int) ((percentile / 100.0f) * count);
	}

	/**
	 * @return the <code>count</code>th-smallest sequence number, or {@link ListenSequence#INVALID} if count is zero
	 */
	long getNthSequenceNumber(int count) {
		if (count == 0) {
			return ListenSequence.INVALID;
		}
		RollingSequenceNumberBuffer buffer = new RollingSequenceNumberBuffer(count);
		delegate.forEachTarget(targetData -> buffer.addElement(targetData.sequenceNumber()));
		delegate.forEachOrphanedDocumentSequenceNumber(buffer::addElement);
		return buffer.maxValue();
	}

	/**
	 * Keeps the smallest <code>maxElements</code> values seen so far.
	 */
	static class RollingSequenceNumberBuffer {
		private final PriorityQueue<Long> queue;
		private final int maxElements;

		RollingSequenceNumberBuffer(int count) {
			this.maxElements = count;
			this.queue = new PriorityQueue<>(count, Comparator.reverseOrder());
		}

		void addElement(Long sequenceNumber) {
			if (queue.size() < maxElements) {
				queue.add(sequenceNumber);
			} else if (sequenceNumber < queue.peek()) {
				queue.poll();
				queue.add(sequenceNumber);
			}
		}

		long maxValue() {
			Long result = queue.peek();
			return result == null ? ListenSequence.INVALID : result;
		}
	}

	/**
	 * Runs collection on the worker queue: first after a minute, then every five minutes.
	 */
	public class Scheduler {
		private final AsyncQueue asyncQueue;
		private final LocalStore localStore;
		private boolean hasRun = false;
		private @Nullable DelayedTask gcTask;

		Scheduler(AsyncQueue asyncQueue, LocalStore localStore) {
			this.asyncQueue = asyncQueue;
			this.localStore = localStore;
		}

		public void start() {
			if (params.minBytesThreshold() != COLLECTION_DISABLED) {
				scheduleGC();
			}
		}

		public void stop() {
			if (gcTask != null) {
				gcTask.cancel();
				gcTask = null;
			}
		}

		private void scheduleGC() {
			Duration delay = hasRun ? REGULAR_GC_DELAY : INITIAL_GC_DELAY;
			gcTask = asyncQueue.enqueueAfterDelay(TimerId.GARBAGE_COLLECTION, delay, () -> {
				localStore.collectGarbage(LruGarbageCollector.this);
				hasRun = true;
				scheduleGC();
			});
		}
	}

	public Scheduler newScheduler(AsyncQueue asyncQueue, LocalStore localStore) {
		return new Scheduler(asyncQueue, localStore);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LruGarbageCollector.class);
}

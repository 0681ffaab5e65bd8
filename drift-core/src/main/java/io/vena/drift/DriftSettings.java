package io.vena.drift;

import io.vena.drift.exceptions.PersistenceUnavailableException;
import io.vena.drift.local.IndexingPolicy;
import io.vena.drift.local.LruGarbageCollector;
import io.vena.drift.local.LocalStore;
import io.vena.drift.remote.ExponentialBackoff;
import io.vena.drift.remote.RemoteStore;
import java.nio.file.Path;
import java.time.Duration;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

import static io.vena.drift.core.SyncEngine.DEFAULT_MAX_CONCURRENT_LIMBO_RESOLUTIONS;
import static io.vena.drift.local.LruGarbageCollector.COLLECTION_DISABLED;

@Value
@Builder
public class DriftSettings {
	public static final long MIN_CACHE_SIZE_BYTES = 1024L * 1024;

	/**
	 * Appears in thread names and log context.
	 */
	@Default String clientName = "drift";

	/**
	 * Cached documents no listener needs are collected once the cache grows past this.
	 * {@link LruGarbageCollector#COLLECTION_DISABLED} keeps them forever.
	 */
	@Default long cacheSizeBytes = LruGarbageCollector.Params.DEFAULT_CACHE_SIZE_BYTES;
	@Default GarbageCollectionMode garbageCollectionMode = GarbageCollectionMode.LRU;
	@Default InitialPersistenceUnavailableMode initialPersistenceUnavailableMode = InitialPersistenceUnavailableMode.MEMORY_ONLY;

	/**
	 * Where durable persistence keeps its files. Ignored by in-memory persistence.
	 */
	@Default @Nullable Path persistenceDirectory = null;

	@Default int maxConcurrentLimboResolutions = DEFAULT_MAX_CONCURRENT_LIMBO_RESOLUTIONS;

	/**
	 * A resume token that hasn't changed any documents is persisted at most this often.
	 */
	@Default Duration resumeTokenMaxAge = LocalStore.DEFAULT_RESUME_TOKEN_MAX_AGE;

	@Default Streams streams = Streams.builder().build();
	@Default Experimental experimental = Experimental.builder().build();
	@Default Testing testing = Testing.builder().build();

	@Value
	@Builder
	public static class Streams {
		@Default Duration initialBackoffDelay = ExponentialBackoff.DEFAULT_INITIAL_DELAY;
		@Default double backoffFactor = ExponentialBackoff.DEFAULT_BACKOFF_FACTOR;
		@Default Duration maxBackoffDelay = ExponentialBackoff.DEFAULT_MAX_DELAY;
		@Default Duration idleTimeout = RemoteStore.Params.DEFAULT_STREAM_IDLE_TIMEOUT;
		@Default Duration onlineStateTimeout = RemoteStore.Params.DEFAULT_ONLINE_STATE_TIMEOUT;
		@Default int maxPendingWrites = RemoteStore.Params.DEFAULT_MAX_PENDING_WRITES;
	}

	/**
	 * Settings with no guarantee of long-term support.
	 */
	@Value
	@Builder
	public static class Experimental {
		@Default int gcPercentileToCollect = LruGarbageCollector.Params.DEFAULT_COLLECTION_PERCENTILE;
		@Default int gcMaxSequenceNumbersToCollect = LruGarbageCollector.Params.DEFAULT_MAX_SEQUENCE_NUMBERS_TO_COLLECT;

		/**
		 * Create field indexes for queries that scan many more documents than they return.
		 */
		@Default boolean autoIndexing = false;
		@Default int autoIndexMinCollectionSize = IndexingPolicy.Adaptive.DEFAULT_MIN_COLLECTION_SIZE;
		@Default double autoIndexRelativeReadCost = IndexingPolicy.Adaptive.DEFAULT_RELATIVE_READ_COST;
	}

	/**
	 * Settings not meant to be used in production.
	 */
	@Value
	@Builder
	public static class Testing {
		/**
		 * Deliver listener events on the worker thread instead of a dedicated callback thread,
		 * so they're already delivered when the operation that caused them completes.
		 */
		@Default boolean synchronousCallbacks = false;
	}

	public enum GarbageCollectionMode {
		/**
		 * Documents are dropped from the cache as soon as nothing references them.
		 */
		EAGER,

		/**
		 * Least-recently-used targets and their documents are collected once the cache is too big.
		 */
		LRU,
	}

	public enum InitialPersistenceUnavailableMode {
		/**
		 * If the persistence can't be started (eg. another client holds its lease), proceed with
		 * in-memory persistence and the network disabled, so the application still starts.
		 */
		MEMORY_ONLY,

		/**
		 * If the persistence can't be started, throw {@link PersistenceUnavailableException}.
		 */
		FAIL,
	}

	public IndexingPolicy indexingPolicy() {
		if (experimental.autoIndexing()) {
			return new IndexingPolicy.Adaptive(experimental.autoIndexMinCollectionSize(), experimental.autoIndexRelativeReadCost());
		} else {
			return IndexingPolicy.disabled();
		}
	}

	public LruGarbageCollector.Params gcParams() {
		return new LruGarbageCollector.Params(cacheSizeBytes, experimental.gcPercentileToCollect(), experimental.gcMaxSequenceNumbersToCollect());
	}

	public RemoteStore.Params remoteParams() {
		return new RemoteStore.Params(
			streams.initialBackoffDelay(),
			streams.backoffFactor(),
			streams.maxBackoffDelay(),
			streams.idleTimeout(),
			streams.onlineStateTimeout(),
			streams.maxPendingWrites());
	}

	public void validate() {
		if (clientName.isBlank()) {
			throw new IllegalArgumentException("Client name must not be blank");
		}
		if (cacheSizeBytes != COLLECTION_DISABLED && cacheSizeBytes < MIN_CACHE_SIZE_BYTES) {
			throw new IllegalArgumentException("Cache size must be at least " + MIN_CACHE_SIZE_BYTES + " bytes, or COLLECTION_DISABLED");
		}
		if (experimental.gcPercentileToCollect() < 0 || experimental.gcPercentileToCollect() > 100) {
			throw new IllegalArgumentException("GC percentile must be between 0 and 100: " + experimental.gcPercentileToCollect());
		}
		if (experimental.gcMaxSequenceNumbersToCollect() < 1) {
			throw new IllegalArgumentException("GC must be able to collect at least one sequence number");
		}
		if (maxConcurrentLimboResolutions < 1) {
			throw new IllegalArgumentException("Need at least one concurrent limbo resolution");
		}
		if (resumeTokenMaxAge.isNegative()) {
			throw new IllegalArgumentException("Resume token max age must not be negative");
		}
		if (streams.initialBackoffDelay().isNegative() || streams.maxBackoffDelay().compareTo(streams.initialBackoffDelay()) < 0) {
			throw new IllegalArgumentException("Backoff delays must satisfy 0 <= initial <= max");
		}
		if (streams.backoffFactor() < 1.0) {
			throw new IllegalArgumentException("Backoff factor must be at least 1: " + streams.backoffFactor());
		}
		if (isNotPositive(streams.idleTimeout()) || isNotPositive(streams.onlineStateTimeout())) {
			throw new IllegalArgumentException("Stream timeouts must be positive");
		}
		if (streams.maxPendingWrites() < 1) {
			throw new IllegalArgumentException("Write pipeline must hold at least one batch");
		}
	}

	private static boolean isNotPositive(Duration duration) {
		return duration.isNegative() || duration.isZero();
	}
}

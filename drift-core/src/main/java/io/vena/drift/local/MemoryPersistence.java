package io.vena.drift.local;

import io.vena.drift.core.Target;
import io.vena.drift.exceptions.PersistenceUnavailableException;
import io.vena.drift.local.PersistenceSnapshot.MutationQueueContents;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.User;
import io.vena.drift.model.mutation.Mutation;
import io.vena.drift.model.mutation.MutationBatch;
import io.vena.drift.model.mutation.Overlay;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps every store in memory as immutable values, so a transaction can be undone
 * by putting back the values it started with.
 *
 * <p>
 * Transactions don't nest: a transaction started inside another simply becomes part of it.
 */
public class MemoryPersistence extends Persistence {
	private final Map<User, MemoryMutationQueue> mutationQueues = new HashMap<>();
	private final Map<User, MemoryDocumentOverlayCache> overlays = new HashMap<>();
	private final MemoryIndexManager indexManager;
	private final MemoryTargetCache targetCache;
	private final MemoryRemoteDocumentCache remoteDocumentCache;
	private final ReferenceDelegate referenceDelegate;
	private boolean started = false;
	private boolean inTransaction = false;

	public static MemoryPersistence createEagerGcMemoryPersistence() {
		return new MemoryPersistence(null);
	}

	public static MemoryPersistence createLruGcMemoryPersistence(LruGarbageCollector.Params params) {
		return new MemoryPersistence(params);
	}

	/**
	 * @param lruParams null for eager garbage collection
	 */
	protected MemoryPersistence(@Nullable LruGarbageCollector.Params lruParams) {
		this.indexManager = new MemoryIndexManager(this);
		this.targetCache = new MemoryTargetCache(this);
		this.remoteDocumentCache = new MemoryRemoteDocumentCache();
		this.remoteDocumentCache.setIndexManager(indexManager);
		if (lruParams == null) {
			this.referenceDelegate = new MemoryEagerReferenceDelegate(this);
		} else {
			this.referenceDelegate = new MemoryLruReferenceDelegate(this, lruParams);
		}
	}

	@Override
	public void start() throws PersistenceUnavailableException {
		if (started) {
			throw new AssertionError("MemoryPersistence double-started");
		}
		started = true;
		if (referenceDelegate instanceof MemoryLruReferenceDelegate) {
			((MemoryLruReferenceDelegate) referenceDelegate).start(targetCache.getHighestListenSequenceNumber());
		}
		LOGGER.debug("Started {} with {} documents and {} targets",
			getClass().getSimpleName(), remoteDocumentCache.size(), targetCache.getTargetCount());
	}

	@Override
	public void shutdown() {
		if (!started) {
			throw new AssertionError("MemoryPersistence shutdown without start");
		}
		started = false;
	}

	@Override
	public boolean isStarted() {
		return started;
	}

	@Override
	public ReferenceDelegate getReferenceDelegate() {
		return referenceDelegate;
	}

	@Override
	public MutationQueue getMutationQueue(User user, IndexManager indexManager) {
		return mutationQueues.computeIfAbsent(user, __ -> new MemoryMutationQueue(this, indexManager));
	}

	@Override
	public TargetCache getTargetCache() {
		return targetCache;
	}

	@Override
	public RemoteDocumentCache getRemoteDocumentCache() {
		return remoteDocumentCache;
	}

	@Override
	public IndexManager getIndexManager(User user) {
		// Index entries derive from the remote documents, which all users share
		return indexManager;
	}

	@Override
	public DocumentOverlayCache getDocumentOverlayCache(User user) {
		return overlays.computeIfAbsent(user, __ -> new MemoryDocumentOverlayCache());
	}

	@Override
	public <T> T runTransaction(String action, Supplier<T> operation) {
		if (inTransaction) {
			return operation.get();
		}
		LOGGER.trace("Starting transaction: {}", action);
		List<Checkpoint<?>> checkpoints = checkpoints();
		inTransaction = true;
		try {
			referenceDelegate.onTransactionStarted();
			T result = operation.get();
			referenceDelegate.onTransactionCommitted();
			boolean modified = false;
			for (Checkpoint<?> checkpoint: checkpoints) {
				modified |= checkpoint.isModified();
			}
			inTransaction = false;
			onTransactionCommitted(action, modified);
			return result;
		} catch (RuntimeException | Error e) {
			LOGGER.debug("Rolling back transaction \"{}\" due to {}", action, e.getClass().getSimpleName());
			for (Checkpoint<?> checkpoint: checkpoints) {
				checkpoint.restore();
			}
			throw e;
		} finally {
			inTransaction = false;
		}
	}

	/**
	 * Called after each outermost transaction commits.
	 *
	 * @param modified whether any store changed
	 */
	protected void onTransactionCommitted(String action, boolean modified) { }

	private List<Checkpoint<?>> checkpoints() {
		List<Checkpoint<?>> result = new ArrayList<>();
		for (MemoryMutationQueue queue: mutationQueues.values()) {
			result.add(queue.checkpoint());
		}
		for (MemoryDocumentOverlayCache cache: overlays.values()) {
			result.add(cache.checkpoint());
		}
		result.add(indexManager.checkpoint());
		result.add(targetCache.checkpoint());
		result.add(remoteDocumentCache.checkpoint());
		if (referenceDelegate instanceof MemoryLruReferenceDelegate) {
			result.add(((MemoryLruReferenceDelegate) referenceDelegate).checkpoint());
		}
		return result;
	}

	boolean mutationQueuesContainKey(DocumentKey key) {
		for (MemoryMutationQueue queue: mutationQueues.values()) {
			if (queue.containsKey(key)) {
				return true;
			}
		}
		return false;
	}

	long getByteSize() {
		long result = remoteDocumentCache.getByteSize() + targetCache.getByteSize();
		for (MemoryMutationQueue queue: mutationQueues.values()) {
			result += queue.getByteSize();
		}
		return result;
	}

	/**
	 * @return the committed contents of every store. Must not be called during a transaction.
	 */
	public PersistenceSnapshot exportSnapshot() {
		if (inTransaction) {
			throw new AssertionError("Cannot export in the middle of a transaction");
		}
		Map<String, MutationQueueContents> queues = new TreeMap<>();
		mutationQueues.forEach((user, queue) -> {
			MemoryMutationQueue.State state = queue.state();
			if (!state.queue().isEmpty() || !state.lastStreamToken().isEmpty()) {
				queues.put(user.storageKey(), new MutationQueueContents(new ArrayList<>(state.queue()), state.nextBatchId(), state.lastStreamToken()));
			}
		});
		Map<String, List<Overlay>> overlayContents = new TreeMap<>();
		overlays.forEach((user, cache) -> {
			if (!cache.allOverlays().isEmpty()) {
				overlayContents.put(user.storageKey(), cache.allOverlays());
			}
		});
		MemoryTargetCache.State targetState = targetCache.state();
		Map<Integer, Set<DocumentKey>> targetDocuments = new TreeMap<>();
		for (TargetData targetData: targetState.targets().values()) {
			Set<DocumentKey> keys = targetState.references().referencesForId(targetData.targetId());
			if (!keys.isEmpty()) {
				targetDocuments.put(targetData.targetId(), keys);
			}
		}
		Map<DocumentKey, Long> orphaned = new TreeMap<>();
		if (referenceDelegate instanceof MemoryLruReferenceDelegate) {
			orphaned.putAll(((MemoryLruReferenceDelegate) referenceDelegate).orphanedSequenceNumbers());
		}
		return PersistenceSnapshot.builder()
			.mutationQueues(queues)
			.overlays(overlayContents)
			.remoteDocuments(remoteDocumentCache.allDocuments())
			.targets(new ArrayList<>(targetState.targets().values()))
			.targetDocuments(targetDocuments)
			.highestTargetId(targetState.highestTargetId())
			.highestListenSequenceNumber(targetState.highestSequenceNumber())
			.lastRemoteSnapshotVersion(targetState.lastRemoteSnapshotVersion())
			.orphanedSequenceNumbers(orphaned)
			.fieldIndexes(new ArrayList<>(indexManager.getFieldIndexes()))
			.build();
	}

	/**
	 * Replaces the contents of every store. Must be called before {@link #start()}.
	 */
	protected void importSnapshot(PersistenceSnapshot snapshot) {
		if (started) {
			throw new AssertionError("Cannot import into a started persistence");
		}
		mutationQueues.clear();
		overlays.clear();

		remoteDocumentCache.restoreState(snapshot.remoteDocuments());
		for (Document document: snapshot.remoteDocuments()) {
			indexManager.addToCollectionParentIndex(document.key().collectionPath());
		}

		snapshot.mutationQueues().forEach((userKey, contents) -> {
			MemoryMutationQueue queue = (MemoryMutationQueue) getMutationQueue(User.fromStorageKey(userKey), indexManager);
			queue.restoreState(MemoryMutationQueue.State.restore(contents.batches(), contents.nextBatchId(), contents.lastStreamToken()));
			for (MutationBatch batch: contents.batches()) {
				for (Mutation mutation: batch.mutations()) {
					indexManager.addToCollectionParentIndex(mutation.key().collectionPath());
				}
			}
		});

		snapshot.overlays().forEach((userKey, overlayList) -> {
			MemoryDocumentOverlayCache cache = (MemoryDocumentOverlayCache) getDocumentOverlayCache(User.fromStorageKey(userKey));
			cache.restoreState(MemoryDocumentOverlayCache.State.restore(overlayList));
		});

		Map<Target, TargetData> targets = new LinkedHashMap<>();
		ReferenceSet references = ReferenceSet.empty();
		for (TargetData targetData: snapshot.targets()) {
			targets.put(targetData.target(), targetData);
		}
		for (Map.Entry<Integer, Set<DocumentKey>> entry: snapshot.targetDocuments().entrySet()) {
			references = references.plusAll(entry.getValue(), entry.getKey());
		}
		targetCache.restoreState(new MemoryTargetCache.State(
			HashTreePMap.from(targets),
			references,
			snapshot.highestTargetId(),
			snapshot.highestListenSequenceNumber(),
			snapshot.lastRemoteSnapshotVersion()));

		if (referenceDelegate instanceof MemoryLruReferenceDelegate) {
			((MemoryLruReferenceDelegate) referenceDelegate).restoreOrphanedSequenceNumbers(snapshot.orphanedSequenceNumbers());
		}

		for (FieldIndex index: snapshot.fieldIndexes()) {
			indexManager.addFieldIndex(index);
		}
		LOGGER.debug("Imported {} documents, {} targets, and {} mutation queues",
			snapshot.remoteDocuments().size(), snapshot.targets().size(), snapshot.mutationQueues().size());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MemoryPersistence.class);
}

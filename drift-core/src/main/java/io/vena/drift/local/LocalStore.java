package io.vena.drift.local;

import io.vena.drift.core.Query;
import io.vena.drift.core.Target;
import io.vena.drift.core.TargetIdGenerator;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.ObjectValue;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.model.User;
import io.vena.drift.model.mutation.Mutation;
import io.vena.drift.model.mutation.MutationBatch;
import io.vena.drift.model.mutation.MutationBatchResult;
import io.vena.drift.model.mutation.MutationResult;
import io.vena.drift.model.mutation.OverlayedDocument;
import io.vena.drift.model.mutation.PatchMutation;
import io.vena.drift.model.mutation.Precondition;
import io.vena.drift.remote.RemoteEvent;
import io.vena.drift.remote.TargetChange;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The local half of the client: applies local writes, server acknowledgements and remote events
 * to the stores in {@link Persistence}, and answers queries from the cache.
 *
 * <p>
 * Every method that changes anything runs as a single persistence transaction,
 * so a failure leaves the stores as they were.
 *
 * <p>
 * Not thread-safe; call only from the client's worker queue.
 */
public final class LocalStore {
	public static final Duration DEFAULT_RESUME_TOKEN_MAX_AGE = Duration.ofMinutes(5);

	private final Persistence persistence;
	private final QueryEngine queryEngine;
	private final RemoteDocumentCache remoteDocuments;
	private final TargetCache targetCache;
	private final Duration resumeTokenMaxAge;

	private IndexManager indexManager;
	private MutationQueue mutationQueue;
	private DocumentOverlayCache documentOverlayCache;
	private LocalDocumentsView localDocuments;

	/**
	 * Documents shown by active views, pinned so garbage collection leaves them alone.
	 */
	private ReferenceSet localViewReferences = ReferenceSet.empty();

	private final Map<Integer, TargetData> queryDataByTarget = new HashMap<>();
	private final Map<Target, Integer> targetIdByTarget = new HashMap<>();
	private TargetIdGenerator targetIdGenerator;

	public LocalStore(Persistence persistence, QueryEngine queryEngine, User initialUser) {
		this(persistence, queryEngine, initialUser, DEFAULT_RESUME_TOKEN_MAX_AGE);
	}

	public LocalStore(Persistence persistence, QueryEngine queryEngine, User initialUser, Duration resumeTokenMaxAge) {
		if (!persistence.isStarted()) {
			throw new AssertionError("LocalStore was passed an unstarted persistence implementation");
		}
		this.persistence = persistence;
		this.queryEngine = queryEngine;
		this.resumeTokenMaxAge = resumeTokenMaxAge;
		this.targetCache = persistence.getTargetCache();
		this.remoteDocuments = persistence.getRemoteDocumentCache();
		this.targetIdGenerator = TargetIdGenerator.forTargetCache(targetCache.getHighestTargetId());
		persistence.getReferenceDelegate().setInMemoryPins(() -> localViewReferences);
		initializeUserComponents(initialUser);
	}

	private void initializeUserComponents(User user) {
		indexManager = persistence.getIndexManager(user);
		mutationQueue = persistence.getMutationQueue(user, indexManager);
		documentOverlayCache = persistence.getDocumentOverlayCache(user);
		remoteDocuments.setIndexManager(indexManager);
		localDocuments = new LocalDocumentsView(remoteDocuments, mutationQueue, documentOverlayCache, indexManager);
		queryEngine.initialize(localDocuments, indexManager);
	}

	public void start() {
		persistence.runTransaction("Start IndexManager", () -> indexManager.start());
		startMutationQueue();
	}

	private void startMutationQueue() {
		persistence.runTransaction("Start MutationQueue", () -> mutationQueue.start());
	}

	/**
	 * Switches to another user's mutation queue and overlays.
	 *
	 * @return the new local view of every document either user had pending writes for
	 */
	public SortedMap<DocumentKey, Document> handleUserChange(User user) {
		List<MutationBatch> oldBatches = mutationQueue.getAllMutationBatches();

		initializeUserComponents(user);
		start();

		List<MutationBatch> newBatches = mutationQueue.getAllMutationBatches();

		Set<DocumentKey> changedKeys = new TreeSet<>();
		for (List<MutationBatch> batches: List.of(oldBatches, newBatches)) {
			for (MutationBatch batch: batches) {
				changedKeys.addAll(batch.keys());
			}
		}
		LOGGER.debug("User changed; recomputing {} documents", changedKeys.size());
		return localDocuments.getDocuments(changedKeys);
	}

	/**
	 * Adds the mutations to the queue as one batch and saves overlays for the touched documents.
	 */
	public LocalWriteResult writeLocally(List<Mutation> mutations) {
		Instant localWriteTime = Instant.now();
		Set<DocumentKey> keys = new TreeSet<>();
		for (Mutation mutation: mutations) {
			keys.add(mutation.key());
		}

		return persistence.runTransaction("Locally write mutations", () -> {
			Map<DocumentKey, Document> remoteDocs = remoteDocuments.getAll(keys);
			Set<DocumentKey> docsWithoutRemoteVersion = new HashSet<>();
			for (Map.Entry<DocumentKey, Document> entry: remoteDocs.entrySet()) {
				if (!entry.getValue().isValid()) {
					docsWithoutRemoteVersion.add(entry.getKey());
				}
			}
			Map<DocumentKey, OverlayedDocument> overlayedDocuments = localDocuments.getOverlayedDocuments(remoteDocs);

			// A patch with transforms needs the value its transforms started from, in case
			// the patch is later applied on top of a different remote version
			List<Mutation> baseMutations = new ArrayList<>();
			for (Mutation mutation: mutations) {
				Document baseDocument = overlayedDocuments.get(mutation.key()).document();
				ObjectValue baseValue = mutation.extractTransformBaseValue(baseDocument);
				if (baseValue != null) {
					baseMutations.add(new PatchMutation(mutation.key(), baseValue, baseValue.fieldMask(), Precondition.exists(true)));
				}
			}

			MutationBatch batch = mutationQueue.addMutationBatch(localWriteTime, baseMutations, mutations);
			Map<DocumentKey, Mutation> overlays = batch.applyToLocalDocumentSet(overlayedDocuments, docsWithoutRemoteVersion);
			documentOverlayCache.saveOverlays(batch.batchId(), overlays);

			SortedMap<DocumentKey, Document> changes = new TreeMap<>();
			overlayedDocuments.forEach((key, doc) -> changes.put(key, doc.document()));
			LOGGER.debug("Wrote batch {} touching {} documents", batch.batchId(), changes.size());
			return new LocalWriteResult(batch.batchId(), changes);
		});
	}

	/**
	 * Applies the server's acknowledgement of the oldest batch to the remote document cache
	 * and removes the batch from the queue.
	 *
	 * @return the new local view of the documents the batch touched
	 */
	public SortedMap<DocumentKey, Document> acknowledgeBatch(MutationBatchResult batchResult) {
		return persistence.runTransaction("Acknowledge batch", () -> {
			MutationBatch batch = batchResult.batch();
			mutationQueue.acknowledgeBatch(batch, batchResult.streamToken());
			applyWriteToRemoteDocuments(batchResult);
			mutationQueue.performConsistencyCheck();

			documentOverlayCache.removeOverlaysForBatchId(batch.batchId());
			localDocuments.recalculateAndSaveOverlays(getKeysWithTransformResults(batchResult));
			return localDocuments.getDocuments(batch.keys());
		});
	}

	private void applyWriteToRemoteDocuments(MutationBatchResult batchResult) {
		MutationBatch batch = batchResult.batch();
		RemoteDocumentChangeBuffer buffer = new RemoteDocumentChangeBuffer(remoteDocuments);
		Map<DocumentKey, Document> docs = buffer.getEntries(batch.keys());
		for (DocumentKey key: batch.keys()) {
			Document doc = docs.get(key);
			SnapshotVersion ackVersion = batchResult.docVersions().get(key);
			if (ackVersion == null) {
				throw new AssertionError("docVersions should contain every doc in the write: " + key);
			}
			if (doc.version().compareTo(ackVersion) < 0) {
				Document updated = batch.applyToRemoteDocument(doc, batchResult);
				if (updated.isValid()) {
					buffer.addEntry(updated, batchResult.commitVersion());
				}
			}
		}
		buffer.apply();
		mutationQueue.removeMutationBatch(batch);
	}

	private static Set<DocumentKey> getKeysWithTransformResults(MutationBatchResult batchResult) {
		Set<DocumentKey> result = new HashSet<>();
		List<MutationResult> results = batchResult.mutationResults();
		for (int i = 0; i < results.size(); i++) {
			if (!results.get(i).transformResults().isEmpty()) {
				result.add(batchResult.batch().mutations().get(i).key());
			}
		}
		return result;
	}

	/**
	 * Removes a batch the server refused.
	 *
	 * @return the new local view of the documents the batch touched
	 */
	public SortedMap<DocumentKey, Document> rejectBatch(int batchId) {
		return persistence.runTransaction("Reject batch", () -> {
			MutationBatch toReject = mutationQueue.lookupMutationBatch(batchId);
			if (toReject == null) {
				throw new AssertionError("Attempt to reject nonexistent batch " + batchId);
			}
			mutationQueue.removeMutationBatch(toReject);
			mutationQueue.performConsistencyCheck();
			documentOverlayCache.removeOverlaysForBatchId(batchId);
			localDocuments.recalculateAndSaveOverlays(toReject.keys());
			return localDocuments.getDocuments(toReject.keys());
		});
	}

	public int getHighestUnacknowledgedBatchId() {
		return persistence.runTransaction("Get highest unacknowledged batch id", () -> mutationQueue.getHighestUnacknowledgedBatchId());
	}

	public String getLastStreamToken() {
		return mutationQueue.getLastStreamToken();
	}

	public void setLastStreamToken(String streamToken) {
		persistence.runTransaction("Set stream token", () -> mutationQueue.setLastStreamToken(streamToken));
	}

	public SnapshotVersion getLastRemoteSnapshotVersion() {
		return targetCache.getLastRemoteSnapshotVersion();
	}

	/**
	 * Applies a remote event to the target cache and the remote document cache.
	 *
	 * @return the new local view of every document the event changed
	 */
	public SortedMap<DocumentKey, Document> applyRemoteEvent(RemoteEvent remoteEvent) {
		SnapshotVersion remoteVersion = remoteEvent.snapshotVersion();

		return persistence.runTransaction("Apply remote event", () -> {
			long sequenceNumber = persistence.getReferenceDelegate().getCurrentSequenceNumber();

			for (Map.Entry<Integer, TargetChange> entry: remoteEvent.targetChanges().entrySet()) {
				int targetId = entry.getKey();
				TargetChange change = entry.getValue();

				TargetData oldTargetData = queryDataByTarget.get(targetId);
				if (oldTargetData == null) {
					// Key associations are only tracked for active targets
					continue;
				}

				targetCache.removeMatchingKeys(change.removedDocuments(), targetId);
				targetCache.addMatchingKeys(change.addedDocuments(), targetId);

				TargetData newTargetData = oldTargetData.withSequenceNumber(sequenceNumber);
				if (remoteEvent.targetMismatches().containsKey(targetId)) {
					newTargetData = newTargetData
						.withResumeToken("", SnapshotVersion.NONE)
						.withLastLimboFreeSnapshotVersion(SnapshotVersion.NONE);
				} else if (!change.resumeToken().isEmpty()) {
					newTargetData = newTargetData.withResumeToken(change.resumeToken(), remoteVersion);
				}

				queryDataByTarget.put(targetId, newTargetData);
				if (shouldPersistTargetData(oldTargetData, newTargetData, change)) {
					targetCache.updateTargetData(newTargetData);
				}
			}

			Map<DocumentKey, Document> documentUpdates = remoteEvent.documentUpdates();
			Set<DocumentKey> limboDocuments = remoteEvent.resolvedLimboDocuments();
			for (DocumentKey key: documentUpdates.keySet()) {
				if (limboDocuments.contains(key)) {
					persistence.getReferenceDelegate().updateLimboDocument(key);
				}
			}

			Set<DocumentKey> existenceChangedKeys = new HashSet<>();
			Map<DocumentKey, Document> changedDocs = populateDocumentChanges(documentUpdates, existenceChangedKeys);

			// NONE is only used by synthesized events, which don't advance the snapshot
			SnapshotVersion lastRemoteVersion = targetCache.getLastRemoteSnapshotVersion();
			if (!remoteVersion.isNone()) {
				if (remoteVersion.compareTo(lastRemoteVersion) < 0) {
					throw new AssertionError("Watch stream reverted to previous snapshot? (" + remoteVersion + " < " + lastRemoteVersion + ")");
				}
				targetCache.setLastRemoteSnapshotVersion(remoteVersion);
			}

			return localDocuments.getLocalViewOfDocuments(changedDocs, existenceChangedKeys);
		});
	}

	/**
	 * Writes the newer documents to the remote document cache.
	 *
	 * @param existenceChangedKeys receives keys whose documents started or stopped existing
	 * @return the documents that were written or removed
	 */
	private Map<DocumentKey, Document> populateDocumentChanges(Map<DocumentKey, Document> documents, Set<DocumentKey> existenceChangedKeys) {
		Map<DocumentKey, Document> changedDocs = new HashMap<>();
		RemoteDocumentChangeBuffer buffer = new RemoteDocumentChangeBuffer(remoteDocuments);
		Map<DocumentKey, Document> existingDocs = buffer.getEntries(documents.keySet());

		for (Map.Entry<DocumentKey, Document> entry: documents.entrySet()) {
			DocumentKey key = entry.getKey();
			Document doc = entry.getValue();
			Document existingDoc = existingDocs.get(key);

			if (doc.isFound() != existingDoc.isFound()) {
				existenceChangedKeys.add(key);
			}

			if (doc.isNoDocument() && doc.version().isNone()) {
				// Synthesized deletes mean the client lost access, so the cached copy can't be trusted
				buffer.removeEntry(key);
				changedDocs.put(key, doc);
			} else if (!existingDoc.isValid()
				|| doc.version().compareTo(existingDoc.version()) > 0
				|| (doc.version().compareTo(existingDoc.version()) == 0 && existingDoc.hasPendingWrites())) {
				if (doc.readTime().isNone()) {
					throw new AssertionError("Cannot add a document when the remote version is zero: " + key);
				}
				buffer.addEntry(doc, doc.readTime());
				changedDocs.put(key, doc);
			} else {
				LOGGER.debug("Ignoring outdated watch update for {}. Current version: {} Watch version: {}",
					key, existingDoc.version(), doc.version());
			}
		}
		buffer.apply();
		return changedDocs;
	}

	/**
	 * Target data is written back when the target had no resume token,
	 * when the last persisted snapshot is older than the max age, or when documents changed.
	 * Resume-token-only updates in between are kept in memory.
	 */
	boolean shouldPersistTargetData(TargetData oldTargetData, TargetData newTargetData, @Nullable TargetChange change) {
		if (newTargetData.resumeToken().isEmpty()) {
			// Cleared by an existence filter mismatch
			return !oldTargetData.resumeToken().isEmpty();
		}
		if (oldTargetData.resumeToken().isEmpty()) {
			return true;
		}
		Duration age = Duration.between(
			oldTargetData.snapshotVersion().timestamp(),
			newTargetData.snapshotVersion().timestamp());
		if (age.compareTo(resumeTokenMaxAge) >= 0) {
			return true;
		}
		return change != null && change.touchesDocuments();
	}

	/**
	 * Pins the documents that entered views and unpins those that left,
	 * and advances the last limbo-free snapshot of views that are in sync with the server.
	 */
	public void notifyLocalViewChanges(List<LocalViewChanges> viewChanges) {
		persistence.runTransaction("notifyLocalViewChanges", () -> {
			for (LocalViewChanges viewChange: viewChanges) {
				int targetId = viewChange.targetId();

				localViewReferences = localViewReferences.plusAll(viewChange.added(), targetId);
				Set<DocumentKey> removed = viewChange.removed();
				localViewReferences = localViewReferences.minusAll(removed, targetId);
				for (DocumentKey key: removed) {
					persistence.getReferenceDelegate().removeReference(key);
				}

				if (!viewChange.fromCache()) {
					TargetData targetData = queryDataByTarget.get(targetId);
					if (targetData == null) {
						throw new AssertionError("Can't set limbo-free snapshot version for unknown target " + targetId);
					}
					TargetData updatedTargetData = targetData.withLastLimboFreeSnapshotVersion(targetData.snapshotVersion());
					queryDataByTarget.put(targetId, updatedTargetData);
					if (shouldPersistTargetData(targetData, updatedTargetData, null)) {
						targetCache.updateTargetData(updatedTargetData);
					}
				}
			}
		});
	}

	/**
	 * @param afterBatchId {@link MutationBatch#UNKNOWN} to get the first batch
	 */
	public @Nullable MutationBatch getNextMutationBatch(int afterBatchId) {
		return persistence.runTransaction("Get next mutation batch", () -> mutationQueue.getNextMutationBatchAfterBatchId(afterBatchId));
	}

	public Document readDocument(DocumentKey key) {
		return persistence.runTransaction("read document", () -> localDocuments.getDocument(key));
	}

	public SortedMap<DocumentKey, Document> readDocuments(Collection<DocumentKey> keys) {
		return persistence.runTransaction("read documents", () -> localDocuments.getDocuments(keys));
	}

	/**
	 * Assigns a target id to the target, reusing the cached one if the target was listened to before.
	 */
	public TargetData allocateTarget(Target target) {
		TargetData targetData = persistence.runTransaction("Allocate target", () -> {
			TargetData cached = targetCache.getTargetData(target);
			if (cached != null) {
				return cached;
			}
			TargetData allocated = new TargetData(target, targetIdGenerator.nextId(),
				persistence.getReferenceDelegate().getCurrentSequenceNumber(), QueryPurpose.LISTEN);
			targetCache.addTargetData(allocated);
			return allocated;
		});

		if (!queryDataByTarget.containsKey(targetData.targetId())) {
			queryDataByTarget.put(targetData.targetId(), targetData);
			targetIdByTarget.put(target, targetData.targetId());
		}
		LOGGER.debug("Allocated target {} for {}", targetData.targetId(), target);
		return targetData;
	}

	/**
	 * @return the in-memory target data if the target is active, else whatever is cached
	 */
	@Nullable TargetData getTargetData(Target target) {
		Integer targetId = targetIdByTarget.get(target);
		if (targetId != null) {
			return queryDataByTarget.get(targetId);
		}
		return targetCache.getTargetData(target);
	}

	/**
	 * Unpins everything the target's view pinned and tells the reference delegate the target is gone.
	 */
	public void releaseTarget(int targetId) {
		persistence.runTransaction("Release target", () -> {
			TargetData targetData = queryDataByTarget.get(targetId);
			if (targetData == null) {
				throw new AssertionError("Tried to release nonexistent target: " + targetId);
			}

			Set<DocumentKey> removedReferences = localViewReferences.referencesForId(targetId);
			localViewReferences = localViewReferences.minusAllForId(targetId);
			for (DocumentKey key: removedReferences) {
				persistence.getReferenceDelegate().removeReference(key);
			}

			persistence.getReferenceDelegate().removeTarget(targetData);
			queryDataByTarget.remove(targetId);
			targetIdByTarget.remove(targetData.target());
		});
		LOGGER.debug("Released target {}", targetId);
	}

	/**
	 * @param usePreviousResults whether to start from the target's last limbo-free results
	 */
	public QueryResult executeQuery(Query query, boolean usePreviousResults) {
		return persistence.runTransaction("Execute query", () -> {
			TargetData targetData = getTargetData(query.toTarget());
			SnapshotVersion lastLimboFreeSnapshotVersion = SnapshotVersion.NONE;
			Set<DocumentKey> remoteKeys = Set.of();
			if (targetData != null) {
				lastLimboFreeSnapshotVersion = targetData.lastLimboFreeSnapshotVersion();
				remoteKeys = targetCache.getMatchingKeysForTargetId(targetData.targetId());
			}
			SortedMap<DocumentKey, Document> documents = queryEngine.getDocumentsMatchingQuery(
				query,
				usePreviousResults ? lastLimboFreeSnapshotVersion : SnapshotVersion.NONE,
				remoteKeys);
			return new QueryResult(documents, remoteKeys);
		});
	}

	public Set<DocumentKey> getRemoteDocumentKeys(int targetId) {
		return persistence.runTransaction("Remote document keys", () -> targetCache.getMatchingKeysForTargetId(targetId));
	}

	public void configureFieldIndexes(List<FieldIndex> newFieldIndexes) {
		persistence.runTransaction("Configure indexes", () -> {
			Set<FieldIndex> existing = new HashSet<>(indexManager.getFieldIndexes());
			for (FieldIndex index: newFieldIndexes) {
				if (!existing.remove(index)) {
					indexManager.addFieldIndex(index);
				}
			}
			for (FieldIndex index: existing) {
				indexManager.deleteFieldIndex(index);
			}
		});
	}

	public LruGarbageCollector.Results collectGarbage(LruGarbageCollector garbageCollector) {
		return persistence.runTransaction("Collect garbage", () -> garbageCollector.collect(new HashSet<>(queryDataByTarget.keySet())));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LocalStore.class);
}

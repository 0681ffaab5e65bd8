package io.vena.drift.remote;

import io.vena.drift.core.DocumentViewChange;
import io.vena.drift.core.Target;
import io.vena.drift.exceptions.BloomFilterException;
import io.vena.drift.local.QueryPurpose;
import io.vena.drift.local.TargetData;
import io.vena.drift.model.DatabaseId;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.remote.WatchChange.DocumentChange;
import io.vena.drift.remote.WatchChange.ExistenceFilterWatchChange;
import io.vena.drift.remote.WatchChange.WatchTargetChange;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates watch changes between global snapshots and turns them into {@link RemoteEvent}s.
 *
 * <p>
 * Changes for targets that are not active (unknown to the sync engine, or
 * awaiting a listen or unlisten acknowledgement) are dropped.
 */
public class WatchChangeAggregator {
	/**
	 * What the aggregator needs to know about the client's targets.
	 */
	public interface TargetMetadataProvider {
		/**
		 * The keys the server last reported for the target, as of the last remote event.
		 */
		Set<DocumentKey> getRemoteKeysForTarget(int targetId);

		/**
		 * @return null if the target is not being listened to
		 */
		@Nullable TargetData getTargetDataForTarget(int targetId);

		DatabaseId getDatabaseId();
	}

	enum BloomFilterApplicationStatus {
		SUCCESS,
		SKIPPED,
		FALSE_POSITIVE,
	}

	private final TargetMetadataProvider targetMetadataProvider;
	private final Map<Integer, TargetState> targetStates = new HashMap<>();

	// Reset whenever a remote event is created
	private Map<DocumentKey, Document> pendingDocumentUpdates = new HashMap<>();
	private Map<DocumentKey, Set<Integer>> pendingDocumentTargetMapping = new HashMap<>();
	private Map<Integer, QueryPurpose> pendingTargetResets = new HashMap<>();

	public WatchChangeAggregator(TargetMetadataProvider targetMetadataProvider) {
		this.targetMetadataProvider = targetMetadataProvider;
	}

	public void handleDocumentChange(DocumentChange documentChange) {
		Document document = documentChange.newDocument();
		DocumentKey documentKey = documentChange.documentKey();
		for (int targetId: documentChange.updatedTargetIds()) {
			if (document != null && document.isFound()) {
				addDocumentToTarget(targetId, document);
			} else {
				removeDocumentFromTarget(targetId, documentKey, document);
			}
		}
		for (int targetId: documentChange.removedTargetIds()) {
			removeDocumentFromTarget(targetId, documentKey, document);
		}
	}

	public void handleTargetChange(WatchTargetChange targetChange) {
		for (int targetId: targetIdsFor(targetChange)) {
			TargetState targetState = ensureTargetState(targetId);
			switch (targetChange.changeType()) {
				case NO_CHANGE:
					if (isActiveTarget(targetId)) {
						targetState.updateResumeToken(targetChange.resumeToken());
					}
					break;
				case ADDED:
					targetState.recordTargetResponse();
					if (!targetState.isPending()) {
						// A freshly re-added target, as after an existence filter mismatch. Forget what we had.
						targetState.clearChanges();
					}
					targetState.updateResumeToken(targetChange.resumeToken());
					break;
				case REMOVED:
					targetState.recordTargetResponse();
					if (!targetState.isPending()) {
						removeTarget(targetId);
					}
					if (targetChange.cause() != null) {
						throw new AssertionError("Errored target changes must be handled before aggregation");
					}
					break;
				case CURRENT:
					if (isActiveTarget(targetId)) {
						targetState.markCurrent();
						targetState.updateResumeToken(targetChange.resumeToken());
					}
					break;
				case RESET:
					if (isActiveTarget(targetId)) {
						// The server re-sends every document that still matches before its next global snapshot
						resetTarget(targetId);
						targetState.updateResumeToken(targetChange.resumeToken());
					}
					break;
				default:
					throw new AssertionError("Unknown target change type: " + targetChange.changeType());
			}
		}
	}

	private Collection<Integer> targetIdsFor(WatchTargetChange targetChange) {
		List<Integer> targetIds = targetChange.targetIds();
		if (!targetIds.isEmpty()) {
			return targetIds;
		}
		List<Integer> activeIds = new ArrayList<>();
		for (Integer id: targetStates.keySet()) {
			if (isActiveTarget(id)) {
				activeIds.add(id);
			}
		}
		return activeIds;
	}

	/**
	 * Compares the server's document count with ours. On a mismatch, tries the bloom filter
	 * to find exactly which documents were removed; failing that, resets the target and
	 * schedules it to be re-listened without a resume token.
	 */
	public void handleExistenceFilter(ExistenceFilterWatchChange watchChange) {
		int targetId = watchChange.targetId();
		int expectedCount = watchChange.existenceFilter().count();

		TargetData targetData = queryDataForActiveTarget(targetId);
		if (targetData == null) {
			return;
		}

		Target target = targetData.target();
		if (target.isDocumentQuery()) {
			if (expectedCount == 0) {
				// Apply the deletion now so no other query keeps showing the document while it's in limbo
				DocumentKey key = DocumentKey.fromPath(target.path());
				removeDocumentFromTarget(targetId, key, Document.noDocument(key, SnapshotVersion.NONE));
			} else if (expectedCount != 1) {
				throw new AssertionError("Single document existence filter with count: " + expectedCount);
			}
			return;
		}

		int currentSize = getCurrentDocumentCountForTarget(targetId);
		if (currentSize != expectedCount) {
			BloomFilter bloomFilter = parseBloomFilter(watchChange);
			BloomFilterApplicationStatus status = (bloomFilter != null)
				? applyBloomFilter(bloomFilter, watchChange, currentSize)
				: BloomFilterApplicationStatus.SKIPPED;
			LOGGER.debug("Existence filter mismatch on target {}: local {}, server {}; bloom filter {}", targetId, currentSize, expectedCount, status);
			if (status != BloomFilterApplicationStatus.SUCCESS) {
				resetTarget(targetId);
				QueryPurpose purpose = (status == BloomFilterApplicationStatus.FALSE_POSITIVE)
					? QueryPurpose.EXISTENCE_FILTER_MISMATCH_BLOOM
					: QueryPurpose.EXISTENCE_FILTER_MISMATCH;
				pendingTargetResets.put(targetId, purpose);
			}
		}
	}

	private @Nullable BloomFilter parseBloomFilter(ExistenceFilterWatchChange watchChange) {
		ExistenceFilter.BloomFilterBits unchangedNames = watchChange.existenceFilter().unchangedNames();
		if (unchangedNames == null) {
			return null;
		}
		BloomFilter bloomFilter;
		try {
			bloomFilter = BloomFilter.create(unchangedNames);
		} catch (BloomFilterException e) {
			LOGGER.warn("Applying bloom filter failed ({}); ignoring the bloom filter and falling back to full re-query", e.getMessage());
			return null;
		}
		if (bloomFilter.bitCount() == 0) {
			return null;
		}
		return bloomFilter;
	}

	private BloomFilterApplicationStatus applyBloomFilter(BloomFilter bloomFilter, ExistenceFilterWatchChange watchChange, int currentCount) {
		int expectedCount = watchChange.existenceFilter().count();
		int removedDocumentCount = filterRemovedDocuments(bloomFilter, watchChange.targetId());
		return (expectedCount == currentCount - removedDocumentCount)
			? BloomFilterApplicationStatus.SUCCESS
			: BloomFilterApplicationStatus.FALSE_POSITIVE;
	}

	/**
	 * Removes every known document the bloom filter says the server no longer has.
	 *
	 * @return how many were removed
	 */
	private int filterRemovedDocuments(BloomFilter bloomFilter, int targetId) {
		DatabaseId databaseId = targetMetadataProvider.getDatabaseId();
		int removalCount = 0;
		for (DocumentKey key: targetMetadataProvider.getRemoteKeysForTarget(targetId)) {
			if (!bloomFilter.mightContain(databaseId.documentName(key))) {
				removeDocumentFromTarget(targetId, key, null);
				removalCount++;
			}
		}
		return removalCount;
	}

	/**
	 * Packages up everything accumulated since the last call, and resets.
	 */
	public RemoteEvent createRemoteEvent(SnapshotVersion snapshotVersion) {
		Map<Integer, TargetChange> targetChanges = new HashMap<>();

		for (Map.Entry<Integer, TargetState> entry: targetStates.entrySet()) {
			int targetId = entry.getKey();
			TargetState targetState = entry.getValue();

			TargetData targetData = queryDataForActiveTarget(targetId);
			if (targetData != null) {
				if (targetState.isCurrent() && targetData.target().isDocumentQuery()) {
					// A current document query with no document means it doesn't exist. This resolves its limbo state.
					DocumentKey key = DocumentKey.fromPath(targetData.target().path());
					if (pendingDocumentUpdates.get(key) == null && !targetContainsDocument(targetId, key)) {
						removeDocumentFromTarget(targetId, key, Document.noDocument(key, snapshotVersion));
					}
				}

				if (targetState.hasChanges()) {
					targetChanges.put(targetId, targetState.toTargetChange());
					targetState.clearChanges();
				}
			}
		}

		// Documents that only limbo resolution targets touched; garbage collection treats them specially
		Set<DocumentKey> resolvedLimboDocuments = new HashSet<>();
		for (Map.Entry<DocumentKey, Set<Integer>> entry: pendingDocumentTargetMapping.entrySet()) {
			boolean isOnlyLimboTarget = true;
			for (int targetId: entry.getValue()) {
				TargetData targetData = queryDataForActiveTarget(targetId);
				if (targetData != null && targetData.purpose() != QueryPurpose.LIMBO_RESOLUTION) {
					isOnlyLimboTarget = false;
					break;
				}
			}
			if (isOnlyLimboTarget) {
				resolvedLimboDocuments.add(entry.getKey());
			}
		}

		Map<DocumentKey, Document> documentUpdates = new HashMap<>();
		pendingDocumentUpdates.forEach((key, document) -> documentUpdates.put(key, document.withReadTime(snapshotVersion)));

		RemoteEvent remoteEvent = new RemoteEvent(
			snapshotVersion,
			Map.copyOf(targetChanges),
			Map.copyOf(pendingTargetResets),
			Map.copyOf(documentUpdates),
			Set.copyOf(resolvedLimboDocuments));

		pendingDocumentUpdates = new HashMap<>();
		pendingDocumentTargetMapping = new HashMap<>();
		pendingTargetResets = new HashMap<>();
		return remoteEvent;
	}

	private void addDocumentToTarget(int targetId, Document document) {
		if (!isActiveTarget(targetId)) {
			return;
		}
		DocumentViewChange.Type changeType = targetContainsDocument(targetId, document.key())
			? DocumentViewChange.Type.MODIFIED
			: DocumentViewChange.Type.ADDED;
		ensureTargetState(targetId).addDocumentChange(document.key(), changeType);
		pendingDocumentUpdates.put(document.key(), document);
		ensureDocumentTargetMapping(document.key()).add(targetId);
	}

	/**
	 * @param updatedDocument the document's new state, or null if only its target membership changed
	 */
	private void removeDocumentFromTarget(int targetId, DocumentKey key, @Nullable Document updatedDocument) {
		if (!isActiveTarget(targetId)) {
			return;
		}
		TargetState targetState = ensureTargetState(targetId);
		if (targetContainsDocument(targetId, key)) {
			targetState.addDocumentChange(key, DocumentViewChange.Type.REMOVED);
		} else {
			// Entered and left between snapshots
			targetState.removeDocumentChange(key);
		}
		ensureDocumentTargetMapping(key).add(targetId);
		if (updatedDocument != null) {
			pendingDocumentUpdates.put(key, updatedDocument);
		}
	}

	void removeTarget(int targetId) {
		targetStates.remove(targetId);
	}

	/**
	 * Remote keys from the last event, adjusted by the changes accumulated since.
	 */
	private int getCurrentDocumentCountForTarget(int targetId) {
		TargetChange targetChange = ensureTargetState(targetId).toTargetChange();
		return targetMetadataProvider.getRemoteKeysForTarget(targetId).size()
			+ targetChange.addedDocuments().size()
			- targetChange.removedDocuments().size();
	}

	/**
	 * Called for each listen or unlisten request sent, so that changes are ignored until the server responds.
	 */
	void recordPendingTargetRequest(int targetId) {
		ensureTargetState(targetId).recordPendingTargetRequest();
	}

	private TargetState ensureTargetState(int targetId) {
		return targetStates.computeIfAbsent(targetId, id -> new TargetState());
	}

	private Set<Integer> ensureDocumentTargetMapping(DocumentKey key) {
		return pendingDocumentTargetMapping.computeIfAbsent(key, k -> new HashSet<>());
	}

	private boolean isActiveTarget(int targetId) {
		return queryDataForActiveTarget(targetId) != null;
	}

	private @Nullable TargetData queryDataForActiveTarget(int targetId) {
		TargetState targetState = targetStates.get(targetId);
		return (targetState != null && targetState.isPending())
			? null
			: targetMetadataProvider.getTargetDataForTarget(targetId);
	}

	/**
	 * Starts the target over, synthesizing removes for every document we know it has.
	 * The server re-adds the ones that still match.
	 */
	private void resetTarget(int targetId) {
		TargetState existing = targetStates.get(targetId);
		if (existing == null || existing.isPending()) {
			throw new AssertionError("Should only reset active targets");
		}
		targetStates.put(targetId, new TargetState());
		for (DocumentKey key: targetMetadataProvider.getRemoteKeysForTarget(targetId)) {
			removeDocumentFromTarget(targetId, key, null);
		}
	}

	private boolean targetContainsDocument(int targetId, DocumentKey key) {
		return targetMetadataProvider.getRemoteKeysForTarget(targetId).contains(key);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(WatchChangeAggregator.class);
}

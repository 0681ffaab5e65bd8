package io.vena.drift.core;

import io.vena.drift.core.DocumentViewChange.Type;
import io.vena.drift.core.ViewSnapshot.SyncState;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.remote.TargetChange;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Value;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PSortedSet;
import org.pcollections.TreePSet;

/**
 * The client-side state of one query: its current results, which of them the server
 * has confirmed, and which are in limbo.
 *
 * <p>
 * A view is fed document changes from the local store and target changes from the
 * remote store, and turns them into {@link ViewSnapshot}s.
 */
public class View {
	/**
	 * The effect of some document changes on a view, computed without applying them.
	 */
	@Value
	public static class DocumentChanges {
		DocumentSet documentSet;
		DocumentViewChangeSet changeSet;
		PSortedSet<DocumentKey> mutatedKeys;

		/**
		 * Documents moved past the limit or were deleted from a full limit query,
		 * so the local store must be queried again to fill the gap.
		 */
		boolean needsRefill;
	}

	private final Query query;

	private SyncState syncState = SyncState.NONE;

	/**
	 * The server has told us the results are up to date as of our last event.
	 */
	private boolean current;

	private DocumentSet documentSet;

	/**
	 * The keys the server says are in the results.
	 */
	private PSortedSet<DocumentKey> syncedDocuments;

	private PSortedSet<DocumentKey> limboDocuments = TreePSet.empty();
	private PSortedSet<DocumentKey> mutatedKeys = TreePSet.empty();

	public View(Query query, Set<DocumentKey> remoteDocuments) {
		this.query = query;
		this.documentSet = DocumentSet.emptySet(query.comparator());
		this.syncedDocuments = TreePSet.from(remoteDocuments);
	}

	public Query query() {
		return query;
	}

	public SyncState syncState() {
		return syncState;
	}

	public DocumentChanges computeDocChanges(Map<DocumentKey, Document> docChanges) {
		return computeDocChanges(docChanges, null);
	}

	/**
	 * @param previousChanges the result of a previous call, when refilling after it reported
	 * {@link DocumentChanges#needsRefill()}
	 */
	public DocumentChanges computeDocChanges(Map<DocumentKey, Document> docChanges, @Nullable DocumentChanges previousChanges) {
		DocumentViewChangeSet changeSet = previousChanges != null ? previousChanges.changeSet() : new DocumentViewChangeSet();
		DocumentSet oldDocumentSet = previousChanges != null ? previousChanges.documentSet() : documentSet;
		PSortedSet<DocumentKey> newMutatedKeys = previousChanges != null ? previousChanges.mutatedKeys() : mutatedKeys;
		DocumentSet newDocumentSet = oldDocumentSet;
		boolean needsRefill = false;

		// The documents at the edge of a full limit. An update that moves past them, or a delete,
		// may let some other cached document into the results.
		Document lastDocInLimit = (query.hasLimitToFirst() && oldDocumentSet.size() == query.limit())
			? oldDocumentSet.getLastDocument() : null;
		Document firstDocInLimit = (query.hasLimitToLast() && oldDocumentSet.size() == query.limit())
			? oldDocumentSet.getFirstDocument() : null;

		for (Map.Entry<DocumentKey, Document> entry: docChanges.entrySet()) {
			DocumentKey key = entry.getKey();
			Document oldDoc = oldDocumentSet.getDocument(key);
			Document newDoc = query.matches(entry.getValue()) ? entry.getValue() : null;

			boolean oldDocHadPendingMutations = oldDoc != null && mutatedKeys.contains(oldDoc.key());
			// Committed mutations only count for documents mutated during the lifetime of the view
			boolean newDocHasPendingMutations = newDoc != null
				&& (newDoc.hasLocalMutations() || (mutatedKeys.contains(newDoc.key()) && newDoc.hasCommittedMutations()));

			boolean changeApplied = false;
			if (oldDoc != null && newDoc != null) {
				if (!oldDoc.data().equals(newDoc.data())) {
					if (!shouldWaitForSyncedDocument(oldDoc, newDoc)) {
						changeSet.addChange(new DocumentViewChange(Type.MODIFIED, newDoc));
						changeApplied = true;
						if ((lastDocInLimit != null && query.comparator().compare(newDoc, lastDocInLimit) > 0)
							|| (firstDocInLimit != null && query.comparator().compare(newDoc, firstDocInLimit) < 0)) {
							needsRefill = true;
						}
					}
				} else if (oldDocHadPendingMutations != newDocHasPendingMutations) {
					changeSet.addChange(new DocumentViewChange(Type.METADATA, newDoc));
					changeApplied = true;
				}
			} else if (oldDoc == null && newDoc != null) {
				changeSet.addChange(new DocumentViewChange(Type.ADDED, newDoc));
				changeApplied = true;
			} else if (oldDoc != null) {
				changeSet.addChange(new DocumentViewChange(Type.REMOVED, oldDoc));
				changeApplied = true;
				if (lastDocInLimit != null || firstDocInLimit != null) {
					needsRefill = true;
				}
			}

			if (changeApplied) {
				if (newDoc != null) {
					newDocumentSet = newDocumentSet.add(newDoc);
					if (newDoc.hasLocalMutations()) {
						newMutatedKeys = newMutatedKeys.plus(newDoc.key());
					} else {
						newMutatedKeys = newMutatedKeys.minus(newDoc.key());
					}
				} else {
					newDocumentSet = newDocumentSet.remove(key);
					newMutatedKeys = newMutatedKeys.minus(key);
				}
			}
		}

		if (query.hasLimit()) {
			for (long i = newDocumentSet.size() - query.limit(); i > 0; --i) {
				Document oldDoc = query.hasLimitToFirst() ? newDocumentSet.getLastDocument() : newDocumentSet.getFirstDocument();
				newDocumentSet = newDocumentSet.remove(oldDoc.key());
				newMutatedKeys = newMutatedKeys.minus(oldDoc.key());
				changeSet.addChange(new DocumentViewChange(Type.REMOVED, oldDoc));
			}
		}

		if (needsRefill && previousChanges != null) {
			throw new AssertionError("View was refilled using documents that themselves needed refilling");
		}
		return new DocumentChanges(newDocumentSet, changeSet, newMutatedKeys, needsRefill);
	}

	/**
	 * A write acknowledgement that changed the data (eg. a server timestamp resolving)
	 * is followed by the same document from the server, so we skip the intermediate event.
	 */
	private boolean shouldWaitForSyncedDocument(Document oldDoc, Document newDoc) {
		return oldDoc.hasLocalMutations() && newDoc.hasCommittedMutations() && !newDoc.hasLocalMutations();
	}

	public ViewChange applyChanges(DocumentChanges docChanges) {
		return applyChanges(docChanges, null, false);
	}

	public ViewChange applyChanges(DocumentChanges docChanges, @Nullable TargetChange targetChange) {
		return applyChanges(docChanges, targetChange, false);
	}

	/**
	 * @param targetIsPendingReset the server is about to resend the whole target, so limbo
	 * tracking and the synced state are held back until it does
	 */
	public ViewChange applyChanges(DocumentChanges docChanges, @Nullable TargetChange targetChange, boolean targetIsPendingReset) {
		if (docChanges.needsRefill()) {
			throw new AssertionError("Cannot apply changes that need a refill");
		}
		DocumentSet oldDocumentSet = documentSet;
		documentSet = docChanges.documentSet();
		mutatedKeys = docChanges.mutatedKeys();

		List<DocumentViewChange> viewChanges = docChanges.changeSet().getChanges();
		viewChanges.sort((a, b) -> {
			int typeComparison = Integer.compare(changeTypeOrder(a), changeTypeOrder(b));
			if (typeComparison != 0) {
				return typeComparison;
			}
			return query.comparator().compare(a.document(), b.document());
		});
		applyTargetChange(targetChange);
		List<LimboDocumentChange> limboChanges = targetIsPendingReset ? List.of() : updateLimboDocuments();
		boolean synced = limboDocuments.isEmpty() && current && !targetIsPendingReset;
		SyncState newSyncState = synced ? SyncState.SYNCED : SyncState.LOCAL;
		boolean syncStateChanged = newSyncState != syncState;
		syncState = newSyncState;

		ViewSnapshot snapshot = null;
		if (!viewChanges.isEmpty() || syncStateChanged) {
			snapshot = new ViewSnapshot(
				query,
				docChanges.documentSet(),
				oldDocumentSet,
				viewChanges,
				newSyncState == SyncState.LOCAL,
				docChanges.mutatedKeys(),
				syncStateChanged,
				false,
				targetChange != null && !targetChange.resumeToken().isEmpty());
		}
		return new ViewChange(snapshot, limboChanges);
	}

	/**
	 * Going offline makes a current view stale. The server will send a new
	 * current target change once we reconnect.
	 */
	public ViewChange applyOnlineStateChange(OnlineState onlineState) {
		if (current && onlineState == OnlineState.OFFLINE) {
			current = false;
			return applyChanges(new DocumentChanges(documentSet, new DocumentViewChangeSet(), mutatedKeys, false));
		} else {
			return new ViewChange(null, List.of());
		}
	}

	private void applyTargetChange(@Nullable TargetChange targetChange) {
		if (targetChange == null) {
			return;
		}
		for (DocumentKey key: targetChange.addedDocuments()) {
			syncedDocuments = syncedDocuments.plus(key);
		}
		for (DocumentKey key: targetChange.modifiedDocuments()) {
			if (!syncedDocuments.contains(key)) {
				throw new AssertionError("Modified document " + key + " not found in view");
			}
		}
		for (DocumentKey key: targetChange.removedDocuments()) {
			syncedDocuments = syncedDocuments.minus(key);
		}
		current = targetChange.current();
	}

	private List<LimboDocumentChange> updateLimboDocuments() {
		// Limbo is only meaningful once we're in sync with the server
		if (!current) {
			return List.of();
		}

		PSortedSet<DocumentKey> oldLimboDocuments = limboDocuments;
		PSortedSet<DocumentKey> newLimboDocuments = TreePSet.empty();
		for (Document document: documentSet) {
			if (shouldBeLimboDoc(document.key())) {
				newLimboDocuments = newLimboDocuments.plus(document.key());
			}
		}
		limboDocuments = newLimboDocuments;

		List<LimboDocumentChange> changes = new ArrayList<>();
		for (DocumentKey key: oldLimboDocuments) {
			if (!newLimboDocuments.contains(key)) {
				changes.add(new LimboDocumentChange(LimboDocumentChange.Type.REMOVED, key));
			}
		}
		for (DocumentKey key: newLimboDocuments) {
			if (!oldLimboDocuments.contains(key)) {
				changes.add(new LimboDocumentChange(LimboDocumentChange.Type.ADDED, key));
			}
		}
		return changes;
	}

	private boolean shouldBeLimboDoc(DocumentKey key) {
		if (syncedDocuments.contains(key)) {
			return false;
		}
		Document document = documentSet.getDocument(key);
		if (document == null) {
			return false;
		}
		// Local changes may explain why the server doesn't list it
		return !document.hasLocalMutations();
	}

	Set<DocumentKey> limboDocuments() {
		return limboDocuments;
	}

	public Set<DocumentKey> syncedDocuments() {
		return syncedDocuments;
	}

	private static int changeTypeOrder(DocumentViewChange change) {
		switch (change.type()) {
			case REMOVED:
				return 0;
			case ADDED:
				return 1;
			case MODIFIED:
			case METADATA:
				// Sorted together since both surface as modifications
				return 2;
			default:
				throw new IllegalArgumentException("Unknown change type: " + change.type());
		}
	}
}

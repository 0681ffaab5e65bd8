package io.vena.drift.core;

import io.vena.drift.core.DocumentViewChange.Type;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.Value;

/**
 * What a listener sees of a query at one moment: the ordered results, the changes
 * since the previous snapshot, and whether the results are known to be current.
 */
@Value
public class ViewSnapshot {
	public enum SyncState {
		NONE,
		LOCAL,
		SYNCED,
	}

	Query query;
	DocumentSet documents;
	DocumentSet oldDocuments;
	List<DocumentViewChange> changes;

	/**
	 * The server has not yet confirmed these results, or they reflect a limbo
	 * document the server has not resolved.
	 */
	boolean fromCache;

	/**
	 * Keys of the results that have local writes not yet acknowledged.
	 */
	Set<DocumentKey> mutatedKeys;

	boolean didSyncStateChange;
	boolean excludesMetadataChanges;

	/**
	 * The target had a resume token, meaning the server has answered this query before.
	 */
	boolean hasCachedResults;

	public static ViewSnapshot fromInitialDocuments(Query query, DocumentSet documents, Set<DocumentKey> mutatedKeys, boolean fromCache, boolean excludesMetadataChanges, boolean hasCachedResults) {
		List<DocumentViewChange> viewChanges = new ArrayList<>();
		for (Document document: documents) {
			viewChanges.add(new DocumentViewChange(Type.ADDED, document));
		}
		return new ViewSnapshot(
			query,
			documents,
			DocumentSet.emptySet(query.comparator()),
			viewChanges,
			fromCache,
			mutatedKeys,
			true,
			excludesMetadataChanges,
			hasCachedResults);
	}

	public boolean hasPendingWrites() {
		return !mutatedKeys.isEmpty();
	}

	public ViewSnapshot withoutMetadataChanges() {
		List<DocumentViewChange> documentChanges = new ArrayList<>();
		for (DocumentViewChange change: changes) {
			if (change.type() != Type.METADATA) {
				documentChanges.add(change);
			}
		}
		return new ViewSnapshot(query, documents, oldDocuments, documentChanges, fromCache, mutatedKeys, didSyncStateChange, true, hasCachedResults);
	}
}

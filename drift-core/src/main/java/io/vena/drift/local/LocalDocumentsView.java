package io.vena.drift.local;

import io.vena.drift.core.Query;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.ResourcePath;
import io.vena.drift.model.mutation.FieldMask;
import io.vena.drift.model.mutation.Mutation;
import io.vena.drift.model.mutation.MutationBatch;
import io.vena.drift.model.mutation.Overlay;
import io.vena.drift.model.mutation.OverlayedDocument;
import io.vena.drift.model.mutation.PatchMutation;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The local view of documents: the remote document cache with saved overlays applied on top.
 */
final class LocalDocumentsView {
	private final RemoteDocumentCache remoteDocumentCache;
	private final MutationQueue mutationQueue;
	private final DocumentOverlayCache documentOverlayCache;
	private final IndexManager indexManager;

	LocalDocumentsView(RemoteDocumentCache remoteDocumentCache, MutationQueue mutationQueue, DocumentOverlayCache documentOverlayCache, IndexManager indexManager) {
		this.remoteDocumentCache = remoteDocumentCache;
		this.mutationQueue = mutationQueue;
		this.documentOverlayCache = documentOverlayCache;
		this.indexManager = indexManager;
	}

	MutationQueue getMutationQueue() {
		return mutationQueue;
	}

	DocumentOverlayCache getDocumentOverlayCache() {
		return documentOverlayCache;
	}

	/**
	 * @return the local view of the document; {@link Document.Kind#INVALID} if there's nothing known about it
	 */
	Document getDocument(DocumentKey key) {
		Overlay overlay = documentOverlayCache.getOverlay(key);
		Document base = (overlay == null || overlay.mutation() instanceof PatchMutation)
			? remoteDocumentCache.get(key)
			: Document.invalid(key);
		if (overlay == null) {
			return base;
		}
		return overlay.mutation().applyToLocalView(OverlayedDocument.unmutated(base), Instant.now()).document();
	}

	SortedMap<DocumentKey, Document> getDocuments(Iterable<DocumentKey> keys) {
		return getLocalViewOfDocuments(remoteDocumentCache.getAll(keys), new HashSet<>());
	}

	/**
	 * Applies overlays to the given remote documents.
	 *
	 * @param existenceStateChanged keys whose remote documents just started or stopped existing;
	 * their overlays are recalculated, since a patch may now apply differently
	 */
	SortedMap<DocumentKey, Document> getLocalViewOfDocuments(Map<DocumentKey, Document> docs, Set<DocumentKey> existenceStateChanged) {
		Map<DocumentKey, Overlay> overlays = new HashMap<>();
		populateOverlays(overlays, docs.keySet());
		SortedMap<DocumentKey, Document> result = new TreeMap<>();
		for (Map.Entry<DocumentKey, OverlayedDocument> entry: computeViews(docs, overlays, existenceStateChanged).entrySet()) {
			result.put(entry.getKey(), entry.getValue().document());
		}
		return result;
	}

	/**
	 * Like {@link #getLocalViewOfDocuments}, but keeps track of the fields the overlays touched.
	 */
	Map<DocumentKey, OverlayedDocument> getOverlayedDocuments(Map<DocumentKey, Document> docs) {
		Map<DocumentKey, Overlay> overlays = new HashMap<>();
		populateOverlays(overlays, docs.keySet());
		return computeViews(docs, overlays, new HashSet<>());
	}

	private Map<DocumentKey, OverlayedDocument> computeViews(Map<DocumentKey, Document> remoteDocs, Map<DocumentKey, Overlay> overlays, Set<DocumentKey> existenceStateChanged) {
		Map<DocumentKey, Document> docs = new HashMap<>(remoteDocs);
		Map<DocumentKey, Document> recalculateDocuments = new HashMap<>();
		Map<DocumentKey, FieldMask> mutatedFields = new HashMap<>();
		Instant now = Instant.now();
		for (Document doc: remoteDocs.values()) {
			DocumentKey key = doc.key();
			Overlay overlay = overlays.get(key);
			if (existenceStateChanged.contains(key) && (overlay == null || overlay.mutation() instanceof PatchMutation)) {
				recalculateDocuments.put(key, doc);
			} else if (overlay != null) {
				Mutation mutation = overlay.mutation();
				mutatedFields.put(key, mutation.fieldMask());
				OverlayedDocument applied = mutation.applyToLocalView(new OverlayedDocument(doc, mutation.fieldMask()), now);
				docs.put(key, applied.document());
			} else {
				mutatedFields.put(key, FieldMask.EMPTY);
			}
		}

		mutatedFields.putAll(recalculateAndSaveOverlays(recalculateDocuments));
		docs.putAll(recalculateDocuments);

		Map<DocumentKey, OverlayedDocument> result = new HashMap<>();
		for (Map.Entry<DocumentKey, Document> entry: docs.entrySet()) {
			result.put(entry.getKey(), new OverlayedDocument(entry.getValue(), mutatedFields.get(entry.getKey())));
		}
		return result;
	}

	private void populateOverlays(Map<DocumentKey, Overlay> overlays, Set<DocumentKey> keys) {
		TreeSet<DocumentKey> missingOverlays = new TreeSet<>();
		for (DocumentKey key: keys) {
			if (!overlays.containsKey(key)) {
				missingOverlays.add(key);
			}
		}
		overlays.putAll(documentOverlayCache.getOverlays(missingOverlays));
	}

	/**
	 * Replays every pending batch over the given documents and saves the resulting overlays.
	 * The map entries are replaced with the documents as seen through the batches.
	 *
	 * @return the fields the batches touched for each key
	 */
	Map<DocumentKey, FieldMask> recalculateAndSaveOverlays(Map<DocumentKey, Document> docs) {
		List<MutationBatch> batches = mutationQueue.getAllMutationBatchesAffectingDocumentKeys(docs.keySet());

		Map<DocumentKey, OverlayedDocument> overlayed = new HashMap<>();
		TreeMap<Integer, Set<DocumentKey>> documentsByBatchId = new TreeMap<>();
		for (MutationBatch batch: batches) {
			for (DocumentKey key: batch.keys()) {
				Document baseDoc = docs.get(key);
				if (baseDoc == null) {
					continue;
				}
				OverlayedDocument current = overlayed.getOrDefault(key, OverlayedDocument.unmutated(baseDoc));
				overlayed.put(key, batch.applyToLocalView(current));
				documentsByBatchId.computeIfAbsent(batch.batchId(), __ -> new HashSet<>()).add(key);
			}
		}

		// Each key's overlay is saved under the newest batch that touched it
		Set<DocumentKey> processed = new HashSet<>();
		for (Map.Entry<Integer, Set<DocumentKey>> entry: documentsByBatchId.descendingMap().entrySet()) {
			Map<DocumentKey, Mutation> overlays = new HashMap<>();
			for (DocumentKey key: entry.getValue()) {
				if (processed.add(key)) {
					OverlayedDocument result = overlayed.get(key);
					Mutation mutation = Mutation.calculateOverlayMutation(result.document(), result.mutatedFields());
					if (mutation != null) {
						overlays.put(key, mutation);
					}
				}
			}
			documentOverlayCache.saveOverlays(entry.getKey(), overlays);
		}

		Map<DocumentKey, FieldMask> masks = new HashMap<>();
		for (Map.Entry<DocumentKey, OverlayedDocument> entry: overlayed.entrySet()) {
			docs.put(entry.getKey(), entry.getValue().document());
			masks.put(entry.getKey(), entry.getValue().mutatedFields());
		}
		return masks;
	}

	void recalculateAndSaveOverlays(Set<DocumentKey> documentKeys) {
		recalculateAndSaveOverlays(new HashMap<>(remoteDocumentCache.getAll(documentKeys)));
	}

	/**
	 * Runs the query against the local view, considering only remote documents read after <code>offset</code>
	 * and overlays from batches after its largest batch id.
	 */
	SortedMap<DocumentKey, Document> getDocumentsMatchingQuery(Query query, IndexOffset offset, QueryContext context) {
		if (query.isDocumentQuery()) {
			return getDocumentsMatchingDocumentQuery(query.path());
		} else if (query.isCollectionGroupQuery()) {
			return getDocumentsMatchingCollectionGroupQuery(query, offset, context);
		} else {
			return getDocumentsMatchingCollectionQuery(query, offset, context);
		}
	}

	SortedMap<DocumentKey, Document> getDocumentsMatchingQuery(Query query, IndexOffset offset) {
		return getDocumentsMatchingQuery(query, offset, new QueryContext());
	}

	private SortedMap<DocumentKey, Document> getDocumentsMatchingDocumentQuery(ResourcePath path) {
		SortedMap<DocumentKey, Document> result = new TreeMap<>();
		Document doc = getDocument(DocumentKey.fromPath(path));
		if (doc.isFound()) {
			result.put(doc.key(), doc);
		}
		return result;
	}

	private SortedMap<DocumentKey, Document> getDocumentsMatchingCollectionGroupQuery(Query query, IndexOffset offset, QueryContext context) {
		String collectionId = query.collectionGroup();
		SortedMap<DocumentKey, Document> results = new TreeMap<>();
		for (ResourcePath parent: indexManager.getCollectionParents(collectionId)) {
			if (!query.path().isPrefixOf(parent)) {
				continue;
			}
			Query collectionQuery = query.asCollectionQueryAtPath(parent.append(collectionId));
			results.putAll(getDocumentsMatchingCollectionQuery(collectionQuery, offset, context));
		}
		return results;
	}

	private SortedMap<DocumentKey, Document> getDocumentsMatchingCollectionQuery(Query query, IndexOffset offset, QueryContext context) {
		Map<DocumentKey, Overlay> overlays = documentOverlayCache.getOverlays(query.path(), offset.largestBatchId());
		Map<DocumentKey, Document> remoteDocuments = new HashMap<>(
			remoteDocumentCache.getDocumentsMatchingQuery(query, offset, overlays.keySet(), context));

		// Documents may match only because of their overlays
		for (DocumentKey key: overlays.keySet()) {
			remoteDocuments.putIfAbsent(key, Document.invalid(key));
		}

		SortedMap<DocumentKey, Document> results = new TreeMap<>();
		Instant now = Instant.now();
		for (Map.Entry<DocumentKey, Document> entry: remoteDocuments.entrySet()) {
			Document doc = entry.getValue();
			Overlay overlay = overlays.get(entry.getKey());
			if (overlay != null) {
				doc = overlay.mutation().applyToLocalView(OverlayedDocument.unmutated(doc), now).document();
			}
			if (query.matches(doc)) {
				results.put(entry.getKey(), doc);
			}
		}
		return results;
	}
}

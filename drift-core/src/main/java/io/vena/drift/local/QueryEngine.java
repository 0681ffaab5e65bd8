package io.vena.drift.local;

import io.vena.drift.core.Query;
import io.vena.drift.core.Target;
import io.vena.drift.local.IndexManager.IndexType;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.model.mutation.MutationBatch;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeSet;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs queries against the local documents, using the cheapest strategy available:
 *
 * <ol><li>
 *     a client-side field index, plus whatever changed since the index was last updated,
 * </li><li>
 *     the documents that matched the target at its last limbo-free snapshot, plus whatever changed since,
 * </li><li>
 *     a scan of the whole collection.
 * </li></ol>
 *
 * A full scan that reads many more documents than it returns may create an index for next time,
 * as decided by the {@link IndexingPolicy}.
 */
public class QueryEngine {
	private final IndexingPolicy indexingPolicy;
	private LocalDocumentsView localDocumentsView;
	private IndexManager indexManager;

	public QueryEngine(IndexingPolicy indexingPolicy) {
		this.indexingPolicy = indexingPolicy;
	}

	void initialize(LocalDocumentsView localDocumentsView, IndexManager indexManager) {
		this.localDocumentsView = localDocumentsView;
		this.indexManager = indexManager;
	}

	/**
	 * @param lastLimboFreeSnapshotVersion {@link SnapshotVersion#NONE} to ignore <code>remoteKeys</code>
	 * @param remoteKeys the keys the server last said match the query's target
	 */
	public SortedMap<DocumentKey, Document> getDocumentsMatchingQuery(Query query, SnapshotVersion lastLimboFreeSnapshotVersion, Set<DocumentKey> remoteKeys) {
		if (localDocumentsView == null) {
			throw new AssertionError("QueryEngine not initialized");
		}

		SortedMap<DocumentKey, Document> result = performQueryUsingIndex(query);
		if (result != null) {
			return result;
		}

		result = performQueryUsingRemoteKeys(query, remoteKeys, lastLimboFreeSnapshotVersion);
		if (result != null) {
			return result;
		}

		QueryContext context = new QueryContext();
		result = executeFullCollectionScan(query, context);
		createCacheIndexes(query, context, result.size());
		return result;
	}

	private void createCacheIndexes(Query query, QueryContext context, int resultSize) {
		if (query.isDocumentQuery()) {
			return;
		}
		if (indexingPolicy.shouldCreateIndex(context.getDocumentReadCount(), resultSize)) {
			indexManager.createTargetIndexes(query.toTarget());
			LOGGER.debug("The scan of {} read {} documents for {} results; creating an index",
				query, context.getDocumentReadCount(), resultSize);
		}
	}

	private @Nullable SortedMap<DocumentKey, Document> performQueryUsingIndex(Query query) {
		if (query.matchesAllDocuments()) {
			return null;
		}

		Target target = query.toTarget();
		IndexType indexType = indexManager.getIndexType(target);
		if (indexType == IndexType.NONE) {
			return null;
		}

		if (query.hasLimit() && indexType == IndexType.PARTIAL) {
			// The index can't order the results, so the limit has to be applied after sorting everything
			return performQueryUsingIndex(query.withoutLimit());
		}

		List<DocumentKey> keys = indexManager.getDocumentsMatchingTarget(target);
		if (keys == null) {
			return null;
		}
		SortedMap<DocumentKey, Document> indexedDocuments = localDocumentsView.getDocuments(keys);
		IndexOffset offset = indexManager.getMinOffset(target);

		TreeSet<Document> previousResults = applyQuery(query, indexedDocuments);
		if (needsRefill(query, previousResults, new TreeSet<>(keys), offset.readTime())) {
			return performQueryUsingIndex(query.withoutLimit());
		}

		LOGGER.trace("Using index for {}", query);
		return appendRemainingResults(previousResults, query, offset);
	}

	private @Nullable SortedMap<DocumentKey, Document> performQueryUsingRemoteKeys(Query query, Set<DocumentKey> remoteKeys, SnapshotVersion lastLimboFreeSnapshotVersion) {
		if (query.matchesAllDocuments()) {
			return null;
		}
		if (lastLimboFreeSnapshotVersion.isNone()) {
			return null;
		}

		SortedMap<DocumentKey, Document> documents = localDocumentsView.getDocuments(remoteKeys);
		TreeSet<Document> previousResults = applyQuery(query, documents);

		if (needsRefill(query, previousResults, remoteKeys, lastLimboFreeSnapshotVersion)) {
			return null;
		}

		LOGGER.debug("Re-using previous result from {} to execute {}", lastLimboFreeSnapshotVersion, query);
		return appendRemainingResults(previousResults, query,
			IndexOffset.createSuccessor(lastLimboFreeSnapshotVersion, MutationBatch.UNKNOWN));
	}

	private TreeSet<Document> applyQuery(Query query, Map<DocumentKey, Document> documents) {
		TreeSet<Document> queryResults = new TreeSet<>(query.comparator());
		for (Document document: documents.values()) {
			if (document.isFound() && query.matches(document)) {
				queryResults.add(document);
			}
		}
		return queryResults;
	}

	/**
	 * A limit query can't be served from previous results if a previous result stopped matching,
	 * or if a document that changed since could sort ahead of the one at the edge of the limit.
	 */
	private boolean needsRefill(Query query, TreeSet<Document> sortedPreviousResults, Set<DocumentKey> remoteKeys, SnapshotVersion limboFreeSnapshotVersion) {
		if (!query.hasLimit()) {
			return false;
		}

		if (remoteKeys.size() != sortedPreviousResults.size()) {
			return true;
		}

		Document documentAtLimitEdge = query.limitType() == Query.LimitType.LIMIT_TO_FIRST
			? (sortedPreviousResults.isEmpty() ? null : sortedPreviousResults.last())
			: (sortedPreviousResults.isEmpty() ? null : sortedPreviousResults.first());
		if (documentAtLimitEdge == null) {
			return false;
		}
		return documentAtLimitEdge.hasPendingWrites()
			|| documentAtLimitEdge.version().compareTo(limboFreeSnapshotVersion) > 0;
	}

	private SortedMap<DocumentKey, Document> executeFullCollectionScan(Query query, QueryContext context) {
		LOGGER.debug("Using full collection scan to execute {}", query);
		return localDocumentsView.getDocumentsMatchingQuery(query, IndexOffset.NONE, context);
	}

	/**
	 * Combines earlier results with documents written or mutated after <code>offset</code>.
	 */
	private SortedMap<DocumentKey, Document> appendRemainingResults(Iterable<Document> indexedResults, Query query, IndexOffset offset) {
		SortedMap<DocumentKey, Document> remainingResults = localDocumentsView.getDocumentsMatchingQuery(query, offset);
		for (Document entry: indexedResults) {
			remainingResults.put(entry.key(), entry);
		}
		return remainingResults;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(QueryEngine.class);
}

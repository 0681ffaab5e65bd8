package io.vena.drift.local;

import io.vena.drift.core.Query;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.SnapshotVersion;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * The last server-confirmed state of every cached document.
 * Lookups never return null: a miss is an {@link Document.Kind#INVALID} document.
 *
 * <p>
 * Writes should go through a {@link RemoteDocumentChangeBuffer} so a batch
 * of changes lands in one step.
 */
public interface RemoteDocumentCache {
	void setIndexManager(IndexManager indexManager);

	/**
	 * @param readTime when the document was received; becomes the document's {@link Document#readTime()}
	 */
	void add(Document document, SnapshotVersion readTime);

	void removeAll(Collection<DocumentKey> keys);

	Document get(DocumentKey documentKey);

	Map<DocumentKey, Document> getAll(Iterable<DocumentKey> documentKeys);

	/**
	 * @return documents immediately within the query's collection that were read after <code>offset</code>
	 * and either match the query or are in <code>mutatedKeys</code> (whose overlays may make them match)
	 */
	Map<DocumentKey, Document> getDocumentsMatchingQuery(Query query, IndexOffset offset, Set<DocumentKey> mutatedKeys, QueryContext context);

	void forEachDocumentKey(Consumer<DocumentKey> consumer);

	long size();

	/**
	 * Approximate memory footprint, for deciding whether garbage collection is worthwhile.
	 */
	long getByteSize();
}

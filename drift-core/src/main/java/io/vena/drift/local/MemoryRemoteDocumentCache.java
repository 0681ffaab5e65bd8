package io.vena.drift.local;

import io.vena.drift.core.Query;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.ResourcePath;
import io.vena.drift.model.SnapshotVersion;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import lombok.Value;
import org.pcollections.PSortedMap;
import org.pcollections.TreePMap;

/**
 * Documents are keyed by path, so the documents of a collection are contiguous
 * and a collection scan starts with a seek.
 */
final class MemoryRemoteDocumentCache implements RemoteDocumentCache {
	private State state = State.EMPTY;
	private IndexManager indexManager;

	@Value
	static class State {
		static final State EMPTY = new State(TreePMap.empty(), 0);

		PSortedMap<ResourcePath, Document> docs;
		long byteSize;
	}

	State state() {
		return state;
	}

	void restoreState(Collection<Document> documents) {
		PSortedMap<ResourcePath, Document> docs = TreePMap.empty();
		long byteSize = 0;
		for (Document document: documents) {
			docs = docs.plus(document.key().path(), document);
			byteSize += ByteSizes.of(document);
		}
		this.state = new State(docs, byteSize);
	}

	Checkpoint<State> checkpoint() {
		return new Checkpoint<>(state, () -> state, s -> state = s);
	}

	@Override
	public void setIndexManager(IndexManager indexManager) {
		this.indexManager = indexManager;
	}

	@Override
	public void add(Document document, SnapshotVersion readTime) {
		if (indexManager == null) {
			throw new AssertionError("setIndexManager must be called before add");
		}
		if (readTime.isNone()) {
			throw new AssertionError("Cannot add a document with a read time of zero: " + document.key());
		}
		Document stored = document.withReadTime(readTime);
		ResourcePath path = document.key().path();
		Document previous = state.docs.get(path);
		long byteSize = state.byteSize + ByteSizes.of(stored) - (previous == null ? 0 : ByteSizes.of(previous));
		state = new State(state.docs.plus(path, stored), byteSize);

		indexManager.addToCollectionParentIndex(document.key().collectionPath());
		indexManager.updateIndexEntries(stored);
	}

	@Override
	public void removeAll(Collection<DocumentKey> keys) {
		if (indexManager == null) {
			throw new AssertionError("setIndexManager must be called before removeAll");
		}
		PSortedMap<ResourcePath, Document> docs = state.docs;
		long byteSize = state.byteSize;
		for (DocumentKey key: keys) {
			Document previous = docs.get(key.path());
			if (previous != null) {
				byteSize -= ByteSizes.of(previous);
				docs = docs.minus(key.path());
				indexManager.removeIndexEntries(key);
			}
		}
		state = new State(docs, byteSize);
	}

	@Override
	public Document get(DocumentKey documentKey) {
		Document document = state.docs.get(documentKey.path());
		return document == null ? Document.invalid(documentKey) : document;
	}

	@Override
	public Map<DocumentKey, Document> getAll(Iterable<DocumentKey> documentKeys) {
		Map<DocumentKey, Document> result = new HashMap<>();
		for (DocumentKey key: documentKeys) {
			result.put(key, get(key));
		}
		return result;
	}

	@Override
	public Map<DocumentKey, Document> getDocumentsMatchingQuery(Query query, IndexOffset offset, Set<DocumentKey> mutatedKeys, QueryContext context) {
		Map<DocumentKey, Document> result = new HashMap<>();
		ResourcePath collectionPath = query.path();
		int immediateChildrenPathLength = collectionPath.length() + 1;

		for (Map.Entry<ResourcePath, Document> entry: state.docs.tailMap(collectionPath, false).entrySet()) {
			ResourcePath path = entry.getKey();
			if (!collectionPath.isPrefixOf(path)) {
				break;
			}
			if (path.length() > immediateChildrenPathLength) {
				// Documents in subcollections
				continue;
			}
			Document document = entry.getValue();
			if (IndexOffset.fromDocument(document).compareTo(offset) <= 0) {
				continue;
			}
			context.incrementDocumentReadCount();
			if (!mutatedKeys.contains(document.key()) && !query.matches(document)) {
				continue;
			}
			result.put(document.key(), document);
		}
		return result;
	}

	@Override
	public void forEachDocumentKey(Consumer<DocumentKey> consumer) {
		for (Document document: state.docs.values()) {
			consumer.accept(document.key());
		}
	}

	@Override
	public long size() {
		return state.docs.size();
	}

	@Override
	public long getByteSize() {
		return state.byteSize;
	}

	List<Document> allDocuments() {
		return new ArrayList<>(state.docs.values());
	}
}

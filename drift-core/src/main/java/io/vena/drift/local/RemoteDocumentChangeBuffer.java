package io.vena.drift.local;

import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.SnapshotVersion;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects changes to the {@link RemoteDocumentCache} and writes them all at once with {@link #apply()}.
 * Reads through the buffer see the buffered changes.
 *
 * <p>
 * A buffer can be applied only once.
 */
public final class RemoteDocumentChangeBuffer {
	private final RemoteDocumentCache cache;
	private final Map<DocumentKey, Document> changes = new LinkedHashMap<>();
	private boolean changesApplied = false;

	public RemoteDocumentChangeBuffer(RemoteDocumentCache cache) {
		this.cache = cache;
	}

	public void addEntry(Document document, SnapshotVersion readTime) {
		assertNotApplied();
		changes.put(document.key(), document.withReadTime(readTime));
	}

	public void removeEntry(DocumentKey key) {
		assertNotApplied();
		changes.put(key, Document.invalid(key));
	}

	public Document getEntry(DocumentKey key) {
		assertNotApplied();
		Document buffered = changes.get(key);
		return buffered == null ? cache.get(key) : buffered;
	}

	public Map<DocumentKey, Document> getEntries(Iterable<DocumentKey> keys) {
		Map<DocumentKey, Document> result = new HashMap<>();
		List<DocumentKey> missing = new ArrayList<>();
		for (DocumentKey key: keys) {
			Document buffered = changes.get(key);
			if (buffered == null) {
				missing.add(key);
			} else {
				result.put(key, buffered);
			}
		}
		result.putAll(cache.getAll(missing));
		return result;
	}

	public void apply() {
		assertNotApplied();
		changesApplied = true;
		List<DocumentKey> removals = new ArrayList<>();
		for (Document document: changes.values()) {
			if (document.isValid()) {
				cache.add(document, document.readTime());
			} else {
				removals.add(document.key());
			}
		}
		cache.removeAll(removals);
	}

	private void assertNotApplied() {
		if (changesApplied) {
			throw new AssertionError("Changes have already been applied");
		}
	}
}

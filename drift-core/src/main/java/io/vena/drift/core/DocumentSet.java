package io.vena.drift.core;

import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PSortedMap;
import org.pcollections.PSortedSet;
import org.pcollections.TreePMap;
import org.pcollections.TreePSet;

/**
 * An immutable set of documents, unique by key and ordered by a query's comparator.
 */
public final class DocumentSet implements Iterable<Document> {
	private final PSortedMap<DocumentKey, Document> keyIndex;
	private final PSortedSet<Document> sortedSet;

	private DocumentSet(PSortedMap<DocumentKey, Document> keyIndex, PSortedSet<Document> sortedSet) {
		this.keyIndex = keyIndex;
		this.sortedSet = sortedSet;
	}

	/**
	 * @param comparator must break ties by key, so distinct documents never compare equal
	 */
	public static DocumentSet emptySet(Comparator<Document> comparator) {
		return new DocumentSet(TreePMap.empty(), TreePSet.empty(comparator));
	}

	public int size() {
		return keyIndex.size();
	}

	public boolean isEmpty() {
		return keyIndex.isEmpty();
	}

	public boolean contains(DocumentKey key) {
		return keyIndex.containsKey(key);
	}

	public @Nullable Document getDocument(DocumentKey key) {
		return keyIndex.get(key);
	}

	public @Nullable Document getFirstDocument() {
		return sortedSet.isEmpty() ? null : sortedSet.first();
	}

	public @Nullable Document getLastDocument() {
		return sortedSet.isEmpty() ? null : sortedSet.last();
	}

	/**
	 * @return the document just before the one with the given key, or null if it's first or absent
	 */
	public @Nullable Document getPredecessor(DocumentKey key) {
		Document document = keyIndex.get(key);
		if (document == null) {
			return null;
		}
		return sortedSet.lower(document);
	}

	/**
	 * @return the position of the document with the given key, or -1 if it's absent
	 */
	public int indexOf(DocumentKey key) {
		Document document = keyIndex.get(key);
		if (document == null) {
			return -1;
		}
		return sortedSet.headSet(document).size();
	}

	/**
	 * Adds or replaces the document with the same key.
	 */
	public DocumentSet add(Document document) {
		DocumentSet removed = remove(document.key());
		return new DocumentSet(
			removed.keyIndex.plus(document.key(), document),
			removed.sortedSet.plus(document));
	}

	public DocumentSet remove(DocumentKey key) {
		Document document = keyIndex.get(key);
		if (document == null) {
			return this;
		}
		return new DocumentSet(keyIndex.minus(key), sortedSet.minus(document));
	}

	public List<Document> toList() {
		return new ArrayList<>(sortedSet);
	}

	@NotNull
	@Override
	public Iterator<Document> iterator() {
		return sortedSet.iterator();
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof DocumentSet)) {
			return false;
		}
		DocumentSet otherSet = (DocumentSet) other;
		if (size() != otherSet.size()) {
			return false;
		}
		Iterator<Document> thisIterator = iterator();
		Iterator<Document> otherIterator = otherSet.iterator();
		while (thisIterator.hasNext()) {
			if (!thisIterator.next().equals(otherIterator.next())) {
				return false;
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		int result = 0;
		for (Document document: this) {
			result = 31 * result + document.hashCode();
		}
		return result;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder("[");
		boolean first = true;
		for (Document document: this) {
			if (!first) {
				builder.append(", ");
			}
			first = false;
			builder.append(document);
		}
		return builder.append("]").toString();
	}
}

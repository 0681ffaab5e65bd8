package io.vena.drift.model;

import io.vena.drift.exceptions.MalformedPathException;
import java.util.Comparator;
import lombok.EqualsAndHashCode;

/**
 * Identifies a document by its full path, which always has an even number of segments:
 * alternating collection ids and document ids.
 */
@EqualsAndHashCode
public final class DocumentKey implements Comparable<DocumentKey> {
	public static final Comparator<DocumentKey> COMPARATOR = DocumentKey::compareTo;

	private static final DocumentKey EMPTY = new DocumentKey(ResourcePath.EMPTY);

	private final ResourcePath path;

	private DocumentKey(ResourcePath path) {
		this.path = path;
	}

	/**
	 * A placeholder that sorts before every real key. Not the key of any document.
	 */
	public static DocumentKey empty() {
		return EMPTY;
	}

	public static DocumentKey fromPath(ResourcePath path) {
		if (!isDocumentKey(path)) {
			throw new MalformedPathException("Document keys need an even number of segments: " + path);
		}
		return new DocumentKey(path);
	}

	public static DocumentKey fromPathString(String path) {
		return fromPath(ResourcePath.fromString(path));
	}

	public static DocumentKey of(String... segments) {
		return fromPath(ResourcePath.of(segments));
	}

	public static boolean isDocumentKey(ResourcePath path) {
		return !path.isEmpty() && path.length() % 2 == 0;
	}

	public ResourcePath path() { return path; }

	public ResourcePath collectionPath() {
		return path.popLast();
	}

	/**
	 * The id of the collection immediately containing this document.
	 */
	public String collectionGroup() {
		return path.segment(path.length() - 2);
	}

	public String documentId() {
		return path.lastSegment();
	}

	public boolean hasCollectionId(String collectionId) {
		return collectionGroup().equals(collectionId);
	}

	@Override
	public int compareTo(DocumentKey other) {
		return path.compareTo(other.path);
	}

	@Override
	public String toString() {
		return path.canonicalString();
	}
}

package io.vena.drift.model;

import io.vena.drift.exceptions.MalformedPathException;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;

import static java.util.Arrays.asList;
import static java.util.Collections.unmodifiableList;

/**
 * A dot-separated path to a field within a document's data.
 * The special path {@link #KEY_PATH} refers to the document's key.
 */
@EqualsAndHashCode
public final class FieldPath implements Comparable<FieldPath> {
	public static final String KEY_FIELD_NAME = "__name__";
	public static final FieldPath KEY_PATH = new FieldPath(List.of(KEY_FIELD_NAME));

	private final List<String> segments;

	private FieldPath(List<String> segments) {
		this.segments = segments;
	}

	public static FieldPath of(String... segments) {
		return fromSegments(asList(segments));
	}

	public static FieldPath fromSegments(List<String> segments) {
		if (segments.isEmpty()) {
			throw new MalformedPathException("Field paths can't be empty");
		}
		for (String segment: segments) {
			if (segment.isEmpty()) {
				throw new MalformedPathException("Field path segments can't be empty: " + segments);
			}
		}
		return new FieldPath(unmodifiableList(new ArrayList<>(segments)));
	}

	public static FieldPath fromDotSeparatedString(String path) {
		return fromSegments(asList(path.split("\\.", -1)));
	}

	public int length() { return segments.size(); }
	public String segment(int index) { return segments.get(index); }
	public List<String> segments() { return segments; }
	public String firstSegment() { return segments.get(0); }
	public String lastSegment() { return segments.get(segments.size() - 1); }

	public boolean isKeyField() {
		return this.equals(KEY_PATH);
	}

	public FieldPath popLast() {
		return new FieldPath(segments.subList(0, segments.size() - 1));
	}

	public FieldPath popFirst() {
		return new FieldPath(segments.subList(1, segments.size()));
	}

	public FieldPath append(String segment) {
		List<String> result = new ArrayList<>(segments);
		result.add(segment);
		return fromSegments(result);
	}

	public boolean isPrefixOf(FieldPath other) {
		if (length() > other.length()) {
			return false;
		}
		for (int i = 0; i < length(); i++) {
			if (!segment(i).equals(other.segment(i))) {
				return false;
			}
		}
		return true;
	}

	public String canonicalString() {
		return String.join(".", segments);
	}

	@Override
	public int compareTo(FieldPath other) {
		int limit = Math.min(length(), other.length());
		for (int i = 0; i < limit; i++) {
			int c = segment(i).compareTo(other.segment(i));
			if (c != 0) {
				return c;
			}
		}
		return Integer.compare(length(), other.length());
	}

	@Override
	public String toString() {
		return canonicalString();
	}
}

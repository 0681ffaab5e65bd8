package io.vena.drift.model;

import io.vena.drift.exceptions.MalformedPathException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;

import static java.util.Arrays.asList;
import static java.util.Collections.unmodifiableList;

/**
 * A slash-separated path to a collection or document, like <code>rooms/lobby/messages</code>.
 * Segments are compared lexicographically, so paths sort the way their documents
 * are laid out in the remote document cache.
 */
@EqualsAndHashCode
public final class ResourcePath implements Comparable<ResourcePath> {
	private final List<String> segments;

	public static final ResourcePath EMPTY = new ResourcePath(Collections.emptyList());

	private ResourcePath(List<String> segments) {
		this.segments = segments;
	}

	public static ResourcePath fromSegments(List<String> segments) {
		for (String segment: segments) {
			if (segment.isEmpty()) {
				throw new MalformedPathException("Path segments can't be empty: " + segments);
			}
			if (segment.contains("/")) {
				throw new MalformedPathException("Path segment can't contain a slash: \"" + segment + "\"");
			}
		}
		return segments.isEmpty() ? EMPTY : new ResourcePath(unmodifiableList(new ArrayList<>(segments)));
	}

	public static ResourcePath of(String... segments) {
		return fromSegments(asList(segments));
	}

	/**
	 * Leading and trailing slashes are ignored; empty interior segments are not allowed.
	 */
	public static ResourcePath fromString(String path) {
		String trimmed = path;
		while (trimmed.startsWith("/")) {
			trimmed = trimmed.substring(1);
		}
		while (trimmed.endsWith("/")) {
			trimmed = trimmed.substring(0, trimmed.length() - 1);
		}
		if (trimmed.isEmpty()) {
			return EMPTY;
		}
		if (trimmed.contains("//")) {
			throw new MalformedPathException("Invalid path (\"" + path + "\"). Paths must not contain // in them.");
		}
		return fromSegments(asList(trimmed.split("/")));
	}

	public int length() { return segments.size(); }
	public boolean isEmpty() { return segments.isEmpty(); }
	public String segment(int index) { return segments.get(index); }
	public List<String> segments() { return segments; }

	public String lastSegment() {
		if (segments.isEmpty()) {
			throw new IllegalStateException("Empty path has no last segment");
		}
		return segments.get(segments.size() - 1);
	}

	public ResourcePath append(String segment) {
		List<String> result = new ArrayList<>(segments.size() + 1);
		result.addAll(segments);
		result.add(segment);
		return fromSegments(result);
	}

	public ResourcePath append(ResourcePath other) {
		List<String> result = new ArrayList<>(segments.size() + other.length());
		result.addAll(segments);
		result.addAll(other.segments);
		return new ResourcePath(unmodifiableList(result));
	}

	public ResourcePath popLast() {
		if (segments.isEmpty()) {
			throw new IllegalStateException("Can't pop the last segment of an empty path");
		}
		return new ResourcePath(segments.subList(0, segments.size() - 1));
	}

	public ResourcePath popFirst() {
		if (segments.isEmpty()) {
			throw new IllegalStateException("Can't pop the first segment of an empty path");
		}
		return new ResourcePath(segments.subList(1, segments.size()));
	}

	public boolean isPrefixOf(ResourcePath other) {
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

	/**
	 * @return true if <code>other</code> is exactly one segment longer than this path and starts with it.
	 */
	public boolean isImmediateParentOf(ResourcePath other) {
		return length() + 1 == other.length() && isPrefixOf(other);
	}

	public String canonicalString() {
		return String.join("/", segments);
	}

	@Override
	public int compareTo(ResourcePath other) {
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

package io.vena.drift.model;

import io.vena.drift.model.mutation.FieldMask;
import java.util.HashSet;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.emptySortedMap;
import static java.util.Collections.unmodifiableSortedMap;

/**
 * Immutable nested map holding the data of a document.
 * Every update returns a new instance sharing unchanged sub-maps with this one.
 */
@EqualsAndHashCode
public final class ObjectValue {
	private static final ObjectValue EMPTY = new ObjectValue(emptySortedMap());

	private final SortedMap<String, Object> fields;

	private ObjectValue(SortedMap<String, Object> fields) {
		this.fields = fields;
	}

	public static ObjectValue empty() {
		return EMPTY;
	}

	@SuppressWarnings("unchecked")
	public static ObjectValue fromMap(Map<String, ?> value) {
		return new ObjectValue((SortedMap<String, Object>) Values.normalize(value));
	}

	public SortedMap<String, Object> asMap() {
		return fields;
	}

	public boolean isEmpty() {
		return fields.isEmpty();
	}

	public boolean has(FieldPath path) {
		Map<?, ?> parent = parentMap(path);
		return parent != null && parent.containsKey(path.lastSegment());
	}

	/**
	 * @return the value at <code>path</code>, or null if it's absent (use {@link #has} to distinguish)
	 */
	public @Nullable Object get(FieldPath path) {
		Map<?, ?> parent = parentMap(path);
		return parent == null ? null : parent.get(path.lastSegment());
	}

	private @Nullable Map<?, ?> parentMap(FieldPath path) {
		Map<?, ?> current = fields;
		for (int i = 0; i < path.length() - 1; i++) {
			Object child = current.get(path.segment(i));
			if (child instanceof Map<?, ?> m) {
				current = m;
			} else {
				return null;
			}
		}
		return current;
	}

	public ObjectValue set(FieldPath path, @Nullable Object value) {
		return new ObjectValue(withValue(fields, path, 0, Values.normalize(value)));
	}

	public ObjectValue setAll(Map<FieldPath, Object> values) {
		SortedMap<String, Object> result = fields;
		for (Entry<FieldPath, Object> entry: values.entrySet()) {
			result = withValue(result, entry.getKey(), 0, Values.normalize(entry.getValue()));
		}
		return new ObjectValue(result);
	}

	public ObjectValue delete(FieldPath path) {
		if (!has(path)) {
			return this;
		}
		return new ObjectValue(withoutValue(fields, path, 0));
	}

	private static SortedMap<String, Object> withValue(Map<String, Object> map, FieldPath path, int index, Object value) {
		TreeMap<String, Object> result = new TreeMap<>(map);
		String segment = path.segment(index);
		if (index == path.length() - 1) {
			result.put(segment, value);
		} else {
			Object child = map.get(segment);
			Map<String, Object> childMap = asStringMap(child);
			result.put(segment, withValue(childMap, path, index + 1, value));
		}
		return unmodifiableSortedMap(result);
	}

	private static SortedMap<String, Object> withoutValue(Map<String, Object> map, FieldPath path, int index) {
		TreeMap<String, Object> result = new TreeMap<>(map);
		String segment = path.segment(index);
		if (index == path.length() - 1) {
			result.remove(segment);
		} else {
			result.put(segment, withoutValue(asStringMap(map.get(segment)), path, index + 1));
		}
		return unmodifiableSortedMap(result);
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asStringMap(@Nullable Object value) {
		if (value instanceof Map) {
			return (Map<String, Object>) value;
		} else {
			return emptySortedMap();
		}
	}

	/**
	 * @return the paths of every leaf value; empty maps count as leaves.
	 */
	public FieldMask fieldMask() {
		Set<FieldPath> result = new HashSet<>();
		collectLeaves(fields, null, result);
		return FieldMask.fromSet(result);
	}

	private static void collectLeaves(Map<String, Object> map, @Nullable FieldPath prefix, Set<FieldPath> result) {
		for (Entry<String, Object> entry: map.entrySet()) {
			FieldPath path = (prefix == null) ? FieldPath.of(entry.getKey()) : prefix.append(entry.getKey());
			Object value = entry.getValue();
			if (value instanceof Map && !((Map<?, ?>) value).isEmpty()) {
				collectLeaves(asStringMap(value), path, result);
			} else {
				result.add(path);
			}
		}
	}

	@Override
	public String toString() {
		return fields.toString();
	}
}

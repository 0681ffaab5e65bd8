package io.vena.drift.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableSortedMap;

/**
 * Operations on field values.
 *
 * <p>
 * Field values are plain Java objects: <code>null</code>, {@link Boolean},
 * {@link Long}, {@link Double}, {@link String}, {@link Instant}, {@link DocumentKey},
 * {@link ServerTimestampValue}, {@link List} and {@link Map}.
 * {@link #normalize} converts other numeric types and copies collections into
 * their canonical immutable form.
 */
public final class Values {
	private Values() {}

	public static final int TYPE_ORDER_NULL = 0;
	public static final int TYPE_ORDER_BOOLEAN = 1;
	public static final int TYPE_ORDER_NUMBER = 2;
	public static final int TYPE_ORDER_TIMESTAMP = 3;
	public static final int TYPE_ORDER_SERVER_TIMESTAMP = 4;
	public static final int TYPE_ORDER_STRING = 5;
	public static final int TYPE_ORDER_REFERENCE = 6;
	public static final int TYPE_ORDER_ARRAY = 7;
	public static final int TYPE_ORDER_MAP = 8;

	public static int typeOrder(@Nullable Object value) {
		if (value == null) {
			return TYPE_ORDER_NULL;
		} else if (value instanceof Boolean) {
			return TYPE_ORDER_BOOLEAN;
		} else if (value instanceof Long || value instanceof Double) {
			return TYPE_ORDER_NUMBER;
		} else if (value instanceof Instant) {
			return TYPE_ORDER_TIMESTAMP;
		} else if (value instanceof ServerTimestampValue) {
			return TYPE_ORDER_SERVER_TIMESTAMP;
		} else if (value instanceof String) {
			return TYPE_ORDER_STRING;
		} else if (value instanceof DocumentKey) {
			return TYPE_ORDER_REFERENCE;
		} else if (value instanceof List) {
			return TYPE_ORDER_ARRAY;
		} else if (value instanceof Map) {
			return TYPE_ORDER_MAP;
		} else {
			throw new IllegalArgumentException("Unsupported field value type: " + value.getClass().getName());
		}
	}

	/**
	 * @return <code>value</code> in canonical form: integral numbers as {@link Long},
	 * floating point as {@link Double}, lists and maps immutable, maps sorted by key.
	 */
	public static @Nullable Object normalize(@Nullable Object value) {
		if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return ((Number) value).longValue();
		} else if (value instanceof Float) {
			return ((Float) value).doubleValue();
		} else if (value instanceof List<?> list) {
			List<Object> result = new ArrayList<>(list.size());
			for (Object element: list) {
				result.add(normalize(element));
			}
			return unmodifiableList(result);
		} else if (value instanceof Map<?, ?> map) {
			TreeMap<String, Object> result = new TreeMap<>();
			for (Entry<?, ?> entry: map.entrySet()) {
				if (!(entry.getKey() instanceof String)) {
					throw new IllegalArgumentException("Map keys must be strings: " + entry.getKey());
				}
				result.put((String) entry.getKey(), normalize(entry.getValue()));
			}
			return unmodifiableSortedMap(result);
		} else {
			typeOrder(value); // Validates
			return value;
		}
	}

	public static boolean equals(@Nullable Object left, @Nullable Object right) {
		return compare(left, right) == 0;
	}

	public static int compare(@Nullable Object left, @Nullable Object right) {
		int leftType = typeOrder(left);
		int rightType = typeOrder(right);
		if (leftType != rightType) {
			return Integer.compare(leftType, rightType);
		}
		switch (leftType) {
			case TYPE_ORDER_NULL:
				return 0;
			case TYPE_ORDER_BOOLEAN:
				return Boolean.compare((Boolean) left, (Boolean) right);
			case TYPE_ORDER_NUMBER:
				return compareNumbers((Number) left, (Number) right);
			case TYPE_ORDER_TIMESTAMP:
				return ((Instant) left).compareTo((Instant) right);
			case TYPE_ORDER_SERVER_TIMESTAMP:
				return ((ServerTimestampValue) left).localWriteTime().compareTo(((ServerTimestampValue) right).localWriteTime());
			case TYPE_ORDER_STRING:
				return ((String) left).compareTo((String) right);
			case TYPE_ORDER_REFERENCE:
				return ((DocumentKey) left).compareTo((DocumentKey) right);
			case TYPE_ORDER_ARRAY:
				return compareArrays((List<?>) left, (List<?>) right);
			case TYPE_ORDER_MAP:
				return compareMaps((Map<?, ?>) left, (Map<?, ?>) right);
			default:
				throw new AssertionError("Invalid type order: " + leftType);
		}
	}

	/**
	 * NaN sorts before all other numbers and equals itself; integers and doubles compare by numeric value.
	 */
	private static int compareNumbers(Number left, Number right) {
		if (left instanceof Long && right instanceof Long) {
			return Long.compare(left.longValue(), right.longValue());
		}
		double l = left.doubleValue();
		double r = right.doubleValue();
		if (Double.isNaN(l)) {
			return Double.isNaN(r) ? 0 : -1;
		} else if (Double.isNaN(r)) {
			return 1;
		}
		if (left instanceof Long) {
			return -compareDoubleWithLong(r, left.longValue());
		} else if (right instanceof Long) {
			return compareDoubleWithLong(l, right.longValue());
		}
		return Double.compare(l == 0.0 ? 0.0 : l, r == 0.0 ? 0.0 : r);
	}

	private static int compareDoubleWithLong(double d, long l) {
		if (d < -0x1p63) {
			return -1;
		} else if (d >= 0x1p63) {
			return 1;
		}
		long truncated = (long) d;
		int c = Long.compare(truncated, l);
		if (c != 0) {
			return c;
		}
		return Double.compare(d - truncated, 0.0);
	}

	private static int compareArrays(List<?> left, List<?> right) {
		int limit = Math.min(left.size(), right.size());
		for (int i = 0; i < limit; i++) {
			int c = compare(left.get(i), right.get(i));
			if (c != 0) {
				return c;
			}
		}
		return Integer.compare(left.size(), right.size());
	}

	private static int compareMaps(Map<?, ?> left, Map<?, ?> right) {
		Iterator<? extends Entry<?, ?>> leftEntries = new TreeMap<>(left).entrySet().iterator();
		Iterator<? extends Entry<?, ?>> rightEntries = new TreeMap<>(right).entrySet().iterator();
		while (leftEntries.hasNext() && rightEntries.hasNext()) {
			Entry<?, ?> l = leftEntries.next();
			Entry<?, ?> r = rightEntries.next();
			int c = ((String) l.getKey()).compareTo((String) r.getKey());
			if (c != 0) {
				return c;
			}
			c = compare(l.getValue(), r.getValue());
			if (c != 0) {
				return c;
			}
		}
		return Boolean.compare(leftEntries.hasNext(), rightEntries.hasNext());
	}

	public static boolean isNumber(@Nullable Object value) {
		return value instanceof Long || value instanceof Double;
	}

	public static boolean isInteger(@Nullable Object value) {
		return value instanceof Long;
	}

	public static boolean isArray(@Nullable Object value) {
		return value instanceof List;
	}

	public static boolean isNaN(@Nullable Object value) {
		return value instanceof Double && ((Double) value).isNaN();
	}

	public static boolean arrayContains(List<?> array, @Nullable Object value) {
		for (Object element: array) {
			if (equals(element, value)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * A string that is equal for equal values, used to build target canonical ids.
	 */
	public static String canonicalId(@Nullable Object value) {
		StringBuilder builder = new StringBuilder();
		appendCanonicalId(builder, value);
		return builder.toString();
	}

	private static void appendCanonicalId(StringBuilder builder, @Nullable Object value) {
		if (value == null) {
			builder.append("null");
		} else if (value instanceof String s) {
			builder.append('"').append(s).append('"');
		} else if (value instanceof Instant i) {
			builder.append("time(").append(i.getEpochSecond()).append(',').append(i.getNano()).append(')');
		} else if (value instanceof DocumentKey k) {
			builder.append("ref(").append(k).append(')');
		} else if (value instanceof List<?> list) {
			builder.append('[');
			boolean first = true;
			for (Object element: list) {
				if (!first) {
					builder.append(',');
				}
				first = false;
				appendCanonicalId(builder, element);
			}
			builder.append(']');
		} else if (value instanceof Map<?, ?> map) {
			builder.append('{');
			boolean first = true;
			for (Entry<?, ?> entry: new TreeMap<>(map).entrySet()) {
				if (!first) {
					builder.append(',');
				}
				first = false;
				builder.append(entry.getKey()).append(':');
				appendCanonicalId(builder, entry.getValue());
			}
			builder.append('}');
		} else {
			builder.append(value);
		}
	}
}

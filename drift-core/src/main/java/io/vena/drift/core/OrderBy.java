package io.vena.drift.core;

import io.vena.drift.model.Document;
import io.vena.drift.model.FieldPath;
import io.vena.drift.model.Values;
import lombok.Value;

@Value
public class OrderBy {
	Direction direction;
	FieldPath field;

	public enum Direction {
		ASCENDING(1),
		DESCENDING(-1);

		private final int comparisonModifier;

		Direction(int comparisonModifier) {
			this.comparisonModifier = comparisonModifier;
		}

		public Direction flip() {
			return this == ASCENDING ? DESCENDING : ASCENDING;
		}
	}

	public static OrderBy asc(FieldPath field) {
		return new OrderBy(Direction.ASCENDING, field);
	}

	public static OrderBy desc(FieldPath field) {
		return new OrderBy(Direction.DESCENDING, field);
	}

	public static OrderBy asc(String dottedField) {
		return asc(FieldPath.fromDotSeparatedString(dottedField));
	}

	public static OrderBy desc(String dottedField) {
		return desc(FieldPath.fromDotSeparatedString(dottedField));
	}

	public OrderBy flipped() {
		return new OrderBy(direction.flip(), field);
	}

	/**
	 * Both documents must have the field.
	 */
	int compare(Document d1, Document d2) {
		if (field.isKeyField()) {
			return direction.comparisonModifier * d1.key().compareTo(d2.key());
		}
		return direction.comparisonModifier * Values.compare(d1.field(field), d2.field(field));
	}

	public String canonicalId() {
		return field.canonicalString() + (direction == Direction.ASCENDING ? "asc" : "desc");
	}
}

package io.vena.drift.core;

import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.FieldPath;
import io.vena.drift.model.Values;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

/**
 * A single-field predicate in a {@link Query}.
 * Comparisons only match values of the same type; a document lacking the field never matches.
 */
@Getter
@EqualsAndHashCode
public final class FieldFilter {
	private final FieldPath field;
	private final Operator operator;
	private final @Nullable Object value;

	public enum Operator {
		LESS_THAN("<"),
		LESS_THAN_OR_EQUAL("<="),
		EQUAL("=="),
		NOT_EQUAL("!="),
		GREATER_THAN(">"),
		GREATER_THAN_OR_EQUAL(">="),
		ARRAY_CONTAINS("array_contains"),
		ARRAY_CONTAINS_ANY("array_contains_any"),
		IN("in"),
		NOT_IN("not_in"),
		;

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		public String symbol() {
			return symbol;
		}

		public boolean isInequality() {
			switch (this) {
				case LESS_THAN:
				case LESS_THAN_OR_EQUAL:
				case GREATER_THAN:
				case GREATER_THAN_OR_EQUAL:
				case NOT_EQUAL:
				case NOT_IN:
					return true;
				default:
					return false;
			}
		}

		boolean takesArray() {
			return this == IN || this == NOT_IN || this == ARRAY_CONTAINS_ANY;
		}
	}

	private FieldFilter(FieldPath field, Operator operator, @Nullable Object value) {
		this.field = field;
		this.operator = operator;
		this.value = value;
	}

	public static FieldFilter of(FieldPath field, Operator operator, @Nullable Object value) {
		Object normalized = Values.normalize(value);
		if (operator.takesArray() && !(normalized instanceof List)) {
			throw new IllegalArgumentException("Operator " + operator.symbol() + " requires an array value; got " + value);
		}
		if (field.isKeyField() && !operator.takesArray() && operator != Operator.ARRAY_CONTAINS && !(normalized instanceof DocumentKey)) {
			throw new IllegalArgumentException("Filters on the document key require a DocumentKey value; got " + value);
		}
		return new FieldFilter(field, operator, normalized);
	}

	public static FieldFilter of(String dottedField, Operator operator, @Nullable Object value) {
		return of(FieldPath.fromDotSeparatedString(dottedField), operator, value);
	}

	public boolean isInequality() {
		return operator.isInequality();
	}

	public boolean matches(Document document) {
		if (!document.hasField(field)) {
			return false;
		}
		Object other = document.field(field);
		switch (operator) {
			case ARRAY_CONTAINS:
				return other instanceof List && Values.arrayContains((List<?>) other, value);
			case ARRAY_CONTAINS_ANY:
				if (other instanceof List) {
					for (Object element: (List<?>) other) {
						if (Values.arrayContains((List<?>) value, element)) {
							return true;
						}
					}
				}
				return false;
			case IN:
				return Values.arrayContains((List<?>) value, other);
			case NOT_IN:
				return !Values.arrayContains((List<?>) value, null)
					&& !Values.arrayContains((List<?>) value, other);
			case NOT_EQUAL:
				return matchesComparison(Values.compare(other, value));
			default:
				return Values.typeOrder(other) == Values.typeOrder(value)
					&& matchesComparison(Values.compare(other, value));
		}
	}

	private boolean matchesComparison(int comparison) {
		switch (operator) {
			case LESS_THAN: return comparison < 0;
			case LESS_THAN_OR_EQUAL: return comparison <= 0;
			case EQUAL: return comparison == 0;
			case NOT_EQUAL: return comparison != 0;
			case GREATER_THAN: return comparison > 0;
			case GREATER_THAN_OR_EQUAL: return comparison >= 0;
			default: throw new AssertionError("Not a comparison operator: " + operator);
		}
	}

	public String canonicalId() {
		return field.canonicalString() + operator.symbol() + Values.canonicalId(value);
	}

	@Override
	public String toString() {
		return field.canonicalString() + " " + operator.symbol() + " " + Values.canonicalId(value);
	}
}

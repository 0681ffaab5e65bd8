package io.vena.drift.model.mutation;

import io.vena.drift.model.Values;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import lombok.EqualsAndHashCode;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableList;

/**
 * Adds or removes elements of an array field. Both are idempotent,
 * so the server's result is computed the same way as the local estimate.
 */
@EqualsAndHashCode
public abstract class ArrayTransformOperation implements TransformOperation {
	private final List<Object> elements;

	ArrayTransformOperation(List<?> elements) {
		List<Object> normalized = new ArrayList<>(elements.size());
		for (Object element: elements) {
			normalized.add(Values.normalize(element));
		}
		this.elements = unmodifiableList(normalized);
	}

	public List<Object> elements() {
		return elements;
	}

	@Override
	public Object applyToLocalView(@Nullable Object previousValue, Instant localWriteTime) {
		return transform(previousValue);
	}

	@Override
	public Object applyToRemoteDocument(@Nullable Object previousValue, @Nullable Object transformResult) {
		return transform(previousValue);
	}

	@Override
	public @Nullable Object computeBaseValue(@Nullable Object previousValue) {
		return null;
	}

	protected abstract List<Object> apply(List<Object> existing);

	private Object transform(@Nullable Object previousValue) {
		List<Object> existing = (previousValue instanceof List<?> list) ? new ArrayList<>(list) : new ArrayList<>();
		return unmodifiableList(apply(existing));
	}

	@EqualsAndHashCode(callSuper = true)
	public static final class Union extends ArrayTransformOperation {
		public Union(List<?> elements) {
			super(elements);
		}

		@Override
		protected List<Object> apply(List<Object> existing) {
			for (Object element: elements()) {
				if (!Values.arrayContains(existing, element)) {
					existing.add(element);
				}
			}
			return existing;
		}

		@Override
		public String toString() {
			return "ArrayUnion" + elements();
		}
	}

	@EqualsAndHashCode(callSuper = true)
	public static final class Remove extends ArrayTransformOperation {
		public Remove(List<?> elements) {
			super(elements);
		}

		@Override
		protected List<Object> apply(List<Object> existing) {
			for (Object element: elements()) {
				for (Iterator<Object> iter = existing.iterator(); iter.hasNext(); ) {
					if (Values.equals(iter.next(), element)) {
						iter.remove();
					}
				}
			}
			return existing;
		}

		@Override
		public String toString() {
			return "ArrayRemove" + elements();
		}
	}
}

package io.vena.drift.model.mutation;

import io.vena.drift.model.FieldPath;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import lombok.EqualsAndHashCode;

/**
 * The set of fields a {@link PatchMutation} touches.
 * A mask covers a field if it contains the field itself or any prefix of it.
 */
@EqualsAndHashCode
public final class FieldMask {
	public static final FieldMask EMPTY = new FieldMask(Collections.emptySet());

	private final Set<FieldPath> mask;

	private FieldMask(Set<FieldPath> mask) {
		this.mask = mask;
	}

	public static FieldMask fromSet(Set<FieldPath> mask) {
		return new FieldMask(Collections.unmodifiableSet(new TreeSet<>(mask)));
	}

	public static FieldMask of(FieldPath... paths) {
		TreeSet<FieldPath> result = new TreeSet<>();
		Collections.addAll(result, paths);
		return new FieldMask(Collections.unmodifiableSet(result));
	}

	public Set<FieldPath> mask() {
		return mask;
	}

	public boolean covers(FieldPath fieldPath) {
		for (FieldPath path: mask) {
			if (path.isPrefixOf(fieldPath)) {
				return true;
			}
		}
		return false;
	}

	public FieldMask union(FieldMask other) {
		TreeSet<FieldPath> result = new TreeSet<>(mask);
		result.addAll(other.mask);
		return new FieldMask(Collections.unmodifiableSet(result));
	}

	@Override
	public String toString() {
		return "FieldMask" + mask;
	}
}

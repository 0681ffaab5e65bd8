package io.vena.drift.local;

import io.vena.drift.model.FieldPath;
import java.util.List;
import lombok.Value;

/**
 * A client-side index over the given fields of every document in a collection group.
 */
@Value
public class FieldIndex {
	String collectionGroup;
	List<FieldPath> fields;

	public FieldIndex(String collectionGroup, List<FieldPath> fields) {
		if (fields.isEmpty()) {
			throw new IllegalArgumentException("Field index on " + collectionGroup + " needs at least one field");
		}
		this.collectionGroup = collectionGroup;
		this.fields = List.copyOf(fields);
	}
}

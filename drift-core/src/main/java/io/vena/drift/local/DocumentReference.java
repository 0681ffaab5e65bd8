package io.vena.drift.local;

import io.vena.drift.model.DocumentKey;
import java.util.Comparator;
import lombok.Value;

/**
 * An association between a document key and an id: a target id, or a mutation batch id.
 */
@Value
public class DocumentReference {
	DocumentKey key;
	int id;

	static final Comparator<DocumentReference> BY_KEY = Comparator
		.comparing(DocumentReference::key)
		.thenComparingInt(DocumentReference::id);

	static final Comparator<DocumentReference> BY_ID = Comparator
		.comparingInt(DocumentReference::id)
		.thenComparing(DocumentReference::key);
}

package io.vena.drift.model.mutation;

import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import java.time.Instant;
import lombok.EqualsAndHashCode;

import static java.util.Collections.emptyList;

/**
 * Asserts a precondition on the server without changing the document.
 * A failed precondition rejects the whole batch.
 */
@EqualsAndHashCode(callSuper = true)
public final class VerifyMutation extends Mutation {
	public VerifyMutation(DocumentKey key, Precondition precondition) {
		super(key, precondition, emptyList());
	}

	@Override
	public Document applyToRemoteDocument(Document document, MutationResult mutationResult) {
		verifyKeyMatches(document);
		return document;
	}

	@Override
	public OverlayedDocument applyToLocalView(OverlayedDocument overlayed, Instant localWriteTime) {
		verifyKeyMatches(overlayed.document());
		return overlayed;
	}

	@Override
	public String toString() {
		return "VerifyMutation{key=" + key() + ", precondition=" + precondition() + "}";
	}
}

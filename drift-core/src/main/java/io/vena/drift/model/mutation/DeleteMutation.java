package io.vena.drift.model.mutation;

import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import java.time.Instant;
import lombok.EqualsAndHashCode;

import static java.util.Collections.emptyList;

@EqualsAndHashCode(callSuper = true)
public final class DeleteMutation extends Mutation {
	public DeleteMutation(DocumentKey key, Precondition precondition) {
		super(key, precondition, emptyList());
	}

	@Override
	public Document applyToRemoteDocument(Document document, MutationResult mutationResult) {
		verifyKeyMatches(document);
		// The server accepted the delete, so the precondition held
		return document
			.asNoDocument(mutationResult.version())
			.withCommittedMutations();
	}

	@Override
	public OverlayedDocument applyToLocalView(OverlayedDocument overlayed, Instant localWriteTime) {
		Document document = overlayed.document();
		verifyKeyMatches(document);
		if (!precondition().isValidFor(document)) {
			return overlayed;
		}
		Document result = document
			.asNoDocument(document.version())
			.withLocalMutations();
		return new OverlayedDocument(result, null);
	}

	@Override
	public String toString() {
		return "DeleteMutation{key=" + key() + ", precondition=" + precondition() + "}";
	}
}

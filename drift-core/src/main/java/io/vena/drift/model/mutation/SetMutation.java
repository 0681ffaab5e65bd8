package io.vena.drift.model.mutation;

import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.ObjectValue;
import java.time.Instant;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import static java.util.Collections.emptyList;

/**
 * Replaces the whole document.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public final class SetMutation extends Mutation {
	private final ObjectValue value;

	public SetMutation(DocumentKey key, ObjectValue value, Precondition precondition) {
		this(key, value, precondition, emptyList());
	}

	public SetMutation(DocumentKey key, ObjectValue value, Precondition precondition, List<FieldTransform> fieldTransforms) {
		super(key, precondition, fieldTransforms);
		this.value = value;
	}

	@Override
	public Document applyToRemoteDocument(Document document, MutationResult mutationResult) {
		verifyKeyMatches(document);
		ObjectValue newData = value.setAll(serverTransformResults(document.data(), mutationResult.transformResults()));
		return document
			.asFound(mutationResult.version(), newData)
			.withCommittedMutations();
	}

	@Override
	public OverlayedDocument applyToLocalView(OverlayedDocument overlayed, Instant localWriteTime) {
		Document document = overlayed.document();
		verifyKeyMatches(document);
		if (!precondition().isValidFor(document)) {
			return overlayed;
		}
		ObjectValue newData = value.setAll(localTransformResults(localWriteTime, document));
		Document result = document
			.asFound(document.version(), newData)
			.withLocalMutations();
		return new OverlayedDocument(result, null);
	}

	@Override
	public String toString() {
		return "SetMutation{key=" + key() + ", value=" + value + ", precondition=" + precondition() + ", transforms=" + fieldTransforms() + "}";
	}
}

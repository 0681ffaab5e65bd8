package io.vena.drift.model.mutation;

import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.FieldPath;
import io.vena.drift.model.ObjectValue;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import static java.util.Collections.emptyList;

/**
 * Updates only the fields in {@link #mask}. A field in the mask that's absent
 * from {@link #value} is deleted.
 *
 * <p>
 * Patches are normally sent with {@link Precondition#exists(boolean) exists(true)}
 * so they don't create documents.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public final class PatchMutation extends Mutation {
	private final ObjectValue value;
	private final FieldMask mask;

	public PatchMutation(DocumentKey key, ObjectValue value, FieldMask mask, Precondition precondition) {
		this(key, value, mask, precondition, emptyList());
	}

	public PatchMutation(DocumentKey key, ObjectValue value, FieldMask mask, Precondition precondition, List<FieldTransform> fieldTransforms) {
		super(key, precondition, fieldTransforms);
		this.value = value;
		this.mask = mask;
	}

	@Override
	public FieldMask fieldMask() {
		return mask;
	}

	@Override
	public Document applyToRemoteDocument(Document document, MutationResult mutationResult) {
		verifyKeyMatches(document);
		if (!precondition().isValidFor(document)) {
			// The server accepted the patch, but we don't have the document it applied to,
			// so all we know is that it exists at that version.
			return document.asUnknown(mutationResult.version());
		}
		Map<FieldPath, Object> transformResults = serverTransformResults(document.data(), mutationResult.transformResults());
		ObjectValue newData = applyPatch(document.data()).setAll(transformResults);
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
		Map<FieldPath, Object> transformResults = localTransformResults(localWriteTime, document);
		ObjectValue newData = applyPatch(document.data()).setAll(transformResults);
		Document result = document
			.asFound(document.version(), newData)
			.withLocalMutations();

		FieldMask previousMask = overlayed.mutatedFields();
		if (previousMask == null) {
			return new OverlayedDocument(result, null);
		}
		Set<FieldPath> mergedMask = new HashSet<>(previousMask.mask());
		mergedMask.addAll(mask.mask());
		for (FieldTransform transform: fieldTransforms()) {
			mergedMask.add(transform.fieldPath());
		}
		return new OverlayedDocument(result, FieldMask.fromSet(mergedMask));
	}

	private ObjectValue applyPatch(ObjectValue data) {
		Map<FieldPath, Object> updates = new LinkedHashMap<>();
		ObjectValue result = data;
		for (FieldPath path: mask.mask()) {
			if (value.has(path)) {
				updates.put(path, value.get(path));
			} else {
				result = result.delete(path);
			}
		}
		return result.setAll(updates);
	}

	@Override
	public String toString() {
		return "PatchMutation{key=" + key() + ", mask=" + mask + ", value=" + value + ", precondition=" + precondition() + ", transforms=" + fieldTransforms() + "}";
	}
}

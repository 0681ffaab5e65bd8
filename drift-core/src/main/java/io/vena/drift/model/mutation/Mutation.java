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
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableList;

/**
 * A write to one document, applied optimistically to the local view
 * and later applied again using the server's response.
 *
 * <p>
 * Local application ({@link #applyToLocalView}) never fails: a mutation whose
 * {@link Precondition} isn't met simply has no local effect.
 * Remote application ({@link #applyToRemoteDocument}) trusts that the server
 * accepted the mutation, and uses the server's transform results rather than local estimates.
 */
@Getter
@EqualsAndHashCode
public abstract class Mutation {
	private final DocumentKey key;
	private final Precondition precondition;
	private final List<FieldTransform> fieldTransforms;

	Mutation(DocumentKey key, Precondition precondition, List<FieldTransform> fieldTransforms) {
		this.key = key;
		this.precondition = precondition;
		this.fieldTransforms = unmodifiableList(fieldTransforms);
	}

	public abstract Document applyToRemoteDocument(Document document, MutationResult mutationResult);

	public abstract OverlayedDocument applyToLocalView(OverlayedDocument document, Instant localWriteTime);

	/**
	 * @return the fields this mutation touches, or null if it replaces the whole document
	 */
	public @Nullable FieldMask fieldMask() {
		return null;
	}

	/**
	 * @return the starting values of this mutation's non-idempotent transforms, or null if it has none
	 */
	public @Nullable ObjectValue extractTransformBaseValue(Document document) {
		ObjectValue baseObject = null;
		for (FieldTransform transform: fieldTransforms) {
			Object existingValue = document.field(transform.fieldPath());
			Object coercedValue = transform.operation().computeBaseValue(existingValue);
			if (coercedValue != null) {
				baseObject = (baseObject == null ? ObjectValue.empty() : baseObject).set(transform.fieldPath(), coercedValue);
			}
		}
		return baseObject;
	}

	protected void verifyKeyMatches(Document document) {
		if (!document.key().equals(key)) {
			throw new AssertionError("Can only apply a mutation to a document with the same key: " + key + " vs " + document.key());
		}
	}

	protected Map<FieldPath, Object> serverTransformResults(ObjectValue previousData, List<Object> serverResults) {
		if (serverResults.size() != fieldTransforms.size()) {
			throw new AssertionError("Server returned " + serverResults.size() + " transform results for " + fieldTransforms.size() + " transforms");
		}
		Map<FieldPath, Object> result = new LinkedHashMap<>();
		for (int i = 0; i < serverResults.size(); i++) {
			FieldTransform transform = fieldTransforms.get(i);
			Object previousValue = previousData.get(transform.fieldPath());
			result.put(transform.fieldPath(), transform.operation().applyToRemoteDocument(previousValue, serverResults.get(i)));
		}
		return result;
	}

	protected Map<FieldPath, Object> localTransformResults(Instant localWriteTime, Document document) {
		Map<FieldPath, Object> result = new LinkedHashMap<>();
		for (FieldTransform transform: fieldTransforms) {
			Object previousValue = document.data().get(transform.fieldPath());
			result.put(transform.fieldPath(), transform.operation().applyToLocalView(previousValue, localWriteTime));
		}
		return result;
	}

	/**
	 * Collapses the local view of a document into the single mutation that, applied to the
	 * remote document, produces the same result. This is what gets stored as the document's overlay.
	 *
	 * @param mask the fields touched by pending mutations, or null if the whole document was replaced
	 * @return null if the document has no local mutations
	 */
	public static @Nullable Mutation calculateOverlayMutation(Document document, @Nullable FieldMask mask) {
		if (!document.hasLocalMutations() || (mask != null && mask.mask().isEmpty())) {
			return null;
		}

		if (mask == null) {
			if (document.isNoDocument()) {
				return new DeleteMutation(document.key(), Precondition.NONE);
			} else {
				return new SetMutation(document.key(), document.data(), Precondition.NONE);
			}
		}

		ObjectValue data = document.data();
		ObjectValue patchValue = ObjectValue.empty();
		Set<FieldPath> maskSet = new HashSet<>();
		for (FieldPath path: mask.mask()) {
			if (maskSet.contains(path)) {
				continue;
			}
			FieldPath effectivePath = path;
			if (!data.has(path) && path.length() > 1) {
				// Deleting a nested field: the parent as a whole becomes the patched field
				effectivePath = path.popLast();
			}
			if (data.has(effectivePath)) {
				patchValue = patchValue.set(effectivePath, data.get(effectivePath));
			}
			maskSet.add(effectivePath);
		}
		return new PatchMutation(document.key(), patchValue, FieldMask.fromSet(maskSet), Precondition.NONE);
	}
}

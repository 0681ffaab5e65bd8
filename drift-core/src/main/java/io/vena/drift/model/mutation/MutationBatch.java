package io.vena.drift.model.mutation;

import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.Value;

/**
 * The mutations from one call to {@code localWrite}, applied atomically.
 *
 * <p>
 * {@link #baseMutations} carry the pre-write values of fields with non-idempotent
 * transforms, so the local view stays stable when the remote document changes
 * underneath a pending increment. They're applied locally only; the server never sees them.
 */
@Value
public class MutationBatch {
	public static final int UNKNOWN = -1;

	int batchId;
	Instant localWriteTime;
	List<Mutation> baseMutations;
	List<Mutation> mutations;

	public MutationBatch(int batchId, Instant localWriteTime, List<Mutation> baseMutations, List<Mutation> mutations) {
		if (mutations.isEmpty()) {
			throw new IllegalArgumentException("Cannot create an empty mutation batch");
		}
		this.batchId = batchId;
		this.localWriteTime = localWriteTime;
		this.baseMutations = List.copyOf(baseMutations);
		this.mutations = List.copyOf(mutations);
	}

	/**
	 * Applies the server's results for this batch to one document.
	 */
	public Document applyToRemoteDocument(Document document, MutationBatchResult batchResult) {
		List<MutationResult> results = batchResult.mutationResults();
		if (results.size() != mutations.size()) {
			throw new AssertionError("Mismatch between mutations length (" + mutations.size() + ") and results length (" + results.size() + ")");
		}
		Document result = document;
		for (int i = 0; i < mutations.size(); i++) {
			Mutation mutation = mutations.get(i);
			if (mutation.key().equals(document.key())) {
				result = mutation.applyToRemoteDocument(result, results.get(i));
			}
		}
		return result;
	}

	public OverlayedDocument applyToLocalView(OverlayedDocument document) {
		OverlayedDocument result = document;
		for (Mutation mutation: baseMutations) {
			if (mutation.key().equals(document.document().key())) {
				result = mutation.applyToLocalView(result, localWriteTime);
			}
		}
		for (Mutation mutation: mutations) {
			if (mutation.key().equals(document.document().key())) {
				result = mutation.applyToLocalView(result, localWriteTime);
			}
		}
		return result;
	}

	/**
	 * Applies this batch to every document it touches, replacing the entries of {@code documents} in place.
	 *
	 * @param documentsWithoutRemoteVersion keys whose overlay must be a full-document mutation
	 * because the remote cache doesn't have a base version to patch
	 * @return the overlay mutation for each affected key that still has local changes
	 */
	public Map<DocumentKey, Mutation> applyToLocalDocumentSet(Map<DocumentKey, OverlayedDocument> documents, Set<DocumentKey> documentsWithoutRemoteVersion) {
		Map<DocumentKey, Mutation> overlays = new HashMap<>();
		for (DocumentKey key: keys()) {
			OverlayedDocument before = documents.get(key);
			if (before == null) {
				throw new AssertionError("Missing document for key " + key);
			}
			OverlayedDocument after = applyToLocalView(before);
			FieldMask mutatedFields = documentsWithoutRemoteVersion.contains(key) ? null : after.mutatedFields();
			Mutation overlay = Mutation.calculateOverlayMutation(after.document(), mutatedFields);
			if (overlay != null) {
				overlays.put(key, overlay);
			}
			Document document = after.document();
			if (!document.isValid()) {
				document = document.asNoDocument(document.version());
			}
			documents.put(key, new OverlayedDocument(document, after.mutatedFields()));
		}
		return overlays;
	}

	public Set<DocumentKey> keys() {
		Set<DocumentKey> result = new TreeSet<>();
		for (Mutation mutation: mutations) {
			result.add(mutation.key());
		}
		return Collections.unmodifiableSet(result);
	}

	public boolean touches(DocumentKey key) {
		for (Mutation mutation: mutations) {
			if (mutation.key().equals(key)) {
				return true;
			}
		}
		return false;
	}
}

package io.vena.drift.model.mutation;

import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.SnapshotVersion;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.Value;

/**
 * The server's acknowledgement of a {@link MutationBatch}.
 */
@Value
public class MutationBatchResult {
	MutationBatch batch;
	SnapshotVersion commitVersion;
	List<MutationResult> mutationResults;
	String streamToken;

	/**
	 * The version each affected document had after the commit, used to
	 * keep acknowledged documents from regressing in the remote cache.
	 */
	Map<DocumentKey, SnapshotVersion> docVersions;

	public static MutationBatchResult create(MutationBatch batch, SnapshotVersion commitVersion, List<MutationResult> mutationResults, String streamToken) {
		if (batch.mutations().size() != mutationResults.size()) {
			throw new AssertionError("Mutations sent " + batch.mutations().size() + " must equal results received " + mutationResults.size());
		}
		Map<DocumentKey, SnapshotVersion> docVersions = new TreeMap<>();
		List<Mutation> mutations = batch.mutations();
		for (int i = 0; i < mutations.size(); i++) {
			docVersions.put(mutations.get(i).key(), mutationResults.get(i).version());
		}
		return new MutationBatchResult(batch, commitVersion, List.copyOf(mutationResults), streamToken, Collections.unmodifiableMap(docVersions));
	}
}

package io.vena.drift.local;

import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.model.mutation.MutationBatch;
import io.vena.drift.model.mutation.Overlay;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * The complete committed contents of a {@link MemoryPersistence}, in a form a
 * durable store can write out and read back.
 * Derived indexes are not included; they're rebuilt on import.
 */
@Value
@Builder
public class PersistenceSnapshot {
	/**
	 * Keyed by {@link io.vena.drift.model.User#storageKey()}.
	 */
	Map<String, MutationQueueContents> mutationQueues;

	/**
	 * Keyed by {@link io.vena.drift.model.User#storageKey()}.
	 */
	Map<String, List<Overlay>> overlays;

	List<Document> remoteDocuments;
	List<TargetData> targets;
	Map<Integer, Set<DocumentKey>> targetDocuments;
	int highestTargetId;
	long highestListenSequenceNumber;
	SnapshotVersion lastRemoteSnapshotVersion;
	Map<DocumentKey, Long> orphanedSequenceNumbers;
	List<FieldIndex> fieldIndexes;

	@Value
	public static class MutationQueueContents {
		List<MutationBatch> batches;
		int nextBatchId;
		String lastStreamToken;
	}
}

package io.vena.drift.local;

import io.vena.drift.core.Query;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.mutation.Mutation;
import io.vena.drift.model.mutation.MutationBatch;
import java.time.Instant;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * The ordered log of one user's pending writes.
 *
 * <p>
 * Batches are removed strictly in the order they were added: only the oldest batch
 * can be acknowledged or removed, and an attempt to do otherwise is an {@link AssertionError}.
 */
public interface MutationQueue {
	void start();

	boolean isEmpty();

	/**
	 * Records the stream token from the server's acknowledgement of the oldest batch.
	 * The batch stays in the queue until {@link #removeMutationBatch}.
	 */
	void acknowledgeBatch(MutationBatch batch, String streamToken);

	String getLastStreamToken();

	void setLastStreamToken(String streamToken);

	MutationBatch addMutationBatch(Instant localWriteTime, List<Mutation> baseMutations, List<Mutation> mutations);

	@Nullable MutationBatch lookupMutationBatch(int batchId);

	/**
	 * @return the first batch with an id greater than <code>batchId</code>, or null if there is none
	 */
	@Nullable MutationBatch getNextMutationBatchAfterBatchId(int batchId);

	/**
	 * @return {@link MutationBatch#UNKNOWN} if the queue is empty
	 */
	int getHighestUnacknowledgedBatchId();

	List<MutationBatch> getAllMutationBatches();

	List<MutationBatch> getAllMutationBatchesAffectingDocumentKey(DocumentKey documentKey);

	List<MutationBatch> getAllMutationBatchesAffectingDocumentKeys(Iterable<DocumentKey> documentKeys);

	/**
	 * Only collection queries are supported here; collection group queries
	 * are broken down into their collections by the caller.
	 */
	List<MutationBatch> getAllMutationBatchesAffectingQuery(Query query);

	void removeMutationBatch(MutationBatch batch);

	boolean containsKey(DocumentKey key);

	/**
	 * Throws {@link AssertionError} if an empty queue still has index entries.
	 */
	void performConsistencyCheck();
}

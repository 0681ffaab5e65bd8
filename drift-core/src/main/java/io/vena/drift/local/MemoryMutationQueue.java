package io.vena.drift.local;

import io.vena.drift.core.Query;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.ResourcePath;
import io.vena.drift.model.mutation.Mutation;
import io.vena.drift.model.mutation.MutationBatch;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import lombok.Value;
import lombok.With;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PSortedSet;
import org.pcollections.PVector;
import org.pcollections.TreePSet;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class MemoryMutationQueue implements MutationQueue {
	private final MemoryPersistence persistence;
	private final IndexManager indexManager;
	private State state = State.EMPTY;

	/**
	 * The queue's contents: the batches in id order, plus an index from document key to batch id.
	 */
	@Value
	@With
	static class State {
		static final State EMPTY = new State(TreePVector.empty(), 1, "", TreePSet.empty(DocumentReference.BY_KEY));

		PVector<MutationBatch> queue;
		int nextBatchId;
		String lastStreamToken;
		PSortedSet<DocumentReference> batchesByDocumentKey;

		static State restore(List<MutationBatch> queue, int nextBatchId, String lastStreamToken) {
			PSortedSet<DocumentReference> index = TreePSet.empty(DocumentReference.BY_KEY);
			for (MutationBatch batch: queue) {
				for (Mutation mutation: batch.mutations()) {
					index = index.plus(new DocumentReference(mutation.key(), batch.batchId()));
				}
			}
			return new State(TreePVector.from(queue), nextBatchId, lastStreamToken, index);
		}
	}

	MemoryMutationQueue(MemoryPersistence persistence, IndexManager indexManager) {
		this.persistence = persistence;
		this.indexManager = indexManager;
	}

	State state() {
		return state;
	}

	void restoreState(State state) {
		this.state = state;
	}

	Checkpoint<State> checkpoint() {
		return new Checkpoint<>(state, () -> state, s -> state = s);
	}

	@Override
	public void start() {
		LOGGER.debug("Starting mutation queue with {} batches", state.queue.size());
	}

	@Override
	public boolean isEmpty() {
		return state.queue.isEmpty();
	}

	@Override
	public void acknowledgeBatch(MutationBatch batch, String streamToken) {
		int batchIndex = indexOfExistingBatchId(batch.batchId(), "acknowledged");
		if (batchIndex != 0) {
			throw new AssertionError("Can only acknowledge the first batch in the mutation queue; batch " + batch.batchId() + " is at index " + batchIndex);
		}
		state = state.withLastStreamToken(streamToken);
	}

	@Override
	public String getLastStreamToken() {
		return state.lastStreamToken;
	}

	@Override
	public void setLastStreamToken(String streamToken) {
		state = state.withLastStreamToken(streamToken);
	}

	@Override
	public MutationBatch addMutationBatch(Instant localWriteTime, List<Mutation> baseMutations, List<Mutation> mutations) {
		if (mutations.isEmpty()) {
			throw new AssertionError("Mutation batches should not be empty");
		}
		int batchId = state.nextBatchId;
		if (!state.queue.isEmpty()) {
			MutationBatch prior = state.queue.get(state.queue.size() - 1);
			if (prior.batchId() >= batchId) {
				throw new AssertionError("Mutation batch ids must be monotonically increasing: " + prior.batchId() + " then " + batchId);
			}
		}

		MutationBatch batch = new MutationBatch(batchId, localWriteTime, baseMutations, mutations);
		PSortedSet<DocumentReference> index = state.batchesByDocumentKey;
		for (Mutation mutation: mutations) {
			index = index.plus(new DocumentReference(mutation.key(), batchId));
			indexManager.addToCollectionParentIndex(mutation.key().collectionPath());
		}
		state = new State(state.queue.plus(batch), batchId + 1, state.lastStreamToken, index);
		LOGGER.trace("Added batch {} with {} mutations", batchId, mutations.size());
		return batch;
	}

	@Override
	public @Nullable MutationBatch lookupMutationBatch(int batchId) {
		int index = indexOfBatchId(batchId);
		if (index < 0 || index >= state.queue.size()) {
			return null;
		}
		MutationBatch batch = state.queue.get(index);
		if (batch.batchId() != batchId) {
			throw new AssertionError("Expected batch " + batchId + " at index " + index + "; found " + batch.batchId());
		}
		return batch;
	}

	@Override
	public @Nullable MutationBatch getNextMutationBatchAfterBatchId(int batchId) {
		for (MutationBatch batch: state.queue) {
			if (batch.batchId() > batchId) {
				return batch;
			}
		}
		return null;
	}

	@Override
	public int getHighestUnacknowledgedBatchId() {
		return state.queue.isEmpty() ? MutationBatch.UNKNOWN : state.nextBatchId - 1;
	}

	@Override
	public List<MutationBatch> getAllMutationBatches() {
		return Collections.unmodifiableList(state.queue);
	}

	@Override
	public List<MutationBatch> getAllMutationBatchesAffectingDocumentKey(DocumentKey documentKey) {
		List<MutationBatch> result = new ArrayList<>();
		for (DocumentReference ref: state.batchesByDocumentKey.tailSet(new DocumentReference(documentKey, 0), true)) {
			if (!ref.key().equals(documentKey)) {
				break;
			}
			result.add(requireBatch(ref.id()));
		}
		return result;
	}

	@Override
	public List<MutationBatch> getAllMutationBatchesAffectingDocumentKeys(Iterable<DocumentKey> documentKeys) {
		Set<Integer> batchIds = new TreeSet<>();
		for (DocumentKey key: documentKeys) {
			for (DocumentReference ref: state.batchesByDocumentKey.tailSet(new DocumentReference(key, 0), true)) {
				if (!ref.key().equals(key)) {
					break;
				}
				batchIds.add(ref.id());
			}
		}
		return batchesWithIds(batchIds);
	}

	@Override
	public List<MutationBatch> getAllMutationBatchesAffectingQuery(Query query) {
		if (query.isCollectionGroupQuery()) {
			throw new AssertionError("Collection group queries must be broken down by collection: " + query);
		}
		ResourcePath queryPath = query.path();
		Set<Integer> batchIds = new TreeSet<>();
		for (DocumentReference ref: state.batchesByDocumentKey) {
			if (queryPath.isImmediateParentOf(ref.key().path())) {
				batchIds.add(ref.id());
			}
		}
		return batchesWithIds(batchIds);
	}

	private List<MutationBatch> batchesWithIds(Set<Integer> batchIds) {
		List<MutationBatch> result = new ArrayList<>(batchIds.size());
		for (Integer batchId: batchIds) {
			result.add(requireBatch(batchId));
		}
		return result;
	}

	private MutationBatch requireBatch(int batchId) {
		MutationBatch batch = lookupMutationBatch(batchId);
		if (batch == null) {
			throw new AssertionError("Index refers to missing batch " + batchId);
		}
		return batch;
	}

	@Override
	public void removeMutationBatch(MutationBatch batch) {
		int batchIndex = indexOfExistingBatchId(batch.batchId(), "removed");
		if (batchIndex != 0) {
			throw new AssertionError("Can only remove the first entry of the mutation queue; batch " + batch.batchId() + " is at index " + batchIndex);
		}
		PSortedSet<DocumentReference> index = state.batchesByDocumentKey;
		for (Mutation mutation: batch.mutations()) {
			index = index.minus(new DocumentReference(mutation.key(), batch.batchId()));
			persistence.getReferenceDelegate().removeMutationReference(mutation.key());
		}
		state = state
			.withQueue(state.queue.subList(1, state.queue.size()))
			.withBatchesByDocumentKey(index);
		LOGGER.trace("Removed batch {}", batch.batchId());
	}

	@Override
	public boolean containsKey(DocumentKey key) {
		DocumentReference first = state.batchesByDocumentKey.ceiling(new DocumentReference(key, Integer.MIN_VALUE));
		return first != null && first.key().equals(key);
	}

	@Override
	public void performConsistencyCheck() {
		if (state.queue.isEmpty() && !state.batchesByDocumentKey.isEmpty()) {
			throw new AssertionError("Document leak: mutation queue is empty but still has " + state.batchesByDocumentKey.size() + " index entries");
		}
	}

	/**
	 * @return the position the batch would occupy in the queue; may be out of range
	 */
	private int indexOfBatchId(int batchId) {
		if (state.queue.isEmpty()) {
			return 0;
		}
		// Ids are dense within the queue, so the position is just an offset
		return batchId - state.queue.get(0).batchId();
	}

	private int indexOfExistingBatchId(int batchId, String action) {
		int index = indexOfBatchId(batchId);
		if (index < 0 || index >= state.queue.size()) {
			throw new AssertionError("Batches must exist to be " + action + ": " + batchId);
		}
		return index;
	}

	long getByteSize() {
		long result = 0;
		for (MutationBatch batch: state.queue) {
			result += ByteSizes.of(batch);
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MemoryMutationQueue.class);
}

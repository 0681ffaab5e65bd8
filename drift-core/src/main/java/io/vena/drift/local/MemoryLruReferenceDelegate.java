package io.vena.drift.local;

import io.vena.drift.model.DocumentKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

/**
 * Stamps each document with the sequence number of the transaction that last
 * made it potentially unreferenced, so the {@link LruGarbageCollector} can
 * remove the least recently used ones in bulk.
 */
final class MemoryLruReferenceDelegate implements ReferenceDelegate, LruDelegate {
	private final MemoryPersistence persistence;
	private final LruGarbageCollector garbageCollector;
	private Supplier<ReferenceSet> inMemoryPins = ReferenceSet::empty;
	private PMap<DocumentKey, Long> orphanedSequenceNumbers = HashTreePMap.empty();
	private ListenSequence listenSequence;
	private long currentSequenceNumber = ListenSequence.INVALID;

	MemoryLruReferenceDelegate(MemoryPersistence persistence, LruGarbageCollector.Params params) {
		this.persistence = persistence;
		this.garbageCollector = new LruGarbageCollector(this, params);
	}

	void start(long highestSequenceNumber) {
		this.listenSequence = new ListenSequence(highestSequenceNumber);
	}

	Map<DocumentKey, Long> orphanedSequenceNumbers() {
		return orphanedSequenceNumbers;
	}

	void restoreOrphanedSequenceNumbers(Map<DocumentKey, Long> orphaned) {
		this.orphanedSequenceNumbers = HashTreePMap.from(orphaned);
	}

	Checkpoint<PMap<DocumentKey, Long>> checkpoint() {
		return new Checkpoint<>(orphanedSequenceNumbers, () -> orphanedSequenceNumbers, s -> orphanedSequenceNumbers = s);
	}

	@Override
	public LruGarbageCollector getGarbageCollector() {
		return garbageCollector;
	}

	@Override
	public void setInMemoryPins(Supplier<ReferenceSet> inMemoryPins) {
		this.inMemoryPins = inMemoryPins;
	}

	@Override
	public void onTransactionStarted() {
		currentSequenceNumber = listenSequence.next();
	}

	@Override
	public void onTransactionCommitted() {
		currentSequenceNumber = ListenSequence.INVALID;
	}

	@Override
	public long getCurrentSequenceNumber() {
		if (currentSequenceNumber == ListenSequence.INVALID) {
			throw new AssertionError("Attempting to get a sequence number outside of a transaction");
		}
		return currentSequenceNumber;
	}

	@Override
	public void forEachTarget(Consumer<TargetData> consumer) {
		persistence.getTargetCache().forEachTarget(consumer);
	}

	@Override
	public long getSequenceNumberCount() {
		return persistence.getTargetCache().getTargetCount() + orphanedSequenceNumbers.size();
	}

	@Override
	public void forEachOrphanedDocumentSequenceNumber(Consumer<Long> consumer) {
		for (Long sequenceNumber: orphanedSequenceNumbers.values()) {
			consumer.accept(sequenceNumber);
		}
	}

	@Override
	public int removeTargets(long upperBound, Set<Integer> activeTargetIds) {
		return persistence.getTargetCache().removeQueries(upperBound, activeTargetIds);
	}

	@Override
	public int removeOrphanedDocuments(long upperBound) {
		List<DocumentKey> garbage = new ArrayList<>();
		persistence.getRemoteDocumentCache().forEachDocumentKey(key -> {
			if (!isPinned(key, upperBound)) {
				garbage.add(key);
			}
		});
		persistence.getRemoteDocumentCache().removeAll(garbage);
		orphanedSequenceNumbers = orphanedSequenceNumbers.minusAll(garbage);
		return garbage.size();
	}

	@Override
	public void removeMutationReference(DocumentKey key) {
		orphanedSequenceNumbers = orphanedSequenceNumbers.plus(key, getCurrentSequenceNumber());
	}

	@Override
	public void removeTarget(TargetData targetData) {
		persistence.getTargetCache().updateTargetData(targetData.withSequenceNumber(getCurrentSequenceNumber()));
	}

	@Override
	public void addReference(DocumentKey key) {
		orphanedSequenceNumbers = orphanedSequenceNumbers.plus(key, getCurrentSequenceNumber());
	}

	@Override
	public void removeReference(DocumentKey key) {
		orphanedSequenceNumbers = orphanedSequenceNumbers.plus(key, getCurrentSequenceNumber());
	}

	@Override
	public void updateLimboDocument(DocumentKey key) {
		orphanedSequenceNumbers = orphanedSequenceNumbers.plus(key, getCurrentSequenceNumber());
	}

	/**
	 * @return true if the document is referenced by a target, a pending mutation, or a local view,
	 * or was last orphaned more recently than <code>upperBound</code>
	 */
	private boolean isPinned(DocumentKey key, long upperBound) {
		if (persistence.mutationQueuesContainKey(key)) {
			return true;
		}
		if (inMemoryPins.get().containsKey(key)) {
			return true;
		}
		if (persistence.getTargetCache().containsKey(key)) {
			return true;
		}
		Long sequenceNumber = orphanedSequenceNumbers.get(key);
		return sequenceNumber != null && sequenceNumber > upperBound;
	}

	@Override
	public long getByteSize() {
		return persistence.getByteSize();
	}
}

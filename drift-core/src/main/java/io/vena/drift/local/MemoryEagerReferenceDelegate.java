package io.vena.drift.local;

import io.vena.drift.model.DocumentKey;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes documents from the cache as soon as nothing references them,
 * at the end of the transaction that released the last reference.
 */
final class MemoryEagerReferenceDelegate implements ReferenceDelegate {
	private final MemoryPersistence persistence;
	private Supplier<ReferenceSet> inMemoryPins = ReferenceSet::empty;
	private @Nullable Set<DocumentKey> orphanedDocuments;

	MemoryEagerReferenceDelegate(MemoryPersistence persistence) {
		this.persistence = persistence;
	}

	@Override
	public void setInMemoryPins(Supplier<ReferenceSet> inMemoryPins) {
		this.inMemoryPins = inMemoryPins;
	}

	@Override
	public long getCurrentSequenceNumber() {
		return ListenSequence.INVALID;
	}

	@Override
	public void addReference(DocumentKey key) {
		orphanedDocuments().remove(key);
	}

	@Override
	public void removeReference(DocumentKey key) {
		orphanedDocuments().add(key);
	}

	@Override
	public void removeMutationReference(DocumentKey key) {
		orphanedDocuments().add(key);
	}

	@Override
	public void removeTarget(TargetData targetData) {
		TargetCache targetCache = persistence.getTargetCache();
		orphanedDocuments().addAll(targetCache.getMatchingKeysForTargetId(targetData.targetId()));
		targetCache.removeTargetData(targetData);
	}

	@Override
	public void updateLimboDocument(DocumentKey key) {
		orphanedDocuments().add(key);
	}

	@Override
	public void onTransactionStarted() {
		orphanedDocuments = new HashSet<>();
	}

	@Override
	public void onTransactionCommitted() {
		List<DocumentKey> garbage = new ArrayList<>();
		for (DocumentKey key: orphanedDocuments()) {
			if (!isReferenced(key)) {
				garbage.add(key);
			}
		}
		if (!garbage.isEmpty()) {
			LOGGER.trace("Eagerly removing {} unreferenced documents", garbage.size());
			persistence.getRemoteDocumentCache().removeAll(garbage);
		}
		orphanedDocuments = null;
	}

	private boolean isReferenced(DocumentKey key) {
		return persistence.getTargetCache().containsKey(key)
			|| persistence.mutationQueuesContainKey(key)
			|| inMemoryPins.get().containsKey(key);
	}

	private Set<DocumentKey> orphanedDocuments() {
		if (orphanedDocuments == null) {
			throw new AssertionError("Orphaned documents are only tracked inside a transaction");
		}
		return orphanedDocuments;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MemoryEagerReferenceDelegate.class);
}

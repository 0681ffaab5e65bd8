package io.vena.drift.local;

import java.util.Set;
import java.util.function.Consumer;

/**
 * What the {@link LruGarbageCollector} needs from the persistence layer.
 */
public interface LruDelegate {
	void forEachTarget(Consumer<TargetData> consumer);

	void forEachOrphanedDocumentSequenceNumber(Consumer<Long> consumer);

	/**
	 * @return the number of targets plus the number of documents marked as orphaned
	 */
	long getSequenceNumberCount();

	/**
	 * Removes non-active targets with sequence number at or below <code>upperBound</code>.
	 */
	int removeTargets(long upperBound, Set<Integer> activeTargetIds);

	/**
	 * Removes documents not pinned by anything and last orphaned at or below <code>upperBound</code>.
	 */
	int removeOrphanedDocuments(long upperBound);

	long getByteSize();

	LruGarbageCollector getGarbageCollector();
}

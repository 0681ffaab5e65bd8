package io.vena.drift.local;

import io.vena.drift.core.Query;
import io.vena.drift.exceptions.PersistenceUnavailableException;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.model.User;
import io.vena.drift.remote.RemoteEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.vena.drift.local.LocalStoreTest.addDocuments;
import static io.vena.drift.local.LocalStoreTest.found;
import static io.vena.drift.local.LocalStoreTest.patch;
import static io.vena.drift.local.LocalStoreTest.version;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LruGarbageCollectorTest {
	final DocumentKey keyA = DocumentKey.of("coll", "a");
	final DocumentKey keyB = DocumentKey.of("coll", "b");
	final Query collQuery = Query.atPath("coll");

	MemoryPersistence persistence;
	LocalStore localStore;
	LruGarbageCollector garbageCollector;

	@BeforeEach
	void setup() throws PersistenceUnavailableException {
		// Collect everything eligible whenever the cache holds anything at all
		storeWith(new LruGarbageCollector.Params(1, 100, 1000));
	}

	@Test
	void activeTarget_keepsItsDocuments() {
		int targetId = localStore.allocateTarget(collQuery.toTarget()).targetId();
		localStore.applyRemoteEvent(addDocuments(targetId, version(1), found(keyA, 1, Map.of("x", 1))));

		LruGarbageCollector.Results results = localStore.collectGarbage(garbageCollector);

		assertTrue(results.hasRun());
		assertEquals(0, results.targetsRemoved());
		assertEquals(0, results.documentsRemoved());
		assertTrue(localStore.readDocument(keyA).isFound());
	}

	@Test
	void releasedTarget_collectedWithUnpinnedDocuments() {
		int targetId = localStore.allocateTarget(collQuery.toTarget()).targetId();
		localStore.applyRemoteEvent(addDocuments(targetId, version(1),
			found(keyA, 1, Map.of("x", 1)),
			found(keyB, 1, Map.of("x", 2))));
		localStore.writeLocally(List.of(patch(keyB, Map.of("x", 3))));
		localStore.releaseTarget(targetId);

		LruGarbageCollector.Results results = localStore.collectGarbage(garbageCollector);

		assertEquals(1, results.targetsRemoved());
		assertEquals(1, results.documentsRemoved());
		assertFalse(localStore.readDocument(keyA).isValid(), "Unreferenced document is gone");
		assertTrue(localStore.readDocument(keyB).isFound(), "Document with a pending write survives");
		assertEquals(Set.of(), localStore.getRemoteDocumentKeys(targetId));
	}

	@Test
	void pinnedByView_survives() {
		int targetId = localStore.allocateTarget(collQuery.toTarget()).targetId();
		localStore.applyRemoteEvent(addDocuments(targetId, version(1), found(keyA, 1, Map.of("x", 1))));
		int otherTarget = localStore.allocateTarget(Query.atPath("coll/a").toTarget()).targetId();
		localStore.notifyLocalViewChanges(List.of(new LocalViewChanges(otherTarget, true, Set.of(keyA), Set.of())));
		localStore.releaseTarget(targetId);

		localStore.collectGarbage(garbageCollector);

		assertTrue(localStore.readDocument(keyA).isFound());
	}

	@Test
	void disabled_neverRuns() throws PersistenceUnavailableException {
		MemoryPersistence disabledPersistence = MemoryPersistence.createLruGcMemoryPersistence(LruGarbageCollector.Params.disabled());
		disabledPersistence.start();
		LocalStore store = new LocalStore(disabledPersistence, new QueryEngine(IndexingPolicy.disabled()), User.UNAUTHENTICATED);
		store.start();
		LruGarbageCollector disabledCollector = ((LruDelegate) disabledPersistence.getReferenceDelegate()).getGarbageCollector();

		assertFalse(store.collectGarbage(disabledCollector).hasRun());
	}

	@Test
	void smallCache_isNotCollected() throws PersistenceUnavailableException {
		LocalStore store = storeWith(new LruGarbageCollector.Params(Long.MAX_VALUE, 100, 1000));
		int targetId = store.allocateTarget(collQuery.toTarget()).targetId();
		store.applyRemoteEvent(addDocuments(targetId, version(1), found(keyA, 1, Map.of("x", 1))));
		store.releaseTarget(targetId);

		LruGarbageCollector.Results results = store.collectGarbage(garbageCollector);

		assertFalse(results.hasRun());
		assertTrue(store.readDocument(keyA).isFound(), "Nothing is removed while the cache is under the threshold");
	}

	@Test
	void orphanedDocumentsAboveCutoff_survive() throws PersistenceUnavailableException {
		LocalStore store = storeWith(new LruGarbageCollector.Params(1, 50, 1000));
		// Each remote event runs in its own transaction, so b is orphaned later than a
		store.applyRemoteEvent(limboResolution(found(keyA, 1, Map.of("x", 1)), version(1)));
		store.applyRemoteEvent(limboResolution(found(keyB, 2, Map.of("x", 2)), version(2)));

		LruGarbageCollector.Results results = store.collectGarbage(garbageCollector);

		assertEquals(1, results.sequenceNumbersCollected());
		assertEquals(1, results.documentsRemoved());
		assertFalse(store.readDocument(keyA).isValid(), "Least recently orphaned document is collected");
		assertTrue(store.readDocument(keyB).isFound(), "Document orphaned after the cutoff survives");
	}

	@Test
	void percentile_choosesUpperBound() {
		RecordingDelegate delegate = new RecordingDelegate(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
		LruGarbageCollector collector = new LruGarbageCollector(delegate, new LruGarbageCollector.Params(1, 30, 1000));

		assertEquals(3, collector.calculateQueryCount(30));
		LruGarbageCollector.Results results = collector.collect(Set.of());

		assertTrue(results.hasRun());
		assertEquals(3, results.sequenceNumbersCollected());
		assertEquals(3, delegate.targetUpperBound);
		assertEquals(3, delegate.documentUpperBound);
	}

	@Test
	void sequenceNumbersToCollect_areCapped() {
		RecordingDelegate delegate = new RecordingDelegate(10, 20, 30, 40, 50, 60, 70, 80, 90, 100);
		LruGarbageCollector collector = new LruGarbageCollector(delegate, new LruGarbageCollector.Params(1, 50, 2));

		LruGarbageCollector.Results results = collector.collect(Set.of());

		assertEquals(2, results.sequenceNumbersCollected(), "50% of 10 is 5, capped at 2");
		assertEquals(20, delegate.documentUpperBound);
	}

	@Test
	void emptyCache_collectsNothing() {
		RecordingDelegate delegate = new RecordingDelegate();
		LruGarbageCollector collector = new LruGarbageCollector(delegate, new LruGarbageCollector.Params(0, 10, 1000));

		LruGarbageCollector.Results results = collector.collect(Set.of());

		assertTrue(results.hasRun());
		assertEquals(0, results.sequenceNumbersCollected());
		assertEquals(ListenSequence.INVALID, delegate.documentUpperBound);
	}

	@Test
	void rollingBuffer_keepsSmallest() {
		LruGarbageCollector.RollingSequenceNumberBuffer buffer = new LruGarbageCollector.RollingSequenceNumberBuffer(3);
		for (long n: new long[] {9, 2, 7, 5, 1, 8}) {
			buffer.addElement(n);
		}
		assertEquals(5, buffer.maxValue());
	}

	private LocalStore storeWith(LruGarbageCollector.Params params) throws PersistenceUnavailableException {
		persistence = MemoryPersistence.createLruGcMemoryPersistence(params);
		persistence.start();
		localStore = new LocalStore(persistence, new QueryEngine(IndexingPolicy.disabled()), User.UNAUTHENTICATED);
		localStore.start();
		garbageCollector = ((LruDelegate) persistence.getReferenceDelegate()).getGarbageCollector();
		return localStore;
	}

	/**
	 * A document the server told us about outside any target, as when resolving limbo.
	 */
	private static RemoteEvent limboResolution(Document document, SnapshotVersion version) {
		return new RemoteEvent(
			version,
			Map.of(),
			Map.of(),
			Map.of(document.key(), document.withReadTime(version)),
			Set.of(document.key()));
	}

	/**
	 * Orphaned documents with the given sequence numbers and no targets, recording the bounds it's asked to collect up to.
	 */
	static final class RecordingDelegate implements LruDelegate {
		final List<Long> orphanedSequenceNumbers = new ArrayList<>();
		long targetUpperBound = Long.MIN_VALUE;
		long documentUpperBound = Long.MIN_VALUE;

		RecordingDelegate(long... sequenceNumbers) {
			for (long n: sequenceNumbers) {
				orphanedSequenceNumbers.add(n);
			}
		}

		@Override
		public void forEachTarget(Consumer<TargetData> consumer) {
		}

		@Override
		public void forEachOrphanedDocumentSequenceNumber(Consumer<Long> consumer) {
			orphanedSequenceNumbers.forEach(consumer);
		}

		@Override
		public long getSequenceNumberCount() {
			return orphanedSequenceNumbers.size();
		}

		@Override
		public int removeTargets(long upperBound, Set<Integer> activeTargetIds) {
			targetUpperBound = upperBound;
			return 0;
		}

		@Override
		public int removeOrphanedDocuments(long upperBound) {
			documentUpperBound = upperBound;
			int before = orphanedSequenceNumbers.size();
			orphanedSequenceNumbers.removeIf(n -> n <= upperBound);
			return before - orphanedSequenceNumbers.size();
		}

		@Override
		public long getByteSize() {
			return 100;
		}

		@Override
		public LruGarbageCollector getGarbageCollector() {
			throw new UnsupportedOperationException();
		}
	}
}

package io.vena.drift.core;

import io.vena.drift.auth.EmptyAttestationProvider;
import io.vena.drift.auth.EmptyCredentialsProvider;
import io.vena.drift.exceptions.PersistenceUnavailableException;
import io.vena.drift.local.IndexingPolicy;
import io.vena.drift.local.LocalStore;
import io.vena.drift.local.LruGarbageCollector;
import io.vena.drift.local.MemoryPersistence;
import io.vena.drift.local.QueryEngine;
import io.vena.drift.model.DatabaseId;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.ObjectValue;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.model.User;
import io.vena.drift.model.mutation.MutationBatchResult;
import io.vena.drift.remote.CallCredentials;
import io.vena.drift.remote.Connection;
import io.vena.drift.remote.ListenRequest;
import io.vena.drift.remote.RemoteEvent;
import io.vena.drift.remote.RemoteStore;
import io.vena.drift.remote.Status;
import io.vena.drift.remote.StreamObserver;
import io.vena.drift.remote.TargetChange;
import io.vena.drift.remote.Transport;
import io.vena.drift.remote.WatchResponse;
import io.vena.drift.remote.WriteRequest;
import io.vena.drift.remote.WriteResponse;
import io.vena.drift.util.AsyncQueue;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs a sync engine with the network disabled, feeding it remote events by hand.
 */
class SyncEngineTest {
	final Query query = Query.atPath("coll");
	final DocumentKey keyA = DocumentKey.of("coll", "a");
	final DocumentKey keyB = DocumentKey.of("coll", "b");
	final List<ViewSnapshot> snapshots = new ArrayList<>();

	AsyncQueue queue;
	MemoryPersistence persistence;
	SyncEngine syncEngine;

	@BeforeEach
	void setup() {
		queue = new AsyncQueue("sync-engine-test");
	}

	@AfterEach
	void teardown() {
		queue.shutdown(() -> { }).join();
	}

	void startWith(int maxConcurrentLimboResolutions) throws PersistenceUnavailableException {
		persistence = MemoryPersistence.createLruGcMemoryPersistence(LruGarbageCollector.Params.disabled());
		persistence.start();
		LocalStore localStore = new LocalStore(persistence, new QueryEngine(IndexingPolicy.disabled()), User.UNAUTHENTICATED);
		localStore.start();
		onWorker(() -> {
			RemoteStore remoteStore = new RemoteStore(
				DatabaseId.forProject("drift-test"), localStore, new UnreachableTransport(), queue,
				new EmptyCredentialsProvider(), new EmptyAttestationProvider(),
				RemoteStore.Params.defaults(), new DelegatingCallback());
			syncEngine = new SyncEngine(localStore, remoteStore, User.UNAUTHENTICATED, maxConcurrentLimboResolutions);
			syncEngine.setCallback(new RecordingCallback());
		});
	}

	@Test
	void limboResolutions_areLimitedAndQueued() throws PersistenceUnavailableException {
		startWith(1);
		putBothDocumentsInLimbo();

		Map<DocumentKey, Integer> active = onWorker(() -> syncEngine.activeLimboDocumentResolutions());
		List<DocumentKey> enqueued = onWorker(() -> syncEngine.enqueuedLimboDocumentResolutions());
		assertEquals(1, active.size());
		assertEquals(1, enqueued.size());
		Set<DocumentKey> all = new HashSet<>(active.keySet());
		all.addAll(enqueued);
		assertEquals(Set.of(keyA, keyB), all);

		// The server says the first one is gone
		DocumentKey first = active.keySet().iterator().next();
		DocumentKey second = enqueued.get(0);
		onWorker(() -> syncEngine.handleRemoteEvent(new RemoteEvent(
			version(3),
			Map.of(),
			Map.of(),
			Map.of(first, Document.noDocument(first, version(3)).withReadTime(version(3))),
			Set.of(first))));

		Map<DocumentKey, Integer> nowActive = onWorker(() -> syncEngine.activeLimboDocumentResolutions());
		assertEquals(Set.of(second), nowActive.keySet());
		assertThat(onWorker(() -> syncEngine.enqueuedLimboDocumentResolutions()), empty());
		assertNotEquals(active.get(first), nowActive.get(second), "Each resolution gets its own target");
	}

	@Test
	void limboResolutions_runConcurrentlyUpToLimit() throws PersistenceUnavailableException {
		startWith(2);
		putBothDocumentsInLimbo();

		assertEquals(Set.of(keyA, keyB), onWorker(() -> syncEngine.activeLimboDocumentResolutions()).keySet());
		assertThat(onWorker(() -> syncEngine.enqueuedLimboDocumentResolutions()), empty());
	}

	@Test
	void stopListening_abandonsQueuedResolutions() throws PersistenceUnavailableException {
		startWith(1);
		putBothDocumentsInLimbo();

		onWorker(() -> syncEngine.stopListening(query));
		assertTrue(onWorker(() -> syncEngine.activeLimboDocumentResolutions()).isEmpty());
		assertThat(onWorker(() -> syncEngine.enqueuedLimboDocumentResolutions()), empty());
	}

	/**
	 * The server sends both documents for the query, then says neither matches any more
	 * without saying what became of them.
	 */
	private void putBothDocumentsInLimbo() {
		int targetId = onWorker(() -> syncEngine.listen(query));
		onWorker(() -> syncEngine.handleRemoteEvent(new RemoteEvent(
			version(1),
			Map.of(targetId, new TargetChange("resume-1", true, Set.of(keyA, keyB), Set.of(), Set.of())),
			Map.of(),
			Map.of(
				keyA, found(keyA, 1).withReadTime(version(1)),
				keyB, found(keyB, 1).withReadTime(version(1))),
			Set.of())));
		ViewSnapshot synced = snapshots.get(snapshots.size() - 1);
		assertThat(synced.documents().toList().stream().map(Document::key).collect(Collectors.toList()), contains(keyA, keyB));
		assertFalse(synced.fromCache());

		onWorker(() -> syncEngine.handleRemoteEvent(new RemoteEvent(
			version(2),
			Map.of(targetId, new TargetChange("resume-2", true, Set.of(), Set.of(), Set.of(keyA, keyB))),
			Map.of(),
			Map.of(),
			Set.of())));
	}

	private void onWorker(Runnable task) {
		queue.enqueue(task).join();
	}

	private <T> T onWorker(Callable<T> task) {
		return queue.enqueue(task).join();
	}

	private static Document found(DocumentKey key, long version) {
		return Document.found(key, version(version), ObjectValue.fromMap(Map.of("id", key.documentId())));
	}

	private static SnapshotVersion version(long micros) {
		return SnapshotVersion.ofMicros(micros);
	}

	final class RecordingCallback implements SyncEngine.SyncEngineCallback {
		@Override
		public void onViewSnapshots(List<ViewSnapshot> newSnapshots) {
			snapshots.addAll(newSnapshots);
		}

		@Override
		public void onError(Query query, Status error) {
			throw new AssertionError("Unexpected error for " + query + ": " + error);
		}

		@Override
		public void handleOnlineStateChange(OnlineState onlineState) {
		}
	}

	/**
	 * The remote store is built before the sync engine it reports to.
	 */
	final class DelegatingCallback implements RemoteStore.RemoteStoreCallback {
		@Override
		public void handleRemoteEvent(RemoteEvent remoteEvent) {
			syncEngine.handleRemoteEvent(remoteEvent);
		}

		@Override
		public void handleRejectedListen(int targetId, Status error) {
			syncEngine.handleRejectedListen(targetId, error);
		}

		@Override
		public void handleSuccessfulWrite(MutationBatchResult successfulWrite) {
			syncEngine.handleSuccessfulWrite(successfulWrite);
		}

		@Override
		public void handleRejectedWrite(int batchId, Status error) {
			syncEngine.handleRejectedWrite(batchId, error);
		}

		@Override
		public void handleOnlineStateChange(OnlineState onlineState) {
			syncEngine.handleOnlineStateChange(onlineState);
		}

		@Override
		public Set<DocumentKey> getRemoteKeysForTarget(int targetId) {
			return syncEngine.getRemoteKeysForTarget(targetId);
		}
	}

	static final class UnreachableTransport implements Transport {
		@Override
		public Connection<ListenRequest> openWatchStream(CallCredentials credentials, StreamObserver<WatchResponse> observer) {
			throw new AssertionError("Network is disabled");
		}

		@Override
		public Connection<WriteRequest> openWriteStream(CallCredentials credentials, StreamObserver<WriteResponse> observer) {
			throw new AssertionError("Network is disabled");
		}
	}
}

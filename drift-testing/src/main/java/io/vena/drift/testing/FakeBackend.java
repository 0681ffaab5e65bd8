package io.vena.drift.testing;

import io.vena.drift.core.Query;
import io.vena.drift.core.Target;
import io.vena.drift.exceptions.BloomFilterException;
import io.vena.drift.exceptions.DriftException.Code;
import io.vena.drift.model.DatabaseId;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.model.mutation.FieldTransform;
import io.vena.drift.model.mutation.Mutation;
import io.vena.drift.model.mutation.MutationResult;
import io.vena.drift.model.mutation.ServerTimestampOperation;
import io.vena.drift.remote.BloomFilter;
import io.vena.drift.remote.CallCredentials;
import io.vena.drift.remote.Connection;
import io.vena.drift.remote.ExistenceFilter;
import io.vena.drift.remote.ListenRequest;
import io.vena.drift.remote.Status;
import io.vena.drift.remote.StreamObserver;
import io.vena.drift.remote.Transport;
import io.vena.drift.remote.WatchChange.DocumentChange;
import io.vena.drift.remote.WatchChange.ExistenceFilterWatchChange;
import io.vena.drift.remote.WatchChange.WatchTargetChange;
import io.vena.drift.remote.WatchChange.WatchTargetChangeType;
import io.vena.drift.remote.WatchResponse;
import io.vena.drift.remote.WriteRequest;
import io.vena.drift.remote.WriteResponse;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.stream.Collectors.toList;

/**
 * An in-process server for tests, implementing both streams of {@link Transport}
 * against a simple map of documents.
 *
 * <p>
 * Every commit gets a new version. Watch targets get their full results when added,
 * followed by an existence filter carrying a bloom filter of the result names, so a client
 * resuming with stale cached results learns which ones are gone. After that, each commit
 * sends only the documents that changed, and every batch of changes ends with a global
 * snapshot at the commit's version.
 *
 * <p>
 * Tests can take the server offline, hold back write acknowledgements,
 * reject writes, and write documents as if another client had.
 */
public class FakeBackend implements Transport {
	private final DatabaseId databaseId;
	private final TreeMap<DocumentKey, Document> documents = new TreeMap<>();
	private final List<WatchConnection> watchConnections = new ArrayList<>();
	private final List<WriteConnection> writeConnections = new ArrayList<>();
	private final List<ListenRequest> listenRequests = new ArrayList<>();
	private final List<WriteRequest> writeRequests = new ArrayList<>();
	private final List<CallCredentials> credentialsSeen = new ArrayList<>();

	private long clock = 0;
	private boolean online = true;
	private boolean writesHeld = false;
	private @Nullable Code nextWriteError = null;
	private int streamsOpened = 0;

	public FakeBackend(DatabaseId databaseId) {
		this.databaseId = databaseId;
	}

	// Transport

	@Override
	public synchronized Connection<ListenRequest> openWatchStream(CallCredentials credentials, StreamObserver<WatchResponse> observer) {
		credentialsSeen.add(credentials);
		WatchConnection connection = new WatchConnection(observer);
		if (online) {
			streamsOpened++;
			watchConnections.add(connection);
			observer.onOpen();
		} else {
			connection.closed = true;
			observer.onClose(Status.of(Code.UNAVAILABLE, "Backend is offline"));
		}
		return connection;
	}

	@Override
	public synchronized Connection<WriteRequest> openWriteStream(CallCredentials credentials, StreamObserver<WriteResponse> observer) {
		credentialsSeen.add(credentials);
		WriteConnection connection = new WriteConnection(observer);
		if (online) {
			streamsOpened++;
			writeConnections.add(connection);
			observer.onOpen();
		} else {
			connection.closed = true;
			observer.onClose(Status.of(Code.UNAVAILABLE, "Backend is offline"));
		}
		return connection;
	}

	// Test controls

	/**
	 * Closes every open stream with {@link Code#UNAVAILABLE}, and fails new ones the same way
	 * until {@link #goOnline()}.
	 */
	public synchronized void goOffline() {
		LOGGER.debug("Backend going offline");
		online = false;
		for (WatchConnection connection: new ArrayList<>(watchConnections)) {
			connection.fail(Status.of(Code.UNAVAILABLE, "Backend went offline"));
		}
		for (WriteConnection connection: new ArrayList<>(writeConnections)) {
			connection.fail(Status.of(Code.UNAVAILABLE, "Backend went offline"));
		}
	}

	public synchronized void goOnline() {
		LOGGER.debug("Backend going online");
		online = true;
	}

	/**
	 * Writes are received but not committed until {@link #releaseWrites()}.
	 */
	public synchronized void holdWrites() {
		writesHeld = true;
	}

	public synchronized void releaseWrites() {
		writesHeld = false;
		for (WriteConnection connection: new ArrayList<>(writeConnections)) {
			connection.commitHeldWrites();
		}
	}

	/**
	 * The next batch of mutations fails the write stream with the given code instead of committing.
	 */
	public synchronized void failNextWrite(Code code) {
		nextWriteError = code;
	}

	/**
	 * Commits mutations as another client would, notifying every watcher.
	 */
	public synchronized SnapshotVersion writeDirectly(Mutation... mutations) {
		SnapshotVersion version = nextVersion();
		for (Mutation mutation: mutations) {
			Document before = serverDocument(mutation.key());
			if (!mutation.precondition().isValidFor(before)) {
				throw new IllegalArgumentException("Precondition failed for " + mutation);
			}
			commit(mutation, before, version);
		}
		broadcastChanges(version);
		return version;
	}

	/**
	 * Removes documents without telling any watcher, as if the change happened while
	 * the client wasn't listening and its resume token is now stale.
	 */
	public synchronized void deleteSilently(DocumentKey... keys) {
		for (DocumentKey key: keys) {
			documents.remove(key);
		}
		for (WatchConnection connection: watchConnections) {
			for (WatchedTarget watched: connection.targets.values()) {
				for (DocumentKey key: keys) {
					watched.sentVersions.remove(key);
				}
			}
		}
	}

	/**
	 * @return the committed document, or a {@link Document#noDocument no-document} if there isn't one
	 */
	public synchronized Document serverDocument(DocumentKey key) {
		Document document = documents.get(key);
		return (document == null) ? Document.noDocument(key, SnapshotVersion.NONE) : document;
	}

	public synchronized List<ListenRequest> listenRequests() {
		return List.copyOf(listenRequests);
	}

	public synchronized List<WriteRequest> writeRequests() {
		return List.copyOf(writeRequests);
	}

	public synchronized List<CallCredentials> credentialsSeen() {
		return List.copyOf(credentialsSeen);
	}

	public synchronized int streamsOpened() {
		return streamsOpened;
	}

	/**
	 * @return the ids of the targets currently watched over any open stream
	 */
	public synchronized Set<Integer> activeTargetIds() {
		Set<Integer> result = new TreeSet<>();
		for (WatchConnection connection: watchConnections) {
			result.addAll(connection.targets.keySet());
		}
		return result;
	}

	// Internals

	private SnapshotVersion nextVersion() {
		clock += 1000;
		return SnapshotVersion.ofMicros(clock);
	}

	private String resumeToken() {
		return "v" + clock;
	}

	private MutationResult commit(Mutation mutation, Document before, SnapshotVersion version) {
		List<Object> transformResults = new ArrayList<>();
		for (FieldTransform transform: mutation.fieldTransforms()) {
			if (transform.operation() instanceof ServerTimestampOperation) {
				transformResults.add(version.timestamp());
			} else {
				transformResults.add(transform.operation().applyToLocalView(before.field(transform.fieldPath()), version.timestamp()));
			}
		}
		MutationResult result = new MutationResult(version, transformResults);
		Document after = mutation.applyToRemoteDocument(before, result);
		if (after.isFound()) {
			documents.put(mutation.key(), after.synced());
		} else if (after.isNoDocument()) {
			documents.remove(mutation.key());
		}
		return result;
	}

	private void broadcastChanges(SnapshotVersion version) {
		for (WatchConnection connection: watchConnections) {
			connection.sendChanges(version);
		}
	}

	private List<Document> results(Target target) {
		Query query = new Query(target.path(), target.collectionGroup(), target.filters(), target.orderBy(), target.limit(), Query.LimitType.LIMIT_TO_FIRST);
		List<Document> matching = documents.values().stream()
			.filter(query::matches)
			.sorted(query.comparator())
			.collect(toList());
		if (target.hasLimit() && matching.size() > target.limit()) {
			return matching.subList(0, (int) target.limit());
		}
		return matching;
	}

	private static final class WatchedTarget {
		final Target target;

		/**
		 * The version of each document the client has been sent for this target.
		 */
		final Map<DocumentKey, SnapshotVersion> sentVersions = new HashMap<>();

		WatchedTarget(Target target) {
			this.target = target;
		}
	}

	private final class WatchConnection implements Connection<ListenRequest> {
		final StreamObserver<WatchResponse> observer;
		final Map<Integer, WatchedTarget> targets = new LinkedHashMap<>();
		boolean closed = false;

		WatchConnection(StreamObserver<WatchResponse> observer) {
			this.observer = observer;
		}

		@Override
		public void send(ListenRequest request) {
			synchronized (FakeBackend.this) {
				if (closed) {
					return;
				}
				listenRequests.add(request);
				if (request.isAddTarget()) {
					addTarget(request);
				} else {
					targets.remove(request.removeTargetId());
					observer.onMessage(new WatchResponse(new WatchTargetChange(WatchTargetChangeType.REMOVED, List.of(request.removeTargetId()))));
				}
			}
		}

		@Override
		public void halfClose() {
			synchronized (FakeBackend.this) {
				closed = true;
				watchConnections.remove(this);
			}
		}

		void fail(Status status) {
			closed = true;
			watchConnections.remove(this);
			observer.onClose(status);
		}

		private void addTarget(ListenRequest request) {
			int targetId = request.addTarget().targetId();
			WatchedTarget watched = new WatchedTarget(request.addTarget().target());
			targets.put(targetId, watched);
			observer.onMessage(new WatchResponse(new WatchTargetChange(WatchTargetChangeType.ADDED, List.of(targetId))));

			List<Document> results = results(watched.target);
			for (Document document: results) {
				watched.sentVersions.put(document.key(), document.version());
				observer.onMessage(new WatchResponse(new DocumentChange(List.of(targetId), List.of(), document.key(), document)));
			}
			observer.onMessage(new WatchResponse(new ExistenceFilterWatchChange(targetId, existenceFilter(results))));
			observer.onMessage(new WatchResponse(new WatchTargetChange(WatchTargetChangeType.CURRENT, List.of(targetId), resumeToken())));
			sendGlobalSnapshot(SnapshotVersion.ofMicros(Math.max(clock, 1)));
		}

		private ExistenceFilter existenceFilter(List<Document> results) {
			List<String> names = results.stream()
				.map(document -> databaseId.documentName(document.key()))
				.collect(toList());
			try {
				return new ExistenceFilter(results.size(), BloomFilter.encode(names, Math.max(8, names.size() * 16), 7));
			} catch (BloomFilterException e) {
				throw new IllegalStateException("Unable to encode bloom filter for " + names.size() + " names", e);
			}
		}

		void sendChanges(SnapshotVersion version) {
			if (closed) {
				return;
			}
			boolean sentAny = false;
			for (Map.Entry<Integer, WatchedTarget> entry: targets.entrySet()) {
				int targetId = entry.getKey();
				WatchedTarget watched = entry.getValue();
				Map<DocumentKey, Document> current = new LinkedHashMap<>();
				for (Document document: results(watched.target)) {
					current.put(document.key(), document);
				}
				for (Document document: current.values()) {
					SnapshotVersion sent = watched.sentVersions.get(document.key());
					if (!document.version().equals(sent)) {
						watched.sentVersions.put(document.key(), document.version());
						observer.onMessage(new WatchResponse(new DocumentChange(List.of(targetId), List.of(), document.key(), document)));
						sentAny = true;
					}
				}
				for (DocumentKey key: new ArrayList<>(watched.sentVersions.keySet())) {
					if (!current.containsKey(key)) {
						watched.sentVersions.remove(key);
						Document newDocument = documents.containsKey(key) ? null : Document.noDocument(key, version);
						observer.onMessage(new WatchResponse(new DocumentChange(List.of(), List.of(targetId), key, newDocument)));
						sentAny = true;
					}
				}
			}
			if (sentAny) {
				sendGlobalSnapshot(version);
			}
		}

		private void sendGlobalSnapshot(SnapshotVersion version) {
			observer.onMessage(new WatchResponse(new WatchTargetChange(WatchTargetChangeType.NO_CHANGE, List.of(), resumeToken()), version));
		}
	}

	private final class WriteConnection implements Connection<WriteRequest> {
		final StreamObserver<WriteResponse> observer;
		final List<WriteRequest> held = new ArrayList<>();
		boolean closed = false;
		int responses = 0;

		WriteConnection(StreamObserver<WriteResponse> observer) {
			this.observer = observer;
		}

		@Override
		public void send(WriteRequest request) {
			synchronized (FakeBackend.this) {
				if (closed) {
					return;
				}
				writeRequests.add(request);
				if (request.handshakeRequest()) {
					observer.onMessage(new WriteResponse(streamToken(), SnapshotVersion.NONE, List.of()));
				} else if (request.mutations().isEmpty()) {
					LOGGER.trace("Ignoring empty write request");
				} else if (writesHeld) {
					held.add(request);
				} else {
					commitWrite(request);
				}
			}
		}

		@Override
		public void halfClose() {
			synchronized (FakeBackend.this) {
				closed = true;
				held.clear();
				writeConnections.remove(this);
			}
		}

		void fail(Status status) {
			closed = true;
			held.clear();
			writeConnections.remove(this);
			observer.onClose(status);
		}

		void commitHeldWrites() {
			List<WriteRequest> toCommit = new ArrayList<>(held);
			held.clear();
			for (WriteRequest request: toCommit) {
				if (!closed) {
					commitWrite(request);
				}
			}
		}

		private void commitWrite(WriteRequest request) {
			if (nextWriteError != null) {
				Code code = nextWriteError;
				nextWriteError = null;
				fail(Status.of(code, "Write rejected by test"));
				return;
			}
			for (Mutation mutation: request.mutations()) {
				if (!mutation.precondition().isValidFor(serverDocument(mutation.key()))) {
					fail(Status.of(Code.FAILED_PRECONDITION, "Precondition failed for " + mutation.key()));
					return;
				}
			}
			SnapshotVersion version = nextVersion();
			List<MutationResult> results = new ArrayList<>();
			for (Mutation mutation: request.mutations()) {
				results.add(commit(mutation, serverDocument(mutation.key()), version));
			}
			LOGGER.debug("Committed {} mutations at {}", results.size(), version);
			observer.onMessage(new WriteResponse(streamToken(), version, results));
			broadcastChanges(version);
		}

		private String streamToken() {
			return "s" + (++responses);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FakeBackend.class);
}

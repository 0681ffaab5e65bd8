package io.vena.drift.remote;

import io.vena.drift.auth.EmptyAttestationProvider;
import io.vena.drift.auth.EmptyCredentialsProvider;
import io.vena.drift.exceptions.DriftException.Code;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.model.mutation.DeleteMutation;
import io.vena.drift.model.mutation.Mutation;
import io.vena.drift.model.mutation.MutationResult;
import io.vena.drift.model.mutation.Precondition;
import io.vena.drift.util.AsyncQueue;
import io.vena.drift.util.AsyncQueue.TimerId;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Drives a {@link WriteStream} directly against a transport whose server side is played by the test.
 */
class WriteStreamTest {
	static final Duration LONG = Duration.ofHours(1);

	final Mutation mutation = new DeleteMutation(DocumentKey.of("coll", "a"), Precondition.NONE);
	final List<String> events = new CopyOnWriteArrayList<>();
	final RecordingTransport transport = new RecordingTransport();

	AsyncQueue queue;
	WriteStream stream;

	@BeforeEach
	void setup() {
		queue = new AsyncQueue("write-stream-test");
		RemoteStore.Params params = new RemoteStore.Params(LONG, 1.5, LONG.multipliedBy(2), LONG, LONG, 10);
		stream = new WriteStream(transport, queue, new EmptyCredentialsProvider(), new EmptyAttestationProvider(), params, new WriteStream.Callback() {
			@Override
			public void onOpen() {
				events.add("open");
			}

			@Override
			public void onClose(Status status) {
				events.add("close " + status.code());
			}

			@Override
			public void onHandshakeComplete() {
				events.add("handshake");
			}

			@Override
			public void onWriteResponse(SnapshotVersion commitVersion, List<MutationResult> mutationResults) {
				events.add("results " + mutationResults.size());
			}
		});
	}

	@AfterEach
	void teardown() {
		queue.shutdown(() -> { }).join();
	}

	@Test
	void startedStream_opensWriteConnectionThroughTransport() {
		startStream();
		assertEquals(1, transport.opened.size());
		assertFalse(onWorker(stream::isOpen));

		transport.latest().observer.onOpen();
		assertTrue(onWorker(stream::isOpen));
		assertThat(events, contains("open"));
	}

	@Test
	void streamTokenIsThreadedThroughEveryRequest() {
		RecordingConnection connection = openAndHandshake("token-1");

		onWorker(() -> stream.writeMutations(List.of(mutation)));
		WriteRequest write = connection.sent.get(1);
		assertFalse(write.handshakeRequest());
		assertEquals("token-1", write.streamToken());
		assertEquals(List.of(mutation), write.mutations());

		connection.observer.onMessage(new WriteResponse("token-2", SnapshotVersion.ofMicros(5), List.of(new MutationResult(SnapshotVersion.ofMicros(5), List.of()))));
		assertEquals("token-2", onWorker(stream::lastStreamToken));
		onWorker(() -> stream.writeMutations(List.of(mutation)));
		assertEquals("token-2", connection.sent.get(2).streamToken());
		assertThat(events, contains("open", "handshake", "results 1"));
	}

	@Test
	void idleStream_closesCleanlyAfterAcknowledgingLastResponse() {
		RecordingConnection connection = openAndHandshake("token-1");

		onWorker(stream::markIdle);
		queue.runDelayedTasksUntil(TimerId.WRITE_STREAM_IDLE).join();

		assertFalse(onWorker(stream::isStarted));
		assertTrue(connection.halfClosed);
		WriteRequest last = connection.sent.get(connection.sent.size() - 1);
		assertEquals("token-1", last.streamToken());
		assertTrue(last.mutations().isEmpty());
		assertThat(events, contains("open", "handshake", "close OK"));
	}

	@Test
	void requestCancelsIdleTimer() {
		openAndHandshake("token-1");

		onWorker(stream::markIdle);
		assertTrue(queue.containsDelayedTask(TimerId.WRITE_STREAM_IDLE));
		onWorker(() -> stream.writeMutations(List.of(mutation)));
		assertFalse(queue.containsDelayedTask(TimerId.WRITE_STREAM_IDLE));
	}

	@Test
	void callbacksFromClosedConnection_areDropped() {
		RecordingConnection first = openAndHandshake("token-1");
		first.observer.onClose(Status.of(Code.UNAVAILABLE));
		assertFalse(onWorker(stream::isStarted));

		first.observer.onMessage(new WriteResponse("stale", SnapshotVersion.ofMicros(9), List.of()));
		first.observer.onOpen();
		assertEquals("token-1", onWorker(stream::lastStreamToken));
		assertThat(events, contains("open", "handshake", "close UNAVAILABLE"));
	}

	@Test
	void restartAfterError_waitsForBackoff() {
		startStream();
		transport.latest().observer.onClose(Status.of(Code.RESOURCE_EXHAUSTED));
		assertFalse(onWorker(stream::isStarted));
		assertThat(events, contains("close RESOURCE_EXHAUSTED"));

		onWorker(stream::start);
		assertTrue(onWorker(stream::isStarted));
		assertEquals(1, transport.opened.size(), "No reconnect until the backoff delay passes");
		assertTrue(queue.containsDelayedTask(TimerId.WRITE_STREAM_CONNECTION_BACKOFF));

		queue.runDelayedTasksUntil(TimerId.WRITE_STREAM_CONNECTION_BACKOFF).join();
		onWorker(() -> { });
		assertEquals(2, transport.opened.size());
	}

	@Test
	void stopDuringBackoff_cancelsReconnect() {
		startStream();
		transport.latest().observer.onClose(Status.of(Code.RESOURCE_EXHAUSTED));
		onWorker(stream::start);
		assertTrue(queue.containsDelayedTask(TimerId.WRITE_STREAM_CONNECTION_BACKOFF));

		onWorker(stream::stop);
		assertFalse(queue.containsDelayedTask(TimerId.WRITE_STREAM_CONNECTION_BACKOFF));
		assertEquals(1, transport.opened.size());
	}

	private RecordingConnection openAndHandshake(String streamToken) {
		startStream();
		RecordingConnection connection = transport.latest();
		connection.observer.onOpen();
		onWorker(stream::writeHandshake);
		assertTrue(connection.sent.get(0).handshakeRequest());
		connection.observer.onMessage(new WriteResponse(streamToken, SnapshotVersion.NONE, List.of()));
		assertTrue(onWorker(stream::isHandshakeComplete));
		return connection;
	}

	/**
	 * The connection is opened by a task that {@link WriteStream#start()} enqueues, so we wait for that too.
	 */
	private void startStream() {
		onWorker(stream::start);
		onWorker(() -> { });
	}

	private void onWorker(Runnable task) {
		queue.enqueue(task).join();
	}

	private <T> T onWorker(Callable<T> task) {
		return queue.enqueue(task).join();
	}

	static final class RecordingTransport implements Transport {
		final List<RecordingConnection> opened = new CopyOnWriteArrayList<>();

		@Override
		public Connection<ListenRequest> openWatchStream(CallCredentials credentials, StreamObserver<WatchResponse> observer) {
			throw new AssertionError("Write stream opened a watch connection");
		}

		@Override
		public Connection<WriteRequest> openWriteStream(CallCredentials credentials, StreamObserver<WriteResponse> observer) {
			RecordingConnection result = new RecordingConnection(observer);
			opened.add(result);
			return result;
		}

		RecordingConnection latest() {
			return opened.get(opened.size() - 1);
		}
	}

	static final class RecordingConnection implements Connection<WriteRequest> {
		final StreamObserver<WriteResponse> observer;
		final List<WriteRequest> sent = new CopyOnWriteArrayList<>();
		volatile boolean halfClosed = false;

		RecordingConnection(StreamObserver<WriteResponse> observer) {
			this.observer = observer;
		}

		@Override
		public void send(WriteRequest request) {
			sent.add(request);
		}

		@Override
		public void halfClose() {
			halfClosed = true;
		}
	}
}

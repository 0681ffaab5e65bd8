package io.vena.drift.remote;

import io.vena.drift.auth.CredentialsProvider;
import io.vena.drift.exceptions.DriftException.Code;
import io.vena.drift.model.User;
import io.vena.drift.util.AsyncQueue;
import io.vena.drift.util.AsyncQueue.DelayedTask;
import io.vena.drift.util.AsyncQueue.TimerId;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A restartable stream to the server, with authentication, exponential backoff and idle timeout.
 *
 * <p>
 * States run {@code INITIAL -> AUTH -> OPEN}, and back to {@code INITIAL} when stopped.
 * A server-side failure moves to {@code ERROR}, from which the next {@link #start()}
 * waits out the backoff delay in {@code BACKOFF} before reconnecting.
 *
 * <p>
 * Every method must be called on the worker queue. Each close increments a generation counter,
 * and callbacks from an earlier generation are dropped, so a listener never hears from a stream
 * after its {@link StreamCallback#onClose}.
 *
 * @param <Req> request message type
 * @param <Resp> response message type
 * @param <L> listener type
 */
public abstract class AbstractStream<Req, Resp, L extends AbstractStream.StreamCallback> {
	public interface StreamCallback {
		void onOpen();

		/**
		 * Called when the stream closes for any reason, including {@link #stop()}.
		 */
		void onClose(Status status);
	}

	enum State {
		INITIAL,
		/** Fetching tokens and connecting. */
		AUTH,
		OPEN,
		/** Failed; {@link #start()} will back off before reconnecting. */
		ERROR,
		BACKOFF,
	}

	protected final Transport transport;
	protected final AsyncQueue workerQueue;
	protected final L listener;
	private final CredentialsProvider<User> authProvider;
	private final CredentialsProvider<String> attestationProvider;
	private final TimerId idleTimerId;
	private final Duration idleTimeout;
	private final ExponentialBackoff backoff;
	private final String name;

	private State state = State.INITIAL;
	private long closeCount = 0;
	private @Nullable Connection<Req> connection;
	private @Nullable DelayedTask idleTimer;

	AbstractStream(
		String name,
		Transport transport,
		AsyncQueue workerQueue,
		CredentialsProvider<User> authProvider,
		CredentialsProvider<String> attestationProvider,
		RemoteStore.Params params,
		TimerId backoffTimerId,
		TimerId idleTimerId,
		L listener
	) {
		this.name = name;
		this.transport = transport;
		this.workerQueue = workerQueue;
		this.authProvider = authProvider;
		this.attestationProvider = attestationProvider;
		this.idleTimerId = idleTimerId;
		this.listener = listener;
		this.idleTimeout = params.streamIdleTimeout();
		this.backoff = new ExponentialBackoff(workerQueue, backoffTimerId,
			params.initialBackoffDelay(), params.backoffFactor(), params.maxBackoffDelay(), new Random());
	}

	/**
	 * True from {@link #start()} until the stream closes, including while connecting or backing off.
	 */
	public boolean isStarted() {
		return state == State.AUTH || state == State.BACKOFF || isOpen();
	}

	public boolean isOpen() {
		return state == State.OPEN;
	}

	/**
	 * Starts connecting. After an error, the connection attempt waits for the backoff delay.
	 */
	public void start() {
		workerQueue.verifyIsCurrentThread();
		if (connection != null || idleTimer != null) {
			throw new AssertionError("Stream " + name + " was not cleaned up after its last close");
		}
		if (state == State.ERROR) {
			performBackoff();
			return;
		}
		if (state != State.INITIAL) {
			throw new AssertionError("Stream " + name + " already started");
		}

		state = State.AUTH;
		long generation = closeCount;
		CompletableFuture<String> authToken = authProvider.getToken();
		CompletableFuture<String> attestationToken = attestationProvider.getToken();
		CompletableFuture.allOf(authToken, attestationToken).whenComplete((ignored, error) ->
			workerQueue.enqueueAndForget(() -> {
				if (generation != closeCount) {
					LOGGER.debug("({}) Ignoring credentials for a stream that has since closed", name);
					return;
				}
				if (error != null) {
					Throwable cause = (error instanceof CompletionException && error.getCause() != null) ? error.getCause() : error;
					LOGGER.warn("({}) Unable to fetch credentials", name, cause);
					handleServerClose(Status.fromThrowable(cause));
					return;
				}
				CallCredentials credentials = new CallCredentials(authToken.join(), attestationToken.join());
				LOGGER.debug("({}) Opening stream", name);
				connection = openConnection(credentials, new GuardedObserver(generation));
			}));
	}

	/**
	 * Closes the stream cleanly. Does nothing if it isn't started.
	 */
	public void stop() {
		if (isStarted()) {
			close(State.INITIAL, Status.OK);
		}
	}

	/**
	 * Skips the backoff delay on the next {@link #start()}, as when the user re-enables the network.
	 * The stream must be stopped.
	 */
	public void inhibitBackoff() {
		if (isStarted()) {
			throw new AssertionError("Can only inhibit backoff on a stopped stream");
		}
		state = State.INITIAL;
		backoff.reset();
	}

	/**
	 * Closes the stream after a period of inactivity, unless a request is sent first.
	 */
	public void markIdle() {
		if (isOpen() && idleTimer == null) {
			idleTimer = workerQueue.enqueueAfterDelay(idleTimerId, idleTimeout, this::handleIdleCloseTimer);
		}
	}

	protected void writeRequest(Req request) {
		workerQueue.verifyIsCurrentThread();
		LOGGER.trace("({}) Stream sending: {}", name, request);
		cancelIdleCheck();
		if (connection == null) {
			throw new AssertionError("Stream " + name + " has no connection");
		}
		connection.send(request);
	}

	protected abstract Connection<Req> openConnection(CallCredentials credentials, StreamObserver<Resp> observer);

	/**
	 * Handles a message from the current generation of the stream.
	 */
	protected abstract void onNext(Resp response);

	/**
	 * Last chance to send a message before a clean close.
	 */
	protected void tearDown() {
	}

	/**
	 * A successful message from the server means the connection is healthy.
	 */
	protected void resetBackoff() {
		backoff.reset();
	}

	private void handleIdleCloseTimer() {
		idleTimer = null;
		if (isOpen()) {
			LOGGER.debug("({}) Closing idle stream", name);
			close(State.INITIAL, Status.OK);
		}
	}

	private void cancelIdleCheck() {
		if (idleTimer != null) {
			idleTimer.cancel();
			idleTimer = null;
		}
	}

	private void handleServerClose(Status status) {
		if (!isStarted()) {
			throw new AssertionError("Can't handle server close on non-started stream " + name);
		}
		close(State.ERROR, status);
	}

	private void close(State finalState, Status status) {
		workerQueue.verifyIsCurrentThread();
		if (!isStarted()) {
			throw new AssertionError("Only started streams should be closed");
		}
		if (finalState != State.ERROR && !status.isOk()) {
			throw new AssertionError("Can't provide an error when not in an error state");
		}

		cancelIdleCheck();
		backoff.cancel();

		// Drops every callback still in flight for this generation
		closeCount++;

		Code code = status.code();
		if (code == Code.OK) {
			backoff.reset();
		} else if (code == Code.RESOURCE_EXHAUSTED) {
			LOGGER.debug("({}) Using maximum backoff delay to avoid overloading the server", name);
			backoff.resetToMax();
		} else if (code == Code.UNAUTHENTICATED) {
			LOGGER.debug("({}) Invalidating tokens after authentication failure", name);
			authProvider.invalidateToken();
			attestationProvider.invalidateToken();
		}

		if (finalState != State.ERROR) {
			LOGGER.debug("({}) Performing stream teardown", name);
			tearDown();
		}

		if (connection != null) {
			if (status.isOk()) {
				LOGGER.debug("({}) Closing stream client-side", name);
				connection.halfClose();
			}
			connection = null;
		}

		state = finalState;
		listener.onClose(status);
	}

	private void performBackoff() {
		if (state != State.ERROR) {
			throw new AssertionError("Should only perform backoff in an error state");
		}
		state = State.BACKOFF;
		backoff.backoffAndRun(() -> {
			if (state != State.BACKOFF) {
				throw new AssertionError("Backoff elapsed but state is now " + state);
			}
			state = State.INITIAL;
			start();
		});
	}

	/**
	 * Moves transport callbacks onto the worker queue, dropping them if the stream
	 * has closed since they were issued.
	 */
	private final class GuardedObserver implements StreamObserver<Resp> {
		private final long generation;

		GuardedObserver(long generation) {
			this.generation = generation;
		}

		@Override
		public void onOpen() {
			runGuarded(() -> {
				LOGGER.debug("({}) Stream is open", name);
				state = State.OPEN;
				listener.onOpen();
			});
		}

		@Override
		public void onMessage(Resp response) {
			runGuarded(() -> {
				LOGGER.trace("({}) Stream received: {}", name, response);
				onNext(response);
			});
		}

		@Override
		public void onClose(Status status) {
			runGuarded(() -> {
				if (status.isOk()) {
					// Unrequested, so retried like a failure
					LOGGER.debug("({}) Stream closed by server", name);
					handleServerClose(Status.of(Code.UNAVAILABLE, "Stream closed by server"));
				} else {
					LOGGER.debug("({}) Stream closed with status: {}", name, status);
					handleServerClose(status);
				}
			});
		}

		private void runGuarded(Runnable task) {
			workerQueue.enqueueAndForget(() -> {
				if (generation == closeCount) {
					task.run();
				} else {
					LOGGER.trace("({}) Dropping callback from closed stream", name);
				}
			});
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AbstractStream.class);
}

package io.vena.drift.remote;

/**
 * Receives the server's side of a stream opened by a {@link Transport}.
 * Methods may be called on any thread, but never concurrently.
 *
 * @param <Resp> response message type
 */
public interface StreamObserver<Resp> {
	/**
	 * The stream is established and requests may be sent.
	 */
	void onOpen();

	void onMessage(Resp response);

	/**
	 * The stream has ended, normally or not. Called at most once, and nothing follows it.
	 */
	void onClose(Status status);
}

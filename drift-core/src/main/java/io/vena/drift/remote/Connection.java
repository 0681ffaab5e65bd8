package io.vena.drift.remote;

/**
 * The client's end of one open bidirectional stream.
 *
 * @param <Req> request message type
 */
public interface Connection<Req> {
	void send(Req request);

	/**
	 * Tells the server we're done sending. Nothing more will be delivered to the stream's
	 * {@link StreamObserver}.
	 */
	void halfClose();
}

package io.vena.drift.remote;

/**
 * Opens the two streams the client holds to the server. Implementations own the wire
 * format and the network; the client only ever sees model objects.
 *
 * <p>
 * Opening returns at once. Failure to connect is reported through {@link StreamObserver#onClose}.
 */
public interface Transport {
	Connection<ListenRequest> openWatchStream(CallCredentials credentials, StreamObserver<WatchResponse> observer);

	Connection<WriteRequest> openWriteStream(CallCredentials credentials, StreamObserver<WriteResponse> observer);
}

package io.vena.drift.remote;

import io.vena.drift.auth.CredentialsProvider;
import io.vena.drift.local.TargetData;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.model.User;
import io.vena.drift.util.AsyncQueue;
import io.vena.drift.util.AsyncQueue.TimerId;

/**
 * The stream on which we tell the server which targets to watch, and receive their changes.
 */
public class WatchStream extends AbstractStream<ListenRequest, WatchResponse, WatchStream.Callback> {
	public interface Callback extends AbstractStream.StreamCallback {
		void onWatchChange(SnapshotVersion snapshotVersion, WatchChange watchChange);
	}

	public WatchStream(Transport transport, AsyncQueue workerQueue, CredentialsProvider<User> authProvider, CredentialsProvider<String> attestationProvider, RemoteStore.Params params, Callback listener) {
		super("watch", transport, workerQueue, authProvider, attestationProvider, params,
			TimerId.LISTEN_STREAM_CONNECTION_BACKOFF, TimerId.LISTEN_STREAM_IDLE, listener);
	}

	/**
	 * Starts listening to a target. The stream must be open.
	 */
	public void watch(TargetData targetData) {
		if (!isOpen()) {
			throw new AssertionError("Watching queries requires an open stream");
		}
		writeRequest(ListenRequest.addTarget(targetData));
	}

	public void unwatch(int targetId) {
		if (!isOpen()) {
			throw new AssertionError("Unwatching targets requires an open stream");
		}
		writeRequest(ListenRequest.removeTarget(targetId));
	}

	@Override
	protected Connection<ListenRequest> openConnection(CallCredentials credentials, StreamObserver<WatchResponse> observer) {
		return transport.openWatchStream(credentials, observer);
	}

	@Override
	protected void onNext(WatchResponse response) {
		resetBackoff();
		listener.onWatchChange(response.snapshotVersion(), response.change());
	}
}

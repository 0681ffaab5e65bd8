package io.vena.drift.remote;

import io.vena.drift.auth.CredentialsProvider;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.model.User;
import io.vena.drift.model.mutation.Mutation;
import io.vena.drift.model.mutation.MutationResult;
import io.vena.drift.util.AsyncQueue;
import io.vena.drift.util.AsyncQueue.TimerId;
import java.util.List;

/**
 * The stream on which we send mutation batches and receive their results.
 *
 * <p>
 * Once open, the stream must be initialized with {@link #writeHandshake()}, whose response
 * carries the stream token. Every later request quotes the token from the previous response,
 * which is how the server knows which results we have already seen.
 */
public class WriteStream extends AbstractStream<WriteRequest, WriteResponse, WriteStream.Callback> {
	public static final String EMPTY_STREAM_TOKEN = "";

	public interface Callback extends AbstractStream.StreamCallback {
		void onHandshakeComplete();

		void onWriteResponse(SnapshotVersion commitVersion, List<MutationResult> mutationResults);
	}

	private boolean handshakeComplete = false;

	/**
	 * Set by the caller before the stream starts, and updated by every response.
	 */
	private String lastStreamToken = EMPTY_STREAM_TOKEN;

	public WriteStream(Transport transport, AsyncQueue workerQueue, CredentialsProvider<User> authProvider, CredentialsProvider<String> attestationProvider, RemoteStore.Params params, Callback listener) {
		super("write", transport, workerQueue, authProvider, attestationProvider, params,
			TimerId.WRITE_STREAM_CONNECTION_BACKOFF, TimerId.WRITE_STREAM_IDLE, listener);
	}

	@Override
	public void start() {
		handshakeComplete = false;
		super.start();
	}

	@Override
	protected void tearDown() {
		if (handshakeComplete) {
			// Acknowledges the last response so the server can forget it
			writeMutations(List.of());
		}
	}

	public boolean isHandshakeComplete() {
		return handshakeComplete;
	}

	public String lastStreamToken() {
		return lastStreamToken;
	}

	public void setLastStreamToken(String streamToken) {
		this.lastStreamToken = streamToken;
	}

	public void writeHandshake() {
		if (!isOpen()) {
			throw new AssertionError("Writing handshake requires an opened stream");
		}
		if (handshakeComplete) {
			throw new AssertionError("Handshake already completed");
		}
		writeRequest(WriteRequest.handshake());
	}

	public void writeMutations(List<Mutation> mutations) {
		if (!isOpen()) {
			throw new AssertionError("Writing mutations requires an opened stream");
		}
		if (!handshakeComplete) {
			throw new AssertionError("Handshake must be complete before writing mutations");
		}
		writeRequest(WriteRequest.write(lastStreamToken, mutations));
	}

	@Override
	protected Connection<WriteRequest> openConnection(CallCredentials credentials, StreamObserver<WriteResponse> observer) {
		return transport.openWriteStream(credentials, observer);
	}

	@Override
	protected void onNext(WriteResponse response) {
		lastStreamToken = response.streamToken();
		if (!handshakeComplete) {
			if (!response.results().isEmpty()) {
				throw new AssertionError("Got mutation results for handshake");
			}
			handshakeComplete = true;
			listener.onHandshakeComplete();
		} else {
			resetBackoff();
			listener.onWriteResponse(response.commitVersion(), response.results());
		}
	}
}

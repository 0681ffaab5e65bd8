package io.vena.drift.remote;

import io.vena.drift.auth.CredentialsProvider;
import io.vena.drift.core.OnlineState;
import io.vena.drift.local.LocalStore;
import io.vena.drift.local.QueryPurpose;
import io.vena.drift.local.TargetData;
import io.vena.drift.model.DatabaseId;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.model.User;
import io.vena.drift.model.mutation.MutationBatch;
import io.vena.drift.model.mutation.MutationBatchResult;
import io.vena.drift.model.mutation.MutationResult;
import io.vena.drift.remote.WatchChange.DocumentChange;
import io.vena.drift.remote.WatchChange.ExistenceFilterWatchChange;
import io.vena.drift.remote.WatchChange.WatchTargetChange;
import io.vena.drift.remote.WatchChange.WatchTargetChangeType;
import io.vena.drift.util.AsyncQueue;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Value;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the server in step with the client: listens to the targets the sync engine asks for,
 * and sends the mutation queue in order.
 *
 * <p>
 * Watch changes are aggregated until the server declares a consistent snapshot, and then
 * delivered to the {@link RemoteStoreCallback} as one {@link RemoteEvent}. Up to
 * {@link Params#maxPendingWrites()} batches are in flight on the write stream at once;
 * the server answers them in order.
 *
 * <p>
 * Everything here runs on the worker queue.
 */
public final class RemoteStore implements WatchChangeAggregator.TargetMetadataProvider {
	/**
	 * Timing and capacity of the streams.
	 */
	@Value
	public static class Params {
		public static final int DEFAULT_MAX_PENDING_WRITES = 10;
		public static final Duration DEFAULT_STREAM_IDLE_TIMEOUT = Duration.ofMinutes(1);
		public static final Duration DEFAULT_ONLINE_STATE_TIMEOUT = Duration.ofSeconds(10);

		Duration initialBackoffDelay;
		double backoffFactor;
		Duration maxBackoffDelay;

		/**
		 * A stream with nothing to do is closed after this long.
		 */
		Duration streamIdleTimeout;

		/**
		 * We declare ourselves offline if the watch stream delivers nothing for this long.
		 */
		Duration onlineStateTimeout;

		/**
		 * Batches in flight on the write stream at once.
		 */
		int maxPendingWrites;

		public static Params defaults() {
			return new Params(
				ExponentialBackoff.DEFAULT_INITIAL_DELAY,
				ExponentialBackoff.DEFAULT_BACKOFF_FACTOR,
				ExponentialBackoff.DEFAULT_MAX_DELAY,
				DEFAULT_STREAM_IDLE_TIMEOUT,
				DEFAULT_ONLINE_STATE_TIMEOUT,
				DEFAULT_MAX_PENDING_WRITES);
		}
	}

	/**
	 * What the remote store reports to the sync engine.
	 */
	public interface RemoteStoreCallback {
		void handleRemoteEvent(RemoteEvent remoteEvent);

		/**
		 * The server refused to listen to the target. It's no longer being listened to.
		 */
		void handleRejectedListen(int targetId, Status error);

		void handleSuccessfulWrite(MutationBatchResult successfulWrite);

		/**
		 * The server permanently rejected the batch. It won't be retried.
		 */
		void handleRejectedWrite(int batchId, Status error);

		void handleOnlineStateChange(OnlineState onlineState);

		/**
		 * The keys the server has said are in the target, as of the last remote event.
		 */
		Set<DocumentKey> getRemoteKeysForTarget(int targetId);
	}

	private final DatabaseId databaseId;
	private final LocalStore localStore;
	private final RemoteStoreCallback remoteStoreCallback;
	private final int maxPendingWrites;
	private final OnlineStateTracker onlineStateTracker;
	private final WatchStream watchStream;
	private final WriteStream writeStream;

	/**
	 * Targets we want to be listening to, whether or not the watch stream is open.
	 */
	private final Map<Integer, TargetData> listenTargets = new HashMap<>();

	/**
	 * Batches sent, or to be sent once the stream is ready, awaiting their results in order.
	 */
	private final Deque<MutationBatch> writePipeline = new ArrayDeque<>();

	private boolean networkEnabled = false;

	/**
	 * Null when the watch stream isn't started. Each stream generation gets a fresh one.
	 */
	private @Nullable WatchChangeAggregator watchChangeAggregator;

	public RemoteStore(
		DatabaseId databaseId,
		LocalStore localStore,
		Transport transport,
		AsyncQueue workerQueue,
		CredentialsProvider<User> authProvider,
		CredentialsProvider<String> attestationProvider,
		Params params,
		RemoteStoreCallback remoteStoreCallback
	) {
		this.databaseId = databaseId;
		this.localStore = localStore;
		this.remoteStoreCallback = remoteStoreCallback;
		this.maxPendingWrites = params.maxPendingWrites();
		this.onlineStateTracker = new OnlineStateTracker(workerQueue, params.onlineStateTimeout(), remoteStoreCallback::handleOnlineStateChange);

		this.watchStream = new WatchStream(transport, workerQueue, authProvider, attestationProvider, params, new WatchStream.Callback() {
			@Override
			public void onOpen() {
				handleWatchStreamOpen();
			}

			@Override
			public void onWatchChange(SnapshotVersion snapshotVersion, WatchChange watchChange) {
				handleWatchChange(snapshotVersion, watchChange);
			}

			@Override
			public void onClose(Status status) {
				handleWatchStreamClose(status);
			}
		});

		this.writeStream = new WriteStream(transport, workerQueue, authProvider, attestationProvider, params, new WriteStream.Callback() {
			@Override
			public void onOpen() {
				handleWriteStreamOpen();
			}

			@Override
			public void onHandshakeComplete() {
				handleWriteStreamHandshakeComplete();
			}

			@Override
			public void onWriteResponse(SnapshotVersion commitVersion, List<MutationResult> mutationResults) {
				handleWriteStreamMutationResults(commitVersion, mutationResults);
			}

			@Override
			public void onClose(Status status) {
				handleWriteStreamClose(status);
			}
		});
	}

	public void start() {
		enableNetwork();
	}

	/**
	 * Re-enables the network after {@link #disableNetwork()}. Does nothing if it's already enabled.
	 */
	public void enableNetwork() {
		networkEnabled = true;
		if (canUseNetwork()) {
			writeStream.setLastStreamToken(localStore.getLastStreamToken());
			if (shouldStartWatchStream()) {
				startWatchStream();
			} else {
				onlineStateTracker.updateState(OnlineState.UNKNOWN);
			}
			// Starts the write stream if there's anything to send
			fillWritePipeline();
		}
	}

	/**
	 * Closes both streams and reports {@link OnlineState#OFFLINE}, so listeners are served from cache.
	 * Listens and writes resume when the network is enabled.
	 */
	public void disableNetwork() {
		networkEnabled = false;
		disableNetworkInternal();
		onlineStateTracker.updateState(OnlineState.OFFLINE);
	}

	private void disableNetworkInternal() {
		watchStream.stop();
		writeStream.stop();
		if (!writePipeline.isEmpty()) {
			LOGGER.debug("Stopping write stream with {} pending writes", writePipeline.size());
			writePipeline.clear();
		}
		cleanUpWatchStreamState();
	}

	private void restartNetwork() {
		networkEnabled = false;
		disableNetworkInternal();
		onlineStateTracker.updateState(OnlineState.UNKNOWN);
		writeStream.inhibitBackoff();
		watchStream.inhibitBackoff();
		enableNetwork();
	}

	public void shutdown() {
		LOGGER.debug("Shutting down");
		networkEnabled = false;
		disableNetworkInternal();
		// UNKNOWN rather than OFFLINE avoids raising spurious events from cache
		onlineStateTracker.updateState(OnlineState.UNKNOWN);
	}

	/**
	 * Restarts the streams with fresh tokens and the new user's mutation queue,
	 * unless the network is disabled.
	 */
	public void handleCredentialChange() {
		if (canUseNetwork()) {
			LOGGER.debug("Restarting streams for new credentials");
			restartNetwork();
		}
	}

	public boolean canUseNetwork() {
		return networkEnabled;
	}

	public OnlineState onlineState() {
		return onlineStateTracker.state();
	}

	/**
	 * Starts listening to the target, or does nothing if we already are.
	 */
	public void listen(TargetData targetData) {
		int targetId = targetData.targetId();
		if (listenTargets.containsKey(targetId)) {
			return;
		}
		listenTargets.put(targetId, targetData);
		if (shouldStartWatchStream()) {
			startWatchStream();
		} else if (watchStream.isOpen()) {
			sendWatchRequest(targetData);
		}
	}

	public void stopListening(int targetId) {
		TargetData targetData = listenTargets.remove(targetId);
		if (targetData == null) {
			throw new AssertionError("stopListening called on target not currently watched: " + targetId);
		}

		if (watchStream.isOpen()) {
			sendUnwatchRequest(targetId);
		}

		if (listenTargets.isEmpty()) {
			if (watchStream.isOpen()) {
				watchStream.markIdle();
			} else if (canUseNetwork()) {
				// With nothing to listen to, nothing can show that the stream is healthy
				onlineStateTracker.updateState(OnlineState.UNKNOWN);
			}
		}
	}

	private void sendWatchRequest(TargetData targetData) {
		watchChangeAggregator().recordPendingTargetRequest(targetData.targetId());
		if (!targetData.resumeToken().isEmpty() || targetData.snapshotVersion().isAfter(SnapshotVersion.NONE)) {
			int expectedCount = getRemoteKeysForTarget(targetData.targetId()).size();
			targetData = targetData.withExpectedCount(expectedCount);
		}
		watchStream.watch(targetData);
	}

	private void sendUnwatchRequest(int targetId) {
		watchChangeAggregator().recordPendingTargetRequest(targetId);
		watchStream.unwatch(targetId);
	}

	private boolean shouldStartWatchStream() {
		return canUseNetwork() && !watchStream.isStarted() && !listenTargets.isEmpty();
	}

	private void cleanUpWatchStreamState() {
		watchChangeAggregator = null;
	}

	private void startWatchStream() {
		if (!shouldStartWatchStream()) {
			throw new AssertionError("startWatchStream called when shouldStartWatchStream is false");
		}
		watchChangeAggregator = new WatchChangeAggregator(this);
		watchStream.start();
		onlineStateTracker.handleWatchStreamStart();
	}

	private WatchChangeAggregator watchChangeAggregator() {
		if (watchChangeAggregator == null) {
			throw new AssertionError("Watch stream has no aggregator");
		}
		return watchChangeAggregator;
	}

	private void handleWatchStreamOpen() {
		// Restore any existing watches
		for (TargetData targetData: listenTargets.values()) {
			sendWatchRequest(targetData);
		}
	}

	private void handleWatchChange(SnapshotVersion snapshotVersion, WatchChange watchChange) {
		// Any message from the server means we're online
		onlineStateTracker.updateState(OnlineState.ONLINE);

		WatchChangeAggregator aggregator = watchChangeAggregator();
		if (watchChange instanceof WatchTargetChange
			&& ((WatchTargetChange) watchChange).changeType() == WatchTargetChangeType.REMOVED
			&& ((WatchTargetChange) watchChange).cause() != null) {
			// Errors are raised immediately, without waiting for a consistent snapshot
			processTargetError((WatchTargetChange) watchChange);
			return;
		}

		if (watchChange instanceof DocumentChange) {
			aggregator.handleDocumentChange((DocumentChange) watchChange);
		} else if (watchChange instanceof ExistenceFilterWatchChange) {
			aggregator.handleExistenceFilter((ExistenceFilterWatchChange) watchChange);
		} else if (watchChange instanceof WatchTargetChange) {
			aggregator.handleTargetChange((WatchTargetChange) watchChange);
		} else {
			throw new AssertionError("Unexpected watch change: " + watchChange.getClass().getSimpleName());
		}

		if (!snapshotVersion.isNone()) {
			SnapshotVersion lastRemoteSnapshotVersion = localStore.getLastRemoteSnapshotVersion();
			if (snapshotVersion.compareTo(lastRemoteSnapshotVersion) >= 0) {
				raiseWatchSnapshot(snapshotVersion);
			}
		}
	}

	private void handleWatchStreamClose(Status status) {
		if (status.isOk() && shouldStartWatchStream()) {
			throw new AssertionError("Watch stream was stopped gracefully while still needed");
		}

		cleanUpWatchStreamState();

		if (shouldStartWatchStream()) {
			onlineStateTracker.handleWatchStreamFailure(status);
			startWatchStream();
		} else {
			// Nothing is trying to connect, so we can't know
			onlineStateTracker.updateState(OnlineState.UNKNOWN);
		}
	}

	private void raiseWatchSnapshot(SnapshotVersion snapshotVersion) {
		if (snapshotVersion.isNone()) {
			throw new AssertionError("Can't raise event for unknown snapshot version");
		}
		RemoteEvent remoteEvent = watchChangeAggregator().createRemoteEvent(snapshotVersion);

		// The local store persists these when it applies the event
		for (Map.Entry<Integer, TargetChange> entry: remoteEvent.targetChanges().entrySet()) {
			TargetChange targetChange = entry.getValue();
			if (!targetChange.resumeToken().isEmpty()) {
				int targetId = entry.getKey();
				TargetData targetData = listenTargets.get(targetId);
				// A watched target might have been removed already
				if (targetData != null) {
					listenTargets.put(targetId, targetData.withResumeToken(targetChange.resumeToken(), snapshotVersion));
				}
			}
		}

		// Re-listen from scratch to targets whose existence filter didn't match
		for (Map.Entry<Integer, QueryPurpose> entry: remoteEvent.targetMismatches().entrySet()) {
			int targetId = entry.getKey();
			TargetData targetData = listenTargets.get(targetId);
			if (targetData != null) {
				listenTargets.put(targetId, targetData.withResumeToken("", targetData.snapshotVersion()));
				sendUnwatchRequest(targetId);
				// Only this request carries the mismatch purpose; later re-listens are ordinary
				TargetData requestTargetData = new TargetData(targetData.target(), targetId, targetData.sequenceNumber(), entry.getValue());
				sendWatchRequest(requestTargetData);
			}
		}

		remoteStoreCallback.handleRemoteEvent(remoteEvent);
	}

	private void processTargetError(WatchTargetChange targetChange) {
		Status cause = targetChange.cause();
		if (cause == null) {
			throw new AssertionError("Processing target error without a cause");
		}
		for (Integer targetId: targetChange.targetIds()) {
			// Ignore targets that have been removed already
			if (listenTargets.containsKey(targetId)) {
				LOGGER.debug("Target {} rejected: {}", targetId, cause);
				listenTargets.remove(targetId);
				watchChangeAggregator().removeTarget(targetId);
				remoteStoreCallback.handleRejectedListen(targetId, cause);
			}
		}
	}

	/**
	 * Tops up the write pipeline from the mutation queue, and starts the write stream if needed.
	 */
	public void fillWritePipeline() {
		int lastBatchIdRetrieved = writePipeline.isEmpty() ? MutationBatch.UNKNOWN : writePipeline.getLast().batchId();
		while (canAddToWritePipeline()) {
			MutationBatch batch = localStore.getNextMutationBatch(lastBatchIdRetrieved);
			if (batch == null) {
				if (writePipeline.isEmpty()) {
					writeStream.markIdle();
				}
				break;
			}
			addToWritePipeline(batch);
			lastBatchIdRetrieved = batch.batchId();
		}

		if (shouldStartWriteStream()) {
			startWriteStream();
		}
	}

	private boolean canAddToWritePipeline() {
		return canUseNetwork() && writePipeline.size() < maxPendingWrites;
	}

	private void addToWritePipeline(MutationBatch mutationBatch) {
		if (!canAddToWritePipeline()) {
			throw new AssertionError("addToWritePipeline called when pipeline is full");
		}
		writePipeline.add(mutationBatch);
		if (writeStream.isOpen() && writeStream.isHandshakeComplete()) {
			writeStream.writeMutations(mutationBatch.mutations());
		}
	}

	private boolean shouldStartWriteStream() {
		return canUseNetwork() && !writeStream.isStarted() && !writePipeline.isEmpty();
	}

	private void startWriteStream() {
		if (!shouldStartWriteStream()) {
			throw new AssertionError("startWriteStream called when shouldStartWriteStream is false");
		}
		writeStream.start();
	}

	private void handleWriteStreamOpen() {
		writeStream.writeHandshake();
	}

	private void handleWriteStreamHandshakeComplete() {
		localStore.setLastStreamToken(writeStream.lastStreamToken());
		for (MutationBatch batch: writePipeline) {
			writeStream.writeMutations(batch.mutations());
		}
	}

	/**
	 * Results arrive in the order the batches were sent.
	 */
	private void handleWriteStreamMutationResults(SnapshotVersion commitVersion, List<MutationResult> results) {
		MutationBatch batch = writePipeline.poll();
		if (batch == null) {
			throw new AssertionError("Got write results with an empty write pipeline");
		}
		MutationBatchResult mutationBatchResult = MutationBatchResult.create(batch, commitVersion, results, writeStream.lastStreamToken());
		remoteStoreCallback.handleSuccessfulWrite(mutationBatchResult);
		fillWritePipeline();
	}

	private void handleWriteStreamClose(Status status) {
		if (status.isOk() && shouldStartWriteStream()) {
			throw new AssertionError("Write stream was stopped gracefully while still needed");
		}

		if (!status.isOk() && !writePipeline.isEmpty()) {
			if (writeStream.isHandshakeComplete()) {
				handleWriteError(status);
			} else {
				// Perhaps the server can't accept our stream token
				handleWriteHandshakeError(status);
			}
		}

		// Rejecting a batch may have refilled the pipeline
		if (shouldStartWriteStream()) {
			startWriteStream();
		}
	}

	private void handleWriteHandshakeError(Status status) {
		if (status.isPermanentError()) {
			LOGGER.debug("Write stream error before completed handshake; resetting stream token {}: {}", writeStream.lastStreamToken(), status);
			writeStream.setLastStreamToken(WriteStream.EMPTY_STREAM_TOKEN);
			localStore.setLastStreamToken(WriteStream.EMPTY_STREAM_TOKEN);
		}
	}

	/**
	 * A permanent error means the first batch itself is bad, so it's rejected. Otherwise the
	 * stream restarts after backoff and resends the pipeline.
	 */
	private void handleWriteError(Status status) {
		if (status.isPermanentWriteError()) {
			MutationBatch batch = writePipeline.poll();
			if (batch == null) {
				throw new AssertionError("Write error with an empty write pipeline");
			}
			// The request was bad, not the server, so there's no reason to back off
			writeStream.inhibitBackoff();
			LOGGER.debug("Batch {} rejected: {}", batch.batchId(), status);
			remoteStoreCallback.handleRejectedWrite(batch.batchId(), status);
			fillWritePipeline();
		}
	}

	@Override
	public Set<DocumentKey> getRemoteKeysForTarget(int targetId) {
		return remoteStoreCallback.getRemoteKeysForTarget(targetId);
	}

	@Override
	public @Nullable TargetData getTargetDataForTarget(int targetId) {
		return listenTargets.get(targetId);
	}

	@Override
	public DatabaseId getDatabaseId() {
		return databaseId;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RemoteStore.class);
}

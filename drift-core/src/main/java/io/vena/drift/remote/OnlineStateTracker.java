package io.vena.drift.remote;

import io.vena.drift.core.OnlineState;
import io.vena.drift.util.AsyncQueue;
import io.vena.drift.util.AsyncQueue.DelayedTask;
import io.vena.drift.util.AsyncQueue.TimerId;
import java.time.Duration;
import java.util.function.Consumer;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides the {@link OnlineState} from the health of the watch stream.
 *
 * <p>
 * We start {@link OnlineState#UNKNOWN} and go {@link OnlineState#ONLINE} as soon as the watch
 * stream delivers a message. We go {@link OnlineState#OFFLINE} if the stream fails before
 * delivering anything, or if it doesn't deliver anything before the timeout, so that listeners
 * see cached results instead of waiting indefinitely.
 */
class OnlineStateTracker {
	static final int MAX_WATCH_STREAM_FAILURES = 1;

	private final AsyncQueue workerQueue;
	private final Duration onlineStateTimeout;
	private final Consumer<OnlineState> onlineStateCallback;

	private OnlineState state = OnlineState.UNKNOWN;

	/**
	 * Consecutive watch stream failures since the last time we were online.
	 */
	private int watchStreamFailures = 0;

	private @Nullable DelayedTask onlineStateTimer;

	/**
	 * Only the first offline transition is worth a warning.
	 */
	private boolean shouldWarnClientIsOffline = true;

	OnlineStateTracker(AsyncQueue workerQueue, Duration onlineStateTimeout, Consumer<OnlineState> onlineStateCallback) {
		this.workerQueue = workerQueue;
		this.onlineStateTimeout = onlineStateTimeout;
		this.onlineStateCallback = onlineStateCallback;
	}

	OnlineState state() {
		return state;
	}

	/**
	 * Called on every attempt to start the watch stream. The first attempt starts the timeout.
	 */
	void handleWatchStreamStart() {
		if (watchStreamFailures == 0) {
			setAndBroadcastState(OnlineState.UNKNOWN);
			if (onlineStateTimer != null) {
				throw new AssertionError("Online state timer shouldn't be started yet");
			}
			onlineStateTimer = workerQueue.enqueueAfterDelay(TimerId.ONLINE_STATE_TIMEOUT, onlineStateTimeout, () -> {
				onlineStateTimer = null;
				if (state != OnlineState.UNKNOWN) {
					throw new AssertionError("Online state timer should be cancelled on leaving UNKNOWN");
				}
				logClientOfflineWarningIfNecessary("Server didn't respond within " + onlineStateTimeout.toSeconds() + " seconds");
				setAndBroadcastState(OnlineState.OFFLINE);
			});
		}
	}

	/**
	 * Called when the watch stream fails while it's still needed.
	 */
	void handleWatchStreamFailure(Status status) {
		if (state == OnlineState.ONLINE) {
			// Having been online, give the reconnection a chance before declaring ourselves offline
			setAndBroadcastState(OnlineState.UNKNOWN);
			if (watchStreamFailures != 0 || onlineStateTimer != null) {
				throw new AssertionError("Failure tracking should have been reset on going online");
			}
		} else {
			watchStreamFailures++;
			if (watchStreamFailures >= MAX_WATCH_STREAM_FAILURES) {
				clearOnlineStateTimer();
				logClientOfflineWarningIfNecessary("Connection failed " + MAX_WATCH_STREAM_FAILURES + " times. Most recent error: " + status);
				setAndBroadcastState(OnlineState.OFFLINE);
			}
		}
	}

	/**
	 * Sets the state explicitly, as when the watch stream delivers a message or the network is disabled,
	 * and resets the failure tracking.
	 */
	void updateState(OnlineState newState) {
		clearOnlineStateTimer();
		watchStreamFailures = 0;
		if (newState == OnlineState.ONLINE) {
			shouldWarnClientIsOffline = false;
		}
		setAndBroadcastState(newState);
	}

	private void setAndBroadcastState(OnlineState newState) {
		if (newState != state) {
			LOGGER.debug("Online state: {} -> {}", state, newState);
			state = newState;
			onlineStateCallback.accept(newState);
		}
	}

	private void logClientOfflineWarningIfNecessary(String reason) {
		if (shouldWarnClientIsOffline) {
			LOGGER.warn("Could not reach the server. {}. The client will operate offline until it connects", reason);
			shouldWarnClientIsOffline = false;
		} else {
			LOGGER.debug("Could not reach the server. {}", reason);
		}
	}

	private void clearOnlineStateTimer() {
		if (onlineStateTimer != null) {
			onlineStateTimer.cancel();
			onlineStateTimer = null;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(OnlineStateTracker.class);
}

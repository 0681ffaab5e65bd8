package io.vena.drift.remote;

import io.vena.drift.util.AsyncQueue;
import io.vena.drift.util.AsyncQueue.DelayedTask;
import io.vena.drift.util.AsyncQueue.TimerId;
import java.time.Duration;
import java.util.Random;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schedules retries on the worker queue with exponentially growing, jittered delays.
 *
 * <p>
 * The first attempt after construction or {@link #reset()} runs immediately.
 * Each later attempt waits the base delay, randomly adjusted by up to half in either direction;
 * the base grows by the backoff factor each time, up to the maximum.
 * Time already spent since the last attempt counts toward the delay.
 */
public class ExponentialBackoff {
	public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
	public static final double DEFAULT_BACKOFF_FACTOR = 1.5;
	public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

	private final AsyncQueue queue;
	private final TimerId timerId;
	private final long initialDelayMs;
	private final double backoffFactor;
	private final long maxDelayMs;
	private final Random random;

	private long currentBaseMs = 0;
	private long lastAttemptTime = System.currentTimeMillis();
	private @Nullable DelayedTask timerTask;

	public ExponentialBackoff(AsyncQueue queue, TimerId timerId) {
		this(queue, timerId, DEFAULT_INITIAL_DELAY, DEFAULT_BACKOFF_FACTOR, DEFAULT_MAX_DELAY, new Random());
	}

	public ExponentialBackoff(AsyncQueue queue, TimerId timerId, Duration initialDelay, double backoffFactor, Duration maxDelay, Random random) {
		this.queue = queue;
		this.timerId = timerId;
		this.initialDelayMs = initialDelay.toMillis();
		this.backoffFactor = backoffFactor;
		this.maxDelayMs = maxDelay.toMillis();
		this.random = random;
	}

	/**
	 * The next attempt runs immediately.
	 */
	public void reset() {
		currentBaseMs = 0;
	}

	/**
	 * The next attempt waits the maximum delay, for use when the server says it's overloaded.
	 */
	public void resetToMax() {
		currentBaseMs = maxDelayMs;
	}

	/**
	 * Cancels any pending attempt and schedules <code>task</code> after the current backoff delay.
	 */
	public void backoffAndRun(Runnable task) {
		cancel();

		long desiredDelayWithJitterMs = currentBaseMs + jitterDelayMs();
		long delaySoFarMs = Math.max(0, System.currentTimeMillis() - lastAttemptTime);
		long remainingDelayMs = Math.max(0, desiredDelayWithJitterMs - delaySoFarMs);

		if (currentBaseMs > 0) {
			LOGGER.debug("Backing off for {} ms (base delay: {} ms, delay with jitter: {} ms, last attempt: {} ms ago)",
				remainingDelayMs, currentBaseMs, desiredDelayWithJitterMs, delaySoFarMs);
		}

		timerTask = queue.enqueueAfterDelay(timerId, Duration.ofMillis(remainingDelayMs), () -> {
			timerTask = null;
			lastAttemptTime = System.currentTimeMillis();
			task.run();
		});

		currentBaseMs = (long) (currentBaseMs * backoffFactor);
		if (currentBaseMs < initialDelayMs) {
			currentBaseMs = initialDelayMs;
		} else if (currentBaseMs > maxDelayMs) {
			currentBaseMs = maxDelayMs;
		}
	}

	public void cancel() {
		if (timerTask != null) {
			timerTask.cancel();
			timerTask = null;
		}
	}

	long currentBaseMs() {
		return currentBaseMs;
	}

	private long jitterDelayMs() {
		return (long) ((random.nextDouble() - 0.5) * currentBaseMs);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ExponentialBackoff.class);
}

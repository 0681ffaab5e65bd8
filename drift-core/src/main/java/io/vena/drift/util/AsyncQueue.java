package io.vena.drift.util;

import io.vena.drift.util.MappedDiagnosticContext.MDCScope;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.drift.util.MappedDiagnosticContext.setupMDC;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * The single worker thread on which every piece of client state is read and written.
 *
 * <p>
 * Tasks run strictly in the order they're enqueued. Delayed tasks are tagged with a
 * {@link TimerId} so tests can fast-forward through them with {@link #runDelayedTasksUntil}.
 *
 * <p>
 * An exception escaping a fire-and-forget task means the client's in-memory state can no longer
 * be trusted. The queue records it as a panic, after which every further enqueue fails.
 */
public final class AsyncQueue {
	public enum TimerId {
		/** Only valid as the argument to {@link #runDelayedTasksUntil}: runs every delayed task. */
		ALL,
		LISTEN_STREAM_IDLE,
		LISTEN_STREAM_CONNECTION_BACKOFF,
		WRITE_STREAM_IDLE,
		WRITE_STREAM_CONNECTION_BACKOFF,
		ONLINE_STATE_TIMEOUT,
		GARBAGE_COLLECTION,
	}

	private final String clientName;
	private final ScheduledThreadPoolExecutor executor;
	private final List<DelayedTask> delayedTasks = new ArrayList<>();
	private volatile Thread workerThread;
	private volatile @Nullable String user;
	private volatile boolean isShuttingDown = false;
	private volatile @Nullable Throwable panic;

	public AsyncQueue(String clientName) {
		this.clientName = clientName;
		this.executor = new ScheduledThreadPoolExecutor(1, runnable -> {
			Thread thread = new Thread(runnable, "drift-worker [" + clientName + "]");
			thread.setDaemon(true);
			workerThread = thread;
			return thread;
		});
		this.executor.setRemoveOnCancelPolicy(true);
		this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
	}

	/**
	 * Sets the user reported in the diagnostic context of subsequent tasks.
	 */
	public void setDiagnosticUser(@Nullable String user) {
		this.user = user;
	}

	public <T> CompletableFuture<T> enqueue(Callable<T> task) {
		CompletableFuture<T> result = new CompletableFuture<>();
		if (isShuttingDown) {
			result.completeExceptionally(new IllegalStateException("Client " + clientName + " has been terminated"));
			return result;
		}
		submit(() -> {
			try {
				result.complete(task.call());
			} catch (Throwable e) {
				LOGGER.debug("Task failed with {}", e.getClass().getSimpleName(), e);
				result.completeExceptionally(e);
			}
		}, result);
		return result;
	}

	public CompletableFuture<Void> enqueue(Runnable task) {
		return enqueue(() -> {
			task.run();
			return null;
		});
	}

	/**
	 * Runs a task whose failure indicates a bug rather than a recoverable condition.
	 * Silently ignored once shutdown has started.
	 */
	public void enqueueAndForget(Runnable task) {
		if (isShuttingDown) {
			LOGGER.debug("Ignoring task enqueued after shutdown");
			return;
		}
		submit(() -> {
			try {
				task.run();
			} catch (RuntimeException | Error e) {
				panic(e);
			}
		}, null);
	}

	/**
	 * Starts the shutdown sequence: runs {@code finalTask}, after which no new tasks are accepted
	 * and pending delayed tasks are cancelled.
	 */
	public CompletableFuture<Void> shutdown(Runnable finalTask) {
		CompletableFuture<Void> result = new CompletableFuture<>();
		if (isShuttingDown) {
			result.complete(null);
			return result;
		}
		isShuttingDown = true;
		submit(() -> {
			try {
				for (DelayedTask delayedTask: new ArrayList<>(delayedTasks)) {
					delayedTask.cancel();
				}
				finalTask.run();
				result.complete(null);
			} catch (RuntimeException | Error e) {
				result.completeExceptionally(e);
			} finally {
				executor.shutdown();
			}
		}, result);
		return result;
	}

	public boolean isShuttingDown() {
		return isShuttingDown;
	}

	/**
	 * Schedules a task to run after a delay. Must be called on the worker thread.
	 */
	public DelayedTask enqueueAfterDelay(TimerId timerId, Duration delay, Runnable task) {
		verifyIsCurrentThread();
		DelayedTask result = new DelayedTask(timerId, System.nanoTime() + delay.toNanos(), task);
		result.schedule(delay.toMillis());
		delayedTasks.add(result);
		return result;
	}

	public boolean containsDelayedTask(TimerId timerId) {
		return enqueue(() -> delayedTasks.stream().anyMatch(t -> t.timerId == timerId)).join();
	}

	/**
	 * Runs pending delayed tasks immediately, in the order they were scheduled to fire,
	 * up to and including the first one with the given timer id.
	 * {@link TimerId#ALL} runs all of them, including any they schedule in turn.
	 */
	public CompletableFuture<Void> runDelayedTasksUntil(TimerId lastTimerId) {
		return enqueue(() -> {
			if (lastTimerId != TimerId.ALL && delayedTasks.stream().noneMatch(t -> t.timerId == lastTimerId)) {
				throw new IllegalArgumentException("No delayed task with timer id " + lastTimerId);
			}
			while (!delayedTasks.isEmpty()) {
				delayedTasks.sort(Comparator.comparingLong(t -> t.targetTimeNanos));
				DelayedTask next = delayedTasks.get(0);
				next.skipDelay();
				if (next.timerId == lastTimerId) {
					break;
				}
			}
		});
	}

	public void verifyIsCurrentThread() {
		if (Thread.currentThread() != workerThread) {
			throw new AssertionError("Must be called on the worker thread for " + clientName + "; called on " + Thread.currentThread().getName());
		}
	}

	public @Nullable Throwable panicCause() {
		return panic;
	}

	private void panic(Throwable e) {
		LOGGER.error("Internal error on the worker thread of client {}; the client can no longer be used", clientName, e);
		panic = e;
		isShuttingDown = true;
		executor.shutdown();
	}

	private void submit(Runnable task, @Nullable CompletableFuture<?> failOnReject) {
		Throwable cause = panic;
		if (cause != null) {
			if (failOnReject != null) {
				failOnReject.completeExceptionally(new IllegalStateException("Client " + clientName + " failed", cause));
			}
			return;
		}
		try {
			executor.execute(() -> {
				try (MDCScope __ = setupMDC(clientName, user)) {
					task.run();
				}
			});
		} catch (RejectedExecutionException e) {
			LOGGER.debug("Worker for {} is shut down; rejecting task", clientName);
			if (failOnReject != null) {
				failOnReject.completeExceptionally(new IllegalStateException("Client " + clientName + " has been terminated", e));
			}
		}
	}

	/**
	 * A task scheduled to run on the queue after a delay, which can be cancelled
	 * until it starts running.
	 */
	public final class DelayedTask {
		private final TimerId timerId;
		private final long targetTimeNanos;
		private final Runnable task;
		private ScheduledFuture<?> scheduledFuture;

		private DelayedTask(TimerId timerId, long targetTimeNanos, Runnable task) {
			this.timerId = timerId;
			this.targetTimeNanos = targetTimeNanos;
			this.task = task;
		}

		public TimerId timerId() {
			return timerId;
		}

		private void schedule(long delayMillis) {
			scheduledFuture = executor.schedule(() -> {
				try (MDCScope __ = setupMDC(clientName, user)) {
					handleDelayElapsed();
				}
			}, delayMillis, MILLISECONDS);
		}

		/**
		 * Must be called on the worker thread. Has no effect if the task already ran.
		 */
		public void cancel() {
			verifyIsCurrentThread();
			if (scheduledFuture != null) {
				scheduledFuture.cancel(false);
				markDone();
			}
		}

		private void skipDelay() {
			scheduledFuture.cancel(false);
			handleDelayElapsed();
		}

		private void handleDelayElapsed() {
			verifyIsCurrentThread();
			if (scheduledFuture != null) {
				markDone();
				try {
					task.run();
				} catch (RuntimeException | Error e) {
					panic(e);
				}
			}
		}

		private void markDone() {
			scheduledFuture = null;
			delayedTasks.remove(this);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AsyncQueue.class);
}

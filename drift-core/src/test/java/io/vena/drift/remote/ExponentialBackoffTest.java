package io.vena.drift.remote;

import io.vena.drift.util.AsyncQueue;
import io.vena.drift.util.AsyncQueue.TimerId;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExponentialBackoffTest {
	static final TimerId TIMER = TimerId.LISTEN_STREAM_CONNECTION_BACKOFF;

	AsyncQueue queue;
	ExponentialBackoff backoff;
	final AtomicInteger attempts = new AtomicInteger();

	@BeforeEach
	void setup() {
		queue = new AsyncQueue("backoff");
		backoff = new ExponentialBackoff(queue, TIMER, Duration.ofMinutes(1), 2.0, Duration.ofMinutes(5), new Random(123));
	}

	@AfterEach
	void teardown() {
		queue.shutdown(() -> { }).join();
	}

	@Test
	void baseDelay_growsUpToTheMaximum() {
		List<Long> bases = queue.enqueue(() -> {
			List<Long> result = new ArrayList<>();
			for (int i = 0; i < 5; i++) {
				backoff.backoffAndRun(attempts::incrementAndGet);
				result.add(backoff.currentBaseMs());
			}
			return result;
		}).join();

		assertEquals(List.of(60_000L, 120_000L, 240_000L, 300_000L, 300_000L), bases);
	}

	@Test
	void delayedAttempt_runsWhenTimerFires() {
		queue.enqueue(() -> {
			backoff.resetToMax();
			backoff.backoffAndRun(attempts::incrementAndGet);
		}).join();
		assertTrue(queue.containsDelayedTask(TIMER));
		assertEquals(0, attempts.get());

		queue.runDelayedTasksUntil(TIMER).join();
		assertEquals(1, attempts.get());
	}

	@Test
	void newAttempt_cancelsThePendingOne() {
		queue.enqueue(() -> {
			backoff.resetToMax();
			backoff.backoffAndRun(attempts::incrementAndGet);
			backoff.backoffAndRun(attempts::incrementAndGet);
		}).join();

		queue.runDelayedTasksUntil(TimerId.ALL).join();
		assertEquals(1, attempts.get());
	}

	@Test
	void cancel_dropsThePendingAttempt() {
		queue.enqueue(() -> {
			backoff.resetToMax();
			backoff.backoffAndRun(attempts::incrementAndGet);
			backoff.cancel();
		}).join();

		assertFalse(queue.containsDelayedTask(TIMER));
		assertEquals(0, attempts.get());
	}

	@Test
	void reset_restartsFromZero() {
		long base = queue.enqueue(() -> {
			backoff.resetToMax();
			backoff.reset();
			return backoff.currentBaseMs();
		}).join();
		assertEquals(0L, base);
	}
}

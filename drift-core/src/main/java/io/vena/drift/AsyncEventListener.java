package io.vena.drift;

import io.vena.drift.core.EventListener;
import io.vena.drift.exceptions.DriftException;
import java.util.concurrent.Executor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers events to an application listener on another executor, and stops delivering
 * once muted, even events already queued.
 */
final class AsyncEventListener<T> implements EventListener<T> {
	private final Executor executor;
	private final EventListener<T> eventListener;
	private volatile boolean muted = false;

	AsyncEventListener(Executor executor, EventListener<T> eventListener) {
		this.executor = executor;
		this.eventListener = eventListener;
	}

	@Override
	public void onEvent(@Nullable T value, @Nullable DriftException error) {
		executor.execute(() -> {
			if (!muted) {
				try {
					eventListener.onEvent(value, error);
				} catch (RuntimeException e) {
					LOGGER.error("Listener threw an exception; event dropped", e);
				}
			}
		});
	}

	void mute() {
		muted = true;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AsyncEventListener.class);
}

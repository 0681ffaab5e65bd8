package io.vena.drift.core;

import io.vena.drift.exceptions.DriftException;
import org.jetbrains.annotations.Nullable;

/**
 * Receives a stream of values, ending with an error if one occurs.
 *
 * @param <T> the value type
 */
@FunctionalInterface
public interface EventListener<T> {
	/**
	 * The error is null unless something went wrong, and nothing follows an error.
	 */
	void onEvent(@Nullable T value, @Nullable DriftException error);
}

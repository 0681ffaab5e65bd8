package io.vena.drift;

/**
 * Returned when adding a listener; removes it.
 */
@FunctionalInterface
public interface ListenerRegistration {
	/**
	 * No events are delivered after this returns. Removing twice has no effect.
	 */
	void remove();
}

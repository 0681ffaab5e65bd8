package io.vena.drift.core;

/**
 * Whether the client believes it can reach the server, which decides whether
 * listeners are shown cached results while they wait.
 */
public enum OnlineState {
	/**
	 * Still trying to connect. Listeners wait for the server, on the assumption
	 * that the state will soon become {@link #ONLINE} or {@link #OFFLINE}.
	 */
	UNKNOWN,

	/**
	 * The watch stream is delivering messages.
	 */
	ONLINE,

	/**
	 * Connecting failed, or the network is disabled. Listeners get cached results
	 * without waiting.
	 */
	OFFLINE,
}

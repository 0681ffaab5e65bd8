package io.vena.drift.auth;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Supplies tokens that authorize stream connections, and announces changes in who they belong to.
 *
 * @param <T> what a change announces: the {@link io.vena.drift.model.User} for authentication,
 *           or the new token itself for attestation
 */
public interface CredentialsProvider<T> {
	/**
	 * @return a future completing with the current token, or with null if there isn't one
	 */
	CompletableFuture<String> getToken();

	/**
	 * The server rejected the last token; the next {@link #getToken()} must fetch a fresh one.
	 */
	void invalidateToken();

	/**
	 * Registers the only listener. It is called once promptly with the current value, and again on every change,
	 * on any thread.
	 */
	void setChangeListener(Consumer<T> changeListener);

	void removeChangeListener();
}

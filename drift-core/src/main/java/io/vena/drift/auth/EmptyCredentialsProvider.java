package io.vena.drift.auth;

import io.vena.drift.model.User;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * No credentials: every connection is made as {@link User#UNAUTHENTICATED}.
 */
public class EmptyCredentialsProvider implements CredentialsProvider<User> {
	@Override
	public CompletableFuture<String> getToken() {
		return CompletableFuture.completedFuture(null);
	}

	@Override
	public void invalidateToken() {
	}

	@Override
	public void setChangeListener(Consumer<User> changeListener) {
		changeListener.accept(User.UNAUTHENTICATED);
	}

	@Override
	public void removeChangeListener() {
	}
}

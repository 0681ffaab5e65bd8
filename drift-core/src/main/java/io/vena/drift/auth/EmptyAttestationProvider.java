package io.vena.drift.auth;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Attests nothing. Connections carry no attestation token.
 */
public class EmptyAttestationProvider implements CredentialsProvider<String> {
	@Override
	public CompletableFuture<String> getToken() {
		return CompletableFuture.completedFuture(null);
	}

	@Override
	public void invalidateToken() {
	}

	@Override
	public void setChangeListener(Consumer<String> changeListener) {
	}

	@Override
	public void removeChangeListener() {
	}
}

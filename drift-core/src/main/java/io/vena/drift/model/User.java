package io.vena.drift.model;

import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * The signed-in principal. Mutation queues and overlays are kept separately for each user.
 */
@Value
public class User {
	public static final User UNAUTHENTICATED = new User(null);

	@Nullable String uid;

	public boolean isAuthenticated() {
		return uid != null;
	}

	/**
	 * The key under which this user's local state is stored.
	 */
	public String storageKey() {
		return isAuthenticated() ? uid : "";
	}

	public static User fromStorageKey(String key) {
		return key.isEmpty() ? UNAUTHENTICATED : new User(key);
	}
}

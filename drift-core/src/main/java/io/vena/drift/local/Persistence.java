package io.vena.drift.local;

import io.vena.drift.exceptions.PersistenceUnavailableException;
import io.vena.drift.model.User;
import java.util.function.Supplier;

/**
 * The storage underneath every local cache, and the transactions that keep them consistent.
 *
 * <p>
 * All access happens on the client's worker thread. A transaction either commits all its
 * changes or, if it throws, none of them.
 */
public abstract class Persistence {
	/**
	 * @throws PersistenceUnavailableException if another client holds exclusive access to the storage
	 */
	public abstract void start() throws PersistenceUnavailableException;

	public abstract void shutdown();

	public abstract boolean isStarted();

	public abstract ReferenceDelegate getReferenceDelegate();

	public abstract MutationQueue getMutationQueue(User user, IndexManager indexManager);

	public abstract TargetCache getTargetCache();

	public abstract RemoteDocumentCache getRemoteDocumentCache();

	public abstract IndexManager getIndexManager(User user);

	public abstract DocumentOverlayCache getDocumentOverlayCache(User user);

	public abstract <T> T runTransaction(String action, Supplier<T> operation);

	public void runTransaction(String action, Runnable operation) {
		runTransaction(action, () -> {
			operation.run();
			return null;
		});
	}
}

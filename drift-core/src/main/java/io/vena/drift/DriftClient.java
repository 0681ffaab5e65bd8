package io.vena.drift;

import io.vena.drift.auth.CredentialsProvider;
import io.vena.drift.auth.EmptyAttestationProvider;
import io.vena.drift.auth.EmptyCredentialsProvider;
import io.vena.drift.core.EventListener;
import io.vena.drift.core.EventManager;
import io.vena.drift.core.ListenOptions;
import io.vena.drift.core.OnlineState;
import io.vena.drift.core.Query;
import io.vena.drift.core.QueryListener;
import io.vena.drift.core.SyncEngine;
import io.vena.drift.core.View;
import io.vena.drift.core.ViewSnapshot;
import io.vena.drift.exceptions.DriftException;
import io.vena.drift.exceptions.PersistenceUnavailableException;
import io.vena.drift.local.FieldIndex;
import io.vena.drift.local.LocalStore;
import io.vena.drift.local.LruDelegate;
import io.vena.drift.local.LruGarbageCollector;
import io.vena.drift.local.Persistence;
import io.vena.drift.local.QueryEngine;
import io.vena.drift.local.QueryResult;
import io.vena.drift.model.DatabaseId;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.User;
import io.vena.drift.model.mutation.Mutation;
import io.vena.drift.model.mutation.MutationBatchResult;
import io.vena.drift.remote.RemoteEvent;
import io.vena.drift.remote.RemoteStore;
import io.vena.drift.remote.Status;
import io.vena.drift.remote.Transport;
import io.vena.drift.util.AsyncQueue;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.drift.DriftSettings.InitialPersistenceUnavailableMode.FAIL;

/**
 * The application's view of one database: reads and queries answered from the local cache,
 * writes applied locally at once and sent to the server in order, and listeners that
 * see local state first and the server's state as soon as it arrives.
 *
 * <p>
 * All state lives on a single worker thread; every method here may be called from any thread.
 * Futures complete, and listeners are called, on a separate callback thread,
 * unless {@link DriftSettings.Testing#synchronousCallbacks()} is set.
 */
public final class DriftClient implements AutoCloseable {
	private final DriftSettings settings;
	private final DatabaseId databaseId;
	private final CredentialsProvider<User> authProvider;
	private final CredentialsProvider<String> attestationProvider;
	private final AsyncQueue asyncQueue;
	private final Executor callbackExecutor;
	private final @Nullable ExecutorService callbackThread;

	// Worker thread only, once initialized
	private Persistence persistence;
	private LocalStore localStore;
	private RemoteStore remoteStore;
	private SyncEngine syncEngine;
	private EventManager eventManager;
	private @Nullable LruGarbageCollector.Scheduler gcScheduler;

	private @Nullable CompletableFuture<Void> terminated;

	/**
	 * Blocks until the auth provider reports the first user and the persistence has started.
	 *
	 * @throws PersistenceUnavailableException if the persistence can't be started
	 * and {@link DriftSettings#initialPersistenceUnavailableMode()} is {@link DriftSettings.InitialPersistenceUnavailableMode#FAIL FAIL}
	 */
	public DriftClient(
		DriftSettings settings,
		DatabaseId databaseId,
		Transport transport,
		CredentialsProvider<User> authProvider,
		CredentialsProvider<String> attestationProvider,
		PersistenceFactory persistenceFactory
	) throws PersistenceUnavailableException {
		settings.validate();
		this.settings = settings;
		this.databaseId = databaseId;
		this.authProvider = authProvider;
		this.attestationProvider = attestationProvider;
		this.asyncQueue = new AsyncQueue(settings.clientName());
		if (settings.testing().synchronousCallbacks()) {
			this.callbackThread = null;
			this.callbackExecutor = Runnable::run;
		} else {
			this.callbackThread = Executors.newSingleThreadExecutor(runnable -> {
				Thread thread = new Thread(runnable, settings.clientName() + "-callbacks");
				thread.setDaemon(true);
				return thread;
			});
			this.callbackExecutor = callbackThread;
		}

		CompletableFuture<User> firstUser = new CompletableFuture<>();
		CompletableFuture<Void> initialized = asyncQueue.enqueue(() -> {
			initialize(firstUser.join(), transport, persistenceFactory);
			return null;
		});
		authProvider.setChangeListener(user -> {
			if (!firstUser.complete(user)) {
				asyncQueue.enqueueAndForget(() -> {
					asyncQueue.setDiagnosticUser(user.uid());
					syncEngine.handleCredentialChange(user);
				});
			}
		});
		attestationProvider.setChangeListener(token -> LOGGER.debug("Attestation token changed"));

		try {
			initialized.join();
		} catch (CompletionException e) {
			LOGGER.debug("Initialization failed; shutting down", e.getCause());
			authProvider.removeChangeListener();
			attestationProvider.removeChangeListener();
			asyncQueue.shutdown(() -> {});
			if (callbackThread != null) {
				callbackThread.shutdown();
			}
			if (e.getCause() instanceof PersistenceUnavailableException) {
				throw (PersistenceUnavailableException) e.getCause();
			} else if (e.getCause() instanceof RuntimeException) {
				throw (RuntimeException) e.getCause();
			} else {
				throw new IllegalStateException("Unable to initialize client " + settings.clientName(), e.getCause());
			}
		}
	}

	/**
	 * A client with no credentials whose cache lasts only as long as the client does.
	 */
	public static DriftClient inMemory(DriftSettings settings, DatabaseId databaseId, Transport transport) {
		try {
			return new DriftClient(settings, databaseId, transport, new EmptyCredentialsProvider(), new EmptyAttestationProvider(), PersistenceFactory.memory());
		} catch (PersistenceUnavailableException e) {
			throw new AssertionError("Memory persistence is always available", e);
		}
	}

	private void initialize(User user, Transport transport, PersistenceFactory persistenceFactory) throws PersistenceUnavailableException {
		asyncQueue.setDiagnosticUser(user.uid());
		boolean networkAllowed = true;
		persistence = persistenceFactory.create(settings);
		try {
			persistence.start();
		} catch (PersistenceUnavailableException e) {
			if (settings.initialPersistenceUnavailableMode() == FAIL) {
				throw e;
			}
			LOGGER.warn("Persistence unavailable; client {} continues offline with an in-memory cache", settings.clientName(), e);
			persistence = PersistenceFactory.memory().create(settings);
			persistence.start();
			networkAllowed = false;
		}

		localStore = new LocalStore(persistence, new QueryEngine(settings.indexingPolicy()), user, settings.resumeTokenMaxAge());
		localStore.start();
		remoteStore = new RemoteStore(
			databaseId, localStore, transport, asyncQueue,
			authProvider, attestationProvider,
			settings.remoteParams(),
			new RemoteStore.RemoteStoreCallback() {
				@Override
				public void handleRemoteEvent(RemoteEvent remoteEvent) {
					syncEngine.handleRemoteEvent(remoteEvent);
				}

				@Override
				public void handleRejectedListen(int targetId, Status error) {
					syncEngine.handleRejectedListen(targetId, error);
				}

				@Override
				public void handleSuccessfulWrite(MutationBatchResult successfulWrite) {
					syncEngine.handleSuccessfulWrite(successfulWrite);
				}

				@Override
				public void handleRejectedWrite(int batchId, Status error) {
					syncEngine.handleRejectedWrite(batchId, error);
				}

				@Override
				public void handleOnlineStateChange(OnlineState onlineState) {
					syncEngine.handleOnlineStateChange(onlineState);
				}

				@Override
				public Set<DocumentKey> getRemoteKeysForTarget(int targetId) {
					return syncEngine.getRemoteKeysForTarget(targetId);
				}
			});
		syncEngine = new SyncEngine(localStore, remoteStore, user, settings.maxConcurrentLimboResolutions());
		eventManager = new EventManager(syncEngine);

		if (networkAllowed) {
			remoteStore.start();
		} else {
			remoteStore.disableNetwork();
		}

		if (persistence.getReferenceDelegate() instanceof LruDelegate) {
			LruGarbageCollector garbageCollector = ((LruDelegate) persistence.getReferenceDelegate()).getGarbageCollector();
			gcScheduler = garbageCollector.newScheduler(asyncQueue, localStore);
			gcScheduler.start();
		}
		LOGGER.info("Client {} started for {}", settings.clientName(), databaseId);
	}

	/**
	 * The local view of the document: the cached server version with pending writes applied.
	 * A document the client knows nothing about has {@link Document.Kind#INVALID}.
	 */
	public CompletableFuture<Document> getDocument(DocumentKey key) {
		verifyNotTerminated();
		return onCallbackThread(asyncQueue.enqueue(() -> localStore.readDocument(key)));
	}

	public CompletableFuture<SortedMap<DocumentKey, Document>> getDocuments(Collection<DocumentKey> keys) {
		verifyNotTerminated();
		List<DocumentKey> keysCopy = List.copyOf(keys);
		return onCallbackThread(asyncQueue.enqueue(() -> localStore.readDocuments(keysCopy)));
	}

	/**
	 * @param useCache if true, answer from the local cache alone. Otherwise, wait for the
	 * server's answer, failing with {@link DriftException.Code#UNAVAILABLE} if the client is offline.
	 */
	public CompletableFuture<ViewSnapshot> runQuery(Query query, boolean useCache) {
		verifyNotTerminated();
		if (useCache) {
			return onCallbackThread(asyncQueue.enqueue(() -> executeQueryFromCache(query)));
		} else {
			return runQueryFromServer(query);
		}
	}

	private ViewSnapshot executeQueryFromCache(Query query) {
		QueryResult queryResult = localStore.executeQuery(query, true);
		View view = new View(query, queryResult.remoteKeys());
		ViewSnapshot snapshot = view.applyChanges(view.computeDocChanges(queryResult.documents())).snapshot();
		if (snapshot == null) {
			throw new AssertionError("A new view always produces a snapshot");
		}
		return snapshot;
	}

	private CompletableFuture<ViewSnapshot> runQueryFromServer(Query query) {
		CompletableFuture<ViewSnapshot> result = new CompletableFuture<>();
		CompletableFuture<ListenerRegistration> registration = new CompletableFuture<>();
		ListenOptions options = ListenOptions.builder()
			.includeDocumentMetadataChanges(true)
			.includeQueryMetadataChanges(true)
			.waitForSyncWhenOnline(true)
			.build();
		registration.complete(listen(query, options, (snapshot, error) -> {
			if (result.isDone()) {
				return;
			}
			registration.thenAccept(ListenerRegistration::remove);
			if (error != null) {
				result.completeExceptionally(error);
			} else if (snapshot.fromCache()) {
				result.completeExceptionally(new DriftException(
					"Unable to get query results from the server while offline; the local cache may have them",
					DriftException.Code.UNAVAILABLE));
			} else {
				result.complete(snapshot);
			}
		}));
		return result;
	}

	/**
	 * Applies the mutations to the local view at once and queues them for the server.
	 *
	 * @return the id of the batch, once it's queued
	 */
	public CompletableFuture<Integer> localWrite(List<Mutation> mutations) {
		return onCallbackThread(enqueueWrite(mutations, new CompletableFuture<>()));
	}

	/**
	 * Like {@link #localWrite}, but completes when the server acknowledges the batch,
	 * or fails when the server rejects it. Never completes while offline.
	 */
	public CompletableFuture<Void> write(List<Mutation> mutations) {
		CompletableFuture<Void> acknowledged = new CompletableFuture<>();
		enqueueWrite(mutations, acknowledged).whenComplete((batchId, error) -> {
			if (error != null) {
				acknowledged.completeExceptionally(error);
			}
		});
		return onCallbackThread(acknowledged);
	}

	private CompletableFuture<Integer> enqueueWrite(List<Mutation> mutations, CompletableFuture<Void> acknowledged) {
		verifyNotTerminated();
		if (mutations.isEmpty()) {
			throw new IllegalArgumentException("A write needs at least one mutation");
		}
		List<Mutation> mutationsCopy = List.copyOf(mutations);
		return asyncQueue.enqueue(() -> syncEngine.writeMutations(mutationsCopy, acknowledged));
	}

	public ListenerRegistration listen(Query query, EventListener<ViewSnapshot> listener) {
		return listen(query, ListenOptions.defaults(), listener);
	}

	/**
	 * The listener first gets whatever the cache has, flagged {@link ViewSnapshot#fromCache() fromCache},
	 * then every change until the registration is removed. After an error, the listener gets nothing more.
	 */
	public ListenerRegistration listen(Query query, ListenOptions options, EventListener<ViewSnapshot> listener) {
		verifyNotTerminated();
		AsyncEventListener<ViewSnapshot> asyncListener = new AsyncEventListener<>(callbackExecutor, listener);
		QueryListener queryListener = new QueryListener(query, options, asyncListener);
		asyncQueue.enqueueAndForget(() -> eventManager.addQueryListener(queryListener));
		return () -> {
			asyncListener.mute();
			asyncQueue.enqueueAndForget(() -> eventManager.removeQueryListener(queryListener));
		};
	}

	/**
	 * Called once promptly, then whenever every active listener has seen the same consistent state.
	 */
	public ListenerRegistration addSnapshotsInSyncListener(Runnable listener) {
		verifyNotTerminated();
		AsyncEventListener<Void> asyncListener = new AsyncEventListener<>(callbackExecutor, (value, error) -> listener.run());
		asyncQueue.enqueueAndForget(() -> eventManager.addSnapshotsInSyncListener(asyncListener));
		return () -> {
			asyncListener.mute();
			asyncQueue.enqueueAndForget(() -> eventManager.removeSnapshotsInSyncListener(asyncListener));
		};
	}

	/**
	 * Completes once every write made so far has been acknowledged or rejected.
	 * Fails with {@link DriftException.Code#CANCELLED} if the user changes first.
	 */
	public CompletableFuture<Void> waitForPendingWrites() {
		verifyNotTerminated();
		CompletableFuture<Void> result = new CompletableFuture<>();
		asyncQueue.enqueue(() -> syncEngine.registerPendingWritesTask(result)).whenComplete((ignored, error) -> {
			if (error != null) {
				result.completeExceptionally(error);
			}
		});
		return onCallbackThread(result);
	}

	public CompletableFuture<Void> enableNetwork() {
		verifyNotTerminated();
		return onCallbackThread(asyncQueue.enqueue(() -> remoteStore.enableNetwork()));
	}

	/**
	 * Writes queue up and listeners are served from cache until {@link #enableNetwork()}.
	 */
	public CompletableFuture<Void> disableNetwork() {
		verifyNotTerminated();
		return onCallbackThread(asyncQueue.enqueue(() -> remoteStore.disableNetwork()));
	}

	/**
	 * Replaces the client-side field indexes the query engine may use.
	 */
	public CompletableFuture<Void> configureFieldIndexes(List<FieldIndex> fieldIndexes) {
		verifyNotTerminated();
		List<FieldIndex> indexesCopy = List.copyOf(fieldIndexes);
		return onCallbackThread(asyncQueue.enqueue(() -> localStore.configureFieldIndexes(indexesCopy)));
	}

	/**
	 * Finishes the tasks already queued, then closes the streams and releases the persistence.
	 * Pending writes stay in durable persistence for the next client.
	 */
	public synchronized CompletableFuture<Void> terminate() {
		if (terminated == null) {
			LOGGER.debug("Terminating client {}", settings.clientName());
			authProvider.removeChangeListener();
			attestationProvider.removeChangeListener();
			terminated = asyncQueue.shutdown(() -> {
				if (gcScheduler != null) {
					gcScheduler.stop();
				}
				remoteStore.shutdown();
				persistence.shutdown();
				LOGGER.info("Client {} terminated", settings.clientName());
			}).whenComplete((ignored, error) -> {
				if (callbackThread != null) {
					callbackThread.shutdown();
				}
			});
		}
		return terminated;
	}

	public boolean isTerminated() {
		return asyncQueue.isShuttingDown();
	}

	@Override
	public void close() {
		terminate().join();
	}

	private void verifyNotTerminated() {
		if (isTerminated()) {
			throw new IllegalStateException("Client " + settings.clientName() + " has been terminated");
		}
	}

	private <T> CompletableFuture<T> onCallbackThread(CompletableFuture<T> future) {
		CompletableFuture<T> result = new CompletableFuture<>();
		future.whenComplete((value, error) -> {
			Runnable completion = () -> {
				if (error == null) {
					result.complete(value);
				} else {
					result.completeExceptionally(error);
				}
			};
			try {
				callbackExecutor.execute(completion);
			} catch (RejectedExecutionException e) {
				LOGGER.debug("Callback thread is shut down; completing on the current thread");
				completion.run();
			}
		});
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DriftClient.class);
}

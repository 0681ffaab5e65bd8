package io.vena.drift.core;

import io.vena.drift.core.ViewSnapshot.SyncState;
import io.vena.drift.exceptions.DriftException;
import io.vena.drift.exceptions.DriftException.Code;
import io.vena.drift.local.ListenSequence;
import io.vena.drift.local.LocalStore;
import io.vena.drift.local.LocalViewChanges;
import io.vena.drift.local.LocalWriteResult;
import io.vena.drift.local.QueryPurpose;
import io.vena.drift.local.QueryResult;
import io.vena.drift.local.ReferenceSet;
import io.vena.drift.local.TargetData;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.model.User;
import io.vena.drift.model.mutation.Mutation;
import io.vena.drift.model.mutation.MutationBatch;
import io.vena.drift.model.mutation.MutationBatchResult;
import io.vena.drift.remote.RemoteEvent;
import io.vena.drift.remote.RemoteStore;
import io.vena.drift.remote.Status;
import io.vena.drift.remote.TargetChange;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ties the local store, the remote store and the views together.
 *
 * <p>
 * Every change, whether a local write, a write result or a remote event, is applied to the
 * local store first; the documents it reports as changed are then fed to every view, and the
 * resulting snapshots go to the {@link SyncEngineCallback}.
 *
 * <p>
 * Documents a view shows but the server doesn't list for its target are in limbo. For each one,
 * the sync engine listens to the single document until the server resolves it, with at most
 * {@link #maxConcurrentLimboResolutions} such listens at once.
 *
 * <p>
 * Everything here runs on the worker queue.
 */
public class SyncEngine implements RemoteStore.RemoteStoreCallback {
	public static final int DEFAULT_MAX_CONCURRENT_LIMBO_RESOLUTIONS = 100;

	/**
	 * Where the sync engine delivers what listeners need to see.
	 */
	public interface SyncEngineCallback {
		void onViewSnapshots(List<ViewSnapshot> snapshots);

		/**
		 * The query's listen failed and has been removed.
		 */
		void onError(Query query, Status error);

		void handleOnlineStateChange(OnlineState onlineState);
	}

	private static final class LimboResolution {
		private final DocumentKey key;

		/**
		 * The server has sent the document for the limbo target, so it's in the target's remote keys.
		 */
		private boolean receivedDocument;

		LimboResolution(DocumentKey key) {
			this.key = key;
		}
	}

	private final LocalStore localStore;
	private final RemoteStore remoteStore;
	private final int maxConcurrentLimboResolutions;

	private final Map<Query, QueryView> queryViewsByQuery = new HashMap<>();
	private final Map<Integer, List<Query>> queriesByTarget = new HashMap<>();

	private final Set<DocumentKey> enqueuedLimboResolutions = new LinkedHashSet<>();
	private final Map<DocumentKey, Integer> activeLimboTargetsByKey = new HashMap<>();
	private final Map<Integer, LimboResolution> activeLimboResolutionsByTarget = new HashMap<>();

	/**
	 * Which views put each limbo document in limbo, by target id.
	 */
	private ReferenceSet limboDocumentRefs = ReferenceSet.empty();

	/**
	 * Completions for local writes, by user and batch id. Batches restored from persistence have none.
	 */
	private final Map<User, Map<Integer, CompletableFuture<Void>>> mutationUserCallbacks = new HashMap<>();

	/**
	 * {@link #registerPendingWritesTask} completions, keyed by the batch they wait for.
	 */
	private final Map<Integer, List<CompletableFuture<Void>>> pendingWritesCallbacks = new HashMap<>();

	private final TargetIdGenerator targetIdGenerator = TargetIdGenerator.forSyncEngine();

	private User currentUser;
	private @Nullable SyncEngineCallback syncEngineListener;

	public SyncEngine(LocalStore localStore, RemoteStore remoteStore, User initialUser, int maxConcurrentLimboResolutions) {
		this.localStore = localStore;
		this.remoteStore = remoteStore;
		this.currentUser = initialUser;
		this.maxConcurrentLimboResolutions = maxConcurrentLimboResolutions;
	}

	public void setCallback(SyncEngineCallback callback) {
		this.syncEngineListener = callback;
	}

	private SyncEngineCallback callback(String method) {
		if (syncEngineListener == null) {
			throw new AssertionError("Trying to call " + method + " before setting callback");
		}
		return syncEngineListener;
	}

	/**
	 * Starts listening to the query, immediately raising a snapshot of what the local store has.
	 *
	 * @param shouldListenToRemote false to serve the query from cache only
	 * @return the target id assigned to the query
	 */
	public int listen(Query query, boolean shouldListenToRemote) {
		SyncEngineCallback callback = callback("listen");
		if (queryViewsByQuery.containsKey(query)) {
			throw new AssertionError("We already listen to query: " + query);
		}

		TargetData targetData = localStore.allocateTarget(query.toTarget());
		ViewSnapshot viewSnapshot = initializeViewAndComputeSnapshot(query, targetData.targetId(), targetData.resumeToken());
		callback.onViewSnapshots(List.of(viewSnapshot));

		if (shouldListenToRemote) {
			remoteStore.listen(targetData);
		}
		return targetData.targetId();
	}

	public int listen(Query query) {
		return listen(query, true);
	}

	private ViewSnapshot initializeViewAndComputeSnapshot(Query query, int targetId, String resumeToken) {
		QueryResult queryResult = localStore.executeQuery(query, true);

		// A query sharing its target with others inherits their sync state
		SyncState currentTargetSyncState = SyncState.NONE;
		List<Query> mirrorQueries = queriesByTarget.get(targetId);
		if (mirrorQueries != null) {
			currentTargetSyncState = queryViewsByQuery.get(mirrorQueries.get(0)).view().syncState();
		}
		TargetChange synthesizedCurrentChange = TargetChange.createSynthesizedTargetChangeForCurrentChange(
			currentTargetSyncState == SyncState.SYNCED, resumeToken);

		View view = new View(query, queryResult.remoteKeys());
		View.DocumentChanges viewDocChanges = view.computeDocChanges(queryResult.documents());
		ViewChange viewChange = view.applyChanges(viewDocChanges, synthesizedCurrentChange);
		updateTrackedLimboDocuments(viewChange.limboChanges(), targetId);

		queryViewsByQuery.put(query, new QueryView(query, targetId, view));
		queriesByTarget.computeIfAbsent(targetId, id -> new ArrayList<>(1)).add(query);
		ViewSnapshot snapshot = viewChange.snapshot();
		if (snapshot == null) {
			throw new AssertionError("A new view always raises a snapshot");
		}
		return snapshot;
	}

	public void stopListening(Query query, boolean shouldUnlistenToRemote) {
		callback("stopListening");
		QueryView queryView = queryViewsByQuery.remove(query);
		if (queryView == null) {
			throw new AssertionError("Trying to stop listening to a query not found");
		}

		int targetId = queryView.targetId();
		List<Query> targetQueries = queriesByTarget.get(targetId);
		targetQueries.remove(query);
		if (targetQueries.isEmpty()) {
			localStore.releaseTarget(targetId);
			if (shouldUnlistenToRemote) {
				remoteStore.stopListening(targetId);
			}
			removeAndCleanupTarget(targetId, Status.OK);
		}
	}

	public void stopListening(Query query) {
		stopListening(query, true);
	}

	/**
	 * Applies the mutations locally as one batch, raises the resulting snapshots, and hands
	 * the batch to the remote store.
	 *
	 * @param userTask completed when the server accepts or rejects the batch
	 * @return the new batch's id
	 */
	public int writeMutations(List<Mutation> mutations, CompletableFuture<Void> userTask) {
		callback("writeMutations");
		LocalWriteResult result = localStore.writeLocally(mutations);
		mutationUserCallbacks.computeIfAbsent(currentUser, user -> new HashMap<>()).put(result.batchId(), userTask);
		emitNewSnapsAndNotifyLocalStore(result.changes(), null);
		remoteStore.fillWritePipeline();
		return result.batchId();
	}

	@Override
	public void handleRemoteEvent(RemoteEvent event) {
		callback("handleRemoteEvent");

		for (Map.Entry<Integer, TargetChange> entry: event.targetChanges().entrySet()) {
			LimboResolution limboResolution = activeLimboResolutionsByTarget.get(entry.getKey());
			if (limboResolution != null) {
				// A limbo target has one document, so it can't have more than one change
				TargetChange targetChange = entry.getValue();
				int changeCount = targetChange.addedDocuments().size()
					+ targetChange.modifiedDocuments().size()
					+ targetChange.removedDocuments().size();
				if (changeCount > 1) {
					throw new AssertionError("Limbo resolution for single document contains multiple changes");
				}
				if (!targetChange.addedDocuments().isEmpty()) {
					limboResolution.receivedDocument = true;
				} else if (!targetChange.modifiedDocuments().isEmpty()) {
					if (!limboResolution.receivedDocument) {
						throw new AssertionError("Received change for limbo target document without add");
					}
				} else if (!targetChange.removedDocuments().isEmpty()) {
					if (!limboResolution.receivedDocument) {
						throw new AssertionError("Received remove for limbo target document without add");
					}
					limboResolution.receivedDocument = false;
				}
			}
		}

		SortedMap<DocumentKey, Document> changes = localStore.applyRemoteEvent(event);
		emitNewSnapsAndNotifyLocalStore(changes, event);
	}

	@Override
	public void handleOnlineStateChange(OnlineState onlineState) {
		SyncEngineCallback callback = callback("handleOnlineStateChange");
		List<ViewSnapshot> newViewSnapshots = new ArrayList<>();
		for (QueryView queryView: queryViewsByQuery.values()) {
			ViewChange viewChange = queryView.view().applyOnlineStateChange(onlineState);
			if (!viewChange.limboChanges().isEmpty()) {
				throw new AssertionError("Online state should not affect limbo documents");
			}
			if (viewChange.snapshot() != null) {
				newViewSnapshots.add(viewChange.snapshot());
			}
		}
		callback.onViewSnapshots(newViewSnapshots);
		callback.handleOnlineStateChange(onlineState);
	}

	@Override
	public Set<DocumentKey> getRemoteKeysForTarget(int targetId) {
		LimboResolution limboResolution = activeLimboResolutionsByTarget.get(targetId);
		if (limboResolution != null && limboResolution.receivedDocument) {
			return Set.of(limboResolution.key);
		}
		Set<DocumentKey> remoteKeys = new TreeSet<>();
		List<Query> queries = queriesByTarget.get(targetId);
		if (queries != null) {
			for (Query query: queries) {
				QueryView queryView = queryViewsByQuery.get(query);
				if (queryView != null) {
					remoteKeys.addAll(queryView.view().syncedDocuments());
				}
			}
		}
		return remoteKeys;
	}

	@Override
	public void handleRejectedListen(int targetId, Status error) {
		callback("handleRejectedListen");

		LimboResolution limboResolution = activeLimboResolutionsByTarget.get(targetId);
		if (limboResolution != null) {
			DocumentKey limboKey = limboResolution.key;
			activeLimboTargetsByKey.remove(limboKey);
			activeLimboResolutionsByTarget.remove(targetId);
			pumpEnqueuedLimboResolutions();

			// The server won't tell us about the document, so treat it as deleted
			LOGGER.debug("Limbo resolution for {} rejected ({}); treating it as deleted", limboKey, error);
			RemoteEvent event = new RemoteEvent(
				SnapshotVersion.NONE,
				Map.of(),
				Map.of(),
				Map.of(limboKey, Document.noDocument(limboKey, SnapshotVersion.NONE)),
				Set.of(limboKey));
			handleRemoteEvent(event);
		} else {
			localStore.releaseTarget(targetId);
			removeAndCleanupTarget(targetId, error);
		}
	}

	@Override
	public void handleSuccessfulWrite(MutationBatchResult mutationBatchResult) {
		callback("handleSuccessfulWrite");

		// User callbacks come before the events the acknowledgement may raise
		int batchId = mutationBatchResult.batch().batchId();
		notifyUser(batchId, null);
		resolvePendingWriteTasks(batchId);

		SortedMap<DocumentKey, Document> changes = localStore.acknowledgeBatch(mutationBatchResult);
		emitNewSnapsAndNotifyLocalStore(changes, null);
	}

	@Override
	public void handleRejectedWrite(int batchId, Status status) {
		callback("handleRejectedWrite");
		SortedMap<DocumentKey, Document> changes = localStore.rejectBatch(batchId);

		if (!changes.isEmpty()) {
			logErrorIfInteresting(status, "Write failed at " + changes.firstKey());
		}

		notifyUser(batchId, status);
		resolvePendingWriteTasks(batchId);
		emitNewSnapsAndNotifyLocalStore(changes, null);
	}

	/**
	 * Completes the task when every batch pending at this moment has been acknowledged or rejected.
	 */
	public void registerPendingWritesTask(CompletableFuture<Void> userTask) {
		if (!remoteStore.canUseNetwork()) {
			LOGGER.debug("The network is disabled. Pending writes will not complete until it's enabled");
		}

		int largestPendingBatchId = localStore.getHighestUnacknowledgedBatchId();
		if (largestPendingBatchId == MutationBatch.UNKNOWN) {
			userTask.complete(null);
			return;
		}
		pendingWritesCallbacks.computeIfAbsent(largestPendingBatchId, id -> new ArrayList<>()).add(userTask);
	}

	private void resolvePendingWriteTasks(int batchId) {
		List<CompletableFuture<Void>> tasks = pendingWritesCallbacks.remove(batchId);
		if (tasks != null) {
			for (CompletableFuture<Void> task: tasks) {
				task.complete(null);
			}
		}
	}

	private void failOutstandingPendingWritesAwaitingTasks() {
		for (List<CompletableFuture<Void>> tasks: pendingWritesCallbacks.values()) {
			for (CompletableFuture<Void> task: tasks) {
				task.completeExceptionally(new DriftException("Waiting for pending writes was cancelled by a user change", Code.CANCELLED));
			}
		}
		pendingWritesCallbacks.clear();
	}

	private void notifyUser(int batchId, @Nullable Status status) {
		Map<Integer, CompletableFuture<Void>> userTasks = mutationUserCallbacks.get(currentUser);
		if (userTasks != null) {
			CompletableFuture<Void> userTask = userTasks.remove(batchId);
			if (userTask != null) {
				if (status != null) {
					userTask.completeExceptionally(status.asException());
				} else {
					userTask.complete(null);
				}
			}
		}
	}

	private void removeAndCleanupTarget(int targetId, Status status) {
		SyncEngineCallback callback = callback("removeAndCleanupTarget");
		for (Query query: queriesByTarget.get(targetId)) {
			queryViewsByQuery.remove(query);
			if (!status.isOk()) {
				callback.onError(query, status);
				logErrorIfInteresting(status, "Listen for " + query + " failed");
			}
		}
		queriesByTarget.remove(targetId);

		Set<DocumentKey> limboKeys = limboDocumentRefs.referencesForId(targetId);
		limboDocumentRefs = limboDocumentRefs.minusAllForId(targetId);
		for (DocumentKey key: limboKeys) {
			if (!limboDocumentRefs.containsKey(key)) {
				removeLimboTarget(key);
			}
		}
	}

	private void removeLimboTarget(DocumentKey key) {
		enqueuedLimboResolutions.remove(key);
		// The target is already gone if its listen was rejected
		Integer targetId = activeLimboTargetsByKey.remove(key);
		if (targetId != null) {
			remoteStore.stopListening(targetId);
			activeLimboResolutionsByTarget.remove(targetId);
			pumpEnqueuedLimboResolutions();
		}
	}

	/**
	 * Feeds changed documents to every view, raises the resulting snapshots,
	 * and tells the local store which documents the views now show.
	 */
	private void emitNewSnapsAndNotifyLocalStore(Map<DocumentKey, Document> changes, @Nullable RemoteEvent remoteEvent) {
		List<ViewSnapshot> newSnapshots = new ArrayList<>();
		List<LocalViewChanges> documentChangesInAllViews = new ArrayList<>();

		for (QueryView queryView: queryViewsByQuery.values()) {
			View view = queryView.view();
			View.DocumentChanges viewDocChanges = view.computeDocChanges(changes);
			if (viewDocChanges.needsRefill()) {
				// A limit query lost results; something past the old limit may now belong in it
				QueryResult queryResult = localStore.executeQuery(queryView.query(), false);
				viewDocChanges = view.computeDocChanges(queryResult.documents(), viewDocChanges);
			}

			TargetChange targetChange = (remoteEvent == null) ? null : remoteEvent.targetChanges().get(queryView.targetId());
			boolean targetIsPendingReset = remoteEvent != null && remoteEvent.targetMismatches().containsKey(queryView.targetId());
			ViewChange viewChange = view.applyChanges(viewDocChanges, targetChange, targetIsPendingReset);
			updateTrackedLimboDocuments(viewChange.limboChanges(), queryView.targetId());

			ViewSnapshot snapshot = viewChange.snapshot();
			if (snapshot != null) {
				newSnapshots.add(snapshot);
				documentChangesInAllViews.add(LocalViewChanges.fromViewSnapshot(queryView.targetId(), snapshot));
			}
		}

		callback("emitNewSnapsAndNotifyLocalStore").onViewSnapshots(newSnapshots);
		localStore.notifyLocalViewChanges(documentChangesInAllViews);
	}

	private void updateTrackedLimboDocuments(List<LimboDocumentChange> limboChanges, int targetId) {
		for (LimboDocumentChange limboChange: limboChanges) {
			DocumentKey key = limboChange.key();
			switch (limboChange.type()) {
				case ADDED:
					limboDocumentRefs = limboDocumentRefs.plus(key, targetId);
					trackLimboChange(key);
					break;
				case REMOVED:
					LOGGER.debug("Document no longer in limbo: {}", key);
					limboDocumentRefs = limboDocumentRefs.minus(key, targetId);
					if (!limboDocumentRefs.containsKey(key)) {
						removeLimboTarget(key);
					}
					break;
				default:
					throw new AssertionError("Unknown limbo change type: " + limboChange.type());
			}
		}
	}

	private void trackLimboChange(DocumentKey key) {
		if (!activeLimboTargetsByKey.containsKey(key) && !enqueuedLimboResolutions.contains(key)) {
			LOGGER.debug("New document in limbo: {}", key);
			enqueuedLimboResolutions.add(key);
			pumpEnqueuedLimboResolutions();
		}
	}

	/**
	 * Starts limbo resolutions from the queue while there's room.
	 */
	private void pumpEnqueuedLimboResolutions() {
		while (!enqueuedLimboResolutions.isEmpty() && activeLimboTargetsByKey.size() < maxConcurrentLimboResolutions) {
			Iterator<DocumentKey> iterator = enqueuedLimboResolutions.iterator();
			DocumentKey key = iterator.next();
			iterator.remove();

			int limboTargetId = targetIdGenerator.nextId();
			activeLimboResolutionsByTarget.put(limboTargetId, new LimboResolution(key));
			activeLimboTargetsByKey.put(key, limboTargetId);
			remoteStore.listen(new TargetData(
				Query.atPath(key.path()).toTarget(),
				limboTargetId,
				ListenSequence.INVALID,
				QueryPurpose.LIMBO_RESOLUTION));
		}
	}

	/**
	 * Switches to another user's mutation queue, recomputes every view, and restarts the streams.
	 */
	public void handleCredentialChange(User user) {
		boolean userChanged = !currentUser.equals(user);
		currentUser = user;

		if (userChanged) {
			LOGGER.info("User changed to {}", user.isAuthenticated() ? user.uid() : "(anonymous)");
			failOutstandingPendingWritesAwaitingTasks();
			SortedMap<DocumentKey, Document> changes = localStore.handleUserChange(user);
			emitNewSnapsAndNotifyLocalStore(changes, null);
		}

		remoteStore.handleCredentialChange();
	}

	Map<DocumentKey, Integer> activeLimboDocumentResolutions() {
		return Map.copyOf(activeLimboTargetsByKey);
	}

	List<DocumentKey> enqueuedLimboDocumentResolutions() {
		return new ArrayList<>(enqueuedLimboResolutions);
	}

	private void logErrorIfInteresting(Status error, String context) {
		if (errorIsInteresting(error)) {
			LOGGER.warn("{}: {}", context, error);
		}
	}

	/**
	 * Errors that may need the developer's attention, as opposed to the usual offline and transient failures.
	 */
	private boolean errorIsInteresting(Status error) {
		String description = error.description() != null ? error.description() : "";
		return error.code() == Code.PERMISSION_DENIED
			|| (error.code() == Code.FAILED_PRECONDITION && description.contains("requires an index"));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SyncEngine.class);
}

package io.vena.drift.core;

import io.vena.drift.exceptions.DriftException;
import org.jetbrains.annotations.Nullable;

/**
 * One application listener on a query. Decides which of the query's view snapshots to pass on.
 *
 * <p>
 * The first snapshot is held back while it's from cache and we might be online, unless it has
 * something to show: the server's answer is likely moments away.
 */
public class QueryListener {
	private final Query query;
	private final ListenOptions options;
	private final EventListener<ViewSnapshot> listener;

	private boolean raisedInitialEvent = false;
	private OnlineState onlineState = OnlineState.UNKNOWN;
	private @Nullable ViewSnapshot snapshot;

	public QueryListener(Query query, ListenOptions options, EventListener<ViewSnapshot> listener) {
		this.query = query;
		this.options = options;
		this.listener = listener;
	}

	public Query query() {
		return query;
	}

	/**
	 * @return whether an event was raised
	 */
	public boolean onViewSnapshot(ViewSnapshot newSnapshot) {
		if (newSnapshot.changes().isEmpty() && !newSnapshot.didSyncStateChange()) {
			throw new AssertionError("We got a new snapshot with no changes");
		}

		if (!options.includeDocumentMetadataChanges()) {
			newSnapshot = newSnapshot.withoutMetadataChanges();
		}

		boolean raisedEvent = false;
		if (!raisedInitialEvent) {
			if (shouldRaiseInitialEvent(newSnapshot, onlineState)) {
				raiseInitialEvent(newSnapshot);
				raisedEvent = true;
			}
		} else if (shouldRaiseEvent(newSnapshot)) {
			listener.onEvent(newSnapshot, null);
			raisedEvent = true;
		}

		this.snapshot = newSnapshot;
		return raisedEvent;
	}

	public void onError(DriftException error) {
		listener.onEvent(null, error);
	}

	/**
	 * Going offline may release a held-back initial snapshot.
	 *
	 * @return whether an event was raised
	 */
	public boolean onOnlineStateChanged(OnlineState onlineState) {
		this.onlineState = onlineState;
		if (snapshot != null && !raisedInitialEvent && shouldRaiseInitialEvent(snapshot, onlineState)) {
			raiseInitialEvent(snapshot);
			return true;
		}
		return false;
	}

	private boolean shouldRaiseInitialEvent(ViewSnapshot snapshot, OnlineState onlineState) {
		if (!snapshot.fromCache()) {
			return true;
		}

		// UNKNOWN counts as online, since it should soon become one or the other
		boolean maybeOnline = onlineState != OnlineState.OFFLINE;
		if (options.waitForSyncWhenOnline() && maybeOnline) {
			return false;
		}

		return !snapshot.documents().isEmpty() || snapshot.hasCachedResults() || onlineState == OnlineState.OFFLINE;
	}

	private boolean shouldRaiseEvent(ViewSnapshot snapshot) {
		// Metadata-only document changes were already stripped if unwanted
		if (!snapshot.changes().isEmpty()) {
			return true;
		}

		boolean hasPendingWritesChanged = this.snapshot != null && this.snapshot.hasPendingWrites() != snapshot.hasPendingWrites();
		if (snapshot.didSyncStateChange() || hasPendingWritesChanged) {
			return options.includeQueryMetadataChanges();
		}

		return false;
	}

	private void raiseInitialEvent(ViewSnapshot snapshot) {
		if (raisedInitialEvent) {
			throw new AssertionError("Trying to raise initial event for second time");
		}
		ViewSnapshot initial = ViewSnapshot.fromInitialDocuments(
			snapshot.query(),
			snapshot.documents(),
			snapshot.mutatedKeys(),
			snapshot.fromCache(),
			snapshot.excludesMetadataChanges(),
			snapshot.hasCachedResults());
		raisedInitialEvent = true;
		listener.onEvent(initial, null);
	}
}

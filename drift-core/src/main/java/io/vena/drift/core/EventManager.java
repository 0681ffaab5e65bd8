package io.vena.drift.core;

import io.vena.drift.remote.Status;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Shares one sync engine listen among all the application listeners on the same query,
 * and routes snapshots, errors and online state changes to them.
 */
public class EventManager implements SyncEngine.SyncEngineCallback {
	private static final class QueryListenersInfo {
		private final List<QueryListener> listeners = new ArrayList<>();
		private @Nullable ViewSnapshot viewSnapshot;
		private int targetId;
	}

	private final SyncEngine syncEngine;
	private final Map<Query, QueryListenersInfo> queries = new HashMap<>();
	private final Set<EventListener<Void>> snapshotsInSyncListeners = new LinkedHashSet<>();
	private OnlineState onlineState = OnlineState.UNKNOWN;

	public EventManager(SyncEngine syncEngine) {
		this.syncEngine = syncEngine;
		syncEngine.setCallback(this);
	}

	/**
	 * @return the target id of the query
	 */
	public int addQueryListener(QueryListener queryListener) {
		Query query = queryListener.query();
		QueryListenersInfo queryInfo = queries.get(query);
		boolean firstListen = queryInfo == null;
		if (firstListen) {
			queryInfo = new QueryListenersInfo();
			queries.put(query, queryInfo);
		}
		queryInfo.listeners.add(queryListener);

		if (queryListener.onOnlineStateChanged(onlineState)) {
			throw new AssertionError("onOnlineStateChanged shouldn't raise an event for brand-new listeners");
		}

		// A later listener on a shared query starts from the latest snapshot
		if (queryInfo.viewSnapshot != null) {
			if (queryListener.onViewSnapshot(queryInfo.viewSnapshot)) {
				raiseSnapshotsInSyncEvent();
			}
		}

		if (firstListen) {
			queryInfo.targetId = syncEngine.listen(query);
		}
		return queryInfo.targetId;
	}

	public void removeQueryListener(QueryListener listener) {
		Query query = listener.query();
		QueryListenersInfo queryInfo = queries.get(query);
		if (queryInfo == null) {
			// Already removed by an error
			return;
		}
		queryInfo.listeners.remove(listener);
		if (queryInfo.listeners.isEmpty()) {
			queries.remove(query);
			syncEngine.stopListening(query);
		}
	}

	/**
	 * Registers a listener called whenever every listener has seen a snapshot from the same
	 * consistent state. Called once promptly.
	 */
	public void addSnapshotsInSyncListener(EventListener<Void> listener) {
		snapshotsInSyncListeners.add(listener);
		listener.onEvent(null, null);
	}

	public void removeSnapshotsInSyncListener(EventListener<Void> listener) {
		snapshotsInSyncListeners.remove(listener);
	}

	@Override
	public void onViewSnapshots(List<ViewSnapshot> snapshots) {
		boolean raisedEvent = false;
		for (ViewSnapshot viewSnapshot: snapshots) {
			QueryListenersInfo info = queries.get(viewSnapshot.query());
			if (info != null) {
				for (QueryListener listener: info.listeners) {
					if (listener.onViewSnapshot(viewSnapshot)) {
						raisedEvent = true;
					}
				}
				info.viewSnapshot = viewSnapshot;
			}
		}
		if (raisedEvent) {
			raiseSnapshotsInSyncEvent();
		}
	}

	@Override
	public void onError(Query query, Status error) {
		QueryListenersInfo info = queries.remove(query);
		if (info != null) {
			for (QueryListener listener: info.listeners) {
				listener.onError(error.asException());
			}
		}
	}

	@Override
	public void handleOnlineStateChange(OnlineState onlineState) {
		this.onlineState = onlineState;
		boolean raisedEvent = false;
		for (QueryListenersInfo info: queries.values()) {
			for (QueryListener listener: info.listeners) {
				if (listener.onOnlineStateChanged(onlineState)) {
					raisedEvent = true;
				}
			}
		}
		if (raisedEvent) {
			raiseSnapshotsInSyncEvent();
		}
	}

	private void raiseSnapshotsInSyncEvent() {
		for (EventListener<Void> listener: snapshotsInSyncListeners) {
			listener.onEvent(null, null);
		}
	}
}

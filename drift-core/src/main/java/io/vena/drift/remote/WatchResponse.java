package io.vena.drift.remote;

import io.vena.drift.model.SnapshotVersion;
import lombok.Value;

/**
 * One message on the watch stream.
 */
@Value
public class WatchResponse {
	WatchChange change;

	/**
	 * Set only on a {@link WatchChange.WatchTargetChange} with no target ids, meaning the server
	 * is consistent across all targets as of this version. {@link SnapshotVersion#NONE} otherwise.
	 */
	SnapshotVersion snapshotVersion;

	public WatchResponse(WatchChange change) {
		this(change, SnapshotVersion.NONE);
	}

	public WatchResponse(WatchChange change, SnapshotVersion snapshotVersion) {
		this.change = change;
		this.snapshotVersion = snapshotVersion;
	}
}

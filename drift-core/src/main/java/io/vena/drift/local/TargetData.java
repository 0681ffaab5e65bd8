package io.vena.drift.local;

import io.vena.drift.core.Target;
import io.vena.drift.model.SnapshotVersion;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.With;
import org.jetbrains.annotations.Nullable;

/**
 * Everything the client tracks about one target, persisted in the {@link TargetCache}.
 */
@Value
@With
@AllArgsConstructor
public class TargetData {
	Target target;
	int targetId;

	/**
	 * When this target was last used; the LRU garbage collector evicts low numbers first.
	 */
	long sequenceNumber;

	QueryPurpose purpose;

	/**
	 * The version at which the server last sent a consistent snapshot for this target.
	 */
	SnapshotVersion snapshotVersion;

	/**
	 * The version of the last snapshot in which no documents were in limbo,
	 * used to re-run the query from cached results.
	 */
	SnapshotVersion lastLimboFreeSnapshotVersion;

	/**
	 * Opaque server token for resuming the listen; empty if there isn't one.
	 */
	String resumeToken;

	/**
	 * How many documents the target had at {@link #resumeToken}, sent along with a
	 * resumed listen so the server can tell whether an existence filter is needed.
	 */
	@Nullable Integer expectedCount;

	public TargetData(Target target, int targetId, long sequenceNumber, QueryPurpose purpose) {
		this(target, targetId, sequenceNumber, purpose, SnapshotVersion.NONE, SnapshotVersion.NONE, "", null);
	}

	/**
	 * A new resume token invalidates any previous {@link #expectedCount}.
	 */
	public TargetData withResumeToken(String resumeToken, SnapshotVersion snapshotVersion) {
		return new TargetData(target, targetId, sequenceNumber, purpose, snapshotVersion, lastLimboFreeSnapshotVersion, resumeToken, null);
	}
}

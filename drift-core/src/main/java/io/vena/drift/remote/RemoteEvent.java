package io.vena.drift.remote;

import io.vena.drift.local.QueryPurpose;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.SnapshotVersion;
import java.util.Map;
import java.util.Set;
import lombok.Value;

/**
 * A consistent batch of changes from the watch stream, as of one snapshot version.
 */
@Value
public class RemoteEvent {
	SnapshotVersion snapshotVersion;
	Map<Integer, TargetChange> targetChanges;

	/**
	 * Targets whose existence filter didn't match, and which must be re-listened with the given purpose.
	 */
	Map<Integer, QueryPurpose> targetMismatches;

	Map<DocumentKey, Document> documentUpdates;

	/**
	 * Documents that are now known to be consistent with the server,
	 * because every target they belong to is current.
	 */
	Set<DocumentKey> resolvedLimboDocuments;

	/**
	 * An event that changes nothing but the given target's currency and resume token.
	 */
	public static RemoteEvent createSynthesizedRemoteEventForCurrentChange(int targetId, boolean current, String resumeToken) {
		return new RemoteEvent(
			SnapshotVersion.NONE,
			Map.of(targetId, TargetChange.createSynthesizedTargetChangeForCurrentChange(current, resumeToken)),
			Map.of(),
			Map.of(),
			Set.of());
	}
}

package io.vena.drift.local;

import io.vena.drift.core.Target;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.SnapshotVersion;
import java.util.Set;
import java.util.function.Consumer;
import org.jetbrains.annotations.Nullable;

/**
 * Bookkeeping for every target the client has listened to, and the documents each one matched.
 */
public interface TargetCache {
	int getHighestTargetId();

	long getHighestListenSequenceNumber();

	long getTargetCount();

	void forEachTarget(Consumer<TargetData> consumer);

	/**
	 * The snapshot version of the most recent remote event applied to the cache.
	 */
	SnapshotVersion getLastRemoteSnapshotVersion();

	void setLastRemoteSnapshotVersion(SnapshotVersion snapshotVersion);

	/**
	 * Throws {@link AssertionError} if the target is already present.
	 */
	void addTargetData(TargetData targetData);

	void updateTargetData(TargetData targetData);

	void removeTargetData(TargetData targetData);

	/**
	 * Removes targets with sequence number at or below <code>upperBound</code>,
	 * except those in <code>activeTargetIds</code>, along with their document associations.
	 *
	 * @return the number of targets removed
	 */
	int removeQueries(long upperBound, Set<Integer> activeTargetIds);

	@Nullable TargetData getTargetData(Target target);

	void addMatchingKeys(Set<DocumentKey> keys, int targetId);

	void removeMatchingKeys(Set<DocumentKey> keys, int targetId);

	void removeMatchingKeysForTargetId(int targetId);

	Set<DocumentKey> getMatchingKeysForTargetId(int targetId);

	boolean containsKey(DocumentKey key);
}

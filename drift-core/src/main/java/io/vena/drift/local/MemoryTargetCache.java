package io.vena.drift.local;

import io.vena.drift.core.Target;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.SnapshotVersion;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import lombok.Value;
import lombok.With;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

final class MemoryTargetCache implements TargetCache {
	private final MemoryPersistence persistence;
	private State state = State.EMPTY;

	@Value
	@With
	static class State {
		static final State EMPTY = new State(HashTreePMap.empty(), ReferenceSet.empty(), 0, 0, SnapshotVersion.NONE);

		PMap<Target, TargetData> targets;
		ReferenceSet references;
		int highestTargetId;
		long highestSequenceNumber;
		SnapshotVersion lastRemoteSnapshotVersion;
	}

	MemoryTargetCache(MemoryPersistence persistence) {
		this.persistence = persistence;
	}

	State state() {
		return state;
	}

	void restoreState(State state) {
		this.state = state;
	}

	Checkpoint<State> checkpoint() {
		return new Checkpoint<>(state, () -> state, s -> state = s);
	}

	@Override
	public int getHighestTargetId() {
		return state.highestTargetId;
	}

	@Override
	public long getHighestListenSequenceNumber() {
		return state.highestSequenceNumber;
	}

	@Override
	public long getTargetCount() {
		return state.targets.size();
	}

	@Override
	public void forEachTarget(Consumer<TargetData> consumer) {
		for (TargetData targetData: state.targets.values()) {
			consumer.accept(targetData);
		}
	}

	@Override
	public SnapshotVersion getLastRemoteSnapshotVersion() {
		return state.lastRemoteSnapshotVersion;
	}

	@Override
	public void setLastRemoteSnapshotVersion(SnapshotVersion snapshotVersion) {
		state = state.withLastRemoteSnapshotVersion(snapshotVersion);
	}

	@Override
	public void addTargetData(TargetData targetData) {
		if (state.targets.containsKey(targetData.target())) {
			throw new AssertionError("Target already present: " + targetData.target());
		}
		putTargetData(targetData);
	}

	@Override
	public void updateTargetData(TargetData targetData) {
		putTargetData(targetData);
	}

	private void putTargetData(TargetData targetData) {
		state = state
			.withTargets(state.targets.plus(targetData.target(), targetData))
			.withHighestTargetId(Math.max(state.highestTargetId, targetData.targetId()))
			.withHighestSequenceNumber(Math.max(state.highestSequenceNumber, targetData.sequenceNumber()));
	}

	@Override
	public void removeTargetData(TargetData targetData) {
		state = state.withTargets(state.targets.minus(targetData.target()));
		removeMatchingKeysForTargetId(targetData.targetId());
	}

	@Override
	public int removeQueries(long upperBound, Set<Integer> activeTargetIds) {
		int removed = 0;
		List<TargetData> candidates = new ArrayList<>(state.targets.values());
		for (TargetData targetData: candidates) {
			if (targetData.sequenceNumber() <= upperBound && !activeTargetIds.contains(targetData.targetId())) {
				removeTargetData(targetData);
				removed++;
			}
		}
		return removed;
	}

	@Override
	public @Nullable TargetData getTargetData(Target target) {
		return state.targets.get(target);
	}

	@Override
	public void addMatchingKeys(Set<DocumentKey> keys, int targetId) {
		state = state.withReferences(state.references.plusAll(keys, targetId));
		ReferenceDelegate referenceDelegate = persistence.getReferenceDelegate();
		for (DocumentKey key: keys) {
			referenceDelegate.addReference(key);
		}
	}

	@Override
	public void removeMatchingKeys(Set<DocumentKey> keys, int targetId) {
		state = state.withReferences(state.references.minusAll(keys, targetId));
		ReferenceDelegate referenceDelegate = persistence.getReferenceDelegate();
		for (DocumentKey key: keys) {
			referenceDelegate.removeReference(key);
		}
	}

	@Override
	public void removeMatchingKeysForTargetId(int targetId) {
		state = state.withReferences(state.references.minusAllForId(targetId));
	}

	@Override
	public Set<DocumentKey> getMatchingKeysForTargetId(int targetId) {
		return state.references.referencesForId(targetId);
	}

	@Override
	public boolean containsKey(DocumentKey key) {
		return state.references.containsKey(key);
	}

	long getByteSize() {
		long result = 0;
		for (TargetData targetData: state.targets.values()) {
			result += ByteSizes.of(targetData);
		}
		return result;
	}

	Map<Target, TargetData> targets() {
		return state.targets;
	}
}

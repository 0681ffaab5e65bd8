package io.vena.drift.local;

import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.ResourcePath;
import io.vena.drift.model.mutation.Mutation;
import io.vena.drift.model.mutation.Overlay;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import lombok.Value;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.HashTreePSet;
import org.pcollections.PMap;
import org.pcollections.PSet;
import org.pcollections.PSortedMap;
import org.pcollections.TreePMap;

final class MemoryDocumentOverlayCache implements DocumentOverlayCache {
	private State state = State.EMPTY;

	@Value
	static class State {
		static final State EMPTY = new State(TreePMap.empty(), HashTreePMap.empty());

		PSortedMap<DocumentKey, Overlay> overlays;
		PMap<Integer, PSet<DocumentKey>> overlayByBatchId;

		static State restore(Iterable<Overlay> overlays) {
			State result = EMPTY;
			for (Overlay overlay: overlays) {
				result = result.plus(overlay);
			}
			return result;
		}

		State plus(Overlay overlay) {
			State base = minus(overlay.key());
			PSet<DocumentKey> keys = base.overlayByBatchId.getOrDefault(overlay.largestBatchId(), HashTreePSet.empty());
			return new State(
				base.overlays.plus(overlay.key(), overlay),
				base.overlayByBatchId.plus(overlay.largestBatchId(), keys.plus(overlay.key())));
		}

		State minus(DocumentKey key) {
			Overlay existing = overlays.get(key);
			if (existing == null) {
				return this;
			}
			PSet<DocumentKey> keys = overlayByBatchId.get(existing.largestBatchId()).minus(key);
			PMap<Integer, PSet<DocumentKey>> byBatch = keys.isEmpty()
				? overlayByBatchId.minus(existing.largestBatchId())
				: overlayByBatchId.plus(existing.largestBatchId(), keys);
			return new State(overlays.minus(key), byBatch);
		}
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
	public @Nullable Overlay getOverlay(DocumentKey key) {
		return state.overlays.get(key);
	}

	@Override
	public Map<DocumentKey, Overlay> getOverlays(SortedSet<DocumentKey> keys) {
		Map<DocumentKey, Overlay> result = new HashMap<>();
		for (DocumentKey key: keys) {
			Overlay overlay = state.overlays.get(key);
			if (overlay != null) {
				result.put(key, overlay);
			}
		}
		return result;
	}

	@Override
	public void saveOverlays(int largestBatchId, Map<DocumentKey, Mutation> overlays) {
		State newState = state;
		for (Map.Entry<DocumentKey, Mutation> entry: overlays.entrySet()) {
			if (entry.getValue() == null) {
				continue;
			}
			if (!entry.getValue().key().equals(entry.getKey())) {
				throw new AssertionError("Overlay for " + entry.getKey() + " has mutation for " + entry.getValue().key());
			}
			newState = newState.plus(new Overlay(largestBatchId, entry.getValue()));
		}
		state = newState;
	}

	@Override
	public void removeOverlaysForBatchId(int batchId) {
		PSet<DocumentKey> keys = state.overlayByBatchId.get(batchId);
		if (keys == null) {
			return;
		}
		State newState = state;
		for (DocumentKey key: keys) {
			newState = newState.minus(key);
		}
		state = newState;
	}

	@Override
	public Map<DocumentKey, Overlay> getOverlays(ResourcePath collection, int sinceBatchId) {
		Map<DocumentKey, Overlay> result = new HashMap<>();
		int immediateChildrenPathLength = collection.length() + 1;
		for (Overlay overlay: state.overlays.values()) {
			ResourcePath path = overlay.key().path();
			if (!collection.isPrefixOf(path) || path.length() != immediateChildrenPathLength) {
				continue;
			}
			if (overlay.largestBatchId() > sinceBatchId) {
				result.put(overlay.key(), overlay);
			}
		}
		return result;
	}

	@Override
	public Map<DocumentKey, Overlay> getOverlays(String collectionGroup, int sinceBatchId, int count) {
		SortedMap<Integer, Map<DocumentKey, Overlay>> batchIdToOverlays = new TreeMap<>();
		for (Overlay overlay: state.overlays.values()) {
			if (!overlay.key().hasCollectionId(collectionGroup)) {
				continue;
			}
			if (overlay.largestBatchId() > sinceBatchId) {
				batchIdToOverlays
					.computeIfAbsent(overlay.largestBatchId(), __ -> new HashMap<>())
					.put(overlay.key(), overlay);
			}
		}

		// Whole batches only, so a caller resuming from the last batch id doesn't miss anything
		Map<DocumentKey, Overlay> result = new HashMap<>();
		for (Map<DocumentKey, Overlay> overlays: batchIdToOverlays.values()) {
			result.putAll(overlays);
			if (result.size() >= count) {
				break;
			}
		}
		return result;
	}

	List<Overlay> allOverlays() {
		return new ArrayList<>(state.overlays.values());
	}
}

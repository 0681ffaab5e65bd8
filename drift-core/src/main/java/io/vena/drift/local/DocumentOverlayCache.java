package io.vena.drift.local;

import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.ResourcePath;
import io.vena.drift.model.mutation.Mutation;
import io.vena.drift.model.mutation.Overlay;
import java.util.Map;
import java.util.SortedSet;
import org.jetbrains.annotations.Nullable;

/**
 * One user's saved overlays: for each document with pending writes, the single
 * mutation equivalent to all of them.
 */
public interface DocumentOverlayCache {
	@Nullable Overlay getOverlay(DocumentKey key);

	/**
	 * Keys with no overlay are omitted from the result.
	 */
	Map<DocumentKey, Overlay> getOverlays(SortedSet<DocumentKey> keys);

	/**
	 * Replaces the overlays for the given keys, each recorded as produced by <code>largestBatchId</code>.
	 */
	void saveOverlays(int largestBatchId, Map<DocumentKey, Mutation> overlays);

	void removeOverlaysForBatchId(int batchId);

	/**
	 * @return overlays for documents immediately within <code>collection</code> whose largest batch id exceeds <code>sinceBatchId</code>
	 */
	Map<DocumentKey, Overlay> getOverlays(ResourcePath collection, int sinceBatchId);

	/**
	 * @return overlays in the collection group with largest batch id exceeding <code>sinceBatchId</code>,
	 * in batch id order, stopping after the batch that reaches <code>count</code>
	 */
	Map<DocumentKey, Overlay> getOverlays(String collectionGroup, int sinceBatchId, int count);
}

package io.vena.drift.model.mutation;

import io.vena.drift.model.DocumentKey;
import lombok.Value;

/**
 * The combined effect of all pending batches on one document, stored so reads
 * don't have to replay the mutation queue.
 *
 * @see Mutation#calculateOverlayMutation
 */
@Value
public class Overlay {
	/**
	 * The highest batch that contributed to this overlay.
	 */
	int largestBatchId;
	Mutation mutation;

	public DocumentKey key() {
		return mutation.key();
	}
}

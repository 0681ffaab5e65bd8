package io.vena.drift.local;

/**
 * Why a target is being listened to.
 */
public enum QueryPurpose {
	/** A regular listen on behalf of an application listener. */
	LISTEN,

	/** Re-listening after an existence filter mismatch, without a bloom filter to narrow it down. */
	EXISTENCE_FILTER_MISMATCH,

	/** Re-listening after an existence filter mismatch that a bloom filter couldn't reconcile. */
	EXISTENCE_FILTER_MISMATCH_BLOOM,

	/** A single-document listen to learn the true state of a limbo document. */
	LIMBO_RESOLUTION,
}

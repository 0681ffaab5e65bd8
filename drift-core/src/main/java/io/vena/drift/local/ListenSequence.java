package io.vena.drift.local;

/**
 * Hands out the sequence numbers that order target and document usage for LRU collection.
 */
public final class ListenSequence {
	public static final long INVALID = -1;

	private long previousSequenceNumber;

	public ListenSequence(long startAfter) {
		this.previousSequenceNumber = startAfter;
	}

	public long next() {
		return ++previousSequenceNumber;
	}
}

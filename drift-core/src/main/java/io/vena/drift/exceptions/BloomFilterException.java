package io.vena.drift.exceptions;

/**
 * The parameters of an existence filter's bloom filter are inconsistent,
 * so the filter can't be used to reconcile a target's key set.
 */
public class BloomFilterException extends Exception {
	public BloomFilterException(String message) {
		super(message);
	}
}

package io.vena.drift.remote;

import lombok.Value;
import org.jetbrains.annotations.Nullable;

@Value
public class ExistenceFilter {
	/**
	 * How many documents the server has in the target.
	 */
	int count;

	/**
	 * Names of the documents the server has in the target, if it chose to send them.
	 */
	@Nullable BloomFilterBits unchangedNames;

	public ExistenceFilter(int count) {
		this(count, null);
	}

	public ExistenceFilter(int count, @Nullable BloomFilterBits unchangedNames) {
		this.count = count;
		this.unchangedNames = unchangedNames;
	}

	/**
	 * The raw parameters of a {@link BloomFilter}, as sent by the server and not yet validated.
	 */
	@Value
	public static class BloomFilterBits {
		byte[] bitmap;
		int padding;
		int hashCount;
	}
}

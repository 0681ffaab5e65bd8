package io.vena.drift.remote;

import io.vena.drift.exceptions.BloomFilterException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * A bloom filter over document names, as computed by the server.
 *
 * <p>
 * A value is hashed with MD5; the two halves of the digest, read as little-endian longs
 * <code>h1</code> and <code>h2</code>, give bit positions <code>(h1 + i*h2) mod bitCount</code>
 * (unsigned) for <code>i</code> from zero to <code>hashCount - 1</code>.
 * Bits are numbered from the least significant bit of each byte.
 */
public final class BloomFilter {
	private final byte[] bitmap;
	private final int hashCount;
	private final int bitCount;
	private final MessageDigest md5;

	/**
	 * @param padding how many of the high-order bits in the last byte of <code>bitmap</code> are unused
	 */
	public BloomFilter(byte[] bitmap, int padding, int hashCount) throws BloomFilterException {
		if (padding < 0 || padding >= 8) {
			throw new BloomFilterException("Invalid padding: " + padding);
		}
		if (hashCount < 0) {
			throw new BloomFilterException("Invalid hash count: " + hashCount);
		}
		if (bitmap.length > 0 && hashCount == 0) {
			throw new BloomFilterException("Invalid hash count: " + hashCount);
		}
		if (bitmap.length == 0 && padding != 0) {
			throw new BloomFilterException("Expected padding of 0 when bitmap length is 0, but got " + padding);
		}
		this.bitmap = bitmap.clone();
		this.hashCount = hashCount;
		this.bitCount = bitmap.length * 8 - padding;
		try {
			this.md5 = MessageDigest.getInstance("MD5");
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("MD5 is required by every Java platform", e);
		}
	}

	public static BloomFilter create(ExistenceFilter.BloomFilterBits bits) throws BloomFilterException {
		return new BloomFilter(bits.bitmap(), bits.padding(), bits.hashCount());
	}

	public int bitCount() {
		return bitCount;
	}

	/**
	 * @return false if <code>value</code> is definitely not in the set; true if it might be
	 */
	public boolean mightContain(String value) {
		if (bitCount == 0) {
			return false;
		}
		byte[] digest = md5.digest(value.getBytes(StandardCharsets.UTF_8));
		ByteBuffer buffer = ByteBuffer.wrap(digest).order(ByteOrder.LITTLE_ENDIAN);
		long hash1 = buffer.getLong(0);
		long hash2 = buffer.getLong(8);
		for (int i = 0; i < hashCount; i++) {
			if (!isBitSet(bitIndex(hash1, hash2, i))) {
				return false;
			}
		}
		return true;
	}

	private int bitIndex(long hash1, long hash2, int hashIndex) {
		long combinedHash = hash1 + (hash2 * hashIndex);
		return (int) Long.remainderUnsigned(combinedHash, bitCount);
	}

	private boolean isBitSet(int index) {
		byte byteAtIndex = bitmap[index / 8];
		int offset = index % 8;
		return (byteAtIndex & (0x01 << offset)) != 0;
	}

	/**
	 * Builds the bits of a filter containing <code>values</code>, the same way the server does.
	 */
	public static ExistenceFilter.BloomFilterBits encode(Iterable<String> values, int bitCount, int hashCount) throws BloomFilterException {
		int byteCount = (bitCount + 7) / 8;
		int padding = byteCount * 8 - bitCount;
		BloomFilter filter = new BloomFilter(new byte[byteCount], padding, hashCount);
		for (String value: values) {
			filter.insert(value);
		}
		return new ExistenceFilter.BloomFilterBits(filter.bitmap, padding, hashCount);
	}

	private void insert(String value) {
		byte[] digest = md5.digest(value.getBytes(StandardCharsets.UTF_8));
		ByteBuffer buffer = ByteBuffer.wrap(digest).order(ByteOrder.LITTLE_ENDIAN);
		long hash1 = buffer.getLong(0);
		long hash2 = buffer.getLong(8);
		for (int i = 0; i < hashCount; i++) {
			int index = bitIndex(hash1, hash2, i);
			bitmap[index / 8] |= (byte) (0x01 << (index % 8));
		}
	}

	@Override
	public String toString() {
		return "BloomFilter{hashCount=" + hashCount + ", bitCount=" + bitCount + "}";
	}
}

package io.vena.drift.remote;

import io.vena.drift.exceptions.BloomFilterException;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BloomFilterTest {
	private static final String PREFIX = "projects/test-project/databases/(default)/documents/coll/doc";

	@Test
	void emptyFilter_containsNothing() throws BloomFilterException {
		BloomFilter filter = new BloomFilter(new byte[0], 0, 0);
		assertEquals(0, filter.bitCount());
		assertFalse(filter.mightContain(""));
		assertFalse(filter.mightContain(PREFIX + "1"));
	}

	@Test
	void bitCount_excludesPadding() throws BloomFilterException {
		assertEquals(8, new BloomFilter(new byte[1], 0, 1).bitCount());
		assertEquals(1, new BloomFilter(new byte[1], 7, 1).bitCount());
		assertEquals(13, new BloomFilter(new byte[2], 3, 1).bitCount());
	}

	@Test
	void invalidParameters_rejected() {
		assertThrows(BloomFilterException.class, () -> new BloomFilter(new byte[1], -1, 1));
		assertThrows(BloomFilterException.class, () -> new BloomFilter(new byte[1], 8, 1));
		assertThrows(BloomFilterException.class, () -> new BloomFilter(new byte[1], 0, -1));
		assertThrows(BloomFilterException.class, () -> new BloomFilter(new byte[1], 0, 0), "Non-empty bitmap needs hashes");
		assertThrows(BloomFilterException.class, () -> new BloomFilter(new byte[0], 1, 0), "Empty bitmap can't be padded");
	}

	@Test
	void allBitsClear_containsNothing() throws BloomFilterException {
		BloomFilter filter = new BloomFilter(new byte[4], 0, 5);
		for (int i = 0; i < 100; i++) {
			assertFalse(filter.mightContain(PREFIX + i));
		}
	}

	@Test
	void allBitsSet_mightContainEverything() throws BloomFilterException {
		byte[] bitmap = {(byte) 0xFF, (byte) 0xFF, (byte) 0x0F};
		BloomFilter filter = new BloomFilter(bitmap, 4, 7);
		for (int i = 0; i < 100; i++) {
			assertTrue(filter.mightContain(PREFIX + i));
		}
	}

	@Test
	void encodedMembers_alwaysMatch() throws BloomFilterException {
		List<String> members = IntStream.range(0, 50)
			.mapToObj(i -> PREFIX + i)
			.collect(Collectors.toList());
		BloomFilter filter = BloomFilter.create(BloomFilter.encode(members, 500, 7));
		for (String member: members) {
			assertTrue(filter.mightContain(member), member);
		}
	}

	@Test
	void sparseFilter_rejectsMostNonMembers() throws BloomFilterException {
		List<String> members = IntStream.range(0, 10)
			.mapToObj(i -> PREFIX + i)
			.collect(Collectors.toList());
		BloomFilter filter = BloomFilter.create(BloomFilter.encode(members, 1000, 7));
		long falsePositives = IntStream.range(1000, 2000)
			.filter(i -> filter.mightContain(PREFIX + i))
			.count();
		assertTrue(falsePositives < 50, "Too many false positives: " + falsePositives);
	}
}

package io.vena.drift.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TargetIdGeneratorTest {
	@Test
	void targetCache_handsOutEvenIds() {
		TargetIdGenerator generator = TargetIdGenerator.forTargetCache(0);
		assertEquals(2, generator.nextId());
		assertEquals(4, generator.nextId());
		assertEquals(6, generator.nextId());
	}

	@Test
	void targetCache_resumesAfterHighestId() {
		assertEquals(10, TargetIdGenerator.forTargetCache(8).nextId());
		assertEquals(10, TargetIdGenerator.forTargetCache(9).nextId());
	}

	@Test
	void syncEngine_handsOutOddIds() {
		TargetIdGenerator generator = TargetIdGenerator.forSyncEngine();
		assertEquals(1, generator.nextId());
		assertEquals(3, generator.nextId());
		assertEquals(5, generator.nextId());
	}
}

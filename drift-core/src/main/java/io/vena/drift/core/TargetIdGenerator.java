package io.vena.drift.core;

/**
 * Hands out target ids from one of two disjoint sequences: even ids for targets
 * the local store persists, and odd ids for the sync engine's limbo resolution targets.
 */
public final class TargetIdGenerator {
	private static final int TARGET_CACHE_ID = 0;
	private static final int SYNC_ENGINE_ID = 1;

	private int nextId;

	private TargetIdGenerator(int generatorId, int after) {
		int candidate = after + 1;
		if (Math.floorMod(candidate, 2) != generatorId) {
			candidate++;
		}
		this.nextId = candidate;
	}

	/**
	 * @param highestTargetId the highest id the target cache has ever handed out
	 */
	public static TargetIdGenerator forTargetCache(int highestTargetId) {
		return new TargetIdGenerator(TARGET_CACHE_ID, highestTargetId);
	}

	public static TargetIdGenerator forSyncEngine() {
		return new TargetIdGenerator(SYNC_ENGINE_ID, 0);
	}

	public int nextId() {
		int result = nextId;
		nextId += 2;
		return result;
	}
}

package io.vena.drift;

import io.vena.drift.local.MemoryPersistence;
import io.vena.drift.local.Persistence;

/**
 * Creates the persistence a {@link DriftClient} stores its local state in.
 * The client starts it, and shuts it down on termination.
 */
@FunctionalInterface
public interface PersistenceFactory {
	Persistence create(DriftSettings settings);

	/**
	 * Nothing survives the client, and garbage collection follows {@link DriftSettings#garbageCollectionMode()}.
	 */
	static PersistenceFactory memory() {
		return settings -> {
			switch (settings.garbageCollectionMode()) {
				case EAGER:
					return MemoryPersistence.createEagerGcMemoryPersistence();
				case LRU:
					return MemoryPersistence.createLruGcMemoryPersistence(settings.gcParams());
				default:
					throw new IllegalArgumentException("Unknown garbage collection mode: " + settings.garbageCollectionMode());
			}
		};
	}
}

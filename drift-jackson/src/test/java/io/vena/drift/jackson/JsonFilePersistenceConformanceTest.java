package io.vena.drift.jackson;

import io.vena.drift.local.LruGarbageCollector;
import io.vena.drift.local.Persistence;
import io.vena.drift.testing.PersistenceConformanceTest;
import java.nio.file.Path;
import org.junit.jupiter.api.io.TempDir;

public class JsonFilePersistenceConformanceTest extends PersistenceConformanceTest {
	@TempDir
	Path directory;

	@Override
	protected Persistence newPersistence() {
		return new JsonFilePersistence(directory, LruGarbageCollector.Params.defaults());
	}

	@Override
	protected boolean isDurable() {
		return true;
	}
}

package io.vena.drift.jackson;

import io.vena.drift.DriftClient;
import io.vena.drift.DriftSettings;
import io.vena.drift.DriftSettings.InitialPersistenceUnavailableMode;
import io.vena.drift.auth.EmptyAttestationProvider;
import io.vena.drift.auth.EmptyCredentialsProvider;
import io.vena.drift.exceptions.PersistenceUnavailableException;
import io.vena.drift.local.MutationQueue;
import io.vena.drift.model.DatabaseId;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.ObjectValue;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.model.User;
import io.vena.drift.model.mutation.Precondition;
import io.vena.drift.model.mutation.SetMutation;
import io.vena.drift.testing.FakeBackend;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static io.vena.drift.jackson.JsonFilePersistence.DATA_FILE_NAME;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JsonFilePersistenceTest {
	@TempDir
	Path directory;

	final DatabaseId databaseId = DatabaseId.forProject("drift-test");
	final DocumentKey key = DocumentKey.of("coll", "a");

	@Test
	void writingTransaction_savesDataFile() throws Exception {
		JsonFilePersistence persistence = new JsonFilePersistence(directory, null);
		persistence.start();
		Path dataFile = directory.resolve(DATA_FILE_NAME);

		persistence.runTransaction("read only", () -> persistence.getRemoteDocumentCache().get(key));
		assertFalse(Files.exists(dataFile), "Nothing changed, so nothing is saved");

		persistence.runTransaction("add", () -> persistence.getRemoteDocumentCache().add(
			Document.found(key, SnapshotVersion.ofMicros(5), ObjectValue.fromMap(Map.of("n", 1))),
			SnapshotVersion.ofMicros(5)));
		assertTrue(Files.exists(dataFile));
		assertTrue(Files.readString(dataFile).contains("coll/a"));
		persistence.shutdown();
	}

	@Test
	void corruptDataFile_isUnavailable() throws Exception {
		Files.writeString(directory.resolve(DATA_FILE_NAME), "{\"formatVersion\": 1, \"mutationQueues\": ");
		JsonFilePersistence persistence = new JsonFilePersistence(directory, null);
		assertThrows(PersistenceUnavailableException.class, persistence::start);

		// The failed start released the lease
		Files.delete(directory.resolve(DATA_FILE_NAME));
		persistence.start();
		persistence.shutdown();
	}

	@Test
	void unsupportedFormatVersion_isUnavailable() throws Exception {
		Files.writeString(directory.resolve(DATA_FILE_NAME), "{\"formatVersion\": 99}");
		JsonFilePersistence persistence = new JsonFilePersistence(directory, null);
		assertThrows(PersistenceUnavailableException.class, persistence::start);
	}

	@Test
	void leaseIsReleasedOnShutdown() throws Exception {
		JsonFilePersistence first = new JsonFilePersistence(directory, null);
		first.start();
		first.shutdown();

		JsonFilePersistence second = new JsonFilePersistence(directory, null);
		second.start();
		assertTrue(second.isStarted());
		second.shutdown();
	}

	@Test
	void factory_requiresDirectory() {
		DriftSettings settings = DriftSettings.builder().build();
		assertThrows(IllegalArgumentException.class, () -> JsonFilePersistence.factory().create(settings));

		DriftSettings withDirectory = DriftSettings.builder().persistenceDirectory(directory).build();
		JsonFilePersistence persistence = (JsonFilePersistence) JsonFilePersistence.factory().create(withDirectory);
		assertEquals(directory, persistence.directory());
	}

	@Test
	void pendingWrites_surviveClientRestart() throws Exception {
		FakeBackend backend = new FakeBackend(databaseId);
		DriftSettings settings = settings(InitialPersistenceUnavailableMode.FAIL);

		try (DriftClient first = newClient(settings, backend)) {
			first.disableNetwork().get(10, TimeUnit.SECONDS);
			first.localWrite(List.of(new SetMutation(key, ObjectValue.fromMap(Map.of("n", 1)), Precondition.NONE))).get(10, TimeUnit.SECONDS);
		}
		assertFalse(backend.serverDocument(key).isFound());

		try (DriftClient second = newClient(settings, backend)) {
			Document local = second.getDocument(key).get(10, TimeUnit.SECONDS);
			assertTrue(local.hasLocalMutations(), "Unsent write was restored");
			second.waitForPendingWrites().get(10, TimeUnit.SECONDS);
		}
		assertTrue(backend.serverDocument(key).isFound());

		JsonFilePersistence persistence = new JsonFilePersistence(directory, null);
		persistence.start();
		MutationQueue queue = persistence.getMutationQueue(User.UNAUTHENTICATED, persistence.getIndexManager(User.UNAUTHENTICATED));
		queue.start();
		assertTrue(queue.isEmpty(), "Acknowledged write was removed from the saved queue");
		persistence.shutdown();
	}

	@Test
	void leaseHeldByAnotherClient_failsOrFallsBackToMemory() throws Exception {
		FakeBackend backend = new FakeBackend(databaseId);
		try (DriftClient owner = newClient(settings(InitialPersistenceUnavailableMode.FAIL), backend)) {
			assertThrows(PersistenceUnavailableException.class, () -> newClient(settings(InitialPersistenceUnavailableMode.FAIL), backend));

			try (DriftClient fallback = newClient(settings(InitialPersistenceUnavailableMode.MEMORY_ONLY), backend)) {
				fallback.localWrite(List.of(new SetMutation(key, ObjectValue.fromMap(Map.of("n", 2)), Precondition.NONE))).get(10, TimeUnit.SECONDS);
				assertTrue(fallback.getDocument(key).get(10, TimeUnit.SECONDS).hasLocalMutations());
				assertFalse(backend.serverDocument(key).isFound(), "Fallback client stays offline");
			}
			assertFalse(owner.getDocument(key).get(10, TimeUnit.SECONDS).isValid(), "Fallback writes don't reach the owner's cache");
		}
	}

	private DriftSettings settings(InitialPersistenceUnavailableMode mode) {
		return DriftSettings.builder()
			.clientName("json-" + mode.name().toLowerCase())
			.persistenceDirectory(directory)
			.initialPersistenceUnavailableMode(mode)
			.build();
	}

	private DriftClient newClient(DriftSettings settings, FakeBackend backend) throws PersistenceUnavailableException {
		return new DriftClient(settings, databaseId, backend, new EmptyCredentialsProvider(), new EmptyAttestationProvider(), JsonFilePersistence.factory());
	}
}

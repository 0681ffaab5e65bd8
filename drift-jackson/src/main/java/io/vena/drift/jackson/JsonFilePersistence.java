package io.vena.drift.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.drift.DriftSettings;
import io.vena.drift.PersistenceFactory;
import io.vena.drift.exceptions.PersistenceUnavailableException;
import io.vena.drift.local.LruGarbageCollector;
import io.vena.drift.local.MemoryPersistence;
import io.vena.drift.local.PersistenceSnapshot;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * A {@link MemoryPersistence} whose committed state is saved to a JSON file
 * in a directory, and read back when a later instance starts on the same directory.
 *
 * <p>
 * Only one instance at a time may use a directory. The lease is an exclusive lock on
 * {@value #LOCK_FILE_NAME}, taken in {@link #start()} and released by {@link #shutdown()};
 * if another instance holds it, {@link #start()} throws {@link PersistenceUnavailableException}.
 *
 * <p>
 * Every transaction that changes anything rewrites the whole file, and the new file
 * replaces the old one atomically. If the write fails, so does the transaction.
 */
public class JsonFilePersistence extends MemoryPersistence {
	public static final String DATA_FILE_NAME = "drift-cache.json";
	public static final String LOCK_FILE_NAME = "drift.lock";

	private final Path directory;
	private final Path dataFile;
	private final Path tempFile;
	private final ObjectMapper mapper;

	private @Nullable FileChannel lockChannel;
	private @Nullable FileLock lease;

	/**
	 * @param lruParams null for eager garbage collection
	 */
	public JsonFilePersistence(Path directory, @Nullable LruGarbageCollector.Params lruParams) {
		super(lruParams);
		this.directory = directory;
		this.dataFile = directory.resolve(DATA_FILE_NAME);
		this.tempFile = directory.resolve(DATA_FILE_NAME + ".tmp");
		this.mapper = new ObjectMapper().registerModule(new DriftJacksonModule(new JsonFormatter()));
	}

	/**
	 * Uses {@link DriftSettings#persistenceDirectory()}, which must be set,
	 * and garbage collection per {@link DriftSettings#garbageCollectionMode()}.
	 */
	public static PersistenceFactory factory() {
		return settings -> {
			Path directory = settings.persistenceDirectory();
			if (directory == null) {
				throw new IllegalArgumentException("JSON file persistence requires a persistence directory");
			}
			LruGarbageCollector.Params lruParams = (settings.garbageCollectionMode() == DriftSettings.GarbageCollectionMode.LRU)
				? settings.gcParams()
				: null;
			return new JsonFilePersistence(directory, lruParams);
		};
	}

	public Path directory() {
		return directory;
	}

	@Override
	public void start() throws PersistenceUnavailableException {
		acquireLease();
		try {
			loadDataFile();
			super.start();
		} catch (PersistenceUnavailableException | RuntimeException e) {
			releaseLease();
			throw e;
		}
	}

	@Override
	public void shutdown() {
		super.shutdown();
		releaseLease();
	}

	private void acquireLease() throws PersistenceUnavailableException {
		FileChannel channel = null;
		try {
			Files.createDirectories(directory);
			channel = FileChannel.open(directory.resolve(LOCK_FILE_NAME), CREATE, WRITE);
			FileLock lock = channel.tryLock();
			if (lock == null) {
				throw new PersistenceUnavailableException("Another process is using " + directory);
			}
			lockChannel = channel;
			lease = lock;
			LOGGER.debug("Acquired lease on {}", directory);
		} catch (OverlappingFileLockException e) {
			closeQuietly(channel);
			throw new PersistenceUnavailableException("Another client in this process is using " + directory, e);
		} catch (PersistenceUnavailableException e) {
			closeQuietly(channel);
			throw e;
		} catch (IOException e) {
			closeQuietly(channel);
			throw new PersistenceUnavailableException("Unable to lock " + directory, e);
		}
	}

	private void releaseLease() {
		try {
			if (lease != null) {
				lease.release();
			}
		} catch (IOException e) {
			LOGGER.warn("Unable to release lease on {}", directory, e);
		} finally {
			closeQuietly(lockChannel);
			lease = null;
			lockChannel = null;
		}
	}

	private void closeQuietly(@Nullable FileChannel channel) {
		if (channel != null) {
			try {
				channel.close();
			} catch (IOException e) {
				LOGGER.warn("Unable to close lock file in {}", directory, e);
			}
		}
	}

	private void loadDataFile() throws PersistenceUnavailableException {
		if (!Files.exists(dataFile)) {
			LOGGER.debug("No data file in {}; starting empty", directory);
			return;
		}
		PersistenceSnapshot snapshot;
		try {
			snapshot = mapper.readValue(dataFile.toFile(), PersistenceSnapshot.class);
		} catch (JsonProcessingException e) {
			throw new PersistenceUnavailableException("Data file " + dataFile + " is corrupt", e);
		} catch (IOException e) {
			throw new PersistenceUnavailableException("Unable to read " + dataFile, e);
		}
		importSnapshot(snapshot);
		LOGGER.info("Loaded {} documents and {} targets from {}", snapshot.remoteDocuments().size(), snapshot.targets().size(), dataFile);
	}

	@Override
	protected void onTransactionCommitted(String action, boolean modified) {
		if (modified) {
			writeDataFile(action);
		}
	}

	private void writeDataFile(String action) {
		try {
			mapper.writeValue(tempFile.toFile(), exportSnapshot());
			Files.move(tempFile, dataFile, ATOMIC_MOVE, REPLACE_EXISTING);
			LOGGER.trace("Saved {} after \"{}\"", dataFile, action);
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to save " + dataFile + " after \"" + action + "\"", e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonFilePersistence.class);
}

package io.vena.drift.local;

import io.vena.drift.core.FieldFilter;
import io.vena.drift.core.Query;
import io.vena.drift.exceptions.PersistenceUnavailableException;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.FieldPath;
import io.vena.drift.model.ObjectValue;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.model.User;
import io.vena.drift.model.mutation.DeleteMutation;
import io.vena.drift.model.mutation.FieldMask;
import io.vena.drift.model.mutation.Mutation;
import io.vena.drift.model.mutation.MutationBatch;
import io.vena.drift.model.mutation.MutationBatchResult;
import io.vena.drift.model.mutation.MutationResult;
import io.vena.drift.model.mutation.Overlay;
import io.vena.drift.model.mutation.PatchMutation;
import io.vena.drift.model.mutation.Precondition;
import io.vena.drift.model.mutation.SetMutation;
import io.vena.drift.remote.RemoteEvent;
import io.vena.drift.remote.TargetChange;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalStoreTest {
	final DocumentKey keyA = DocumentKey.of("coll", "a");
	final DocumentKey keyB = DocumentKey.of("coll", "b");
	final Query collQuery = Query.atPath("coll");

	MemoryPersistence persistence;
	LocalStore localStore;

	@BeforeEach
	void setup() throws PersistenceUnavailableException {
		persistence = MemoryPersistence.createLruGcMemoryPersistence(LruGarbageCollector.Params.disabled());
		persistence.start();
		localStore = new LocalStore(persistence, new QueryEngine(IndexingPolicy.disabled()), User.UNAUTHENTICATED);
		localStore.start();
	}

	@Test
	void unknownDocument_isInvalid() {
		assertFalse(localStore.readDocument(keyA).isValid());
	}

	@Test
	void localWrite_visibleImmediately() {
		LocalWriteResult result = localStore.writeLocally(List.of(set(keyA, Map.of("x", 1))));

		Document document = localStore.readDocument(keyA);
		assertTrue(document.isFound());
		assertTrue(document.hasLocalMutations());
		assertEquals(1L, document.data().get(FieldPath.of("x")));
		assertEquals(document, result.changes().get(keyA));
		assertEquals(result.batchId(), localStore.getHighestUnacknowledgedBatchId());
	}

	@Test
	void setThenPatch_foldsIntoOneOverlay() {
		localStore.writeLocally(List.of(set(keyA, Map.of("x", 1))));
		int patchBatch = localStore.writeLocally(List.of(patch(keyA, Map.of("y", 2)))).batchId();

		Document document = localStore.readDocument(keyA);
		assertEquals(ObjectValue.fromMap(Map.of("x", 1, "y", 2)), document.data());

		Overlay overlay = persistence.getDocumentOverlayCache(User.UNAUTHENTICATED).getOverlay(keyA);
		assertEquals(patchBatch, overlay.largestBatchId());
		assertThat(overlay.mutation(), instanceOf(SetMutation.class));
		assertEquals(ObjectValue.fromMap(Map.of("x", 1, "y", 2)), ((SetMutation) overlay.mutation()).value());
	}

	@Test
	void setThenDeleteOffline_readsAsDeleted() {
		localStore.writeLocally(List.of(set(keyA, Map.of("x", 1))));
		localStore.writeLocally(List.of(new DeleteMutation(keyA, Precondition.NONE)));

		Document document = localStore.readDocument(keyA);
		assertTrue(document.isNoDocument());
		assertTrue(document.hasLocalMutations());
		assertThat(localStore.executeQuery(collQuery, false).documents(), anEmptyMap());
	}

	@Test
	void acknowledgedWrite_hasCommittedMutationsUntilWatchCatchesUp() {
		int targetId = localStore.allocateTarget(collQuery.toTarget()).targetId();
		localStore.writeLocally(List.of(set(keyA, Map.of("x", 1))));
		acknowledgeNextBatch(version(5));

		Document acknowledged = localStore.readDocument(keyA);
		assertTrue(acknowledged.isFound());
		assertTrue(acknowledged.hasCommittedMutations());
		assertEquals(version(5), acknowledged.version());
		assertEquals(MutationBatch.UNKNOWN, localStore.getHighestUnacknowledgedBatchId());

		localStore.applyRemoteEvent(addDocuments(targetId, version(5), found(keyA, 5, Map.of("x", 1))));
		Document synced = localStore.readDocument(keyA);
		assertFalse(synced.hasPendingWrites());
		assertEquals(version(5), synced.version());
	}

	@Test
	void rejectedWrite_revertsToRemoteState() {
		int targetId = localStore.allocateTarget(collQuery.toTarget()).targetId();
		localStore.applyRemoteEvent(addDocuments(targetId, version(1), found(keyA, 1, Map.of("x", 1))));
		int batchId = localStore.writeLocally(List.of(set(keyA, Map.of("x", 2)))).batchId();
		assertEquals(2L, localStore.readDocument(keyA).data().get(FieldPath.of("x")));

		SortedMap<DocumentKey, Document> changes = localStore.rejectBatch(batchId);

		Document reverted = changes.get(keyA);
		assertEquals(1L, reverted.data().get(FieldPath.of("x")));
		assertFalse(reverted.hasPendingWrites());
		assertNull(persistence.getDocumentOverlayCache(User.UNAUTHENTICATED).getOverlay(keyA));
	}

	@Test
	void sameRemoteEventTwice_secondChangesNothing() {
		int targetId = localStore.allocateTarget(collQuery.toTarget()).targetId();
		RemoteEvent event = addDocuments(targetId, version(3), found(keyA, 3, Map.of("x", 1)));

		assertEquals(Set.of(keyA), localStore.applyRemoteEvent(event).keySet());
		assertThat(localStore.applyRemoteEvent(event), anEmptyMap());
		assertEquals(version(3), localStore.getLastRemoteSnapshotVersion());
	}

	@Test
	void olderRemoteDocument_ignored() {
		int targetId = localStore.allocateTarget(collQuery.toTarget()).targetId();
		localStore.applyRemoteEvent(addDocuments(targetId, version(3), found(keyA, 3, Map.of("x", "new"))));
		localStore.applyRemoteEvent(addDocuments(targetId, version(4), found(keyA, 2, Map.of("x", "old"))));

		assertEquals("new", localStore.readDocument(keyA).data().get(FieldPath.of("x")));
	}

	@Test
	void executeQuery_mergesPendingWritesWithRemoteDocuments() {
		int targetId = localStore.allocateTarget(collQuery.toTarget()).targetId();
		localStore.applyRemoteEvent(addDocuments(targetId, version(1),
			found(keyA, 1, Map.of("x", 1)),
			found(keyB, 1, Map.of("x", 2))));
		localStore.writeLocally(List.of(patch(keyB, Map.of("x", 1))));

		Query query = collQuery.filter(FieldFilter.of(FieldPath.of("x"), FieldFilter.Operator.EQUAL, 1L));
		QueryResult result = localStore.executeQuery(query, false);
		assertThat(result.documents().keySet(), contains(keyA, keyB));
	}

	@Test
	void userChange_switchesMutationQueue() {
		User alice = new User("alice");
		localStore.handleUserChange(alice);
		localStore.writeLocally(List.of(set(keyA, Map.of("owner", "alice"))));

		SortedMap<DocumentKey, Document> changes = localStore.handleUserChange(new User("bob"));
		assertFalse(changes.get(keyA).isValid(), "Bob doesn't see Alice's pending write");

		localStore.handleUserChange(alice);
		assertEquals("alice", localStore.readDocument(keyA).data().get(FieldPath.of("owner")));
	}

	@Test
	void resumeToken_persistedOnlyWhenWorthwhile() {
		TargetData noToken = new TargetData(collQuery.toTarget(), 2, 1, QueryPurpose.LISTEN);
		TargetData withToken = noToken.withResumeToken("t1", SnapshotVersion.of(Instant.ofEpochSecond(1000)));
		TargetData soonAfter = withToken.withResumeToken("t2", SnapshotVersion.of(Instant.ofEpochSecond(1010)));
		TargetData muchLater = withToken.withResumeToken("t3", SnapshotVersion.of(Instant.ofEpochSecond(1000).plus(Duration.ofMinutes(6))));
		TargetChange noDocuments = new TargetChange("t2", true, Set.of(), Set.of(), Set.of());
		TargetChange withDocuments = new TargetChange("t2", true, Set.of(keyA), Set.of(), Set.of());

		assertTrue(localStore.shouldPersistTargetData(noToken, withToken, noDocuments), "First token");
		assertFalse(localStore.shouldPersistTargetData(withToken, soonAfter, noDocuments), "Token alone, too soon");
		assertTrue(localStore.shouldPersistTargetData(withToken, soonAfter, withDocuments), "Documents changed");
		assertTrue(localStore.shouldPersistTargetData(withToken, muchLater, noDocuments), "Max age exceeded");
	}

	@Test
	void allocateTarget_reusesCachedTargetId() {
		TargetData first = localStore.allocateTarget(collQuery.toTarget());
		localStore.releaseTarget(first.targetId());
		TargetData second = localStore.allocateTarget(collQuery.toTarget());
		assertEquals(first.targetId(), second.targetId());

		TargetData other = localStore.allocateTarget(Query.atPath("other").toTarget());
		assertEquals(first.targetId() + 2, other.targetId(), "Target cache ids are even and increasing");
	}

	private void acknowledgeNextBatch(SnapshotVersion commitVersion) {
		MutationBatch batch = localStore.getNextMutationBatch(MutationBatch.UNKNOWN);
		List<MutationResult> results = batch.mutations().stream()
			.map(m -> new MutationResult(commitVersion, List.of()))
			.collect(Collectors.toList());
		localStore.acknowledgeBatch(MutationBatchResult.create(batch, commitVersion, results, "stream-token"));
	}

	static RemoteEvent addDocuments(int targetId, SnapshotVersion version, Document... documents) {
		Map<DocumentKey, Document> updates = new HashMap<>();
		Set<DocumentKey> added = new HashSet<>();
		for (Document document: documents) {
			updates.put(document.key(), document.withReadTime(version));
			added.add(document.key());
		}
		return new RemoteEvent(
			version,
			Map.of(targetId, new TargetChange("resume-" + version, true, added, Set.of(), Set.of())),
			Map.of(),
			updates,
			Set.of());
	}

	static Mutation set(DocumentKey key, Map<String, ?> value) {
		return new SetMutation(key, ObjectValue.fromMap(value), Precondition.NONE);
	}

	static Mutation patch(DocumentKey key, Map<String, ?> value) {
		FieldMask mask = FieldMask.fromSet(value.keySet().stream()
			.map(FieldPath::of)
			.collect(Collectors.toSet()));
		return new PatchMutation(key, ObjectValue.fromMap(value), mask, Precondition.exists(true));
	}

	static Document found(DocumentKey key, long version, Map<String, ?> value) {
		return Document.found(key, version(version), ObjectValue.fromMap(value));
	}

	static SnapshotVersion version(long micros) {
		return SnapshotVersion.ofMicros(micros);
	}
}

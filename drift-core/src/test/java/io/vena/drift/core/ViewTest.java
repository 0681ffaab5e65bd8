package io.vena.drift.core;

import io.vena.drift.core.DocumentViewChange.Type;
import io.vena.drift.core.ViewSnapshot.SyncState;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.ObjectValue;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.remote.TargetChange;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ViewTest {
	final Query query = Query.atPath("coll");
	final Document docA = doc("a", 1);
	final Document docB = doc("b", 2);
	final Document docC = doc("c", 3);

	@Test
	void initialDocuments_comeFromCache() {
		View view = new View(query, Set.of());
		ViewSnapshot snapshot = apply(view, changes(docB, docA), null).snapshot();

		assertNotNull(snapshot);
		assertTrue(snapshot.fromCache());
		assertFalse(snapshot.hasPendingWrites());
		assertEquals(List.of(docA, docB), snapshot.documents().toList());
		assertEquals(List.of(Type.ADDED, Type.ADDED), types(snapshot));
		assertEquals(SyncState.LOCAL, view.syncState());
	}

	@Test
	void currentTargetChange_marksViewSynced() {
		View view = new View(query, Set.of());
		apply(view, changes(docA, docB), null);

		ViewChange change = apply(view, Map.of(), current(Set.of(docA.key(), docB.key())));
		assertNotNull(change.snapshot());
		assertFalse(change.snapshot().fromCache());
		assertTrue(change.snapshot().didSyncStateChange());
		assertThat(change.snapshot().changes(), empty());
		assertEquals(SyncState.SYNCED, view.syncState());
	}

	@Test
	void unconfirmedDocument_goesIntoLimbo() {
		View view = new View(query, Set.of());
		apply(view, changes(docA, docB), null);

		ViewChange change = apply(view, Map.of(), current(Set.of(docA.key())));
		assertThat(change.limboChanges(), contains(new LimboDocumentChange(LimboDocumentChange.Type.ADDED, docB.key())));
		assertEquals(SyncState.LOCAL, view.syncState());

		// Server confirms the deletion
		ViewChange resolved = apply(view, Map.of(docB.key(), Document.noDocument(docB.key(), SnapshotVersion.ofMicros(5))), null);
		assertThat(resolved.limboChanges(), contains(new LimboDocumentChange(LimboDocumentChange.Type.REMOVED, docB.key())));
		assertNotNull(resolved.snapshot());
		assertFalse(resolved.snapshot().fromCache());
		assertEquals(List.of(docA), resolved.snapshot().documents().toList());
	}

	@Test
	void locallyMutatedDocument_isNotLimbo() {
		View view = new View(query, Set.of());
		apply(view, changes(docA.withLocalMutations()), null);

		ViewChange change = apply(view, Map.of(), current(Set.of()));
		assertThat(change.limboChanges(), empty());
		assertTrue(change.snapshot().hasPendingWrites());
		assertEquals(SyncState.SYNCED, view.syncState());
	}

	@Test
	void pendingWriteAcknowledged_producesMetadataChange() {
		View view = new View(query, Set.of());
		apply(view, changes(docA.withLocalMutations()), null);

		ViewSnapshot snapshot = apply(view, changes(docA), null).snapshot();
		assertNotNull(snapshot);
		assertEquals(List.of(Type.METADATA), types(snapshot));
		assertFalse(snapshot.hasPendingWrites());
		assertThat(snapshot.withoutMetadataChanges().changes(), empty());
	}

	@Test
	void limitToFirst_trimsExtraDocuments() {
		View view = new View(query.limitToFirst(2), Set.of());
		ViewSnapshot snapshot = apply(view, changes(docA, docB, docC), null).snapshot();
		assertEquals(List.of(docA, docB), snapshot.documents().toList());
	}

	@Test
	void deleteFromFullLimit_needsRefill() {
		View view = new View(query.limitToFirst(2), Set.of());
		apply(view, changes(docA, docB, docC), null);

		View.DocumentChanges changes = view.computeDocChanges(Map.of(docA.key(), Document.noDocument(docA.key(), SnapshotVersion.ofMicros(9))));
		assertTrue(changes.needsRefill());

		View.DocumentChanges refilled = view.computeDocChanges(changes(docB, docC), changes);
		assertFalse(refilled.needsRefill());
		assertEquals(List.of(docB, docC), refilled.documentSet().toList());
	}

	@Test
	void unchangedDocument_producesNoSnapshot() {
		View view = new View(query, Set.of());
		apply(view, changes(docA), null);
		assertNull(apply(view, changes(docA), null).snapshot());
	}

	@Test
	void goingOffline_revertsToCache() {
		View view = new View(query, Set.of());
		apply(view, changes(docA), current(Set.of(docA.key())));
		assertEquals(SyncState.SYNCED, view.syncState());

		ViewChange change = view.applyOnlineStateChange(OnlineState.OFFLINE);
		assertNotNull(change.snapshot());
		assertTrue(change.snapshot().fromCache());
		assertEquals(SyncState.LOCAL, view.syncState());

		assertNull(view.applyOnlineStateChange(OnlineState.OFFLINE).snapshot());
	}

	private static ViewChange apply(View view, Map<DocumentKey, Document> documents, TargetChange targetChange) {
		return view.applyChanges(view.computeDocChanges(documents), targetChange);
	}

	private static Map<DocumentKey, Document> changes(Document... documents) {
		Map<DocumentKey, Document> result = new LinkedHashMap<>();
		for (Document document: documents) {
			result.put(document.key(), document);
		}
		return result;
	}

	private static TargetChange current(Set<DocumentKey> added) {
		return new TargetChange("token", true, added, Set.of(), Set.of());
	}

	private static List<Type> types(ViewSnapshot snapshot) {
		return snapshot.changes().stream().map(DocumentViewChange::type).collect(Collectors.toList());
	}

	private static Document doc(String id, long version) {
		return Document.found(DocumentKey.of("coll", id), SnapshotVersion.ofMicros(version), ObjectValue.fromMap(Map.of("n", version)));
	}
}

package io.vena.drift.local;

import io.vena.drift.core.FieldFilter;
import io.vena.drift.core.OrderBy;
import io.vena.drift.core.Query;
import io.vena.drift.core.View;
import io.vena.drift.core.ViewSnapshot;
import io.vena.drift.exceptions.PersistenceUnavailableException;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.FieldPath;
import io.vena.drift.model.User;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static io.vena.drift.core.FieldFilter.Operator.ARRAY_CONTAINS;
import static io.vena.drift.core.FieldFilter.Operator.EQUAL;
import static io.vena.drift.core.FieldFilter.Operator.GREATER_THAN;
import static io.vena.drift.core.FieldFilter.Operator.IN;
import static io.vena.drift.local.LocalStoreTest.found;
import static io.vena.drift.local.LocalStoreTest.set;
import static io.vena.drift.local.LocalStoreTest.version;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;

class QueryEngineTest {
	final Query collQuery = Query.atPath("coll");

	MemoryPersistence persistence;
	LocalStore localStore;

	void setupWith(IndexingPolicy indexingPolicy) throws PersistenceUnavailableException {
		persistence = MemoryPersistence.createLruGcMemoryPersistence(LruGarbageCollector.Params.disabled());
		persistence.start();
		localStore = new LocalStore(persistence, new QueryEngine(indexingPolicy), User.UNAUTHENTICATED);
		localStore.start();
	}

	@Test
	void orderByAndLimit() throws PersistenceUnavailableException {
		setupWith(IndexingPolicy.disabled());
		int targetId = localStore.allocateTarget(collQuery.toTarget()).targetId();
		localStore.applyRemoteEvent(LocalStoreTest.addDocuments(targetId, version(1),
			found(key("a"), 1, Map.of("n", 3)),
			found(key("b"), 1, Map.of("n", 1)),
			found(key("c"), 1, Map.of("n", 2))));

		assertEquals(List.of(key("b"), key("c")), run(collQuery.orderBy(OrderBy.asc("n")).limitToFirst(2)));
		assertEquals(List.of(key("c"), key("a")), run(collQuery.orderBy(OrderBy.asc("n")).limitToLast(2)));
		assertEquals(List.of(key("a"), key("c")), run(collQuery.orderBy(OrderBy.desc("n")).limitToFirst(2)));
	}

	@Test
	void filters() throws PersistenceUnavailableException {
		setupWith(IndexingPolicy.disabled());
		localStore.writeLocally(List.of(
			set(key("a"), Map.of("n", 1, "tags", List.of("red", "blue"))),
			set(key("b"), Map.of("n", 5, "tags", List.of("green"))),
			set(key("c"), Map.of("n", 9))));

		assertEquals(List.of(key("b"), key("c")), run(collQuery.filter(FieldFilter.of(FieldPath.of("n"), GREATER_THAN, 2L))));
		assertEquals(List.of(key("a")), run(collQuery.filter(FieldFilter.of(FieldPath.of("tags"), ARRAY_CONTAINS, "blue"))));
		assertEquals(List.of(key("a"), key("c")), run(collQuery.filter(FieldFilter.of(FieldPath.of("n"), IN, List.of(1L, 9L)))));
	}

	@Test
	void collectionGroup_spansParents() throws PersistenceUnavailableException {
		setupWith(IndexingPolicy.disabled());
		DocumentKey nested1 = DocumentKey.of("rooms", "r1", "messages", "m1");
		DocumentKey nested2 = DocumentKey.of("rooms", "r2", "messages", "m2");
		DocumentKey unrelated = DocumentKey.of("rooms", "r1", "members", "x");
		localStore.writeLocally(List.of(
			set(nested1, Map.of("text", "hi")),
			set(nested2, Map.of("text", "hello")),
			set(unrelated, Map.of("text", "nope"))));

		assertEquals(List.of(nested1, nested2), run(Query.collectionGroup("messages")));
	}

	@Test
	void previousResults_includeLaterChanges() throws PersistenceUnavailableException {
		setupWith(IndexingPolicy.disabled());
		Query query = collQuery.filter(FieldFilter.of(FieldPath.of("match"), EQUAL, true));
		int targetId = localStore.allocateTarget(query.toTarget()).targetId();
		localStore.applyRemoteEvent(LocalStoreTest.addDocuments(targetId, version(1),
			found(key("a"), 1, Map.of("match", true))));
		localStore.notifyLocalViewChanges(List.of(new LocalViewChanges(targetId, false, Set.of(key("a")), Set.of())));
		localStore.writeLocally(List.of(set(key("b"), Map.of("match", true))));

		QueryResult result = localStore.executeQuery(query, true);
		assertEquals(Set.of(key("a"), key("b")), result.documents().keySet());
		assertEquals(Set.of(key("a")), result.remoteKeys());
	}

	@Test
	void adaptiveIndexing_createsIndexForSelectiveScans() throws PersistenceUnavailableException {
		setupWith(new IndexingPolicy.Adaptive(10, 2.0));
		int targetId = localStore.allocateTarget(collQuery.toTarget()).targetId();
		List<Document> documents = new ArrayList<>();
		for (int i = 0; i < 20; i++) {
			documents.add(found(key("d" + i), 1, Map.of("n", i)));
		}
		localStore.applyRemoteEvent(LocalStoreTest.addDocuments(targetId, version(1), documents.toArray(new Document[0])));
		Query selective = collQuery.filter(FieldFilter.of(FieldPath.of("n"), EQUAL, 7L));

		assertThat(persistence.getIndexManager(User.UNAUTHENTICATED).getFieldIndexes("coll"), empty());
		assertEquals(List.of(key("d7")), run(selective));
		assertThat(persistence.getIndexManager(User.UNAUTHENTICATED).getFieldIndexes("coll"), not(empty()));
		assertEquals(List.of(key("d7")), run(selective), "Indexed query gives the same results");
	}

	@Test
	void configuredIndex_givesSameResultsAsScan() throws PersistenceUnavailableException {
		setupWith(IndexingPolicy.disabled());
		localStore.configureFieldIndexes(List.of(new FieldIndex("coll", List.of(FieldPath.of("n")))));
		int targetId = localStore.allocateTarget(collQuery.toTarget()).targetId();
		localStore.applyRemoteEvent(LocalStoreTest.addDocuments(targetId, version(1),
			found(key("a"), 1, Map.of("n", 1)),
			found(key("b"), 1, Map.of("n", 2))));
		localStore.writeLocally(List.of(set(key("c"), Map.of("n", 2))));

		assertEquals(List.of(key("b"), key("c")), run(collQuery.filter(FieldFilter.of(FieldPath.of("n"), EQUAL, 2L))));
	}

	@Test
	void engineResults_mayExceedLimit() throws PersistenceUnavailableException {
		setupWith(IndexingPolicy.disabled());
		localStore.writeLocally(List.of(
			set(key("a"), Map.of("n", 3)),
			set(key("b"), Map.of("n", 1)),
			set(key("c"), Map.of("n", 2))));

		Query limited = collQuery.orderBy(OrderBy.asc("n")).limitToFirst(1);
		assertThat(localStore.executeQuery(limited, false).documents().keySet(), hasItem(key("b")));
		assertEquals(List.of(key("b")), run(limited));
	}

	/**
	 * The engine may return more than the query's limit; the {@link View} built on top trims it.
	 */
	private List<DocumentKey> run(Query query) {
		QueryResult queryResult = localStore.executeQuery(query, false);
		View view = new View(query, queryResult.remoteKeys());
		ViewSnapshot snapshot = view.applyChanges(view.computeDocChanges(queryResult.documents())).snapshot();
		List<DocumentKey> result = new ArrayList<>();
		if (snapshot != null) {
			snapshot.documents().forEach(doc -> result.add(doc.key()));
		}
		return result;
	}

	static DocumentKey key(String id) {
		return DocumentKey.of("coll", id);
	}
}

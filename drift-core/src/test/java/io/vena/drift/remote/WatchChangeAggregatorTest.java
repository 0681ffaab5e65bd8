package io.vena.drift.remote;

import io.vena.drift.core.Query;
import io.vena.drift.exceptions.BloomFilterException;
import io.vena.drift.local.QueryPurpose;
import io.vena.drift.local.TargetData;
import io.vena.drift.model.DatabaseId;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.ObjectValue;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.remote.WatchChange.DocumentChange;
import io.vena.drift.remote.WatchChange.ExistenceFilterWatchChange;
import io.vena.drift.remote.WatchChange.WatchTargetChange;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.vena.drift.remote.WatchChange.WatchTargetChangeType.ADDED;
import static io.vena.drift.remote.WatchChange.WatchTargetChangeType.CURRENT;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WatchChangeAggregatorTest {
	static final DatabaseId DATABASE_ID = DatabaseId.forProject("test-project");
	static final int LISTEN_TARGET = 2;
	static final int LIMBO_TARGET = 1;

	final DocumentKey keyA = DocumentKey.of("coll", "a");
	final DocumentKey keyB = DocumentKey.of("coll", "b");
	final DocumentKey keyC = DocumentKey.of("coll", "c");

	final Map<Integer, TargetData> targets = new HashMap<>();
	final Map<Integer, Set<DocumentKey>> remoteKeys = new HashMap<>();
	WatchChangeAggregator aggregator;

	@BeforeEach
	void setup() {
		targets.put(LISTEN_TARGET, new TargetData(Query.atPath("coll").toTarget(), LISTEN_TARGET, 1, QueryPurpose.LISTEN));
		aggregator = new WatchChangeAggregator(new WatchChangeAggregator.TargetMetadataProvider() {
			@Override
			public Set<DocumentKey> getRemoteKeysForTarget(int targetId) {
				return remoteKeys.getOrDefault(targetId, Set.of());
			}

			@Override
			public @Nullable TargetData getTargetDataForTarget(int targetId) {
				return targets.get(targetId);
			}

			@Override
			public DatabaseId getDatabaseId() {
				return DATABASE_ID;
			}
		});
	}

	@Test
	void addedTargetWithDocuments_producesOneEvent() {
		aggregator.recordPendingTargetRequest(LISTEN_TARGET);
		aggregator.handleTargetChange(new WatchTargetChange(ADDED, List.of(LISTEN_TARGET)));
		for (DocumentKey key: List.of(keyA, keyB, keyC)) {
			aggregator.handleDocumentChange(new DocumentChange(List.of(LISTEN_TARGET), List.of(), key, found(key, 1)));
		}
		aggregator.handleTargetChange(new WatchTargetChange(CURRENT, List.of(LISTEN_TARGET), "token-1"));

		RemoteEvent event = aggregator.createRemoteEvent(version(2));

		assertEquals(Set.of(LISTEN_TARGET), event.targetChanges().keySet());
		TargetChange change = event.targetChanges().get(LISTEN_TARGET);
		assertThat(change.addedDocuments(), containsInAnyOrder(keyA, keyB, keyC));
		assertThat(change.modifiedDocuments(), empty());
		assertThat(change.removedDocuments(), empty());
		assertTrue(change.current());
		assertEquals("token-1", change.resumeToken());

		assertEquals(Set.of(keyA, keyB, keyC), event.documentUpdates().keySet());
		event.documentUpdates().values().forEach(doc ->
			assertEquals(version(2), doc.readTime(), "Updates carry the snapshot version as their read time"));
		assertThat(event.targetMismatches(), anEmptyMap());
		assertThat(event.resolvedLimboDocuments(), empty());
	}

	@Test
	void eventsAreIncremental() {
		aggregator.handleDocumentChange(new DocumentChange(List.of(LISTEN_TARGET), List.of(), keyA, found(keyA, 1)));
		aggregator.createRemoteEvent(version(1));

		RemoteEvent second = aggregator.createRemoteEvent(version(2));
		assertThat(second.documentUpdates(), anEmptyMap());
		assertThat(second.targetChanges(), anEmptyMap());
	}

	@Test
	void changesWhileTargetPending_ignored() {
		aggregator.recordPendingTargetRequest(LISTEN_TARGET);
		aggregator.handleDocumentChange(new DocumentChange(List.of(LISTEN_TARGET), List.of(), keyA, found(keyA, 1)));

		RemoteEvent event = aggregator.createRemoteEvent(version(1));
		assertThat(event.documentUpdates(), anEmptyMap());
		assertThat(event.targetChanges(), anEmptyMap());
	}

	@Test
	void existingDocument_isModified() {
		remoteKeys.put(LISTEN_TARGET, Set.of(keyA));
		aggregator.handleDocumentChange(new DocumentChange(List.of(LISTEN_TARGET), List.of(), keyA, found(keyA, 2)));

		TargetChange change = aggregator.createRemoteEvent(version(2)).targetChanges().get(LISTEN_TARGET);
		assertEquals(Set.of(keyA), change.modifiedDocuments());
		assertThat(change.addedDocuments(), empty());
	}

	@Test
	void existenceFilterMismatch_withoutBloomFilter_resetsTarget() {
		remoteKeys.put(LISTEN_TARGET, Set.of(keyA, keyB, keyC));
		aggregator.handleExistenceFilter(new ExistenceFilterWatchChange(LISTEN_TARGET, new ExistenceFilter(2)));

		RemoteEvent event = aggregator.createRemoteEvent(version(3));
		assertEquals(Map.of(LISTEN_TARGET, QueryPurpose.EXISTENCE_FILTER_MISMATCH), event.targetMismatches());
		assertThat(event.targetChanges().get(LISTEN_TARGET).removedDocuments(), containsInAnyOrder(keyA, keyB, keyC));
	}

	@Test
	void existenceFilterMatch_changesNothing() {
		remoteKeys.put(LISTEN_TARGET, Set.of(keyA, keyB));
		aggregator.handleExistenceFilter(new ExistenceFilterWatchChange(LISTEN_TARGET, new ExistenceFilter(2)));

		RemoteEvent event = aggregator.createRemoteEvent(version(3));
		assertThat(event.targetMismatches(), anEmptyMap());
		assertThat(event.documentUpdates(), anEmptyMap());
	}

	@Test
	void bloomFilter_identifiesRemovedDocument() throws BloomFilterException {
		remoteKeys.put(LISTEN_TARGET, Set.of(keyA, keyB, keyC));
		ExistenceFilter.BloomFilterBits bits = BloomFilter.encode(
			List.of(DATABASE_ID.documentName(keyA), DATABASE_ID.documentName(keyB)), 1000, 7);
		aggregator.handleExistenceFilter(new ExistenceFilterWatchChange(LISTEN_TARGET, new ExistenceFilter(2, bits)));

		RemoteEvent event = aggregator.createRemoteEvent(version(3));
		assertThat(event.targetMismatches(), anEmptyMap());
		assertEquals(Set.of(keyC), event.targetChanges().get(LISTEN_TARGET).removedDocuments());
	}

	@Test
	void bloomFilterFalsePositive_resetsTargetWithBloomPurpose() throws BloomFilterException {
		remoteKeys.put(LISTEN_TARGET, Set.of(keyA, keyB, keyC));
		ExistenceFilter.BloomFilterBits bits = BloomFilter.encode(
			List.of(DATABASE_ID.documentName(keyA), DATABASE_ID.documentName(keyB), DATABASE_ID.documentName(keyC)), 1000, 7);
		aggregator.handleExistenceFilter(new ExistenceFilterWatchChange(LISTEN_TARGET, new ExistenceFilter(2, bits)));

		RemoteEvent event = aggregator.createRemoteEvent(version(3));
		assertEquals(Map.of(LISTEN_TARGET, QueryPurpose.EXISTENCE_FILTER_MISMATCH_BLOOM), event.targetMismatches());
	}

	@Test
	void invalidBloomFilter_fallsBackToFullRequery() {
		remoteKeys.put(LISTEN_TARGET, Set.of(keyA, keyB, keyC));
		ExistenceFilter.BloomFilterBits invalidBits = new ExistenceFilter.BloomFilterBits(new byte[] {1}, 0, 0);
		aggregator.handleExistenceFilter(new ExistenceFilterWatchChange(LISTEN_TARGET, new ExistenceFilter(2, invalidBits)));

		RemoteEvent event = aggregator.createRemoteEvent(version(3));
		assertEquals(Map.of(LISTEN_TARGET, QueryPurpose.EXISTENCE_FILTER_MISMATCH), event.targetMismatches());
	}

	@Test
	void documentQueryWithZeroCount_deletesDocument() {
		targets.put(LIMBO_TARGET, new TargetData(Query.atPath("coll/a").toTarget(), LIMBO_TARGET, 1, QueryPurpose.LIMBO_RESOLUTION));
		aggregator.handleExistenceFilter(new ExistenceFilterWatchChange(LIMBO_TARGET, new ExistenceFilter(0)));

		RemoteEvent event = aggregator.createRemoteEvent(version(3));
		Document document = event.documentUpdates().get(keyA);
		assertTrue(document.isNoDocument());
	}

	@Test
	void currentLimboTargetWithoutDocument_resolvesAsDeleted() {
		targets.put(LIMBO_TARGET, new TargetData(Query.atPath("coll/a").toTarget(), LIMBO_TARGET, 1, QueryPurpose.LIMBO_RESOLUTION));
		aggregator.handleTargetChange(new WatchTargetChange(CURRENT, List.of(LIMBO_TARGET), "token"));

		RemoteEvent event = aggregator.createRemoteEvent(version(4));
		Document document = event.documentUpdates().get(keyA);
		assertTrue(document.isNoDocument());
		assertEquals(version(4), document.version());
		assertEquals(Set.of(keyA), event.resolvedLimboDocuments());
	}

	@Test
	void documentAlsoInListenTarget_notResolvedLimbo() {
		targets.put(LIMBO_TARGET, new TargetData(Query.atPath("coll/a").toTarget(), LIMBO_TARGET, 1, QueryPurpose.LIMBO_RESOLUTION));
		aggregator.handleDocumentChange(new DocumentChange(List.of(LIMBO_TARGET), List.of(), keyA, found(keyA, 1)));
		aggregator.handleDocumentChange(new DocumentChange(List.of(LIMBO_TARGET, LISTEN_TARGET), List.of(), keyB, found(keyB, 1)));

		RemoteEvent event = aggregator.createRemoteEvent(version(1));
		assertEquals(Set.of(keyA), event.resolvedLimboDocuments());
	}

	static SnapshotVersion version(long micros) {
		return SnapshotVersion.ofMicros(micros);
	}

	static Document found(DocumentKey key, long version) {
		return Document.found(key, version(version), ObjectValue.fromMap(Map.of("version", version)));
	}
}

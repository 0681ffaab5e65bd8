package io.vena.drift.model.mutation;

import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.FieldPath;
import io.vena.drift.model.ObjectValue;
import io.vena.drift.model.ServerTimestampValue;
import io.vena.drift.model.SnapshotVersion;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MutationTest {
	static final Instant WRITE_TIME = Instant.parse("2024-05-06T07:08:09Z");
	static final SnapshotVersion COMMIT_VERSION = SnapshotVersion.ofMicros(2_000);

	final DocumentKey key = DocumentKey.of("coll", "a");
	final Document existing = Document.found(key, SnapshotVersion.ofMicros(1_000), data(Map.of(
		"name", "old",
		"count", 5,
		"nested", Map.of("x", 1, "y", 2),
		"tags", List.of("a", "b"))));

	@Test
	void set_replacesDocumentLocally() {
		Mutation set = new SetMutation(key, data(Map.of("name", "new")), Precondition.NONE);
		OverlayedDocument result = set.applyToLocalView(OverlayedDocument.unmutated(existing), WRITE_TIME);

		assertEquals(data(Map.of("name", "new")), result.document().data());
		assertTrue(result.document().hasLocalMutations());
		assertNull(result.mutatedFields(), "A set overwrites the whole document");
	}

	@Test
	void patch_updatesAndDeletesMaskedFields() {
		Mutation patch = new PatchMutation(
			key,
			data(Map.of("nested", Map.of("x", 10))),
			FieldMask.of(FieldPath.of("nested", "x"), FieldPath.of("name")),
			Precondition.exists(true));
		OverlayedDocument result = patch.applyToLocalView(OverlayedDocument.unmutated(existing), WRITE_TIME);

		ObjectValue data = result.document().data();
		assertEquals(10L, data.get(FieldPath.of("nested", "x")));
		assertEquals(2L, data.get(FieldPath.of("nested", "y")));
		assertFalse(data.has(FieldPath.of("name")), "Masked field absent from the value is deleted");
		assertEquals(5L, data.get(FieldPath.of("count")));
	}

	@Test
	void patchWithUnmetPrecondition_hasNoLocalEffect_butRemoteResultIsUnknown() {
		Document missing = Document.noDocument(key, SnapshotVersion.ofMicros(1_000));
		Mutation patch = new PatchMutation(key, data(Map.of("name", "x")), FieldMask.of(FieldPath.of("name")), Precondition.exists(true));

		OverlayedDocument unmutated = OverlayedDocument.unmutated(missing);
		assertSame(unmutated, patch.applyToLocalView(unmutated, WRITE_TIME));

		Document remote = patch.applyToRemoteDocument(missing, new MutationResult(COMMIT_VERSION, List.of()));
		assertTrue(remote.isUnknown());
		assertEquals(COMMIT_VERSION, remote.version());
		assertTrue(remote.hasCommittedMutations());
	}

	@Test
	void delete_leavesNoDocument() {
		Mutation delete = new DeleteMutation(key, Precondition.NONE);
		Document local = delete.applyToLocalView(OverlayedDocument.unmutated(existing), WRITE_TIME).document();
		assertTrue(local.isNoDocument());
		assertTrue(local.hasLocalMutations());

		Document remote = delete.applyToRemoteDocument(existing, new MutationResult(COMMIT_VERSION, List.of()));
		assertTrue(remote.isNoDocument());
		assertEquals(COMMIT_VERSION, remote.version());
	}

	@Test
	void serverTimestamp_isPlaceholderLocallyAndServerTimeRemotely() {
		Instant serverTime = Instant.parse("2024-05-06T07:08:10Z");
		Mutation patch = new PatchMutation(
			key, ObjectValue.empty(), FieldMask.EMPTY, Precondition.NONE,
			List.of(new FieldTransform(FieldPath.of("name"), ServerTimestampOperation.INSTANCE)));

		Object local = patch.applyToLocalView(OverlayedDocument.unmutated(existing), WRITE_TIME).document().data().get(FieldPath.of("name"));
		assertThat(local, instanceOf(ServerTimestampValue.class));
		assertEquals(WRITE_TIME, ((ServerTimestampValue) local).localWriteTime());
		assertEquals("old", ((ServerTimestampValue) local).previousValue());

		Document remote = patch.applyToRemoteDocument(existing, new MutationResult(COMMIT_VERSION, List.of(serverTime)));
		assertEquals(serverTime, remote.data().get(FieldPath.of("name")));
	}

	@Test
	void increment_treatsNonNumbersAsZeroAndSaturates() {
		NumericIncrementOperation increment = new NumericIncrementOperation(3);
		assertEquals(8L, increment.applyToLocalView(5L, WRITE_TIME));
		assertEquals(3L, increment.applyToLocalView("not a number", WRITE_TIME));
		assertEquals(5.5, increment.applyToLocalView(2.5, WRITE_TIME));
		assertEquals(Long.MAX_VALUE, new NumericIncrementOperation(Long.MAX_VALUE).applyToLocalView(1L, WRITE_TIME));
		assertEquals(0L, increment.computeBaseValue(null));
	}

	@Test
	void incrementBaseValue_isRecordedForPendingWrites() {
		Mutation patch = new PatchMutation(
			key, ObjectValue.empty(), FieldMask.EMPTY, Precondition.NONE,
			List.of(
				new FieldTransform(FieldPath.of("count"), new NumericIncrementOperation(1)),
				new FieldTransform(FieldPath.of("name"), ServerTimestampOperation.INSTANCE)));
		assertEquals(data(Map.of("count", 5)), patch.extractTransformBaseValue(existing));
	}

	@Test
	void arrayTransforms_unionAndRemoveByValue() {
		assertEquals(List.of("a", "b", "c"), new ArrayTransformOperation.Union(List.of("b", "c")).applyToLocalView(List.of("a", "b"), WRITE_TIME));
		assertEquals(List.of(1L), new ArrayTransformOperation.Union(List.of(1)).applyToLocalView("not an array", WRITE_TIME));
		assertEquals(List.of("b"), new ArrayTransformOperation.Remove(List.of("a")).applyToLocalView(List.of("a", "b", "a"), WRITE_TIME));
		assertEquals(List.of(), new ArrayTransformOperation.Remove(List.of(1.0)).applyToLocalView(List.of(1L), WRITE_TIME));
	}

	@Test
	void overlayMutation_collapsesPatches() {
		OverlayedDocument view = OverlayedDocument.unmutated(existing);
		view = new PatchMutation(key, data(Map.of("name", "first")), FieldMask.of(FieldPath.of("name")), Precondition.NONE)
			.applyToLocalView(view, WRITE_TIME);
		view = new PatchMutation(key, ObjectValue.empty(), FieldMask.of(FieldPath.of("nested", "y")), Precondition.NONE)
			.applyToLocalView(view, WRITE_TIME);

		Mutation overlay = Mutation.calculateOverlayMutation(view.document(), view.mutatedFields());
		assertThat(overlay, instanceOf(PatchMutation.class));
		Document reapplied = overlay.applyToLocalView(OverlayedDocument.unmutated(existing), WRITE_TIME).document();
		assertEquals(view.document().data(), reapplied.data());
	}

	@Test
	void overlayMutation_forDeletedDocumentIsDelete() {
		OverlayedDocument view = new DeleteMutation(key, Precondition.NONE).applyToLocalView(OverlayedDocument.unmutated(existing), WRITE_TIME);
		assertThat(Mutation.calculateOverlayMutation(view.document(), view.mutatedFields()), instanceOf(DeleteMutation.class));
		assertNull(Mutation.calculateOverlayMutation(existing, FieldMask.EMPTY));
	}

	private static ObjectValue data(Map<String, ?> fields) {
		return ObjectValue.fromMap(fields);
	}
}

package io.vena.drift.model;

import io.vena.drift.exceptions.MalformedPathException;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathsTest {

	@Test
	void resourcePath_parsesSlashes() {
		assertEquals(ResourcePath.of("rooms", "lobby", "messages"), ResourcePath.fromString("/rooms/lobby/messages/"));
		assertTrue(ResourcePath.fromString("///").isEmpty());
		assertThrows(MalformedPathException.class, () -> ResourcePath.fromString("rooms//lobby"));
		assertThrows(MalformedPathException.class, () -> ResourcePath.of("a/b"));
	}

	@Test
	void resourcePath_prefixes() {
		ResourcePath rooms = ResourcePath.of("rooms");
		ResourcePath lobby = ResourcePath.of("rooms", "lobby");
		assertTrue(rooms.isPrefixOf(lobby));
		assertTrue(rooms.isImmediateParentOf(lobby));
		assertFalse(rooms.isImmediateParentOf(lobby.append("messages")));
		assertEquals(rooms, lobby.popLast());
		assertEquals(ResourcePath.of("lobby"), lobby.popFirst());
	}

	@Test
	void resourcePath_sortsBySegment() {
		// Segment-wise, not character-wise: "a/b" sorts before "a-b"
		assertThat(ResourcePath.of("a", "b").compareTo(ResourcePath.of("a-b")), lessThan(0));
		assertThat(ResourcePath.of("a").compareTo(ResourcePath.of("a", "b")), lessThan(0));
	}

	@Test
	void documentKey_requiresEvenLength() {
		DocumentKey key = DocumentKey.fromPathString("rooms/lobby");
		assertEquals("rooms/lobby", key.path().canonicalString());
		assertThrows(IllegalArgumentException.class, () -> DocumentKey.fromPathString("rooms"));
		assertThrows(IllegalArgumentException.class, () -> DocumentKey.of("rooms", "lobby", "messages"));
	}

	@Test
	void fieldPath_keepsDotsInsideSegments() {
		FieldPath path = FieldPath.of("a", "b.c");
		assertEquals(2, path.length());
		assertEquals(List.of("a", "b", "c"), FieldPath.fromDotSeparatedString("a.b.c").segments());
		assertTrue(FieldPath.of("a").isPrefixOf(path));
		assertTrue(FieldPath.KEY_PATH.isKeyField());
	}
}

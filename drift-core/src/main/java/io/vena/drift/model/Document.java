package io.vena.drift.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * The cached state of one document, as a closed set of variants selected by {@link Kind}.
 *
 * <p>
 * An absent or not-yet-loaded document is represented as {@link Kind#INVALID} rather than null,
 * so every lookup returns a {@code Document}.
 * Only {@link Kind#FOUND} documents carry data; all other kinds carry {@link ObjectValue#empty()}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Document {
	@NonNull DocumentKey key;
	@NonNull Kind kind;

	/**
	 * Version of the last server state this document reflects; {@link SnapshotVersion#NONE} if none.
	 */
	@NonNull SnapshotVersion version;

	/**
	 * When the remote document cache last received this document; not part of equality.
	 */
	@EqualsAndHashCode.Exclude
	@NonNull SnapshotVersion readTime;

	@NonNull SnapshotVersion createTime;
	@NonNull ObjectValue data;
	@NonNull State state;

	public enum Kind {
		/** Not known to exist or not exist; the result of a cache miss. */
		INVALID,
		/** Exists, with known contents. */
		FOUND,
		/** Known not to exist. */
		NO_DOCUMENT,
		/** Known to exist, but contents unknown, eg. after a write acknowledgement without a read. */
		UNKNOWN,
	}

	public enum State {
		SYNCED,
		HAS_LOCAL_MUTATIONS,
		HAS_COMMITTED_MUTATIONS,
	}

	public static Document invalid(DocumentKey key) {
		return new Document(key, Kind.INVALID, SnapshotVersion.NONE, SnapshotVersion.NONE, SnapshotVersion.NONE, ObjectValue.empty(), State.SYNCED);
	}

	public static Document found(DocumentKey key, SnapshotVersion version, ObjectValue data) {
		return new Document(key, Kind.FOUND, version, SnapshotVersion.NONE, SnapshotVersion.NONE, data, State.SYNCED);
	}

	public static Document noDocument(DocumentKey key, SnapshotVersion version) {
		return new Document(key, Kind.NO_DOCUMENT, version, SnapshotVersion.NONE, SnapshotVersion.NONE, ObjectValue.empty(), State.SYNCED);
	}

	public static Document unknown(DocumentKey key, SnapshotVersion version) {
		return new Document(key, Kind.UNKNOWN, version, SnapshotVersion.NONE, SnapshotVersion.NONE, ObjectValue.empty(), State.HAS_COMMITTED_MUTATIONS);
	}

	/**
	 * Rebuilds a document exactly as it was persisted.
	 */
	public static Document restore(DocumentKey key, Kind kind, SnapshotVersion version, SnapshotVersion readTime, SnapshotVersion createTime, ObjectValue data, State state) {
		return new Document(key, kind, version, readTime, createTime, data, state);
	}

	public Document asFound(SnapshotVersion newVersion, ObjectValue newData) {
		SnapshotVersion newCreateTime = (kind == Kind.FOUND) ? createTime : SnapshotVersion.NONE;
		return new Document(key, Kind.FOUND, newVersion, readTime, newCreateTime, newData, State.SYNCED);
	}

	public Document asNoDocument(SnapshotVersion newVersion) {
		return new Document(key, Kind.NO_DOCUMENT, newVersion, readTime, SnapshotVersion.NONE, ObjectValue.empty(), State.SYNCED);
	}

	public Document asUnknown(SnapshotVersion newVersion) {
		return new Document(key, Kind.UNKNOWN, newVersion, readTime, SnapshotVersion.NONE, ObjectValue.empty(), State.HAS_COMMITTED_MUTATIONS);
	}

	public Document withData(ObjectValue newData) {
		return new Document(key, kind, version, readTime, createTime, newData, state);
	}

	public Document withReadTime(SnapshotVersion newReadTime) {
		return new Document(key, kind, version, newReadTime, createTime, data, state);
	}

	public Document withCreateTime(SnapshotVersion newCreateTime) {
		return new Document(key, kind, version, readTime, newCreateTime, data, state);
	}

	public Document withLocalMutations() {
		return new Document(key, kind, SnapshotVersion.NONE, readTime, createTime, data, State.HAS_LOCAL_MUTATIONS);
	}

	public Document withCommittedMutations() {
		return new Document(key, kind, version, readTime, createTime, data, State.HAS_COMMITTED_MUTATIONS);
	}

	public Document synced() {
		return new Document(key, kind, version, readTime, createTime, data, State.SYNCED);
	}

	public boolean isValid() { return kind != Kind.INVALID; }
	public boolean isFound() { return kind == Kind.FOUND; }
	public boolean isNoDocument() { return kind == Kind.NO_DOCUMENT; }
	public boolean isUnknown() { return kind == Kind.UNKNOWN; }

	public boolean hasLocalMutations() { return state == State.HAS_LOCAL_MUTATIONS; }
	public boolean hasCommittedMutations() { return state == State.HAS_COMMITTED_MUTATIONS; }
	public boolean hasPendingWrites() { return hasLocalMutations() || hasCommittedMutations(); }

	/**
	 * @return the field value, or the {@link DocumentKey} itself for {@link FieldPath#KEY_PATH}
	 */
	public @Nullable Object field(FieldPath path) {
		if (path.isKeyField()) {
			return key;
		}
		return data.get(path);
	}

	public boolean hasField(FieldPath path) {
		return path.isKeyField() || data.has(path);
	}

	@Override
	public String toString() {
		return "Document{" + key + ", " + kind + ", " + version + ", " + state + ", " + data + "}";
	}
}

package io.vena.drift.model;

import java.time.Instant;
import lombok.NonNull;
import lombok.Value;

/**
 * A server-assigned point in time at which a document or snapshot was read or written.
 */
@Value
public class SnapshotVersion implements Comparable<SnapshotVersion> {
	public static final SnapshotVersion NONE = new SnapshotVersion(Instant.EPOCH);

	@NonNull Instant timestamp;

	public static SnapshotVersion of(Instant timestamp) {
		return new SnapshotVersion(timestamp);
	}

	public static SnapshotVersion ofMicros(long micros) {
		return new SnapshotVersion(Instant.EPOCH.plusNanos(micros * 1_000));
	}

	public boolean isNone() {
		return this.equals(NONE);
	}

	public boolean isAfter(SnapshotVersion other) {
		return compareTo(other) > 0;
	}

	@Override
	public int compareTo(SnapshotVersion other) {
		return timestamp.compareTo(other.timestamp);
	}

	@Override
	public String toString() {
		return "SnapshotVersion(" + timestamp + ")";
	}
}

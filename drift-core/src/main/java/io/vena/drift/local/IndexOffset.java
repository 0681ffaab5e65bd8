package io.vena.drift.local;

import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.SnapshotVersion;
import java.time.Instant;
import java.util.Comparator;
import lombok.Value;

/**
 * A position in the remote document cache ordered by read time, then key,
 * plus the largest batch id whose overlays have been accounted for.
 * Scans "since" an offset see only documents strictly after it.
 */
@Value
public class IndexOffset implements Comparable<IndexOffset> {
	public static final IndexOffset NONE = new IndexOffset(SnapshotVersion.NONE, DocumentKey.empty(), -1);

	SnapshotVersion readTime;
	DocumentKey documentKey;
	int largestBatchId;

	private static final Comparator<IndexOffset> COMPARATOR = Comparator
		.comparing(IndexOffset::readTime)
		.thenComparing(IndexOffset::documentKey)
		.thenComparingInt(IndexOffset::largestBatchId);

	public static IndexOffset create(SnapshotVersion readTime, DocumentKey key, int largestBatchId) {
		return new IndexOffset(readTime, key, largestBatchId);
	}

	/**
	 * @return an offset that every document read after <code>readTime</code> is past
	 */
	public static IndexOffset createSuccessor(SnapshotVersion readTime, int largestBatchId) {
		Instant successor = readTime.timestamp().plusNanos(1);
		return new IndexOffset(SnapshotVersion.of(successor), DocumentKey.empty(), largestBatchId);
	}

	public static IndexOffset fromDocument(Document document) {
		return new IndexOffset(document.readTime(), document.key(), -1);
	}

	@Override
	public int compareTo(IndexOffset other) {
		return COMPARATOR.compare(this, other);
	}
}

package io.vena.drift.local;

import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import java.util.SortedMap;
import lombok.Value;

@Value
public class LocalWriteResult {
	int batchId;

	/**
	 * The local view of every document the write touched.
	 */
	SortedMap<DocumentKey, Document> changes;
}

package io.vena.drift.local;

/**
 * Per-execution statistics gathered by the {@link QueryEngine}.
 */
public class QueryContext {
	private int documentReadCount = 0;

	public int getDocumentReadCount() {
		return documentReadCount;
	}

	public void incrementDocumentReadCount() {
		documentReadCount++;
	}
}

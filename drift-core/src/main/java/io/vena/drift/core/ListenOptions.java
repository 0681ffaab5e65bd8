package io.vena.drift.core;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

/**
 * Which snapshots a listener wants to hear about.
 */
@Value
@Builder
public class ListenOptions {
	/**
	 * Raise snapshots when only a document's pending-write state changed.
	 */
	@Default boolean includeDocumentMetadataChanges = false;

	/**
	 * Raise snapshots when only the query's {@code fromCache} or pending-write state changed.
	 */
	@Default boolean includeQueryMetadataChanges = false;

	/**
	 * While possibly online, hold back the first snapshot until the server confirms it.
	 */
	@Default boolean waitForSyncWhenOnline = false;

	public static ListenOptions defaults() {
		return ListenOptions.builder().build();
	}

	public static ListenOptions includeMetadataChanges() {
		return ListenOptions.builder()
			.includeDocumentMetadataChanges(true)
			.includeQueryMetadataChanges(true)
			.build();
	}
}

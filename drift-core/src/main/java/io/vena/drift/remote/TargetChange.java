package io.vena.drift.remote;

import io.vena.drift.model.DocumentKey;
import java.util.Set;
import lombok.Value;

/**
 * What happened to one target in a {@link RemoteEvent}.
 */
@Value
public class TargetChange {
	/**
	 * Empty if the server didn't send a new one.
	 */
	String resumeToken;

	/**
	 * Whether the target's results are in sync with the server as of the event's snapshot version.
	 */
	boolean current;

	Set<DocumentKey> addedDocuments;
	Set<DocumentKey> modifiedDocuments;
	Set<DocumentKey> removedDocuments;

	public static TargetChange createSynthesizedTargetChangeForCurrentChange(boolean current, String resumeToken) {
		return new TargetChange(resumeToken, current, Set.of(), Set.of(), Set.of());
	}

	public boolean touchesDocuments() {
		return !addedDocuments.isEmpty() || !modifiedDocuments.isEmpty() || !removedDocuments.isEmpty();
	}
}

package io.vena.drift.remote;

import io.vena.drift.core.DocumentViewChange;
import io.vena.drift.model.DocumentKey;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The watch stream's view of one target between two remote events.
 */
final class TargetState {
	/**
	 * Listen and unlisten requests still awaiting a response.
	 * Changes for a target with outstanding responses are dropped.
	 */
	private int outstandingResponses = 0;

	private final Map<DocumentKey, DocumentViewChange.Type> documentChanges = new HashMap<>();

	/**
	 * Starts true so a newly added target raises a snapshot even when empty.
	 */
	private boolean hasChanges = true;

	private String resumeToken = "";
	private boolean current = false;

	boolean isCurrent() {
		return current;
	}

	boolean isPending() {
		return outstandingResponses != 0;
	}

	boolean hasChanges() {
		return hasChanges;
	}

	/**
	 * Empty tokens are ignored.
	 */
	void updateResumeToken(String resumeToken) {
		if (!resumeToken.isEmpty()) {
			hasChanges = true;
			this.resumeToken = resumeToken;
		}
	}

	TargetChange toTargetChange() {
		Set<DocumentKey> addedDocuments = new HashSet<>();
		Set<DocumentKey> modifiedDocuments = new HashSet<>();
		Set<DocumentKey> removedDocuments = new HashSet<>();
		documentChanges.forEach((key, changeType) -> {
			switch (changeType) {
				case ADDED:
					addedDocuments.add(key);
					break;
				case MODIFIED:
					modifiedDocuments.add(key);
					break;
				case REMOVED:
					removedDocuments.add(key);
					break;
				default:
					throw new AssertionError("Encountered invalid change type: " + changeType);
			}
		});
		return new TargetChange(resumeToken, current, Set.copyOf(addedDocuments), Set.copyOf(modifiedDocuments), Set.copyOf(removedDocuments));
	}

	void clearChanges() {
		hasChanges = false;
		documentChanges.clear();
	}

	void addDocumentChange(DocumentKey key, DocumentViewChange.Type changeType) {
		hasChanges = true;
		documentChanges.put(key, changeType);
	}

	void removeDocumentChange(DocumentKey key) {
		hasChanges = true;
		documentChanges.remove(key);
	}

	void recordPendingTargetRequest() {
		++outstandingResponses;
	}

	void recordTargetResponse() {
		--outstandingResponses;
		if (outstandingResponses < 0) {
			throw new AssertionError("outstandingResponses is negative: " + outstandingResponses);
		}
	}

	void markCurrent() {
		hasChanges = true;
		current = true;
	}
}

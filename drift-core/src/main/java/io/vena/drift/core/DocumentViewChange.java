package io.vena.drift.core;

import io.vena.drift.model.Document;
import lombok.Value;

@Value
public class DocumentViewChange {
	public enum Type {
		REMOVED,
		ADDED,
		MODIFIED,
		/** Only the document's pending-write state changed. */
		METADATA,
	}

	Type type;
	Document document;
}

package io.vena.drift.core;

import io.vena.drift.model.DocumentKey;
import lombok.Value;

/**
 * A document entering or leaving limbo in one view.
 */
@Value
public class LimboDocumentChange {
	public enum Type {
		ADDED,
		REMOVED,
	}

	Type type;
	DocumentKey key;
}

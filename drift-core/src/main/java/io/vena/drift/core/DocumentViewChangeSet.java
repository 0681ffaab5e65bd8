package io.vena.drift.core;

import io.vena.drift.core.DocumentViewChange.Type;
import io.vena.drift.model.DocumentKey;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Accumulates view changes, folding successive changes to one document into one.
 */
public class DocumentViewChangeSet {
	private final TreeMap<DocumentKey, DocumentViewChange> changes = new TreeMap<>();

	public void addChange(DocumentViewChange change) {
		DocumentKey key = change.document().key();
		DocumentViewChange old = changes.get(key);
		if (old == null) {
			changes.put(key, change);
			return;
		}

		Type oldType = old.type();
		Type newType = change.type();
		if (newType != Type.ADDED && oldType == Type.METADATA) {
			changes.put(key, change);
		} else if (newType == Type.METADATA && oldType != Type.REMOVED) {
			changes.put(key, new DocumentViewChange(oldType, change.document()));
		} else if (newType == Type.MODIFIED && oldType == Type.MODIFIED) {
			changes.put(key, new DocumentViewChange(Type.MODIFIED, change.document()));
		} else if (newType == Type.MODIFIED && oldType == Type.ADDED) {
			changes.put(key, new DocumentViewChange(Type.ADDED, change.document()));
		} else if (newType == Type.REMOVED && oldType == Type.ADDED) {
			changes.remove(key);
		} else if (newType == Type.REMOVED && oldType == Type.MODIFIED) {
			changes.put(key, new DocumentViewChange(Type.REMOVED, old.document()));
		} else if (newType == Type.ADDED && oldType == Type.REMOVED) {
			changes.put(key, new DocumentViewChange(Type.MODIFIED, change.document()));
		} else {
			throw new AssertionError("Unsupported combination of changes " + newType + " after " + oldType);
		}
	}

	public List<DocumentViewChange> getChanges() {
		return new ArrayList<>(changes.values());
	}
}

package io.vena.drift.local;

import io.vena.drift.core.DocumentViewChange;
import io.vena.drift.core.ViewSnapshot;
import io.vena.drift.model.DocumentKey;
import java.util.Set;
import java.util.TreeSet;
import lombok.Value;

/**
 * The documents that entered and left a view's results, which the local store
 * pins for as long as the view shows them.
 */
@Value
public class LocalViewChanges {
	int targetId;
	boolean fromCache;
	Set<DocumentKey> added;
	Set<DocumentKey> removed;

	public static LocalViewChanges fromViewSnapshot(int targetId, ViewSnapshot snapshot) {
		Set<DocumentKey> added = new TreeSet<>();
		Set<DocumentKey> removed = new TreeSet<>();
		for (DocumentViewChange change: snapshot.changes()) {
			switch (change.type()) {
				case ADDED:
					added.add(change.document().key());
					break;
				case REMOVED:
					removed.add(change.document().key());
					break;
				default:
					break;
			}
		}
		return new LocalViewChanges(targetId, snapshot.fromCache(), added, removed);
	}
}

package io.vena.drift.model.mutation;

import io.vena.drift.model.Document;
import io.vena.drift.model.SnapshotVersion;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * A condition on the prior state of a document that must hold for a mutation to apply.
 * At most one of {@link #updateTime} and {@link #exists} is set; neither means {@link #NONE}.
 */
@Value
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class Precondition {
	public static final Precondition NONE = new Precondition(null, null);

	@Nullable SnapshotVersion updateTime;
	@Nullable Boolean exists;

	public static Precondition exists(boolean exists) {
		return new Precondition(null, exists);
	}

	public static Precondition updateTime(SnapshotVersion updateTime) {
		return new Precondition(updateTime, null);
	}

	public boolean isNone() {
		return updateTime == null && exists == null;
	}

	public boolean isValidFor(Document document) {
		if (updateTime != null) {
			return document.isFound() && document.version().equals(updateTime);
		} else if (exists != null) {
			return exists == document.isFound();
		} else {
			return true;
		}
	}
}

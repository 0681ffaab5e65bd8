package io.vena.drift.model;

import java.time.Instant;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * Placeholder stored in the local view of a field whose value the server will set
 * to its commit time. Sorts after all real timestamps, ordered by local write time.
 */
@Value
public class ServerTimestampValue {
	Instant localWriteTime;

	/**
	 * What the field held before the transform was applied locally; may be another placeholder.
	 */
	@Nullable Object previousValue;

	@Override
	public String toString() {
		return "ServerTimestamp(" + localWriteTime + ")";
	}
}

package io.vena.drift.model.mutation;

import io.vena.drift.model.ServerTimestampValue;
import java.time.Instant;
import org.jetbrains.annotations.Nullable;

/**
 * Sets a field to the commit time of the write.
 */
public final class ServerTimestampOperation implements TransformOperation {
	public static final ServerTimestampOperation INSTANCE = new ServerTimestampOperation();

	private ServerTimestampOperation() {}

	@Override
	public Object applyToLocalView(@Nullable Object previousValue, Instant localWriteTime) {
		return new ServerTimestampValue(localWriteTime, previousValue);
	}

	@Override
	public @Nullable Object applyToRemoteDocument(@Nullable Object previousValue, @Nullable Object transformResult) {
		return transformResult;
	}

	@Override
	public @Nullable Object computeBaseValue(@Nullable Object previousValue) {
		return null;
	}

	@Override
	public String toString() {
		return "ServerTimestamp";
	}
}

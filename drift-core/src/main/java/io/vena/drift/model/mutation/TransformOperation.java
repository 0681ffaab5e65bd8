package io.vena.drift.model.mutation;

import java.time.Instant;
import org.jetbrains.annotations.Nullable;

/**
 * A field transform whose result is only known for certain once the server reports it.
 */
public interface TransformOperation {
	/**
	 * Estimates the result locally, before the server has seen the write.
	 */
	@Nullable Object applyToLocalView(@Nullable Object previousValue, Instant localWriteTime);

	/**
	 * @param transformResult the value the server reported, if it reports one for this kind of transform
	 */
	@Nullable Object applyToRemoteDocument(@Nullable Object previousValue, @Nullable Object transformResult);

	/**
	 * For non-idempotent transforms, the value the transform should be considered to start from,
	 * recorded so that a re-delivered server snapshot doesn't apply the transform twice.
	 * Null for idempotent transforms.
	 */
	@Nullable Object computeBaseValue(@Nullable Object previousValue);
}

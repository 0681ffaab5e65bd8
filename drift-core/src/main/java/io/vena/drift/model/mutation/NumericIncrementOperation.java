package io.vena.drift.model.mutation;

import io.vena.drift.model.Values;
import java.time.Instant;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * Adds {@link #operand} to a numeric field, treating non-numeric fields as zero.
 * Integer addition saturates instead of overflowing.
 */
@Value
public class NumericIncrementOperation implements TransformOperation {
	Number operand;

	public NumericIncrementOperation(Number operand) {
		Object normalized = Values.normalize(operand);
		if (!Values.isNumber(normalized)) {
			throw new IllegalArgumentException("Increment operand must be a number: " + operand);
		}
		this.operand = (Number) normalized;
	}

	@Override
	public Object applyToLocalView(@Nullable Object previousValue, Instant localWriteTime) {
		Number base = (Number) computeBaseValue(previousValue);
		if (base instanceof Long && operand instanceof Long) {
			return safeIncrement(base.longValue(), operand.longValue());
		}
		return base.doubleValue() + operand.doubleValue();
	}

	@Override
	public @Nullable Object applyToRemoteDocument(@Nullable Object previousValue, @Nullable Object transformResult) {
		if (transformResult == null) {
			throw new IllegalStateException("Server reported no result for a numeric increment");
		}
		return transformResult;
	}

	@Override
	public Object computeBaseValue(@Nullable Object previousValue) {
		return Values.isNumber(previousValue) ? previousValue : (Object) 0L;
	}

	private static long safeIncrement(long x, long y) {
		long r = x + y;
		// Overflow iff both arguments have the opposite sign of the result
		if (((x ^ r) & (y ^ r)) >= 0) {
			return r;
		}
		return (r >= 0L) ? Long.MIN_VALUE : Long.MAX_VALUE;
	}

	@Override
	public String toString() {
		return "Increment(" + operand + ")";
	}
}

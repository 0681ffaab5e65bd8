package io.vena.drift.exceptions;

import lombok.Getter;
import lombok.NonNull;

/**
 * A failure that is reported to the application, tagged with a {@link Code}
 * that says whether retrying could help.
 */
public class DriftException extends RuntimeException {
	@Getter private final Code code;

	public DriftException(String message, @NonNull Code code) {
		super(message);
		this.code = code;
	}

	public DriftException(String message, @NonNull Code code, Throwable cause) {
		super(message, cause);
		this.code = code;
	}

	/**
	 * Same numbering as gRPC status codes.
	 */
	public enum Code {
		OK(0),
		CANCELLED(1),
		UNKNOWN(2),
		INVALID_ARGUMENT(3),
		DEADLINE_EXCEEDED(4),
		NOT_FOUND(5),
		ALREADY_EXISTS(6),
		PERMISSION_DENIED(7),
		RESOURCE_EXHAUSTED(8),
		FAILED_PRECONDITION(9),
		ABORTED(10),
		OUT_OF_RANGE(11),
		UNIMPLEMENTED(12),
		INTERNAL(13),
		UNAVAILABLE(14),
		DATA_LOSS(15),
		UNAUTHENTICATED(16);

		private final int value;

		Code(int value) {
			this.value = value;
		}

		public int value() {
			return value;
		}

		public static Code fromValue(int value) {
			for (Code code: values()) {
				if (code.value == value) {
					return code;
				}
			}
			return UNKNOWN;
		}
	}
}

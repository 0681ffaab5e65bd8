package io.vena.drift.remote;

import io.vena.drift.exceptions.DriftException;
import io.vena.drift.exceptions.DriftException.Code;
import lombok.NonNull;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of a stream or of one target on the watch stream, as reported by a transport.
 */
@Value
public class Status {
	public static final Status OK = new Status(Code.OK, null, null);

	@NonNull Code code;
	@Nullable String description;
	@Nullable Throwable cause;

	public static Status of(Code code) {
		return new Status(code, null, null);
	}

	public static Status of(Code code, String description) {
		return new Status(code, description, null);
	}

	public static Status fromThrowable(Throwable cause) {
		if (cause instanceof DriftException) {
			return new Status(((DriftException) cause).code(), cause.getMessage(), cause);
		}
		return new Status(Code.UNKNOWN, cause.toString(), cause);
	}

	public boolean isOk() {
		return code == Code.OK;
	}

	/**
	 * Whether retrying the same request can't be expected to help.
	 */
	public boolean isPermanentError() {
		switch (code) {
			case OK:
				throw new IllegalArgumentException("Treated status OK as error");
			case CANCELLED:
			case UNKNOWN:
			case DEADLINE_EXCEEDED:
			case RESOURCE_EXHAUSTED:
			case INTERNAL:
			case UNAVAILABLE:
			case UNAUTHENTICATED:
				return false;
			default:
				return true;
		}
	}

	/**
	 * Like {@link #isPermanentError()}, except that an aborted write is worth resending:
	 * it usually means contention on the server.
	 */
	public boolean isPermanentWriteError() {
		return isPermanentError() && code != Code.ABORTED;
	}

	public DriftException asException() {
		String message = description == null ? code.name() : description;
		return cause == null ? new DriftException(message, code) : new DriftException(message, code, cause);
	}

	@Override
	public String toString() {
		return description == null ? code.name() : code + ": " + description;
	}
}

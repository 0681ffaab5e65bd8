package io.vena.drift.exceptions;

public class MalformedPathException extends IllegalArgumentException {
	public MalformedPathException(String message) { super(message); }
	public MalformedPathException(String message, Throwable cause) { super(message, cause); }
	public MalformedPathException(Throwable cause) { super(cause); }
}

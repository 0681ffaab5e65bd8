package io.vena.drift.exceptions;

import java.io.IOException;

/**
 * Indicates that durable persistence could not be opened, usually because
 * another client holds the exclusive lease on it.
 *
 * <p>
 * Callers recover by continuing with memory-only persistence; this is not fatal.
 */
public class PersistenceUnavailableException extends IOException {
	public PersistenceUnavailableException(String message) { super(message); }
	public PersistenceUnavailableException(String message, Throwable cause) { super(message, cause); }
}

package io.vena.drift.local;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Remembers the state of one memory store at the start of a transaction.
 * Store states are immutable values, so restoring is just putting the old value back.
 */
final class Checkpoint<S> {
	private final S saved;
	private final Supplier<S> current;
	private final Consumer<S> restorer;

	Checkpoint(S saved, Supplier<S> current, Consumer<S> restorer) {
		this.saved = saved;
		this.current = current;
		this.restorer = restorer;
	}

	void restore() {
		restorer.accept(saved);
	}

	boolean isModified() {
		return current.get() != saved;
	}
}

package io.vena.drift.local;

import io.vena.drift.model.DocumentKey;
import java.util.function.Supplier;

/**
 * Keeps track of what keeps each cached document alive, so that documents nothing
 * refers to anymore can be garbage collected.
 *
 * <p>
 * A document is referenced while it is in the result set of a target,
 * touched by a pending mutation, or pinned by a local view.
 * Every callback runs inside a persistence transaction.
 */
public interface ReferenceDelegate {
	/**
	 * Supplies the references held by local views, which aren't persisted.
	 */
	void setInMemoryPins(Supplier<ReferenceSet> inMemoryPins);

	/** A target started matching this document. */
	void addReference(DocumentKey key);

	/** A target stopped matching this document. */
	void removeReference(DocumentKey key);

	/** A mutation batch touching this document was removed from the queue. */
	void removeMutationReference(DocumentKey key);

	/** The last listener of a target went away. */
	void removeTarget(TargetData targetData);

	/** A limbo document was resolved. */
	void updateLimboDocument(DocumentKey key);

	/**
	 * The sequence number of the current transaction.
	 */
	long getCurrentSequenceNumber();

	void onTransactionStarted();

	void onTransactionCommitted();
}

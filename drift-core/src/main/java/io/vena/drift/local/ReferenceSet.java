package io.vena.drift.local;

import io.vena.drift.model.DocumentKey;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import org.pcollections.PSortedSet;
import org.pcollections.TreePSet;

/**
 * An immutable collection of (key, id) references, indexed both ways so we can ask
 * "is this key referenced at all?" and "which keys does this id reference?" cheaply.
 *
 * <p>
 * Used for target-to-document associations in the memory target cache,
 * and for documents pinned by local views in the {@link LocalStore}.
 */
public final class ReferenceSet {
	private static final ReferenceSet EMPTY = new ReferenceSet(TreePSet.empty(DocumentReference.BY_KEY), TreePSet.empty(DocumentReference.BY_ID));

	private final PSortedSet<DocumentReference> referencesByKey;
	private final PSortedSet<DocumentReference> referencesById;

	private ReferenceSet(PSortedSet<DocumentReference> referencesByKey, PSortedSet<DocumentReference> referencesById) {
		this.referencesByKey = referencesByKey;
		this.referencesById = referencesById;
	}

	public static ReferenceSet empty() {
		return EMPTY;
	}

	public boolean isEmpty() {
		return referencesByKey.isEmpty();
	}

	public int size() {
		return referencesByKey.size();
	}

	public ReferenceSet plus(DocumentKey key, int id) {
		DocumentReference ref = new DocumentReference(key, id);
		return new ReferenceSet(referencesByKey.plus(ref), referencesById.plus(ref));
	}

	public ReferenceSet plusAll(Iterable<DocumentKey> keys, int id) {
		ReferenceSet result = this;
		for (DocumentKey key: keys) {
			result = result.plus(key, id);
		}
		return result;
	}

	public ReferenceSet minus(DocumentKey key, int id) {
		DocumentReference ref = new DocumentReference(key, id);
		return new ReferenceSet(referencesByKey.minus(ref), referencesById.minus(ref));
	}

	public ReferenceSet minusAll(Iterable<DocumentKey> keys, int id) {
		ReferenceSet result = this;
		for (DocumentKey key: keys) {
			result = result.minus(key, id);
		}
		return result;
	}

	public ReferenceSet minusAllForId(int id) {
		return minusAll(referencesForId(id), id);
	}

	public Set<DocumentKey> referencesForId(int id) {
		Set<DocumentKey> result = new TreeSet<>();
		for (DocumentReference ref: referencesById.tailSet(new DocumentReference(DocumentKey.empty(), id), true)) {
			if (ref.id() != id) {
				break;
			}
			result.add(ref.key());
		}
		return Collections.unmodifiableSet(result);
	}

	public boolean containsKey(DocumentKey key) {
		DocumentReference first = referencesByKey.ceiling(new DocumentReference(key, Integer.MIN_VALUE));
		return first != null && first.key().equals(key);
	}

	/**
	 * @return every (key, id) pair, ordered by id then key
	 */
	public Iterable<DocumentReference> referencesById() {
		return referencesById;
	}

	@Override
	public String toString() {
		return "ReferenceSet" + referencesById;
	}
}

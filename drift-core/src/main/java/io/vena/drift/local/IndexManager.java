package io.vena.drift.local;

import io.vena.drift.core.Target;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.ResourcePath;
import java.util.Collection;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Answers two questions the query engine can't answer efficiently from the
 * remote document cache alone: which collections with a given id exist,
 * and which documents match a target according to a client-side index.
 */
public interface IndexManager {
	/**
	 * How well the available indexes serve a target.
	 */
	enum IndexType {
		/** No index covers the target's filters. */
		NONE,
		/** An index narrows the candidates, but results must still be filtered and sorted. */
		PARTIAL,
		/** An index covers every filter and ordering of the target. */
		FULL,
	}

	void start();

	/**
	 * Records that documents may exist under <code>collectionPath</code>. Must be idempotent.
	 */
	void addToCollectionParentIndex(ResourcePath collectionPath);

	/**
	 * @return the parents of every known collection with the given id
	 */
	List<ResourcePath> getCollectionParents(String collectionId);

	void addFieldIndex(FieldIndex index);

	void deleteFieldIndex(FieldIndex index);

	Collection<FieldIndex> getFieldIndexes(String collectionGroup);

	Collection<FieldIndex> getFieldIndexes();

	IndexType getIndexType(Target target);

	/**
	 * @return a superset of the keys of documents in the cache matching the target, or null if no index applies
	 */
	@Nullable List<DocumentKey> getDocumentsMatchingTarget(Target target);

	/**
	 * Creates whatever indexes would serve the given target, if the client hasn't got one already.
	 */
	void createTargetIndexes(Target target);

	/**
	 * The offset up to which every document is reflected in the indexes serving <code>target</code>.
	 */
	IndexOffset getMinOffset(Target target);

	/**
	 * Brings index entries up to date with a change to the remote document cache.
	 */
	void updateIndexEntries(Document document);

	void removeIndexEntries(DocumentKey key);
}

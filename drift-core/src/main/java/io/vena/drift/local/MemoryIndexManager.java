package io.vena.drift.local;

import io.vena.drift.core.FieldFilter;
import io.vena.drift.core.OrderBy;
import io.vena.drift.core.Target;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.FieldPath;
import io.vena.drift.model.ObjectValue;
import io.vena.drift.model.ResourcePath;
import io.vena.drift.model.SnapshotVersion;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Value;
import lombok.With;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.pcollections.PSortedMap;
import org.pcollections.PSortedSet;
import org.pcollections.TreePMap;
import org.pcollections.TreePSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the collection parent index, plus client-side field indexes whose entries
 * hold just the indexed fields of each document in the collection group.
 *
 * <p>
 * Entries are maintained as the remote document cache changes, and a new index is
 * backfilled as soon as it's created, so an index always covers its whole collection group.
 */
final class MemoryIndexManager implements IndexManager {
	private final MemoryPersistence persistence;
	private State state = State.EMPTY;

	@Value
	@With
	static class State {
		static final State EMPTY = new State(HashTreePMap.empty(), HashTreePMap.empty(), HashTreePMap.empty());

		PMap<String, PSortedSet<ResourcePath>> collectionParents;
		PMap<FieldIndex, PSortedMap<ResourcePath, ObjectValue>> entries;
		PMap<FieldIndex, IndexOffset> offsets;
	}

	MemoryIndexManager(MemoryPersistence persistence) {
		this.persistence = persistence;
	}

	State state() {
		return state;
	}

	Checkpoint<State> checkpoint() {
		return new Checkpoint<>(state, () -> state, s -> state = s);
	}

	@Override
	public void start() {
		LOGGER.debug("Starting index manager with {} field indexes", state.entries.size());
	}

	@Override
	public void addToCollectionParentIndex(ResourcePath collectionPath) {
		if (collectionPath.length() % 2 != 1) {
			throw new AssertionError("Expected a collection path: " + collectionPath);
		}
		String collectionId = collectionPath.lastSegment();
		ResourcePath parentPath = collectionPath.popLast();
		PSortedSet<ResourcePath> existing = state.collectionParents.getOrDefault(collectionId, TreePSet.empty());
		if (!existing.contains(parentPath)) {
			state = state.withCollectionParents(state.collectionParents.plus(collectionId, existing.plus(parentPath)));
		}
	}

	@Override
	public List<ResourcePath> getCollectionParents(String collectionId) {
		return new ArrayList<>(state.collectionParents.getOrDefault(collectionId, TreePSet.empty()));
	}

	@Override
	public void addFieldIndex(FieldIndex index) {
		if (state.entries.containsKey(index)) {
			return;
		}
		LOGGER.debug("Adding field index {}", index);
		PSortedMap<ResourcePath, ObjectValue> entries = TreePMap.empty();
		IndexOffset offset = IndexOffset.NONE;
		for (Document document: ((MemoryRemoteDocumentCache) persistence.getRemoteDocumentCache()).allDocuments()) {
			if (document.isFound() && document.key().hasCollectionId(index.collectionGroup())) {
				entries = entries.plus(document.key().path(), indexedValues(index, document));
				offset = max(offset, IndexOffset.fromDocument(document));
			}
		}
		state = state
			.withEntries(state.entries.plus(index, entries))
			.withOffsets(state.offsets.plus(index, offset));
	}

	@Override
	public void deleteFieldIndex(FieldIndex index) {
		LOGGER.debug("Deleting field index {}", index);
		state = state
			.withEntries(state.entries.minus(index))
			.withOffsets(state.offsets.minus(index));
	}

	@Override
	public Collection<FieldIndex> getFieldIndexes(String collectionGroup) {
		List<FieldIndex> result = new ArrayList<>();
		for (FieldIndex index: state.entries.keySet()) {
			if (index.collectionGroup().equals(collectionGroup)) {
				result.add(index);
			}
		}
		return result;
	}

	@Override
	public Collection<FieldIndex> getFieldIndexes() {
		return new ArrayList<>(state.entries.keySet());
	}

	@Override
	public IndexType getIndexType(Target target) {
		if (target.isDocumentQuery()) {
			return IndexType.NONE;
		}
		FieldIndex index = indexFor(target);
		if (index == null) {
			return IndexType.NONE;
		}
		for (OrderBy orderBy: target.orderBy()) {
			if (!orderBy.field().isKeyField() && !index.fields().contains(orderBy.field())) {
				return IndexType.PARTIAL;
			}
		}
		return IndexType.FULL;
	}

	@Override
	public @Nullable List<DocumentKey> getDocumentsMatchingTarget(Target target) {
		FieldIndex index = target.isDocumentQuery() ? null : indexFor(target);
		if (index == null) {
			return null;
		}
		List<DocumentKey> result = new ArrayList<>();
		for (Map.Entry<ResourcePath, ObjectValue> entry: state.entries.get(index).entrySet()) {
			ResourcePath path = entry.getKey();
			if (!matchesTargetPath(target, path)) {
				continue;
			}
			Document indexed = Document.found(DocumentKey.fromPath(path), SnapshotVersion.NONE, entry.getValue());
			if (matchesFilters(target, indexed)) {
				result.add(indexed.key());
			}
		}
		LOGGER.trace("Index {} returned {} candidates for {}", index, result.size(), target);
		return result;
	}

	@Override
	public void createTargetIndexes(Target target) {
		if (target.isDocumentQuery() || getIndexType(target) != IndexType.NONE) {
			return;
		}
		Set<FieldPath> fields = new LinkedHashSet<>(filterFields(target));
		if (fields.isEmpty()) {
			return;
		}
		for (OrderBy orderBy: target.orderBy()) {
			if (!orderBy.field().isKeyField()) {
				fields.add(orderBy.field());
			}
		}
		addFieldIndex(new FieldIndex(collectionGroupOf(target), new ArrayList<>(fields)));
	}

	@Override
	public IndexOffset getMinOffset(Target target) {
		FieldIndex index = indexFor(target);
		return index == null ? IndexOffset.NONE : state.offsets.get(index);
	}

	@Override
	public void updateIndexEntries(Document document) {
		for (FieldIndex index: getFieldIndexes(document.key().collectionGroup())) {
			PSortedMap<ResourcePath, ObjectValue> entries = state.entries.get(index);
			if (document.isFound()) {
				entries = entries.plus(document.key().path(), indexedValues(index, document));
			} else {
				entries = entries.minus(document.key().path());
			}
			state = state
				.withEntries(state.entries.plus(index, entries))
				.withOffsets(state.offsets.plus(index, max(state.offsets.get(index), IndexOffset.fromDocument(document))));
		}
	}

	@Override
	public void removeIndexEntries(DocumentKey key) {
		for (FieldIndex index: getFieldIndexes(key.collectionGroup())) {
			state = state.withEntries(state.entries.plus(index, state.entries.get(index).minus(key.path())));
		}
	}

	/**
	 * @return the index covering the most filter fields, as long as it covers all of them
	 */
	private @Nullable FieldIndex indexFor(Target target) {
		List<FieldPath> filterFields = filterFields(target);
		if (filterFields.isEmpty()) {
			return null;
		}
		FieldIndex best = null;
		for (FieldIndex index: getFieldIndexes(collectionGroupOf(target))) {
			if (index.fields().containsAll(filterFields)) {
				if (best == null || index.fields().size() > best.fields().size()) {
					best = index;
				}
			}
		}
		return best;
	}

	private static List<FieldPath> filterFields(Target target) {
		List<FieldPath> result = new ArrayList<>();
		for (FieldFilter filter: target.filters()) {
			if (!filter.field().isKeyField() && !result.contains(filter.field())) {
				result.add(filter.field());
			}
		}
		return result;
	}

	private static String collectionGroupOf(Target target) {
		return target.collectionGroup() != null ? target.collectionGroup() : target.path().lastSegment();
	}

	private static boolean matchesTargetPath(Target target, ResourcePath documentPath) {
		if (target.collectionGroup() != null) {
			return target.path().isPrefixOf(documentPath);
		} else {
			return target.path().isImmediateParentOf(documentPath);
		}
	}

	private static boolean matchesFilters(Target target, Document indexed) {
		for (FieldFilter filter: target.filters()) {
			if (!filter.field().isKeyField() && !filter.matches(indexed)) {
				return false;
			}
		}
		return true;
	}

	private static ObjectValue indexedValues(FieldIndex index, Document document) {
		ObjectValue result = ObjectValue.empty();
		for (FieldPath field: index.fields()) {
			if (document.data().has(field)) {
				result = result.set(field, document.data().get(field));
			}
		}
		return result;
	}

	private static IndexOffset max(IndexOffset a, IndexOffset b) {
		return a.compareTo(b) >= 0 ? a : b;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MemoryIndexManager.class);
}

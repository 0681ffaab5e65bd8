package io.vena.drift.core;

import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.FieldPath;
import io.vena.drift.model.ResourcePath;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

import static io.vena.drift.core.Target.NO_LIMIT;

/**
 * An immutable query over one collection, a collection group, or a single document.
 *
 * <p>
 * Results are always totally ordered: the explicit orderings are followed by an implicit
 * ordering on the document key, and a query with an inequality filter but no explicit ordering
 * is ordered by the inequality field first.
 */
@Getter
@EqualsAndHashCode(of = {"canonicalId"})
public final class Query {
	private final ResourcePath path;
	private final @Nullable String collectionGroup;
	private final List<FieldFilter> filters;
	private final List<OrderBy> explicitOrderBy;
	private final long limit;
	private final LimitType limitType;

	private final List<OrderBy> orderBy;
	private final String canonicalId;

	@Getter(AccessLevel.NONE)
	private volatile Target target;

	public enum LimitType {
		LIMIT_TO_FIRST,
		LIMIT_TO_LAST,
	}

	public Query(ResourcePath path, @Nullable String collectionGroup, List<FieldFilter> filters, List<OrderBy> explicitOrderBy, long limit, LimitType limitType) {
		this.path = path;
		this.collectionGroup = collectionGroup;
		this.filters = List.copyOf(filters);
		this.explicitOrderBy = List.copyOf(explicitOrderBy);
		this.limit = limit;
		this.limitType = limitType;
		this.orderBy = computeNormalizedOrderBy();
		this.canonicalId = toTarget().canonicalId() + "|lt:" + limitType;
	}

	public static Query atPath(ResourcePath path) {
		return new Query(path, null, List.of(), List.of(), NO_LIMIT, LimitType.LIMIT_TO_FIRST);
	}

	public static Query atPath(String path) {
		return atPath(ResourcePath.fromString(path));
	}

	public static Query collectionGroup(String collectionId) {
		return new Query(ResourcePath.EMPTY, collectionId, List.of(), List.of(), NO_LIMIT, LimitType.LIMIT_TO_FIRST);
	}

	public Query filter(FieldFilter filter) {
		List<FieldFilter> newFilters = new ArrayList<>(filters);
		newFilters.add(filter);
		return new Query(path, collectionGroup, newFilters, explicitOrderBy, limit, limitType);
	}

	public Query orderBy(OrderBy order) {
		List<OrderBy> newOrderBy = new ArrayList<>(explicitOrderBy);
		newOrderBy.add(order);
		return new Query(path, collectionGroup, filters, newOrderBy, limit, limitType);
	}

	public Query limitToFirst(long n) {
		return new Query(path, collectionGroup, filters, explicitOrderBy, n, LimitType.LIMIT_TO_FIRST);
	}

	public Query limitToLast(long n) {
		return new Query(path, collectionGroup, filters, explicitOrderBy, n, LimitType.LIMIT_TO_LAST);
	}

	/**
	 * @return the same query with the limit removed
	 */
	public Query withoutLimit() {
		return new Query(path, collectionGroup, filters, explicitOrderBy, NO_LIMIT, LimitType.LIMIT_TO_FIRST);
	}

	/**
	 * Turns one collection of a collection group query into a regular collection query.
	 */
	public Query asCollectionQueryAtPath(ResourcePath collectionPath) {
		return new Query(collectionPath, null, filters, explicitOrderBy, limit, limitType);
	}

	public boolean isDocumentQuery() {
		return DocumentKey.isDocumentKey(path) && collectionGroup == null && filters.isEmpty();
	}

	public boolean isCollectionGroupQuery() {
		return collectionGroup != null;
	}

	public boolean hasLimit() {
		return limit != NO_LIMIT;
	}

	public boolean hasLimitToFirst() {
		return hasLimit() && limitType == LimitType.LIMIT_TO_FIRST;
	}

	public boolean hasLimitToLast() {
		return hasLimit() && limitType == LimitType.LIMIT_TO_LAST;
	}

	public boolean matchesAllDocuments() {
		return filters.isEmpty() && limit == NO_LIMIT && (explicitOrderBy.isEmpty()
			|| (explicitOrderBy.size() == 1 && explicitOrderBy.get(0).field().isKeyField()));
	}

	public @Nullable FieldPath inequalityField() {
		for (FieldFilter filter: filters) {
			if (filter.isInequality()) {
				return filter.field();
			}
		}
		return null;
	}

	public boolean matches(Document document) {
		return document.isFound()
			&& matchesPathAndCollectionGroup(document)
			&& matchesOrderBy(document)
			&& matchesFilters(document);
	}

	private boolean matchesPathAndCollectionGroup(Document document) {
		ResourcePath docPath = document.key().path();
		if (collectionGroup != null) {
			return document.key().hasCollectionId(collectionGroup) && path.isPrefixOf(docPath);
		} else if (DocumentKey.isDocumentKey(path)) {
			return path.equals(docPath);
		} else {
			return path.isImmediateParentOf(docPath);
		}
	}

	private boolean matchesOrderBy(Document document) {
		for (OrderBy order: explicitOrderBy) {
			if (!document.hasField(order.field())) {
				return false;
			}
		}
		return true;
	}

	private boolean matchesFilters(Document document) {
		for (FieldFilter filter: filters) {
			if (!filter.matches(document)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Orders documents as this query's results are ordered. Only meaningful for matching documents.
	 */
	public Comparator<Document> comparator() {
		List<OrderBy> ordering = orderBy;
		return (d1, d2) -> {
			for (OrderBy order: ordering) {
				int c = order.compare(d1, d2);
				if (c != 0) {
					return c;
				}
			}
			return 0;
		};
	}

	/**
	 * Limit-to-last queries are sent as limit-to-first with every ordering flipped.
	 */
	public Target toTarget() {
		Target result = target;
		if (result == null) {
			List<OrderBy> targetOrderBy = orderBy;
			if (limitType == LimitType.LIMIT_TO_LAST) {
				targetOrderBy = new ArrayList<>();
				for (OrderBy o: orderBy) {
					targetOrderBy.add(o.flipped());
				}
			}
			result = new Target(path, collectionGroup, filters, targetOrderBy, limit);
			target = result;
		}
		return result;
	}

	private List<OrderBy> computeNormalizedOrderBy() {
		FieldPath inequalityField = inequalityField();
		List<OrderBy> result = new ArrayList<>();
		if (inequalityField != null && explicitOrderBy.isEmpty()) {
			if (!inequalityField.isKeyField()) {
				result.add(OrderBy.asc(inequalityField));
			}
			result.add(OrderBy.asc(FieldPath.KEY_PATH));
			return List.copyOf(result);
		}
		boolean foundKey = false;
		for (OrderBy order: explicitOrderBy) {
			result.add(order);
			if (order.field().isKeyField()) {
				foundKey = true;
			}
		}
		if (!foundKey) {
			OrderBy.Direction lastDirection = explicitOrderBy.isEmpty()
				? OrderBy.Direction.ASCENDING
				: explicitOrderBy.get(explicitOrderBy.size() - 1).direction();
			result.add(new OrderBy(lastDirection, FieldPath.KEY_PATH));
		}
		return List.copyOf(result);
	}

	@Override
	public String toString() {
		return "Query(" + canonicalId + ")";
	}
}

package io.vena.drift.core;

import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.ResourcePath;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

/**
 * What the server is asked to watch: a {@link Query} with its ordering fully normalized.
 * Two queries that differ only in limit type can share a target.
 *
 * <p>
 * Targets are identified by {@link #canonicalId()}, which is also their key in the target cache.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Target {
	public static final long NO_LIMIT = -1;

	private final ResourcePath path;
	private final @Nullable String collectionGroup;
	private final List<FieldFilter> filters;
	private final List<OrderBy> orderBy;
	private final long limit;

	@EqualsAndHashCode.Include
	private final String canonicalId;

	public Target(ResourcePath path, @Nullable String collectionGroup, List<FieldFilter> filters, List<OrderBy> orderBy, long limit) {
		this.path = path;
		this.collectionGroup = collectionGroup;
		this.filters = List.copyOf(filters);
		this.orderBy = List.copyOf(orderBy);
		this.limit = limit;
		this.canonicalId = computeCanonicalId();
	}

	public boolean isDocumentQuery() {
		return DocumentKey.isDocumentKey(path) && collectionGroup == null && filters.isEmpty();
	}

	public boolean hasLimit() {
		return limit != NO_LIMIT;
	}

	private String computeCanonicalId() {
		StringBuilder builder = new StringBuilder(path.canonicalString());
		if (collectionGroup != null) {
			builder.append("|cg:").append(collectionGroup);
		}
		builder.append("|f:");
		for (FieldFilter filter: filters) {
			builder.append(filter.canonicalId());
		}
		builder.append("|ob:");
		for (OrderBy o: orderBy) {
			builder.append(o.canonicalId());
		}
		if (hasLimit()) {
			builder.append("|l:").append(limit);
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return "Target(" + canonicalId + ")";
	}
}

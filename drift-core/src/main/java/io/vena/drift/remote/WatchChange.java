package io.vena.drift.remote;

import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.jetbrains.annotations.Nullable;

/**
 * One message from the watch stream.
 */
public abstract class WatchChange {
	private WatchChange() { }

	/**
	 * A document was added to, changed within, or removed from some targets.
	 */
	@Getter
	@ToString
	@EqualsAndHashCode(callSuper = false)
	public static final class DocumentChange extends WatchChange {
		private final List<Integer> updatedTargetIds;
		private final List<Integer> removedTargetIds;
		private final DocumentKey documentKey;

		/**
		 * Null if the server only said which targets the document left, without saying whether it still exists.
		 */
		private final @Nullable Document newDocument;

		public DocumentChange(List<Integer> updatedTargetIds, List<Integer> removedTargetIds, DocumentKey documentKey, @Nullable Document newDocument) {
			this.updatedTargetIds = List.copyOf(updatedTargetIds);
			this.removedTargetIds = List.copyOf(removedTargetIds);
			this.documentKey = documentKey;
			this.newDocument = newDocument;
		}
	}

	/**
	 * The server's count of the documents in a target, optionally with a bloom filter of their names.
	 */
	@Getter
	@ToString
	@EqualsAndHashCode(callSuper = false)
	public static final class ExistenceFilterWatchChange extends WatchChange {
		private final int targetId;
		private final ExistenceFilter existenceFilter;

		public ExistenceFilterWatchChange(int targetId, ExistenceFilter existenceFilter) {
			this.targetId = targetId;
			this.existenceFilter = existenceFilter;
		}
	}

	public enum WatchTargetChangeType {
		NO_CHANGE,
		ADDED,
		REMOVED,
		CURRENT,
		RESET,
	}

	/**
	 * A change in the state of some targets. With no target ids, it applies to every active target.
	 */
	@Getter
	@ToString
	@EqualsAndHashCode(callSuper = false)
	public static final class WatchTargetChange extends WatchChange {
		private final WatchTargetChangeType changeType;
		private final List<Integer> targetIds;
		private final String resumeToken;

		/**
		 * Why the server removed the targets; null unless {@link #changeType} is {@link WatchTargetChangeType#REMOVED}
		 * because of an error.
		 */
		private final @Nullable Status cause;

		public WatchTargetChange(WatchTargetChangeType changeType, List<Integer> targetIds) {
			this(changeType, targetIds, "", null);
		}

		public WatchTargetChange(WatchTargetChangeType changeType, List<Integer> targetIds, String resumeToken) {
			this(changeType, targetIds, resumeToken, null);
		}

		public WatchTargetChange(WatchTargetChangeType changeType, List<Integer> targetIds, String resumeToken, @Nullable Status cause) {
			if (cause != null && changeType != WatchTargetChangeType.REMOVED) {
				throw new IllegalArgumentException("Cause must only be provided for removed targets");
			}
			this.changeType = changeType;
			this.targetIds = List.copyOf(targetIds);
			this.resumeToken = resumeToken;
			this.cause = cause;
		}
	}
}

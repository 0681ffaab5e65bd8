package io.vena.drift.remote;

import io.vena.drift.local.QueryPurpose;
import io.vena.drift.local.TargetData;
import java.util.Map;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * Asks the watch stream to start or stop listening to one target.
 */
@Value
public class ListenRequest {
	public static final String LISTEN_TAGS_LABEL = "listen-tags";

	/**
	 * The target to listen to, with the resume token and expected count to resume from. Null for a removal.
	 */
	@Nullable TargetData addTarget;

	/**
	 * The target to stop listening to. Ignored for an addition.
	 */
	int removeTargetId;

	/**
	 * Diagnostic labels describing why the target is being listened to.
	 */
	Map<String, String> labels;

	public static ListenRequest addTarget(TargetData targetData) {
		String tag = listenTag(targetData.purpose());
		Map<String, String> labels = (tag == null) ? Map.of() : Map.of(LISTEN_TAGS_LABEL, tag);
		return new ListenRequest(targetData, 0, labels);
	}

	public static ListenRequest removeTarget(int targetId) {
		return new ListenRequest(null, targetId, Map.of());
	}

	public boolean isAddTarget() {
		return addTarget != null;
	}

	private static @Nullable String listenTag(QueryPurpose purpose) {
		switch (purpose) {
			case LISTEN:
				return null;
			case EXISTENCE_FILTER_MISMATCH:
				return "existence-filter-mismatch";
			case EXISTENCE_FILTER_MISMATCH_BLOOM:
				return "existence-filter-mismatch-bloom";
			case LIMBO_RESOLUTION:
				return "limbo-document";
			default:
				throw new IllegalArgumentException("Unrecognized query purpose: " + purpose);
		}
	}
}

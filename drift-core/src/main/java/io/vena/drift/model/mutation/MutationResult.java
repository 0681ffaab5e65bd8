package io.vena.drift.model.mutation;

import io.vena.drift.model.SnapshotVersion;
import java.util.List;
import lombok.Value;

/**
 * The server's response to one mutation: the document's update time and,
 * in field transform order, the authoritative transform results.
 */
@Value
public class MutationResult {
	SnapshotVersion version;
	List<Object> transformResults;
}

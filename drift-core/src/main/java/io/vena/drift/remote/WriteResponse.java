package io.vena.drift.remote;

import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.model.mutation.MutationResult;
import java.util.List;
import lombok.Value;

/**
 * The server's answer to a {@link WriteRequest}. The answer to the handshake has no results.
 */
@Value
public class WriteResponse {
	String streamToken;
	SnapshotVersion commitVersion;
	List<MutationResult> results;
}

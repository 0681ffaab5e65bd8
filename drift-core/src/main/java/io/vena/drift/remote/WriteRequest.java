package io.vena.drift.remote;

import io.vena.drift.model.mutation.Mutation;
import java.util.List;
import lombok.Value;

/**
 * A message on the write stream: either the initial handshake, or a batch of mutations
 * carrying the stream token from the previous response.
 */
@Value
public class WriteRequest {
	boolean handshakeRequest;
	String streamToken;
	List<Mutation> mutations;

	public static WriteRequest handshake() {
		return new WriteRequest(true, "", List.of());
	}

	/**
	 * An empty list of mutations just acknowledges the last response, as when closing.
	 */
	public static WriteRequest write(String streamToken, List<Mutation> mutations) {
		return new WriteRequest(false, streamToken, List.copyOf(mutations));
	}
}

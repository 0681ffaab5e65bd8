package io.vena.drift.remote;

import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * The tokens a {@link Transport} attaches to a new stream.
 */
@Value
public class CallCredentials {
	@Nullable String authToken;
	@Nullable String attestationToken;
}

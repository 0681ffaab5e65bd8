package io.vena.drift.core;

import java.util.List;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

@Value
public class ViewChange {
	/**
	 * Null if nothing visible changed.
	 */
	@Nullable ViewSnapshot snapshot;
	List<LimboDocumentChange> limboChanges;
}

package io.vena.drift.model.mutation;

import io.vena.drift.model.Document;
import lombok.Value;
import lombok.With;
import org.jetbrains.annotations.Nullable;

/**
 * The local view of a document together with the fields pending mutations have touched.
 * A null {@link #mutatedFields} means the whole document was overwritten or deleted.
 */
@Value
@With
public class OverlayedDocument {
	Document document;
	@Nullable FieldMask mutatedFields;

	public static OverlayedDocument unmutated(Document document) {
		return new OverlayedDocument(document, FieldMask.EMPTY);
	}
}

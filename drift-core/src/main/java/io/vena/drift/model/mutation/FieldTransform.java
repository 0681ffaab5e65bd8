package io.vena.drift.model.mutation;

import io.vena.drift.model.FieldPath;
import lombok.Value;

@Value
public class FieldTransform {
	FieldPath fieldPath;
	TransformOperation operation;
}

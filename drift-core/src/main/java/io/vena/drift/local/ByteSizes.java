package io.vena.drift.local;

import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.ObjectValue;
import io.vena.drift.model.mutation.Mutation;
import io.vena.drift.model.mutation.MutationBatch;
import io.vena.drift.model.mutation.PatchMutation;
import io.vena.drift.model.mutation.SetMutation;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Rough serialized sizes of cached objects, used to decide when garbage collection should run.
 */
final class ByteSizes {
	private static final int FIXED_OVERHEAD = 16;

	static long of(Document document) {
		return FIXED_OVERHEAD + of(document.key()) + of(document.data());
	}

	static long of(MutationBatch batch) {
		long result = FIXED_OVERHEAD;
		for (Mutation mutation: batch.baseMutations()) {
			result += of(mutation);
		}
		for (Mutation mutation: batch.mutations()) {
			result += of(mutation);
		}
		return result;
	}

	static long of(TargetData targetData) {
		return FIXED_OVERHEAD
			+ utf8(targetData.target().canonicalId())
			+ utf8(targetData.resumeToken());
	}

	private static long of(Mutation mutation) {
		long result = FIXED_OVERHEAD + of(mutation.key());
		if (mutation instanceof SetMutation) {
			result += of(((SetMutation) mutation).value());
		} else if (mutation instanceof PatchMutation) {
			result += of(((PatchMutation) mutation).value());
		}
		return result;
	}

	private static long of(DocumentKey key) {
		return utf8(key.path().canonicalString());
	}

	private static long of(ObjectValue value) {
		return ofValue(value.asMap());
	}

	private static long ofValue(Object value) {
		if (value == null || value instanceof Boolean) {
			return 1;
		} else if (value instanceof String) {
			return utf8((String) value);
		} else if (value instanceof DocumentKey) {
			return of((DocumentKey) value);
		} else if (value instanceof List) {
			long result = 0;
			for (Object element: (List<?>) value) {
				result += ofValue(element);
			}
			return result;
		} else if (value instanceof Map) {
			long result = 0;
			for (Map.Entry<?, ?> entry: ((Map<?, ?>) value).entrySet()) {
				result += utf8(entry.getKey().toString()) + ofValue(entry.getValue());
			}
			return result;
		} else {
			// Numbers, timestamps, server timestamps
			return 8;
		}
	}

	private static long utf8(String s) {
		return s.getBytes(StandardCharsets.UTF_8).length;
	}

	private ByteSizes() {}
}

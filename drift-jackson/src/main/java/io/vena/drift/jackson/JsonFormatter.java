package io.vena.drift.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vena.drift.core.FieldFilter;
import io.vena.drift.core.OrderBy;
import io.vena.drift.core.Target;
import io.vena.drift.local.FieldIndex;
import io.vena.drift.local.PersistenceSnapshot;
import io.vena.drift.local.PersistenceSnapshot.MutationQueueContents;
import io.vena.drift.local.QueryPurpose;
import io.vena.drift.local.TargetData;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.FieldPath;
import io.vena.drift.model.ObjectValue;
import io.vena.drift.model.ResourcePath;
import io.vena.drift.model.ServerTimestampValue;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.model.Values;
import io.vena.drift.model.mutation.ArrayTransformOperation;
import io.vena.drift.model.mutation.DeleteMutation;
import io.vena.drift.model.mutation.FieldMask;
import io.vena.drift.model.mutation.FieldTransform;
import io.vena.drift.model.mutation.Mutation;
import io.vena.drift.model.mutation.MutationBatch;
import io.vena.drift.model.mutation.NumericIncrementOperation;
import io.vena.drift.model.mutation.Overlay;
import io.vena.drift.model.mutation.PatchMutation;
import io.vena.drift.model.mutation.Precondition;
import io.vena.drift.model.mutation.ServerTimestampOperation;
import io.vena.drift.model.mutation.SetMutation;
import io.vena.drift.model.mutation.TransformOperation;
import io.vena.drift.model.mutation.VerifyMutation;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

/**
 * Converts persisted types to and from Jackson trees.
 *
 * <p>
 * Field values use native JSON where that's unambiguous. Anything else is a
 * single-field object whose name starts with <code>$</code>:
 * <code>{"$timestamp": "2024-01-01T00:00:00Z"}</code>, <code>{"$reference": "coll/doc"}</code>,
 * <code>{"$double": "NaN"}</code> for non-finite doubles, <code>{"$serverTimestamp": {...}}</code>,
 * and <code>{"$map": {...}}</code> for a map that itself has a key starting with <code>$</code>.
 *
 * <p>
 * Decoding methods throw {@link IllegalArgumentException} for malformed input.
 */
public final class JsonFormatter {
	/**
	 * Bumped when the layout of {@link #snapshotToJson} changes incompatibly.
	 */
	public static final int FORMAT_VERSION = 1;

	static final String TIMESTAMP_TAG = "$timestamp";
	static final String REFERENCE_TAG = "$reference";
	static final String DOUBLE_TAG = "$double";
	static final String SERVER_TIMESTAMP_TAG = "$serverTimestamp";
	static final String MAP_TAG = "$map";

	private final JsonNodeFactory nodes = JsonNodeFactory.instance;

	// Field values

	public JsonNode valueToJson(@Nullable Object value) {
		if (value == null) {
			return nodes.nullNode();
		} else if (value instanceof Boolean) {
			return nodes.booleanNode((Boolean) value);
		} else if (value instanceof Long) {
			return nodes.numberNode((Long) value);
		} else if (value instanceof Double) {
			double d = (Double) value;
			if (Double.isFinite(d)) {
				return nodes.numberNode(d);
			} else {
				return tagged(DOUBLE_TAG, nodes.textNode(Double.toString(d)));
			}
		} else if (value instanceof String) {
			return nodes.textNode((String) value);
		} else if (value instanceof Instant) {
			return tagged(TIMESTAMP_TAG, nodes.textNode(value.toString()));
		} else if (value instanceof DocumentKey) {
			return tagged(REFERENCE_TAG, nodes.textNode(((DocumentKey) value).path().canonicalString()));
		} else if (value instanceof ServerTimestampValue) {
			ServerTimestampValue serverTimestamp = (ServerTimestampValue) value;
			ObjectNode body = nodes.objectNode();
			body.put("localWriteTime", serverTimestamp.localWriteTime().toString());
			body.set("previousValue", valueToJson(serverTimestamp.previousValue()));
			return tagged(SERVER_TIMESTAMP_TAG, body);
		} else if (value instanceof List) {
			ArrayNode result = nodes.arrayNode();
			for (Object element: (List<?>) value) {
				result.add(valueToJson(element));
			}
			return result;
		} else if (value instanceof Map) {
			ObjectNode result = nodes.objectNode();
			boolean needsTag = false;
			for (Entry<?, ?> entry: ((Map<?, ?>) value).entrySet()) {
				String name = (String) entry.getKey();
				needsTag |= name.startsWith("$");
				result.set(name, valueToJson(entry.getValue()));
			}
			return needsTag ? tagged(MAP_TAG, result) : result;
		} else {
			throw new IllegalArgumentException("Unsupported field value type: " + value.getClass().getName());
		}
	}

	public @Nullable Object valueFromJson(JsonNode node) {
		switch (node.getNodeType()) {
			case NULL:
				return null;
			case BOOLEAN:
				return node.booleanValue();
			case NUMBER:
				if (node.isIntegralNumber()) {
					if (!node.canConvertToLong()) {
						throw new IllegalArgumentException("Integer out of range: " + node);
					}
					return node.longValue();
				} else {
					return node.doubleValue();
				}
			case STRING:
				return node.textValue();
			case ARRAY: {
				List<Object> result = new ArrayList<>(node.size());
				for (JsonNode element: node) {
					result.add(valueFromJson(element));
				}
				return Values.normalize(result);
			}
			case OBJECT:
				if (node.size() == 1) {
					String name = node.fieldNames().next();
					if (name.startsWith("$")) {
						return taggedValueFromJson(name, node.get(name));
					}
				}
				return mapFromJson(node);
			default:
				throw new IllegalArgumentException("Unexpected JSON node type " + node.getNodeType());
		}
	}

	private Object taggedValueFromJson(String tag, JsonNode body) {
		switch (tag) {
			case TIMESTAMP_TAG:
				return instantFromJson(body);
			case REFERENCE_TAG:
				return documentKeyFromJson(body);
			case DOUBLE_TAG:
				try {
					return Double.valueOf(text(body));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("Malformed double: " + body, e);
				}
			case SERVER_TIMESTAMP_TAG:
				return new ServerTimestampValue(instantFromJson(required(body, "localWriteTime")), valueFromJson(required(body, "previousValue")));
			case MAP_TAG:
				return mapFromJson(body);
			default:
				throw new IllegalArgumentException("Unrecognized value tag: " + tag);
		}
	}

	private Object mapFromJson(JsonNode node) {
		if (!node.isObject()) {
			throw new IllegalArgumentException("Expected an object: " + node);
		}
		Map<String, Object> result = new TreeMap<>();
		Iterator<Entry<String, JsonNode>> fields = node.fields();
		while (fields.hasNext()) {
			Entry<String, JsonNode> field = fields.next();
			result.put(field.getKey(), valueFromJson(field.getValue()));
		}
		return Values.normalize(result);
	}

	public JsonNode objectValueToJson(ObjectValue value) {
		return valueToJson(value.asMap());
	}

	@SuppressWarnings("unchecked")
	public ObjectValue objectValueFromJson(JsonNode node) {
		Object value = valueFromJson(node);
		if (!(value instanceof Map)) {
			throw new IllegalArgumentException("Document data must be a map: " + node);
		}
		return ObjectValue.fromMap((Map<String, ?>) value);
	}

	// Paths and versions

	public JsonNode instantToJson(Instant instant) {
		return nodes.textNode(instant.toString());
	}

	public Instant instantFromJson(JsonNode node) {
		try {
			return Instant.parse(text(node));
		} catch (DateTimeParseException e) {
			throw new IllegalArgumentException("Malformed timestamp: " + node, e);
		}
	}

	public JsonNode snapshotVersionToJson(SnapshotVersion version) {
		return instantToJson(version.timestamp());
	}

	public SnapshotVersion snapshotVersionFromJson(JsonNode node) {
		return SnapshotVersion.of(instantFromJson(node));
	}

	public JsonNode resourcePathToJson(ResourcePath path) {
		return nodes.textNode(path.canonicalString());
	}

	public ResourcePath resourcePathFromJson(JsonNode node) {
		return ResourcePath.fromString(text(node));
	}

	public JsonNode documentKeyToJson(DocumentKey key) {
		return resourcePathToJson(key.path());
	}

	public DocumentKey documentKeyFromJson(JsonNode node) {
		return DocumentKey.fromPath(resourcePathFromJson(node));
	}

	/**
	 * Field paths are arrays of segments, since segments may contain dots.
	 */
	public JsonNode fieldPathToJson(FieldPath path) {
		ArrayNode result = nodes.arrayNode();
		path.segments().forEach(result::add);
		return result;
	}

	public FieldPath fieldPathFromJson(JsonNode node) {
		List<String> segments = new ArrayList<>();
		for (JsonNode segment: array(node)) {
			segments.add(text(segment));
		}
		return FieldPath.fromSegments(segments);
	}

	// Documents

	public JsonNode documentToJson(Document document) {
		ObjectNode result = nodes.objectNode();
		result.set("key", documentKeyToJson(document.key()));
		result.put("kind", document.kind().name());
		result.set("version", snapshotVersionToJson(document.version()));
		result.set("readTime", snapshotVersionToJson(document.readTime()));
		result.set("createTime", snapshotVersionToJson(document.createTime()));
		result.set("data", objectValueToJson(document.data()));
		result.put("state", document.state().name());
		return result;
	}

	public Document documentFromJson(JsonNode node) {
		return Document.restore(
			documentKeyFromJson(required(node, "key")),
			enumFromJson(Document.Kind.class, required(node, "kind")),
			snapshotVersionFromJson(required(node, "version")),
			snapshotVersionFromJson(required(node, "readTime")),
			snapshotVersionFromJson(required(node, "createTime")),
			objectValueFromJson(required(node, "data")),
			enumFromJson(Document.State.class, required(node, "state")));
	}

	// Mutations

	public JsonNode preconditionToJson(Precondition precondition) {
		ObjectNode result = nodes.objectNode();
		if (precondition.updateTime() != null) {
			result.set("updateTime", snapshotVersionToJson(precondition.updateTime()));
		} else if (precondition.exists() != null) {
			result.put("exists", precondition.exists());
		}
		return result;
	}

	public Precondition preconditionFromJson(JsonNode node) {
		if (node.has("updateTime")) {
			return Precondition.updateTime(snapshotVersionFromJson(node.get("updateTime")));
		} else if (node.has("exists")) {
			JsonNode exists = node.get("exists");
			if (!exists.isBoolean()) {
				throw new IllegalArgumentException("Precondition 'exists' must be a boolean: " + exists);
			}
			return Precondition.exists(exists.booleanValue());
		} else {
			return Precondition.NONE;
		}
	}

	public JsonNode transformOperationToJson(TransformOperation operation) {
		ObjectNode result = nodes.objectNode();
		if (operation instanceof ServerTimestampOperation) {
			result.put("type", "serverTimestamp");
		} else if (operation instanceof NumericIncrementOperation) {
			result.put("type", "increment");
			result.set("operand", valueToJson(((NumericIncrementOperation) operation).operand()));
		} else if (operation instanceof ArrayTransformOperation.Union) {
			result.put("type", "arrayUnion");
			result.set("elements", valueToJson(((ArrayTransformOperation) operation).elements()));
		} else if (operation instanceof ArrayTransformOperation.Remove) {
			result.put("type", "arrayRemove");
			result.set("elements", valueToJson(((ArrayTransformOperation) operation).elements()));
		} else {
			throw new IllegalArgumentException("Unsupported transform operation: " + operation.getClass().getName());
		}
		return result;
	}

	public TransformOperation transformOperationFromJson(JsonNode node) {
		String type = text(required(node, "type"));
		switch (type) {
			case "serverTimestamp":
				return ServerTimestampOperation.INSTANCE;
			case "increment": {
				Object operand = valueFromJson(required(node, "operand"));
				if (!(operand instanceof Number)) {
					throw new IllegalArgumentException("Increment operand must be a number: " + node);
				}
				return new NumericIncrementOperation((Number) operand);
			}
			case "arrayUnion":
				return new ArrayTransformOperation.Union(elementsFromJson(node));
			case "arrayRemove":
				return new ArrayTransformOperation.Remove(elementsFromJson(node));
			default:
				throw new IllegalArgumentException("Unrecognized transform type: " + type);
		}
	}

	private List<?> elementsFromJson(JsonNode node) {
		Object elements = valueFromJson(required(node, "elements"));
		if (!(elements instanceof List)) {
			throw new IllegalArgumentException("Array transform elements must be an array: " + node);
		}
		return (List<?>) elements;
	}

	public JsonNode fieldTransformToJson(FieldTransform transform) {
		ObjectNode result = nodes.objectNode();
		result.set("field", fieldPathToJson(transform.fieldPath()));
		result.set("operation", transformOperationToJson(transform.operation()));
		return result;
	}

	public FieldTransform fieldTransformFromJson(JsonNode node) {
		return new FieldTransform(
			fieldPathFromJson(required(node, "field")),
			transformOperationFromJson(required(node, "operation")));
	}

	public JsonNode mutationToJson(Mutation mutation) {
		ObjectNode result = nodes.objectNode();
		if (mutation instanceof SetMutation) {
			result.put("type", "set");
		} else if (mutation instanceof PatchMutation) {
			result.put("type", "patch");
		} else if (mutation instanceof DeleteMutation) {
			result.put("type", "delete");
		} else if (mutation instanceof VerifyMutation) {
			result.put("type", "verify");
		} else {
			throw new IllegalArgumentException("Unsupported mutation: " + mutation.getClass().getName());
		}
		result.set("key", documentKeyToJson(mutation.key()));
		result.set("precondition", preconditionToJson(mutation.precondition()));
		if (!mutation.fieldTransforms().isEmpty()) {
			result.set("transforms", listToJson(mutation.fieldTransforms(), this::fieldTransformToJson));
		}
		if (mutation instanceof SetMutation) {
			result.set("value", objectValueToJson(((SetMutation) mutation).value()));
		} else if (mutation instanceof PatchMutation) {
			PatchMutation patch = (PatchMutation) mutation;
			result.set("value", objectValueToJson(patch.value()));
			result.set("mask", listToJson(new ArrayList<>(patch.mask().mask()), this::fieldPathToJson));
		}
		return result;
	}

	public Mutation mutationFromJson(JsonNode node) {
		String type = text(required(node, "type"));
		DocumentKey key = documentKeyFromJson(required(node, "key"));
		Precondition precondition = preconditionFromJson(required(node, "precondition"));
		List<FieldTransform> transforms = node.has("transforms")
			? listFromJson(node.get("transforms"), this::fieldTransformFromJson)
			: List.of();
		switch (type) {
			case "set":
				return new SetMutation(key, objectValueFromJson(required(node, "value")), precondition, transforms);
			case "patch": {
				Set<FieldPath> mask = new TreeSet<>(listFromJson(required(node, "mask"), this::fieldPathFromJson));
				return new PatchMutation(key, objectValueFromJson(required(node, "value")), FieldMask.fromSet(mask), precondition, transforms);
			}
			case "delete":
				return new DeleteMutation(key, precondition);
			case "verify":
				return new VerifyMutation(key, precondition);
			default:
				throw new IllegalArgumentException("Unrecognized mutation type: " + type);
		}
	}

	public JsonNode mutationBatchToJson(MutationBatch batch) {
		ObjectNode result = nodes.objectNode();
		result.put("batchId", batch.batchId());
		result.set("localWriteTime", instantToJson(batch.localWriteTime()));
		result.set("baseMutations", listToJson(batch.baseMutations(), this::mutationToJson));
		result.set("mutations", listToJson(batch.mutations(), this::mutationToJson));
		return result;
	}

	public MutationBatch mutationBatchFromJson(JsonNode node) {
		return new MutationBatch(
			intFromJson(required(node, "batchId")),
			instantFromJson(required(node, "localWriteTime")),
			listFromJson(required(node, "baseMutations"), this::mutationFromJson),
			listFromJson(required(node, "mutations"), this::mutationFromJson));
	}

	public JsonNode overlayToJson(Overlay overlay) {
		ObjectNode result = nodes.objectNode();
		result.put("largestBatchId", overlay.largestBatchId());
		result.set("mutation", mutationToJson(overlay.mutation()));
		return result;
	}

	public Overlay overlayFromJson(JsonNode node) {
		return new Overlay(
			intFromJson(required(node, "largestBatchId")),
			mutationFromJson(required(node, "mutation")));
	}

	// Targets

	public JsonNode fieldFilterToJson(FieldFilter filter) {
		ObjectNode result = nodes.objectNode();
		result.set("field", fieldPathToJson(filter.field()));
		result.put("operator", filter.operator().name());
		result.set("value", valueToJson(filter.value()));
		return result;
	}

	public FieldFilter fieldFilterFromJson(JsonNode node) {
		return FieldFilter.of(
			fieldPathFromJson(required(node, "field")),
			enumFromJson(FieldFilter.Operator.class, required(node, "operator")),
			valueFromJson(required(node, "value")));
	}

	public JsonNode orderByToJson(OrderBy orderBy) {
		ObjectNode result = nodes.objectNode();
		result.set("field", fieldPathToJson(orderBy.field()));
		result.put("direction", orderBy.direction().name());
		return result;
	}

	public OrderBy orderByFromJson(JsonNode node) {
		return new OrderBy(
			enumFromJson(OrderBy.Direction.class, required(node, "direction")),
			fieldPathFromJson(required(node, "field")));
	}

	public JsonNode targetToJson(Target target) {
		ObjectNode result = nodes.objectNode();
		result.set("path", resourcePathToJson(target.path()));
		if (target.collectionGroup() != null) {
			result.put("collectionGroup", target.collectionGroup());
		}
		result.set("filters", listToJson(target.filters(), this::fieldFilterToJson));
		result.set("orderBy", listToJson(target.orderBy(), this::orderByToJson));
		result.put("limit", target.limit());
		return result;
	}

	public Target targetFromJson(JsonNode node) {
		JsonNode collectionGroup = node.get("collectionGroup");
		return new Target(
			resourcePathFromJson(required(node, "path")),
			collectionGroup == null ? null : text(collectionGroup),
			listFromJson(required(node, "filters"), this::fieldFilterFromJson),
			listFromJson(required(node, "orderBy"), this::orderByFromJson),
			longFromJson(required(node, "limit")));
	}

	public JsonNode targetDataToJson(TargetData targetData) {
		ObjectNode result = nodes.objectNode();
		result.set("target", targetToJson(targetData.target()));
		result.put("targetId", targetData.targetId());
		result.put("sequenceNumber", targetData.sequenceNumber());
		result.put("purpose", targetData.purpose().name());
		result.set("snapshotVersion", snapshotVersionToJson(targetData.snapshotVersion()));
		result.set("lastLimboFreeSnapshotVersion", snapshotVersionToJson(targetData.lastLimboFreeSnapshotVersion()));
		result.put("resumeToken", targetData.resumeToken());
		if (targetData.expectedCount() != null) {
			result.put("expectedCount", targetData.expectedCount());
		}
		return result;
	}

	public TargetData targetDataFromJson(JsonNode node) {
		JsonNode expectedCount = node.get("expectedCount");
		return new TargetData(
			targetFromJson(required(node, "target")),
			intFromJson(required(node, "targetId")),
			longFromJson(required(node, "sequenceNumber")),
			enumFromJson(QueryPurpose.class, required(node, "purpose")),
			snapshotVersionFromJson(required(node, "snapshotVersion")),
			snapshotVersionFromJson(required(node, "lastLimboFreeSnapshotVersion")),
			text(required(node, "resumeToken")),
			expectedCount == null ? null : intFromJson(expectedCount));
	}

	public JsonNode fieldIndexToJson(FieldIndex index) {
		ObjectNode result = nodes.objectNode();
		result.put("collectionGroup", index.collectionGroup());
		result.set("fields", listToJson(index.fields(), this::fieldPathToJson));
		return result;
	}

	public FieldIndex fieldIndexFromJson(JsonNode node) {
		return new FieldIndex(
			text(required(node, "collectionGroup")),
			listFromJson(required(node, "fields"), this::fieldPathFromJson));
	}

	// Whole persistence

	public JsonNode mutationQueueContentsToJson(MutationQueueContents contents) {
		ObjectNode result = nodes.objectNode();
		result.set("batches", listToJson(contents.batches(), this::mutationBatchToJson));
		result.put("nextBatchId", contents.nextBatchId());
		result.put("lastStreamToken", contents.lastStreamToken());
		return result;
	}

	public MutationQueueContents mutationQueueContentsFromJson(JsonNode node) {
		return new MutationQueueContents(
			listFromJson(required(node, "batches"), this::mutationBatchFromJson),
			intFromJson(required(node, "nextBatchId")),
			text(required(node, "lastStreamToken")));
	}

	public JsonNode snapshotToJson(PersistenceSnapshot snapshot) {
		ObjectNode result = nodes.objectNode();
		result.put("formatVersion", FORMAT_VERSION);

		ObjectNode queues = result.putObject("mutationQueues");
		snapshot.mutationQueues().forEach((userKey, contents) -> queues.set(userKey, mutationQueueContentsToJson(contents)));
		ObjectNode overlays = result.putObject("overlays");
		snapshot.overlays().forEach((userKey, list) -> overlays.set(userKey, listToJson(list, this::overlayToJson)));

		result.set("remoteDocuments", listToJson(snapshot.remoteDocuments(), this::documentToJson));
		result.set("targets", listToJson(snapshot.targets(), this::targetDataToJson));
		ArrayNode targetDocuments = result.putArray("targetDocuments");
		snapshot.targetDocuments().forEach((targetId, keys) -> {
			ObjectNode entry = targetDocuments.addObject();
			entry.put("targetId", targetId);
			entry.set("keys", listToJson(new ArrayList<>(keys), this::documentKeyToJson));
		});
		result.put("highestTargetId", snapshot.highestTargetId());
		result.put("highestListenSequenceNumber", snapshot.highestListenSequenceNumber());
		result.set("lastRemoteSnapshotVersion", snapshotVersionToJson(snapshot.lastRemoteSnapshotVersion()));
		ArrayNode orphaned = result.putArray("orphanedSequenceNumbers");
		snapshot.orphanedSequenceNumbers().forEach((key, sequenceNumber) -> {
			ObjectNode entry = orphaned.addObject();
			entry.set("key", documentKeyToJson(key));
			entry.put("sequenceNumber", sequenceNumber);
		});
		result.set("fieldIndexes", listToJson(snapshot.fieldIndexes(), this::fieldIndexToJson));
		return result;
	}

	public PersistenceSnapshot snapshotFromJson(JsonNode node) {
		int formatVersion = intFromJson(required(node, "formatVersion"));
		if (formatVersion != FORMAT_VERSION) {
			throw new IllegalArgumentException("Unsupported format version " + formatVersion + "; expected " + FORMAT_VERSION);
		}

		Map<String, MutationQueueContents> queues = new TreeMap<>();
		required(node, "mutationQueues").fields().forEachRemaining(field ->
			queues.put(field.getKey(), mutationQueueContentsFromJson(field.getValue())));
		Map<String, List<Overlay>> overlays = new TreeMap<>();
		required(node, "overlays").fields().forEachRemaining(field ->
			overlays.put(field.getKey(), listFromJson(field.getValue(), this::overlayFromJson)));

		Map<Integer, Set<DocumentKey>> targetDocuments = new TreeMap<>();
		for (JsonNode entry: array(required(node, "targetDocuments"))) {
			targetDocuments.put(
				intFromJson(required(entry, "targetId")),
				new LinkedHashSet<>(listFromJson(required(entry, "keys"), this::documentKeyFromJson)));
		}
		Map<DocumentKey, Long> orphaned = new TreeMap<>();
		for (JsonNode entry: array(required(node, "orphanedSequenceNumbers"))) {
			orphaned.put(documentKeyFromJson(required(entry, "key")), longFromJson(required(entry, "sequenceNumber")));
		}

		return PersistenceSnapshot.builder()
			.mutationQueues(queues)
			.overlays(overlays)
			.remoteDocuments(listFromJson(required(node, "remoteDocuments"), this::documentFromJson))
			.targets(listFromJson(required(node, "targets"), this::targetDataFromJson))
			.targetDocuments(targetDocuments)
			.highestTargetId(intFromJson(required(node, "highestTargetId")))
			.highestListenSequenceNumber(longFromJson(required(node, "highestListenSequenceNumber")))
			.lastRemoteSnapshotVersion(snapshotVersionFromJson(required(node, "lastRemoteSnapshotVersion")))
			.orphanedSequenceNumbers(orphaned)
			.fieldIndexes(listFromJson(required(node, "fieldIndexes"), this::fieldIndexFromJson))
			.build();
	}

	// Helpers

	private JsonNode tagged(String tag, JsonNode body) {
		ObjectNode result = nodes.objectNode();
		result.set(tag, body);
		return result;
	}

	private <T> ArrayNode listToJson(List<T> items, Function<T, JsonNode> encoder) {
		ArrayNode result = nodes.arrayNode();
		for (T item: items) {
			result.add(encoder.apply(item));
		}
		return result;
	}

	private <T> PVector<T> listFromJson(JsonNode node, Function<JsonNode, T> decoder) {
		PVector<T> result = TreePVector.empty();
		for (JsonNode element: array(node)) {
			result = result.plus(decoder.apply(element));
		}
		return result;
	}

	private static JsonNode required(JsonNode node, String fieldName) {
		JsonNode result = node.get(fieldName);
		if (result == null) {
			throw new IllegalArgumentException("Missing '" + fieldName + "' field in " + abbreviated(node));
		}
		return result;
	}

	private static JsonNode array(JsonNode node) {
		if (!node.isArray()) {
			throw new IllegalArgumentException("Expected an array: " + abbreviated(node));
		}
		return node;
	}

	private static String text(JsonNode node) {
		if (!node.isTextual()) {
			throw new IllegalArgumentException("Expected a string: " + abbreviated(node));
		}
		return node.textValue();
	}

	private static int intFromJson(JsonNode node) {
		if (!node.isIntegralNumber() || !node.canConvertToInt()) {
			throw new IllegalArgumentException("Expected an int: " + abbreviated(node));
		}
		return node.intValue();
	}

	private static long longFromJson(JsonNode node) {
		if (!node.isIntegralNumber() || !node.canConvertToLong()) {
			throw new IllegalArgumentException("Expected a long: " + abbreviated(node));
		}
		return node.longValue();
	}

	private static <E extends Enum<E>> E enumFromJson(Class<E> enumClass, JsonNode node) {
		String name = text(node);
		try {
			return Enum.valueOf(enumClass, name);
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("No " + enumClass.getSimpleName() + " named " + name, e);
		}
	}

	private static String abbreviated(JsonNode node) {
		String text = node.toString();
		return text.length() <= 100 ? text : text.substring(0, 97) + "...";
	}
}

package io.vena.drift.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.ser.Serializers;
import io.vena.drift.core.FieldFilter;
import io.vena.drift.core.OrderBy;
import io.vena.drift.core.Target;
import io.vena.drift.local.FieldIndex;
import io.vena.drift.local.PersistenceSnapshot;
import io.vena.drift.local.PersistenceSnapshot.MutationQueueContents;
import io.vena.drift.local.TargetData;
import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import io.vena.drift.model.FieldPath;
import io.vena.drift.model.ObjectValue;
import io.vena.drift.model.ResourcePath;
import io.vena.drift.model.SnapshotVersion;
import io.vena.drift.model.mutation.FieldTransform;
import io.vena.drift.model.mutation.Mutation;
import io.vena.drift.model.mutation.MutationBatch;
import io.vena.drift.model.mutation.Overlay;
import io.vena.drift.model.mutation.Precondition;
import io.vena.drift.model.mutation.TransformOperation;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;

/**
 * Lets an {@link com.fasterxml.jackson.databind.ObjectMapper} read and write the
 * persisted drift types, in the layout defined by {@link JsonFormatter}.
 */
public final class DriftJacksonModule extends Module {
	private final List<Codec<?>> codecs = new ArrayList<>();

	public DriftJacksonModule(JsonFormatter formatter) {
		// Subclasses of Mutation and TransformOperation match their base class
		add(SnapshotVersion.class, formatter::snapshotVersionToJson, formatter::snapshotVersionFromJson);
		add(DocumentKey.class, formatter::documentKeyToJson, formatter::documentKeyFromJson);
		add(ResourcePath.class, formatter::resourcePathToJson, formatter::resourcePathFromJson);
		add(FieldPath.class, formatter::fieldPathToJson, formatter::fieldPathFromJson);
		add(ObjectValue.class, formatter::objectValueToJson, formatter::objectValueFromJson);
		add(Document.class, formatter::documentToJson, formatter::documentFromJson);
		add(Precondition.class, formatter::preconditionToJson, formatter::preconditionFromJson);
		add(TransformOperation.class, formatter::transformOperationToJson, formatter::transformOperationFromJson);
		add(FieldTransform.class, formatter::fieldTransformToJson, formatter::fieldTransformFromJson);
		add(Mutation.class, formatter::mutationToJson, formatter::mutationFromJson);
		add(MutationBatch.class, formatter::mutationBatchToJson, formatter::mutationBatchFromJson);
		add(Overlay.class, formatter::overlayToJson, formatter::overlayFromJson);
		add(FieldFilter.class, formatter::fieldFilterToJson, formatter::fieldFilterFromJson);
		add(OrderBy.class, formatter::orderByToJson, formatter::orderByFromJson);
		add(Target.class, formatter::targetToJson, formatter::targetFromJson);
		add(TargetData.class, formatter::targetDataToJson, formatter::targetDataFromJson);
		add(FieldIndex.class, formatter::fieldIndexToJson, formatter::fieldIndexFromJson);
		add(MutationQueueContents.class, formatter::mutationQueueContentsToJson, formatter::mutationQueueContentsFromJson);
		add(PersistenceSnapshot.class, formatter::snapshotToJson, formatter::snapshotFromJson);
	}

	private <T> void add(Class<T> type, Function<T, JsonNode> encoder, Function<JsonNode, T> decoder) {
		codecs.add(new Codec<>(type, encoder, decoder));
	}

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(new DriftSerializers());
		context.addDeserializers(new DriftDeserializers());
	}

	private @Nullable Codec<?> codecFor(Class<?> theClass) {
		for (Codec<?> codec: codecs) {
			if (codec.type.isAssignableFrom(theClass)) {
				return codec;
			}
		}
		return null;
	}

	private final class DriftSerializers extends Serializers.Base {
		@Override
		public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
			Codec<?> codec = codecFor(type.getRawClass());
			return (codec == null) ? null : codec.serializer();
		}
	}

	private final class DriftDeserializers extends Deserializers.Base {
		@Override
		public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
			Codec<?> codec = codecFor(type.getRawClass());
			if (codec == null || !type.getRawClass().isAssignableFrom(codec.type)) {
				// Only the registered base type can be deserialized; its subtypes are chosen by the JSON
				return null;
			}
			return codec.deserializer();
		}
	}

	@RequiredArgsConstructor
	private static final class Codec<T> {
		final Class<T> type;
		final Function<T, JsonNode> encoder;
		final Function<JsonNode, T> decoder;

		JsonSerializer<T> serializer() {
			return new JsonSerializer<T>() {
				@Override
				public void serialize(T value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					gen.writeTree(encoder.apply(value));
				}
			};
		}

		JsonDeserializer<T> deserializer() {
			return new JsonDeserializer<T>() {
				@Override
				public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					JsonNode node = ctxt.readTree(p);
					try {
						return decoder.apply(node);
					} catch (IllegalArgumentException e) {
						throw JsonMappingException.from(p, "Malformed " + type.getSimpleName() + ": " + e.getMessage(), e);
					}
				}

				@Override
				public boolean isCachable() {
					return true;
				}
			};
		}
	}
}

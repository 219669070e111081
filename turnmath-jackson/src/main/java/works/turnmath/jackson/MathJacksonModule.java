package works.turnmath.jackson;

import com.fasterxml.jackson.annotation.JsonFormat;
import org.jetbrains.annotations.Nullable;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
import tools.jackson.core.Version;
import tools.jackson.core.exc.StreamConstraintsException;
import tools.jackson.databind.BeanDescription;
import tools.jackson.databind.DeserializationConfig;
import tools.jackson.databind.DeserializationContext;
import tools.jackson.databind.JacksonModule;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.SerializationConfig;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.deser.Deserializers;
import tools.jackson.databind.node.ObjectNode;
import tools.jackson.databind.ser.Serializers;
import works.turnmath.MathNode;
import works.turnmath.exceptions.DepthExceededException;

import static java.util.Objects.requireNonNull;

/**
 * Lets an application's own {@link tools.jackson.databind.ObjectMapper} read and write
 * {@link MathNode} values, including where they appear as fields of other objects,
 * using the same format as {@link JacksonMathSerializer}.
 * <p>
 * Errors in the tree are reported by {@link works.turnmath.exceptions.MathTreeException MathTreeException},
 * which the mapper may wrap in its own exception.
 * <p>
 * The mapper's own nesting limits still apply, and Jackson's defaults admit trees only
 * a few hundred levels deep. Build the mapper on {@link JacksonMathSerializer#jsonFactory}
 * to match the serializer's {@link MathSerializerSettings#maxDepth() maxDepth}.
 * A tree that exceeds the mapper's limits is reported as a {@link DepthExceededException}.
 */
public final class MathJacksonModule extends JacksonModule {
	private final JacksonMathSerializer serializer;

	public MathJacksonModule() {
		this(new JacksonMathSerializer());
	}

	public MathJacksonModule(JacksonMathSerializer serializer) {
		this.serializer = requireNonNull(serializer);
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
		context.addSerializers(new MathSerializers());
		context.addDeserializers(new MathDeserializers());
	}

	private DepthExceededException tooDeep(@Nullable String nodeId, StreamConstraintsException e) {
		return new DepthExceededException(nodeId, serializer.settings().maxDepth(),
			"Tree exceeds the nesting limits of the ObjectMapper: " + e.getOriginalMessage(), e);
	}

	private final class MathSerializers extends Serializers.Base {
		private final ValueSerializer<MathNode> nodeSerializer = new ValueSerializer<>() {
			@Override
			public void serialize(MathNode value, JsonGenerator gen, SerializationContext serializers) {
				ObjectNode tree = serializer.serialize(value);
				try {
					gen.writeTree(tree);
				} catch (StreamConstraintsException e) {
					throw tooDeep(value.id(), e);
				}
			}
		};

		@Override
		public ValueSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription.Supplier beanDescRef, JsonFormat.Value formatOverrides) {
			if (MathNode.class.isAssignableFrom(type.getRawClass())) {
				return nodeSerializer;
			} else {
				return null;
			}
		}
	}

	private final class MathDeserializers extends Deserializers.Base {
		private final ValueDeserializer<MathNode> nodeDeserializer = new ValueDeserializer<>() {
			@Override
			public MathNode deserialize(JsonParser p, DeserializationContext ctxt) {
				JsonNode tree;
				try {
					tree = ctxt.readTree(p);
				} catch (StreamConstraintsException e) {
					throw tooDeep(null, e);
				}
				return serializer.deserialize(tree);
			}
		};

		@Override
		public ValueDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription.Supplier beanDescRef) {
			if (MathNode.class.isAssignableFrom(type.getRawClass())) {
				return nodeDeserializer;
			} else {
				return null;
			}
		}

		@Override
		public boolean hasDeserializerFor(DeserializationConfig config, Class<?> valueType) {
			return MathNode.class.isAssignableFrom(valueType);
		}
	}
}

package works.tessel.jackson;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
import tools.jackson.core.Version;
import tools.jackson.databind.BeanDescription;
import tools.jackson.databind.DeserializationConfig;
import tools.jackson.databind.DeserializationContext;
import tools.jackson.databind.JacksonModule;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.SerializationConfig;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.deser.Deserializers;
import tools.jackson.databind.ser.Serializers;
import works.tessel.codec.AdapterRegistry;
import works.tessel.codec.JsonAdapter;
import works.tessel.types.TypeDescriptor;

import static java.util.Objects.requireNonNull;

/**
 * Lets a Jackson {@code ObjectMapper} read and write the given types
 * using the adapters from an {@link AdapterRegistry}.
 * <p>
 * Only the listed raw classes are handled; for those, every instantiation is
 * delegated to the registry, including nested values.
 * Everything else is left to Jackson.
 */
public final class TesselJacksonModule extends JacksonModule {
	private final AdapterRegistry registry;
	private final Set<Class<?>> types;

	private TesselJacksonModule(AdapterRegistry registry, Set<Class<?>> types) {
		this.registry = requireNonNull(registry);
		this.types = Set.copyOf(types);
	}

	public static TesselJacksonModule of(AdapterRegistry registry, Class<?>... types) {
		return new TesselJacksonModule(registry, Set.of(types));
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
		context.addSerializers(new AdapterSerializers());
		context.addDeserializers(new AdapterDeserializers());
	}

	static TypeDescriptor descriptorFor(JavaType type) {
		List<TypeDescriptor> typeArguments = new ArrayList<>();
		for (int i = 0; i < type.containedTypeCount(); i++) {
			typeArguments.add(descriptorFor(type.containedType(i)));
		}
		return new TypeDescriptor(type.getRawClass(), typeArguments, Set.of());
	}

	private JsonAdapter<Object> adapterFor(JavaType type) {
		TypeDescriptor descriptor = descriptorFor(type);
		LOGGER.debug("Delegating {} to {}", type, descriptor);
		return registry.adapterFor(descriptor);
	}

	private final class AdapterSerializers extends Serializers.Base {
		private final Map<JavaType, ValueSerializer<?>> memo = new ConcurrentHashMap<>();

		@Override
		public ValueSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription.Supplier beanDescRef, JsonFormat.Value formatOverrides) {
			if (!types.contains(type.getRawClass())) {
				return null;
			}
			return memo.computeIfAbsent(type, t -> new AdapterSerializer(adapterFor(t)));
		}
	}

	private final class AdapterDeserializers extends Deserializers.Base {
		private final Map<JavaType, ValueDeserializer<?>> memo = new ConcurrentHashMap<>();

		@Override
		public ValueDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription.Supplier beanDescRef) {
			if (!types.contains(type.getRawClass())) {
				return null;
			}
			return memo.computeIfAbsent(type, t -> new AdapterDeserializer(adapterFor(t)));
		}

		@Override
		public boolean hasDeserializerFor(DeserializationConfig config, Class<?> valueType) {
			return types.contains(valueType);
		}
	}

	private static final class AdapterSerializer extends ValueSerializer<Object> {
		private final JsonAdapter<Object> adapter;

		AdapterSerializer(JsonAdapter<Object> adapter) {
			this.adapter = adapter;
		}

		@Override
		public void serialize(Object value, JsonGenerator gen, SerializationContext serializers) {
			try {
				adapter.toJson(new JacksonJsonWriter(gen), value);
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
		}
	}

	private static final class AdapterDeserializer extends ValueDeserializer<Object> {
		private final JsonAdapter<Object> adapter;

		AdapterDeserializer(JsonAdapter<Object> adapter) {
			this.adapter = adapter;
		}

		@Override
		public Object deserialize(JsonParser p, DeserializationContext ctxt) {
			try {
				return adapter.fromJson(new JacksonJsonReader(p));
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TesselJacksonModule.class);
}

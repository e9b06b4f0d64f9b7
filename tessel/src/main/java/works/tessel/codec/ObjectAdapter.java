package works.tessel.codec;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tessel.exceptions.MissingPropertiesException;
import works.tessel.mapping.PropertyDescriptor;
import works.tessel.mapping.RecordDescriptor;

/**
 * Maps a record to a JSON object as described by a {@link RecordDescriptor}.
 * <p>
 * Decoding ignores unknown members, whatever their shape, and reports all missing
 * required properties together in a {@link MissingPropertiesException}.
 * Encoding writes every property, in declaration order, including nulls.
 */
public final class ObjectAdapter<T> extends JsonAdapter<T> {
	private final RecordDescriptor<T> descriptor;
	private final List<PropertyDescriptor> properties;
	private final List<JsonAdapter<Object>> adapters;
	private final Map<String, Integer> indexesByJsonKey;

	/**
	 * Marks slots for which the JSON had no member.
	 */
	private static final Object ABSENT = new Object() {
		@Override
		public String toString() {
			return "ABSENT";
		}
	};

	/**
	 * @param registry supplies the adapter for each property's type
	 */
	public ObjectAdapter(RecordDescriptor<T> descriptor, AdapterRegistry registry) {
		this.descriptor = descriptor;
		this.properties = descriptor.properties();
		List<JsonAdapter<Object>> adapters = new ArrayList<>(properties.size());
		Map<String, Integer> indexes = new HashMap<>();
		for (int i = 0; i < properties.size(); i++) {
			PropertyDescriptor p = properties.get(i);
			adapters.add(registry.adapterFor(p.type()));
			indexes.put(p.jsonKey(), i);
		}
		this.adapters = List.copyOf(adapters);
		this.indexesByJsonKey = Map.copyOf(indexes);
	}

	@Override
	public @Nullable T fromJson(JsonReader reader) throws IOException {
		if (reader.peek() == Token.NULL) {
			reader.nextNull();
			return null;
		}
		Object[] slots = new Object[properties.size()];
		Arrays.fill(slots, ABSENT);
		reader.beginObject();
		while (reader.hasNext()) {
			String key = reader.nextName();
			Integer index = indexesByJsonKey.get(key);
			if (index == null) {
				LOGGER.trace("Skipping unknown member \"{}\" of {}", key, descriptor.qualifiedName());
				reader.skipValue();
			} else if (reader.peek() == Token.NULL) {
				reader.nextNull();
				slots[index] = null;
			} else {
				slots[index] = adapters.get(index).fromJson(reader);
			}
		}
		reader.endObject();

		List<String> missing = null;
		for (int i = 0; i < slots.length; i++) {
			PropertyDescriptor p = properties.get(i);
			Object value = slots[i];
			if (value == ABSENT || value == null) {
				if (p.isRequired()) {
					if (missing == null) {
						missing = new ArrayList<>();
					}
					missing.add(p.name());
				} else if (p.hasDefault() && (value == ABSENT || !p.nullable())) {
					slots[i] = p.defaultValue().get();
				} else {
					slots[i] = null;
				}
			}
		}
		if (missing != null) {
			throw new MissingPropertiesException(missing);
		}
		return descriptor.instantiate(slots);
	}

	@Override
	public void toJson(JsonWriter writer, @Nullable T value) throws IOException {
		if (value == null) {
			writer.nullValue();
			return;
		}
		writer.beginObject();
		for (int i = 0; i < properties.size(); i++) {
			PropertyDescriptor p = properties.get(i);
			writer.name(p.jsonKey());
			Object propertyValue = p.read(value);
			if (propertyValue == null) {
				writer.nullValue();
			} else {
				adapters.get(i).toJson(writer, propertyValue);
			}
		}
		writer.endObject();
	}

	public RecordDescriptor<T> descriptor() {
		return descriptor;
	}

	@Override
	public String toString() {
		return "GeneratedJsonAdapter(" + descriptor.qualifiedName() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ObjectAdapter.class);
}

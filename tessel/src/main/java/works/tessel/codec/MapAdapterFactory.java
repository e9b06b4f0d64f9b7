package works.tessel.codec;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.tessel.exceptions.JsonContentException;
import works.tessel.types.TypeDescriptor;

import static java.util.Collections.unmodifiableMap;

/**
 * Handles {@code Map<String, V>} as a JSON object.
 * A raw {@link Map} has {@link Object} values.
 * Decoded maps are unmodifiable and preserve input order.
 */
final class MapAdapterFactory implements JsonAdapter.Factory {
	static final MapAdapterFactory INSTANCE = new MapAdapterFactory();

	private MapAdapterFactory() { }

	@Override
	public @Nullable JsonAdapter<?> create(TypeDescriptor type, AdapterRegistry registry) {
		if (type.isQualified() || type.rawClass() != Map.class) {
			return null;
		}
		if (type.typeArguments().isEmpty()) {
			return new MapAdapter<>(registry.adapterFor(TypeDescriptor.of(Object.class))).nullSafe();
		}
		if (type.typeArgument(0).rawClass() != String.class) {
			// Only strings can be JSON member names
			return null;
		}
		return new MapAdapter<>(registry.adapterFor(type.typeArgument(1))).nullSafe();
	}

	@Override
	public String toString() {
		return "MapAdapterFactory";
	}

	private static final class MapAdapter<V> extends JsonAdapter<Map<String, V>> {
		private final JsonAdapter<V> valueAdapter;

		MapAdapter(JsonAdapter<V> valueAdapter) {
			this.valueAdapter = valueAdapter.nullSafe();
		}

		@Override
		public Map<String, V> fromJson(JsonReader reader) throws IOException {
			Map<String, V> result = new LinkedHashMap<>();
			reader.beginObject();
			while (reader.hasNext()) {
				String name = reader.nextName();
				V value = valueAdapter.fromJson(reader);
				if (result.containsKey(name)) {
					throw new JsonContentException("Map key '" + name + "' has multiple values");
				}
				result.put(name, value);
			}
			reader.endObject();
			return unmodifiableMap(result);
		}

		@Override
		public void toJson(JsonWriter writer, Map<String, V> value) throws IOException {
			writer.beginObject();
			for (var entry : value.entrySet()) {
				if (entry.getKey() == null) {
					throw new IllegalArgumentException("Map key is null");
				}
				writer.name(entry.getKey());
				valueAdapter.toJson(writer, entry.getValue());
			}
			writer.endObject();
		}

		@Override
		public String toString() {
			return "JsonAdapter(" + valueAdapter + ").map()";
		}
	}
}

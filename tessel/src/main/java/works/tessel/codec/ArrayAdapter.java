package works.tessel.codec;

import java.io.IOException;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.tessel.types.TypeDescriptor;

/**
 * Reads and writes Java arrays, including arrays of primitives, as JSON arrays.
 */
final class ArrayAdapter extends JsonAdapter<Object> {
	static final JsonAdapter.Factory FACTORY = new JsonAdapter.Factory() {
		@Override
		public @Nullable JsonAdapter<?> create(TypeDescriptor type, AdapterRegistry registry) {
			if (type.isQualified() || !type.isArray()) {
				return null;
			}
			Class<?> componentType = type.rawClass().getComponentType();
			JsonAdapter<Object> componentAdapter = registry.adapterFor(TypeDescriptor.of(componentType));
			return new ArrayAdapter(componentType, componentAdapter).nullSafe();
		}

		@Override
		public String toString() {
			return "ArrayAdapter.FACTORY";
		}
	};

	private final Class<?> componentType;
	private final JsonAdapter<Object> componentAdapter;

	ArrayAdapter(Class<?> componentType, JsonAdapter<Object> componentAdapter) {
		this.componentType = componentType;
		this.componentAdapter = componentType.isPrimitive() ? componentAdapter : componentAdapter.nullSafe();
	}

	@Override
	public Object fromJson(JsonReader reader) throws IOException {
		List<Object> list = new ArrayList<>();
		reader.beginArray();
		while (reader.hasNext()) {
			list.add(componentAdapter.fromJson(reader));
		}
		reader.endArray();
		Object array = Array.newInstance(componentType, list.size());
		for (int i = 0; i < list.size(); i++) {
			Array.set(array, i, list.get(i));
		}
		return array;
	}

	@Override
	public void toJson(JsonWriter writer, Object value) throws IOException {
		writer.beginArray();
		for (int i = 0, length = Array.getLength(value); i < length; i++) {
			componentAdapter.toJson(writer, Array.get(value, i));
		}
		writer.endArray();
	}

	@Override
	public String toString() {
		return componentAdapter + ".array()";
	}
}

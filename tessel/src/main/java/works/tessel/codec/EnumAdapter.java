package works.tessel.codec;

import java.io.IOException;
import java.lang.reflect.Field;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import works.tessel.exceptions.JsonContentException;
import works.tessel.mapping.Json;
import works.tessel.mapping.JsonDefaultValue;

/**
 * Reads and writes enum constants as strings: the constant's {@link Enum#name() name},
 * or the name given by its {@link Json} annotation.
 * A constant annotated {@link JsonDefaultValue} is used for strings that match no constant.
 */
final class EnumAdapter<E extends Enum<E>> extends JsonAdapter<E> {
	private final Class<E> enumType;
	private final Map<String, E> constantsByJsonName = new HashMap<>();
	private final Map<E, String> jsonNamesByConstant;
	private final E fallback;

	EnumAdapter(Class<E> enumType) {
		this.enumType = enumType;
		this.jsonNamesByConstant = new EnumMap<>(enumType);
		E fallback = null;
		for (E constant : enumType.getEnumConstants()) {
			Field field;
			try {
				field = enumType.getField(constant.name());
			} catch (NoSuchFieldException e) {
				throw new IllegalStateException("Missing field for enum constant " + constant, e);
			}
			Json json = field.getAnnotation(Json.class);
			String jsonName = json == null ? constant.name() : json.name();
			if (constantsByJsonName.put(jsonName, constant) != null) {
				throw new IllegalArgumentException("Duplicate JSON name \"" + jsonName + "\" in " + enumType.getSimpleName());
			}
			jsonNamesByConstant.put(constant, jsonName);
			if (field.isAnnotationPresent(JsonDefaultValue.class)) {
				if (fallback != null) {
					throw new IllegalArgumentException("Multiple default values in " + enumType.getSimpleName());
				}
				fallback = constant;
			}
		}
		this.fallback = fallback;
	}

	@Override
	public E fromJson(JsonReader reader) throws IOException {
		String name = reader.nextString();
		E result = constantsByJsonName.get(name);
		if (result != null) {
			return result;
		} else if (fallback != null) {
			return fallback;
		} else {
			throw new JsonContentException("Expected one of " + constantsByJsonName.keySet() + " but was \"" + name + "\"");
		}
	}

	@Override
	public void toJson(JsonWriter writer, E value) throws IOException {
		writer.value(jsonNamesByConstant.get(value));
	}

	@Override
	public String toString() {
		return "JsonAdapter(" + enumType.getName() + ")";
	}
}

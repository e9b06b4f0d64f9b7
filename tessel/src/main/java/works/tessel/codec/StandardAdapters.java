package works.tessel.codec;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.tessel.exceptions.JsonContentException;
import works.tessel.types.TypeDescriptor;

/**
 * Adapters for strings, primitives and their boxes, enums, and {@link Object}.
 * Boxed types are null-safe; primitive types are not.
 */
final class StandardAdapters {
	private StandardAdapters() { }

	static final JsonAdapter.Factory FACTORY = new JsonAdapter.Factory() {
		@Override
		public @Nullable JsonAdapter<?> create(TypeDescriptor type, AdapterRegistry registry) {
			if (type.isQualified()) {
				return null;
			}
			Class<?> c = type.rawClass();
			if (c == boolean.class) return BOOLEAN;
			if (c == byte.class) return BYTE;
			if (c == char.class) return CHARACTER;
			if (c == double.class) return DOUBLE;
			if (c == float.class) return FLOAT;
			if (c == int.class) return INTEGER;
			if (c == long.class) return LONG;
			if (c == short.class) return SHORT;
			if (c == Boolean.class) return BOOLEAN.nullSafe();
			if (c == Byte.class) return BYTE.nullSafe();
			if (c == Character.class) return CHARACTER.nullSafe();
			if (c == Double.class) return DOUBLE.nullSafe();
			if (c == Float.class) return FLOAT.nullSafe();
			if (c == Integer.class) return INTEGER.nullSafe();
			if (c == Long.class) return LONG.nullSafe();
			if (c == Short.class) return SHORT.nullSafe();
			if (c == String.class) return STRING.nullSafe();
			if (c == Object.class) return new ObjectJsonAdapter(registry).nullSafe();
			if (c.isEnum()) return enumAdapter(c).nullSafe();
			return null;
		}

		@Override
		public String toString() {
			return "StandardAdapters.FACTORY";
		}
	};

	@SuppressWarnings({"unchecked", "rawtypes"})
	private static JsonAdapter<?> enumAdapter(Class<?> c) {
		return new EnumAdapter(c);
	}

	static int rangeCheckNextInt(JsonReader reader, String typeMessage, int min, int max) throws IOException {
		int value = reader.nextInt();
		if (value < min || value > max) {
			throw new JsonContentException("Expected " + typeMessage + " but was " + value);
		}
		return value;
	}

	static final JsonAdapter<Boolean> BOOLEAN = new JsonAdapter<>() {
		@Override
		public Boolean fromJson(JsonReader reader) throws IOException {
			return reader.nextBoolean();
		}

		@Override
		public void toJson(JsonWriter writer, Boolean value) throws IOException {
			writer.value(value.booleanValue());
		}

		@Override
		public String toString() {
			return "JsonAdapter(Boolean)";
		}
	};

	/**
	 * Bytes are unsigned in JSON: they read from {@code [-128, 255]} and write as {@code [0, 255]}.
	 */
	static final JsonAdapter<Byte> BYTE = new JsonAdapter<>() {
		@Override
		public Byte fromJson(JsonReader reader) throws IOException {
			return (byte) rangeCheckNextInt(reader, "a byte", Byte.MIN_VALUE, 0xff);
		}

		@Override
		public void toJson(JsonWriter writer, Byte value) throws IOException {
			writer.value(value.intValue() & 0xff);
		}

		@Override
		public String toString() {
			return "JsonAdapter(Byte)";
		}
	};

	static final JsonAdapter<Character> CHARACTER = new JsonAdapter<>() {
		@Override
		public Character fromJson(JsonReader reader) throws IOException {
			String value = reader.nextString();
			if (value.length() != 1) {
				throw new JsonContentException("Expected a char but was \"" + value + "\"");
			}
			return value.charAt(0);
		}

		@Override
		public void toJson(JsonWriter writer, Character value) throws IOException {
			writer.value(value.toString());
		}

		@Override
		public String toString() {
			return "JsonAdapter(Character)";
		}
	};

	static final JsonAdapter<Double> DOUBLE = new JsonAdapter<>() {
		@Override
		public Double fromJson(JsonReader reader) throws IOException {
			return reader.nextDouble();
		}

		@Override
		public void toJson(JsonWriter writer, Double value) throws IOException {
			writer.value(value.doubleValue());
		}

		@Override
		public String toString() {
			return "JsonAdapter(Double)";
		}
	};

	static final JsonAdapter<Float> FLOAT = new JsonAdapter<>() {
		@Override
		public Float fromJson(JsonReader reader) throws IOException {
			double value = reader.nextDouble();
			float result = (float) value;
			if (Float.isInfinite(result)) {
				throw new JsonContentException("Expected a float but was " + value);
			}
			return result;
		}

		@Override
		public void toJson(JsonWriter writer, Float value) throws IOException {
			// Written as a Number so it prints as a float, without spurious digits
			writer.value((Number) value);
		}

		@Override
		public String toString() {
			return "JsonAdapter(Float)";
		}
	};

	static final JsonAdapter<Integer> INTEGER = new JsonAdapter<>() {
		@Override
		public Integer fromJson(JsonReader reader) throws IOException {
			return reader.nextInt();
		}

		@Override
		public void toJson(JsonWriter writer, Integer value) throws IOException {
			writer.value(value.intValue());
		}

		@Override
		public String toString() {
			return "JsonAdapter(Integer)";
		}
	};

	static final JsonAdapter<Long> LONG = new JsonAdapter<>() {
		@Override
		public Long fromJson(JsonReader reader) throws IOException {
			return reader.nextLong();
		}

		@Override
		public void toJson(JsonWriter writer, Long value) throws IOException {
			writer.value(value.longValue());
		}

		@Override
		public String toString() {
			return "JsonAdapter(Long)";
		}
	};

	static final JsonAdapter<Short> SHORT = new JsonAdapter<>() {
		@Override
		public Short fromJson(JsonReader reader) throws IOException {
			return (short) rangeCheckNextInt(reader, "a short", Short.MIN_VALUE, Short.MAX_VALUE);
		}

		@Override
		public void toJson(JsonWriter writer, Short value) throws IOException {
			writer.value(value.intValue());
		}

		@Override
		public String toString() {
			return "JsonAdapter(Short)";
		}
	};

	static final JsonAdapter<String> STRING = new JsonAdapter<>() {
		@Override
		public String fromJson(JsonReader reader) throws IOException {
			return reader.nextString();
		}

		@Override
		public void toJson(JsonWriter writer, String value) throws IOException {
			writer.value(value);
		}

		@Override
		public String toString() {
			return "JsonAdapter(String)";
		}
	};

	/**
	 * Reads any JSON value into maps, lists, strings, doubles, booleans, and nulls.
	 * Writes values according to their runtime types.
	 */
	static final class ObjectJsonAdapter extends JsonAdapter<Object> {
		private final AdapterRegistry registry;

		ObjectJsonAdapter(AdapterRegistry registry) {
			this.registry = registry;
		}

		@Override
		public @Nullable Object fromJson(JsonReader reader) throws IOException {
			switch (reader.peek()) {
				case BEGIN_ARRAY: {
					List<Object> list = new ArrayList<>();
					reader.beginArray();
					while (reader.hasNext()) {
						list.add(fromJson(reader));
					}
					reader.endArray();
					return list;
				}
				case BEGIN_OBJECT: {
					Map<String, Object> map = new LinkedHashMap<>();
					reader.beginObject();
					while (reader.hasNext()) {
						String name = reader.nextName();
						Object value = fromJson(reader);
						Object replaced = map.put(name, value);
						if (replaced != null) {
							throw new JsonContentException("Map key '" + name + "' has multiple values: " + replaced + " and " + value);
						}
					}
					reader.endObject();
					return map;
				}
				case STRING:
					return reader.nextString();
				case NUMBER:
					return reader.nextDouble();
				case BOOLEAN:
					return reader.nextBoolean();
				case NULL:
					reader.nextNull();
					return null;
				default:
					throw new JsonContentException("Expected a value but was " + reader.peek());
			}
		}

		@Override
		public void toJson(JsonWriter writer, @Nullable Object value) throws IOException {
			if (value == null) {
				writer.nullValue();
				return;
			}
			Class<?> valueClass = value.getClass();
			if (valueClass == Object.class) {
				// Don't recurse forever
				writer.beginObject();
				writer.endObject();
			} else {
				registry.adapterFor(TypeDescriptor.of(toJsonType(valueClass))).toJson(writer, value);
			}
		}

		/**
		 * Collections and maps are written according to their interfaces,
		 * since the built-in adapters only handle those.
		 */
		private static Class<?> toJsonType(Class<?> valueClass) {
			if (Map.class.isAssignableFrom(valueClass)) return Map.class;
			if (Set.class.isAssignableFrom(valueClass)) return Set.class;
			if (Collection.class.isAssignableFrom(valueClass)) return Collection.class;
			return valueClass;
		}

		@Override
		public String toString() {
			return "JsonAdapter(Object)";
		}
	}
}

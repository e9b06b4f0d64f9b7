package works.tessel.mapping;

import java.util.function.Function;
import java.util.function.Supplier;
import works.tessel.exceptions.JsonException;
import works.tessel.exceptions.JsonProcessingException;
import works.tessel.types.TypeDescriptor;

import static java.util.Objects.requireNonNull;

/**
 * One property of a {@link RecordDescriptor}.
 *
 * @param name the field name, as used in diagnostics
 * @param jsonKey the member name used in JSON
 * @param type the property's type usage, including any qualifiers
 * @param defaultValue supplies the value when the property is absent or null in the JSON;
 *                     null if the property has no default
 * @param accessor reads the property from an instance of the record
 */
public record PropertyDescriptor(
	String name,
	String jsonKey,
	TypeDescriptor type,
	boolean nullable,
	Supplier<?> defaultValue,
	Function<Object, ?> accessor
) {
	public PropertyDescriptor {
		requireNonNull(name);
		requireNonNull(jsonKey);
		requireNonNull(type);
		requireNonNull(accessor);
		if (nullable && type.isPrimitive()) {
			throw new IllegalArgumentException("Primitive property \"" + name + "\" can't be nullable");
		}
	}

	/**
	 * @param accessor the record's accessor for this property; typically a method reference
	 */
	@SuppressWarnings("unchecked")
	public static <R> Builder builder(String name, TypeDescriptor type, Function<R, ?> accessor) {
		return new Builder(name, type, (Function<Object, ?>) accessor);
	}

	/**
	 * A required property must appear in the JSON with a non-null value.
	 */
	public boolean isRequired() {
		return !nullable && defaultValue == null;
	}

	public boolean hasDefault() {
		return defaultValue != null;
	}

	public Object read(Object instance) {
		try {
			return accessor.apply(instance);
		} catch (JsonException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new JsonProcessingException("Error reading property \"" + name + "\"", e);
		}
	}

	public static final class Builder {
		private final String name;
		private final TypeDescriptor type;
		private final Function<Object, ?> accessor;
		private String jsonKey;
		private boolean nullable = false;
		private Supplier<?> defaultValue = null;

		private Builder(String name, TypeDescriptor type, Function<Object, ?> accessor) {
			this.name = requireNonNull(name);
			this.type = requireNonNull(type);
			this.accessor = requireNonNull(accessor);
			this.jsonKey = name;
		}

		public Builder jsonKey(String jsonKey) {
			this.jsonKey = requireNonNull(jsonKey);
			return this;
		}

		public Builder nullable() {
			return nullable(true);
		}

		public Builder nullable(boolean nullable) {
			this.nullable = nullable;
			return this;
		}

		public Builder defaultValue(Supplier<?> defaultValue) {
			this.defaultValue = requireNonNull(defaultValue);
			return this;
		}

		public PropertyDescriptor build() {
			return new PropertyDescriptor(name, jsonKey, type, nullable, defaultValue, accessor);
		}
	}
}

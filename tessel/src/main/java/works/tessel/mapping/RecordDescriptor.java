package works.tessel.mapping;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import works.tessel.exceptions.JsonException;
import works.tessel.exceptions.JsonProcessingException;

import static java.util.Objects.requireNonNull;

/**
 * Describes how one concrete record type maps to a JSON object.
 *
 * @param type the record's raw class
 * @param qualifiedName the type's name qualified by its enclosing types, like {@code Outer.Inner}
 * @param properties in declaration order, which is also JSON output order
 * @param instantiator creates an instance from property values given in the same order as {@code properties}
 */
public record RecordDescriptor<T>(
	Class<T> type,
	String qualifiedName,
	List<PropertyDescriptor> properties,
	Function<Object[], T> instantiator
) {
	public RecordDescriptor {
		requireNonNull(type);
		requireNonNull(qualifiedName);
		requireNonNull(instantiator);
		properties = List.copyOf(properties);
		Set<String> names = new HashSet<>();
		Set<String> jsonKeys = new HashSet<>();
		for (var p : properties) {
			if (!names.add(p.name())) {
				throw new IllegalArgumentException("Duplicate property name \"" + p.name() + "\" in " + qualifiedName);
			}
			if (!jsonKeys.add(p.jsonKey())) {
				throw new IllegalArgumentException("Duplicate JSON key \"" + p.jsonKey() + "\" in " + qualifiedName);
			}
		}
	}

	public static <T> Builder<T> builder(Class<T> type) {
		return new Builder<>(type);
	}

	public T instantiate(Object[] values) {
		try {
			return instantiator.apply(values);
		} catch (JsonException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new JsonProcessingException("Error instantiating " + qualifiedName, e);
		}
	}

	/**
	 * @return the simple names of {@code type} and its enclosing types, outermost first, separated by dots
	 */
	public static String qualifiedNameOf(Class<?> type) {
		Deque<String> names = new ArrayDeque<>();
		for (Class<?> c = type; c != null; c = c.getEnclosingClass()) {
			names.addFirst(c.getSimpleName());
		}
		return String.join(".", names);
	}

	public static final class Builder<T> {
		private final Class<T> type;
		private String qualifiedName;
		private final List<PropertyDescriptor> properties = new ArrayList<>();
		private Function<Object[], T> instantiator;

		private Builder(Class<T> type) {
			this.type = requireNonNull(type);
			this.qualifiedName = qualifiedNameOf(type);
		}

		public Builder<T> qualifiedName(String qualifiedName) {
			this.qualifiedName = requireNonNull(qualifiedName);
			return this;
		}

		public Builder<T> property(PropertyDescriptor property) {
			properties.add(requireNonNull(property));
			return this;
		}

		public Builder<T> property(PropertyDescriptor.Builder property) {
			return property(property.build());
		}

		public Builder<T> instantiator(Function<Object[], T> instantiator) {
			this.instantiator = requireNonNull(instantiator);
			return this;
		}

		public RecordDescriptor<T> build() {
			if (instantiator == null) {
				throw new IllegalStateException("No instantiator for " + qualifiedName);
			}
			return new RecordDescriptor<>(type, qualifiedName, properties, instantiator);
		}
	}
}

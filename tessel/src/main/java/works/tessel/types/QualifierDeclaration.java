package works.tessel.types;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Declares the elements of a qualifier tag, and the defaults of those that have one.
 * Use {@link #marker} to build {@link QualifierMarker}s with defaults filled in.
 *
 * @param elements in declaration order
 */
public record QualifierDeclaration(String name, List<Element> elements) {
	public QualifierDeclaration {
		requireNonNull(name);
		elements = List.copyOf(elements);
		var names = new HashSet<String>();
		for (Element e : elements) {
			if (!names.add(e.name())) {
				throw new IllegalArgumentException("Duplicate element " + e.name() + " in qualifier " + name);
			}
		}
	}

	/**
	 * @param defaultValue null if the element must always be given explicitly
	 */
	public record Element(String name, @Nullable Object defaultValue) {
		public Element {
			requireNonNull(name);
		}

		public boolean hasDefault() {
			return defaultValue != null;
		}
	}

	public static QualifierDeclaration of(Class<? extends Annotation> annotationType) {
		if (!annotationType.isAnnotation()) {
			throw new IllegalArgumentException("Not an annotation type: " + annotationType);
		}
		return new QualifierDeclaration(
			annotationType.getName(),
			elementMethods(annotationType).stream()
				.map(m -> new Element(m.getName(), m.getDefaultValue()))
				.toList());
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	/**
	 * @param explicitValues element values stated at the use site
	 * @throws IllegalArgumentException if an element is unknown,
	 * or an element with no default has no value
	 */
	public QualifierMarker marker(Map<String, ?> explicitValues) {
		for (String key : explicitValues.keySet()) {
			if (elements.stream().noneMatch(e -> e.name().equals(key))) {
				throw new IllegalArgumentException("Qualifier " + name + " has no element " + key);
			}
		}
		Map<String, Object> values = new LinkedHashMap<>();
		for (Element e : elements) {
			Object value = explicitValues.get(e.name());
			if (value == null) {
				if (e.hasDefault()) {
					value = e.defaultValue();
				} else {
					throw new IllegalArgumentException("Qualifier " + name + " requires a value for element " + e.name());
				}
			}
			values.put(e.name(), value);
		}
		return new QualifierMarker(name, values);
	}

	public QualifierMarker marker() {
		return marker(Map.of());
	}

	/**
	 * Reflection doesn't promise any particular order for declared methods,
	 * so we sort them by name to get a stable element order.
	 */
	static List<Method> elementMethods(Class<? extends Annotation> annotationType) {
		return Stream.of(annotationType.getDeclaredMethods())
			.filter(m -> !Modifier.isStatic(m.getModifiers()))
			.filter(m -> m.getParameterCount() == 0)
			.peek(Method::trySetAccessible)
			.sorted(Comparator.comparing(Method::getName))
			.toList();
	}

	public static final class Builder {
		private final String name;
		private final List<Element> elements = new ArrayList<>();

		private Builder(String name) {
			this.name = requireNonNull(name);
		}

		public Builder element(String elementName) {
			elements.add(new Element(elementName, null));
			return this;
		}

		public Builder element(String elementName, Object defaultValue) {
			elements.add(new Element(elementName, requireNonNull(defaultValue)));
			return this;
		}

		public QualifierDeclaration build() {
			return new QualifierDeclaration(name, elements);
		}
	}
}

package works.tessel.types;

import java.lang.annotation.Annotation;
import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * One qualifying tag attached to a type usage: a name plus named element values.
 * <p>
 * Markers compare by value. Element values are normalized on construction so that
 * {@link Object#equals} gives the intended semantics:
 * <ul>
 *     <li>strings, numbers, booleans and characters compare by value;</li>
 *     <li>{@link Class} and {@link Enum} references compare by identity;</li>
 *     <li>arrays (including {@code byte[]}) become immutable {@link List}s,
 *         so they compare by length and then element by element;</li>
 *     <li>nested annotations become nested {@code QualifierMarker}s.</li>
 * </ul>
 * Elements omitted at the use site must already have been replaced by their declared defaults;
 * {@link #of(Annotation)} and {@link QualifierDeclaration#marker} both take care of that.
 *
 * @param name identifies the tag; for annotation-based tags, the annotation type's binary name
 * @param elements in declaration order; iteration order does not participate in equality
 */
public record QualifierMarker(String name, Map<String, Object> elements) {
	public QualifierMarker {
		requireNonNull(name);
		Map<String, Object> normalized = new LinkedHashMap<>();
		elements.forEach((k, v) -> normalized.put(requireNonNull(k), normalize(k, v)));
		elements = Collections.unmodifiableMap(normalized);
	}

	/**
	 * @return a marker for a tag with no elements
	 */
	public static QualifierMarker named(String name) {
		return new QualifierMarker(name, Map.of());
	}

	/**
	 * Reads every element of {@code annotation}, including those whose values come from
	 * declared defaults, so the result is indistinguishable from a marker built with
	 * all the same values stated explicitly.
	 */
	public static QualifierMarker of(Annotation annotation) {
		Class<? extends Annotation> type = annotation.annotationType();
		Map<String, Object> elements = new LinkedHashMap<>();
		for (Method method : QualifierDeclaration.elementMethods(type)) {
			try {
				elements.put(method.getName(), method.invoke(annotation));
			} catch (IllegalAccessException | InvocationTargetException e) {
				throw new IllegalStateException("Unable to read element " + method.getName() + " of " + annotation, e);
			}
		}
		return new QualifierMarker(type.getName(), elements);
	}

	public Object element(String elementName) {
		Object result = elements.get(elementName);
		if (result == null) {
			throw new IllegalArgumentException("Qualifier " + name + " has no element " + elementName);
		}
		return result;
	}

	public boolean isAnnotation(Class<? extends Annotation> annotationType) {
		return name.equals(annotationType.getName());
	}

	private static Object normalize(String elementName, Object value) {
		if (value == null) {
			throw new IllegalArgumentException("Qualifier element " + elementName + " cannot be null");
		} else if (value instanceof String
			|| value instanceof Number
			|| value instanceof Boolean
			|| value instanceof Character
			|| value instanceof Class<?>
			|| value instanceof Enum<?>
			|| value instanceof QualifierMarker
		) {
			return value;
		} else if (value instanceof Annotation a) {
			return of(a);
		} else if (value.getClass().isArray()) {
			int length = Array.getLength(value);
			List<Object> list = new ArrayList<>(length);
			for (int i = 0; i < length; i++) {
				list.add(normalize(elementName, Array.get(value, i)));
			}
			return List.copyOf(list);
		} else if (value instanceof List<?> l) {
			return l.stream()
				.map(v -> normalize(elementName, v))
				.toList();
		} else {
			throw new IllegalArgumentException("Unsupported value for qualifier element " + elementName + ": " + value.getClass());
		}
	}

	@Override
	public String toString() {
		String simpleName = name.substring(Math.max(name.lastIndexOf('.'), name.lastIndexOf('$')) + 1);
		if (elements.isEmpty()) {
			return "@" + simpleName;
		} else {
			return "@" + simpleName + elements.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue())
				.collect(joining(", ", "(", ")"));
		}
	}
}

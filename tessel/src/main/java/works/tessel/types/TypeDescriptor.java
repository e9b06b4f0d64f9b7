package works.tessel.types;

import java.lang.annotation.Annotation;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static java.util.Collections.unmodifiableMap;
import static java.util.stream.Collectors.joining;

/**
 * A fully specified type usage: the raw class, its generic type arguments,
 * and the {@link QualifierMarker qualifiers} attached at the point of use.
 * <p>
 * This is the unit of adapter resolution, and the sole key of the resolution cache,
 * so equality is strict: raw classes must be equal, type arguments equal pairwise and in order,
 * and qualifier sets equal as unordered sets.
 * <p>
 * Type arguments are always fully resolved. Type variables and wildcards only
 * exist in the {@link Type}s that descriptors are created {@link #of(Type, Map) from}.
 *
 * @param typeArguments empty for non-generic classes, or for a generic class used raw
 */
public record TypeDescriptor(
	Class<?> rawClass,
	List<TypeDescriptor> typeArguments,
	Set<QualifierMarker> qualifiers
) {
	public TypeDescriptor {
		typeArguments = List.copyOf(typeArguments);
		qualifiers = Set.copyOf(qualifiers);
	}

	public TypeDescriptor(Class<?> rawClass, TypeDescriptor... typeArguments) {
		this(rawClass, List.of(typeArguments), Set.of());
	}

	public static TypeDescriptor of(Class<?> type) {
		return of((Type) type);
	}

	public static TypeDescriptor of(TypeReference<?> ref) {
		return of(ref.type());
	}

	public static TypeDescriptor of(Type type) {
		return of(type, Map.of());
	}

	/**
	 * @param bindings values for any type variables that appear in {@code type}, by name
	 * @throws IllegalArgumentException if {@code type} mentions an unbound type variable
	 */
	public static TypeDescriptor of(Type type, Map<String, TypeDescriptor> bindings) {
		if (type instanceof Class<?> clazz) {
			return new TypeDescriptor(clazz);
		} else if (type instanceof ParameterizedType pt) {
			return new TypeDescriptor(
				(Class<?>) pt.getRawType(),
				Stream.of(pt.getActualTypeArguments())
					.map(t -> of(t, bindings))
					.toList(),
				Set.of());
		} else if (type instanceof TypeVariable<?> tv) {
			TypeDescriptor bound = bindings.get(tv.getName());
			if (bound == null) {
				throw new IllegalArgumentException("Unbound type variable " + tv.getName() + " in " + tv.getGenericDeclaration());
			}
			return bound;
		} else if (type instanceof WildcardType w) {
			// A type usage is either a producer or a consumer of values;
			// either way, the adapter we want is the one for the bound.
			if (w.getLowerBounds().length == 1) {
				return of(w.getLowerBounds()[0], bindings);
			} else {
				return of(w.getUpperBounds()[0], bindings);
			}
		} else if (type instanceof GenericArrayType t) {
			TypeDescriptor component = of(t.getGenericComponentType(), bindings);
			return new TypeDescriptor(component.rawClass().arrayType());
		}
		throw new IllegalArgumentException("Unsupported type: " + type);
	}

	public TypeDescriptor typeArgument(int index) {
		return typeArguments.get(index);
	}

	public boolean isQualified() {
		return !qualifiers.isEmpty();
	}

	public boolean isArray() {
		return rawClass.isArray();
	}

	public boolean isPrimitive() {
		return rawClass.isPrimitive();
	}

	public TypeDescriptor withQualifiers(Collection<QualifierMarker> newQualifiers) {
		return new TypeDescriptor(rawClass, typeArguments, Set.copyOf(newQualifiers));
	}

	public TypeDescriptor withQualifiers(Annotation... annotations) {
		return withQualifiers(Stream.of(annotations).map(QualifierMarker::of).toList());
	}

	public TypeDescriptor withoutQualifiers() {
		if (qualifiers.isEmpty()) {
			return this;
		} else {
			return new TypeDescriptor(rawClass, typeArguments, Set.of());
		}
	}

	/**
	 * @return the type arguments keyed by the names of {@link #rawClass}'s type parameters;
	 * empty if this descriptor has no type arguments
	 */
	public Map<String, TypeDescriptor> actualArguments() {
		if (typeArguments.isEmpty()) {
			return Map.of();
		}
		var typeParameters = rawClass.getTypeParameters();
		if (typeParameters.length != typeArguments.size()) {
			throw new IllegalStateException("Expected " + typeParameters.length + " type arguments for " + rawClass + "; got " + typeArguments.size());
		}
		Map<String, TypeDescriptor> map = new HashMap<>();
		for (int i = 0; i < typeParameters.length; i++) {
			map.put(typeParameters[i].getName(), typeArguments.get(i));
		}
		return unmodifiableMap(map);
	}

	/**
	 * @return a human-readable rendering for error messages, naming the qualifiers if there are any
	 */
	public String description() {
		if (qualifiers.isEmpty()) {
			return toString();
		} else {
			return toString() + " annotated " + qualifiers.stream()
				.map(QualifierMarker::toString)
				.sorted()
				.collect(joining(", ", "[", "]"));
		}
	}

	@Override
	public String toString() {
		String simpleName = rawClass.getSimpleName();
		if (simpleName.isEmpty()) {
			// Anonymous classes
			simpleName = rawClass.getName();
			simpleName = simpleName.substring(simpleName.lastIndexOf('.') + 1);
		}
		if (typeArguments.isEmpty()) {
			return simpleName;
		} else {
			return simpleName + typeArguments.stream()
				.map(TypeDescriptor::toString)
				.collect(joining(",", "<", ">"));
		}
	}
}

package works.tessel.mapping;

import java.lang.annotation.Annotation;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tessel.exceptions.JsonProcessingException;
import works.tessel.types.QualifierMarker;
import works.tessel.types.TypeDescriptor;

/**
 * Derives {@link RecordDescriptor}s from Java records using reflection.
 * <p>
 * Honours these annotations on record components:
 * {@link Json} to choose the JSON key,
 * {@link Nullable} to allow absent and null values,
 * and any annotation meta-annotated with {@link JsonQualifier}, which becomes
 * a qualifier on the component's type.
 * Static methods annotated {@link JsonDefaultValue} supply defaults.
 * <p>
 * Accessors and constructors are invoked via {@link MethodHandle}s obtained from
 * the {@link Lookup} registered for the record's package,
 * or {@link MethodHandles#publicLookup()} if none was registered.
 */
public final class RecordScanner {
	private final Map<Package, Lookup> lookups = new ConcurrentHashMap<>();

	/**
	 * When scanning types, uses the given {@link Lookup} object to find {@link MethodHandle}s
	 * for any class in the same package as the {@link Lookup}'s {@linkplain Lookup#lookupClass() lookup class}.
	 *
	 * @return {@code this}
	 */
	public RecordScanner useLookup(Lookup lookup) {
		lookups.put(lookup.lookupClass().getPackage(), lookup);
		return this;
	}

	public <R extends Record> RecordDescriptor<R> scan(Class<R> recordClass) {
		return scan(recordClass, TypeDescriptor.of(recordClass));
	}

	/**
	 * @param instantiation supplies values for {@code recordClass}'s type parameters, if any
	 */
	public <R extends Record> RecordDescriptor<R> scan(Class<R> recordClass, TypeDescriptor instantiation) {
		if (!recordClass.isRecord()) {
			throw new IllegalArgumentException("Not a record: " + recordClass);
		}
		if (instantiation.rawClass() != recordClass) {
			throw new IllegalArgumentException("Type " + instantiation + " is not an instantiation of " + recordClass.getSimpleName());
		}
		if (recordClass.getTypeParameters().length != instantiation.typeArguments().size()) {
			throw new IllegalArgumentException("Record " + recordClass.getSimpleName() + " requires "
				+ recordClass.getTypeParameters().length + " type arguments; got " + instantiation);
		}
		LOGGER.debug("Scanning {}", instantiation);
		var actualTypeArguments = instantiation.actualArguments();
		var defaults = scanDefaults(recordClass);
		var builder = RecordDescriptor.builder(recordClass);
		for (RecordComponent c : recordClass.getRecordComponents()) {
			builder.property(scanRecordComponent(c, actualTypeArguments, defaults.remove(c.getName())));
		}
		if (!defaults.isEmpty()) {
			throw new IllegalStateException("Default values supplied for nonexistent components of " + recordClass.getSimpleName() + ": " + defaults.keySet());
		}
		return builder
			.instantiator(recordFinisher(recordClass))
			.build();
	}

	private <R extends Record> Function<Object[], R> recordFinisher(Class<R> recordClass) {
		Class<?>[] ctorParameterTypes = Stream.of(recordClass.getRecordComponents())
			.map(RecordComponent::getType)
			.toArray(Class<?>[]::new);
		MethodHandle constructor;
		try {
			constructor = lookupFor(recordClass).unreflectConstructor(recordClass.getDeclaredConstructor(ctorParameterTypes));
		} catch (NoSuchMethodException | IllegalAccessException e) {
			throw new IllegalStateException("Unexpected error accessing record constructor for " + recordClass, e);
		}
		return args -> {
			try {
				return recordClass.cast(constructor.invokeWithArguments(args));
			} catch (RuntimeException | Error e) {
				throw e;
			} catch (Throwable e) {
				throw new JsonProcessingException("Unexpected exception from record constructor for " + recordClass.getSimpleName(), e);
			}
		};
	}

	private PropertyDescriptor scanRecordComponent(RecordComponent c, Map<String, TypeDescriptor> recordTypeArguments, Supplier<?> defaultValue) {
		MethodHandle mh;
		try {
			mh = lookupFor(c.getDeclaringRecord()).unreflect(c.getAccessor());
		} catch (IllegalAccessException e) {
			throw new IllegalStateException("Unexpected error accessing record component accessor for " + c, e);
		}
		Function<Object, ?> accessor = instance -> {
			try {
				return mh.invoke(instance);
			} catch (RuntimeException | Error e) {
				throw e;
			} catch (Throwable e) {
				throw new JsonProcessingException("Unexpected exception from accessor for " + c, e);
			}
		};

		List<QualifierMarker> qualifiers = Stream.of(c.getAnnotations())
			.filter(RecordScanner::isQualifier)
			.map(QualifierMarker::of)
			.toList();
		TypeDescriptor type = TypeDescriptor.of(c.getGenericType(), recordTypeArguments)
			.withQualifiers(qualifiers);

		Json json = c.getAnnotation(Json.class);
		var builder = PropertyDescriptor.builder(c.getName(), type, accessor)
			.jsonKey(json == null ? c.getName() : json.name())
			.nullable(c.isAnnotationPresent(Nullable.class) && !c.getType().isPrimitive());
		if (defaultValue != null) {
			builder.defaultValue(defaultValue);
		}
		return builder.build();
	}

	/**
	 * @return mutable map of component name to default value supplier
	 */
	private Map<String, Supplier<?>> scanDefaults(Class<?> recordClass) {
		Map<String, Supplier<?>> result = new HashMap<>();
		for (Method m : recordClass.getDeclaredMethods()) {
			JsonDefaultValue annotation = m.getAnnotation(JsonDefaultValue.class);
			if (annotation == null) {
				continue;
			}
			if (!Modifier.isStatic(m.getModifiers()) || m.getParameterCount() != 0) {
				throw new IllegalStateException("Default value method must be static with no parameters: " + m);
			}
			MethodHandle mh;
			try {
				mh = lookupFor(recordClass).unreflect(m);
			} catch (IllegalAccessException e) {
				throw new IllegalStateException("Unexpected error accessing default value method " + m, e);
			}
			Supplier<?> supplier = () -> {
				try {
					return mh.invoke();
				} catch (RuntimeException | Error e) {
					throw e;
				} catch (Throwable e) {
					throw new JsonProcessingException("Unexpected exception from default value method " + m, e);
				}
			};
			if (result.put(annotation.value(), supplier) != null) {
				throw new IllegalStateException("Multiple default values for component \"" + annotation.value() + "\" of " + recordClass.getSimpleName());
			}
		}
		return result;
	}

	private Lookup lookupFor(Class<?> c) {
		return lookups.getOrDefault(c.getPackage(), MethodHandles.publicLookup());
	}

	/**
	 * @return true if {@code annotation} is a qualifier
	 */
	public static boolean isQualifier(Annotation annotation) {
		return annotation.annotationType().isAnnotationPresent(JsonQualifier.class);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RecordScanner.class);
}

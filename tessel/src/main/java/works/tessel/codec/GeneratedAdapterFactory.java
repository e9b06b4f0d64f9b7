package works.tessel.codec;

import java.lang.invoke.MethodHandles.Lookup;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import works.tessel.mapping.RecordDescriptor;
import works.tessel.mapping.RecordScanner;
import works.tessel.types.TypeDescriptor;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Produces an {@link ObjectAdapter} for each record type it knows,
 * given either as a ready-made {@link RecordDescriptor} or as a function
 * from each generic instantiation to its descriptor.
 * Only unqualified type usages match.
 */
public final class GeneratedAdapterFactory implements JsonAdapter.Factory {
	private final Map<Class<?>, Function<TypeDescriptor, RecordDescriptor<?>>> descriptors;

	private GeneratedAdapterFactory(Map<Class<?>, Function<TypeDescriptor, RecordDescriptor<?>>> descriptors) {
		this.descriptors = Map.copyOf(descriptors);
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public @Nullable JsonAdapter<?> create(TypeDescriptor type, AdapterRegistry registry) {
		if (type.isQualified()) {
			return null;
		}
		var descriptorFunction = descriptors.get(type.rawClass());
		if (descriptorFunction == null) {
			return null;
		}
		if (type.rawClass().getTypeParameters().length != type.typeArguments().size()) {
			// Raw usage of a generic type
			return null;
		}
		return new ObjectAdapter<>(descriptorFunction.apply(type), registry);
	}

	@Override
	public String toString() {
		return "GeneratedAdapterFactory" + descriptors.keySet().stream()
			.map(Class::getSimpleName)
			.sorted()
			.collect(joining(", ", "[", "]"));
	}

	public static final class Builder {
		private final Map<Class<?>, Function<TypeDescriptor, RecordDescriptor<?>>> descriptors = new LinkedHashMap<>();
		private final RecordScanner scanner = new RecordScanner();

		private Builder() { }

		/**
		 * For non-generic types.
		 */
		public Builder add(RecordDescriptor<?> descriptor) {
			requireNonNull(descriptor);
			if (descriptor.type().getTypeParameters().length != 0) {
				throw new IllegalArgumentException("Generic type " + descriptor.qualifiedName() + " requires a descriptor function");
			}
			return add(descriptor.type(), t -> descriptor);
		}

		/**
		 * @param descriptorFunction called once for each distinct instantiation of {@code type}
		 */
		public Builder add(Class<?> type, Function<TypeDescriptor, RecordDescriptor<?>> descriptorFunction) {
			requireNonNull(type);
			requireNonNull(descriptorFunction);
			if (descriptors.putIfAbsent(type, descriptorFunction) != null) {
				throw new IllegalArgumentException("Type already added: " + type.getSimpleName());
			}
			return this;
		}

		/**
		 * Derives descriptors from {@code recordClass} using a {@link RecordScanner}.
		 * Non-generic records are scanned immediately.
		 */
		public Builder scan(Class<? extends Record> recordClass) {
			if (recordClass.getTypeParameters().length == 0) {
				return add(scanner.scan(recordClass));
			} else {
				return add(recordClass, t -> scanner.scan(recordClass, t));
			}
		}

		/**
		 * @see RecordScanner#useLookup
		 */
		public Builder useLookup(Lookup lookup) {
			scanner.useLookup(lookup);
			return this;
		}

		public GeneratedAdapterFactory build() {
			return new GeneratedAdapterFactory(descriptors);
		}
	}
}

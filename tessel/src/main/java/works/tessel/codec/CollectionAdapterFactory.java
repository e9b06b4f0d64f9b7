package works.tessel.codec;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import works.tessel.types.TypeDescriptor;

import static java.util.Collections.unmodifiableCollection;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableSet;

/**
 * Handles {@link List}, {@link Collection}, and {@link Set} of any element type,
 * as JSON arrays. A raw collection type has {@link Object} elements.
 * Decoded collections are unmodifiable, and sets preserve input order.
 */
final class CollectionAdapterFactory implements JsonAdapter.Factory {
	static final CollectionAdapterFactory INSTANCE = new CollectionAdapterFactory();

	private CollectionAdapterFactory() { }

	@Override
	public @Nullable JsonAdapter<?> create(TypeDescriptor type, AdapterRegistry registry) {
		if (type.isQualified()) {
			return null;
		}
		Class<?> c = type.rawClass();
		TypeDescriptor elementType = type.typeArguments().isEmpty()
			? TypeDescriptor.of(Object.class)
			: type.typeArgument(0);
		if (c == List.class || c == Collection.class) {
			return new CollectionAdapter<>(registry.adapterFor(elementType), ArrayList::new).nullSafe();
		} else if (c == Set.class) {
			return new CollectionAdapter<>(registry.adapterFor(elementType), LinkedHashSet::new).nullSafe();
		} else {
			return null;
		}
	}

	@Override
	public String toString() {
		return "CollectionAdapterFactory";
	}

	private static final class CollectionAdapter<E> extends JsonAdapter<Collection<E>> {
		private final JsonAdapter<E> elementAdapter;
		private final Supplier<Collection<E>> constructor;

		CollectionAdapter(JsonAdapter<E> elementAdapter, Supplier<Collection<E>> constructor) {
			this.elementAdapter = elementAdapter.nullSafe();
			this.constructor = constructor;
		}

		@Override
		public Collection<E> fromJson(JsonReader reader) throws IOException {
			Collection<E> result = constructor.get();
			reader.beginArray();
			while (reader.hasNext()) {
				result.add(elementAdapter.fromJson(reader));
			}
			reader.endArray();
			if (result instanceof List<E> list) {
				return unmodifiableList(list);
			} else if (result instanceof Set<E> set) {
				return unmodifiableSet(set);
			} else {
				return unmodifiableCollection(result);
			}
		}

		@Override
		public void toJson(JsonWriter writer, Collection<E> value) throws IOException {
			writer.beginArray();
			for (E element : value) {
				elementAdapter.toJson(writer, element);
			}
			writer.endArray();
		}

		@Override
		public String toString() {
			return elementAdapter + ".collection()";
		}
	}
}

package works.tessel.codec;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.tessel.types.QualifierMarker;
import works.tessel.types.TypeDescriptor;

import static java.util.Objects.requireNonNull;

/**
 * A factory for one exact qualified type usage, whose adapter applies a fixed
 * structural transform around the adapter for the same type without qualifiers.
 * <p>
 * For example, a property declared as {@code @Wrapped @Named String name}
 * can be read from <code>{"name":["value"]}</code> by a combinator registered
 * for {@code String} with qualifiers {@code @Wrapped} and {@code @Named},
 * which delegates the inner {@code "value"} to the ordinary {@code String} adapter.
 */
public abstract class QualifierCombinator<T> implements JsonAdapter.Factory {
	private final TypeDescriptor type;

	/**
	 * @param qualifiers must match the type usage's qualifiers exactly
	 */
	protected QualifierCombinator(Type type, Set<QualifierMarker> qualifiers) {
		requireNonNull(type);
		if (qualifiers.isEmpty()) {
			throw new IllegalArgumentException("Combinator for " + type.getTypeName() + " needs at least one qualifier");
		}
		this.type = TypeDescriptor.of(type).withQualifiers(qualifiers);
	}

	public TypeDescriptor type() {
		return type;
	}

	protected abstract T decode(JsonReader reader, JsonAdapter<T> delegate) throws IOException;

	protected abstract void encode(JsonWriter writer, T value, JsonAdapter<T> delegate) throws IOException;

	@Override
	public final @Nullable JsonAdapter<?> create(TypeDescriptor requested, AdapterRegistry registry) {
		if (!type.equals(requested)) {
			return null;
		}
		JsonAdapter<T> delegate = registry.adapterFor(requested.withoutQualifiers());
		return new CombinedAdapter(delegate);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + type.description() + ")";
	}

	private final class CombinedAdapter extends JsonAdapter<T> {
		private final JsonAdapter<T> delegate;

		CombinedAdapter(JsonAdapter<T> delegate) {
			this.delegate = delegate;
		}

		@Override
		public T fromJson(JsonReader reader) throws IOException {
			return decode(reader, delegate);
		}

		@Override
		public void toJson(JsonWriter writer, T value) throws IOException {
			encode(writer, value, delegate);
		}

		@Override
		public String toString() {
			return QualifierCombinator.this + "[" + delegate + "]";
		}
	}
}

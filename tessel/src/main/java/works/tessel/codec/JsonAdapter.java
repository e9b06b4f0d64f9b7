package works.tessel.codec;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import org.jetbrains.annotations.Nullable;
import works.tessel.codec.io.CharArrayJsonReader;
import works.tessel.codec.io.TextJsonWriter;
import works.tessel.exceptions.JsonSyntaxException;
import works.tessel.types.TypeDescriptor;

/**
 * Converts values of one {@link TypeDescriptor type usage} to and from JSON.
 * <p>
 * Adapters obtained from an {@link AdapterRegistry} are immutable and thread-safe;
 * the readers and writers they are handed are not.
 */
public abstract class JsonAdapter<T> {
	public abstract @Nullable T fromJson(JsonReader reader) throws IOException;

	public abstract void toJson(JsonWriter writer, @Nullable T value) throws IOException;

	/**
	 * Decodes a complete JSON document.
	 *
	 * @throws JsonSyntaxException if {@code json} is malformed, or has content after the first value
	 */
	public final @Nullable T fromJson(String json) throws IOException {
		try (CharArrayJsonReader reader = CharArrayJsonReader.forString(json)) {
			T result = fromJson(reader);
			if (reader.peek() != Token.END_DOCUMENT) {
				throw new JsonSyntaxException("JSON document was not fully consumed", reader.offset());
			}
			return result;
		}
	}

	public final String toJson(@Nullable T value) {
		return toJson(value, WriterSettings.DEFAULT);
	}

	public final String toJson(@Nullable T value, WriterSettings settings) {
		StringWriter out = new StringWriter();
		try (TextJsonWriter writer = new TextJsonWriter(out, settings)) {
			toJson(writer, value);
		} catch (IOException e) {
			// StringWriter doesn't do IO
			throw new UncheckedIOException(e);
		}
		return out.toString();
	}

	/**
	 * @return an adapter that reads and writes JSON {@code null} itself,
	 * delegating all other values to this one
	 */
	public final JsonAdapter<T> nullSafe() {
		if (this instanceof NullSafeAdapter) {
			return this;
		}
		return new NullSafeAdapter<>(this);
	}

	/**
	 * Produces adapters for the {@link TypeDescriptor type usages} it recognizes.
	 */
	public interface Factory {
		/**
		 * @param registry to be used to obtain adapters for any nested types
		 * @return null if this factory doesn't handle {@code type}
		 */
		@Nullable JsonAdapter<?> create(TypeDescriptor type, AdapterRegistry registry);
	}

	private static final class NullSafeAdapter<T> extends JsonAdapter<T> {
		private final JsonAdapter<T> delegate;

		NullSafeAdapter(JsonAdapter<T> delegate) {
			this.delegate = delegate;
		}

		@Override
		public @Nullable T fromJson(JsonReader reader) throws IOException {
			if (reader.peek() == Token.NULL) {
				reader.nextNull();
				return null;
			}
			return delegate.fromJson(reader);
		}

		@Override
		public void toJson(JsonWriter writer, @Nullable T value) throws IOException {
			if (value == null) {
				writer.nullValue();
			} else {
				delegate.toJson(writer, value);
			}
		}

		@Override
		public String toString() {
			return delegate + ".nullSafe()";
		}
	}
}

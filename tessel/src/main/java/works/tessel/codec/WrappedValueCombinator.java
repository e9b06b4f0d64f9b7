package works.tessel.codec;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.Set;
import works.tessel.types.QualifierMarker;

import static java.util.Objects.requireNonNull;

/**
 * Wraps a value in an object with a single member whose value is a one-element array:
 * <code>{"key":[value]}</code>.
 * When reading, the member name is ignored.
 */
public class WrappedValueCombinator<T> extends QualifierCombinator<T> {
	private final String keyName;

	public WrappedValueCombinator(Type type, Set<QualifierMarker> qualifiers, String keyName) {
		super(type, qualifiers);
		this.keyName = requireNonNull(keyName);
	}

	@Override
	protected T decode(JsonReader reader, JsonAdapter<T> delegate) throws IOException {
		reader.beginObject();
		reader.nextName();
		reader.beginArray();
		T result = delegate.fromJson(reader);
		reader.endArray();
		reader.endObject();
		return result;
	}

	@Override
	protected void encode(JsonWriter writer, T value, JsonAdapter<T> delegate) throws IOException {
		writer.beginObject();
		writer.name(keyName);
		writer.beginArray();
		delegate.toJson(writer, value);
		writer.endArray();
		writer.endObject();
	}
}

package works.tessel.codec;

import java.io.IOException;
import works.tessel.types.TypeDescriptor;

/**
 * Stands in for an adapter that is still being built,
 * so that a recursive type can refer to its own adapter.
 * Bound exactly once, when the real adapter is complete.
 */
final class DeferredAdapter<T> extends JsonAdapter<T> {
	private final TypeDescriptor type;
	private volatile JsonAdapter<T> delegate;

	DeferredAdapter(TypeDescriptor type) {
		this.type = type;
	}

	void bind(JsonAdapter<T> delegate) {
		if (this.delegate != null) {
			throw new IllegalStateException("Adapter for " + type.description() + " is already bound");
		}
		this.delegate = delegate;
	}

	boolean isBound() {
		return delegate != null;
	}

	@Override
	public T fromJson(JsonReader reader) throws IOException {
		return delegate().fromJson(reader);
	}

	@Override
	public void toJson(JsonWriter writer, T value) throws IOException {
		delegate().toJson(writer, value);
	}

	private JsonAdapter<T> delegate() {
		JsonAdapter<T> result = delegate;
		if (result == null) {
			throw new IllegalStateException("Adapter for " + type.description() + " isn't ready yet");
		}
		return result;
	}

	@Override
	public String toString() {
		JsonAdapter<T> result = delegate;
		return result == null ? "DeferredAdapter(" + type + ")" : result.toString();
	}
}

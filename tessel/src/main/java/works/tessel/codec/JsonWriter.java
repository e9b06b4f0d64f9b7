package works.tessel.codec;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;

/**
 * A push-style streaming writer of JSON values.
 * Callers are responsible for emitting a well-nested sequence of calls;
 * implementations throw {@link IllegalStateException} when they can tell otherwise.
 * <p>
 * Implementations are not thread-safe.
 */
public interface JsonWriter extends Closeable, Flushable {
	void beginObject() throws IOException;

	void endObject() throws IOException;

	void beginArray() throws IOException;

	void endArray() throws IOException;

	/**
	 * Must be followed by exactly one value.
	 */
	void name(String name) throws IOException;

	void value(String value) throws IOException;

	void value(boolean value) throws IOException;

	void value(long value) throws IOException;

	/**
	 * @throws IllegalArgumentException for NaN and infinities, which JSON can't represent
	 */
	void value(double value) throws IOException;

	/**
	 * Writes the number using its {@link Number#toString() toString} representation.
	 */
	void value(Number value) throws IOException;

	void nullValue() throws IOException;
}

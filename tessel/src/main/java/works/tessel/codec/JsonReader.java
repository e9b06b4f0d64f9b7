package works.tessel.codec;

import java.io.Closeable;
import java.io.IOException;
import java.math.BigDecimal;
import works.tessel.exceptions.JsonContentException;

/**
 * A pull-style streaming reader of JSON values.
 * <p>
 * Callers {@link #peek} at the next token and then call the one method that consumes it.
 * Calling a method that doesn't match the next token throws {@link JsonContentException};
 * input that isn't well-formed JSON throws whatever the implementation uses for syntax errors,
 * and that exception is propagated to the caller unchanged.
 * <p>
 * Implementations are not thread-safe.
 */
public interface JsonReader extends Closeable {
	/**
	 * Idempotent: calling it repeatedly returns the same token without consuming anything.
	 */
	Token peek() throws IOException;

	/**
	 * @return true if the current array or object has another element or member
	 */
	boolean hasNext() throws IOException;

	void beginObject() throws IOException;

	void endObject() throws IOException;

	void beginArray() throws IOException;

	void endArray() throws IOException;

	String nextName() throws IOException;

	/**
	 * Also accepts a {@link Token#NUMBER NUMBER}, returning its text.
	 */
	String nextString() throws IOException;

	boolean nextBoolean() throws IOException;

	void nextNull() throws IOException;

	/**
	 * Also accepts a {@link Token#STRING STRING} whose contents are a number.
	 * @throws JsonContentException if the number has a fractional part or doesn't fit in a long
	 */
	long nextLong() throws IOException;

	/**
	 * Also accepts a {@link Token#STRING STRING} whose contents are a number.
	 */
	double nextDouble() throws IOException;

	/**
	 * Reads a number without losing precision.
	 * Also accepts a {@link Token#STRING STRING} whose contents are a number.
	 */
	BigDecimal nextNumber() throws IOException;

	/**
	 * @throws JsonContentException if the number has a fractional part or doesn't fit in an int
	 */
	default int nextInt() throws IOException {
		long value = nextLong();
		if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
			throw new JsonContentException("Expected an int but was " + value);
		}
		return (int) value;
	}

	/**
	 * Consumes the next value, whatever its shape, including any nested values.
	 * If the next token is a {@link Token#NAME NAME}, consumes the name and its value.
	 */
	void skipValue() throws IOException;

	/**
	 * @throws JsonContentException if the next token is not {@code expected}
	 */
	default void expect(Token expected) throws IOException {
		Token actual = peek();
		if (actual != expected) {
			throw new JsonContentException("Expected " + expected + " but was " + actual);
		}
	}
}

package works.tessel.exceptions;

/**
 * Malformed JSON text, detected by {@link works.tessel.codec.io.CharArrayJsonReader CharArrayJsonReader}.
 * Readers backed by other parsers report syntax errors with their own exceptions.
 */
public final class JsonSyntaxException extends JsonFormatException {
	private final int offset;

	/**
	 * @param offset the character position at which the problem was detected
	 */
	public JsonSyntaxException(String problem, int offset) {
		super(problem + " at offset " + offset);
		this.offset = offset;
	}

	public int offset() {
		return offset;
	}
}

package works.tessel.exceptions;

/**
 * Well-formed JSON that an adapter can't accept:
 * a token other than the one expected, a number out of range, a duplicate map key,
 * or missing properties.
 * <p>
 * Messages name what was expected, as in {@code Expected BEGIN_OBJECT but was STRING}.
 */
public sealed class JsonContentException extends JsonFormatException permits MissingPropertiesException {
	public JsonContentException(String message) {
		super(message);
	}

	public JsonContentException(String message, Throwable cause) {
		super(message, cause);
	}
}

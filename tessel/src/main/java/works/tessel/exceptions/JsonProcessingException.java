package works.tessel.exceptions;

/**
 * User code failed while JSON was being read or written:
 * a record constructor, an accessor, or a default value method threw.
 * The cause is that code's exception.
 * <p>
 * Failures while scanning records, before any JSON is processed,
 * are reported as {@link IllegalStateException}s instead.
 */
public final class JsonProcessingException extends JsonException {
	public JsonProcessingException(String message, Throwable cause) {
		super(message, cause);
	}
}

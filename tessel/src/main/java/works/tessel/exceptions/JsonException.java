package works.tessel.exceptions;

/**
 * Raised by an adapter while JSON is being read or written.
 * Problems found while resolving adapters, before any JSON is touched,
 * are {@link UnsupportedTypeException}s instead.
 */
public sealed abstract class JsonException extends RuntimeException permits JsonFormatException, JsonProcessingException {
	JsonException(String message) {
		super(message);
	}

	JsonException(String message, Throwable cause) {
		super(message, cause);
	}
}

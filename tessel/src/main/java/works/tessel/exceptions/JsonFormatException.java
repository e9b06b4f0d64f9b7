package works.tessel.exceptions;

/**
 * Something is wrong with the input: either it isn't JSON ({@link JsonSyntaxException}),
 * or it's JSON of a shape the adapter can't accept ({@link JsonContentException}).
 */
public sealed abstract class JsonFormatException extends JsonException permits
	JsonContentException,
	JsonSyntaxException
{
	JsonFormatException(String message) {
		super(message);
	}

	JsonFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}

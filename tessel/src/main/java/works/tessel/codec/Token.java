package works.tessel.codec;

/**
 * The kinds of value-level token a {@link JsonReader} can {@link JsonReader#peek peek}.
 * Punctuation and whitespace never appear here; readers handle those internally.
 */
public enum Token {
	BEGIN_OBJECT,
	END_OBJECT,
	BEGIN_ARRAY,
	END_ARRAY,

	/**
	 * A member name within an object.
	 * Reading it with {@link JsonReader#nextName()} leaves the reader ready for the member's value.
	 */
	NAME,

	STRING,
	NUMBER,

	/**
	 * Either {@code true} or {@code false}.
	 */
	BOOLEAN,

	NULL,

	/**
	 * There is nothing more in the input.
	 */
	END_DOCUMENT;

	/**
	 * @return true for tokens that close a structure
	 */
	public boolean isEnd() {
		return switch (this) {
			case END_OBJECT, END_ARRAY, END_DOCUMENT -> true;
			default -> false;
		};
	}
}

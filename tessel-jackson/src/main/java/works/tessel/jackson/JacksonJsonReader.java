package works.tessel.jackson;

import java.math.BigDecimal;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import works.tessel.codec.JsonReader;
import works.tessel.codec.Token;
import works.tessel.exceptions.JsonContentException;

import static java.util.Objects.requireNonNull;

/**
 * A {@link JsonReader} backed by a Jackson {@link JsonParser}.
 * <p>
 * The parser may already be positioned on the first token of a value,
 * as it is when Jackson calls a deserializer; in that case, reading starts there.
 * After a complete value has been read, the parser is left on that value's last token,
 * as Jackson expects.
 * <p>
 * Jackson's own exceptions propagate unchanged.
 */
public final class JacksonJsonReader implements JsonReader {
	private final JsonParser parser;

	/**
	 * The next token to be consumed, if {@link #hasPending}.
	 * This is always the parser's current token.
	 */
	private JsonToken pending;
	private boolean hasPending;

	public JacksonJsonReader(JsonParser parser) {
		this.parser = requireNonNull(parser);
		this.pending = parser.currentToken();
		this.hasPending = pending != null;
	}

	private JsonToken pending() {
		if (!hasPending) {
			pending = parser.nextToken();
			hasPending = true;
		}
		return pending;
	}

	private void consume() {
		hasPending = false;
	}

	@Override
	public Token peek() {
		JsonToken token = pending();
		if (token == null) {
			return Token.END_DOCUMENT;
		}
		return switch (token) {
			case START_OBJECT -> Token.BEGIN_OBJECT;
			case END_OBJECT -> Token.END_OBJECT;
			case START_ARRAY -> Token.BEGIN_ARRAY;
			case END_ARRAY -> Token.END_ARRAY;
			case PROPERTY_NAME -> Token.NAME;
			case VALUE_STRING -> Token.STRING;
			case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> Token.NUMBER;
			case VALUE_TRUE, VALUE_FALSE -> Token.BOOLEAN;
			case VALUE_NULL -> Token.NULL;
			default -> throw new JsonContentException("Unsupported token " + token);
		};
	}

	@Override
	public boolean hasNext() {
		Token token = peek();
		return token != Token.END_OBJECT && token != Token.END_ARRAY && token != Token.END_DOCUMENT;
	}

	@Override
	public void beginObject() {
		expect(Token.BEGIN_OBJECT);
		consume();
	}

	@Override
	public void endObject() {
		expect(Token.END_OBJECT);
		consume();
	}

	@Override
	public void beginArray() {
		expect(Token.BEGIN_ARRAY);
		consume();
	}

	@Override
	public void endArray() {
		expect(Token.END_ARRAY);
		consume();
	}

	@Override
	public String nextName() {
		expect(Token.NAME);
		String result = parser.currentName();
		consume();
		return result;
	}

	@Override
	public String nextString() {
		Token token = peek();
		if (token != Token.STRING && token != Token.NUMBER) {
			throw new JsonContentException("Expected a string but was " + token);
		}
		String result = parser.getString();
		consume();
		return result;
	}

	@Override
	public boolean nextBoolean() {
		expect(Token.BOOLEAN);
		boolean result = pending == JsonToken.VALUE_TRUE;
		consume();
		return result;
	}

	@Override
	public void nextNull() {
		expect(Token.NULL);
		consume();
	}

	@Override
	public long nextLong() {
		BigDecimal value = nextNumber();
		try {
			return value.longValueExact();
		} catch (ArithmeticException e) {
			throw new JsonContentException("Expected a long but was " + value, e);
		}
	}

	@Override
	public double nextDouble() {
		Token token = peek();
		double result;
		if (token == Token.NUMBER) {
			result = parser.getDoubleValue();
		} else if (token == Token.STRING) {
			try {
				result = Double.parseDouble(parser.getString());
			} catch (NumberFormatException e) {
				throw new JsonContentException("Expected a double but was \"" + parser.getString() + "\"", e);
			}
		} else {
			throw new JsonContentException("Expected a double but was " + token);
		}
		if (Double.isNaN(result) || Double.isInfinite(result)) {
			throw new JsonContentException("JSON forbids NaN and infinities: " + result);
		}
		consume();
		return result;
	}

	@Override
	public BigDecimal nextNumber() {
		Token token = peek();
		BigDecimal result;
		if (token == Token.NUMBER) {
			result = parser.getDecimalValue();
		} else if (token == Token.STRING) {
			try {
				result = new BigDecimal(parser.getString());
			} catch (NumberFormatException e) {
				throw new JsonContentException("Expected a number but was \"" + parser.getString() + "\"", e);
			}
		} else {
			throw new JsonContentException("Expected a number but was " + token);
		}
		consume();
		return result;
	}

	@Override
	public void skipValue() {
		Token token = peek();
		switch (token) {
			case NAME -> {
				consume();
				skipValue();
			}
			case BEGIN_OBJECT, BEGIN_ARRAY -> {
				parser.skipChildren();
				consume();
			}
			case END_OBJECT, END_ARRAY, END_DOCUMENT -> throw new JsonContentException("Expected a value but was " + token);
			default -> consume();
		}
	}

	@Override
	public void expect(Token expected) {
		Token actual = peek();
		if (actual != expected) {
			throw new JsonContentException("Expected " + expected + " but was " + actual);
		}
	}

	@Override
	public void close() {
		parser.close();
	}
}

package works.tessel.codec.io;

import java.math.BigDecimal;
import java.util.Arrays;
import works.tessel.codec.JsonReader;
import works.tessel.codec.Token;
import works.tessel.exceptions.JsonContentException;
import works.tessel.exceptions.JsonSyntaxException;

import static java.lang.Math.min;
import static works.tessel.codec.Token.BEGIN_ARRAY;
import static works.tessel.codec.Token.BEGIN_OBJECT;
import static works.tessel.codec.Token.BOOLEAN;
import static works.tessel.codec.Token.END_ARRAY;
import static works.tessel.codec.Token.END_DOCUMENT;
import static works.tessel.codec.Token.END_OBJECT;
import static works.tessel.codec.Token.NAME;
import static works.tessel.codec.Token.NULL;
import static works.tessel.codec.Token.NUMBER;
import static works.tessel.codec.Token.STRING;

/**
 * A {@link JsonReader} that reads from a char array.
 * Useful for reading JSON text that is small enough to have been
 * fully loaded into memory already, like when reading from a String.
 * <p>
 * Structure is validated with a stack of scopes, so malformed or truncated input
 * is reported as a {@link JsonSyntaxException} as soon as it's encountered.
 * Calling a method that doesn't match a well-formed input is a {@link JsonContentException}.
 */
public final class CharArrayJsonReader implements JsonReader {
	private final char[] chars;
	private int pos = 0;

	/**
	 * Cached result of {@link #peek()}.
	 * When non-null, {@link #pos} points at the first character of the peeked token;
	 * any preceding punctuation has already been consumed.
	 */
	private Token peeked = null;

	private int[] scopes = new int[32];
	private int depth = 0;

	private static final int EMPTY_DOCUMENT = 0;
	private static final int NONEMPTY_DOCUMENT = 1;
	private static final int EMPTY_OBJECT = 2;
	private static final int DANGLING_NAME = 3;
	private static final int NONEMPTY_OBJECT = 4;
	private static final int EMPTY_ARRAY = 5;
	private static final int NONEMPTY_ARRAY = 6;

	public CharArrayJsonReader(char[] chars) {
		this.chars = chars;
		push(EMPTY_DOCUMENT);
	}

	public static CharArrayJsonReader forString(String s) {
		return new CharArrayJsonReader(s.toCharArray());
	}

	/**
	 * @return the position of the first character not yet consumed
	 */
	public int offset() {
		return pos;
	}

	@Override
	public Token peek() {
		if (peeked == null) {
			peeked = doPeek();
		}
		return peeked;
	}

	private Token doPeek() {
		int scope = scopes[depth - 1];
		switch (scope) {
			case EMPTY_ARRAY -> replaceTop(NONEMPTY_ARRAY);
			case NONEMPTY_ARRAY -> {
				int c = nextNonWhitespace();
				if (c == ']') {
					return END_ARRAY;
				} else if (c == ',') {
					pos++;
				} else {
					throw syntaxError("Unterminated array");
				}
			}
			case EMPTY_OBJECT, NONEMPTY_OBJECT -> {
				replaceTop(DANGLING_NAME);
				if (scope == NONEMPTY_OBJECT) {
					int c = nextNonWhitespace();
					if (c == '}') {
						replaceTop(NONEMPTY_OBJECT);
						return END_OBJECT;
					} else if (c == ',') {
						pos++;
					} else {
						throw syntaxError("Unterminated object");
					}
				}
				int c = nextNonWhitespace();
				if (c == '"') {
					return NAME;
				} else if (c == '}' && scope == EMPTY_OBJECT) {
					replaceTop(EMPTY_OBJECT);
					return END_OBJECT;
				} else {
					throw syntaxError("Expected name");
				}
			}
			case DANGLING_NAME -> {
				replaceTop(NONEMPTY_OBJECT);
				if (nextNonWhitespace() != ':') {
					throw syntaxError("Expected ':'");
				}
				pos++;
			}
			case EMPTY_DOCUMENT -> replaceTop(NONEMPTY_DOCUMENT);
			case NONEMPTY_DOCUMENT -> {
				if (nextNonWhitespace() == -1) {
					return END_DOCUMENT;
				} else {
					throw syntaxError("Unexpected content after the end of the document");
				}
			}
			default -> throw new IllegalStateException("Unexpected scope " + scope);
		}

		int c = nextNonWhitespace();
		switch (c) {
			case '{':
				return BEGIN_OBJECT;
			case '[':
				return BEGIN_ARRAY;
			case ']':
				if (scope == EMPTY_ARRAY) {
					return END_ARRAY;
				}
				throw syntaxError("Unexpected ']'");
			case '"':
				return STRING;
			case 't':
			case 'f':
				return BOOLEAN;
			case 'n':
				return NULL;
			case -1:
				throw syntaxError("Unexpected end of input");
			default:
				if (Util.isNumberLeadingChar(c)) {
					return NUMBER;
				}
				throw syntaxError("Unexpected character '" + (char) c + "'");
		}
	}

	@Override
	public boolean hasNext() {
		Token token = peek();
		return token != END_OBJECT && token != END_ARRAY && token != END_DOCUMENT;
	}

	@Override
	public void beginObject() {
		expect(BEGIN_OBJECT);
		pos++;
		peeked = null;
		push(EMPTY_OBJECT);
	}

	@Override
	public void endObject() {
		expect(END_OBJECT);
		pos++;
		peeked = null;
		pop();
	}

	@Override
	public void beginArray() {
		expect(BEGIN_ARRAY);
		pos++;
		peeked = null;
		push(EMPTY_ARRAY);
	}

	@Override
	public void endArray() {
		expect(END_ARRAY);
		pos++;
		peeked = null;
		pop();
	}

	@Override
	public String nextName() {
		expect(NAME);
		peeked = null;
		return consumeString();
	}

	@Override
	public String nextString() {
		Token token = peek();
		if (token == STRING) {
			peeked = null;
			return consumeString();
		} else if (token == NUMBER) {
			peeked = null;
			return consumeNumber();
		} else {
			throw new JsonContentException("Expected a string but was " + token);
		}
	}

	@Override
	public boolean nextBoolean() {
		expect(BOOLEAN);
		peeked = null;
		if (chars[pos] == 't') {
			validateCharacters("true");
			return true;
		} else {
			validateCharacters("false");
			return false;
		}
	}

	@Override
	public void nextNull() {
		expect(NULL);
		peeked = null;
		validateCharacters("null");
	}

	@Override
	public int nextInt() {
		long value = nextLong();
		if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
			throw new JsonContentException("Expected an int but was " + value);
		}
		return (int) value;
	}

	@Override
	public long nextLong() {
		String text = numberText("a long");
		try {
			return Long.parseLong(text);
		} catch (NumberFormatException notALong) {
			try {
				return new BigDecimal(text).longValueExact();
			} catch (NumberFormatException | ArithmeticException e2) {
				throw new JsonContentException("Expected a long but was " + text, e2);
			}
		}
	}

	@Override
	public double nextDouble() {
		String text = numberText("a double");
		try {
			double result = Double.parseDouble(text);
			if (Double.isNaN(result) || Double.isInfinite(result)) {
				throw new JsonContentException("JSON forbids NaN and infinities: " + text);
			}
			return result;
		} catch (NumberFormatException e) {
			throw new JsonContentException("Expected a double but was " + text, e);
		}
	}

	@Override
	public BigDecimal nextNumber() {
		String text = numberText("a number");
		try {
			return new BigDecimal(text);
		} catch (NumberFormatException e) {
			throw new JsonContentException("Expected a number but was " + text, e);
		}
	}

	/**
	 * Consumes a NUMBER, or a STRING that is expected to contain one.
	 */
	private String numberText(String expected) {
		Token token = peek();
		if (token == NUMBER) {
			peeked = null;
			return consumeNumber();
		} else if (token == STRING) {
			peeked = null;
			return consumeString();
		} else {
			throw new JsonContentException("Expected " + expected + " but was " + token);
		}
	}

	@Override
	public void skipValue() {
		if (peek() == NAME) {
			// The value that follows is part of what we're skipping
			nextName();
		}
		int nesting = 0;
		do {
			Token token = peek();
			switch (token) {
				case BEGIN_OBJECT -> {
					beginObject();
					nesting++;
				}
				case BEGIN_ARRAY -> {
					beginArray();
					nesting++;
				}
				case END_OBJECT, END_ARRAY -> {
					if (nesting == 0) {
						throw new JsonContentException("Expected a value but was " + token);
					}
					if (token == END_OBJECT) {
						endObject();
					} else {
						endArray();
					}
					nesting--;
				}
				case NAME -> nextName();
				case STRING -> nextString();
				case NUMBER -> {
					peeked = null;
					consumeNumber();
				}
				case BOOLEAN -> nextBoolean();
				case NULL -> nextNull();
				case END_DOCUMENT -> throw syntaxError("Unexpected end of input");
			}
		} while (nesting > 0);
	}

	@Override
	public void close() {
		peeked = null;
		depth = 0;
	}

	@Override
	public void expect(Token expected) {
		Token actual = peek();
		if (actual != expected) {
			if (actual == END_DOCUMENT) {
				throw syntaxError("Unexpected end of input; expected " + expected);
			}
			throw new JsonContentException("Expected " + expected + " but was " + actual);
		}
	}

	@Override
	public String toString() {
		return "CharArrayJsonReader at offset " + pos + ": \"" + previewString(20) + "\"";
	}

	private int nextNonWhitespace() {
		while (pos < chars.length && Util.isWhitespace(chars[pos])) {
			pos++;
		}
		if (pos >= chars.length) {
			return -1;
		} else {
			return chars[pos];
		}
	}

	private String consumeNumber() {
		int start = pos;
		while (pos < chars.length && Util.isNumberChar(chars[pos])) {
			pos++;
		}
		String text = new String(chars, start, pos - start);
		if (!Util.isValidNumber(text)) {
			throw syntaxError("Malformed number \"" + text + "\"");
		}
		return text;
	}

	/**
	 * {@link #pos} must be at the opening quote.
	 */
	private String consumeString() {
		int start = ++pos;
		while (pos < chars.length) {
			char c = chars[pos];
			if (c == '"') {
				String result = new String(chars, start, pos - start);
				pos++;
				return result;
			} else if (c == '\\') {
				// Escapes need the slow path
				return consumeEscapedString(start);
			} else if (c < 0x20) {
				throw syntaxError("Invalid character in string: 0x" + Integer.toHexString(c));
			}
			pos++;
		}
		throw syntaxError("Unterminated string at end of input");
	}

	private String consumeEscapedString(int start) {
		StringBuilder sb = new StringBuilder();
		sb.append(chars, start, pos - start);
		while (pos < chars.length) {
			char c = chars[pos++];
			if (c == '"') {
				return sb.toString();
			} else if (c == '\\') {
				if (pos >= chars.length) {
					throw syntaxError("Unterminated escape sequence at end of input");
				}
				char esc = chars[pos++];
				switch (esc) {
					case '"', '\\', '/' -> sb.append(esc);
					case 'b' -> sb.append('\b');
					case 'f' -> sb.append('\f');
					case 'n' -> sb.append('\n');
					case 'r' -> sb.append('\r');
					case 't' -> sb.append('\t');
					case 'u' -> {
						if (pos + 4 > chars.length) {
							throw syntaxError("Incomplete Unicode escape sequence at end of input");
						}
						int value = 0;
						for (int i = 0; i < 4; i++) {
							int digit = Character.digit(chars[pos++], 16);
							if (digit < 0) {
								throw syntaxError("Invalid Unicode escape sequence");
							}
							value = (value << 4) | digit;
						}
						sb.append((char) value);
					}
					default -> throw syntaxError("Invalid escape: \\" + esc);
				}
			} else if (c < 0x20) {
				throw syntaxError("Invalid character in string: 0x" + Integer.toHexString(c));
			} else {
				sb.append(c);
			}
		}
		throw syntaxError("Unterminated string at end of input");
	}

	private void validateCharacters(String expectedCharacters) {
		if (expectedCharacters.length() > chars.length - pos) {
			throw syntaxError("Unexpected end of input; expecting '" + expectedCharacters + "'");
		}
		for (int i = 0; i < expectedCharacters.length(); i++) {
			if (chars[pos + i] != expectedCharacters.charAt(i)) {
				throw syntaxError("Unexpected character '" + chars[pos + i] +
					"'; expecting '" + expectedCharacters.charAt(i) + "'");
			}
		}
		pos += expectedCharacters.length();
	}

	private String previewString(int requestedLength) {
		int actualLength = min(requestedLength, chars.length - pos);
		return new String(chars, pos, actualLength);
	}

	private JsonSyntaxException syntaxError(String message) {
		return new JsonSyntaxException(message, pos);
	}

	private void push(int scope) {
		if (depth == scopes.length) {
			scopes = Arrays.copyOf(scopes, depth * 2);
		}
		scopes[depth++] = scope;
	}

	private void pop() {
		depth--;
	}

	private void replaceTop(int scope) {
		scopes[depth - 1] = scope;
	}
}

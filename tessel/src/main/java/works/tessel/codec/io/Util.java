package works.tessel.codec.io;

import java.util.regex.Pattern;

final class Util {
	private static final Pattern NUMBER = Pattern.compile("-?(0|[1-9][0-9]*)(\\.[0-9]+)?([eE][+-]?[0-9]+)?");

	private Util() { }

	static boolean isWhitespace(int c) {
		return c == 0x20 || c == 0x0A || c == 0x0D || c == 0x09;
	}

	static boolean isNumberChar(int c) {
		return (c >= '0' && c <= '9') || c == '.' || c == '-' || c == '+' || c == 'e' || c == 'E';
	}

	static boolean isNumberLeadingChar(int c) {
		return (c >= '0' && c <= '9') || c == '-';
	}

	/**
	 * The characters of a number token are gathered leniently by {@link #isNumberChar};
	 * this checks that they actually form a JSON number.
	 */
	static boolean isValidNumber(CharSequence text) {
		return NUMBER.matcher(text).matches();
	}

	/**
	 * Characters JSON requires to be escaped are escaped; so are U+2028 and U+2029,
	 * which are not legal unescaped in JavaScript string literals.
	 * Everything else is written as-is.
	 */
	static String stringLiteral(String s) {
		StringBuilder sb = new StringBuilder(s.length() + 2);
		sb.append('"');
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '"': sb.append("\\\""); break;
				case '\\': sb.append("\\\\"); break;
				case '\b': sb.append("\\b"); break;
				case '\f': sb.append("\\f"); break;
				case '\n': sb.append("\\n"); break;
				case '\r': sb.append("\\r"); break;
				case '\t': sb.append("\\t"); break;
				case '\u2028', '\u2029':
					sb.append(String.format("\\u%04x", (int) c));
					break;
				default:
					if (c < 0x20) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
			}
		}
		sb.append('"');
		return sb.toString();
	}
}

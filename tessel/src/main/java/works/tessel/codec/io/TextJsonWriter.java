package works.tessel.codec.io;

import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;
import works.tessel.codec.JsonWriter;
import works.tessel.codec.WriterSettings;

import static java.util.Objects.requireNonNull;

/**
 * A {@link JsonWriter} that emits JSON text to a {@link Writer}.
 * <p>
 * With {@link WriterSettings#DEFAULT default settings}, output is compact.
 * With a nonempty {@link WriterSettings#indent() indent}, every member and element
 * starts on its own line, indented once per level of nesting;
 * empty objects and arrays are still written as <code>{}</code> and <code>[]</code>.
 * No trailing newline is ever written.
 */
public final class TextJsonWriter implements JsonWriter {
	private final Writer out;
	private final WriterSettings settings;
	private final String nameSeparator;

	/**
	 * A member name is held back until its value arrives,
	 * so that a null value can be omitted along with its name.
	 */
	private String deferredName = null;

	private int[] scopes = new int[32];
	private int depth = 0;

	private static final int EMPTY_DOCUMENT = 0;
	private static final int NONEMPTY_DOCUMENT = 1;
	private static final int EMPTY_OBJECT = 2;
	private static final int DANGLING_NAME = 3;
	private static final int NONEMPTY_OBJECT = 4;
	private static final int EMPTY_ARRAY = 5;
	private static final int NONEMPTY_ARRAY = 6;

	public TextJsonWriter(Writer out) {
		this(out, WriterSettings.DEFAULT);
	}

	public TextJsonWriter(Writer out, WriterSettings settings) {
		this.out = requireNonNull(out);
		this.settings = requireNonNull(settings);
		this.nameSeparator = settings.indent().isEmpty() ? ":" : ": ";
		push(EMPTY_DOCUMENT);
	}

	@Override
	public void beginObject() throws IOException {
		writeDeferredName();
		beforeValue();
		push(EMPTY_OBJECT);
		out.write('{');
	}

	@Override
	public void endObject() throws IOException {
		close(EMPTY_OBJECT, NONEMPTY_OBJECT, '}');
	}

	@Override
	public void beginArray() throws IOException {
		writeDeferredName();
		beforeValue();
		push(EMPTY_ARRAY);
		out.write('[');
	}

	@Override
	public void endArray() throws IOException {
		close(EMPTY_ARRAY, NONEMPTY_ARRAY, ']');
	}

	@Override
	public void name(String name) {
		requireNonNull(name);
		if (deferredName != null) {
			throw new IllegalStateException("Name \"" + deferredName + "\" has no value");
		}
		int scope = top();
		if (scope != EMPTY_OBJECT && scope != NONEMPTY_OBJECT) {
			throw new IllegalStateException("Name \"" + name + "\" is not within an object");
		}
		deferredName = name;
	}

	@Override
	public void value(String value) throws IOException {
		if (value == null) {
			nullValue();
			return;
		}
		writeDeferredName();
		beforeValue();
		out.write(Util.stringLiteral(value));
	}

	@Override
	public void value(boolean value) throws IOException {
		writeDeferredName();
		beforeValue();
		out.write(value ? "true" : "false");
	}

	@Override
	public void value(long value) throws IOException {
		writeDeferredName();
		beforeValue();
		out.write(Long.toString(value));
	}

	@Override
	public void value(double value) throws IOException {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			throw new IllegalArgumentException("JSON forbids NaN and infinities: " + value);
		}
		writeDeferredName();
		beforeValue();
		out.write(Double.toString(value));
	}

	@Override
	public void value(Number value) throws IOException {
		if (value == null) {
			nullValue();
			return;
		}
		String text = value.toString();
		if (text.equals("NaN") || text.equals("Infinity") || text.equals("-Infinity")) {
			throw new IllegalArgumentException("JSON forbids NaN and infinities: " + value);
		}
		writeDeferredName();
		beforeValue();
		out.write(text);
	}

	@Override
	public void nullValue() throws IOException {
		if (deferredName != null && !settings.serializeNulls()) {
			deferredName = null;
			return;
		}
		writeDeferredName();
		beforeValue();
		out.write("null");
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	/**
	 * @throws IOException if the document is incomplete
	 */
	@Override
	public void close() throws IOException {
		out.close();
		if (depth > 1 || top() != NONEMPTY_DOCUMENT) {
			throw new IOException("Incomplete document");
		}
	}

	private void writeDeferredName() throws IOException {
		if (deferredName != null) {
			int scope = top();
			if (scope == NONEMPTY_OBJECT) {
				out.write(',');
			}
			newline();
			replaceTop(DANGLING_NAME);
			out.write(Util.stringLiteral(deferredName));
			deferredName = null;
		}
	}

	private void beforeValue() throws IOException {
		switch (top()) {
			case EMPTY_DOCUMENT -> replaceTop(NONEMPTY_DOCUMENT);
			case NONEMPTY_DOCUMENT -> throw new IllegalStateException("JSON must have only one top-level value");
			case EMPTY_ARRAY -> {
				replaceTop(NONEMPTY_ARRAY);
				newline();
			}
			case NONEMPTY_ARRAY -> {
				out.write(',');
				newline();
			}
			case DANGLING_NAME -> {
				out.write(nameSeparator);
				replaceTop(NONEMPTY_OBJECT);
			}
			default -> throw new IllegalStateException("Value within an object must be preceded by a name");
		}
	}

	private void close(int emptyScope, int nonemptyScope, char bracket) throws IOException {
		int scope = top();
		if (scope != emptyScope && scope != nonemptyScope) {
			throw new IllegalStateException("Nesting problem: unexpected '" + bracket + "'");
		}
		if (deferredName != null) {
			throw new IllegalStateException("Name \"" + deferredName + "\" has no value");
		}
		depth--;
		if (scope == nonemptyScope) {
			newline();
		}
		out.write(bracket);
	}

	private void newline() throws IOException {
		if (settings.indent().isEmpty()) {
			return;
		}
		out.write('\n');
		for (int i = 1; i < depth; i++) {
			out.write(settings.indent());
		}
	}

	private int top() {
		return scopes[depth - 1];
	}

	private void push(int scope) {
		if (depth == scopes.length) {
			scopes = Arrays.copyOf(scopes, depth * 2);
		}
		scopes[depth++] = scope;
	}

	private void replaceTop(int scope) {
		scopes[depth - 1] = scope;
	}
}

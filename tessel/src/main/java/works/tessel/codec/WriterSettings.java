package works.tessel.codec;

import static java.util.Objects.requireNonNull;

/**
 * Formatting options for JSON text output.
 *
 * @param indent emitted once per nesting level at the start of each line;
 *               if empty, output is compact and on a single line
 * @param serializeNulls if false, members whose value is null are omitted entirely
 */
public record WriterSettings(String indent, boolean serializeNulls) {
	public WriterSettings {
		requireNonNull(indent);
		if (!indent.isBlank()) {
			throw new IllegalArgumentException("Indent must consist only of whitespace: \"" + indent + "\"");
		}
	}

	public static final WriterSettings DEFAULT = new WriterSettings("", true);
	public static final WriterSettings PRETTY = new WriterSettings("  ", true);

	public WriterSettings withIndent(String indent) {
		return new WriterSettings(indent, serializeNulls);
	}

	public WriterSettings withSerializeNulls(boolean serializeNulls) {
		return new WriterSettings(indent, serializeNulls);
	}
}

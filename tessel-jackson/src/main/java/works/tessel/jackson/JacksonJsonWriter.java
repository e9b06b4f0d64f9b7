package works.tessel.jackson;

import java.math.BigDecimal;
import java.math.BigInteger;
import tools.jackson.core.JsonGenerator;
import works.tessel.codec.JsonWriter;

import static java.util.Objects.requireNonNull;

/**
 * A {@link JsonWriter} backed by a Jackson {@link JsonGenerator}.
 * Formatting is up to the generator.
 */
public final class JacksonJsonWriter implements JsonWriter {
	private final JsonGenerator generator;

	public JacksonJsonWriter(JsonGenerator generator) {
		this.generator = requireNonNull(generator);
	}

	@Override
	public void beginObject() {
		generator.writeStartObject();
	}

	@Override
	public void endObject() {
		generator.writeEndObject();
	}

	@Override
	public void beginArray() {
		generator.writeStartArray();
	}

	@Override
	public void endArray() {
		generator.writeEndArray();
	}

	@Override
	public void name(String name) {
		generator.writeName(name);
	}

	@Override
	public void value(String value) {
		generator.writeString(value);
	}

	@Override
	public void value(boolean value) {
		generator.writeBoolean(value);
	}

	@Override
	public void value(long value) {
		generator.writeNumber(value);
	}

	@Override
	public void value(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			throw new IllegalArgumentException("JSON forbids NaN and infinities: " + value);
		}
		generator.writeNumber(value);
	}

	@Override
	public void value(Number value) {
		if (value == null) {
			generator.writeNull();
		} else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
			generator.writeNumber(value.longValue());
		} else if (value instanceof Float f) {
			generator.writeNumber(f.floatValue());
		} else if (value instanceof Double d) {
			value(d.doubleValue());
		} else if (value instanceof BigDecimal d) {
			generator.writeNumber(d);
		} else if (value instanceof BigInteger i) {
			generator.writeNumber(i);
		} else {
			generator.writeNumber(value.toString());
		}
	}

	@Override
	public void nullValue() {
		generator.writeNull();
	}

	@Override
	public void flush() {
		generator.flush();
	}

	@Override
	public void close() {
		generator.close();
	}
}

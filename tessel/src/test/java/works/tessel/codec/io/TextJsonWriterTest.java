package works.tessel.codec.io;

import java.io.IOException;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.tessel.codec.JsonWriter;
import works.tessel.codec.WriterSettings;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TextJsonWriterTest {
	private final ObjectMapper mapper = JsonMapper.builder().build();

	interface Writes {
		void writeTo(JsonWriter writer) throws IOException;
	}

	static String write(WriterSettings settings, Writes body) throws IOException {
		StringWriter out = new StringWriter();
		try (TextJsonWriter writer = new TextJsonWriter(out, settings)) {
			body.writeTo(writer);
		}
		return out.toString();
	}

	static void sample(JsonWriter w) throws IOException {
		w.beginObject();
		w.name("s");
		w.value("a\"b\\c\n\u2028é");
		w.name("n");
		w.value(42);
		w.name("d");
		w.value(1.5);
		w.name("f");
		w.value((Number) 3.14f);
		w.name("b");
		w.value(true);
		w.name("z");
		w.nullValue();
		w.name("list");
		w.beginArray();
		w.value(1);
		w.beginObject();
		w.endObject();
		w.beginArray();
		w.endArray();
		w.endArray();
		w.endObject();
	}

	@Test
	void compact() throws IOException {
		String actual = write(WriterSettings.DEFAULT, TextJsonWriterTest::sample);
		assertEquals(
			"{\"s\":\"a\\\"b\\\\c\\n\\u2028é\",\"n\":42,\"d\":1.5,\"f\":3.14,\"b\":true,\"z\":null,\"list\":[1,{},[]]}",
			actual);
		JsonNode node = mapper.readTree(actual);
		assertEquals("a\"b\\c\n\u2028é", node.get("s").asString());
	}

	@Test
	void pretty() throws IOException {
		String actual = write(WriterSettings.PRETTY, TextJsonWriterTest::sample);
		assertEquals("""
			{
			  "s": "a\\"b\\\\c\\n\\u2028é",
			  "n": 42,
			  "d": 1.5,
			  "f": 3.14,
			  "b": true,
			  "z": null,
			  "list": [
			    1,
			    {},
			    []
			  ]
			}""", actual);
		assertEquals(mapper.readTree(write(WriterSettings.DEFAULT, TextJsonWriterTest::sample)), mapper.readTree(actual));
	}

	@Test
	void customIndent() throws IOException {
		String actual = write(WriterSettings.DEFAULT.withIndent("\t"), w -> {
			w.beginArray();
			w.value("x");
			w.endArray();
		});
		assertEquals("[\n\t\"x\"\n]", actual);
	}

	@Test
	void omitNulls() throws IOException {
		String actual = write(WriterSettings.DEFAULT.withSerializeNulls(false), w -> {
			w.beginObject();
			w.name("a");
			w.nullValue();
			w.name("b");
			w.value(1);
			w.name("c");
			w.nullValue();
			w.name("d");
			w.beginArray();
			w.nullValue();
			w.endArray();
			w.endObject();
		});
		assertEquals("{\"b\":1,\"d\":[null]}", actual);
	}

	@Test
	void nonFinite_throws() {
		assertThrows(IllegalArgumentException.class, () -> write(WriterSettings.DEFAULT, w -> w.value(Double.NaN)));
		assertThrows(IllegalArgumentException.class, () -> write(WriterSettings.DEFAULT, w -> w.value((Number) Float.POSITIVE_INFINITY)));
	}

	@Test
	void misnested_throws() {
		assertThrows(IllegalStateException.class, () -> write(WriterSettings.DEFAULT, w -> {
			w.beginObject();
			w.value(1);
		}));
		assertThrows(IllegalStateException.class, () -> write(WriterSettings.DEFAULT, w -> {
			w.beginArray();
			w.endObject();
		}));
		assertThrows(IllegalStateException.class, () -> write(WriterSettings.DEFAULT, w -> {
			w.value(1);
			w.value(2);
		}));
	}

	@Test
	void incompleteDocument_throws() {
		assertThrows(IOException.class, () -> write(WriterSettings.DEFAULT, JsonWriter::beginArray));
	}

	@Test
	void blankIndentOnly() {
		assertThrows(IllegalArgumentException.class, () -> WriterSettings.DEFAULT.withIndent("x"));
	}
}

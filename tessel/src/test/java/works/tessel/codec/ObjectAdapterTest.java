package works.tessel.codec;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.tessel.exceptions.JsonContentException;
import works.tessel.exceptions.JsonProcessingException;
import works.tessel.exceptions.MissingPropertiesException;
import works.tessel.mapping.Json;
import works.tessel.mapping.JsonDefaultValue;
import works.tessel.mapping.Nullable;
import works.tessel.mapping.PropertyDescriptor;
import works.tessel.mapping.RecordDescriptor;
import works.tessel.types.TypeDescriptor;
import works.tessel.types.TypeReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ObjectAdapterTest {
	record TestClass(
		String string,
		@Nullable String nullableString,
		int integer,
		@Nullable Integer nullableInt,
		boolean isBoolean,
		@Nullable Boolean isNullableBoolean,
		short aShort,
		@Nullable Short nullableShort,
		byte aByte,
		@Nullable Byte nullableByte,
		char aChar,
		@Nullable Character nullableChar,
		List<String> list,
		List<Map<String, Set<String>>> nestedList,
		String abstractProperty,
		@Json(name = "other_name") String customName,
		@Hello String annotated,
		@Hello String anotherAnnotated,
		GenericClass<String, List<String>> genericClass
	) { }

	record GenericClass<T, C extends Collection<T>>(C collection, T value) { }

	record GenericClassWithQualifier<T>(@Hello T value) { }

	record Simple(String prop) { }

	record CustomNames(String prop1, String prop2) { }

	record WithDefaults(@Nullable String nullable, String withDefault, int number) {
		@JsonDefaultValue("withDefault")
		static String defaultWithDefault() {
			return "default";
		}

		@JsonDefaultValue("number")
		static int defaultNumber() {
			return 3;
		}
	}

	record NullableWithDefault(@Nullable String value) {
		@JsonDefaultValue("value")
		static String defaultValue() {
			return "default";
		}
	}

	record Picky(String value) {
		Picky {
			if (value.isEmpty()) {
				throw new IllegalArgumentException("Empty value");
			}
		}
	}

	/**
	 * Described by hand rather than scanned.
	 */
	static final RecordDescriptor<CustomNames> CUSTOM_NAMES = RecordDescriptor.builder(CustomNames.class)
		.property(PropertyDescriptor.builder("prop1", TypeDescriptor.of(String.class), CustomNames::prop1)
			.jsonKey("jsonProp1"))
		.property(PropertyDescriptor.builder("prop2", TypeDescriptor.of(String.class), CustomNames::prop2)
			.jsonKey("jsonProp2"))
		.instantiator(args -> new CustomNames((String) args[0], (String) args[1]))
		.build();

	final AdapterRegistry registry = AdapterRegistry.builder()
		.add(GeneratedAdapterFactory.builder()
			.useLookup(MethodHandles.lookup())
			.scan(TestClass.class)
			.scan(GenericClass.class)
			.scan(GenericClassWithQualifier.class)
			.scan(Simple.class)
			.scan(WithDefaults.class)
			.scan(NullableWithDefault.class)
			.scan(Picky.class)
			.scan(NestedClasses.class)
			.scan(NestedClasses.Inner.class)
			.add(CUSTOM_NAMES)
			.build())
		.add(String.class, Hello.class, new Hello.Adapter())
		.build();

	final ObjectMapper mapper = JsonMapper.builder().build();

	@Test
	void testBasic() throws IOException {
		String json = """
			{
			  "string": "string",
			  "nullableString": "nullableString",
			  "integer": 4711,
			  "nullableInt": 1337,
			  "isBoolean": true,
			  "isNullableBoolean": false,
			  "aShort": 32767,
			  "nullableShort": -32768,
			  "aByte": 255,
			  "nullableByte": 128,
			  "aChar": "c",
			  "nullableChar": "n",
			  "list": [
			    "String1",
			    "String2"
			  ],
			  "nestedList": [
			    {
			      "key1": [
			        "set1",
			        "set2"
			      ]
			    },
			    {
			      "key2": [
			        "set1",
			        "set2"
			      ],
			      "key3": []
			    }
			  ],
			  "abstractProperty": "abstract",
			  "other_name": "other_value",
			  "annotated": "World!",
			  "anotherAnnotated": "Other World!",
			  "genericClass": {
			    "collection": [
			      "val1",
			      "val2"
			    ],
			    "value": "val3"
			  }
			}""";
		JsonAdapter<TestClass> adapter = registry.adapter(TestClass.class);
		TestClass actual = adapter.fromJson(json);

		TestClass expected = new TestClass(
			"string",
			"nullableString",
			4711,
			1337,
			true,
			false,
			Short.MAX_VALUE,
			Short.MIN_VALUE,
			(byte) -1,
			Byte.MIN_VALUE,
			'c',
			'n',
			List.of("String1", "String2"),
			List.of(
				Map.of("key1", Set.of("set1", "set2")),
				Map.of(
					"key2", Set.of("set1", "set2"),
					"key3", Set.of())),
			"abstract",
			"other_value",
			"Hello, World!",
			"Hello, Other World!",
			new GenericClass<>(List.of("val1", "val2"), "val3"));

		assertEquals(expected, actual);
		assertEquals(json, adapter.toJson(actual, WriterSettings.PRETTY));
	}

	@Test
	void missingProperties() {
		var e = assertThrows(MissingPropertiesException.class, () -> registry.adapter(TestClass.class).fromJson("{}"));
		assertEquals("The following properties were null: " +
			"string, " +
			"integer, " +
			"isBoolean, " +
			"aShort, " +
			"aByte, " +
			"aChar, " +
			"list, " +
			"nestedList, " +
			"abstractProperty, " +
			"customName, " +
			"annotated, " +
			"anotherAnnotated, " +
			"genericClass",
			e.getMessage());
		assertEquals(13, e.propertyNames().size());
	}

	@Test
	void explicitNullOnRequiredProperty_isMissing() {
		var e = assertThrows(MissingPropertiesException.class, () -> registry.adapter(Simple.class).fromJson("{\"prop\":null}"));
		assertEquals(List.of("prop"), e.propertyNames());
	}

	@Test
	void customNames() throws IOException {
		String json = "{\"jsonProp1\":\"value1\",\"jsonProp2\":\"value2\"}";
		JsonAdapter<CustomNames> adapter = registry.adapter(CustomNames.class);
		CustomNames actual = adapter.fromJson(json);
		assertEquals(new CustomNames("value1", "value2"), actual);
		assertEquals(json, adapter.toJson(actual));
	}

	@Test
	void extraFields() throws IOException {
		JsonAdapter<Simple> adapter = registry.adapter(Simple.class);
		Simple actual = adapter.fromJson("{\"prop\":\"value\",\"extra_prop\":\"extra_value\"}");
		assertEquals(new Simple("value"), actual);
		assertEquals("{\"prop\":\"value\"}", adapter.toJson(actual));
	}

	@Test
	void extraFieldsOfAnyShape() throws IOException {
		Simple actual = registry.adapter(Simple.class).fromJson("""
			{
				"before": { "deep": [1, 2.5, {"x": [true, false, null]}], "empty": {} },
				"prop": "value",
				"after": [[], [[]], "s"]
			}
			""");
		assertEquals(new Simple("value"), actual);
	}

	@Test
	void nestedClasses() throws IOException {
		JsonAdapter<NestedClasses> adapter = registry.adapter(NestedClasses.class);
		String json = "{\"inner\":{\"prop\":\"value\"}}";
		NestedClasses actual = adapter.fromJson(json);
		assertEquals(new NestedClasses(new NestedClasses.Inner("value")), actual);
		assertEquals(json, adapter.toJson(actual));
	}

	@Test
	void genericType() throws IOException {
		JsonAdapter<GenericClass<String, List<String>>> adapter = registry.adapterFor(
			TypeDescriptor.of(new TypeReference<GenericClass<String, List<String>>>() { }));
		String json = "{\"collection\":[\"a\"],\"value\":\"b\"}";
		var actual = adapter.fromJson(json);
		assertEquals(new GenericClass<>(List.of("a"), "b"), actual);
		assertEquals(json, adapter.toJson(actual));
	}

	@Test
	void genericTypeWithQualifier() throws IOException {
		JsonAdapter<GenericClassWithQualifier<String>> adapter = registry.adapterFor(
			TypeDescriptor.of(new TypeReference<GenericClassWithQualifier<String>>() { }));
		String json = "{\"value\":\"world!\"}";
		var actual = adapter.fromJson(json);
		assertEquals(new GenericClassWithQualifier<>("Hello, world!"), actual);
		assertEquals(json, adapter.toJson(actual));
	}

	@Test
	void testToString() {
		assertEquals("GeneratedJsonAdapter(NestedClasses)", registry.adapter(NestedClasses.class).toString());
		assertEquals("GeneratedJsonAdapter(NestedClasses.Inner)", registry.adapter(NestedClasses.Inner.class).toString());
	}

	@Test
	void defaults() throws IOException {
		JsonAdapter<WithDefaults> adapter = registry.adapter(WithDefaults.class);
		assertEquals(new WithDefaults(null, "default", 3), adapter.fromJson("{}"));
		assertEquals(new WithDefaults(null, "default", 3), adapter.fromJson("{\"withDefault\":null}"));
		assertEquals(new WithDefaults("n", "w", 7), adapter.fromJson("{\"nullable\":\"n\",\"withDefault\":\"w\",\"number\":7}"));
	}

	@Test
	void nullableWithDefault() throws IOException {
		JsonAdapter<NullableWithDefault> adapter = registry.adapter(NullableWithDefault.class);
		assertEquals(new NullableWithDefault("default"), adapter.fromJson("{}"));
		assertEquals(new NullableWithDefault(null), adapter.fromJson("{\"value\":null}"));
	}

	@Test
	void nullsAreWritten() {
		JsonAdapter<WithDefaults> adapter = registry.adapter(WithDefaults.class);
		WithDefaults value = new WithDefaults(null, "w", 1);
		assertEquals("{\"nullable\":null,\"withDefault\":\"w\",\"number\":1}", adapter.toJson(value));
		assertEquals("{\"withDefault\":\"w\",\"number\":1}",
			adapter.toJson(value, WriterSettings.DEFAULT.withSerializeNulls(false)));
	}

	@Test
	void topLevelNull() throws IOException {
		JsonAdapter<Simple> adapter = registry.adapter(Simple.class);
		assertNull(adapter.fromJson("null"));
		assertEquals("null", adapter.toJson(null));
	}

	@Test
	void wrongShape_throws() {
		var e = assertThrows(JsonContentException.class, () -> registry.adapter(Simple.class).fromJson("[]"));
		assertEquals("Expected BEGIN_OBJECT but was BEGIN_ARRAY", e.getMessage());
	}

	@Test
	void constructorThrows_wrapped() {
		var e = assertThrows(JsonProcessingException.class, () -> registry.adapter(Picky.class).fromJson("{\"value\":\"\"}"));
		assertEquals(IllegalArgumentException.class, e.getCause().getClass());
	}

	@Test
	void outputIsValidJson() throws IOException {
		JsonAdapter<NestedClasses> adapter = registry.adapter(NestedClasses.class);
		String json = adapter.toJson(new NestedClasses(new NestedClasses.Inner("quote\" and \\ backslash")));
		assertEquals("quote\" and \\ backslash", mapper.readTree(json).get("inner").get("prop").asString());
	}
}

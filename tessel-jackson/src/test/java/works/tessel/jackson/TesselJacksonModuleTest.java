package works.tessel.jackson;

import java.lang.invoke.MethodHandles;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.tessel.codec.AdapterRegistry;
import works.tessel.codec.GeneratedAdapterFactory;
import works.tessel.exceptions.MissingPropertiesException;
import works.tessel.mapping.Json;
import works.tessel.mapping.Nullable;
import works.tessel.types.TypeDescriptor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TesselJacksonModuleTest {
	record Point(int x, int y, @Json(name = "label") @Nullable String name) { }

	record Labeled<T>(String label, T value) { }

	/**
	 * Not handled by the module, so Jackson's own record support applies.
	 */
	record Plain(String name) { }

	final AdapterRegistry registry = AdapterRegistry.builder()
		.add(GeneratedAdapterFactory.builder()
			.useLookup(MethodHandles.lookup())
			.scan(Point.class)
			.scan(Labeled.class)
			.build())
		.build();

	final ObjectMapper mapper = JsonMapper.builder()
		.addModule(TesselJacksonModule.of(registry, Point.class, Labeled.class))
		.build();

	@Test
	void roundTrip() {
		Point point = new Point(1, 2, "origin-ish");
		String json = mapper.writeValueAsString(point);
		assertEquals("{\"x\":1,\"y\":2,\"label\":\"origin-ish\"}", json);
		assertEquals(point, mapper.readValue(json, Point.class));
	}

	@Test
	void nestedInJacksonContainers() {
		Map<String, Point> points = mapper.readValue(
			"{\"a\":{\"x\":1,\"y\":2},\"b\":null}",
			new TypeReference<Map<String, Point>>() { });
		assertEquals(new Point(1, 2, null), points.get("a"));
		assertTrue(points.containsKey("b"));

		List<Point> list = mapper.readValue("[{\"x\":3,\"y\":4,\"label\":\"p\"}]", new TypeReference<List<Point>>() { });
		assertEquals(List.of(new Point(3, 4, "p")), list);
	}

	@Test
	void genericType() {
		TypeReference<Labeled<List<String>>> type = new TypeReference<>() { };
		Labeled<List<String>> value = new Labeled<>("letters", List.of("a", "b"));
		String json = mapper.writerFor(type).writeValueAsString(value);
		assertEquals("{\"label\":\"letters\",\"value\":[\"a\",\"b\"]}", json);
		assertEquals(value, mapper.readValue(json, type));
	}

	@Test
	void otherTypesLeftToJackson() {
		assertEquals("{\"name\":\"n\"}", mapper.writeValueAsString(new Plain("n")));
		assertEquals(new Plain("n"), mapper.readValue("{\"name\":\"n\"}", Plain.class));
	}

	@Test
	void missingProperties() {
		RuntimeException e = assertThrows(RuntimeException.class, () -> mapper.readValue("{\"x\":1}", Point.class));
		Throwable cause = e;
		while (cause != null && !(cause instanceof MissingPropertiesException)) {
			cause = cause.getCause();
		}
		assertTrue(cause instanceof MissingPropertiesException, "Expected MissingPropertiesException: " + e);
		assertEquals(List.of("y"), ((MissingPropertiesException) cause).propertyNames());
	}

	@Test
	void descriptorFor() {
		assertEquals(
			TypeDescriptor.of(new works.tessel.types.TypeReference<Labeled<Map<String, Integer>>>() { }),
			TesselJacksonModule.descriptorFor(mapper.getTypeFactory().constructType(new TypeReference<Labeled<Map<String, Integer>>>() { })));
	}
}

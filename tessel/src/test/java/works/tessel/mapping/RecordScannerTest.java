package works.tessel.mapping;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.lang.invoke.MethodHandles;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.tessel.exceptions.JsonProcessingException;
import works.tessel.types.QualifierDeclaration;
import works.tessel.types.TypeDescriptor;
import works.tessel.types.TypeReference;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecordScannerTest {
	RecordScanner scanner;

	@Retention(RUNTIME) @Target(RECORD_COMPONENT) @JsonQualifier
	@interface Trimmed { }

	@Retention(RUNTIME) @Target(RECORD_COMPONENT)
	@interface NotAQualifier { }

	record Example(
		String plain,
		@Json(name = "renamed") String custom,
		@Nullable String optional,
		@Nullable int primitive,
		@Trimmed @NotAQualifier String qualified,
		List<String> list
	) {
		@JsonDefaultValue("custom")
		static String defaultCustom() {
			return "fallback";
		}
	}

	record Pair<A, B>(A first, B second, Map<String, A> byName) { }

	record Outer(Inner inner) {
		record Inner(String value) { }
	}

	record BadDefault(String value) {
		@JsonDefaultValue("nonexistent")
		static String defaultNonexistent() {
			return "";
		}
	}

	record NonStaticDefault(String value) {
		@JsonDefaultValue("value")
		String defaultValue() {
			return "";
		}
	}

	record DuplicateKeys(String a, @Json(name = "a") String b) { }

	record Throwing(String value) {
		@Override
		public String value() {
			throw new IllegalStateException("nope");
		}
	}

	@BeforeEach
	void setup() {
		scanner = new RecordScanner().useLookup(MethodHandles.lookup());
	}

	@Test
	void properties() {
		RecordDescriptor<Example> descriptor = scanner.scan(Example.class);
		assertEquals("RecordScannerTest.Example", descriptor.qualifiedName());
		List<PropertyDescriptor> properties = descriptor.properties();
		assertEquals(List.of("plain", "custom", "optional", "primitive", "qualified", "list"),
			properties.stream().map(PropertyDescriptor::name).toList());
		assertEquals(List.of("plain", "renamed", "optional", "primitive", "qualified", "list"),
			properties.stream().map(PropertyDescriptor::jsonKey).toList());

		PropertyDescriptor plain = properties.get(0);
		assertTrue(plain.isRequired());
		assertFalse(plain.hasDefault());

		PropertyDescriptor custom = properties.get(1);
		assertFalse(custom.isRequired());
		assertEquals("fallback", custom.defaultValue().get());

		PropertyDescriptor optional = properties.get(2);
		assertTrue(optional.nullable());
		assertFalse(optional.isRequired());

		// Primitives can't be null
		assertFalse(properties.get(3).nullable());
		assertTrue(properties.get(3).isRequired());

		assertEquals(TypeDescriptor.of(String.class).withQualifiers(Set.of(QualifierDeclaration.of(Trimmed.class).marker())),
			properties.get(4).type());
		assertEquals(TypeDescriptor.of(new TypeReference<List<String>>() { }), properties.get(5).type());
	}

	@Test
	void accessorsAndInstantiator() {
		RecordDescriptor<Example> descriptor = scanner.scan(Example.class);
		Example example = new Example("p", "c", null, 7, "q", List.of("x"));
		assertEquals(List.of("p", "c", 7, "q", List.of("x")),
			descriptor.properties().stream()
				.map(p -> p.read(example))
				.filter(v -> v != null)
				.toList());
		assertEquals(example, descriptor.instantiate(new Object[]{"p", "c", null, 7, "q", List.of("x")}));
	}

	@Test
	void genericInstantiation() {
		TypeDescriptor instantiation = TypeDescriptor.of(new TypeReference<Pair<String, Integer>>() { });
		RecordDescriptor<?> descriptor = scanner.scan(Pair.class, instantiation);
		assertEquals(List.of(
			TypeDescriptor.of(String.class),
			TypeDescriptor.of(Integer.class),
			TypeDescriptor.of(new TypeReference<Map<String, String>>() { })),
			descriptor.properties().stream().map(PropertyDescriptor::type).toList());
	}

	@Test
	void wrongNumberOfTypeArguments() {
		assertThrows(IllegalArgumentException.class, () -> scanner.scan(Pair.class));
	}

	@Test
	void nestedNames() {
		assertEquals("RecordScannerTest.Outer.Inner", scanner.scan(Outer.Inner.class).qualifiedName());
	}

	@Test
	void defaultForNonexistentComponent() {
		var e = assertThrows(IllegalStateException.class, () -> scanner.scan(BadDefault.class));
		assertEquals("Default values supplied for nonexistent components of BadDefault: [nonexistent]", e.getMessage());
	}

	@Test
	void nonStaticDefault() {
		assertThrows(IllegalStateException.class, () -> scanner.scan(NonStaticDefault.class));
	}

	@Test
	void duplicateJsonKeys() {
		assertThrows(IllegalArgumentException.class, () -> scanner.scan(DuplicateKeys.class));
	}

	@Test
	void accessorExceptions_wrapped() {
		PropertyDescriptor value = scanner.scan(Throwing.class).properties().get(0);
		var e = assertThrows(JsonProcessingException.class, () -> value.read(new Throwing("x")));
		assertEquals(IllegalStateException.class, e.getCause().getClass());
	}

	@Test
	void isQualifier() {
		var annotations = Example.class.getRecordComponents()[4].getAnnotations();
		assertEquals(2, annotations.length);
		assertEquals(1, List.of(annotations).stream().filter(RecordScanner::isQualifier).count());
	}
}

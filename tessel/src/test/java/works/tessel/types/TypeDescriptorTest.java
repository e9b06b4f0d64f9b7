package works.tessel.types;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TypeDescriptorTest {

	@Retention(RUNTIME)
	@Target(RECORD_COMPONENT)
	@interface Loud { }

	@Retention(RUNTIME)
	@Target(RECORD_COMPONENT)
	@interface Quiet { }

	record Annotated(@Loud String loud, @Loud @Quiet String both) { }

	record Box<T>(T value, List<T> values) { }

	@Test
	void classLiteral() {
		TypeDescriptor actual = TypeDescriptor.of(String.class);
		assertEquals(String.class, actual.rawClass());
		assertEquals(List.of(), actual.typeArguments());
		assertEquals(Set.of(), actual.qualifiers());
		assertFalse(actual.isQualified());
	}

	@Test
	void typeReference() {
		TypeDescriptor actual = TypeDescriptor.of(new TypeReference<Map<String, List<Integer>>>() { });
		TypeDescriptor expected = new TypeDescriptor(Map.class,
			TypeDescriptor.of(String.class),
			new TypeDescriptor(List.class, TypeDescriptor.of(Integer.class)));
		assertEquals(expected, actual);
		assertEquals(expected.hashCode(), actual.hashCode());
		assertEquals("Map<String,List<Integer>>", actual.toString());
	}

	@Test
	void wildcardsUseTheirBound() {
		assertEquals(
			TypeDescriptor.of(new TypeReference<List<Number>>() { }),
			TypeDescriptor.of(new TypeReference<List<? extends Number>>() { }));
		assertEquals(
			TypeDescriptor.of(new TypeReference<List<Integer>>() { }),
			TypeDescriptor.of(new TypeReference<List<? super Integer>>() { }));
	}

	@Test
	void bareTypeVariable() {
		TypeDescriptor actual = TypeDescriptor.of(Box.class.getRecordComponents()[0].getGenericType(),
			Map.of("T", TypeDescriptor.of(String.class)));
		assertEquals(TypeDescriptor.of(String.class), actual);
	}

	@Test
	void genericArray() {
		TypeDescriptor actual = TypeDescriptor.of(new TypeReference<List<String>[]>() { });
		assertEquals(TypeDescriptor.of(List[].class), actual);
		assertTrue(actual.isArray());
		assertTrue(TypeDescriptor.of(int.class).isPrimitive());
	}

	@Test
	void typeVariableBinding() {
		var binding = Map.of("T", TypeDescriptor.of(Integer.class));
		TypeDescriptor values = TypeDescriptor.of(Box.class.getRecordComponents()[1].getGenericType(), binding);
		assertEquals(new TypeDescriptor(List.class, TypeDescriptor.of(Integer.class)), values);
	}

	@Test
	void unboundTypeVariable_throws() {
		assertThrows(IllegalArgumentException.class, () ->
			TypeDescriptor.of(Box.class.getRecordComponents()[0].getGenericType()));
	}

	@Test
	void actualArguments() {
		TypeDescriptor box = new TypeDescriptor(Box.class, TypeDescriptor.of(String.class));
		assertEquals(Map.of("T", TypeDescriptor.of(String.class)), box.actualArguments());
		assertEquals(Map.of(), TypeDescriptor.of(Box.class).actualArguments());
	}

	@Test
	void differentArgumentsAreDifferent() {
		assertNotEquals(
			TypeDescriptor.of(new TypeReference<List<String>>() { }),
			TypeDescriptor.of(new TypeReference<List<Integer>>() { }));
		assertNotEquals(
			TypeDescriptor.of(List.class),
			TypeDescriptor.of(new TypeReference<List<String>>() { }));
	}

	@Test
	void qualifiersParticipateInEquality() {
		var components = Annotated.class.getRecordComponents();
		TypeDescriptor plain = TypeDescriptor.of(String.class);
		TypeDescriptor loud = plain.withQualifiers(components[0].getAnnotations());
		TypeDescriptor both = plain.withQualifiers(components[1].getAnnotations());

		assertTrue(loud.isQualified());
		assertNotEquals(plain, loud);
		assertNotEquals(loud, both, "Subset of qualifiers is not a match");
		assertEquals(plain, both.withoutQualifiers());
		assertEquals(loud, plain.withQualifiers(List.of(QualifierMarker.named(Loud.class.getName()))));
	}

	@Test
	void description() {
		var loud = TypeDescriptor.of(String.class)
			.withQualifiers(Annotated.class.getRecordComponents()[0].getAnnotations());
		assertEquals("String", TypeDescriptor.of(String.class).description());
		assertEquals("String annotated [@Loud]", loud.description());
	}
}

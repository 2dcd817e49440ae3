package works.locus.types;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.locus.types.DataType.BOOLEAN;
import static works.locus.types.DataType.BYTE;
import static works.locus.types.DataType.CHAR;
import static works.locus.types.DataType.DOUBLE;
import static works.locus.types.DataType.FLOAT;
import static works.locus.types.DataType.INT;
import static works.locus.types.DataType.LONG;
import static works.locus.types.DataType.SHORT;

class DataTypeCreationTest {

	static Stream<Arguments> classes() {
		return Stream.of(
			Arguments.of(boolean.class, BOOLEAN),
			Arguments.of(byte.class, BYTE),
			Arguments.of(short.class, SHORT),
			Arguments.of(int.class, INT),
			Arguments.of(long.class, LONG),
			Arguments.of(float.class, FLOAT),
			Arguments.of(double.class, DOUBLE),
			Arguments.of(char.class, CHAR),
			Arguments.of(String.class, DataType.STRING),
			Arguments.of(Object.class, DataType.OBJECT),
			Arguments.of(int[].class, new ArrayType(INT)),
			Arguments.of(int[][].class, new ArrayType(new ArrayType(INT))),
			Arguments.of(String[].class, new ArrayType(DataType.STRING)),
			Arguments.of(Optional.class, new ErasedType(Optional.class)),
			Arguments.of(Map[].class, new ArrayType(new ErasedType(Map.class)))
		);
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("classes")
	void fromClass(Class<?> clazz, DataType expected) {
		assertEquals(expected, DataType.of(clazz));
	}

	@Test
	<T> void genericArrays() {
		assertEquals(new ArrayType(new BoundType(List.class, DataType.STRING)), DataType.of(new TypeReference<List<String>[]>() { }));
		assertEquals(new UnknownArrayType(new TypeVariable("T")), DataType.of(new TypeReference<T[]>() { }));
		assertEquals(new UnknownArrayType(new UnknownArrayType(new TypeVariable("T"))), DataType.of(new TypeReference<T[][]>() { }));
	}

	@Test
	<T> void parameterized() {
		var nested = new TypeReference<Map<String, List<Integer>>>() { };
		assertEquals(
			new BoundType(Map.class, DataType.STRING, new BoundType(List.class, DataType.of(Integer.class))),
			DataType.of(nested));

		var withVariable = new TypeReference<List<T>>() { };
		assertEquals(
			new BoundType(List.class, DataType.of(firstTypeArgument(withVariable))),
			DataType.of(withVariable));
	}

	private static Type firstTypeArgument(TypeReference<?> ref) {
		return ((ParameterizedType) ref.reflectionType()).getActualTypeArguments()[0];
	}

	static class Outer<O> {
		class Inner<I> { }
	}

	static class NestedFields {
		Outer<String>.Inner<Long> ofStrings;
		Outer<Integer>.Inner<Long> ofIntegers;
		Map.Entry<String, Long> entry;
	}

	@Test
	void typeNestedInParameterizedType_throws() throws NoSuchFieldException {
		Type ofStrings = NestedFields.class.getDeclaredField("ofStrings").getGenericType();
		Type ofIntegers = NestedFields.class.getDeclaredField("ofIntegers").getGenericType();
		assertThrows(IllegalArgumentException.class, () -> DataType.of(ofStrings));
		assertThrows(IllegalArgumentException.class, () -> DataType.of(ofIntegers));
		assertThrows(IllegalArgumentException.class, () -> new TypeReference<Outer<String>.Inner<Long>>() { });
	}

	@Test
	void typeNestedInRawType_works() throws NoSuchFieldException {
		Type entry = NestedFields.class.getDeclaredField("entry").getGenericType();
		assertEquals(new BoundType(Map.Entry.class, DataType.STRING, DataType.of(Long.class)), DataType.of(entry));
	}

	@Test
	void typeVariables() {
		class Generic<T extends Number, U extends Comparable<U>> {
		}
		record Holder<V extends Number, W extends Comparable<W>>(
			Generic<V, W> generic
		) { }
		ParameterizedType genericType = (ParameterizedType) Holder.class.getRecordComponents()[0].getGenericType();
		var actual = (BoundType)DataType.of(genericType);
		assertEquals("V", ((TypeVariable) actual.typeArgument(0)).name());
		assertEquals("W", ((TypeVariable) actual.typeArgument(1)).name());
		assertEquals(Number.class, actual.typeArgument(0).leastUpperBoundClass());
		assertEquals(Comparable.class, actual.typeArgument(1).leastUpperBoundClass());
	}

	@Test
	void wildcards() {
		var unbounded = (BoundType)DataType.of(new TypeReference<List<?>>() { });
		assertEquals(WildcardType.unbounded(), unbounded.typeArgument(0));

		var upperBounded = (BoundType)DataType.of(new TypeReference<List<? extends Number>>() { });
		assertEquals((WildcardType.extends_(Number.class)), upperBounded.typeArgument(0));

		var lowerBounded = (BoundType)DataType.of(new TypeReference<List<? super Integer>>() { });
		assertEquals((WildcardType.super_(Integer.class)), lowerBounded.typeArgument(0));
	}

	@Test
	void toStrings() {
		assertEquals("Map<String,List<Integer>>", DataType.of(new TypeReference<Map<String, List<Integer>>>() { }).toString());
		assertEquals("List<? extends Number>", DataType.of(new TypeReference<List<? extends Number>>() { }).toString());
		assertEquals("int[]", DataType.of(int[].class).toString());
		assertEquals("List", DataType.of(List.class).toString());
	}

	@Test
	void unsupportedType() {
		var bogusType = new java.lang.reflect.Type() { };
		assertThrows(IllegalArgumentException.class, () -> DataType.of(bogusType));
	}

	@Test
	<T> void known_rejectsUnknownTypes() {
		assertThrows(IllegalArgumentException.class, () -> DataType.known(new TypeReference<T[]>() { }));
		assertEquals(DataType.STRING, DataType.known(String.class));
	}

}

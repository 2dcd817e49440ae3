package works.locus.types;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * An immutable descriptor of a fully-specified Java type, including its generic arguments.
 * <p>
 * Implementations are records, so two {@code DataType}s are {@link Object#equals equal}
 * exactly when they denote the same type: {@code List<String>} and {@code List<Integer>}
 * are different descriptors, and both differ from the {@link ErasedType erased} {@code List}.
 * This makes a {@code DataType} suitable as a lookup key wherever
 * {@link Class} would lose information.
 */
public sealed interface DataType permits KnownType, UnknownType {
	PrimitiveType BOOLEAN = new PrimitiveType(boolean.class);
	PrimitiveType BYTE = new PrimitiveType(byte.class);
	PrimitiveType SHORT = new PrimitiveType(short.class);
	PrimitiveType INT = new PrimitiveType(int.class);
	PrimitiveType LONG = new PrimitiveType(long.class);
	PrimitiveType FLOAT = new PrimitiveType(float.class);
	PrimitiveType DOUBLE = new PrimitiveType(double.class);
	PrimitiveType CHAR = new PrimitiveType(char.class);
	BoundType STRING = (BoundType) DataType.of(String.class);
	BoundType OBJECT = (BoundType) DataType.of(Object.class);

	static KnownType known(Type type) {
		if (of(type) instanceof KnownType kt) {
			return kt;
		} else {
			throw new IllegalArgumentException("Type is not a KnownType: " + type);
		}
	}

	static KnownType known(TypeReference<?> ref) {
		return known(ref.reflectionType());
	}

	/**
	 * @throws IllegalArgumentException if {@code type} is nested in a parameterized type,
	 * like {@code Outer<String>.Inner}, or is not a kind of type Java reflection produces
	 */
	static DataType of(Type type) {
		if (type instanceof Class<?> clazz) {
			if (clazz.isArray()) {
				return arrayOf(of(clazz.getComponentType()));
			} else if (clazz.isPrimitive()) {
				return new PrimitiveType(clazz);
			} else if (clazz.getTypeParameters().length == 0) {
				return new BoundType(clazz, List.of());
			} else {
				return new ErasedType(clazz);
			}
		} else if (type instanceof ParameterizedType pt) {
			if (pt.getOwnerType() instanceof ParameterizedType owner) {
				// The owner's arguments are part of the type, and BoundType has nowhere to keep them
				throw new IllegalArgumentException("Unsupported type: " + pt.getTypeName()
					+ " is nested in parameterized type " + owner.getTypeName());
			}
			return new BoundType(
				(Class<?>) pt.getRawType(),
				Stream.of(pt.getActualTypeArguments()).map(DataType::of).toList());
		} else if (type instanceof java.lang.reflect.TypeVariable<?> tv) {
			return new TypeVariable(tv.getName(), Arrays.asList(tv.getBounds()));
		} else if (type instanceof java.lang.reflect.WildcardType w) {
			return ofWildcard(w);
		} else if (type instanceof GenericArrayType t) {
			return arrayOf(of(t.getGenericComponentType()));
		}
		throw new IllegalArgumentException("Unsupported type: " + type);
	}

	static DataType of(TypeReference<?> ref) {
		return ref.dataType();
	}

	private static DataType arrayOf(DataType elementType) {
		if (elementType instanceof KnownType kt) {
			return new ArrayType(kt);
		} else {
			return new UnknownArrayType((UnknownType) elementType);
		}
	}

	private static DataType ofWildcard(java.lang.reflect.WildcardType wildcardType) {
		assert wildcardType.getLowerBounds().length <= 1 && wildcardType.getUpperBounds().length <= 1;
		if (wildcardType.getLowerBounds().length == 1) {
			return new LowerBoundedWildcardType(DataType.of(wildcardType.getLowerBounds()[0]));
		} else if (wildcardType.getUpperBounds()[0].equals(Object.class)) {
			return new UnboundedWildcardType();
		} else {
			return new UpperBoundedWildcardType(DataType.of(wildcardType.getUpperBounds()[0]));
		}
	}

	/**
	 * {@code A.isAssignableFrom(B)} if a value of type B can be assigned to
	 * a variable of type A. This extends {@link Class#isAssignableFrom} to
	 * generics: type arguments must match exactly unless the target uses a wildcard.
	 * Like {@link Class#isAssignableFrom}, it returns {@code false}
	 * for boxing and unboxing conversions.
	 * <p>
	 * {@code other} is expected to be {@link #isClosed() closed}:
	 * the types of registered services are always closed,
	 * so there's no need to reason about wildcards on both sides.
	 */
	boolean isAssignableFrom(DataType other);

	default boolean isAssignableFrom(Type type) {
		return isAssignableFrom(DataType.of(type));
	}

	default boolean isAssignableFrom(TypeReference<?> ref) {
		return isAssignableFrom(ref.dataType());
	}

	/**
	 * Whether this type, when used as a type argument, admits {@code argument}.
	 * For concrete types, that means equality; wildcards and type variables
	 * admit anything within their bounds.
	 */
	default boolean contains(DataType argument) {
		return this.equals(argument);
	}

	/**
	 * @return this type with each {@link TypeVariable} named in {@code actualArguments}
	 * replaced by its corresponding type
	 */
	DataType substitute(Map<String, DataType> actualArguments);

	/**
	 * @return The most specific common supertype of all possible types
	 * represented by this DataType.
	 */
	Class<?> leastUpperBoundClass();

	/**
	 * @return true if this type mentions no wildcard or type variable anywhere.
	 * An {@link ErasedType} counts as closed: it is a raw type, not a wildcard.
	 */
	boolean isClosed();
}

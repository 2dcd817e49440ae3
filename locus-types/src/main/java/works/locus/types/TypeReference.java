package works.locus.types;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import works.locus.types.exceptions.MissingTypeParameterException;

/**
 * Captures a generic type that erasure would otherwise lose.
 * Always instantiate this as an anonymous subclass:
 *
 * <pre>{@code
 * DataType listOfStrings = new TypeReference<List<String>>() { }.dataType();
 * }</pre>
 *
 * The anonymous class's superclass is the parameterized {@code TypeReference<List<String>>},
 * and that survives compilation in the class file, so it can be read back here.
 * <p>
 * The type is captured once, during construction.
 * A subclass that doesn't supply a concrete type argument fails right there
 * with a {@link MissingTypeParameterException}, and so does any class that
 * extends {@code TypeReference} indirectly.
 */
@SuppressWarnings("unused") // The type parameter is used only via reflection
public abstract class TypeReference<T> {
	private final Type reflectionType;
	private final DataType dataType;

	protected TypeReference() {
		Type superclass = getClass().getGenericSuperclass();
		// Only a direct subclass of TypeReference says what T is
		if (superclass instanceof ParameterizedType pt && pt.getRawType() == TypeReference.class) {
			Type argument = pt.getActualTypeArguments()[0];
			if (argument instanceof java.lang.reflect.TypeVariable<?>) {
				throw new MissingTypeParameterException(argument,
					"Type parameter is not bound to a concrete type. Found: " + argument.getTypeName());
			}
			this.reflectionType = argument;
		} else {
			throw new MissingTypeParameterException(superclass,
				"Missing type parameter. Found: " + superclass);
		}
		this.dataType = DataType.of(reflectionType);
	}

	public final Type reflectionType() {
		return reflectionType;
	}

	public final DataType dataType() {
		return dataType;
	}

	@Override
	public final boolean equals(Object obj) {
		return obj instanceof TypeReference<?> other && this.dataType.equals(other.dataType);
	}

	@Override
	public final int hashCode() {
		return dataType.hashCode();
	}

	@Override
	public String toString() {
		return "TypeReference<" + dataType + ">";
	}
}

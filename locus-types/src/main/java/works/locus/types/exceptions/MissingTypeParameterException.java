package works.locus.types.exceptions;

import java.lang.reflect.Type;

/**
 * A concrete type argument was needed but none could be recovered,
 * typically because a {@link works.locus.types.TypeReference} was
 * instantiated without supplying one.
 */
public class MissingTypeParameterException extends IllegalStateException {
	private final Type foundType;

	public MissingTypeParameterException(Type foundType, String message) {
		super(message);
		this.foundType = foundType;
	}

	/**
	 * @return the type that was found where a parameterized type was expected
	 */
	public Type foundType() {
		return foundType;
	}
}

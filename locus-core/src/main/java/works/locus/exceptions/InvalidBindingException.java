package works.locus.exceptions;

import works.locus.types.DataType;

/**
 * A service can't be registered under the given type.
 */
public class InvalidBindingException extends IllegalArgumentException {
	private final DataType boundType;

	public InvalidBindingException(DataType boundType, String message) {
		super(fullMessage(boundType, message));
		this.boundType = boundType;
	}

	public DataType boundType() {
		return boundType;
	}

	private static String fullMessage(DataType boundType, String message) {
		return "Invalid binding for " + boundType + ": " + message;
	}
}

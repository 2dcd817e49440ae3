package works.locus.exceptions;

import works.locus.types.DataType;

/**
 * The registry could not produce exactly one service for the requested type.
 */
public sealed abstract class ServiceResolutionException extends RuntimeException permits AmbiguousServiceException, UnresolvedServiceException {
	private final DataType requestedType;

	protected ServiceResolutionException(DataType requestedType, String message) {
		super(message);
		this.requestedType = requestedType;
	}

	/**
	 * @return the type exactly as it was requested
	 */
	public DataType requestedType() {
		return requestedType;
	}
}

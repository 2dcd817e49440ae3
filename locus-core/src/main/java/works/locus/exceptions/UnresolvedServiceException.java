package works.locus.exceptions;

import works.locus.types.DataType;

public final class UnresolvedServiceException extends ServiceResolutionException {
	public UnresolvedServiceException(DataType requestedType) {
		super(requestedType, "No service registered for " + requestedType);
	}

	public UnresolvedServiceException(DataType requestedType, String message) {
		super(requestedType, message);
	}
}

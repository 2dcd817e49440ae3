package works.locus.exceptions;

import java.util.List;
import works.locus.types.DataType;

public final class AmbiguousServiceException extends ServiceResolutionException {
	private final List<DataType> candidates;

	public AmbiguousServiceException(DataType requestedType, List<? extends DataType> candidates) {
		super(requestedType, "Multiple services match " + requestedType + ": " + candidates);
		this.candidates = List.copyOf(candidates);
	}

	/**
	 * @return the registered types that matched the request
	 */
	public List<DataType> candidates() {
		return candidates;
	}
}

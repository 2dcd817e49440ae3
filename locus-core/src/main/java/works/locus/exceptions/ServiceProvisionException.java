package works.locus.exceptions;

import works.locus.types.DataType;

/**
 * A registered factory didn't produce a usable service.
 */
public class ServiceProvisionException extends IllegalStateException {
	private final DataType boundType;

	public ServiceProvisionException(DataType boundType, String message) {
		super(message);
		this.boundType = boundType;
	}

	public DataType boundType() {
		return boundType;
	}
}

package works.locus.logging;

public final class MdcKeys {
	public static final String LOCATOR_NAME        = "locus.name";
	public static final String LOCATOR_INSTANCE_ID = "locus.instanceID";
	/**
	 * The {@link works.locus.types.DataType#toString() rendered} type being resolved.
	 * Nested resolutions replace it until they finish.
	 */
	public static final String REQUESTED_TYPE      = "locus.requestedType";

	private MdcKeys() {}
}

package works.locus.logging;

import org.slf4j.MDC;
import works.locus.types.DataType;

import static works.locus.logging.MdcKeys.LOCATOR_INSTANCE_ID;
import static works.locus.logging.MdcKeys.LOCATOR_NAME;
import static works.locus.logging.MdcKeys.REQUESTED_TYPE;

/**
 * Tags log messages with the locator they were emitted on behalf of,
 * and the type it was resolving at the time.
 * Resolutions nest (a factory may resolve its own dependencies, possibly from another locator),
 * so each scope restores whatever was there before it.
 */
public final class MappedDiagnosticContext {

	private MappedDiagnosticContext() {}

	/**
	 * @return a scope that must be closed, typically by try-with-resources
	 */
	public static MDCScope setupMDC(String locatorName, String instanceID, DataType requestedType) {
		MDCScope result = new MDCScope();
		MDC.put(LOCATOR_NAME, locatorName);
		MDC.put(LOCATOR_INSTANCE_ID, instanceID);
		MDC.put(REQUESTED_TYPE, requestedType.toString());
		return result;
	}

	/**
	 * An {@link AutoCloseable} that restores the previous locator MDC values when closed.
	 */
	public static final class MDCScope implements AutoCloseable {
		private final String oldName = MDC.get(LOCATOR_NAME);
		private final String oldInstanceID = MDC.get(LOCATOR_INSTANCE_ID);
		private final String oldRequestedType = MDC.get(REQUESTED_TYPE);

		MDCScope() { }

		@Override
		public void close() {
			restore(LOCATOR_NAME, oldName);
			restore(LOCATOR_INSTANCE_ID, oldInstanceID);
			restore(REQUESTED_TYPE, oldRequestedType);
		}

		private static void restore(String key, String oldValue) {
			if (oldValue == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, oldValue);
			}
		}
	}
}

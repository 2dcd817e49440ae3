package works.locus.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import works.locus.Locator;
import works.locus.logging.MdcKeys;
import works.locus.types.DataType;
import works.locus.types.TypeReference;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static java.util.Objects.requireNonNull;
import static works.locus.logging.MdcKeys.LOCATOR_INSTANCE_ID;
import static works.locus.logging.MdcKeys.REQUESTED_TYPE;

/**
 * A Logback {@link TurboFilter} that quiets individual {@link Locator}s,
 * either entirely or only while they resolve particular types.
 * Handy in tests that provoke failures on purpose.
 * <p>
 * Install the filter in the Logback configuration
 * (or with {@link LoggerContext#addTurboFilter}), then take control of a locator:
 *
 * <pre>{@code
 * try (var logs = LocatorLogFilter.control(locator)) {
 *     logs.minimumLevel(Level.ERROR)
 *         .minimumLevel(PaymentGateway.class, Level.OFF);
 *     ...
 * }
 * }</pre>
 *
 * Messages are attributed using the {@link MdcKeys MDC} that {@link Locator} sets during each resolution,
 * so a controller covers everything logged while its locator resolves a service,
 * from any logger, including the locator's factories.
 * Only the innermost resolution counts: when a factory for {@code A} resolves {@code B},
 * messages logged while {@code B} is being resolved are subject to the rules for {@code B}.
 * <p>
 * A controller can only drop messages.
 * Anything Logback's own levels would discard stays discarded.
 */
public class LocatorLogFilter extends TurboFilter {
	private static final Map<String, LogController> CONTROLLERS = new ConcurrentHashMap<>();

	/**
	 * @return a controller for {@code locator}'s messages, which has no effect until given a level;
	 * close it to release the locator
	 * @throws IllegalStateException if {@code locator} already has an open controller
	 */
	public static LogController control(Locator locator) {
		LogController controller = new LogController(locator);
		if (CONTROLLERS.putIfAbsent(locator.instanceID(), controller) != null) {
			throw new IllegalStateException("Log controller already exists for " + locator);
		}
		LOGGER.debug("Controlling logs for {}", locator);
		return controller;
	}

	@Override
	public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
		String instanceID = MDC.get(LOCATOR_INSTANCE_ID);
		if (instanceID == null || level == null) {
			return NEUTRAL;
		}
		LogController controller = CONTROLLERS.get(instanceID);
		if (controller == null) {
			return NEUTRAL;
		}
		Level minimum = controller.minimumLevelFor(MDC.get(REQUESTED_TYPE));
		if (minimum == null || level.isGreaterOrEqual(minimum)) {
			return NEUTRAL;
		}
		return DENY;
	}

	/**
	 * Per-locator rules. A rule for the type being resolved takes precedence over the locator-wide level.
	 * Types are matched by their {@link DataType#toString() rendered} form, as it appears in the MDC.
	 */
	public static final class LogController implements AutoCloseable {
		private final Locator locator;
		private final Map<String, Level> minimumByType = new ConcurrentHashMap<>();
		private volatile Level minimum;

		private LogController(Locator locator) {
			this.locator = locator;
		}

		/**
		 * Drops this locator's messages below {@code level}.
		 * {@link Level#OFF} drops them all.
		 */
		public LogController minimumLevel(Level level) {
			this.minimum = requireNonNull(level);
			return this;
		}

		/**
		 * Drops messages below {@code level} logged while this locator resolves {@code type}.
		 */
		public LogController minimumLevel(DataType type, Level level) {
			minimumByType.put(type.toString(), requireNonNull(level));
			return this;
		}

		public LogController minimumLevel(Class<?> type, Level level) {
			return minimumLevel(DataType.of(type), level);
		}

		public LogController minimumLevel(TypeReference<?> type, Level level) {
			return minimumLevel(type.dataType(), level);
		}

		Level minimumLevelFor(String requestedType) {
			Level result = (requestedType == null) ? null : minimumByType.get(requestedType);
			return (result == null) ? minimum : result;
		}

		@Override
		public void close() {
			if (CONTROLLERS.remove(locator.instanceID(), this)) {
				LOGGER.debug("Released logs for {}", locator);
			}
		}
	}

	private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LocatorLogFilter.class);
}

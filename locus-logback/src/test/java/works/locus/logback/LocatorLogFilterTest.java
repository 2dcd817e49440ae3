package works.locus.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import works.locus.Locator;
import works.locus.logback.LocatorLogFilter.LogController;
import works.locus.types.TypeReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LocatorLogFilterTest {
	static final String FACTORY_LOGGER = LocatorLogFilterTest.class.getName() + ".factory";

	LoggerContext loggerContext;
	LocatorLogFilter filter;
	ListAppender<ILoggingEvent> appender;
	Logger factoryLogger;
	Locator quiet;
	Locator noisy;
	final List<LogController> controllers = new ArrayList<>();

	@BeforeEach
	void setupLogging() {
		loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
		filter = new LocatorLogFilter();
		filter.setContext(loggerContext);
		filter.start();
		loggerContext.addTurboFilter(filter);

		appender = new ListAppender<>();
		appender.setContext(loggerContext);
		appender.start();
		factoryLogger = loggerContext.getLogger(FACTORY_LOGGER);
		factoryLogger.addAppender(appender);

		quiet = loggingLocator("quiet");
		noisy = loggingLocator("noisy");
	}

	@AfterEach
	void teardownLogging() {
		controllers.forEach(LogController::close);
		factoryLogger.detachAppender(appender);
		loggerContext.getTurboFilterList().remove(filter);
	}

	@Test
	void locatorWideMinimum_dropsLowerLevels() {
		control(quiet).minimumLevel(Level.ERROR);
		quiet.resolve(Service.class);
		assertEquals(List.of("error: quiet Service"), messages());
	}

	@Test
	void typeMinimum_appliesOnlyWhileResolvingThatType() {
		control(quiet).minimumLevel(Service.class, Level.ERROR);
		quiet.resolve(Client.class);
		assertEquals(List.of("error: quiet Service", "warning: quiet Client"), messages(),
			"Client's own warning comes after its nested resolution of Service has finished");
	}

	@Test
	void typeMinimum_takesPrecedenceOverLocatorWide() {
		control(quiet)
			.minimumLevel(Level.OFF)
			.minimumLevel(new TypeReference<Service>() { }, Level.WARN);
		quiet.resolve(Client.class);
		assertEquals(List.of("warning: quiet Service", "error: quiet Service"), messages());
	}

	@Test
	void controller_cannotEnableMessages() {
		control(quiet).minimumLevel(Level.TRACE);
		quiet.resolve(Service.class);
		assertEquals(List.of("warning: quiet Service", "error: quiet Service"), messages(),
			"Debug messages are still dropped by the root level");
	}

	@Test
	void controllerWithoutLevels_hasNoEffect() {
		control(quiet);
		quiet.resolve(Service.class);
		assertEquals(List.of("warning: quiet Service", "error: quiet Service"), messages());
	}

	@Test
	void otherLocators_unaffected() {
		control(quiet).minimumLevel(Level.OFF);
		noisy.resolve(Service.class);
		assertEquals(List.of("warning: noisy Service", "error: noisy Service"), messages());
	}

	@Test
	void outsideResolution_unaffected() {
		control(quiet).minimumLevel(Level.OFF);
		factoryLogger.warn("no locator");
		assertEquals(List.of("no locator"), messages());
	}

	@Test
	void close_releasesLocator() {
		try (LogController controller = LocatorLogFilter.control(quiet)) {
			controller.minimumLevel(Level.OFF);
			quiet.resolve(Service.class);
		}
		quiet.resolve(Service.class);
		assertEquals(List.of("warning: quiet Service", "error: quiet Service"), messages());
		control(quiet);
	}

	@Test
	void secondController_throws() {
		control(quiet);
		assertThrows(IllegalStateException.class, () -> LocatorLogFilter.control(quiet));
	}

	private LogController control(Locator locator) {
		LogController result = LocatorLogFilter.control(locator);
		controllers.add(result);
		return result;
	}

	private List<String> messages() {
		return appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
	}

	private static Locator loggingLocator(String name) {
		org.slf4j.Logger logger = LoggerFactory.getLogger(FACTORY_LOGGER);
		return Locator.builder(name)
			.bindFactory(Service.class, l -> {
				logger.debug("debug: {} Service", name);
				logger.warn("warning: {} Service", name);
				logger.error("error: {} Service", name);
				return new Service();
			})
			.bindFactory(Client.class, l -> {
				Service service = l.resolve(Service.class);
				logger.warn("warning: {} Client", name);
				return new Client(service);
			})
			.build();
	}

	static final class Service { }

	record Client(Service service) { }
}

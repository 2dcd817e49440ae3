package works.locus;

import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.locus.exceptions.ServiceResolutionException;
import works.locus.logging.MappedDiagnosticContext;
import works.locus.types.DataType;
import works.locus.types.TypeReference;

import static java.util.Objects.requireNonNull;

/**
 * The standard {@link ServiceLocator}: looks services up in a {@link ServiceRegistry}.
 * <p>
 * Build one per composition root and hand it to whatever needs it:
 *
 * <pre>{@code
 * Locator locator = Locator.builder("orders")
 *     .bind(Clock.class, Clock.systemUTC())
 *     .bind(new TypeReference<List<String>>() { }, List.of("EUR", "USD"))
 *     .bindFactory(OrderService.class, l -> new OrderService(l.resolve(Clock.class)))
 *     .build();
 * }</pre>
 *
 * A locator always resolves {@link ServiceLocator} and {@link Locator} to itself,
 * so factories can depend on "the locator" like any other service.
 */
public final class Locator implements ServiceLocator {
	private final String name;
	private final String instanceID;
	private final ServiceRegistry registry;

	private Locator(String name, ServiceRegistry registry) {
		this.name = name;
		this.instanceID = UUID.randomUUID().toString();
		this.registry = registry;
	}

	/**
	 * @param name identifies this locator in logs
	 * @param registry where services are looked up; its contents are its own business
	 */
	public static Locator over(String name, ServiceRegistry registry) {
		Locator result = new Locator(requireNonNull(name), requireNonNull(registry));
		LOGGER.info("Locator \"{}\" {} using {}", name, result.instanceID, registry);
		return result;
	}

	public static Builder builder(String name) {
		return new Builder(requireNonNull(name));
	}

	public String name() {
		return name;
	}

	/**
	 * Distinguishes locators that happen to share a {@link #name}.
	 */
	public String instanceID() {
		return instanceID;
	}

	public ServiceRegistry registry() {
		return registry;
	}

	@Override
	@SuppressWarnings("unchecked")
	public <T> T resolve(DataType type) {
		if (type == null) {
			throw new IllegalArgumentException("Data type can't be null");
		}
		try (var __ = MappedDiagnosticContext.setupMDC(name, instanceID, type)) {
			if (SELF_TYPES.contains(type)) {
				return (T) this;
			}
			Binding binding;
			try {
				binding = registry.lookup(type);
			} catch (ServiceResolutionException e) {
				LOGGER.debug("Unable to resolve {}: {}", type, e.getMessage());
				throw e;
			}
			LOGGER.debug("Resolved {} using {}", type, binding);
			return (T) binding.provide(this);
		}
	}

	@Override
	public String toString() {
		return "Locator(\"" + name + "\", " + instanceID + ")";
	}

	public static final class Builder {
		private final String name;
		private LocatorSettings settings = LocatorSettings.defaults();
		private MapServiceRegistry registry;

		Builder(String name) {
			this.name = name;
		}

		/**
		 * Must be called before any bindings are added.
		 */
		public Builder settings(LocatorSettings settings) {
			if (registry != null) {
				throw new IllegalStateException("Settings must be supplied before bindings");
			}
			this.settings = requireNonNull(settings);
			return this;
		}

		public <T> Builder bind(Class<T> type, T instance) {
			registry().register(type, instance);
			return this;
		}

		public <T> Builder bind(TypeReference<T> type, T instance) {
			registry().register(type, instance);
			return this;
		}

		public Builder bind(DataType type, Object instance) {
			registry().register(type, instance);
			return this;
		}

		public <T> Builder bindFactory(Class<T> type, Function<? super ServiceLocator, ? extends T> factory) {
			registry().registerFactory(type, factory);
			return this;
		}

		public <T> Builder bindFactory(TypeReference<T> type, Function<? super ServiceLocator, ? extends T> factory) {
			registry().registerFactory(type, factory);
			return this;
		}

		public Locator build() {
			return Locator.over(name, registry());
		}

		private MapServiceRegistry registry() {
			if (registry == null) {
				registry = new MapServiceRegistry(settings);
			}
			return registry;
		}

		@Override
		public String toString() {
			return "Locator.Builder(name=" + this.name + ", settings=" + this.settings + ")";
		}
	}

	private static final Set<DataType> SELF_TYPES = Set.of(
		DataType.of(ServiceLocator.class),
		DataType.of(Locator.class));

	private static final Logger LOGGER = LoggerFactory.getLogger(Locator.class);
}

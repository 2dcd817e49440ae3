package works.locus;

import works.locus.types.KnownType;

/**
 * What a {@link ServiceRegistry} has on file for one type.
 */
public sealed interface Binding permits InstanceBinding, FactoryBinding {
	/**
	 * @return the type under which this binding is registered;
	 * always {@link works.locus.types.DataType#isClosed() closed}
	 */
	KnownType boundType();

	/**
	 * @param locator the locator performing the resolution,
	 *                for factories that need to resolve their own dependencies
	 * @return the service
	 */
	Object provide(ServiceLocator locator);
}

package works.locus;

import java.util.function.Function;
import works.locus.exceptions.ServiceProvisionException;
import works.locus.types.KnownType;

/**
 * Calls {@code factory} on every resolution. Nothing is cached.
 */
public record FactoryBinding(KnownType boundType, Function<? super ServiceLocator, ?> factory) implements Binding {
	@Override
	public Object provide(ServiceLocator locator) {
		Object result = factory.apply(locator);
		if (result == null) {
			throw new ServiceProvisionException(boundType, "Factory for " + boundType + " returned null");
		}
		if (!boundType.rawClass().isInstance(result)) {
			throw new ServiceProvisionException(boundType, "Factory for " + boundType
				+ " returned an instance of " + result.getClass().getName());
		}
		return result;
	}

	@Override
	public String toString() {
		return boundType + " -> factory";
	}
}

package works.locus;

import works.locus.types.KnownType;

/**
 * Always provides the same object.
 */
public record InstanceBinding(KnownType boundType, Object instance) implements Binding {
	@Override
	public Object provide(ServiceLocator locator) {
		return instance;
	}

	@Override
	public String toString() {
		return boundType + " -> " + instance.getClass().getName();
	}
}

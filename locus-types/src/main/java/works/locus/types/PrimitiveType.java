package works.locus.types;

import java.util.Map;

public record PrimitiveType(Class<?> rawClass) implements KnownType {
	public PrimitiveType {
		assert rawClass.isPrimitive();
	}

	/**
	 * Primitives have no subtypes, and boxing doesn't count,
	 * so only the same primitive is assignable.
	 */
	@Override
	public boolean isAssignableFrom(DataType other) {
		return other instanceof PrimitiveType p && rawClass.equals(p.rawClass());
	}

	@Override
	public PrimitiveType substitute(Map<String, DataType> actualArguments) {
		return this;
	}

	@Override
	public boolean isClosed() {
		return true;
	}

	@Override
	public String toString() {
		return rawClass.getSimpleName();
	}
}

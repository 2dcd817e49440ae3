package works.locus.types;

import java.lang.reflect.Type;

/**
 * Wildcards only ever appear as type arguments,
 * where they admit a range of types rather than exactly one.
 */
sealed public interface WildcardType extends UnknownType permits LowerBoundedWildcardType, UnboundedWildcardType, UpperBoundedWildcardType {
	static UnboundedWildcardType unbounded() {
		return new UnboundedWildcardType();
	}

	static UpperBoundedWildcardType extends_(Type upperBound) {
		return new UpperBoundedWildcardType(DataType.of(upperBound));
	}

	static LowerBoundedWildcardType super_(Type lowerBound) {
		return new LowerBoundedWildcardType(DataType.of(lowerBound));
	}

	DataType upperBound();

	@Override
	default Class<?> leastUpperBoundClass() {
		return upperBound().leastUpperBoundClass();
	}

	@Override
	default boolean isAssignableFrom(DataType other) {
		return upperBound().isAssignableFrom(other);
	}
}

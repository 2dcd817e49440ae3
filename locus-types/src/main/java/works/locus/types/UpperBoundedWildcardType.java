package works.locus.types;

import java.util.Map;

public record UpperBoundedWildcardType(DataType upperBound) implements WildcardType {
	@Override
	public boolean contains(DataType argument) {
		return upperBound.isAssignableFrom(argument);
	}

	@Override
	public UpperBoundedWildcardType substitute(Map<String, DataType> actualArguments) {
		return new UpperBoundedWildcardType(upperBound.substitute(actualArguments));
	}

	@Override
	public String toString() {
		return "? extends " + upperBound;
	}
}

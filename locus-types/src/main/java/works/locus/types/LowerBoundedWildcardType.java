package works.locus.types;

import java.util.Map;

public record LowerBoundedWildcardType(DataType lowerBound) implements WildcardType {
	@Override
	public DataType upperBound() {
		return OBJECT;
	}

	@Override
	public boolean contains(DataType argument) {
		return argument.isAssignableFrom(lowerBound);
	}

	@Override
	public LowerBoundedWildcardType substitute(Map<String, DataType> actualArguments) {
		return new LowerBoundedWildcardType(lowerBound.substitute(actualArguments));
	}

	@Override
	public String toString() {
		return "? super " + lowerBound;
	}
}

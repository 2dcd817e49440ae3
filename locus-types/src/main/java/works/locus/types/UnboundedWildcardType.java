package works.locus.types;

import java.util.Map;

public record UnboundedWildcardType() implements WildcardType {
	@Override
	public DataType upperBound() {
		return OBJECT;
	}

	@Override
	public boolean contains(DataType argument) {
		return true;
	}

	@Override
	public UnboundedWildcardType substitute(Map<String, DataType> actualArguments) {
		return this;
	}

	@Override
	public String toString() {
		return "?";
	}
}

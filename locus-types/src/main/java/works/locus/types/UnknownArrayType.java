package works.locus.types;

import java.util.Map;

import static works.locus.types.ArrayType.arrayIsAssignableFrom;

public record UnknownArrayType(UnknownType elementType) implements UnknownType {
	@Override
	public String toString() {
		return "«" + elementType + "»[]";
	}

	@Override
	public boolean isAssignableFrom(DataType other) {
		return arrayIsAssignableFrom(this, elementType, other);
	}

	@Override
	public DataType substitute(Map<String, DataType> actualArguments) {
		var newElementType = elementType.substitute(actualArguments);
		if (newElementType instanceof KnownType k) {
			return new ArrayType(k);
		} else {
			return new UnknownArrayType((UnknownType) newElementType);
		}
	}

	@Override
	public Class<?> leastUpperBoundClass() {
		return Object[].class;
	}
}

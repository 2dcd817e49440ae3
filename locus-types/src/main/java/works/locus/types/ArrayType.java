package works.locus.types;

import java.util.Map;

public record ArrayType(KnownType elementType) implements KnownType {
	@Override
	public Class<?> rawClass() {
		return elementType.rawClass().arrayType();
	}

	@Override
	public boolean isAssignableFrom(DataType other) {
		return arrayIsAssignableFrom(this, elementType, other);
	}

	/**
	 * Reference arrays are covariant; primitive arrays match only themselves.
	 */
	static boolean arrayIsAssignableFrom(DataType arrayType, DataType elementType, DataType other) {
		DataType otherElementType;
		if (other instanceof ArrayType a) {
			otherElementType = a.elementType();
		} else if (other instanceof UnknownArrayType u) {
			otherElementType = u.elementType();
		} else if (other instanceof TypeVariable tv) {
			return tv.bounds().stream().anyMatch(bound -> arrayType.isAssignableFrom(DataType.of(bound)));
		} else if (other instanceof WildcardType w) {
			return arrayType.isAssignableFrom(w.upperBound());
		} else {
			return false;
		}
		if (elementType instanceof PrimitiveType || otherElementType instanceof PrimitiveType) {
			return elementType.equals(otherElementType);
		} else {
			return elementType.isAssignableFrom(otherElementType);
		}
	}

	@Override
	public ArrayType substitute(Map<String, DataType> actualArguments) {
		return new ArrayType(elementType.substitute(actualArguments));
	}

	@Override
	public boolean isClosed() {
		return elementType.isClosed();
	}

	@Override
	public String toString() {
		return elementType + "[]";
	}
}

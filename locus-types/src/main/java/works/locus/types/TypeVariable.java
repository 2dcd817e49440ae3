package works.locus.types;

import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;

/**
 * Note that we don't turn the bounds into {@link DataType}s eagerly,
 * because the bounds on type variables can be self-referential
 * (think {@code T extends Comparable<T>}),
 * and this would lead to infinite recursion.
 * For the same reason, {@link #contains} checks the bounds by erasure only.
 */
public record TypeVariable(String name, List<Type> bounds) implements UnknownType {

	public TypeVariable {
		if (bounds.isEmpty()) {
			throw new IllegalArgumentException("TypeVariable must have at least one bound (Object if unbounded)");
		}
		bounds = List.copyOf(bounds);
	}

	public TypeVariable(String name, Type... bounds) {
		this(name, (bounds.length == 0)? NO_BOUNDS : List.of(bounds));
	}

	public static TypeVariable unbounded(String name) {
		return new TypeVariable(name, NO_BOUNDS);
	}

	/**
	 * Only the variable itself is assignable to a variable:
	 * nothing is known about what it will turn out to be.
	 */
	@Override
	public boolean isAssignableFrom(DataType other) {
		return this.equals(other);
	}

	@Override
	public boolean contains(DataType argument) {
		Class<?> argumentClass = argument.leastUpperBoundClass();
		return bounds.stream()
			.allMatch(bound -> DataType.of(bound).leastUpperBoundClass().isAssignableFrom(argumentClass));
	}

	@Override
	public Class<?> leastUpperBoundClass() {
		if (bounds.size() == 1) {
			return DataType.of(bounds.get(0)).leastUpperBoundClass();
		} else {
			// Intersection types have no single class
			return Object.class;
		}
	}

	@Override
	public DataType substitute(Map<String, DataType> actualArguments) {
		return actualArguments.getOrDefault(name, this);
	}

	@Override
	public String toString() {
		if (NO_BOUNDS.equals(bounds)) {
			return name;
		} else {
			StringBuilder sb = new StringBuilder();
			sb.append(name);
			sb.append(" extends ");
			for (int i = 0; i < bounds.size(); i++) {
				if (i > 0) {
					sb.append(" & ");
				}
				sb.append(bounds.get(i).getTypeName());
			}
			return sb.toString();
		}
	}

	public static final List<Type> NO_BOUNDS = List.of(Object.class);

}

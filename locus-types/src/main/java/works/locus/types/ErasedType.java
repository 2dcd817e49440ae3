package works.locus.types;

import java.util.HashMap;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;

/**
 * A generic class or interface with its type arguments erased,
 * as obtained from a bare {@link Class} object like {@code List.class}.
 * <p>
 * Distinct from every {@link BoundType} of the same class:
 * an erased type can't tell {@code List<String>} from {@code List<Integer>},
 * so it is never <em>equal</em> to either of them,
 * though both are {@link #isAssignableFrom assignable} to it.
 */
public record ErasedType(Class<?> rawClass) implements InstanceType {
	public ErasedType {
		if (rawClass.isPrimitive() || rawClass.isArray() || rawClass.getTypeParameters().length == 0) {
			throw new IllegalArgumentException("Not a generic class or interface: " + rawClass);
		}
	}

	@Override
	public boolean isAssignableFrom(DataType other) {
		if (other instanceof KnownType kt) {
			return rawClass.isAssignableFrom(kt.rawClass());
		} else if (other instanceof TypeVariable tv) {
			return tv.bounds().stream().anyMatch(bound -> this.isAssignableFrom(DataType.of(bound)));
		} else if (other instanceof WildcardType w) {
			return this.isAssignableFrom(w.upperBound());
		} else {
			return rawClass.isAssignableFrom(Object[].class);
		}
	}

	/**
	 * Every parameter of an erased type is as good as an unbounded wildcard.
	 */
	@Override
	public Map<String, DataType> actualArguments() {
		Map<String, DataType> map = new HashMap<>();
		for (var p : rawClass.getTypeParameters()) {
			map.put(p.getName(), new UnboundedWildcardType());
		}
		return unmodifiableMap(map);
	}

	@Override
	public ErasedType substitute(Map<String, DataType> actualArguments) {
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

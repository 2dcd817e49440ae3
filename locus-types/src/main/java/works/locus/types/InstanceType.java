package works.locus.types;

import java.util.Map;

/**
 * Represents a class or interface type.
 */
sealed public interface InstanceType extends KnownType permits BoundType, ErasedType {

	/**
	 * @return the type of the generic parameter of {@code targetClass} used by this type.
	 * For example, if this type inherits (directly or indirectly) {@code List<String>},
	 * then calling {@code parameterType(List.class, 0)} will return {@link DataType#STRING}.
	 * If the parameter is never bound on the way up the hierarchy,
	 * the result is the corresponding {@link TypeVariable}.
	 */
	default DataType parameterType(Class<?> targetClass, int parameterIndex) {
		if (!targetClass.isAssignableFrom(this.rawClass())) {
			throw new IllegalArgumentException("Expected targetClass " + targetClass + " to be assignable from " + this.rawClass());
		}
		if (targetClass.equals(this.rawClass())) {
			if (this instanceof BoundType g) {
				return g.bindings().get(parameterIndex);
			} else {
				return new UnboundedWildcardType();
			}
		}

		// Find an immediate supertype that is a subtype of targetClass.
		InstanceType immediateSuperType = null;
		if (targetClass.isInterface()) {
			for (var i : this.rawClass().getGenericInterfaces()) {
				var candidate = (InstanceType) DataType.of(i);
				if (targetClass.isAssignableFrom(candidate.rawClass())) {
					immediateSuperType = candidate;
					break;
				}
			}
		}
		if (immediateSuperType == null) {
			// Not among the interfaces, so it must be from our superclass
			immediateSuperType = (InstanceType) DataType.of(rawClass().getGenericSuperclass());
		}

		// Suppose class S<X> extends T<Map<String, X>> where class T<V> implements List<V>,
		// and we're calling S<Integer>.parameterType(List.class, 0).
		// Recursing into T<Map<String, X>> yields Map<String, X>,
		// expressed in terms of S's own variables, which S then binds.
		return immediateSuperType
			.parameterType(targetClass, parameterIndex)
			.substitute(actualArguments());
	}

	/**
	 * @return the type arguments of this type, keyed by the name of
	 * the corresponding type parameter of {@link #rawClass()}
	 */
	Map<String, DataType> actualArguments();

	@Override
	InstanceType substitute(Map<String, DataType> actualArguments);
}

package works.locus.types;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;
import static java.util.stream.Collectors.joining;

/**
 * An {@link InstanceType} accompanied by generic type information.
 * Not to be confused with a <em>bounded type</em>;
 * this is about <em>bindings</em>, not <em>bounds</em>.
 * <p>
 * For ordinary classes, {@code bindings} will be empty,
 * indicating that the class has no type parameters.
 */
public record BoundType(Class<?> rawClass, List<? extends DataType> bindings) implements InstanceType {

	public BoundType {
		bindings = List.copyOf(bindings);
		if (rawClass.getTypeParameters().length != bindings.size()) {
			throw new IllegalArgumentException("Class " + rawClass.getSimpleName()
				+ " has " + rawClass.getTypeParameters().length
				+ " type parameters; got " + bindings.size() + " bindings");
		}
	}

	public BoundType(Class<?> rawClass, DataType... bindings) {
		this(rawClass, List.of(bindings));
	}

	DataType typeArgument(int index) {
		return bindings().get(index);
	}

	@Override
	public boolean isAssignableFrom(DataType other) {
		if (other instanceof InstanceType it) {
			// Unchecked conversions don't count: a raw type's arguments are wildcards
			return rawClass().isAssignableFrom(it.rawClass())
				&& argsAreContained(it);
		} else if (other instanceof ArrayType at) {
			return rawClass().isAssignableFrom(at.rawClass());
		} else if (other instanceof UnknownArrayType) {
			return rawClass().isAssignableFrom(Object[].class);
		} else if (other instanceof TypeVariable tv) {
			return tv.bounds().stream().anyMatch(bound -> this.isAssignableFrom(DataType.of(bound)));
		} else if (other instanceof WildcardType w) {
			return this.isAssignableFrom(w.upperBound());
		} else {
			return false;
		}
	}

	private boolean argsAreContained(InstanceType candidate) {
		for (int i = 0; i < this.bindings().size(); i++) {
			DataType candidateArg = candidate.parameterType(this.rawClass(), i);
			if (!this.typeArgument(i).contains(candidateArg)) {
				return false;
			}
		}
		return true;
	}

	@Override
	public Map<String, DataType> actualArguments() {
		var typeParameters = rawClass().getTypeParameters();
		Map<String, DataType> map = new HashMap<>();
		for (int i = 0; i < typeParameters.length; i++) {
			map.put(typeParameters[i].getName(), bindings.get(i));
		}
		return unmodifiableMap(map);
	}

	@Override
	public BoundType substitute(Map<String, DataType> actualArguments) {
		return new BoundType(rawClass, bindings.stream()
			.map(ta -> ta.substitute(actualArguments))
			.toList());
	}

	@Override
	public boolean isClosed() {
		return bindings.stream().allMatch(DataType::isClosed);
	}

	@Override
	public String toString() {
		String simpleName = this.rawClass().getSimpleName();
		if (simpleName.isEmpty()) {
			// Anonymous classes
			simpleName = this.rawClass().getName();
			simpleName = simpleName.substring(simpleName.lastIndexOf('.') + 1);
		}
		if (this.bindings().isEmpty()) {
			return simpleName;
		} else {
			return simpleName + "<"
				+ this.bindings().stream()
				.map(DataType::toString)
				.collect(joining(","))
				+ ">";
		}
	}
}

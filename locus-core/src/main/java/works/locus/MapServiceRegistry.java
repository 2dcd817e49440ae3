package works.locus;

import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.locus.exceptions.AmbiguousServiceException;
import works.locus.exceptions.InvalidBindingException;
import works.locus.exceptions.UnresolvedServiceException;
import works.locus.types.ArrayType;
import works.locus.types.BoundType;
import works.locus.types.DataType;
import works.locus.types.KnownType;
import works.locus.types.LowerBoundedWildcardType;
import works.locus.types.PrimitiveType;
import works.locus.types.TypeReference;
import works.locus.types.TypeVariable;
import works.locus.types.UnknownArrayType;
import works.locus.types.UpperBoundedWildcardType;

import static works.locus.LocatorSettings.MatchingPolicy.EXACT;

/**
 * A {@link ServiceRegistry} that holds instances and factories in memory,
 * matching requests according to {@link LocatorSettings#getMatching()}.
 * <p>
 * Lookups read an immutable snapshot and never block.
 * Registrations replace the snapshot, one at a time.
 */
public final class MapServiceRegistry implements ServiceRegistry {
	private final LocatorSettings settings;
	private volatile PMap<DataType, Binding> bindings = HashTreePMap.empty();

	public MapServiceRegistry(LocatorSettings settings) {
		this.settings = settings;
	}

	public MapServiceRegistry() {
		this(LocatorSettings.defaults());
	}

	public <T> MapServiceRegistry register(Class<T> type, T instance) {
		return register(DataType.of(type), instance);
	}

	public <T> MapServiceRegistry register(TypeReference<T> type, T instance) {
		return register(type.dataType(), instance);
	}

	public MapServiceRegistry register(DataType type, Object instance) {
		KnownType key = validKey(type);
		if (instance == null) {
			throw new InvalidBindingException(type, "instance can't be null");
		}
		if (!key.rawClass().isInstance(instance)) {
			throw new InvalidBindingException(type, "instance of " + instance.getClass().getName() + " is not a " + key.rawClass().getName());
		}
		return add(new InstanceBinding(key, instance));
	}

	public <T> MapServiceRegistry registerFactory(Class<T> type, Function<? super ServiceLocator, ? extends T> factory) {
		return registerFactory(DataType.of(type), factory);
	}

	public <T> MapServiceRegistry registerFactory(TypeReference<T> type, Function<? super ServiceLocator, ? extends T> factory) {
		return registerFactory(type.dataType(), factory);
	}

	public MapServiceRegistry registerFactory(DataType type, Function<? super ServiceLocator, ?> factory) {
		KnownType key = validKey(type);
		if (factory == null) {
			throw new InvalidBindingException(type, "factory can't be null");
		}
		return add(new FactoryBinding(key, factory));
	}

	/**
	 * @return the bindings registered so far, in no particular order
	 */
	public List<Binding> bindings() {
		return List.copyOf(bindings.values());
	}

	@Override
	public Binding lookup(DataType requestedType) {
		PMap<DataType, Binding> snapshot = this.bindings;
		Binding exact = snapshot.get(requestedType);
		if (exact != null) {
			LOGGER.trace("Exact match for {}", requestedType);
			return exact;
		}
		if (settings.getMatching() == EXACT) {
			throw new UnresolvedServiceException(requestedType);
		}
		if (mentionsTypeVariable(requestedType)) {
			// A type variable would admit any binding within its bounds
			throw new UnresolvedServiceException(requestedType,
				"No service registered for " + requestedType + ": type variables can't be matched");
		}
		List<Binding> candidates = snapshot.values().stream()
			.filter(b -> requestedType.isAssignableFrom(b.boundType()))
			.sorted(Comparator.comparing(b -> b.boundType().toString()))
			.toList();
		switch (candidates.size()) {
			case 0:
				throw new UnresolvedServiceException(requestedType);
			case 1:
				LOGGER.trace("Assignable match for {}: {}", requestedType, candidates.get(0));
				return candidates.get(0);
			default:
				throw new AmbiguousServiceException(requestedType, candidates.stream().map(Binding::boundType).toList());
		}
	}

	private static boolean mentionsTypeVariable(DataType type) {
		if (type instanceof TypeVariable) {
			return true;
		} else if (type instanceof BoundType bt) {
			return bt.bindings().stream().anyMatch(MapServiceRegistry::mentionsTypeVariable);
		} else if (type instanceof ArrayType at) {
			return mentionsTypeVariable(at.elementType());
		} else if (type instanceof UnknownArrayType uat) {
			return mentionsTypeVariable(uat.elementType());
		} else if (type instanceof UpperBoundedWildcardType w) {
			return mentionsTypeVariable(w.upperBound());
		} else if (type instanceof LowerBoundedWildcardType w) {
			return mentionsTypeVariable(w.lowerBound());
		} else {
			return false;
		}
	}

	private static KnownType validKey(DataType type) {
		if (type == null) {
			throw new IllegalArgumentException("Type can't be null");
		}
		if (!(type instanceof KnownType key) || !type.isClosed()) {
			throw new InvalidBindingException(type, "bound type can't have wildcards or type variables");
		}
		if (key instanceof PrimitiveType) {
			throw new InvalidBindingException(type, "primitive types can't be bound");
		}
		return key;
	}

	private synchronized MapServiceRegistry add(Binding binding) {
		Binding existing = bindings.get(binding.boundType());
		if (existing != null) {
			if (settings.isAllowRebinding()) {
				LOGGER.warn("Replacing binding {} with {}", existing, binding);
			} else {
				throw new InvalidBindingException(binding.boundType(), "already bound: " + existing);
			}
		}
		bindings = bindings.plus(binding.boundType(), binding);
		LOGGER.debug("Registered {}", binding);
		return this;
	}

	@Override
	public String toString() {
		return "MapServiceRegistry(" + bindings.size() + " bindings, matching=" + settings.getMatching() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MapServiceRegistry.class);
}

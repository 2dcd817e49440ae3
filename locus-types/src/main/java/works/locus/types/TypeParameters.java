package works.locus.types;

import java.lang.reflect.GenericDeclaration;
import java.util.HashMap;
import java.util.Map;
import java.util.WeakHashMap;
import works.locus.types.exceptions.MissingTypeParameterException;

/**
 * Resolves a class's type parameter as seen from a concrete subclass.
 * For example, given
 *
 * <pre>{@code
 * abstract class Repository<E> { ... }
 * class PersonRepository extends Repository<Person> { ... }
 * }</pre>
 *
 * resolving {@code Repository}'s {@code E} in the context of {@code PersonRepository}
 * yields {@code Person}.
 * <p>
 * <strong>Not thread-safe.</strong>
 * Results are memoized in a static {@link WeakHashMap} keyed by context class,
 * and {@link WeakHashMap} does no locking of its own.
 * The cached {@link DataType}s hold strong references to classes,
 * often including the context class itself (as in {@code class Node extends Base<Node>}),
 * so an entry can keep its own key reachable: don't count on this cache to let classes unload.
 * Callers that may run concurrently must hold the monitor of this class:
 *
 * <pre>{@code
 * synchronized (TypeParameters.class) {
 *     type = TypeParameters.resolve(getClass(), Repository.class.getTypeParameters()[0]);
 * }
 * }</pre>
 *
 * or capture the type with a {@link TypeReference} instead, which needs no shared state.
 */
public final class TypeParameters {
	private static final Map<Class<?>, Map<java.lang.reflect.TypeVariable<?>, DataType>> CACHE = new WeakHashMap<>();

	private TypeParameters() {}

	/**
	 * @param context a class that binds {@code parameter}, directly or through its supertypes
	 * @param parameter a type parameter of a generic class or interface that {@code context} extends
	 * @return the closed type {@code context} supplies for {@code parameter}
	 * @throws MissingTypeParameterException if {@code context} doesn't bind {@code parameter} to a closed type
	 * @throws IllegalArgumentException if {@code parameter} doesn't belong to a supertype of {@code context}
	 */
	public static DataType resolve(Class<?> context, java.lang.reflect.TypeVariable<?> parameter) {
		if (context == null || parameter == null) {
			throw new IllegalArgumentException("Context and parameter can't be null");
		}
		var resolved = CACHE.computeIfAbsent(context, c -> new HashMap<>());
		DataType result = resolved.get(parameter);
		if (result == null) {
			result = compute(context, parameter);
			resolved.put(parameter, result);
		}
		return result;
	}

	static void clearCache() {
		CACHE.clear();
	}

	private static DataType compute(Class<?> context, java.lang.reflect.TypeVariable<?> parameter) {
		GenericDeclaration declaration = parameter.getGenericDeclaration();
		if (!(declaration instanceof Class<?> declaringClass)) {
			throw new IllegalArgumentException("Only class type parameters can be resolved; "
				+ parameter + " is declared by " + declaration);
		}
		if (!declaringClass.isAssignableFrom(context)) {
			throw new IllegalArgumentException(context.getSimpleName() + " is not a subtype of " + declaringClass.getSimpleName());
		}
		int index = indexOf(declaringClass, parameter);
		var contextType = (InstanceType) DataType.of(context);
		DataType result = contextType.parameterType(declaringClass, index);
		if (!result.isClosed()) {
			throw new MissingTypeParameterException(parameter,
				"Type parameter " + parameter.getName() + " of " + declaringClass.getSimpleName()
					+ " is not bound to a concrete type by " + context.getSimpleName() + ". Found: " + result);
		}
		return result;
	}

	private static int indexOf(Class<?> declaringClass, java.lang.reflect.TypeVariable<?> parameter) {
		var typeParameters = declaringClass.getTypeParameters();
		for (int i = 0; i < typeParameters.length; i++) {
			if (typeParameters[i].equals(parameter)) {
				return i;
			}
		}
		throw new AssertionError("Type parameter " + parameter + " not found on its own declaring class " + declaringClass);
	}
}

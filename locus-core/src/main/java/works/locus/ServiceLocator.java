package works.locus;

import java.lang.reflect.Type;
import works.locus.exceptions.AmbiguousServiceException;
import works.locus.exceptions.UnresolvedServiceException;
import works.locus.types.DataType;
import works.locus.types.TypeParameters;
import works.locus.types.TypeReference;
import works.locus.types.exceptions.MissingTypeParameterException;

/**
 * Service for resolving other services.
 * <p>
 * Use one locator per composition root.
 * When several independent compositions coexist,
 * each must pass its own locator around to resolve the appropriate services;
 * there is no global instance.
 * <p>
 * Every way of asking for a service ends up at {@link #resolve(DataType)},
 * the only abstract method. The other overloads just compute a {@link DataType}
 * and differ in how much of the requested type survives that computation:
 *
 * <ol>
 *     <li>{@link #resolve(TypeReference)} keeps everything, and is safe to call from any thread;</li>
 *     <li>{@link #resolveUnsafe} also keeps everything, but is not thread-safe;</li>
 *     <li>{@link #resolve(Object[]) resolve(T...)} keeps only the erased class; and</li>
 *     <li>{@link #resolve(Class)} keeps exactly what a {@link Class} can express.</li>
 * </ol>
 *
 * None of these fall back to one another: if a lookup fails, the exception propagates,
 * and no less precise lookup is attempted.
 */
public interface ServiceLocator {
	/**
	 * Resolve a service registered in the locator.
	 *
	 * @param type the exact type of service wanted
	 * @return registered implementation
	 * @throws IllegalArgumentException if {@code type} is null
	 * @throws UnresolvedServiceException if nothing is registered for {@code type}
	 * @throws AmbiguousServiceException if the registry can't choose between several candidates
	 */
	<T> T resolve(DataType type);

	/**
	 * Resolve a service registered in the locator.
	 * This is the way to ask for a generic type:
	 *
	 * <pre>{@code
	 * List<String> names = locator.resolve(new TypeReference<List<String>>() { });
	 * }</pre>
	 *
	 * @param typeReference captures the requested type, generic arguments included
	 * @return registered implementation
	 * @throws IllegalArgumentException if {@code typeReference} is null
	 */
	default <T> T resolve(TypeReference<T> typeReference) {
		if (typeReference == null) {
			throw new IllegalArgumentException("Type reference can't be null");
		}
		return resolve(typeReference.dataType());
	}

	/**
	 * Resolve the service whose type is a class's type parameter,
	 * as bound by a concrete subclass:
	 *
	 * <pre>{@code
	 * abstract class Repository<E> {
	 *     Repository(ServiceLocator locator) {
	 *         this.codec = locator.resolveUnsafe(getClass(), Repository.class.getTypeParameters()[0]);
	 *     }
	 * }
	 * }</pre>
	 *
	 * <strong>Warning: not thread-safe.</strong>
	 * This relies on {@link TypeParameters}, whose cache does no locking.
	 * Calling code must be guarded with {@code synchronized (TypeParameters.class)}
	 * or, as a workaround, use {@link #resolve(TypeReference)} instead.
	 *
	 * @param context the concrete class that binds {@code parameter}
	 * @param parameter a type parameter of some supertype of {@code context}
	 * @return registered implementation
	 * @throws MissingTypeParameterException if {@code context} doesn't bind {@code parameter} to a concrete type
	 */
	default <T> T resolveUnsafe(Class<?> context, java.lang.reflect.TypeVariable<?> parameter) {
		return resolve(TypeParameters.resolve(context, parameter));
	}

	/**
	 * Resolve a service registered in the locator, using the type inferred at the call site:
	 *
	 * <pre>{@code
	 * Clock clock = locator.resolve();
	 * }</pre>
	 *
	 * <strong>Warning: generic types are erased at compile time.</strong>
	 * Only the erased class of {@code T} is available, so
	 * {@code List<String>} and {@code List<Integer>} both turn into a request for the raw {@code List}.
	 * Use {@link #resolve(TypeReference)} for generic types.
	 *
	 * @param reified leave this empty; the compiler fills it in with an array whose component type is the erasure of {@code T}
	 * @return registered implementation
	 * @throws IllegalArgumentException if any arguments are passed
	 */
	@SuppressWarnings({"unchecked", "varargs"})
	default <T> T resolve(T... reified) {
		if (reified == null || reified.length != 0) {
			throw new IllegalArgumentException("Don't pass any arguments; the type is inferred from the call site");
		}
		return resolve(DataType.of(reified.getClass().getComponentType()));
	}

	/**
	 * Resolve a service registered in the locator.
	 * For a generic class, this requests the {@link works.locus.types.ErasedType erased} type.
	 *
	 * @param clazz class or interface
	 * @return registered implementation
	 * @throws IllegalArgumentException if {@code clazz} is null
	 */
	default <T> T resolve(Class<T> clazz) {
		if (clazz == null) {
			throw new IllegalArgumentException("Class can't be null");
		}
		return resolve(DataType.of(clazz));
	}

	/**
	 * Resolve a service registered in the locator,
	 * given a reflective type such as a field's {@link java.lang.reflect.Field#getGenericType() generic type}.
	 *
	 * @param type class, interface, or parameterized type
	 * @return registered implementation
	 * @throws IllegalArgumentException if {@code type} is null
	 */
	default <T> T resolve(Type type) {
		if (type == null) {
			throw new IllegalArgumentException("Type can't be null");
		}
		return resolve(DataType.of(type));
	}
}

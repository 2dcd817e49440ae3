package works.locus;

import org.jetbrains.annotations.NotNull;
import works.locus.exceptions.AmbiguousServiceException;
import works.locus.exceptions.UnresolvedServiceException;
import works.locus.types.DataType;

/**
 * Where a {@link Locator} finds its services.
 * <p>
 * How bindings get here, how they're stored,
 * and how a request that matches several of them is settled
 * are all up to the implementation.
 * The only requirement is that it accepts any {@link DataType} as a lookup key.
 *
 * @see MapServiceRegistry
 */
public interface ServiceRegistry {
	/**
	 * @throws UnresolvedServiceException if no binding matches {@code requestedType};
	 *   its {@link UnresolvedServiceException#requestedType() requestedType} must be {@code requestedType} itself
	 * @throws AmbiguousServiceException if more than one binding matches and the registry can't choose
	 */
	@NotNull Binding lookup(@NotNull DataType requestedType);
}

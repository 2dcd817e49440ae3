/**
 * Type-safe service lookup.
 * <p>
 * Start with {@link works.locus.ServiceLocator}, the resolution contract,
 * and {@link works.locus.Locator}, its standard implementation.
 * A {@link works.locus.ServiceRegistry} supplies the bindings;
 * {@link works.locus.MapServiceRegistry} is the one Locus provides.
 */
package works.locus;

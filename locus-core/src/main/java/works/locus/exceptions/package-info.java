/**
 * Exceptions thrown by locators and registries.
 * <p>
 * Everything here is unchecked.
 * {@link works.locus.exceptions.ServiceResolutionException} and its subclasses
 * describe a lookup that found the wrong number of services;
 * the rest indicate a misconfigured registry.
 */
package works.locus.exceptions;

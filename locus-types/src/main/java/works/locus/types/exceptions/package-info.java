/**
 * Exceptions thrown while capturing types.
 */
package works.locus.types.exceptions;

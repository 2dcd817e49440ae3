/**
 * Rich abstract datatype representing Java types, rooted at {@link works.locus.types.DataType}.
 * <p>
 * {@link java.lang.reflect.Type} has no useful notion of equality across its implementations,
 * and {@link java.lang.Class} forgets type arguments.
 * A {@link works.locus.types.DataType} is a value that remembers them,
 * and a {@link works.locus.types.TypeReference} is how a caller obtains one for a generic type.
 */
package works.locus.types;

/**
 * Type descriptors for Locus.
 * <p>
 * {@link works.locus.types.DataType} describes a Java type, generics included,
 * as a comparable value;
 * {@link works.locus.types.TypeReference} captures one at a call site;
 * and {@link works.locus.types.TypeParameters} recovers one from a subclass's declaration.
 */
module works.locus.types {
	exports works.locus.types;
	exports works.locus.types.exceptions;
}

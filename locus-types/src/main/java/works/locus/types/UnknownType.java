package works.locus.types;

/**
 * A {@link DataType} with at least one wildcard or type variable.
 * These can describe a request, but can never be the key of a registered service.
 */
sealed public interface UnknownType extends DataType permits
	TypeVariable,
	UnknownArrayType,
	WildcardType
{
	@Override
	default boolean isClosed() {
		return false;
	}
}

package works.locus;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

import static works.locus.LocatorSettings.MatchingPolicy.ASSIGNABLE;

@Value
@Builder(toBuilder = true)
public class LocatorSettings {
	/**
	 * How the registry chooses a binding for a requested type.
	 * An exact match always wins regardless of this setting.
	 */
	@Default MatchingPolicy matching = ASSIGNABLE;

	/**
	 * Whether a type that already has a binding may be bound again,
	 * replacing the earlier binding.
	 * If not, binding the same type twice throws {@link works.locus.exceptions.InvalidBindingException}.
	 */
	@Default boolean allowRebinding = false;

	public static LocatorSettings defaults() {
		return builder().build();
	}

	public enum MatchingPolicy {
		/**
		 * Only a binding for exactly the requested type will do.
		 * A request for the raw {@code List} will not find a binding for {@code List<String>}.
		 */
		EXACT,

		/**
		 * Failing an exact match, any binding whose type is
		 * {@link works.locus.types.DataType#isAssignableFrom assignable}
		 * to the requested type is a candidate.
		 * If there's exactly one candidate, it is used; if there are several,
		 * the request is ambiguous.
		 */
		ASSIGNABLE,
	}
}

package works.combex.attributes;

/**
 * What {@link AttributeCleaner} does with a value that has no wire representation.
 */
public enum UnsupportedValuePolicy {
	/**
	 * Drop the attribute.
	 */
	DROP,

	/**
	 * Keep the attribute as a short, depth-limited debug string.
	 *
	 * @see ShortInspector
	 */
	INSPECT,
}

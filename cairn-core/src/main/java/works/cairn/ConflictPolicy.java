package works.cairn;

/**
 * What {@link TypeRegistry} does when a function is registered for a type that already has one.
 */
public enum ConflictPolicy {
	/**
	 * Leave the existing function in place and ignore the new one.
	 */
	KEEP_EXISTING,

	/**
	 * Replace the existing function with the new one.
	 */
	REPLACE,

	/**
	 * Throw {@link works.cairn.exceptions.HandlerConflictException} and leave the registry unchanged.
	 */
	ERROR,
}

package works.cairn.storage;

/**
 * A stored value that stands for "missing".
 * Its kind always matches the kind of the {@link StorageType} it accompanies.
 */
public sealed interface Placeholder permits
	Placeholder.IntegerPlaceholder,
	Placeholder.FloatPlaceholder,
	Placeholder.StringPlaceholder
{
	record IntegerPlaceholder(long value) implements Placeholder { }

	/**
	 * May be NaN or infinite.
	 */
	record FloatPlaceholder(double value) implements Placeholder {
		/**
		 * NaN matches NaN; otherwise values are compared numerically.
		 */
		public boolean matches(double stored) {
			return Double.isNaN(value) ? Double.isNaN(stored) : stored == value;
		}
	}

	record StringPlaceholder(String value) implements Placeholder { }
}

package works.cairn.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.IntPredicate;
import works.cairn.exceptions.EncodingException;
import works.cairn.storage.Placeholder.FloatPlaceholder;
import works.cairn.storage.Placeholder.IntegerPlaceholder;
import works.cairn.storage.Placeholder.StringPlaceholder;

/**
 * Writes an encoding's placeholder into the missing slots of a column before it is stored,
 * and turns it back into "missing" when the stored values are read.
 * <p>
 * Each {@code restore} method is the inverse of the corresponding {@code substitute}
 * method for the encoding the optimizer chose for that column.
 */
public final class PlaceholderSubstitution {
	private PlaceholderSubstitution() { }

	public static long[] substituteIntegers(IntegerColumn column, StorageEncoding encoding) {
		long placeholder = integerPlaceholder(encoding, column.size(), column::isMissing);
		long[] result = new long[column.size()];
		for (int i = 0; i < result.length; i++) {
			result[i] = column.isMissing(i) ? placeholder : column.get(i);
		}
		return result;
	}

	/**
	 * @throws EncodingException if a non-missing value doesn't fit in 32 bits
	 */
	public static IntegerColumn restoreIntegers(long[] stored, StorageEncoding encoding) {
		IntegerPlaceholder placeholder = encoding.placeholder() instanceof IntegerPlaceholder
			? (IntegerPlaceholder) encoding.placeholder()
			: null;
		int[] values = new int[stored.length];
		boolean[] missing = new boolean[stored.length];
		for (int i = 0; i < stored.length; i++) {
			if (placeholder != null && stored[i] == placeholder.value()) {
				missing[i] = true;
			} else if (stored[i] < Integer.MIN_VALUE || stored[i] > Integer.MAX_VALUE) {
				throw new EncodingException("stored value " + stored[i] + " at index " + i + " does not fit in a 32-bit integer");
			} else {
				values[i] = (int) stored[i];
			}
		}
		return new IntegerColumn(values, missing);
	}

	/**
	 * Integer-typed encodings are substituted as whole numbers, so the result is exact
	 * in either case.
	 */
	public static double[] substituteNumbers(NumberColumn column, StorageEncoding encoding) {
		double placeholder = 0;
		boolean anyMissing = false;
		for (int i = 0; i < column.size(); i++) {
			anyMissing |= column.isMissing(i);
		}
		if (anyMissing) {
			placeholder = numberPlaceholder(encoding)
				.orElseThrow(() -> new EncodingException("column has missing values but the encoding has no placeholder"));
		}
		double[] result = new double[column.size()];
		for (int i = 0; i < result.length; i++) {
			result[i] = column.isMissing(i) ? placeholder : column.get(i);
		}
		return result;
	}

	public static NumberColumn restoreNumbers(double[] stored, StorageEncoding encoding) {
		Placeholder placeholder = encoding.placeholder();
		boolean[] missing = new boolean[stored.length];
		for (int i = 0; i < stored.length; i++) {
			if (placeholder instanceof FloatPlaceholder) {
				missing[i] = ((FloatPlaceholder) placeholder).matches(stored[i]);
			} else if (placeholder instanceof IntegerPlaceholder) {
				missing[i] = stored[i] == ((IntegerPlaceholder) placeholder).value();
			}
		}
		return new NumberColumn(stored, missing);
	}

	public static List<String> substituteStrings(StringColumn column, StorageEncoding encoding) {
		String placeholder = null;
		List<String> result = new ArrayList<>(column.size());
		for (int i = 0; i < column.size(); i++) {
			if (column.isMissing(i)) {
				if (placeholder == null) {
					placeholder = stringPlaceholder(encoding);
				}
				result.add(placeholder);
			} else {
				result.add(column.get(i));
			}
		}
		return result;
	}

	/**
	 * @return the values, with null wherever the placeholder was stored
	 */
	public static List<String> restoreStrings(List<String> stored, StorageEncoding encoding) {
		String placeholder = encoding.placeholder() instanceof StringPlaceholder
			? ((StringPlaceholder) encoding.placeholder()).value()
			: null;
		List<String> result = new ArrayList<>(stored.size());
		for (String value : stored) {
			result.add(value != null && value.equals(placeholder) ? null : value);
		}
		return result;
	}

	/**
	 * @return {@code 1} for true, {@code 0} for false, and the placeholder for missing
	 */
	public static long[] substituteBooleans(BooleanColumn column, StorageEncoding encoding) {
		long placeholder = integerPlaceholder(encoding, column.size(), column::isMissing);
		long[] result = new long[column.size()];
		for (int i = 0; i < result.length; i++) {
			Boolean value = column.get(i);
			if (value == null) {
				result[i] = placeholder;
			} else {
				result[i] = value ? 1 : 0;
			}
		}
		return result;
	}

	/**
	 * Any non-zero stored value other than the placeholder reads as true.
	 */
	public static BooleanColumn restoreBooleans(long[] stored, StorageEncoding encoding) {
		IntegerPlaceholder placeholder = encoding.placeholder() instanceof IntegerPlaceholder
			? (IntegerPlaceholder) encoding.placeholder()
			: null;
		List<Boolean> result = new ArrayList<>(stored.length);
		for (long value : stored) {
			if (placeholder != null && value == placeholder.value()) {
				result.add(null);
			} else {
				result.add(value != 0);
			}
		}
		return new BooleanColumn(result);
	}

	private static long integerPlaceholder(StorageEncoding encoding, int size, IntPredicate isMissing) {
		for (int i = 0; i < size; i++) {
			if (isMissing.test(i)) {
				if (encoding.placeholder() instanceof IntegerPlaceholder) {
					return ((IntegerPlaceholder) encoding.placeholder()).value();
				}
				throw new EncodingException("column has missing values but the encoding has no integer placeholder");
			}
		}
		return 0;
	}

	private static Optional<Double> numberPlaceholder(StorageEncoding encoding) {
		Placeholder placeholder = encoding.placeholder();
		if (placeholder instanceof FloatPlaceholder) {
			return Optional.of(((FloatPlaceholder) placeholder).value());
		} else if (placeholder instanceof IntegerPlaceholder) {
			return Optional.of((double) ((IntegerPlaceholder) placeholder).value());
		} else {
			return Optional.empty();
		}
	}

	private static String stringPlaceholder(StorageEncoding encoding) {
		if (encoding.placeholder() instanceof StringPlaceholder) {
			return ((StringPlaceholder) encoding.placeholder()).value();
		}
		throw new EncodingException("column has missing values but the encoding has no string placeholder");
	}
}

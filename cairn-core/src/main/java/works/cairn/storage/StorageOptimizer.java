package works.cairn.storage;

import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntPredicate;
import java.util.function.IntToLongFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.cairn.exceptions.EncodingException;
import works.cairn.storage.Placeholder.FloatPlaceholder;
import works.cairn.storage.Placeholder.IntegerPlaceholder;
import works.cairn.storage.Placeholder.StringPlaceholder;
import works.cairn.storage.StorageType.FloatType;
import works.cairn.storage.StorageType.IntegerType;
import works.cairn.storage.StorageType.StringType;

import static works.cairn.storage.StorageType.IntegerType.INT16;
import static works.cairn.storage.StorageType.IntegerType.INT32;
import static works.cairn.storage.StorageType.IntegerType.INT8;
import static works.cairn.storage.StorageType.IntegerType.UINT16;
import static works.cairn.storage.StorageType.IntegerType.UINT32;
import static works.cairn.storage.StorageType.IntegerType.UINT8;

/**
 * Chooses the smallest container type that stores a column exactly,
 * and, if the column has missing values, a placeholder that no real value uses.
 * <p>
 * Callers write the placeholder into the missing slots themselves;
 * see {@link PlaceholderSubstitution}.
 */
public final class StorageOptimizer {
	/**
	 * Integer widths in the order they are tried.
	 */
	public static final List<IntegerType> INTEGER_LADDER = List.of(UINT8, INT8, UINT16, INT16, UINT32, INT32);

	static final String STRING_PLACEHOLDER = "NA";

	private StorageOptimizer() { }

	public static StorageEncoding optimizeIntegers(IntegerColumn column) {
		long min = Long.MAX_VALUE;
		long max = Long.MIN_VALUE;
		boolean anyMissing = false;
		for (int i = 0; i < column.size(); i++) {
			if (column.isMissing(i)) {
				anyMissing = true;
			} else {
				min = Math.min(min, column.get(i));
				max = Math.max(max, column.get(i));
			}
		}
		if (min > max) {
			// Empty or entirely missing
			return anyMissing
				? new StorageEncoding(UINT8, new IntegerPlaceholder(UINT8.max()))
				: StorageEncoding.of(UINT8);
		}
		if (!anyMissing) {
			return StorageEncoding.of(firstContaining(min, max).orElseThrow());
		}
		Set<Long> observed = observedCandidates(min, max, i -> !column.isMissing(i), column::get, column.size());
		Optional<StorageEncoding> searched = searchIntegerLadder(min, max, observed, false);
		return searched.orElseGet(() -> new StorageEncoding(INT32, new IntegerPlaceholder(IntegerColumn.NATIVE_MISSING)));
	}

	public static StorageEncoding optimizeNumbers(NumberColumn column) {
		boolean anyMissing = false;
		boolean integral = true;
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (int i = 0; i < column.size(); i++) {
			if (column.isMissing(i)) {
				anyMissing = true;
				continue;
			}
			double v = column.get(i);
			if (!isStorableAsInteger(v)) {
				integral = false;
			} else {
				min = Math.min(min, v);
				max = Math.max(max, v);
			}
		}

		if (integral) {
			if (min > max) {
				return anyMissing
					? new StorageEncoding(UINT8, new IntegerPlaceholder(UINT8.max()))
					: StorageEncoding.of(UINT8);
			}
			long lo = (long) min;
			long hi = (long) max;
			Optional<IntegerType> narrowest = firstContaining(lo, hi);
			if (narrowest.isPresent() && !anyMissing) {
				return StorageEncoding.of(narrowest.get());
			} else if (narrowest.isPresent()) {
				Set<Long> observed = observedCandidates(lo, hi, i -> !column.isMissing(i), i -> (long) column.get(i), column.size());
				Optional<StorageEncoding> searched = searchIntegerLadder(lo, hi, observed, true);
				if (searched.isPresent()) {
					return searched.get();
				}
				LOGGER.debug("No free integer placeholder for values in [{}, {}]; using floating point", lo, hi);
			} else {
				LOGGER.debug("No integer type holds [{}, {}]; using floating point", lo, hi);
			}
		}

		FloatType floatType = FloatType.FLOAT32;
		for (int i = 0; i < column.size(); i++) {
			if (!column.isMissing(i) && !floatType.represents(column.get(i))) {
				floatType = FloatType.FLOAT64;
				break;
			}
		}
		if (!anyMissing) {
			return StorageEncoding.of(floatType);
		}

		List<FloatType> widths = floatType == FloatType.FLOAT32
			? List.of(FloatType.FLOAT32, FloatType.FLOAT64)
			: List.of(FloatType.FLOAT64);
		for (FloatType candidate : widths) {
			Optional<Double> special = freeSpecialValue(column, candidate);
			if (special.isPresent()) {
				return new StorageEncoding(candidate, new FloatPlaceholder(special.get()));
			}
		}
		return new StorageEncoding(FloatType.FLOAT64, new FloatPlaceholder(bisect(column)));
	}

	/**
	 * @throws EncodingException if a value is declared with an encoding that can't be stored,
	 * is declared ASCII but isn't, or has no UTF-8 form
	 */
	public static StorageEncoding optimizeStrings(StringColumn column) {
		int width = 0;
		boolean anyMissing = false;
		boolean allAscii = true;
		Set<String> present = new HashSet<>();
		for (int i = 0; i < column.size(); i++) {
			String value = column.get(i);
			if (value == null) {
				anyMissing = true;
				continue;
			}
			TextEncoding encoding = column.encoding(i);
			if (!encoding.storable()) {
				throw new EncodingException("value " + i + " is declared as " + encoding + "; only ASCII and UTF-8 text can be stored");
			}
			boolean ascii = isAscii(value);
			if (encoding == TextEncoding.ASCII && !ascii) {
				throw new EncodingException("value " + i + " is declared as ASCII but contains non-ASCII characters");
			}
			allAscii &= ascii;
			width = Math.max(width, utf8Length(value, i));
			present.add(value);
		}

		StringPlaceholder placeholder = null;
		if (anyMissing) {
			String candidate = STRING_PLACEHOLDER;
			while (present.contains(candidate)) {
				candidate = "_" + candidate;
			}
			placeholder = new StringPlaceholder(candidate);
			width = Math.max(width, candidate.length());
		}
		TextEncoding charset = allAscii ? TextEncoding.ASCII : TextEncoding.UTF8;
		return new StorageEncoding(new StringType(Math.max(1, width), charset), placeholder);
	}

	public static StorageEncoding optimizeBooleans(BooleanColumn column) {
		for (int i = 0; i < column.size(); i++) {
			if (column.isMissing(i)) {
				return new StorageEncoding(INT8, new IntegerPlaceholder(-1));
			}
		}
		return StorageEncoding.of(INT8);
	}

	private static Optional<IntegerType> firstContaining(long min, long max) {
		for (IntegerType type : INTEGER_LADDER) {
			if (type.contains(min) && type.contains(max)) {
				return Optional.of(type);
			}
		}
		return Optional.empty();
	}

	/**
	 * Walks every acceptable width, trying its maximum, its minimum, then zero.
	 *
	 * @param searchWidest whether to search at {@link IntegerType#INT32 int32} too,
	 * rather than leaving it to the caller
	 */
	private static Optional<StorageEncoding> searchIntegerLadder(long min, long max, Set<Long> observed, boolean searchWidest) {
		for (IntegerType type : INTEGER_LADDER) {
			if (!type.contains(min) || !type.contains(max)) {
				continue;
			}
			if (INT32.equals(type) && !searchWidest) {
				return Optional.empty();
			}
			for (long candidate : placeholderCandidates(type)) {
				if (!observed.contains(candidate)) {
					return Optional.of(new StorageEncoding(type, new IntegerPlaceholder(candidate)));
				}
			}
			LOGGER.trace("Every placeholder candidate for {} is in use", type.descriptor());
		}
		return Optional.empty();
	}

	private static long[] placeholderCandidates(IntegerType type) {
		return new long[] { type.max(), type.min(), 0L };
	}

	/**
	 * One pass over the column, checking only the values that could be chosen as placeholders.
	 */
	private static Set<Long> observedCandidates(long min, long max, IntPredicate present, IntToLongFunction value, int size) {
		Set<Long> candidates = new HashSet<>();
		for (IntegerType type : INTEGER_LADDER) {
			if (type.contains(min) && type.contains(max)) {
				for (long c : placeholderCandidates(type)) {
					candidates.add(c);
				}
			}
		}
		Set<Long> observed = new HashSet<>();
		for (int i = 0; i < size && observed.size() < candidates.size(); i++) {
			if (present.test(i)) {
				long v = value.applyAsLong(i);
				if (candidates.contains(v)) {
					observed.add(v);
				}
			}
		}
		return observed;
	}

	/**
	 * Negative zero is excluded so that it is not stored as a plain integer zero.
	 */
	private static boolean isStorableAsInteger(double v) {
		return Double.isFinite(v)
			&& v == Math.rint(v)
			&& v >= INT32.min()
			&& v <= UINT32.max()
			&& !(v == 0.0 && Double.doubleToRawLongBits(v) != 0L);
	}

	private static Optional<Double> freeSpecialValue(NumberColumn column, FloatType type) {
		boolean hasNaN = false;
		boolean hasPositiveInfinity = false;
		boolean hasNegativeInfinity = false;
		boolean hasLowest = false;
		boolean hasHighest = false;
		for (int i = 0; i < column.size(); i++) {
			if (column.isMissing(i)) {
				continue;
			}
			double v = column.get(i);
			if (Double.isNaN(v)) {
				hasNaN = true;
			} else if (v == Double.POSITIVE_INFINITY) {
				hasPositiveInfinity = true;
			} else if (v == Double.NEGATIVE_INFINITY) {
				hasNegativeInfinity = true;
			} else if (v == type.lowest()) {
				hasLowest = true;
			} else if (v == type.highest()) {
				hasHighest = true;
			}
		}
		if (!hasNaN) {
			return Optional.of(Double.NaN);
		} else if (!hasPositiveInfinity) {
			return Optional.of(Double.POSITIVE_INFINITY);
		} else if (!hasNegativeInfinity) {
			return Optional.of(Double.NEGATIVE_INFINITY);
		} else if (!hasLowest) {
			return Optional.of(type.lowest());
		} else if (!hasHighest) {
			return Optional.of(type.highest());
		} else {
			return Optional.empty();
		}
	}

	/**
	 * Finds a finite double different from every finite value in the column,
	 * looking below the smallest, above the largest, then between neighbours.
	 */
	private static double bisect(NumberColumn column) {
		double[] finite = new double[column.size()];
		int count = 0;
		for (int i = 0; i < column.size(); i++) {
			if (!column.isMissing(i) && Double.isFinite(column.get(i))) {
				// Adding zero turns negative zero into positive zero
				finite[count++] = column.get(i) + 0.0;
			}
		}
		double[] sorted = Arrays.stream(finite, 0, count).sorted().distinct().toArray();
		if (sorted.length == 0) {
			return 0.0;
		}
		if (sorted[0] > -Double.MAX_VALUE) {
			return Math.nextDown(sorted[0]);
		}
		if (sorted[sorted.length - 1] < Double.MAX_VALUE) {
			return Math.nextUp(sorted[sorted.length - 1]);
		}
		for (int i = 1; i < sorted.length; i++) {
			double a = sorted[i - 1];
			double b = sorted[i];
			double mid = a / 2 + b / 2;
			if (mid != a && mid != b) {
				return mid;
			}
		}
		throw new EncodingException("no unused double-precision value is available as a missing-value placeholder");
	}

	/**
	 * @throws EncodingException if {@code value} has no UTF-8 form, such as when it contains an unpaired surrogate
	 */
	private static int utf8Length(String value, int index) {
		CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
			.onMalformedInput(CodingErrorAction.REPORT)
			.onUnmappableCharacter(CodingErrorAction.REPORT);
		try {
			return encoder.encode(CharBuffer.wrap(value)).remaining();
		} catch (CharacterCodingException e) {
			throw new EncodingException("value " + index + " cannot be encoded as UTF-8", e);
		}
	}

	private static boolean isAscii(String value) {
		for (int i = 0; i < value.length(); i++) {
			if (value.charAt(i) > 0x7F) {
				return false;
			}
		}
		return true;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(StorageOptimizer.class);
}

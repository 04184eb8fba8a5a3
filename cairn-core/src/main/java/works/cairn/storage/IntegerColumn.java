package works.cairn.storage;

import java.util.Arrays;
import java.util.List;

/**
 * 32-bit integers with an explicit missing mask.
 * <p>
 * {@link Integer#MIN_VALUE} is also treated as missing wherever it appears,
 * since that is how 32-bit integer columns mark missing values natively.
 */
public final class IntegerColumn {
	public static final int NATIVE_MISSING = Integer.MIN_VALUE;

	private final int[] values;
	private final boolean[] missing;

	public IntegerColumn(int[] values, boolean[] missing) {
		if (values.length != missing.length) {
			throw new IllegalArgumentException("Mask length " + missing.length + " does not match value count " + values.length);
		}
		this.values = values.clone();
		this.missing = missing.clone();
	}

	/**
	 * @param values where {@link #NATIVE_MISSING} marks a missing value
	 */
	public static IntegerColumn of(int... values) {
		return new IntegerColumn(values, new boolean[values.length]);
	}

	/**
	 * @param values where null marks a missing value
	 */
	public static IntegerColumn ofNullable(List<Integer> values) {
		int[] v = new int[values.size()];
		boolean[] m = new boolean[values.size()];
		for (int i = 0; i < v.length; i++) {
			Integer value = values.get(i);
			if (value == null) {
				m[i] = true;
			} else {
				v[i] = value;
			}
		}
		return new IntegerColumn(v, m);
	}

	public int size() {
		return values.length;
	}

	public boolean isMissing(int index) {
		return missing[index] || values[index] == NATIVE_MISSING;
	}

	/**
	 * Meaningless where {@link #isMissing} is true.
	 */
	public int get(int index) {
		return values[index];
	}

	@Override
	public String toString() {
		return "IntegerColumn(" + Arrays.toString(values) + ", missing=" + Arrays.toString(missing) + ")";
	}
}

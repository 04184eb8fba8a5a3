package works.cairn.storage;

import java.util.Arrays;
import java.util.List;

/**
 * Doubles with an explicit missing mask.
 * NaN is an ordinary value here, distinct from missing.
 */
public final class NumberColumn {
	private final double[] values;
	private final boolean[] missing;

	public NumberColumn(double[] values, boolean[] missing) {
		if (values.length != missing.length) {
			throw new IllegalArgumentException("Mask length " + missing.length + " does not match value count " + values.length);
		}
		this.values = values.clone();
		this.missing = missing.clone();
	}

	public static NumberColumn of(double... values) {
		return new NumberColumn(values, new boolean[values.length]);
	}

	/**
	 * @param values where null marks a missing value
	 */
	public static NumberColumn ofNullable(List<Double> values) {
		double[] v = new double[values.size()];
		boolean[] m = new boolean[values.size()];
		for (int i = 0; i < v.length; i++) {
			Double value = values.get(i);
			if (value == null) {
				m[i] = true;
			} else {
				v[i] = value;
			}
		}
		return new NumberColumn(v, m);
	}

	public int size() {
		return values.length;
	}

	public boolean isMissing(int index) {
		return missing[index];
	}

	public double get(int index) {
		return values[index];
	}

	@Override
	public String toString() {
		return "NumberColumn(" + Arrays.toString(values) + ", missing=" + Arrays.toString(missing) + ")";
	}
}

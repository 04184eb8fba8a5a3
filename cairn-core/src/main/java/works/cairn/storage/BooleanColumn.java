package works.cairn.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Booleans; null marks a missing value.
 */
public final class BooleanColumn {
	private final List<Boolean> values;

	public BooleanColumn(List<Boolean> values) {
		this.values = Collections.unmodifiableList(new ArrayList<>(values));
	}

	public static BooleanColumn of(Boolean... values) {
		List<Boolean> list = new ArrayList<>(values.length);
		Collections.addAll(list, values);
		return new BooleanColumn(list);
	}

	public int size() {
		return values.size();
	}

	public boolean isMissing(int index) {
		return values.get(index) == null;
	}

	@Nullable
	public Boolean get(int index) {
		return values.get(index);
	}

	@Override
	public String toString() {
		return "BooleanColumn(" + values + ")";
	}
}

package works.cairn.basic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A data frame as loaded by {@link DataFrameFormat#read}.
 *
 * @param columns one loaded object per entry of {@code columnNames}
 * @param annotations the loaded {@code other_annotations} object, if there is one
 */
public record DataFrame(
	long rowCount,
	List<String> columnNames,
	List<Object> columns,
	@Nullable Object annotations
) {
	public DataFrame {
		if (columnNames.size() != columns.size()) {
			throw new IllegalArgumentException("Got " + columnNames.size() + " column names for " + columns.size() + " columns");
		}
		columnNames = List.copyOf(columnNames);
		columns = Collections.unmodifiableList(new ArrayList<>(columns));
	}

	public int columnCount() {
		return columns.size();
	}

	public Object column(String name) {
		int index = columnNames.indexOf(name);
		if (index < 0) {
			throw new IllegalArgumentException("No column named \"" + name + "\"");
		}
		return columns.get(index);
	}
}

package works.cairn.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Text values, each with its declared encoding; null marks a missing value.
 */
public final class StringColumn {
	private final List<String> values;
	private final List<TextEncoding> encodings;

	public StringColumn(List<String> values, List<TextEncoding> encodings) {
		if (values.size() != encodings.size()) {
			throw new IllegalArgumentException("Encoding count " + encodings.size() + " does not match value count " + values.size());
		}
		this.values = Collections.unmodifiableList(new ArrayList<>(values));
		this.encodings = List.copyOf(encodings);
	}

	/**
	 * All values declared with the same {@code encoding}.
	 */
	public static StringColumn of(TextEncoding encoding, List<String> values) {
		return new StringColumn(values, Collections.nCopies(values.size(), encoding));
	}

	public static StringColumn utf8(String... values) {
		List<String> list = new ArrayList<>(values.length);
		Collections.addAll(list, values);
		return of(TextEncoding.UTF8, list);
	}

	public int size() {
		return values.size();
	}

	public boolean isMissing(int index) {
		return values.get(index) == null;
	}

	@Nullable
	public String get(int index) {
		return values.get(index);
	}

	public TextEncoding encoding(int index) {
		return encodings.get(index);
	}

	@Override
	public String toString() {
		return "StringColumn(" + values + ")";
	}
}

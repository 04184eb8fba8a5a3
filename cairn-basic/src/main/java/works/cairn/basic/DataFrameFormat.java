package works.cairn.basic;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.cairn.ObjectFile;
import works.cairn.ObjectMetadata;
import works.cairn.ObjectReader;
import works.cairn.ValidationContext;
import works.cairn.exceptions.InvalidObjectException;

/**
 * A table of named columns, each of which is an object of any type whose height is the row count.
 * <p>
 * Column {@code i} is saved in {@code other_columns/i}.
 * Annotations on the columns, if any, are a {@link SimpleListFormat simple list}
 * (or anything else satisfying {@link SimpleListFormat#INTERFACE SIMPLE_LIST})
 * in {@code other_annotations}.
 */
public final class DataFrameFormat {
	public static final String TYPE = "data_frame";
	public static final String INTERFACE = "DATA_FRAME";
	public static final String VERSION = "1.0";
	public static final String COLUMNS_DIRECTORY = "other_columns";
	public static final String ANNOTATIONS_DIRECTORY = "other_annotations";

	static final String ROW_COUNT = "row_count";
	static final String COLUMN_NAMES = "column_names";

	private DataFrameFormat() { }

	public static ObjectWriter writer(long rowCount, List<String> columnNames, List<ObjectWriter> columns, @Nullable ObjectWriter annotations) {
		return directory -> save(directory, rowCount, columnNames, columns, annotations);
	}

	public static void save(Path directory, long rowCount, List<String> columnNames, List<ObjectWriter> columns, @Nullable ObjectWriter annotations) throws IOException {
		if (columnNames.size() != columns.size()) {
			throw new IllegalArgumentException("Got " + columnNames.size() + " column names for " + columns.size() + " columns");
		}
		Map<String, Object> section = new LinkedHashMap<>();
		section.put("version", VERSION);
		section.put(ROW_COUNT, rowCount);
		section.put(COLUMN_NAMES, List.copyOf(columnNames));
		ObjectFile.write(directory, TYPE, Map.of(TYPE, section));
		Path columnDir = directory.resolve(COLUMNS_DIRECTORY);
		for (int i = 0; i < columns.size(); i++) {
			columns.get(i).save(columnDir.resolve(Integer.toString(i)));
		}
		if (annotations != null) {
			annotations.save(directory.resolve(ANNOTATIONS_DIRECTORY));
		}
		LOGGER.debug("Saved data frame with {} rows and {} columns to {}", rowCount, columns.size(), directory);
	}

	public static void validate(Path directory, ObjectMetadata metadata, ValidationContext context) {
		ObjectMetadata section = metadata.section(TYPE);
		String version = section.requireString("version");
		if (!VERSION.equals(version)) {
			throw section.malformed("version", "unsupported version '" + version + "'");
		}
		long rowCount = section.requireCount(ROW_COUNT);
		List<String> names = columnNames(section);

		List<Path> columns = IndexedDirectory.entries(directory.resolve(COLUMNS_DIRECTORY), COLUMNS_DIRECTORY, names.size());
		for (int i = 0; i < columns.size(); i++) {
			Path column = columns.get(i);
			ObjectMetadata columnMetadata = context.readNestedObjectFile(column);
			context.validate(column, columnMetadata);
			long height = context.height(column, columnMetadata);
			if (height != rowCount) {
				throw new InvalidObjectException("expected height of column " + i + " ('" + names.get(i) + "') to be " + rowCount + ", got " + height);
			}
		}

		Path annotations = directory.resolve(ANNOTATIONS_DIRECTORY);
		if (Files.exists(annotations)) {
			ObjectMetadata annotationMetadata = context.readNestedObjectFile(annotations);
			if (!context.satisfiesInterface(annotationMetadata.type(), SimpleListFormat.INTERFACE)) {
				throw new InvalidObjectException("expected '" + ANNOTATIONS_DIRECTORY + "' to satisfy the '"
					+ SimpleListFormat.INTERFACE + "' interface, but it is a '" + annotationMetadata.type() + "'");
			}
			context.validate(annotations, annotationMetadata);
		}
	}

	public static DataFrame read(Path directory, ObjectMetadata metadata, ObjectReader reader) {
		ObjectMetadata section = metadata.section(TYPE);
		long rowCount = section.requireCount(ROW_COUNT);
		List<String> names = columnNames(section);
		List<Object> columns = new ArrayList<>(names.size());
		for (Path column : IndexedDirectory.entries(directory.resolve(COLUMNS_DIRECTORY), COLUMNS_DIRECTORY, names.size())) {
			columns.add(reader.readObject(column));
		}
		Path annotationDir = directory.resolve(ANNOTATIONS_DIRECTORY);
		Object annotations = Files.exists(annotationDir) ? reader.readObject(annotationDir) : null;
		return new DataFrame(rowCount, names, columns, annotations);
	}

	public static long height(Path directory, ObjectMetadata metadata, ValidationContext context) {
		return metadata.section(TYPE).requireCount(ROW_COUNT);
	}

	public static List<Long> dimensions(Path directory, ObjectMetadata metadata, ValidationContext context) {
		ObjectMetadata section = metadata.section(TYPE);
		return List.of(section.requireCount(ROW_COUNT), (long) section.requireList(COLUMN_NAMES).size());
	}

	private static List<String> columnNames(ObjectMetadata section) {
		List<String> result = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		for (Object name : section.requireList(COLUMN_NAMES)) {
			if (!(name instanceof String)) {
				throw section.malformed(COLUMN_NAMES, "expected an array of strings");
			}
			String s = (String) name;
			if (s.isEmpty()) {
				throw new InvalidObjectException("column names should not be empty");
			}
			if (!seen.add(s)) {
				throw new InvalidObjectException("duplicated column name '" + s + "'");
			}
			result.add(s);
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DataFrameFormat.class);
}

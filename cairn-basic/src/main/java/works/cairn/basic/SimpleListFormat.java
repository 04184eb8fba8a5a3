package works.cairn.basic;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.cairn.ObjectFile;
import works.cairn.ObjectMetadata;
import works.cairn.ObjectReader;
import works.cairn.ValidationContext;

/**
 * An ordered list of arbitrary objects.
 * <p>
 * Element {@code i} is saved as its own object in {@code other_contents/i}.
 */
public final class SimpleListFormat {
	public static final String TYPE = "simple_list";
	public static final String INTERFACE = "SIMPLE_LIST";
	public static final String VERSION = "1.0";
	public static final String CONTENTS_DIRECTORY = "other_contents";

	private SimpleListFormat() { }

	public static ObjectWriter writer(List<ObjectWriter> elements) {
		return directory -> save(directory, elements);
	}

	public static void save(Path directory, List<ObjectWriter> elements) throws IOException {
		ObjectFile.write(directory, TYPE, Map.of(TYPE, Map.of(
			"version", VERSION,
			"length", elements.size()
		)));
		Path contents = directory.resolve(CONTENTS_DIRECTORY);
		for (int i = 0; i < elements.size(); i++) {
			elements.get(i).save(contents.resolve(Integer.toString(i)));
		}
		LOGGER.debug("Saved list of {} elements to {}", elements.size(), directory);
	}

	public static void validate(Path directory, ObjectMetadata metadata, ValidationContext context) {
		ObjectMetadata section = metadata.section(TYPE);
		String version = section.requireString("version");
		if (!VERSION.equals(version)) {
			throw section.malformed("version", "unsupported version '" + version + "'");
		}
		long length = section.requireCount("length");
		Path contents = directory.resolve(CONTENTS_DIRECTORY);
		List<Path> elements = IndexedDirectory.entries(contents, CONTENTS_DIRECTORY, length);
		for (Path element : elements) {
			context.validate(element);
		}
	}

	/**
	 * @return the elements, each read with whatever function is registered for its type
	 */
	public static List<Object> read(Path directory, ObjectMetadata metadata, ObjectReader reader) {
		long length = metadata.section(TYPE).requireCount("length");
		List<Object> result = new ArrayList<>();
		for (Path element : IndexedDirectory.entries(directory.resolve(CONTENTS_DIRECTORY), CONTENTS_DIRECTORY, length)) {
			result.add(reader.readObject(element));
		}
		return Collections.unmodifiableList(result);
	}

	public static long height(Path directory, ObjectMetadata metadata, ValidationContext context) {
		return metadata.section(TYPE).requireCount("length");
	}

	public static List<Long> dimensions(Path directory, ObjectMetadata metadata, ValidationContext context) {
		return List.of(height(directory, metadata, context));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SimpleListFormat.class);
}

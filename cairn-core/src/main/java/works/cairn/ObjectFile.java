package works.cairn;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The metadata file inside each object directory.
 * It always has a {@code type} field naming the object type;
 * each type may add its own fields.
 */
public final class ObjectFile {
	public static final String DEFAULT_NAME = "OBJECT";

	private ObjectFile() { }

	public static ObjectMetadata read(Path directory) {
		return read(directory, DEFAULT_NAME);
	}

	/**
	 * @throws works.cairn.exceptions.MalformedMetadataException if the file is missing,
	 * unparseable, or lacks a string {@code type}
	 */
	public static ObjectMetadata read(Path directory, String fileName) {
		Path file = directory.resolve(fileName);
		ObjectMetadata result = ObjectMetadata.of(file, MetadataFiles.readDocument(file));
		result.type();
		return result;
	}

	public static boolean exists(Path directory, String fileName) {
		return Files.isRegularFile(directory.resolve(fileName));
	}

	public static void write(Path directory, String type, Map<String, ?> extra) throws IOException {
		write(directory, DEFAULT_NAME, type, extra);
	}

	/**
	 * @param extra additional fields; must not contain {@code type}
	 */
	public static void write(Path directory, String fileName, String type, Map<String, ?> extra) throws IOException {
		if (extra.containsKey(ObjectMetadata.TYPE)) {
			throw new IllegalArgumentException("Extra metadata must not contain \"" + ObjectMetadata.TYPE + "\"");
		}
		Map<String, Object> document = new LinkedHashMap<>();
		document.put(ObjectMetadata.TYPE, type);
		document.putAll(extra);
		Files.createDirectories(directory);
		MetadataFiles.writeDocument(directory.resolve(fileName), document);
	}
}

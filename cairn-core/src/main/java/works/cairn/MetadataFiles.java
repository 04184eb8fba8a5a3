package works.cairn;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.cairn.exceptions.MalformedMetadataException;

import static tools.jackson.databind.SerializationFeature.INDENT_OUTPUT;

/**
 * Reads and writes the JSON documents that hold object metadata.
 * <p>
 * Each read opens the file, parses it, and closes it before returning,
 * so a validation pass holds at most one document open at a time.
 */
public final class MetadataFiles {
	private static final ObjectMapper MAPPER = JsonMapper.builder()
		.enable(INDENT_OUTPUT)
		.build();

	private MetadataFiles() { }

	/**
	 * @return the top-level JSON object in {@code file}
	 * @throws MalformedMetadataException if the file is missing, unreadable,
	 * not valid JSON, or not a JSON object
	 */
	public static Map<String, Object> readDocument(Path file) {
		byte[] bytes;
		try {
			bytes = Files.readAllBytes(file);
		} catch (NoSuchFileException e) {
			throw new MalformedMetadataException(file, null, "file does not exist", e);
		} catch (IOException e) {
			throw new MalformedMetadataException(file, null, "unable to read file", e);
		}
		Object parsed;
		try {
			parsed = MAPPER.readValue(bytes, Object.class);
		} catch (JacksonException e) {
			throw new MalformedMetadataException(file, null, "invalid JSON", e);
		}
		if (parsed instanceof Map) {
			@SuppressWarnings("unchecked")
			Map<String, Object> result = (Map<String, Object>) parsed;
			if (LOGGER.isTraceEnabled()) {
				LOGGER.trace("Read {}: {}", file, result);
			}
			return result;
		} else {
			throw new MalformedMetadataException(file, null, "expected a JSON object");
		}
	}

	public static void writeDocument(Path file, Map<String, ?> document) throws IOException {
		byte[] bytes;
		try {
			bytes = MAPPER.writeValueAsBytes(document);
		} catch (JacksonException e) {
			throw new IOException("Unable to serialize metadata for " + file, e);
		}
		Files.write(file, bytes);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MetadataFiles.class);
}

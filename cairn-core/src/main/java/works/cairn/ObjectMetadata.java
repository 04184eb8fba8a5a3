package works.cairn;

import java.math.BigInteger;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import works.cairn.exceptions.MalformedMetadataException;

import static java.util.Objects.requireNonNull;

/**
 * Read-only view of a metadata document, or of one nested section of it.
 * <p>
 * Only {@code type} is understood by the core; all other fields belong to
 * the handlers for that type. The typed accessors throw
 * {@link MalformedMetadataException} naming the source file and the
 * dotted path of the offending field, so handlers don't need to assemble
 * that context themselves.
 */
public final class ObjectMetadata {
	public static final String TYPE = "type";

	private final Path source;
	private final String prefix;
	private final Map<String, Object> fields;

	private ObjectMetadata(Path source, String prefix, Map<String, Object> fields) {
		this.source = source;
		this.prefix = prefix;
		this.fields = fields;
	}

	/**
	 * @param source the file the fields were read from; used only in error messages
	 */
	public static ObjectMetadata of(Path source, Map<String, ?> fields) {
		return new ObjectMetadata(requireNonNull(source), "", Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
	}

	public Path source() {
		return source;
	}

	public Map<String, Object> asMap() {
		return fields;
	}

	/**
	 * @throws MalformedMetadataException if there is no string-valued {@code type} field
	 */
	public String type() {
		return requireString(TYPE);
	}

	public boolean has(String field) {
		return fields.get(field) != null;
	}

	public Optional<Object> get(String field) {
		return Optional.ofNullable(fields.get(field));
	}

	public ObjectMetadata section(String field) {
		return optionalSection(field).orElseThrow(() -> malformed(field, "expected an object"));
	}

	public Optional<ObjectMetadata> optionalSection(String field) {
		Object value = fields.get(field);
		if (value == null) {
			return Optional.empty();
		} else if (value instanceof Map) {
			@SuppressWarnings("unchecked")
			Map<String, Object> map = (Map<String, Object>) value;
			return Optional.of(new ObjectMetadata(source, qualified(field) + ".", Collections.unmodifiableMap(map)));
		} else {
			throw malformed(field, "expected an object");
		}
	}

	public String requireString(String field) {
		return optionalString(field).orElseThrow(() -> malformed(field, "expected a string"));
	}

	public Optional<String> optionalString(String field) {
		Object value = fields.get(field);
		if (value == null) {
			return Optional.empty();
		} else if (value instanceof String) {
			return Optional.of((String) value);
		} else {
			throw malformed(field, "expected a string");
		}
	}

	public long requireLong(String field) {
		Object value = fields.get(field);
		if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
			return ((Number) value).longValue();
		} else if (value instanceof BigInteger && ((BigInteger) value).bitLength() < Long.SIZE) {
			return ((BigInteger) value).longValue();
		} else {
			throw malformed(field, "expected an integer");
		}
	}

	/**
	 * Like {@link #requireLong} but also rejects negative values.
	 */
	public long requireCount(String field) {
		long result = requireLong(field);
		if (result < 0) {
			throw malformed(field, "expected a non-negative integer");
		}
		return result;
	}

	public Optional<Boolean> optionalBoolean(String field) {
		Object value = fields.get(field);
		if (value == null) {
			return Optional.empty();
		} else if (value instanceof Boolean) {
			return Optional.of((Boolean) value);
		} else {
			throw malformed(field, "expected a boolean");
		}
	}

	public List<?> requireList(String field) {
		Object value = fields.get(field);
		if (value instanceof List) {
			return Collections.unmodifiableList((List<?>) value);
		} else {
			throw malformed(field, "expected an array");
		}
	}

	/**
	 * Builds, but does not throw, an exception pointing at {@code field} in this document.
	 */
	public MalformedMetadataException malformed(String field, String message) {
		return new MalformedMetadataException(source, qualified(field), message);
	}

	private String qualified(String field) {
		return prefix + field;
	}

	@Override
	public String toString() {
		return "ObjectMetadata(" + source + (prefix.isEmpty() ? "" : ", " + prefix) + ")" + fields;
	}
}

package works.cairn.basic;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import works.cairn.ObjectMetadata;
import works.cairn.storage.Placeholder;
import works.cairn.storage.Placeholder.FloatPlaceholder;
import works.cairn.storage.Placeholder.IntegerPlaceholder;
import works.cairn.storage.Placeholder.StringPlaceholder;
import works.cairn.storage.StorageEncoding;
import works.cairn.storage.StorageType;
import works.cairn.storage.StorageType.FloatType;
import works.cairn.storage.StorageType.IntegerType;
import works.cairn.storage.StorageType.StringType;
import works.cairn.storage.TextEncoding;

/**
 * Records a {@link StorageEncoding} in metadata, and reads it back.
 * <p>
 * The {@code storage} section has a {@code container} naming the type,
 * {@code size} and {@code charset} for strings, and an optional {@code placeholder}.
 * JSON has no literals for the non-finite doubles, so they are written as the strings
 * {@code "NaN"}, {@code "Inf"} and {@code "-Inf"}.
 */
final class StorageDescriptors {
	static final String CONTAINER = "container";
	static final String SIZE = "size";
	static final String CHARSET = "charset";
	static final String PLACEHOLDER = "placeholder";

	private StorageDescriptors() { }

	static Map<String, Object> toMap(StorageEncoding encoding) {
		Map<String, Object> result = new LinkedHashMap<>();
		StorageType type = encoding.type();
		result.put(CONTAINER, type.descriptor());
		if (type instanceof StringType) {
			result.put(SIZE, ((StringType) type).size());
			result.put(CHARSET, ((StringType) type).charset().tag());
		}
		Placeholder placeholder = encoding.placeholder();
		if (placeholder instanceof IntegerPlaceholder) {
			result.put(PLACEHOLDER, ((IntegerPlaceholder) placeholder).value());
		} else if (placeholder instanceof FloatPlaceholder) {
			result.put(PLACEHOLDER, numberToJson(((FloatPlaceholder) placeholder).value()));
		} else if (placeholder instanceof StringPlaceholder) {
			result.put(PLACEHOLDER, ((StringPlaceholder) placeholder).value());
		}
		return result;
	}

	/**
	 * @throws works.cairn.exceptions.MalformedMetadataException if the section doesn't describe
	 * a valid encoding, or the placeholder doesn't fit the container
	 */
	static StorageEncoding fromMetadata(ObjectMetadata storage) {
		String container = storage.requireString(CONTAINER);
		StorageType type;
		if ("string".equals(container)) {
			long size = storage.requireCount(SIZE);
			if (size < 1 || size > Integer.MAX_VALUE) {
				throw storage.malformed(SIZE, "string width must be between 1 and " + Integer.MAX_VALUE);
			}
			TextEncoding charset;
			try {
				charset = TextEncoding.fromTag(storage.requireString(CHARSET));
			} catch (IllegalArgumentException e) {
				throw storage.malformed(CHARSET, e.getMessage());
			}
			type = new StringType((int) size, charset);
		} else if (container.startsWith("float")) {
			if ("float32".equals(container)) {
				type = FloatType.FLOAT32;
			} else if ("float64".equals(container)) {
				type = FloatType.FLOAT64;
			} else {
				throw storage.malformed(CONTAINER, "unknown container type '" + container + "'");
			}
		} else {
			try {
				type = IntegerType.fromDescriptor(container);
			} catch (IllegalArgumentException e) {
				throw storage.malformed(CONTAINER, "unknown container type '" + container + "'");
			}
		}

		Optional<Object> placeholderValue = storage.get(PLACEHOLDER);
		if (placeholderValue.isEmpty()) {
			return StorageEncoding.of(type);
		}
		Object value = placeholderValue.get();
		Placeholder placeholder;
		if (type instanceof IntegerType) {
			Optional<Long> integer = integerValue(value);
			if (integer.isEmpty() || !((IntegerType) type).contains(integer.get())) {
				throw storage.malformed(PLACEHOLDER, "expected an integer that fits in " + type.descriptor());
			}
			placeholder = new IntegerPlaceholder(integer.get());
		} else if (type instanceof FloatType) {
			Optional<Double> number = numberFromJson(value);
			if (number.isEmpty() || !((FloatType) type).represents(number.get())) {
				throw storage.malformed(PLACEHOLDER, "expected a number that fits in " + type.descriptor());
			}
			placeholder = new FloatPlaceholder(number.get());
		} else {
			if (!(value instanceof String)) {
				throw storage.malformed(PLACEHOLDER, "expected a string");
			}
			placeholder = new StringPlaceholder((String) value);
		}
		return new StorageEncoding(type, placeholder);
	}

	static Object numberToJson(double value) {
		if (Double.isNaN(value)) {
			return "NaN";
		} else if (value == Double.POSITIVE_INFINITY) {
			return "Inf";
		} else if (value == Double.NEGATIVE_INFINITY) {
			return "-Inf";
		} else {
			return value;
		}
	}

	/**
	 * @return empty if {@code value} is neither a JSON number nor one of the non-finite spellings
	 */
	static Optional<Double> numberFromJson(Object value) {
		if (value instanceof Number) {
			return Optional.of(((Number) value).doubleValue());
		} else if ("NaN".equals(value)) {
			return Optional.of(Double.NaN);
		} else if ("Inf".equals(value)) {
			return Optional.of(Double.POSITIVE_INFINITY);
		} else if ("-Inf".equals(value)) {
			return Optional.of(Double.NEGATIVE_INFINITY);
		} else {
			return Optional.empty();
		}
	}

	/**
	 * @return empty unless {@code value} is a JSON integer that fits in a {@code long}
	 */
	static Optional<Long> integerValue(Object value) {
		if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
			return Optional.of(((Number) value).longValue());
		} else if (value instanceof BigInteger && ((BigInteger) value).bitLength() < Long.SIZE) {
			return Optional.of(((BigInteger) value).longValue());
		} else {
			return Optional.empty();
		}
	}
}

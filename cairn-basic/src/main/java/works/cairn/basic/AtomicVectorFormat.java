package works.cairn.basic;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.cairn.MetadataFiles;
import works.cairn.ObjectFile;
import works.cairn.ObjectMetadata;
import works.cairn.ObjectReader;
import works.cairn.ValidationContext;
import works.cairn.basic.AtomicVector.BooleanVector;
import works.cairn.basic.AtomicVector.IntegerVector;
import works.cairn.basic.AtomicVector.NumberVector;
import works.cairn.basic.AtomicVector.StringVector;
import works.cairn.basic.AtomicVector.ValueKind;
import works.cairn.exceptions.InvalidObjectException;
import works.cairn.exceptions.MalformedMetadataException;
import works.cairn.storage.PlaceholderSubstitution;
import works.cairn.storage.StorageEncoding;
import works.cairn.storage.StorageOptimizer;
import works.cairn.storage.StorageType;
import works.cairn.storage.StorageType.FloatType;
import works.cairn.storage.StorageType.IntegerType;
import works.cairn.storage.StorageType.StringType;
import works.cairn.storage.StringColumn;
import works.cairn.storage.TextEncoding;

/**
 * A single column of integers, numbers, strings or booleans.
 * <p>
 * The object file carries an {@code atomic_vector} section with
 * {@code version}, {@code type}, {@code length} and {@code storage};
 * the stored values, with placeholders in place of missing values,
 * are the {@code values} array of {@code contents.json}.
 */
public final class AtomicVectorFormat {
	public static final String TYPE = "atomic_vector";
	public static final String VERSION = "1.0";
	public static final String CONTENTS = "contents.json";

	static final String VALUES = "values";
	static final String STORAGE = "storage";

	private AtomicVectorFormat() { }

	public static ObjectWriter writer(AtomicVector vector) {
		return directory -> save(directory, vector);
	}

	public static void save(Path directory, AtomicVector vector) throws IOException {
		StorageEncoding encoding;
		List<Object> stored = new ArrayList<>(vector.length());
		if (vector instanceof IntegerVector) {
			IntegerVector v = (IntegerVector) vector;
			encoding = StorageOptimizer.optimizeIntegers(v.values());
			for (long value : PlaceholderSubstitution.substituteIntegers(v.values(), encoding)) {
				stored.add(value);
			}
		} else if (vector instanceof NumberVector) {
			NumberVector v = (NumberVector) vector;
			encoding = StorageOptimizer.optimizeNumbers(v.values());
			boolean integerContainer = encoding.type() instanceof IntegerType;
			for (double value : PlaceholderSubstitution.substituteNumbers(v.values(), encoding)) {
				stored.add(integerContainer ? (Object) (long) value : StorageDescriptors.numberToJson(value));
			}
		} else if (vector instanceof StringVector) {
			StringVector v = (StringVector) vector;
			encoding = StorageOptimizer.optimizeStrings(v.values());
			stored.addAll(PlaceholderSubstitution.substituteStrings(v.values(), encoding));
		} else {
			BooleanVector v = (BooleanVector) vector;
			encoding = StorageOptimizer.optimizeBooleans(v.values());
			for (long value : PlaceholderSubstitution.substituteBooleans(v.values(), encoding)) {
				stored.add(value);
			}
		}

		Map<String, Object> section = new LinkedHashMap<>();
		section.put("version", VERSION);
		section.put(ObjectMetadata.TYPE, vector.kind().tag());
		section.put("length", vector.length());
		section.put(STORAGE, StorageDescriptors.toMap(encoding));
		ObjectFile.write(directory, TYPE, Map.of(TYPE, section));
		MetadataFiles.writeDocument(directory.resolve(CONTENTS), Map.of(VALUES, stored));
		LOGGER.debug("Saved {} {} values to {} as {}", vector.length(), vector.kind().tag(), directory, encoding);
	}

	/**
	 * Reads back a vector written by {@link #save}. Does not validate it.
	 */
	public static AtomicVector read(Path directory) {
		return read(directory, ObjectFile.read(directory));
	}

	public static AtomicVector read(Path directory, ObjectMetadata metadata, ObjectReader reader) {
		return read(directory, metadata);
	}

	private static AtomicVector read(Path directory, ObjectMetadata metadata) {
		ObjectMetadata section = metadata.section(TYPE);
		ValueKind kind = kind(section);
		StorageEncoding encoding = StorageDescriptors.fromMetadata(section.section(STORAGE));
		ObjectMetadata contents = readContents(directory);
		List<?> values = contents.requireList(VALUES);
		switch (kind) {
			case INTEGER: {
				long[] stored = new long[values.size()];
				for (int i = 0; i < stored.length; i++) {
					stored[i] = StorageDescriptors.integerValue(values.get(i))
						.orElseThrow(() -> contents.malformed(VALUES, "expected integers"));
				}
				return new IntegerVector(PlaceholderSubstitution.restoreIntegers(stored, encoding));
			}
			case NUMBER: {
				double[] stored = new double[values.size()];
				for (int i = 0; i < stored.length; i++) {
					stored[i] = StorageDescriptors.numberFromJson(values.get(i))
						.orElseThrow(() -> contents.malformed(VALUES, "expected numbers"));
				}
				return new NumberVector(PlaceholderSubstitution.restoreNumbers(stored, encoding));
			}
			case STRING: {
				List<String> stored = new ArrayList<>(values.size());
				for (Object value : values) {
					if (!(value instanceof String)) {
						throw contents.malformed(VALUES, "expected strings");
					}
					stored.add((String) value);
				}
				return new StringVector(StringColumn.of(TextEncoding.UTF8, PlaceholderSubstitution.restoreStrings(stored, encoding)));
			}
			case BOOLEAN: {
				long[] stored = new long[values.size()];
				for (int i = 0; i < stored.length; i++) {
					stored[i] = StorageDescriptors.integerValue(values.get(i))
						.orElseThrow(() -> contents.malformed(VALUES, "expected integers"));
				}
				return new BooleanVector(PlaceholderSubstitution.restoreBooleans(stored, encoding));
			}
			default:
				throw new AssertionError("Unexpected kind: " + kind);
		}
	}

	public static void validate(Path directory, ObjectMetadata metadata, ValidationContext context) {
		ObjectMetadata section = metadata.section(TYPE);
		String version = section.requireString("version");
		if (!VERSION.equals(version)) {
			throw section.malformed("version", "unsupported version '" + version + "'");
		}
		ValueKind kind = kind(section);
		long length = section.requireCount("length");
		ObjectMetadata storage = section.section(STORAGE);
		StorageEncoding encoding = StorageDescriptors.fromMetadata(storage);
		requireCompatible(storage, kind, encoding.type());

		ObjectMetadata contents = readContents(directory);
		List<?> values = contents.requireList(VALUES);
		if (values.size() != length) {
			throw new InvalidObjectException("number of values (" + values.size() + ") does not match the declared length (" + length + ")");
		}
		StorageType type = encoding.type();
		for (int i = 0; i < values.size(); i++) {
			Object value = values.get(i);
			if (!fits(value, type)) {
				throw new InvalidObjectException("value " + i + " (" + value + ") does not fit in the '" + type.descriptor() + "' container");
			}
		}
	}

	public static long height(Path directory, ObjectMetadata metadata, ValidationContext context) {
		return metadata.section(TYPE).requireCount("length");
	}

	public static List<Long> dimensions(Path directory, ObjectMetadata metadata, ValidationContext context) {
		return List.of(height(directory, metadata, context));
	}

	private static ValueKind kind(ObjectMetadata section) {
		String tag = section.requireString(ObjectMetadata.TYPE);
		for (ValueKind kind : ValueKind.values()) {
			if (kind.tag().equals(tag)) {
				return kind;
			}
		}
		throw section.malformed(ObjectMetadata.TYPE, "unknown vector type '" + tag + "'");
	}

	private static void requireCompatible(ObjectMetadata storage, ValueKind kind, StorageType type) {
		boolean compatible;
		switch (kind) {
			case INTEGER:
				compatible = type instanceof IntegerType;
				break;
			case NUMBER:
				compatible = type instanceof IntegerType || type instanceof FloatType;
				break;
			case STRING:
				compatible = type instanceof StringType;
				break;
			case BOOLEAN:
				compatible = IntegerType.INT8.equals(type);
				break;
			default:
				throw new AssertionError("Unexpected kind: " + kind);
		}
		if (!compatible) {
			throw storage.malformed(StorageDescriptors.CONTAINER,
				"container '" + type.descriptor() + "' cannot hold " + kind.tag() + " values");
		}
	}

	private static boolean fits(Object value, StorageType type) {
		if (type instanceof IntegerType) {
			Optional<Long> integer = StorageDescriptors.integerValue(value);
			return integer.isPresent() && ((IntegerType) type).contains(integer.get());
		} else if (type instanceof FloatType) {
			Optional<Double> number = StorageDescriptors.numberFromJson(value);
			return number.isPresent() && ((FloatType) type).represents(number.get());
		} else {
			StringType stringType = (StringType) type;
			if (!(value instanceof String)) {
				return false;
			}
			String s = (String) value;
			if (stringType.charset() == TextEncoding.ASCII && !s.chars().allMatch(c -> c <= 0x7F)) {
				return false;
			}
			return s.getBytes(StandardCharsets.UTF_8).length <= stringType.size();
		}
	}

	/**
	 * @throws MalformedMetadataException if the contents file is missing or unreadable
	 */
	private static ObjectMetadata readContents(Path directory) {
		Path file = directory.resolve(CONTENTS);
		if (!Files.isRegularFile(file)) {
			throw new MalformedMetadataException(file, null, "expected a '" + CONTENTS + "' file");
		}
		return ObjectMetadata.of(file, MetadataFiles.readDocument(file));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AtomicVectorFormat.class);
}

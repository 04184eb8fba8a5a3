package works.cairn.storage;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import works.cairn.storage.Placeholder.FloatPlaceholder;
import works.cairn.storage.Placeholder.IntegerPlaceholder;
import works.cairn.storage.Placeholder.StringPlaceholder;
import works.cairn.storage.StorageType.FloatType;
import works.cairn.storage.StorageType.IntegerType;
import works.cairn.storage.StorageType.StringType;

/**
 * A container type, plus the placeholder used for missing values if there are any.
 */
public record StorageEncoding(StorageType type, @Nullable Placeholder placeholder) {
	public StorageEncoding {
		if (placeholder != null && !compatible(type, placeholder)) {
			throw new IllegalArgumentException("Placeholder " + placeholder + " does not match type " + type);
		}
	}

	public static StorageEncoding of(StorageType type) {
		return new StorageEncoding(type, null);
	}

	public Optional<Placeholder> optionalPlaceholder() {
		return Optional.ofNullable(placeholder);
	}

	private static boolean compatible(StorageType type, Placeholder placeholder) {
		if (type instanceof IntegerType) {
			return placeholder instanceof IntegerPlaceholder
				&& ((IntegerType) type).contains(((IntegerPlaceholder) placeholder).value());
		} else if (type instanceof FloatType) {
			return placeholder instanceof FloatPlaceholder;
		} else if (type instanceof StringType) {
			return placeholder instanceof StringPlaceholder;
		} else {
			return false;
		}
	}
}

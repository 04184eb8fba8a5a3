package works.cairn;

import java.nio.file.Path;

/**
 * Checks the on-disk representation of one object type.
 * <p>
 * Implementations throw {@link works.cairn.exceptions.InvalidObjectException}
 * (or a subclass) if the object at {@code path} is invalid.
 * Nested objects are checked by calling {@link ValidationContext#validate(Path)}.
 */
@FunctionalInterface
public interface ValidateFunction {
	void validate(Path path, ObjectMetadata metadata, ValidationContext context);
}

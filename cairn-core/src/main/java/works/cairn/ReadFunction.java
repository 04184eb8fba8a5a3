package works.cairn;

import java.nio.file.Path;

/**
 * Loads one object type from disk into memory.
 * Nested objects are loaded by calling {@link ObjectReader#readObject(Path)}.
 */
@FunctionalInterface
public interface ReadFunction {
	Object read(Path path, ObjectMetadata metadata, ObjectReader reader);
}

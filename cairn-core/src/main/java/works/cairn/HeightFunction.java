package works.cairn;

import java.nio.file.Path;

/**
 * Reports the "height" of an object: its length if it's vector-like,
 * or the extent of its first dimension otherwise.
 * Containers use this to check that their elements have the extent they declare.
 */
@FunctionalInterface
public interface HeightFunction {
	long height(Path path, ObjectMetadata metadata, ValidationContext context);
}

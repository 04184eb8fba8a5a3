package works.cairn.basic;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Saves one object into a directory, creating the directory if needed.
 * Container formats use these to save their children without knowing their types.
 */
@FunctionalInterface
public interface ObjectWriter {
	void save(Path directory) throws IOException;
}

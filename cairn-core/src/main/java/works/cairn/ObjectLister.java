package works.cairn;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the objects saved under a directory.
 * <p>
 * A directory containing an object file is an object.
 * Directories beneath an object belong to that object and are its children;
 * directories beneath anything else are searched for further top-level objects.
 */
public final class ObjectLister {
	private final String objectFileName;

	public ObjectLister() {
		this(ObjectFile.DEFAULT_NAME);
	}

	public ObjectLister(String objectFileName) {
		this.objectFileName = objectFileName;
	}

	/**
	 * @param path relative to the listing root, using {@code /} as the separator
	 * @param child true if this object lies inside another object's directory
	 */
	public record ObjectListing(String path, String type, boolean child) { }

	/**
	 * @param includeChildren if false, only top-level objects are returned
	 * and the contents of object directories are not searched
	 * @return objects ordered by path
	 */
	public List<ObjectListing> listObjects(Path root, boolean includeChildren) {
		List<ObjectListing> result = new ArrayList<>();
		traverse(root, root, false, includeChildren, result);
		result.sort(Comparator.comparing(ObjectListing::path));
		return List.copyOf(result);
	}

	private void traverse(Path root, Path dir, boolean insideObject, boolean includeChildren, List<ObjectListing> result) {
		boolean isObject = ObjectFile.exists(dir, objectFileName);
		if (isObject) {
			String type = ObjectFile.read(dir, objectFileName).type();
			String relative = relativeName(root, dir);
			LOGGER.debug("Found {} '{}' at '{}'", insideObject ? "child" : "object", type, relative);
			result.add(new ObjectListing(relative, type, insideObject));
			if (!includeChildren) {
				return;
			}
		}
		for (Path sub : subdirectories(dir)) {
			traverse(root, sub, insideObject || isObject, includeChildren, result);
		}
	}

	private static List<Path> subdirectories(Path dir) {
		try (Stream<Path> entries = Files.list(dir)) {
			return entries
				.filter(Files::isDirectory)
				.sorted()
				.collect(Collectors.toList());
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to list directory " + dir, e);
		}
	}

	static String relativeName(Path root, Path path) {
		if (root.equals(path)) {
			return ".";
		}
		List<String> parts = new ArrayList<>();
		for (Path part : root.relativize(path)) {
			parts.add(part.toString());
		}
		return String.join("/", parts);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ObjectLister.class);
}

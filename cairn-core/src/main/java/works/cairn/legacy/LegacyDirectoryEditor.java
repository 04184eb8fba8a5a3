package works.cairn.legacy;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.cairn.MetadataFiles;
import works.cairn.ObjectMetadata;
import works.cairn.exceptions.RedirectionException;

import static works.cairn.exceptions.RedirectionException.Reason.DANGLING;
import static works.cairn.legacy.LegacyDirectoryValidator.dirname;
import static works.cairn.legacy.LegacyDirectoryValidator.isDocument;
import static works.cairn.legacy.LegacyDirectoryValidator.isHidden;
import static works.cairn.legacy.LegacyDirectoryValidator.isStrictlyInside;
import static works.cairn.legacy.LegacyDirectoryValidator.resolve;

/**
 * Moves and removes top-level objects in a legacy directory,
 * keeping their documents and any redirections to them consistent.
 * <p>
 * An object is named either by its resource path or by a redirection to it.
 * Each operation acts on the whole directory holding the object's resource,
 * so children move or disappear along with their parent.
 * Only redirections stored next to that directory are updated.
 */
public final class LegacyDirectoryEditor {

	/**
	 * Moves the directory holding {@code from} to {@code to}.
	 * Every document inside has its {@code path}, and any local {@code resource.path}
	 * under the old directory, rewritten to the new location.
	 *
	 * @param renameRedirections if true, a redirection to the object is renamed to {@code to}
	 * @throws IllegalArgumentException if {@code from} is a child, or can't be moved to {@code to}
	 * @throws FileAlreadyExistsException if {@code to} already exists
	 * @throws works.cairn.exceptions.MalformedMetadataException if a document in the object's directory
	 * doesn't describe something inside it
	 */
	public void moveObject(Path root, String from, String to, boolean renameRedirections) throws IOException {
		LegacyDocument document = topLevelDocument(root, from, "cannot move a child object without moving the parent");
		String refpath = document.path();
		String oldDir = dirname(refpath);
		if (to.isEmpty() || to.equals(oldDir) || isStrictlyInside(to, oldDir)) {
			throw new IllegalArgumentException("cannot move '" + oldDir + "' to '" + to + "'");
		}
		Path source = resolve(root, oldDir);
		Path target = resolve(root, to);
		if (Files.exists(target)) {
			throw new FileAlreadyExistsException(target.toString(), null, "cannot move an object over an existing path");
		}

		String fromSlash = oldDir + "/";
		String toSlash = to + "/";
		List<Path> contents;
		try (Stream<Path> walk = Files.walk(source)) {
			contents = walk.collect(Collectors.toList());
		}

		// All documents are rewritten in memory before anything on disk changes
		Map<Path, Map<String, Object>> rewritten = new LinkedHashMap<>();
		for (Path file : contents) {
			Path relative = source.relativize(file);
			if (Files.isRegularFile(file) && isDocument(file.getFileName().toString()) && !isHidden(relative)) {
				rewritten.put(relative, movedDocument(file, fromSlash, toSlash));
			}
		}

		for (Path file : contents) {
			Path relative = source.relativize(file);
			Path destination = target.resolve(relative.toString());
			if (Files.isDirectory(file)) {
				Files.createDirectories(destination);
			} else if (rewritten.containsKey(relative)) {
				MetadataFiles.writeDocument(destination, rewritten.get(relative));
			} else {
				Files.move(file, destination);
			}
		}
		deleteRecursively(source);

		String newRefpath = toSlash + refpath.substring(fromSlash.length());
		for (Path file : redirectionFiles(root, dirname(oldDir))) {
			Map<String, Object> redirection = MetadataFiles.readDocument(file);
			List<Object> targets = targets(file, redirection);
			int index = indexOfLocalTarget(targets, refpath);
			if (index < 0) {
				continue;
			}
			Map<String, Object> entry = stringKeyed(targets.get(index));
			entry.put("location", newRefpath);
			targets.set(index, entry);
			Map<String, Object> updated = withTargets(redirection, targets);
			Path destination = file;
			if (renameRedirections) {
				updated.put(LegacyDocument.PATH, to);
				Files.delete(file);
				destination = resolve(root, to + ".json");
				Files.createDirectories(destination.getParent());
			}
			MetadataFiles.writeDocument(destination, updated);
			LOGGER.debug("Redirection {} now leads to '{}'", destination, newRefpath);
		}
		LOGGER.debug("Moved '{}' to '{}' in {}", oldDir, to, root);
	}

	/**
	 * Deletes the directory holding {@code path}, then drops redirections to it.
	 * A redirection left with no targets is deleted.
	 *
	 * @throws IllegalArgumentException if {@code path} is a child
	 */
	public void removeObject(Path root, String path) throws IOException {
		LegacyDocument document = topLevelDocument(root, path, "cannot remove a child object without removing the parent");
		String refpath = document.path();
		String oldDir = dirname(refpath);
		deleteRecursively(resolve(root, oldDir));

		for (Path file : redirectionFiles(root, dirname(oldDir))) {
			Map<String, Object> redirection = MetadataFiles.readDocument(file);
			List<Object> targets = targets(file, redirection);
			List<Object> survivors = new ArrayList<>();
			for (Object target : targets) {
				if (!isLocalTarget(target, refpath)) {
					survivors.add(target);
				}
			}
			if (survivors.size() == targets.size()) {
				continue;
			}
			if (survivors.isEmpty()) {
				Files.delete(file);
				LOGGER.debug("Deleted redirection {}", file);
			} else {
				MetadataFiles.writeDocument(file, withTargets(redirection, survivors));
			}
		}
		LOGGER.debug("Removed '{}' from {}", oldDir, root);
	}

	private static LegacyDocument topLevelDocument(Path root, String path, String childMessage) throws IOException {
		LegacyDocument document = findDocument(root, path);
		if (document.child()) {
			throw new IllegalArgumentException(childMessage);
		}
		if (dirname(document.path()).isEmpty()) {
			throw new IllegalArgumentException("object '" + document.path() + "' has no directory of its own");
		}
		return document;
	}

	/**
	 * Looks for {@code path.json}, then for {@code path} itself if it's a document,
	 * following redirections to their first local target.
	 */
	static LegacyDocument findDocument(Path root, String path) throws IOException {
		Set<String> visited = new HashSet<>();
		String current = path;
		while (true) {
			String location = documentLocation(root, current);
			Path file = resolve(root, location);
			LegacyDocument document = LegacyDocument.parse(location, ObjectMetadata.of(file, MetadataFiles.readDocument(file)));
			if (!document.redirection()) {
				return document;
			}
			if (document.redirectTargets().isEmpty() || !visited.add(location)) {
				throw new RedirectionException(DANGLING, current,
					"redirection in '" + location + "' does not lead to an object");
			}
			current = document.redirectTargets().get(0);
		}
	}

	private static String documentLocation(Path root, String path) throws NoSuchFileException {
		String sibling = path + ".json";
		if (Files.isRegularFile(resolve(root, sibling))) {
			return sibling;
		}
		if (isDocument(path) && Files.isRegularFile(resolve(root, path))) {
			return path;
		}
		throw new NoSuchFileException(resolve(root, sibling).toString(), null, "no metadata for '" + path + "'");
	}

	private static Map<String, Object> movedDocument(Path file, String fromSlash, String toSlash) {
		ObjectMetadata metadata = ObjectMetadata.of(file, MetadataFiles.readDocument(file));
		String path = metadata.requireString(LegacyDocument.PATH);
		if (!path.startsWith(fromSlash)) {
			throw metadata.malformed(LegacyDocument.PATH, "expected to start with '" + fromSlash + "'");
		}
		Map<String, Object> result = stringKeyed(withResourcePaths(metadata.asMap(), fromSlash, toSlash));
		result.put(LegacyDocument.PATH, toSlash + path.substring(fromSlash.length()));
		return result;
	}

	/**
	 * @return a copy of {@code node} where each local resource under {@code fromSlash} is moved to {@code toSlash}
	 */
	private static Object withResourcePaths(Object node, String fromSlash, String toSlash) {
		if (node instanceof Map) {
			Map<String, Object> result = new LinkedHashMap<>();
			for (Map.Entry<?, ?> entry : ((Map<?, ?>) node).entrySet()) {
				Object value = entry.getValue();
				if (LegacyDocument.RESOURCE.equals(entry.getKey()) && isLocal(value)) {
					Map<String, Object> resource = stringKeyed(value);
					Object path = resource.get(LegacyDocument.PATH);
					if (path instanceof String && ((String) path).startsWith(fromSlash)) {
						resource.put(LegacyDocument.PATH, toSlash + ((String) path).substring(fromSlash.length()));
					}
					result.put(LegacyDocument.RESOURCE, resource);
				} else {
					result.put(String.valueOf(entry.getKey()), withResourcePaths(value, fromSlash, toSlash));
				}
			}
			return result;
		} else if (node instanceof List) {
			List<Object> result = new ArrayList<>();
			for (Object value : (List<?>) node) {
				result.add(withResourcePaths(value, fromSlash, toSlash));
			}
			return result;
		} else {
			return node;
		}
	}

	private static List<Object> targets(Path file, Map<String, Object> redirection) {
		ObjectMetadata metadata = ObjectMetadata.of(file, redirection);
		return new ArrayList<>(metadata.section(LegacyDocument.REDIRECTION).requireList(LegacyDocument.TARGETS));
	}

	private static Map<String, Object> withTargets(Map<String, Object> redirection, List<Object> targets) {
		Map<String, Object> section = stringKeyed(redirection.get(LegacyDocument.REDIRECTION));
		section.put(LegacyDocument.TARGETS, targets);
		Map<String, Object> result = new LinkedHashMap<>(redirection);
		result.put(LegacyDocument.REDIRECTION, section);
		return result;
	}

	/**
	 * @return the non-hidden redirection documents directly inside {@code dir}
	 */
	private static List<Path> redirectionFiles(Path root, String dir) throws IOException {
		List<Path> candidates;
		try (Stream<Path> list = Files.list(resolve(root, dir))) {
			candidates = list
				.filter(Files::isRegularFile)
				.filter(f -> isDocument(f.getFileName().toString()) && !f.getFileName().toString().startsWith("."))
				.sorted()
				.collect(Collectors.toList());
		}
		List<Path> result = new ArrayList<>();
		for (Path file : candidates) {
			Object schema = MetadataFiles.readDocument(file).get(LegacyDocument.SCHEMA);
			if (schema instanceof String && ((String) schema).startsWith(LegacyDocument.REDIRECTION_SCHEMA_PREFIX)) {
				result.add(file);
			}
		}
		return result;
	}

	private static boolean isLocal(Object resource) {
		return resource instanceof Map && LegacyDocument.LOCAL.equals(((Map<?, ?>) resource).get("type"));
	}

	private static int indexOfLocalTarget(List<Object> targets, String location) {
		for (int i = 0; i < targets.size(); i++) {
			if (isLocalTarget(targets.get(i), location)) {
				return i;
			}
		}
		return -1;
	}

	private static boolean isLocalTarget(Object target, String location) {
		return isLocal(target) && location.equals(((Map<?, ?>) target).get("location"));
	}

	private static Map<String, Object> stringKeyed(Object map) {
		Map<String, Object> result = new LinkedHashMap<>();
		((Map<?, ?>) map).forEach((k, v) -> result.put(String.valueOf(k), v));
		return result;
	}

	private static void deleteRecursively(Path directory) throws IOException {
		List<Path> contents;
		try (Stream<Path> walk = Files.walk(directory)) {
			contents = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
		}
		for (Path path : contents) {
			Files.delete(path);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LegacyDirectoryEditor.class);
}

package works.cairn.legacy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.cairn.MetadataFiles;
import works.cairn.ObjectMetadata;
import works.cairn.exceptions.RedirectionException;
import works.cairn.exceptions.StructuralViolationException;

import static works.cairn.exceptions.RedirectionException.Reason.DANGLING;
import static works.cairn.exceptions.RedirectionException.Reason.EXISTING_PATH;
import static works.cairn.exceptions.RedirectionException.Reason.PATH_MISMATCH;
import static works.cairn.exceptions.StructuralViolationException.Violation.DUPLICATE_REFERENCE;
import static works.cairn.exceptions.StructuralViolationException.Violation.MISSING_CHILD;
import static works.cairn.exceptions.StructuralViolationException.Violation.NESTED_NON_CHILD;
import static works.cairn.exceptions.StructuralViolationException.Violation.NON_EXISTENT_PATH;
import static works.cairn.exceptions.StructuralViolationException.Violation.NON_NESTED_CHILD;
import static works.cairn.exceptions.StructuralViolationException.Violation.NON_REFERENCED_CHILD;
import static works.cairn.exceptions.StructuralViolationException.Violation.REFERENCED_NON_CHILD;
import static works.cairn.exceptions.StructuralViolationException.Violation.UNEXPECTED_PATH;
import static works.cairn.exceptions.StructuralViolationException.Violation.UNKNOWN_FILE;

/**
 * Validates directories in the legacy layout, where each resource {@code p}
 * is described by a sibling document {@code p.json},
 * and parents name their children through nested {@code {"resource": {"path": ...}}} objects.
 * <p>
 * Unlike the current layout, the whole directory is checked as one graph:
 * every document is loaded, every reference is accounted for,
 * and every file on disk must be described by exactly one document.
 * <p>
 * All paths are relative to the root and use {@code /} as the separator.
 * Hidden files and directories are ignored.
 */
public final class LegacyDirectoryValidator {

	/**
	 * @throws StructuralViolationException if the documents and files don't form a consistent tree
	 * @throws RedirectionException if a redirection is misplaced, shadows a file, or leads nowhere
	 * @throws works.cairn.exceptions.MalformedMetadataException if a document can't be read
	 */
	public void validate(Path root) {
		List<String> allFiles = listFiles(root);
		Set<String> fileSet = new HashSet<>(allFiles);
		List<String> otherFiles = allFiles.stream()
			.filter(f -> !isDocument(f))
			.collect(Collectors.toList());

		List<String> amChild = new ArrayList<>();
		List<String> notChild = new ArrayList<>();
		List<String> expectedChild = new ArrayList<>();
		List<String> redirects = new ArrayList<>();

		for (LegacyDocument doc : readDocuments(root, allFiles)) {
			String location = doc.location();
			String path = doc.path();
			if (doc.redirection()) {
				if (!location.equals(path + ".json")) {
					throw new RedirectionException(PATH_MISMATCH, path,
						"metadata in '" + location + "' references an unexpected path '" + path + "'");
				}
				if (fileSet.contains(path)) {
					throw new RedirectionException(EXISTING_PATH, path,
						"metadata in '" + location + "' contains a redirection from existing path '" + path + "'");
				}
				for (String target : doc.redirectTargets()) {
					if (target.equals(path)) {
						throw new RedirectionException(EXISTING_PATH, path,
							"metadata in '" + location + "' contains a redirection from existing path '" + path + "' to itself");
					}
					redirects.add(target);
				}
				LOGGER.debug("Redirection from '{}' to {}", path, doc.redirectTargets());
				continue;
			}

			if (!fileSet.contains(path)) {
				throw new StructuralViolationException(NON_EXISTENT_PATH, path,
					"metadata in '" + location + "' references a non-existent path '" + path + "'");
			}
			if (!path.equals(location) && !location.equals(path + ".json")) {
				throw new StructuralViolationException(UNEXPECTED_PATH, path,
					"metadata in '" + location + "' references an unexpected path '" + path + "'");
			}

			if (doc.child()) {
				amChild.add(path);
			} else {
				notChild.add(path);
			}

			String parentDir = dirname(location);
			for (String childPath : doc.childPaths()) {
				if (!isStrictlyInside(dirname(childPath), parentDir)) {
					throw new StructuralViolationException(NON_NESTED_CHILD, childPath,
						"metadata in '" + location + "' references non-nested child '" + childPath + "'");
				}
			}
			expectedChild.addAll(doc.childPaths());
		}

		Set<String> notChildSet = new HashSet<>(notChild);
		for (String expected : expectedChild) {
			if (notChildSet.contains(expected)) {
				throw new StructuralViolationException(REFERENCED_NON_CHILD, expected,
					"non-child object in '" + expected + "' is referenced by another object");
			}
		}

		Set<String> seen = new HashSet<>();
		for (String expected : expectedChild) {
			if (!seen.add(expected)) {
				throw new StructuralViolationException(DUPLICATE_REFERENCE, expected,
					"multiple references to child at '" + expected + "'");
			}
		}

		Set<String> amChildSet = new HashSet<>(amChild);
		for (String expected : expectedChild) {
			if (!amChildSet.contains(expected)) {
				throw new StructuralViolationException(MISSING_CHILD, expected,
					"missing child object '" + expected + "'");
			}
		}

		for (String child : amChild) {
			if (!seen.contains(child)) {
				throw new StructuralViolationException(NON_REFERENCED_CHILD, child,
					"non-referenced child object in '" + child + "'");
			}
		}

		for (String other : otherFiles) {
			if (!amChildSet.contains(other) && !notChildSet.contains(other)) {
				throw new StructuralViolationException(UNKNOWN_FILE, other,
					"unknown file at '" + other + "'");
			}
		}

		checkNonChildNesting(notChild);

		for (String target : redirects) {
			if (!amChildSet.contains(target) && !notChildSet.contains(target)) {
				throw new RedirectionException(DANGLING, target,
					"invalid redirection to '" + target + "'");
			}
		}

		LOGGER.debug("Legacy directory {} is valid: {} objects, {} children, {} redirections",
			root, notChild.size(), amChild.size(), redirects.size());
	}

	/**
	 * Top-level objects each own their directory, so none may live beneath another's.
	 */
	private static void checkNonChildNesting(List<String> notChild) {
		TreeSet<String> dirs = new TreeSet<>();
		for (String path : notChild) {
			dirs.add(dirname(path));
		}
		for (String dir : dirs) {
			for (String ancestor = dirname(dir); !ancestor.isEmpty(); ancestor = dirname(ancestor)) {
				if (dirs.contains(ancestor)) {
					throw new StructuralViolationException(NESTED_NON_CHILD, dir,
						"non-child object at '" + dir + "' is nested inside the directory of '" + ancestor + "'");
				}
			}
		}
	}

	/**
	 * @param ignoreChildren if true, documents with {@code is_child} set are omitted
	 * @return every document under {@code root}, keyed by its location and ordered by it
	 */
	public Map<String, ObjectMetadata> loadAllMetadata(Path root, boolean ignoreChildren) {
		Map<String, ObjectMetadata> result = new TreeMap<>();
		for (String file : listFiles(root)) {
			if (!isDocument(file)) {
				continue;
			}
			Path documentFile = resolve(root, file);
			ObjectMetadata metadata = ObjectMetadata.of(documentFile, MetadataFiles.readDocument(documentFile));
			if (ignoreChildren && metadata.optionalBoolean(LegacyDocument.IS_CHILD).orElse(false)) {
				continue;
			}
			result.put(file, metadata);
		}
		return result;
	}

	/**
	 * Writes a redirection document making {@code alias} a short name for {@code target}.
	 *
	 * @return the document that was written
	 * @throws FileAlreadyExistsException if a document already exists for {@code alias}
	 */
	public Map<String, Object> createRedirection(Path root, String alias, String target) throws IOException {
		String location = alias + ".json";
		Path file = resolve(root, location);
		if (Files.exists(file)) {
			throw new FileAlreadyExistsException(file.toString(), null, "cannot create a redirection over an existing document");
		}
		Map<String, Object> targetEntry = new LinkedHashMap<>();
		targetEntry.put("type", LegacyDocument.LOCAL);
		targetEntry.put("location", target);

		Map<String, Object> document = new LinkedHashMap<>();
		document.put(LegacyDocument.PATH, alias);
		document.put(LegacyDocument.SCHEMA, LegacyDocument.REDIRECTION_SCHEMA);
		document.put(LegacyDocument.REDIRECTION, Map.of(LegacyDocument.TARGETS, List.of(targetEntry)));

		Path parent = file.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		MetadataFiles.writeDocument(file, document);
		LOGGER.debug("Created redirection from '{}' to '{}' in {}", alias, target, root);
		return document;
	}

	private static List<LegacyDocument> readDocuments(Path root, List<String> allFiles) {
		List<LegacyDocument> result = new ArrayList<>();
		for (String file : allFiles) {
			if (isDocument(file)) {
				Path documentFile = resolve(root, file);
				ObjectMetadata metadata = ObjectMetadata.of(documentFile, MetadataFiles.readDocument(documentFile));
				result.add(LegacyDocument.parse(file, metadata));
			}
		}
		return result;
	}

	/**
	 * @return relative names of all regular, non-hidden files under {@code root}, sorted
	 */
	static List<String> listFiles(Path root) {
		try (Stream<Path> files = Files.walk(root)) {
			return files
				.filter(Files::isRegularFile)
				.map(root::relativize)
				.filter(p -> !isHidden(p))
				.map(LegacyDirectoryValidator::slashSeparated)
				.sorted()
				.collect(Collectors.toList());
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to list files under " + root, e);
		}
	}

	static boolean isHidden(Path relative) {
		for (Path part : relative) {
			if (part.toString().startsWith(".")) {
				return true;
			}
		}
		return false;
	}

	private static String slashSeparated(Path relative) {
		List<String> parts = new ArrayList<>();
		for (Path part : relative) {
			parts.add(part.toString());
		}
		return String.join("/", parts);
	}

	static Path resolve(Path root, String relative) {
		Path result = root;
		for (String part : relative.split("/")) {
			result = result.resolve(part);
		}
		return result;
	}

	static boolean isDocument(String file) {
		return file.endsWith(".json");
	}

	/**
	 * @return the directory part of {@code path}, or the empty string for the root
	 */
	static String dirname(String path) {
		int slash = path.lastIndexOf('/');
		return slash < 0 ? "" : path.substring(0, slash);
	}

	/**
	 * @return true if {@code dir} is a proper sub-directory of {@code ancestor}
	 */
	static boolean isStrictlyInside(String dir, String ancestor) {
		if (ancestor.isEmpty()) {
			return !dir.isEmpty();
		}
		return dir.startsWith(ancestor + "/");
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LegacyDirectoryValidator.class);
}

package works.cairn;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.cairn.exceptions.CairnException;
import works.cairn.exceptions.InvalidObjectException;
import works.cairn.exceptions.StructuralViolationException;

import static works.cairn.exceptions.StructuralViolationException.Violation.NOT_A_DIRECTORY;
import static works.cairn.exceptions.StructuralViolationException.Violation.TOO_DEEP;

/**
 * The state of one validation pass at one depth of the tree.
 * <p>
 * Handlers receive a context and use it to re-enter the validator on nested objects
 * ({@link #validate(Path)}), to ask a nested object for its extent
 * ({@link #height}, {@link #dimensions}), and to check what a nested object's type
 * is capable of ({@link #satisfiesInterface}, {@link #derivedFrom}).
 * <p>
 * Contexts are immutable. Nothing is cached between calls;
 * each pass re-reads the tree from disk.
 */
public final class ValidationContext {
	private final TypeRegistry registry;
	private final ValidationSettings settings;
	private final Path root;
	private final int depth;

	ValidationContext(TypeRegistry registry, ValidationSettings settings, Path root, int depth) {
		this.registry = registry;
		this.settings = settings;
		this.root = root;
		this.depth = depth;
	}

	public TypeRegistry registry() {
		return registry;
	}

	public ValidationSettings settings() {
		return settings;
	}

	/**
	 * @return the directory on which this validation pass was started
	 */
	public Path root() {
		return root;
	}

	public int depth() {
		return depth;
	}

	public ObjectMetadata readObjectFile(Path path) {
		requireDirectory(path);
		return ObjectFile.read(path, settings.objectFileName());
	}

	/**
	 * Reads the object file of a nested object that the caller will inspect before validating it.
	 * Failures carry the nested object's location, as for {@link #validate(Path)}.
	 */
	public ObjectMetadata readNestedObjectFile(Path path) {
		try {
			return readObjectFile(path);
		} catch (CairnException e) {
			throw CairnException.wrap(e, failedToValidate(path));
		} catch (UncheckedIOException e) {
			throw new InvalidObjectException(failedToValidate(path) + "; " + e.getMessage(), e);
		}
	}

	/**
	 * Validates the nested object at {@code path}, reading its metadata from its object file.
	 * Any failure is rethrown with the nested object's location prepended to its message;
	 * I/O failures become {@link InvalidObjectException}s.
	 */
	public void validate(Path path) {
		try {
			deeper(path).dispatchValidate(path, readObjectFile(path));
		} catch (CairnException e) {
			throw CairnException.wrap(e, failedToValidate(path));
		} catch (UncheckedIOException e) {
			throw new InvalidObjectException(failedToValidate(path) + "; " + e.getMessage(), e);
		}
	}

	/**
	 * Like {@link #validate(Path)} for a caller that has already read the metadata,
	 * typically to check {@link #satisfiesInterface interfaces} first.
	 */
	public void validate(Path path, ObjectMetadata metadata) {
		try {
			deeper(path).dispatchValidate(path, metadata);
		} catch (CairnException e) {
			throw CairnException.wrap(e, failedToValidate(path));
		} catch (UncheckedIOException e) {
			throw new InvalidObjectException(failedToValidate(path) + "; " + e.getMessage(), e);
		}
	}

	private String failedToValidate(Path path) {
		return "failed to validate '" + describe(path) + "'";
	}

	void dispatchValidate(Path path, ObjectMetadata metadata) {
		requireDirectory(path);
		String type = metadata.type();
		ValidateFunction function = registry.validateFunction(type);
		LOGGER.debug("{}Validating '{}' as '{}'", indent(), describe(path), type);
		function.validate(path, metadata, this);
	}

	public long height(Path path, ObjectMetadata metadata) {
		requireDirectory(path);
		return registry.heightFunction(metadata.type()).height(path, metadata, deeper(path));
	}

	public List<Long> dimensions(Path path, ObjectMetadata metadata) {
		requireDirectory(path);
		return List.copyOf(registry.dimensionsFunction(metadata.type()).dimensions(path, metadata, deeper(path)));
	}

	public boolean satisfiesInterface(String type, String interfaceName) {
		return registry.satisfiesInterface(type, interfaceName);
	}

	public boolean derivedFrom(String type, String base) {
		return registry.derivedFrom(type, base);
	}

	private ValidationContext deeper(Path path) {
		if (depth >= settings.maxDepth()) {
			throw new StructuralViolationException(TOO_DEEP, describe(path),
				"objects are nested more than " + settings.maxDepth() + " levels deep at '" + describe(path) + "'");
		}
		return new ValidationContext(registry, settings, root, depth + 1);
	}

	private void requireDirectory(Path path) {
		if (!Files.isDirectory(path)) {
			throw new StructuralViolationException(NOT_A_DIRECTORY, describe(path),
				"expected '" + describe(path) + "' to be a directory");
		}
	}

	/**
	 * @return {@code path} relative to the root, where possible
	 */
	String describe(Path path) {
		if (path.startsWith(root) && !path.equals(root)) {
			return root.relativize(path).toString();
		}
		return path.toString();
	}

	private String indent() {
		return "  ".repeat(depth);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ValidationContext.class);
}

package works.cairn;

import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.cairn.exceptions.InvalidObjectException;
import works.cairn.exceptions.StructuralViolationException;

import static java.util.Objects.requireNonNull;
import static works.cairn.exceptions.StructuralViolationException.Violation.NOT_A_DIRECTORY;

/**
 * Loads objects by dispatching on the type in their object file
 * to the {@link ReadFunction} registered for it.
 * <p>
 * Reading does not validate; callers that don't trust the directory
 * should run an {@link ObjectValidator} first.
 */
public final class ObjectReader {
	private final TypeRegistry registry;
	private final ValidationSettings settings;

	public ObjectReader(TypeRegistry registry) {
		this(registry, ValidationSettings.DEFAULT);
	}

	public ObjectReader(TypeRegistry registry, ValidationSettings settings) {
		settings.validate();
		this.registry = requireNonNull(registry);
		this.settings = settings;
	}

	/**
	 * @throws works.cairn.exceptions.UnknownTypeException if nothing is registered for the object's type
	 * @throws works.cairn.exceptions.MissingCapabilityException if the type is known but can't be read
	 */
	public Object readObject(Path directory) {
		if (!Files.isDirectory(directory)) {
			throw new StructuralViolationException(NOT_A_DIRECTORY, directory.toString(),
				"expected '" + directory + "' to be a directory");
		}
		ObjectMetadata metadata = ObjectFile.read(directory, settings.objectFileName());
		ReadFunction function = registry.readFunction(metadata.type());
		LOGGER.debug("Reading '{}' from {}", metadata.type(), directory);
		return function.read(directory, metadata, this);
	}

	/**
	 * @throws InvalidObjectException if the object is not a {@code T}
	 */
	public <T> T readObject(Path directory, Class<T> expectedClass) {
		Object result = readObject(directory);
		if (expectedClass.isInstance(result)) {
			return expectedClass.cast(result);
		}
		throw new InvalidObjectException("expected '" + directory + "' to hold a "
			+ expectedClass.getSimpleName() + ", but it holds a " + result.getClass().getSimpleName());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ObjectReader.class);
}

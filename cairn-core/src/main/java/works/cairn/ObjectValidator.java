package works.cairn;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Checks that an object directory in the current format can be decoded,
 * by dispatching to whatever functions its {@link TypeRegistry} holds for the object's type.
 * <p>
 * The validator itself knows only about the object file and its {@code type} field;
 * everything else, including which sub-directories hold nested objects,
 * is the business of the type's own {@link ValidateFunction}.
 * <p>
 * Instances hold no per-call state and may be shared between threads.
 */
public final class ObjectValidator {
	private final TypeRegistry registry;
	private final ValidationSettings settings;

	public ObjectValidator(TypeRegistry registry) {
		this(registry, ValidationSettings.DEFAULT);
	}

	public ObjectValidator(TypeRegistry registry, ValidationSettings settings) {
		settings.validate();
		this.registry = requireNonNull(registry);
		this.settings = settings;
	}

	public TypeRegistry registry() {
		return registry;
	}

	public ValidationSettings settings() {
		return settings;
	}

	/**
	 * @throws works.cairn.exceptions.CairnException describing the first problem found
	 */
	public void validate(Path directory) {
		ValidationContext context = rootContext(directory);
		ObjectMetadata metadata = context.readObjectFile(directory);
		LOGGER.debug("Validating object at {}", directory);
		context.dispatchValidate(directory, metadata);
	}

	/**
	 * Validates {@code directory} using the given {@code metadata} in place of its object file.
	 */
	public void validate(Path directory, ObjectMetadata metadata) {
		LOGGER.debug("Validating object at {} with supplied metadata", directory);
		rootContext(directory).dispatchValidate(directory, metadata);
	}

	/**
	 * @return the length of the object along its first dimension
	 */
	public long height(Path directory) {
		ValidationContext context = rootContext(directory);
		ObjectMetadata metadata = context.readObjectFile(directory);
		return registry.heightFunction(metadata.type()).height(directory, metadata, context);
	}

	public List<Long> dimensions(Path directory) {
		ValidationContext context = rootContext(directory);
		ObjectMetadata metadata = context.readObjectFile(directory);
		return List.copyOf(registry.dimensionsFunction(metadata.type()).dimensions(directory, metadata, context));
	}

	public ObjectMetadata readObjectFile(Path directory) {
		return rootContext(directory).readObjectFile(directory);
	}

	/**
	 * Writes the object file for {@code directory}, creating the directory if needed.
	 *
	 * @param extra additional fields; must not contain {@code type}
	 */
	public void writeObjectFile(Path directory, String type, Map<String, ?> extra) {
		try {
			ObjectFile.write(directory, settings.objectFileName(), type, extra);
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to write object file in " + directory, e);
		}
	}

	private ValidationContext rootContext(Path directory) {
		return new ValidationContext(registry, settings, directory, 0);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ObjectValidator.class);
}

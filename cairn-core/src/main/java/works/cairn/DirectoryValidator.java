package works.cairn;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.cairn.ObjectLister.ObjectListing;
import works.cairn.ValidationSettings.DirectoryFormat;
import works.cairn.exceptions.CairnException;
import works.cairn.legacy.LegacyDirectoryValidator;

/**
 * Validates every object saved under a directory,
 * in whichever layout {@link ValidationSettings#format()} calls for.
 */
public final class DirectoryValidator {
	private final ObjectValidator objectValidator;
	private final LegacyDirectoryValidator legacyValidator;

	public DirectoryValidator(TypeRegistry registry) {
		this(new ObjectValidator(registry));
	}

	public DirectoryValidator(ObjectValidator objectValidator) {
		this(objectValidator, new LegacyDirectoryValidator());
	}

	public DirectoryValidator(ObjectValidator objectValidator, LegacyDirectoryValidator legacyValidator) {
		this.objectValidator = objectValidator;
		this.legacyValidator = legacyValidator;
	}

	/**
	 * In the current layout, each top-level object is validated,
	 * and its handler is expected to validate its own children.
	 *
	 * @return the paths, relative to {@code root}, of the top-level objects that were validated;
	 * empty for the legacy layout
	 * @throws CairnException for the first invalid object, with its path prepended to the message
	 */
	public List<String> validateDirectory(Path root) {
		DirectoryFormat format = effectiveFormat(root);
		LOGGER.debug("Validating directory {} in {} format", root, format);
		if (format == DirectoryFormat.LEGACY) {
			legacyValidator.validate(root);
			return List.of();
		}
		ObjectLister lister = new ObjectLister(objectValidator.settings().objectFileName());
		List<String> validated = new ArrayList<>();
		for (ObjectListing listing : lister.listObjects(root, false)) {
			Path objectDir = ".".equals(listing.path()) ? root : root.resolve(listing.path());
			try {
				objectValidator.validate(objectDir);
			} catch (CairnException e) {
				throw CairnException.wrap(e, "failed to validate '" + listing.path() + "'");
			}
			validated.add(listing.path());
		}
		return List.copyOf(validated);
	}

	DirectoryFormat effectiveFormat(Path root) {
		DirectoryFormat configured = objectValidator.settings().format();
		if (configured != DirectoryFormat.AUTO) {
			return configured;
		}
		String objectFileName = objectValidator.settings().objectFileName();
		try (Stream<Path> files = Files.walk(root)) {
			boolean anyObjectFile = files.anyMatch(p ->
				Files.isRegularFile(p) && p.getFileName().toString().equals(objectFileName));
			return anyObjectFile ? DirectoryFormat.CURRENT : DirectoryFormat.LEGACY;
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to scan directory " + root, e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryValidator.class);
}

package works.cairn.exceptions;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/**
 * A metadata document is missing, unreadable, or lacks a required field.
 */
public final class MalformedMetadataException extends InvalidObjectException {
	private final Path file;
	@Nullable private final String field;

	public MalformedMetadataException(Path file, @Nullable String field, String message) {
		super(fullMessage(file, field, message));
		this.file = file;
		this.field = field;
	}

	public MalformedMetadataException(Path file, @Nullable String field, String message, Throwable cause) {
		super(fullMessage(file, field, message), cause);
		this.file = file;
		this.field = field;
	}

	private MalformedMetadataException(String message, Path file, @Nullable String field, Throwable cause) {
		super(message, cause);
		this.file = file;
		this.field = field;
	}

	public Path file() {
		return file;
	}

	/**
	 * @return the offending field, or null if the document as a whole is at fault
	 */
	@Nullable
	public String field() {
		return field;
	}

	@Override
	protected MalformedMetadataException withMessage(String newMessage) {
		return new MalformedMetadataException(newMessage, file, field, this);
	}

	private static String fullMessage(Path file, @Nullable String field, String message) {
		if (field == null) {
			return "malformed metadata in '" + file + "': " + message;
		} else {
			return "malformed metadata in '" + file + "' at '" + field + "': " + message;
		}
	}
}

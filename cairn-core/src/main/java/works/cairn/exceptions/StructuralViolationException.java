package works.cairn.exceptions;

/**
 * The directory tree has the wrong shape:
 * references, child flags, or files on disk don't agree with each other.
 */
public final class StructuralViolationException extends InvalidObjectException {
	private final Violation violation;
	private final String path;

	public StructuralViolationException(Violation violation, String path, String message) {
		super(message);
		this.violation = violation;
		this.path = path;
	}

	private StructuralViolationException(Violation violation, String path, String message, Throwable cause) {
		super(message, cause);
		this.violation = violation;
		this.path = path;
	}

	public Violation violation() {
		return violation;
	}

	/**
	 * @return the path, relative to the directory being validated where possible,
	 * at which the violation was detected
	 */
	public String path() {
		return path;
	}

	@Override
	protected StructuralViolationException withMessage(String newMessage) {
		return new StructuralViolationException(violation, path, newMessage, this);
	}

	public enum Violation {
		/**
		 * An object path is not a directory.
		 */
		NOT_A_DIRECTORY,

		/**
		 * Objects are nested more deeply than the validator will follow.
		 */
		TOO_DEEP,

		/**
		 * A metadata document describes a file that doesn't exist.
		 */
		NON_EXISTENT_PATH,

		/**
		 * A metadata document's declared path doesn't match where the document is stored.
		 */
		UNEXPECTED_PATH,

		/**
		 * A child reference points outside the subdirectories of its parent.
		 */
		NON_NESTED_CHILD,

		/**
		 * An object not flagged as a child is referenced by another object.
		 */
		REFERENCED_NON_CHILD,

		/**
		 * Two references point at the same child.
		 */
		DUPLICATE_REFERENCE,

		/**
		 * A referenced child has no metadata document.
		 */
		MISSING_CHILD,

		/**
		 * An object flagged as a child is not referenced by anything.
		 */
		NON_REFERENCED_CHILD,

		/**
		 * A file on disk is not accounted for by any metadata document.
		 */
		UNKNOWN_FILE,

		/**
		 * An object not flagged as a child lives inside another object's directory.
		 */
		NESTED_NON_CHILD,
	}
}

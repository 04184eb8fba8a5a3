package works.cairn.exceptions;

/**
 * A redirection document is inconsistent with the directory contents.
 */
public final class RedirectionException extends InvalidObjectException {
	private final Reason reason;
	private final String path;

	public RedirectionException(Reason reason, String path, String message) {
		super(message);
		this.reason = reason;
		this.path = path;
	}

	private RedirectionException(Reason reason, String path, String message, Throwable cause) {
		super(message, cause);
		this.reason = reason;
		this.path = path;
	}

	public Reason reason() {
		return reason;
	}

	/**
	 * @return the redirection's own path
	 */
	public String path() {
		return path;
	}

	@Override
	protected RedirectionException withMessage(String newMessage) {
		return new RedirectionException(reason, path, newMessage, this);
	}

	public enum Reason {
		/**
		 * The redirection document isn't stored where its declared path says it should be.
		 */
		PATH_MISMATCH,

		/**
		 * The redirection would shadow a real file, or points at itself.
		 */
		EXISTING_PATH,

		/**
		 * The redirection target is not a real object.
		 */
		DANGLING,
	}
}

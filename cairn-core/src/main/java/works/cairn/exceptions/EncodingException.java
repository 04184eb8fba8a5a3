package works.cairn.exceptions;

/**
 * Values can't be represented in any storage container,
 * typically because a string declares a character set we can't store.
 */
public final class EncodingException extends CairnException {
	public EncodingException(String message) {
		super(message);
	}

	public EncodingException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	protected EncodingException withMessage(String newMessage) {
		return new EncodingException(newMessage, this);
	}
}

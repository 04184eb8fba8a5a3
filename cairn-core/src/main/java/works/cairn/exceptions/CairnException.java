package works.cairn.exceptions;

/**
 * Root of the exceptions thrown by the object-directory validators,
 * the type registry, and the storage-encoding optimizer.
 * <p>
 * Each subclass names one kind of failure, so callers can tell
 * "the tree shape is wrong" apart from "nobody knows how to check this type"
 * without parsing messages.
 */
public sealed abstract class CairnException extends RuntimeException permits
	InvalidObjectException,
	UnregisteredCapabilityException,
	EncodingException,
	RegistrationException
{
	protected CairnException(String message) {
		super(message);
	}

	protected CairnException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return an exception of the same kind, carrying the same details,
	 * with the given message and with {@code this} as its cause.
	 */
	protected abstract CairnException withMessage(String newMessage);

	/**
	 * Prefixes the message of {@code exception} with {@code context},
	 * preserving its kind so callers can still catch the specific subclass.
	 */
	@SuppressWarnings("unchecked")
	public static <T extends CairnException> T wrap(T exception, String context) {
		return (T) exception.withMessage(context + "; " + exception.getMessage());
	}
}

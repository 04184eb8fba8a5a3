package works.cairn.exceptions;

/**
 * The on-disk representation of an object is invalid.
 * <p>
 * Type-specific validation handlers throw this class directly;
 * the subclasses are reserved for failures detected by the core itself.
 */
public sealed class InvalidObjectException extends CairnException permits
	MalformedMetadataException,
	StructuralViolationException,
	RedirectionException
{
	public InvalidObjectException(String message) {
		super(message);
	}

	public InvalidObjectException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	protected InvalidObjectException withMessage(String newMessage) {
		return new InvalidObjectException(newMessage, this);
	}
}

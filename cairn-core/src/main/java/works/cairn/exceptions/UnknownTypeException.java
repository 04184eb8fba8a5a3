package works.cairn.exceptions;

import works.cairn.Capability;

/**
 * The type tag has no registrations of any kind.
 */
public final class UnknownTypeException extends UnregisteredCapabilityException {
	public UnknownTypeException(Capability capability, String type) {
		super(capability, type, "no registered '" + capability.functionName() + "' function for unknown object type '" + type + "'");
	}

	private UnknownTypeException(Capability capability, String type, String message, Throwable cause) {
		super(capability, type, message, cause);
	}

	@Override
	protected UnknownTypeException withMessage(String newMessage) {
		return new UnknownTypeException(capability(), type(), newMessage, this);
	}
}

package works.cairn.exceptions;

import works.cairn.Capability;

/**
 * The type tag is known, but nothing is registered for this particular capability.
 */
public final class MissingCapabilityException extends UnregisteredCapabilityException {
	public MissingCapabilityException(Capability capability, String type) {
		super(capability, type, "no registered '" + capability.functionName() + "' function for object type '" + type + "'");
	}

	private MissingCapabilityException(Capability capability, String type, String message, Throwable cause) {
		super(capability, type, message, cause);
	}

	@Override
	protected MissingCapabilityException withMessage(String newMessage) {
		return new MissingCapabilityException(capability(), type(), newMessage, this);
	}
}

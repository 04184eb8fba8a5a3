package works.cairn.exceptions;

import works.cairn.Capability;

public final class HandlerConflictException extends RegistrationException {
	private final Capability capability;

	public HandlerConflictException(Capability capability, String type) {
		super(type, "a '" + capability.functionName() + "' function is already registered for object type '" + type + "'");
		this.capability = capability;
	}

	private HandlerConflictException(Capability capability, String type, String message, Throwable cause) {
		super(type, message, cause);
		this.capability = capability;
	}

	public Capability capability() {
		return capability;
	}

	@Override
	protected HandlerConflictException withMessage(String newMessage) {
		return new HandlerConflictException(capability, type(), newMessage, this);
	}
}

package works.cairn.exceptions;

import works.cairn.Capability;

/**
 * No handler is registered for an operation that validation requires.
 * <p>
 * The two subclasses let callers distinguish a type nobody has heard of
 * from a known type that simply lacks the requested capability.
 */
public sealed abstract class UnregisteredCapabilityException extends CairnException permits
	UnknownTypeException,
	MissingCapabilityException
{
	private final Capability capability;
	private final String type;

	protected UnregisteredCapabilityException(Capability capability, String type, String message) {
		super(message);
		this.capability = capability;
		this.type = type;
	}

	protected UnregisteredCapabilityException(Capability capability, String type, String message, Throwable cause) {
		super(message, cause);
		this.capability = capability;
		this.type = type;
	}

	public Capability capability() {
		return capability;
	}

	public String type() {
		return type;
	}
}

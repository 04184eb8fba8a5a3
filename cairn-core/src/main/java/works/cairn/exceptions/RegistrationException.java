package works.cairn.exceptions;

/**
 * A {@link works.cairn.TypeRegistry} mutation was refused.
 * The registry is left unchanged.
 */
public sealed abstract class RegistrationException extends CairnException permits
	HandlerConflictException,
	DerivationCycleException
{
	private final String type;

	protected RegistrationException(String type, String message) {
		super(message);
		this.type = type;
	}

	protected RegistrationException(String type, String message, Throwable cause) {
		super(message, cause);
		this.type = type;
	}

	public String type() {
		return type;
	}
}

package works.cairn.exceptions;

public final class DerivationCycleException extends RegistrationException {
	private final String base;

	public DerivationCycleException(String type, String base) {
		super(type, "declaring object type '" + type + "' as derived from '" + base + "' would create a derivation cycle");
		this.base = base;
	}

	private DerivationCycleException(String type, String base, String message, Throwable cause) {
		super(type, message, cause);
		this.base = base;
	}

	public String base() {
		return base;
	}

	@Override
	protected DerivationCycleException withMessage(String newMessage) {
		return new DerivationCycleException(type(), base, newMessage, this);
	}
}

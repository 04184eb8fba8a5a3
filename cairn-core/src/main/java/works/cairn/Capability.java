package works.cairn;

/**
 * The per-type functions a {@link TypeRegistry} can hold.
 */
public enum Capability {
	VALIDATE("validate"),
	HEIGHT("height"),
	DIMENSIONS("dimensions"),
	READ("read");

	private final String functionName;

	Capability(String functionName) {
		this.functionName = functionName;
	}

	public String functionName() {
		return functionName;
	}
}

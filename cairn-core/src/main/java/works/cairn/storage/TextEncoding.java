package works.cairn.storage;

/**
 * The character encoding a text value was declared with.
 * Only {@link #ASCII} and {@link #UTF8} can be stored.
 */
public enum TextEncoding {
	ASCII,
	UTF8,
	LATIN1,

	/**
	 * Raw bytes with no declared character set.
	 */
	BYTES,
	;

	public boolean storable() {
		return this == ASCII || this == UTF8;
	}

	/**
	 * @return the tag recorded in metadata for a stored text column
	 */
	public String tag() {
		switch (this) {
			case ASCII: return "ASCII";
			case UTF8: return "UTF-8";
			default: throw new IllegalStateException("Encoding cannot be stored: " + this);
		}
	}

	public static TextEncoding fromTag(String tag) {
		switch (tag) {
			case "ASCII": return ASCII;
			case "UTF-8": return UTF8;
			default: throw new IllegalArgumentException("Unknown character set tag: \"" + tag + "\"");
		}
	}
}

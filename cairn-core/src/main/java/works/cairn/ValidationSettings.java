package works.cairn;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ValidationSettings {
	public static final ValidationSettings DEFAULT = ValidationSettings.builder().build();

	/**
	 * How deeply objects may nest inside each other.
	 */
	@Default int maxDepth = 64;

	/**
	 * Which layout {@link DirectoryValidator} expects.
	 */
	@Default DirectoryFormat format = DirectoryFormat.AUTO;

	/**
	 * Name of the metadata file inside each object directory.
	 */
	@Default String objectFileName = ObjectFile.DEFAULT_NAME;

	public enum DirectoryFormat {
		/**
		 * Use {@link #LEGACY} if no object file exists anywhere in the directory,
		 * and {@link #CURRENT} otherwise.
		 */
		AUTO,

		/**
		 * Each object is a directory containing an object file,
		 * and each type's handler validates its own children.
		 */
		CURRENT,

		/**
		 * Each resource has a sibling {@code .json} document, and parents list their
		 * children explicitly; validated by {@link works.cairn.legacy.LegacyDirectoryValidator}.
		 */
		LEGACY,
	}

	public void validate() {
		if (maxDepth <= 0) {
			throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
		}
		if (objectFileName.isEmpty() || objectFileName.contains("/")) {
			throw new IllegalArgumentException("Invalid object file name: \"" + objectFileName + "\"");
		}
	}
}

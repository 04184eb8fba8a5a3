package works.cairn.legacy;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import works.cairn.MetadataFiles;
import works.cairn.exceptions.MalformedMetadataException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Starts from a valid directory holding a data frame with one child list,
 * a redirection {@code df} to the data frame, and an unrelated object under {@code other}.
 */
class LegacyDirectoryEditorTest {
	static final String PARENT = "df/simple.csv";
	static final String CHILD = "df/child-1/list.json";
	static final String OTHER = "other/data.csv";

	@TempDir Path dir;
	final LegacyDirectoryEditor editor = new LegacyDirectoryEditor();
	final LegacyDirectoryValidator validator = new LegacyDirectoryValidator();

	@BeforeEach
	void setupDirectory() throws IOException {
		Files.createDirectories(dir.resolve("df/child-1"));
		Files.writeString(dir.resolve(PARENT), "A\n1\n", UTF_8);
		MetadataFiles.writeDocument(dir.resolve(PARENT + ".json"), Map.of(
			"path", PARENT,
			"$schema", "csv_data_frame/v1.json",
			"data_frame", Map.of("columns", List.of(Map.of(
				"name", "A",
				"resource", Map.of("type", "local", "path", CHILD)
			)))
		));
		MetadataFiles.writeDocument(dir.resolve(CHILD), Map.of(
			"path", CHILD,
			"$schema", "basic_list/v1.json",
			"is_child", true
		));
		writeRedirection("df", List.of(PARENT));

		Files.createDirectories(dir.resolve("other"));
		Files.writeString(dir.resolve(OTHER), "B\n2\n", UTF_8);
		MetadataFiles.writeDocument(dir.resolve(OTHER + ".json"), Map.of(
			"path", OTHER,
			"$schema", "csv_data_frame/v1.json"
		));
		validator.validate(dir);
	}

	@Test
	void move_rewritesPathsAndRenamesRedirection() throws IOException {
		editor.moveObject(dir, "df", "frame", true);

		assertFalse(Files.exists(dir.resolve("df")));
		assertFalse(Files.exists(dir.resolve("df.json")));
		assertEquals("A\n1\n", Files.readString(dir.resolve("frame/simple.csv"), UTF_8));

		Map<String, Object> parent = MetadataFiles.readDocument(dir.resolve("frame/simple.csv.json"));
		assertEquals("frame/simple.csv", parent.get("path"));
		assertEquals("frame/child-1/list.json", onlyResourcePath(parent));
		assertEquals("frame/child-1/list.json", MetadataFiles.readDocument(dir.resolve("frame/child-1/list.json")).get("path"));

		Map<String, Object> redirection = MetadataFiles.readDocument(dir.resolve("frame.json"));
		assertEquals("frame", redirection.get("path"));
		assertEquals(List.of("frame/simple.csv"), localTargets(redirection));

		validator.validate(dir);
	}

	@Test
	void move_keepingRedirectionName() throws IOException {
		editor.moveObject(dir, PARENT, "frame", false);

		Map<String, Object> redirection = MetadataFiles.readDocument(dir.resolve("df.json"));
		assertEquals("df", redirection.get("path"));
		assertEquals(List.of("frame/simple.csv"), localTargets(redirection));
		assertFalse(Files.exists(dir.resolve("frame.json")));
		validator.validate(dir);
	}

	@Test
	void move_intoNestedDirectory() throws IOException {
		editor.moveObject(dir, "df", "archive/2024/df", false);
		assertTrue(Files.exists(dir.resolve("archive/2024/df/simple.csv")));
		assertEquals(List.of("archive/2024/df/simple.csv"), localTargets(MetadataFiles.readDocument(dir.resolve("df.json"))));
		validator.validate(dir);
	}

	@Test
	void move_leavesOtherObjectsAlone() throws IOException {
		editor.moveObject(dir, "df", "frame", true);
		assertEquals(OTHER, MetadataFiles.readDocument(dir.resolve(OTHER + ".json")).get("path"));
		assertEquals("B\n2\n", Files.readString(dir.resolve(OTHER), UTF_8));
	}

	@Test
	void move_child_rejected() {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
			() -> editor.moveObject(dir, CHILD, "elsewhere", true));
		assertThat(e.getMessage(), containsString("without moving the parent"));
		assertTrue(Files.exists(dir.resolve(CHILD)));
	}

	@Test
	void move_overExistingPath_rejected() throws IOException {
		assertThrows(FileAlreadyExistsException.class, () -> editor.moveObject(dir, "df", "other", true));
		assertThrows(IllegalArgumentException.class, () -> editor.moveObject(dir, "df", "df/inner", true));
		validator.validate(dir);
	}

	@Test
	void move_foreignDocument_changesNothing() throws IOException {
		MetadataFiles.writeDocument(dir.resolve("df/stray.json"), Map.of(
			"path", "elsewhere/stray.json",
			"$schema", "basic_list/v1.json"
		));
		MalformedMetadataException e = assertThrows(MalformedMetadataException.class,
			() -> editor.moveObject(dir, "df", "frame", true));
		assertThat(e.getMessage(), containsString("expected to start with 'df/'"));
		assertTrue(Files.exists(dir.resolve(PARENT)));
		assertFalse(Files.exists(dir.resolve("frame")));
		assertEquals(List.of(PARENT), localTargets(MetadataFiles.readDocument(dir.resolve("df.json"))));
	}

	@Test
	void remove_deletesObjectAndItsRedirection() throws IOException {
		editor.removeObject(dir, PARENT);
		assertFalse(Files.exists(dir.resolve("df")));
		assertFalse(Files.exists(dir.resolve("df.json")));
		assertTrue(Files.exists(dir.resolve(OTHER)));
		validator.validate(dir);
	}

	@Test
	void remove_throughRedirection() throws IOException {
		editor.removeObject(dir, "df");
		assertFalse(Files.exists(dir.resolve("df")));
		assertFalse(Files.exists(dir.resolve("df.json")));
		validator.validate(dir);
	}

	@Test
	void remove_keepsRedirectionWithOtherTargets() throws IOException {
		writeRedirection("both", List.of(PARENT, OTHER));
		validator.validate(dir);

		editor.removeObject(dir, "df");
		assertEquals(List.of(OTHER), localTargets(MetadataFiles.readDocument(dir.resolve("both.json"))));
		validator.validate(dir);
	}

	@Test
	void remove_child_rejected() {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> editor.removeObject(dir, CHILD));
		assertThat(e.getMessage(), containsString("without removing the parent"));
		assertTrue(Files.exists(dir.resolve(CHILD)));
	}

	@Test
	void remove_unknownPath() {
		assertThrows(NoSuchFileException.class, () -> editor.removeObject(dir, "nothing/here.csv"));
	}

	private void writeRedirection(String alias, List<String> targets) throws IOException {
		List<Object> entries = targets.stream()
			.map(t -> (Object) Map.of("type", "local", "location", t))
			.toList();
		MetadataFiles.writeDocument(dir.resolve(alias + ".json"), Map.of(
			"path", alias,
			"$schema", "redirection/v1.json",
			"redirection", Map.of("targets", entries)
		));
	}

	private static Object onlyResourcePath(Map<String, Object> parent) {
		Map<?, ?> frame = (Map<?, ?>) parent.get("data_frame");
		Map<?, ?> column = (Map<?, ?>) ((List<?>) frame.get("columns")).get(0);
		return ((Map<?, ?>) column.get("resource")).get("path");
	}

	private static List<Object> localTargets(Map<String, Object> redirection) {
		Map<?, ?> section = (Map<?, ?>) redirection.get("redirection");
		return ((List<?>) section.get("targets")).stream()
			.<Object>map(t -> ((Map<?, ?>) t).get("location"))
			.toList();
	}

}

package works.cairn;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import works.cairn.exceptions.InvalidObjectException;
import works.cairn.exceptions.MalformedMetadataException;
import works.cairn.exceptions.MissingCapabilityException;
import works.cairn.exceptions.StructuralViolationException;
import works.cairn.exceptions.UnknownTypeException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.cairn.exceptions.StructuralViolationException.Violation.NOT_A_DIRECTORY;

class ObjectReaderTest {
	@TempDir Path dir;
	ObjectReader reader;

	@BeforeEach
	void setupReader() {
		reader = new ObjectReader(SampleTypes.newRegistry());
	}

	@Test
	void leaf() throws IOException {
		SampleTypes.writeLeaf(dir, "hello");
		assertEquals("hello", reader.readObject(dir));
		assertEquals("hello", reader.readObject(dir, String.class));
	}

	@Test
	void nestedObjectsDispatchOnTheirOwnType() throws IOException {
		SampleTypes.writePair(dir);
		SampleTypes.writePair(dir.resolve("left"));
		SampleTypes.writeLeaf(dir.resolve("left").resolve("left"), "a");
		SampleTypes.writeLeaf(dir.resolve("left").resolve("right"), "b");
		SampleTypes.writeLeaf(dir.resolve("right"), "c");
		assertEquals(List.of(List.of("a", "b"), "c"), reader.readObject(dir));
	}

	@Test
	void wrongClass() throws IOException {
		SampleTypes.writeLeaf(dir, "hello");
		InvalidObjectException e = assertThrows(InvalidObjectException.class, () -> reader.readObject(dir, List.class));
		assertThat(e.getMessage(), containsString("to hold a List, but it holds a String"));
	}

	@Test
	void unknownType() throws IOException {
		ObjectFile.write(dir, "mystery", Map.of());
		UnknownTypeException e = assertThrows(UnknownTypeException.class, () -> reader.readObject(dir));
		assertEquals("mystery", e.type());
	}

	@Test
	void typeWithoutReader() throws IOException {
		SampleTypes.writeChain(dir, 0);
		MissingCapabilityException e = assertThrows(MissingCapabilityException.class, () -> reader.readObject(dir));
		assertEquals(Capability.READ, e.capability());
		assertEquals(SampleTypes.CHAIN, e.type());
	}

	@Test
	void notADirectory() throws IOException {
		Path file = Files.writeString(dir.resolve("file"), "hi", UTF_8);
		StructuralViolationException e = assertThrows(StructuralViolationException.class, () -> reader.readObject(file));
		assertEquals(NOT_A_DIRECTORY, e.violation());
		assertThrows(StructuralViolationException.class, () -> reader.readObject(dir.resolve("nope")));
	}

	@Test
	void customObjectFileName() throws IOException {
		ObjectFile.write(dir, SampleTypes.LEAF, Map.of("value", "x"));
		Files.move(dir.resolve(ObjectFile.DEFAULT_NAME), dir.resolve("_meta"));
		ObjectReader custom = new ObjectReader(SampleTypes.newRegistry(), ValidationSettings.builder().objectFileName("_meta").build());
		assertEquals("x", custom.readObject(dir));
		assertThrows(MalformedMetadataException.class, () -> reader.readObject(dir));
	}
}

package works.cairn.basic;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import works.cairn.MetadataFiles;
import works.cairn.ObjectFile;
import works.cairn.ObjectMetadata;
import works.cairn.ObjectValidator;
import works.cairn.basic.AtomicVector.BooleanVector;
import works.cairn.basic.AtomicVector.IntegerVector;
import works.cairn.basic.AtomicVector.NumberVector;
import works.cairn.basic.AtomicVector.StringVector;
import works.cairn.exceptions.EncodingException;
import works.cairn.exceptions.InvalidObjectException;
import works.cairn.exceptions.MalformedMetadataException;
import works.cairn.storage.BooleanColumn;
import works.cairn.storage.IntegerColumn;
import works.cairn.storage.NumberColumn;
import works.cairn.storage.StringColumn;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AtomicVectorFormatTest {

	@TempDir Path dir;
	final ObjectValidator validator = new ObjectValidator(BasicFormats.newRegistry());

	@Test
	void integers_withMissing() throws IOException {
		AtomicVectorFormat.save(dir, new IntegerVector(IntegerColumn.ofNullable(Arrays.asList(1, null, 3))));
		validator.validate(dir);
		assertEquals("uint8", storage().requireString("container"));
		assertTrue(storage().has("placeholder"));

		IntegerColumn restored = ((IntegerVector) AtomicVectorFormat.read(dir)).values();
		assertEquals(3, restored.size());
		assertEquals(1, restored.get(0));
		assertTrue(restored.isMissing(1));
		assertEquals(3, restored.get(2));
	}

	@Test
	void integers_complete_noPlaceholder() throws IOException {
		AtomicVectorFormat.save(dir, new IntegerVector(IntegerColumn.of(-5, 1000)));
		validator.validate(dir);
		assertEquals("int16", storage().requireString("container"));
		assertFalse(storage().has("placeholder"));
	}

	@Test
	void numbers_withMissing() throws IOException {
		AtomicVectorFormat.save(dir, new NumberVector(NumberColumn.ofNullable(Arrays.asList(1.5, null, -2.25))));
		validator.validate(dir);
		assertEquals("float32", storage().requireString("container"));

		NumberColumn restored = ((NumberVector) AtomicVectorFormat.read(dir)).values();
		assertEquals(1.5, restored.get(0));
		assertTrue(restored.isMissing(1));
		assertEquals(-2.25, restored.get(2));
	}

	@Test
	void numbers_integral_storedAsIntegers() throws IOException {
		AtomicVectorFormat.save(dir, new NumberVector(NumberColumn.of(1.0, 2.0, 300.0)));
		validator.validate(dir);
		assertEquals("uint16", storage().requireString("container"));
		assertEquals(300.0, ((NumberVector) AtomicVectorFormat.read(dir)).values().get(2));
	}

	@Test
	void strings_placeholderAvoidsRealValues() throws IOException {
		AtomicVectorFormat.save(dir, new StringVector(StringColumn.utf8("NA", null, "héllo")));
		validator.validate(dir);
		assertEquals("UTF-8", storage().requireString("charset"));

		StringColumn restored = ((StringVector) AtomicVectorFormat.read(dir)).values();
		assertEquals("NA", restored.get(0));
		assertTrue(restored.isMissing(1));
		assertEquals("héllo", restored.get(2));
	}

	@Test
	void unencodableString_nothingWritten() {
		StringVector vector = new StringVector(StringColumn.utf8("a\uD800b", null));
		assertThrows(EncodingException.class, () -> AtomicVectorFormat.save(dir, vector));
		assertFalse(Files.exists(dir.resolve(ObjectFile.DEFAULT_NAME)));
	}

	@Test
	void booleans_withMissing() throws IOException {
		AtomicVectorFormat.save(dir, new BooleanVector(BooleanColumn.of(true, null, false)));
		validator.validate(dir);
		assertEquals("int8", storage().requireString("container"));

		BooleanColumn restored = ((BooleanVector) AtomicVectorFormat.read(dir)).values();
		assertEquals(true, restored.get(0));
		assertTrue(restored.isMissing(1));
		assertEquals(false, restored.get(2));
	}

	@Test
	void heightAndDimensions() throws IOException {
		AtomicVectorFormat.save(dir, new IntegerVector(IntegerColumn.of(4, 5, 6, 7)));
		assertEquals(4, validator.height(dir));
		assertEquals(List.of(4L), validator.dimensions(dir));
	}

	@Test
	void fewerValuesThanLength() throws IOException {
		AtomicVectorFormat.save(dir, new IntegerVector(IntegerColumn.of(1, 2, 3)));
		MetadataFiles.writeDocument(dir.resolve(AtomicVectorFormat.CONTENTS), Map.of("values", List.of(1, 2)));
		InvalidObjectException e = assertThrows(InvalidObjectException.class, () -> validator.validate(dir));
		assertThat(e.getMessage(), containsString("number of values (2) does not match the declared length (3)"));
	}

	@Test
	void valueOutsideContainer() throws IOException {
		AtomicVectorFormat.save(dir, new IntegerVector(IntegerColumn.of(1, 2)));
		MetadataFiles.writeDocument(dir.resolve(AtomicVectorFormat.CONTENTS), Map.of("values", List.of(1, 300)));
		InvalidObjectException e = assertThrows(InvalidObjectException.class, () -> validator.validate(dir));
		assertThat(e.getMessage(), containsString("value 1 (300) does not fit in the 'uint8' container"));
	}

	@Test
	void missingContentsFile() throws IOException {
		AtomicVectorFormat.save(dir, new IntegerVector(IntegerColumn.of(1)));
		Files.delete(dir.resolve(AtomicVectorFormat.CONTENTS));
		assertThrows(MalformedMetadataException.class, () -> validator.validate(dir));
	}

	@Test
	void unsupportedVersion() throws IOException {
		AtomicVectorFormat.save(dir, new IntegerVector(IntegerColumn.of(1)));
		rewriteSection(section -> section.put("version", "2.0"));
		MalformedMetadataException e = assertThrows(MalformedMetadataException.class, () -> validator.validate(dir));
		assertThat(e.getMessage(), containsString("unsupported version '2.0'"));
	}

	@Test
	void unknownKind() throws IOException {
		AtomicVectorFormat.save(dir, new IntegerVector(IntegerColumn.of(1)));
		rewriteSection(section -> section.put("type", "complex"));
		MalformedMetadataException e = assertThrows(MalformedMetadataException.class, () -> validator.validate(dir));
		assertThat(e.getMessage(), containsString("unknown vector type 'complex'"));
	}

	@Test
	void booleansOutsideInt8() throws IOException {
		AtomicVectorFormat.save(dir, new BooleanVector(BooleanColumn.of(true, false)));
		rewriteSection(section -> section.put("storage", Map.of("container", "uint8")));
		MalformedMetadataException e = assertThrows(MalformedMetadataException.class, () -> validator.validate(dir));
		assertThat(e.getMessage(), containsString("container 'uint8' cannot hold boolean values"));
	}

	@Test
	void placeholderOutsideContainer() throws IOException {
		AtomicVectorFormat.save(dir, new IntegerVector(IntegerColumn.of(1)));
		rewriteSection(section -> section.put("storage", Map.of("container", "int8", "placeholder", 1000)));
		MalformedMetadataException e = assertThrows(MalformedMetadataException.class, () -> validator.validate(dir));
		assertEquals("atomic_vector.storage.placeholder", e.field());
	}

	private ObjectMetadata storage() {
		return ObjectFile.read(dir).section(AtomicVectorFormat.TYPE).section("storage");
	}

	private void rewriteSection(Consumer<Map<String, Object>> edit) throws IOException {
		Map<String, Object> section = new LinkedHashMap<>(ObjectFile.read(dir).section(AtomicVectorFormat.TYPE).asMap());
		edit.accept(section);
		ObjectFile.write(dir, AtomicVectorFormat.TYPE, Map.of(AtomicVectorFormat.TYPE, section));
	}

}

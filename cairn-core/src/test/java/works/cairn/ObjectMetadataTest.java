package works.cairn;

import java.math.BigInteger;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.cairn.exceptions.MalformedMetadataException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ObjectMetadataTest {
	static final Path SOURCE = Path.of("some", "OBJECT");

	final ObjectMetadata metadata = ObjectMetadata.of(SOURCE, Map.of(
		"type", "thing",
		"count", 3,
		"big", new BigInteger("12345678901"),
		"negative", -1,
		"ratio", 0.5,
		"flag", true,
		"names", List.of("a", "b"),
		"nested", Map.of("inner", Map.of("value", "x"))
	));

	@Test
	void typedAccessors() {
		assertEquals("thing", metadata.type());
		assertEquals(3L, metadata.requireLong("count"));
		assertEquals(12345678901L, metadata.requireCount("big"));
		assertEquals(true, metadata.optionalBoolean("flag").orElseThrow());
		assertEquals(List.of("a", "b"), metadata.requireList("names"));
		assertTrue(metadata.optionalString("absent").isEmpty());
		assertFalse(metadata.has("absent"));
	}

	@Test
	void nonIntegers_rejected() {
		MalformedMetadataException e = assertThrows(MalformedMetadataException.class, () -> metadata.requireLong("ratio"));
		assertEquals("ratio", e.field());
		assertEquals(SOURCE, e.file());
		assertThat(e.getMessage(), containsString("expected an integer"));
	}

	@Test
	void negativeCount_rejected() {
		assertEquals(-1L, metadata.requireLong("negative"));
		assertThrows(MalformedMetadataException.class, () -> metadata.requireCount("negative"));
	}

	@Test
	void nestedSections_reportDottedField() {
		ObjectMetadata inner = metadata.section("nested").section("inner");
		assertEquals("x", inner.requireString("value"));

		MalformedMetadataException e = assertThrows(MalformedMetadataException.class, () -> inner.requireLong("value"));
		assertEquals("nested.inner.value", e.field());
		assertThat(e.getMessage(), containsString("at 'nested.inner.value'"));
	}

	@Test
	void wrongKinds_rejected() {
		assertThrows(MalformedMetadataException.class, () -> metadata.section("type"));
		assertThrows(MalformedMetadataException.class, () -> metadata.section("absent"));
		assertThrows(MalformedMetadataException.class, () -> metadata.optionalBoolean("count"));
		assertThrows(MalformedMetadataException.class, () -> metadata.requireList("flag"));
		assertThrows(MalformedMetadataException.class, () -> metadata.requireString("count"));
		assertTrue(metadata.optionalSection("absent").isEmpty());
	}

}

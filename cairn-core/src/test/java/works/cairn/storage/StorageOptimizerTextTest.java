package works.cairn.storage;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.cairn.exceptions.EncodingException;
import works.cairn.storage.Placeholder.IntegerPlaceholder;
import works.cairn.storage.Placeholder.StringPlaceholder;
import works.cairn.storage.StorageType.StringType;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.cairn.storage.StorageType.IntegerType.INT8;
import static works.cairn.storage.TextEncoding.ASCII;
import static works.cairn.storage.TextEncoding.LATIN1;
import static works.cairn.storage.TextEncoding.UTF8;

/**
 * Strings and booleans.
 */
class StorageOptimizerTextTest {

	@Test
	void widthIsLongestValue() {
		assertEquals(StorageEncoding.of(new StringType(2, ASCII)), StorageOptimizer.optimizeStrings(StringColumn.utf8("a", "bb", "")));
	}

	@Test
	void emptyStrings_widthOne() {
		assertEquals(StorageEncoding.of(new StringType(1, ASCII)), StorageOptimizer.optimizeStrings(StringColumn.utf8("", "")));
		assertEquals(StorageEncoding.of(new StringType(1, ASCII)), StorageOptimizer.optimizeStrings(StringColumn.utf8()));
	}

	@Test
	void widthCountsUtf8Bytes() {
		assertEquals(StorageEncoding.of(new StringType(2, UTF8)), StorageOptimizer.optimizeStrings(StringColumn.utf8("é", "a")));
	}

	@Test
	void missing_naPlaceholder() {
		StorageEncoding actual = StorageOptimizer.optimizeStrings(StringColumn.utf8("abcdef", null));
		assertEquals(new StorageEncoding(new StringType(6, ASCII), new StringPlaceholder("NA")), actual);
	}

	@Test
	void placeholderWidensBuffer() {
		StorageEncoding actual = StorageOptimizer.optimizeStrings(StringColumn.utf8("x", null));
		assertEquals(new StorageEncoding(new StringType(2, ASCII), new StringPlaceholder("NA")), actual);
	}

	@Test
	void naPresent_prependsUnderscores() {
		assertEquals(new StringPlaceholder("_NA"),
			StorageOptimizer.optimizeStrings(StringColumn.utf8("NA", null)).placeholder());

		StorageEncoding actual = StorageOptimizer.optimizeStrings(StringColumn.utf8("NA", "_NA", null));
		assertEquals(new StorageEncoding(new StringType(4, ASCII), new StringPlaceholder("__NA")), actual);
	}

	@Test
	void declaredAsciiWithNonAscii_rejected() {
		StringColumn column = StringColumn.of(ASCII, List.of("plain", "naïve"));
		EncodingException e = assertThrows(EncodingException.class, () -> StorageOptimizer.optimizeStrings(column));
		assertThat(e.getMessage(), containsString("ASCII"));
	}

	@Test
	void otherEncoding_rejected() {
		StringColumn column = new StringColumn(List.of("a", "b"), List.of(UTF8, LATIN1));
		EncodingException e = assertThrows(EncodingException.class, () -> StorageOptimizer.optimizeStrings(column));
		assertThat(e.getMessage(), containsString("LATIN1"));
	}

	@Test
	void unpairedSurrogate_rejected() {
		StringColumn column = StringColumn.utf8("ok", "a\uD800b", null);
		EncodingException e = assertThrows(EncodingException.class, () -> StorageOptimizer.optimizeStrings(column));
		assertThat(e.getMessage(), containsString("value 1 cannot be encoded as UTF-8"));
	}

	@Test
	void surrogatePair_countsFourBytes() {
		assertEquals(StorageEncoding.of(new StringType(4, UTF8)), StorageOptimizer.optimizeStrings(StringColumn.utf8("\uD83D\uDE00", "ab")));
	}

	@Test
	void booleans() {
		assertEquals(StorageEncoding.of(INT8), StorageOptimizer.optimizeBooleans(BooleanColumn.of(true, false)));
		assertEquals(new StorageEncoding(INT8, new IntegerPlaceholder(-1)),
			StorageOptimizer.optimizeBooleans(new BooleanColumn(Arrays.asList(true, null))));
	}

}

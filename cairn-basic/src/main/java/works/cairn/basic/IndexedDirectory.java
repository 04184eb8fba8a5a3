package works.cairn.basic;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import works.cairn.exceptions.InvalidObjectException;

/**
 * A directory whose entries are named {@code 0}, {@code 1}, ... {@code n-1}, with nothing else in it.
 */
final class IndexedDirectory {
	private IndexedDirectory() { }

	/**
	 * @param name used in error messages
	 * @return the entries in index order
	 * @throws InvalidObjectException if the directory is missing when {@code expectedCount > 0},
	 * or doesn't contain exactly the expected entries
	 */
	static List<Path> entries(Path directory, String name, long expectedCount) {
		if (!Files.exists(directory)) {
			if (expectedCount == 0) {
				return List.of();
			}
			throw new InvalidObjectException("expected '" + name + "' to be a directory");
		}
		if (!Files.isDirectory(directory)) {
			throw new InvalidObjectException("expected '" + name + "' to be a directory");
		}
		List<String> names;
		try (Stream<Path> list = Files.list(directory)) {
			names = list.map(p -> p.getFileName().toString()).sorted().toList();
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to list " + directory, e);
		}
		for (String entry : names) {
			if (!isIndexBelow(entry, expectedCount)) {
				throw new InvalidObjectException("unexpected entry '" + name + "/" + entry + "'");
			}
		}
		if (names.size() != expectedCount) {
			throw new InvalidObjectException("expected " + expectedCount + " entries in '" + name + "', found " + names.size());
		}
		List<Path> result = new ArrayList<>(names.size());
		for (int i = 0; i < expectedCount; i++) {
			result.add(directory.resolve(Integer.toString(i)));
		}
		return result;
	}

	/**
	 * Rejects leading zeros, so each index has exactly one spelling.
	 */
	private static boolean isIndexBelow(String entry, long bound) {
		if (entry.isEmpty() || entry.length() > 10 || (entry.length() > 1 && entry.charAt(0) == '0')) {
			return false;
		}
		for (int i = 0; i < entry.length(); i++) {
			char c = entry.charAt(i);
			if (c < '0' || c > '9') {
				return false;
			}
		}
		return Long.parseLong(entry) < bound;
	}
}

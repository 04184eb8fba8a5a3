package works.cairn.legacy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import works.cairn.ObjectMetadata;

/**
 * One {@code .json} metadata document in a legacy directory.
 *
 * @param location where the document is stored, relative to the root
 * @param path the resource the document describes, or the alias for a redirection
 * @param childPaths every {@code resource.path} referenced from within the document
 * @param redirectTargets locations of the local targets, for a redirection
 */
record LegacyDocument(
	String location,
	ObjectMetadata metadata,
	String path,
	boolean redirection,
	boolean child,
	List<String> childPaths,
	List<String> redirectTargets
) {
	static final String PATH = "path";
	static final String SCHEMA = "$schema";
	static final String IS_CHILD = "is_child";
	static final String RESOURCE = "resource";
	static final String REDIRECTION = "redirection";
	static final String TARGETS = "targets";
	static final String REDIRECTION_SCHEMA_PREFIX = "redirection/";
	static final String REDIRECTION_SCHEMA = REDIRECTION_SCHEMA_PREFIX + "v1.json";
	static final String LOCAL = "local";

	static LegacyDocument parse(String location, ObjectMetadata metadata) {
		String path = metadata.requireString(PATH);
		String schema = metadata.optionalString(SCHEMA).orElse("");
		if (schema.startsWith(REDIRECTION_SCHEMA_PREFIX)) {
			return new LegacyDocument(location, metadata, path, true, false, List.of(), redirectTargets(metadata));
		}
		boolean child = metadata.optionalBoolean(IS_CHILD).orElse(false);
		List<String> children = new ArrayList<>();
		collectResourcePaths(metadata, metadata.asMap(), children);
		return new LegacyDocument(location, metadata, path, false, child, List.copyOf(children), List.of());
	}

	private static List<String> redirectTargets(ObjectMetadata metadata) {
		List<String> result = new ArrayList<>();
		for (Object entry : metadata.section(REDIRECTION).requireList(TARGETS)) {
			if (!(entry instanceof Map)) {
				throw metadata.malformed(REDIRECTION + "." + TARGETS, "expected an array of objects");
			}
			Map<?, ?> target = (Map<?, ?>) entry;
			if (LOCAL.equals(target.get("type"))) {
				Object location = target.get("location");
				if (!(location instanceof String)) {
					throw metadata.malformed(REDIRECTION + "." + TARGETS, "expected a string location for a local target");
				}
				result.add((String) location);
			}
		}
		return result;
	}

	/**
	 * A {@code resource} object ends the search along its branch;
	 * anything nested inside it is not a separate reference.
	 */
	private static void collectResourcePaths(ObjectMetadata metadata, Object node, List<String> out) {
		if (node instanceof Map) {
			Map<?, ?> map = (Map<?, ?>) node;
			Object resource = map.get(RESOURCE);
			if (resource instanceof Map) {
				Object path = ((Map<?, ?>) resource).get(PATH);
				if (!(path instanceof String)) {
					throw metadata.malformed(RESOURCE + "." + PATH, "expected a string");
				}
				out.add((String) path);
				return;
			}
			for (Object value : map.values()) {
				collectResourcePaths(metadata, value, out);
			}
		} else if (node instanceof List) {
			for (Object value : (List<?>) node) {
				collectResourcePaths(metadata, value, out);
			}
		}
	}
}

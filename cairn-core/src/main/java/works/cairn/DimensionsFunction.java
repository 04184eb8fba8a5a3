package works.cairn;

import java.nio.file.Path;
import java.util.List;

@FunctionalInterface
public interface DimensionsFunction {
	List<Long> dimensions(Path path, ObjectMetadata metadata, ValidationContext context);
}

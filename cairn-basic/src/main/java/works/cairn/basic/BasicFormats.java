package works.cairn.basic;

import works.cairn.ConflictPolicy;
import works.cairn.TypeRegistry;

/**
 * Installs the built-in formats into a {@link TypeRegistry}.
 */
public final class BasicFormats {
	private BasicFormats() { }

	public static TypeRegistry newRegistry() {
		TypeRegistry result = new TypeRegistry();
		register(result, ConflictPolicy.ERROR);
		return result;
	}

	/**
	 * @param policy applied to each function individually
	 */
	public static void register(TypeRegistry registry, ConflictPolicy policy) {
		registry.registerValidate(AtomicVectorFormat.TYPE, AtomicVectorFormat::validate, policy);
		registry.registerHeight(AtomicVectorFormat.TYPE, AtomicVectorFormat::height, policy);
		registry.registerDimensions(AtomicVectorFormat.TYPE, AtomicVectorFormat::dimensions, policy);
		registry.registerRead(AtomicVectorFormat.TYPE, AtomicVectorFormat::read, policy);

		registry.registerValidate(SimpleListFormat.TYPE, SimpleListFormat::validate, policy);
		registry.registerHeight(SimpleListFormat.TYPE, SimpleListFormat::height, policy);
		registry.registerDimensions(SimpleListFormat.TYPE, SimpleListFormat::dimensions, policy);
		registry.registerRead(SimpleListFormat.TYPE, SimpleListFormat::read, policy);
		registry.declareInterface(SimpleListFormat.TYPE, SimpleListFormat.INTERFACE);

		registry.registerValidate(DataFrameFormat.TYPE, DataFrameFormat::validate, policy);
		registry.registerHeight(DataFrameFormat.TYPE, DataFrameFormat::height, policy);
		registry.registerDimensions(DataFrameFormat.TYPE, DataFrameFormat::dimensions, policy);
		registry.registerRead(DataFrameFormat.TYPE, DataFrameFormat::read, policy);
		registry.declareInterface(DataFrameFormat.TYPE, DataFrameFormat.INTERFACE);
	}
}

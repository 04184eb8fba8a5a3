package works.cairn.storage;

/**
 * The container type chosen to store a column.
 */
public sealed interface StorageType permits
	StorageType.IntegerType,
	StorageType.FloatType,
	StorageType.StringType
{
	/**
	 * @return the name recorded in metadata, such as {@code uint8} or {@code float64}
	 */
	String descriptor();

	record IntegerType(boolean signed, int bits) implements StorageType {
		public static final IntegerType UINT8 = new IntegerType(false, 8);
		public static final IntegerType INT8 = new IntegerType(true, 8);
		public static final IntegerType UINT16 = new IntegerType(false, 16);
		public static final IntegerType INT16 = new IntegerType(true, 16);
		public static final IntegerType UINT32 = new IntegerType(false, 32);
		public static final IntegerType INT32 = new IntegerType(true, 32);

		public IntegerType {
			if (bits != 8 && bits != 16 && bits != 32) {
				throw new IllegalArgumentException("Unsupported integer width: " + bits);
			}
		}

		public long min() {
			return signed ? -(1L << (bits - 1)) : 0L;
		}

		public long max() {
			return signed ? (1L << (bits - 1)) - 1 : (1L << bits) - 1;
		}

		public boolean contains(long value) {
			return min() <= value && value <= max();
		}

		@Override
		public String descriptor() {
			return (signed ? "int" : "uint") + bits;
		}

		public static IntegerType fromDescriptor(String descriptor) {
			switch (descriptor) {
				case "uint8": return UINT8;
				case "int8": return INT8;
				case "uint16": return UINT16;
				case "int16": return INT16;
				case "uint32": return UINT32;
				case "int32": return INT32;
				default: throw new IllegalArgumentException("Not an integer type: \"" + descriptor + "\"");
			}
		}
	}

	record FloatType(int bits) implements StorageType {
		public static final FloatType FLOAT32 = new FloatType(32);
		public static final FloatType FLOAT64 = new FloatType(64);

		public FloatType {
			if (bits != 32 && bits != 64) {
				throw new IllegalArgumentException("Unsupported floating-point width: " + bits);
			}
		}

		public double lowest() {
			return bits == 32 ? -Float.MAX_VALUE : -Double.MAX_VALUE;
		}

		public double highest() {
			return bits == 32 ? Float.MAX_VALUE : Double.MAX_VALUE;
		}

		/**
		 * @return true if {@code value} survives conversion to this width unchanged
		 */
		public boolean represents(double value) {
			return bits == 64 || Double.isNaN(value) || (double) (float) value == value;
		}

		@Override
		public String descriptor() {
			return "float" + bits;
		}
	}

	/**
	 * A fixed-width, null-padded byte buffer.
	 *
	 * @param size width in bytes
	 */
	record StringType(int size, TextEncoding charset) implements StorageType {
		public StringType {
			if (size < 1) {
				throw new IllegalArgumentException("String width must be positive: " + size);
			}
			if (!charset.storable()) {
				throw new IllegalArgumentException("Character set cannot be stored: " + charset);
			}
		}

		@Override
		public String descriptor() {
			return "string";
		}
	}
}

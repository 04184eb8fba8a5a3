package works.cairn.basic;

import works.cairn.storage.BooleanColumn;
import works.cairn.storage.IntegerColumn;
import works.cairn.storage.NumberColumn;
import works.cairn.storage.StringColumn;

/**
 * A one-dimensional column of values of a single kind, with missing values.
 */
public sealed interface AtomicVector permits
	AtomicVector.IntegerVector,
	AtomicVector.NumberVector,
	AtomicVector.StringVector,
	AtomicVector.BooleanVector
{
	int length();

	/**
	 * @return the kind recorded in metadata
	 */
	ValueKind kind();

	enum ValueKind {
		INTEGER("integer"),
		NUMBER("number"),
		STRING("string"),
		BOOLEAN("boolean"),
		;

		private final String tag;

		ValueKind(String tag) {
			this.tag = tag;
		}

		public String tag() {
			return tag;
		}
	}

	record IntegerVector(IntegerColumn values) implements AtomicVector {
		@Override
		public int length() {
			return values.size();
		}

		@Override
		public ValueKind kind() {
			return ValueKind.INTEGER;
		}
	}

	record NumberVector(NumberColumn values) implements AtomicVector {
		@Override
		public int length() {
			return values.size();
		}

		@Override
		public ValueKind kind() {
			return ValueKind.NUMBER;
		}
	}

	record StringVector(StringColumn values) implements AtomicVector {
		@Override
		public int length() {
			return values.size();
		}

		@Override
		public ValueKind kind() {
			return ValueKind.STRING;
		}
	}

	record BooleanVector(BooleanColumn values) implements AtomicVector {
		@Override
		public int length() {
			return values.size();
		}

		@Override
		public ValueKind kind() {
			return ValueKind.BOOLEAN;
		}
	}
}

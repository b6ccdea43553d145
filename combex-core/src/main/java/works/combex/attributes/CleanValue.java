package works.combex.attributes;

import static java.util.Objects.requireNonNull;

/**
 * A scalar attribute value that is safe to put on the wire.
 * Never null, never a container.
 */
public sealed interface CleanValue {
	/**
	 * @return the plain Java object for this value, suitable for a JSON codec
	 */
	Object asObject();

	record StringValue(String value) implements CleanValue {
		public StringValue {
			requireNonNull(value);
		}

		@Override public Object asObject() { return value; }
	}

	record LongValue(long value) implements CleanValue {
		@Override public Object asObject() { return value; }
	}

	record DoubleValue(double value) implements CleanValue {
		@Override public Object asObject() { return value; }
	}

	record BooleanValue(boolean value) implements CleanValue {
		@Override public Object asObject() { return value; }
	}

	static CleanValue of(String value) { return new StringValue(value); }
	static CleanValue of(long value) { return new LongValue(value); }
	static CleanValue of(double value) { return new DoubleValue(value); }
	static CleanValue of(boolean value) { return new BooleanValue(value); }
}

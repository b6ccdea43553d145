package works.combex.attributes;

import static java.util.Objects.requireNonNull;

public record Attribute(String key, CleanValue value) {
	public Attribute {
		requireNonNull(key);
		requireNonNull(value);
	}

	public static Attribute of(String key, String value) { return new Attribute(key, CleanValue.of(value)); }
	public static Attribute of(String key, long value) { return new Attribute(key, CleanValue.of(value)); }
	public static Attribute of(String key, double value) { return new Attribute(key, CleanValue.of(value)); }
	public static Attribute of(String key, boolean value) { return new Attribute(key, CleanValue.of(value)); }

	public Attribute withValue(CleanValue newValue) {
		return new Attribute(key, newValue);
	}
}

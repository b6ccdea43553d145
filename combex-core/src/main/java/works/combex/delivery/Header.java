package works.combex.delivery;

import static java.util.Objects.requireNonNull;

public record Header(String name, String value) {
	public Header {
		requireNonNull(name);
		requireNonNull(value);
	}

	public static Header of(String name, String value) {
		return new Header(name, value);
	}

	public boolean hasName(String other) {
		return name.equalsIgnoreCase(other);
	}
}

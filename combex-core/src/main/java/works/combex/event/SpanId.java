package works.combex.event;

import static java.lang.Long.parseUnsignedLong;

/**
 * A 64-bit span identifier.
 */
public record SpanId(long value) {
	public static SpanId fromHex(String hex) {
		if (hex.length() != 16) {
			throw new IllegalArgumentException("Span ID must be 16 hex digits: \"" + hex + "\"");
		}
		return new SpanId(parseUnsignedLong(hex, 16));
	}

	/**
	 * @return 16 lower-case hex digits, zero-padded
	 */
	public String toHex() {
		return hex16(value);
	}

	static String hex16(long value) {
		String digits = Long.toHexString(value);
		return "0".repeat(16 - digits.length()) + digits;
	}

	@Override
	public String toString() {
		return toHex();
	}
}

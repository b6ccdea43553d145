package works.combex.event;

import static java.lang.Long.parseUnsignedLong;

/**
 * A 128-bit trace identifier.
 */
public record TraceId(long high, long low) {
	public static TraceId fromHex(String hex) {
		if (hex.length() != 32) {
			throw new IllegalArgumentException("Trace ID must be 32 hex digits: \"" + hex + "\"");
		}
		return new TraceId(
			parseUnsignedLong(hex.substring(0, 16), 16),
			parseUnsignedLong(hex.substring(16), 16));
	}

	/**
	 * @return 32 lower-case hex digits, zero-padded
	 */
	public String toHex() {
		return SpanId.hex16(high) + SpanId.hex16(low);
	}

	@Override
	public String toString() {
		return toHex();
	}
}

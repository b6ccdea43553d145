package works.combex.attributes;

import works.combex.attributes.CleanValue.StringValue;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Cuts string values down to the ingestion endpoint's value size limit.
 *
 * <p>
 * A trimmed string is exactly {@code limit} bytes of UTF-8:
 * a prefix of the original followed by between {@value #MIN_ELLIPSIS} and {@value #MAX_ELLIPSIS} periods.
 * The ellipsis grows one period at a time until the cut falls on a code point boundary,
 * so the result is always valid UTF-8.
 */
public final class ValueTrimmer {
	public static final int DEFAULT_VALUE_LIMIT = 49_127;
	public static final int MIN_ELLIPSIS = 3;
	public static final int MAX_ELLIPSIS = 7;

	private final int limit;

	public ValueTrimmer(int limit) {
		if (limit < MAX_ELLIPSIS) {
			throw new IllegalArgumentException("Value limit must be at least " + MAX_ELLIPSIS + " bytes; got " + limit);
		}
		this.limit = limit;
	}

	public int limit() {
		return limit;
	}

	public CleanAttributes trim(CleanAttributes attributes) {
		return attributes.mapValues(this::trim);
	}

	public CleanValue trim(CleanValue value) {
		if (value instanceof StringValue s) {
			return new StringValue(trim(s.value()));
		} else {
			return value;
		}
	}

	public String trim(String value) {
		if ((long) value.length() * 3 <= limit) {
			// Every UTF-16 char is at most 3 bytes of UTF-8
			return value;
		}
		byte[] bytes = value.getBytes(UTF_8);
		if (bytes.length <= limit) {
			return value;
		}
		for (int ellipsis = MIN_ELLIPSIS; ellipsis <= limit; ellipsis++) {
			int cut = limit - ellipsis;
			if (isCodePointStart(bytes[cut])) {
				return new String(bytes, 0, cut, UTF_8) + ".".repeat(ellipsis);
			}
		}
		return ".".repeat(limit);
	}

	private static boolean isCodePointStart(byte b) {
		return (b & 0xC0) != 0x80;
	}
}

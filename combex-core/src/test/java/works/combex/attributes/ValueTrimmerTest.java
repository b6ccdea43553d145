package works.combex.attributes;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.ByteBuffer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValueTrimmerTest {
	@Test
	void shortString_isUnchanged() {
		String value = "short";
		assertSame(value, new ValueTrimmer(ValueTrimmer.DEFAULT_VALUE_LIMIT).trim(value));
	}

	@Test
	void asciiString_endsWithThreeDots() {
		String trimmed = new ValueTrimmer(10).trim("abcdefghijklmnop");
		assertEquals("abcdefg...", trimmed);
	}

	@Test
	void stringAtLimit_isUnchanged() {
		assertEquals("abcdefghij", new ValueTrimmer(10).trim("abcdefghij"));
	}

	@ParameterizedTest
	@ValueSource(strings = {"é", "€", "😀"})
	void multibyteStrings_trimToExactlyTheLimitWithValidUtf8(String character) throws CharacterCodingException {
		for (int limit = 7; limit < 40; limit++) {
			String trimmed = new ValueTrimmer(limit).trim(character.repeat(50));
			byte[] bytes = trimmed.getBytes(UTF_8);
			assertEquals(limit, bytes.length, "limit " + limit);
			assertValidUtf8(bytes);
			int dots = trimmed.length() - trimmed.replaceAll("\\.+$", "").length();
			assertTrue(dots >= 3 && dots <= 7, "ellipsis of " + dots + " for limit " + limit);
		}
	}

	@Test
	void defaultLimit_isRespected() {
		String trimmed = new ValueTrimmer(ValueTrimmer.DEFAULT_VALUE_LIMIT).trim("€".repeat(20_000));
		assertEquals(ValueTrimmer.DEFAULT_VALUE_LIMIT, trimmed.getBytes(UTF_8).length);
	}

	@Test
	void nonStringValues_areUnchanged() {
		ValueTrimmer trimmer = new ValueTrimmer(7);
		assertEquals(CleanValue.of(123456789L), trimmer.trim(CleanValue.of(123456789L)));
	}

	@Test
	void tinyLimit_throws() {
		assertThrows(IllegalArgumentException.class, () -> new ValueTrimmer(6));
	}

	private static void assertValidUtf8(byte[] bytes) throws CharacterCodingException {
		UTF_8.newDecoder()
			.onMalformedInput(CodingErrorAction.REPORT)
			.onUnmappableCharacter(CodingErrorAction.REPORT)
			.decode(ByteBuffer.wrap(bytes));
	}
}

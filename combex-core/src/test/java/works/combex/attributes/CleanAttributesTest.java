package works.combex.attributes;

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class CleanAttributesTest {
	@Test
	void sort_ordersByKeyAndKeepsFirst() {
		CleanAttributes actual = CleanAttributes.sort(List.of(
			Attribute.of("b", 1L),
			Attribute.of("a", "first"),
			Attribute.of("a", "second")));
		assertEquals(List.of(
			Attribute.of("a", "first"),
			Attribute.of("b", 1L)
		), actual.asList());
	}

	@Test
	void merge_prefersReceiver() {
		CleanAttributes mine = CleanAttributes.of(Attribute.of("shared", "mine"), Attribute.of("x", 1L));
		CleanAttributes theirs = CleanAttributes.of(Attribute.of("shared", "theirs"), Attribute.of("y", 2L));
		assertEquals(CleanAttributes.of(
			Attribute.of("shared", "mine"),
			Attribute.of("x", 1L),
			Attribute.of("y", 2L)
		), mine.merge(theirs));
	}

	@Test
	void without_removesKey() {
		CleanAttributes attributes = CleanAttributes.of(Attribute.of("a", 1L), Attribute.of("b", 2L));
		CleanAttributes actual = attributes.without("a");
		assertFalse(actual.containsKey("a"));
		assertEquals(1, actual.size());
	}
}

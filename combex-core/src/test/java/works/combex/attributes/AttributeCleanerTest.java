package works.combex.attributes;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.combex.attributes.RawValue.Entry;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static works.combex.attributes.UnsupportedValuePolicy.INSPECT;

class AttributeCleanerTest {
	final AttributeCleaner cleaner = AttributeCleaner.dropping();

	enum Color { RED }

	@Test
	void scalars_passThrough() {
		CleanAttributes actual = cleaner.clean(Map.of(
			"s", "text",
			"i", 42,
			"f", 1.5,
			"b", true));
		assertEquals(CleanAttributes.of(
			Attribute.of("b", true),
			Attribute.of("f", 1.5),
			Attribute.of("i", 42L),
			Attribute.of("s", "text")
		), actual);
	}

	@Test
	void nestedMaps_flatten() {
		CleanAttributes actual = cleaner.clean(Map.of(
			"map", Map.of(
				"a", 1,
				"b", Map.of("c", "deep"))));
		assertEquals(CleanAttributes.of(
			Attribute.of("map.a", 1L),
			Attribute.of("map.b.c", "deep")
		), actual);
	}

	@Test
	void typeTag_isStripped() {
		Map<String, Object> nested = new LinkedHashMap<>();
		nested.put(AttributeCleaner.TYPE_TAG_KEY, "SomeStruct");
		nested.put("field", "value");
		assertEquals(
			CleanAttributes.of(Attribute.of("outer.field", "value")),
			cleaner.clean(Map.of("outer", nested)));
	}

	@Test
	void nullsAndUnsupported_areDropped() {
		Map<Object, Object> input = new LinkedHashMap<>();
		input.put("null", null);
		input.put("list", List.of(1, 2));
		input.put(42, "non-string key");
		input.put("kept", "yes");
		assertEquals(CleanAttributes.of(Attribute.of("kept", "yes")), cleaner.clean(input));
	}

	@Test
	void enums_becomeNames() {
		Map<Object, Object> input = new LinkedHashMap<>();
		input.put(Color.RED, "key was an enum");
		input.put("color", Color.RED);
		assertEquals(CleanAttributes.of(
			Attribute.of("RED", "key was an enum"),
			Attribute.of("color", "RED")
		), cleaner.clean(input));
	}

	@Test
	void duplicateKeys_keepFirst() {
		CleanAttributes actual = cleaner.clean(List.of(
			new Entry("k", RawValue.of("first")),
			new Entry("k", RawValue.of("second"))));
		assertEquals(CleanAttributes.of(Attribute.of("k", "first")), actual);
	}

	@Test
	void nonMapInput_isEmpty() {
		assertEquals(CleanAttributes.empty(), cleaner.clean("not a map"));
		assertEquals(CleanAttributes.empty(), cleaner.clean(null));
	}

	@Test
	void cleaning_isIdempotent() {
		CleanAttributes once = cleaner.clean(Map.of(
			"a", Map.of("b", 1, "c", "x"),
			"d", false));
		assertEquals(once, cleaner.clean(once.toMap()));
		assertEquals(once, cleaner.clean(once));
	}

	@Test
	void selfReferencingMap_isDroppedWhereItRecurs() {
		Map<String, Object> self = new LinkedHashMap<>();
		self.put("a", 1);
		self.put("self", self);
		assertEquals(
			CleanAttributes.of(Attribute.of("root.a", 1L)),
			cleaner.clean(Map.of("root", self)));
		assertEquals(
			CleanAttributes.of(Attribute.of("a", 1L)),
			cleaner.clean(self));
	}

	@Test
	void mutuallyReferencingMaps_areDroppedWhereTheyRecur() {
		Map<String, Object> outer = new LinkedHashMap<>();
		Map<String, Object> inner = new LinkedHashMap<>();
		outer.put("name", "outer");
		outer.put("inner", inner);
		inner.put("name", "inner");
		inner.put("outer", outer);
		assertEquals(CleanAttributes.of(
			Attribute.of("inner.name", "inner"),
			Attribute.of("name", "outer")
		), cleaner.clean(RawValue.mapOf(outer)));
	}

	@Test
	void sharedMap_isNotACycle() {
		Map<String, Object> shared = Map.of("x", 1);
		assertEquals(CleanAttributes.of(
			Attribute.of("left.x", 1L),
			Attribute.of("right.x", 1L)
		), cleaner.clean(Map.of("left", shared, "right", shared)));
	}

	@Test
	void inspectPolicy_rendersUnsupportedValues() {
		CleanAttributes actual = new AttributeCleaner(INSPECT).clean(Map.of(
			"list", List.of(1, 2, 3, 4, 5, 6, 7)));
		String rendered = (String) actual.get("list").orElseThrow().asObject();
		assertEquals("[1, 2, 3, 4, 5, ...]", rendered);
	}

	@Test
	void inspectPolicy_limitsDepthAndStrings() {
		String inspected = ShortInspector.inspect(List.of(List.of(List.of("too deep")), "x".repeat(200)));
		assertThat(inspected, startsWith("[[[...]], \""));
		assertThat(inspected, containsString("x".repeat(100) + "...\""));
	}
}

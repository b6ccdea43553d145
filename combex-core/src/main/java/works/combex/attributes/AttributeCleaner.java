package works.combex.attributes;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.combex.attributes.RawValue.BoolValue;
import works.combex.attributes.RawValue.Entry;
import works.combex.attributes.RawValue.FloatValue;
import works.combex.attributes.RawValue.IntValue;
import works.combex.attributes.RawValue.MapValue;
import works.combex.attributes.RawValue.NullValue;
import works.combex.attributes.RawValue.StringValue;
import works.combex.attributes.RawValue.SymbolValue;
import works.combex.attributes.RawValue.Unsupported;

import static works.combex.attributes.UnsupportedValuePolicy.DROP;

/**
 * Turns producer-supplied attributes into {@link CleanAttributes}:
 * a flat, sorted, deduplicated list of string keys and scalar values.
 *
 * <p>
 * Rules, applied to each key/value pair in order:
 *
 * <ol><li>
 *     Enum keys become their names; other non-string keys drop the pair.
 * </li><li>
 *     Null values drop the pair.
 * </li><li>
 *     Strings, integers, floats and booleans pass through unchanged.
 * </li><li>
 *     Symbols become their bare names.
 * </li><li>
 *     Nested maps are flattened, prefixing each inner key with {@code "<outer>."}.
 *     The {@link #TYPE_TAG_KEY type tag} is stripped first.
 * </li><li>
 *     Anything else is handled according to the {@link UnsupportedValuePolicy}.
 * </li></ol>
 *
 * Cleaning never fails. Malformed input is simply absent from the result.
 */
public final class AttributeCleaner {
	/**
	 * Bookkeeping key that nested maps may carry to describe their own type.
	 * It is not user data, so it is removed before flattening.
	 */
	public static final String TYPE_TAG_KEY = "@type";

	private final UnsupportedValuePolicy unsupportedValuePolicy;

	public AttributeCleaner(UnsupportedValuePolicy unsupportedValuePolicy) {
		this.unsupportedValuePolicy = unsupportedValuePolicy;
	}

	public static AttributeCleaner dropping() {
		return DROPPING;
	}

	/**
	 * @param input a {@link MapValue}, a {@link Map}, or an {@link Iterable} of {@link Map.Entry} / {@link Entry} / {@link Attribute},
	 *              so {@link CleanAttributes} can be cleaned again unchanged;
	 *              anything else cleans to {@link CleanAttributes#empty() empty}
	 */
	public CleanAttributes clean(Object input) {
		List<Attribute> result = new ArrayList<>();
		if (input instanceof MapValue map) {
			map.entries().forEach(e -> cleanPair(e.key(), e.value(), result));
		} else if (input instanceof Map<?, ?> map) {
			RawValue.mapOf(map).entries().forEach(e -> cleanPair(e.key(), e.value(), result));
		} else if (input instanceof Iterable<?> list) {
			for (Object element: list) {
				if (element instanceof Attribute a) {
					cleanPair(a.key(), RawValue.of(a.value().asObject()), result);
				} else if (element instanceof Entry e) {
					cleanPair(e.key(), e.value(), result);
				} else if (element instanceof Map.Entry<?, ?> e) {
					cleanPair(e.getKey(), RawValue.of(e.getValue()), result);
				} else {
					LOGGER.trace("Dropping list element that is not a key/value pair: {}", element);
				}
			}
		}
		return CleanAttributes.sort(result);
	}

	private void cleanPair(Object rawKey, RawValue value, List<Attribute> out) {
		String key = keyString(rawKey);
		if (key == null) {
			LOGGER.trace("Dropping attribute with unsupported key type: {}", rawKey);
			return;
		}
		if (value instanceof NullValue) {
			return;
		} else if (value instanceof StringValue s) {
			out.add(Attribute.of(key, s.value()));
		} else if (value instanceof IntValue i) {
			out.add(Attribute.of(key, i.value()));
		} else if (value instanceof FloatValue f) {
			out.add(Attribute.of(key, f.value()));
		} else if (value instanceof BoolValue b) {
			out.add(Attribute.of(key, b.value()));
		} else if (value instanceof SymbolValue s) {
			out.add(Attribute.of(key, s.name()));
		} else if (value instanceof MapValue map) {
			for (Entry e: map.entries()) {
				String innerKey = keyString(e.key());
				if (TYPE_TAG_KEY.equals(innerKey)) {
					continue;
				}
				// Nest under the outer key. An unusable inner key leaves null here, which drops the pair.
				cleanPair(innerKey == null ? null : key + "." + innerKey, e.value(), out);
			}
		} else if (value instanceof Unsupported u) {
			if (unsupportedValuePolicy == DROP) {
				LOGGER.trace("Dropping unsupported value for \"{}\"", key);
			} else {
				out.add(Attribute.of(key, ShortInspector.inspect(u.value())));
			}
		} else {
			throw new AssertionError("Unexpected raw value: " + value.getClass().getSimpleName());
		}
	}

	private static String keyString(Object key) {
		if (key instanceof String s) {
			return s;
		} else if (key instanceof Enum<?> e) {
			return e.name();
		} else if (key instanceof CharSequence s) {
			return s.toString();
		} else {
			return null;
		}
	}

	private static final AttributeCleaner DROPPING = new AttributeCleaner(DROP);
	private static final Logger LOGGER = LoggerFactory.getLogger(AttributeCleaner.class);
}

package works.combex.attributes;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * An attribute value as supplied by whoever produced the span or resource,
 * before any cleaning.
 * <p>
 * Every variant is something a producer might hand us;
 * only {@link AttributeCleaner} decides which of them survive onto the wire.
 */
public sealed interface RawValue {
	record NullValue() implements RawValue {}
	record BoolValue(boolean value) implements RawValue {}
	record IntValue(long value) implements RawValue {}
	record FloatValue(double value) implements RawValue {}

	record StringValue(String value) implements RawValue {
		public StringValue {
			requireNonNull(value);
		}
	}

	/**
	 * An enum-like atom. Cleans to its bare name.
	 */
	record SymbolValue(String name) implements RawValue {
		public SymbolValue {
			requireNonNull(name);
		}
	}

	/**
	 * A nested key/value map. Keys are left as the producer supplied them:
	 * strings are kept, enum constants are stringified, and anything else
	 * causes the entry to be dropped during cleaning.
	 */
	record MapValue(List<Entry> entries) implements RawValue {
		public MapValue {
			entries = unmodifiableList(new ArrayList<>(entries));
		}

		public static MapValue empty() {
			return new MapValue(List.of());
		}
	}

	/**
	 * Anything without a defined wire representation: lists, arrays, records, handles...
	 */
	record Unsupported(Object value) implements RawValue {}

	record Entry(Object key, RawValue value) {
		public Entry {
			requireNonNull(value);
		}
	}

	NullValue NULL = new NullValue();

	/**
	 * Converts a plain Java object into the corresponding variant.
	 * Maps are converted recursively. A map that contains itself, directly or
	 * through nested maps, is {@link Unsupported} at the point where it recurs.
	 */
	static RawValue of(Object value) {
		return of(value, newIdentitySet());
	}

	static MapValue mapOf(Map<?, ?> map) {
		Set<Object> enclosing = newIdentitySet();
		enclosing.add(map);
		return mapOf(map, enclosing);
	}

	private static RawValue of(Object value, Set<Object> enclosing) {
		if (value == null) {
			return NULL;
		} else if (value instanceof RawValue r) {
			return r;
		} else if (value instanceof Boolean b) {
			return new BoolValue(b);
		} else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte
			|| value instanceof AtomicInteger || value instanceof AtomicLong) {
			return new IntValue(((Number) value).longValue());
		} else if (value instanceof BigInteger big && big.bitLength() < Long.SIZE) {
			return new IntValue(big.longValue());
		} else if (value instanceof Double || value instanceof Float) {
			return new FloatValue(((Number) value).doubleValue());
		} else if (value instanceof CharSequence s) {
			return new StringValue(s.toString());
		} else if (value instanceof Enum<?> e) {
			return new SymbolValue(e.name());
		} else if (value instanceof Map<?, ?> map) {
			if (!enclosing.add(map)) {
				return new Unsupported(map);
			}
			MapValue result = mapOf(map, enclosing);
			enclosing.remove(map);
			return result;
		} else {
			return new Unsupported(value);
		}
	}

	private static MapValue mapOf(Map<?, ?> map, Set<Object> enclosing) {
		List<Entry> entries = new ArrayList<>(map.size());
		map.forEach((k, v) -> entries.add(new Entry(k, of(v, enclosing))));
		return new MapValue(entries);
	}

	private static Set<Object> newIdentitySet() {
		return Collections.newSetFromMap(new IdentityHashMap<>());
	}
}

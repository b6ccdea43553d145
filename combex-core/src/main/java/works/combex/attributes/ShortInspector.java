package works.combex.attributes;

import java.lang.reflect.Array;
import java.util.Iterator;
import java.util.Map;

/**
 * Renders arbitrary objects as short debug strings.
 * Output is bounded: containers show at most {@link #ELEMENT_LIMIT} elements,
 * nesting stops at {@link #DEPTH_LIMIT}, and long strings are cut.
 */
final class ShortInspector {
	static final int ELEMENT_LIMIT = 5;
	static final int DEPTH_LIMIT = 2;
	static final int STRING_LIMIT = 100;

	private ShortInspector() { }

	static String inspect(Object value) {
		StringBuilder sb = new StringBuilder();
		append(sb, value, 0);
		return sb.toString();
	}

	private static void append(StringBuilder sb, Object value, int depth) {
		if (value == null) {
			sb.append("null");
		} else if (value instanceof CharSequence s) {
			sb.append('"').append(cut(s.toString())).append('"');
		} else if (value instanceof Map<?, ?> map) {
			if (depth >= DEPTH_LIMIT) {
				sb.append("{...}");
				return;
			}
			sb.append('{');
			appendElements(sb, map.entrySet().iterator(), depth);
			sb.append('}');
		} else if (value instanceof Map.Entry<?, ?> entry) {
			append(sb, entry.getKey(), depth);
			sb.append('=');
			append(sb, entry.getValue(), depth);
		} else if (value instanceof Iterable<?> iterable) {
			if (depth >= DEPTH_LIMIT) {
				sb.append("[...]");
				return;
			}
			sb.append('[');
			appendElements(sb, iterable.iterator(), depth);
			sb.append(']');
		} else if (value.getClass().isArray()) {
			if (depth >= DEPTH_LIMIT) {
				sb.append("[...]");
				return;
			}
			sb.append('[');
			appendElements(sb, new ArrayIterator(value), depth);
			sb.append(']');
		} else {
			sb.append(cut(String.valueOf(value)));
		}
	}

	private static void appendElements(StringBuilder sb, Iterator<?> iter, int depth) {
		for (int i = 0; iter.hasNext(); i++) {
			Object element = iter.next();
			if (i > 0) {
				sb.append(", ");
			}
			if (i >= ELEMENT_LIMIT) {
				sb.append("...");
				return;
			}
			append(sb, element, depth + 1);
		}
	}

	private static String cut(String s) {
		if (s.length() <= STRING_LIMIT) {
			return s;
		} else {
			return s.substring(0, STRING_LIMIT) + "...";
		}
	}

	private static final class ArrayIterator implements Iterator<Object> {
		final Object array;
		final int length;
		int next = 0;

		ArrayIterator(Object array) {
			this.array = array;
			this.length = Array.getLength(array);
		}

		@Override public boolean hasNext() { return next < length; }
		@Override public Object next() { return Array.get(array, next++); }
	}
}

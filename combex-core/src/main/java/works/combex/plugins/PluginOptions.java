package works.combex.plugins;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import works.combex.exceptions.ConfigurationException;

/**
 * Typed access to a {@link PluginSpec}'s options.
 * Problems are reported as {@link ConfigurationException}s naming the full option key.
 */
public final class PluginOptions {
	private final String prefix;
	private final Map<String, Object> options;

	PluginOptions(String prefix, Map<String, Object> options) {
		this.prefix = prefix;
		this.options = options;
	}

	public int requirePositiveInt(String name) {
		Object value = options.get(name);
		if (value == null) {
			throw new ConfigurationException(key(name), "required");
		}
		return positiveInt(name, value);
	}

	public int getPositiveInt(String name, int defaultValue) {
		Object value = options.get(name);
		return value == null ? defaultValue : positiveInt(name, value);
	}

	public boolean getBoolean(String name, boolean defaultValue) {
		Object value = options.get(name);
		if (value == null) {
			return defaultValue;
		} else if (value instanceof Boolean b) {
			return b;
		} else if ("true".equals(value) || "false".equals(value)) {
			return Boolean.parseBoolean((String) value);
		} else {
			throw new ConfigurationException(key(name), "expected a boolean; got " + value);
		}
	}

	public Map<?, ?> getMap(String name) {
		Object value = options.get(name);
		if (value == null) {
			return Map.of();
		} else if (value instanceof Map<?, ?> map) {
			return map;
		} else {
			throw new ConfigurationException(key(name), "expected a map; got " + value);
		}
	}

	/**
	 * @throws ConfigurationException for the first option not in {@code known}, alphabetically
	 */
	public void rejectUnknown(Set<String> known) {
		Set<String> unknown = new TreeSet<>(options.keySet());
		unknown.removeAll(known);
		if (!unknown.isEmpty()) {
			throw new ConfigurationException(key(unknown.iterator().next()), "unknown option; expected one of " + new TreeSet<>(known));
		}
	}

	private int positiveInt(String name, Object value) {
		long result;
		if (value instanceof Integer || value instanceof Long || value instanceof Short) {
			result = ((Number) value).longValue();
		} else if (value instanceof String s) {
			try {
				result = Long.parseLong(s.trim());
			} catch (NumberFormatException e) {
				throw new ConfigurationException(key(name), "expected a positive integer; got \"" + s + "\"", e);
			}
		} else {
			throw new ConfigurationException(key(name), "expected a positive integer; got " + value);
		}
		if (result <= 0 || result > Integer.MAX_VALUE) {
			throw new ConfigurationException(key(name), "expected a positive integer; got " + result);
		}
		return (int) result;
	}

	private String key(String name) {
		return prefix + "." + name;
	}
}

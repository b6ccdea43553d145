package works.combex.logging;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.MDC;

/**
 * Sets any number of MDC entries for the duration of a try-with-resources block.
 * The value each key had before this scope first set it is put back on {@link #close()},
 * or the key is removed if it had none, so an inner scope leaves an outer one intact.
 *
 * <p>
 * Only code inside the try block sees the entries. A catch or finally on the same
 * statement runs after {@link #close()}.
 */
public final class MdcScope implements AutoCloseable {
	private final Map<String, String> oldValues = new LinkedHashMap<>();

	private MdcScope() { }

	public static MdcScope of(String key, String value) {
		return new MdcScope().and(key, value);
	}

	public MdcScope and(String key, String value) {
		if (!oldValues.containsKey(key)) {
			oldValues.put(key, MDC.get(key));
		}
		MDC.put(key, value);
		return this;
	}

	@Override
	public void close() {
		oldValues.forEach((key, oldValue) -> {
			if (oldValue == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, oldValue);
			}
		});
	}
}

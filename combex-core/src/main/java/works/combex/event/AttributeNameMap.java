package works.combex.event;

import java.util.Locale;
import java.util.Optional;
import lombok.With;

/**
 * Wire attribute names for the metadata that {@link EventAssembler} derives from each span.
 * <p>
 * The defaults match the trace-handling definitions an ingestion dataset uses out of the box
 * (eg. {@code trace.trace_id}). Change them to match a dataset configured otherwise.
 * A null or empty name suppresses the corresponding attribute.
 */
@With
public record AttributeNameMap(
	String durationMs,
	String name,
	String parentSpanId,
	String spanId,
	String spanType,
	String traceId
) {
	public static AttributeNameMap defaults() {
		return DEFAULTS;
	}

	public enum DerivedKey {
		DURATION_MS,
		NAME,
		PARENT_SPAN_ID,
		SPAN_ID,
		SPAN_TYPE,
		TRACE_ID,
		;

		/**
		 * @return the configuration spelling of this key, eg. {@code "parent_span_id"}
		 */
		public String configName() {
			return name().toLowerCase(Locale.ROOT);
		}

		public static Optional<DerivedKey> fromConfigName(String configName) {
			for (DerivedKey k: values()) {
				if (k.configName().equals(configName)) {
					return Optional.of(k);
				}
			}
			return Optional.empty();
		}
	}

	/**
	 * @return the wire name for {@code key}, or empty if that attribute is suppressed
	 */
	public Optional<String> targetFor(DerivedKey key) {
		String result = switch (key) {
			case DURATION_MS -> durationMs;
			case NAME -> name;
			case PARENT_SPAN_ID -> parentSpanId;
			case SPAN_ID -> spanId;
			case SPAN_TYPE -> spanType;
			case TRACE_ID -> traceId;
		};
		if (result == null || result.isEmpty()) {
			return Optional.empty();
		} else {
			return Optional.of(result);
		}
	}

	public AttributeNameMap with(DerivedKey key, String target) {
		return switch (key) {
			case DURATION_MS -> withDurationMs(target);
			case NAME -> withName(target);
			case PARENT_SPAN_ID -> withParentSpanId(target);
			case SPAN_ID -> withSpanId(target);
			case SPAN_TYPE -> withSpanType(target);
			case TRACE_ID -> withTraceId(target);
		};
	}

	private static final AttributeNameMap DEFAULTS = new AttributeNameMap(
		"duration_ms",
		"name",
		"trace.parent_id",
		"trace.span_id",
		"meta.span_type",
		"trace.trace_id"
	);
}

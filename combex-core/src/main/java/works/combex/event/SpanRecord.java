package works.combex.event;

import java.util.List;
import works.combex.attributes.RawValue.MapValue;

import static java.util.Objects.requireNonNull;

/**
 * A finished span, decoupled from whatever tracing SDK produced it.
 * Adapters populate these; the core only reads them.
 *
 * @param parentSpanId null for a root span
 * @param attributes the span's own attributes, not yet cleaned
 * @param events timed events recorded inside the span
 */
public record SpanRecord(
	TraceId traceId,
	SpanId spanId,
	SpanId parentSpanId,
	String name,
	SpanTimestamp start,
	SpanTimestamp end,
	SpanKind kind,
	MapValue attributes,
	List<TimedEvent> events
) {
	public SpanRecord {
		requireNonNull(traceId);
		requireNonNull(spanId);
		requireNonNull(name);
		requireNonNull(start);
		requireNonNull(end);
		requireNonNull(kind);
		requireNonNull(attributes);
		events = List.copyOf(events);
	}

	public boolean isRoot() {
		return parentSpanId == null;
	}
}

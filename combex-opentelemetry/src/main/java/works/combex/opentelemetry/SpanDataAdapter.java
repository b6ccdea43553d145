package works.combex.opentelemetry;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.SpanData;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import works.combex.attributes.RawValue;
import works.combex.attributes.RawValue.MapValue;
import works.combex.event.SpanId;
import works.combex.event.SpanKind;
import works.combex.event.SpanRecord;
import works.combex.event.SpanTimestamp;
import works.combex.event.TimedEvent;
import works.combex.event.TraceId;

/**
 * Converts the OpenTelemetry SDK's finished spans into {@link SpanRecord}s.
 * Array-valued attributes have no flat representation and come through as
 * {@link RawValue.Unsupported}.
 */
final class SpanDataAdapter {
	private SpanDataAdapter() { }

	static SpanRecord toSpanRecord(SpanData span) {
		SpanId parent = span.getParentSpanContext().isValid()
			? SpanId.fromHex(span.getParentSpanId())
			: null;
		return new SpanRecord(
			TraceId.fromHex(span.getTraceId()),
			SpanId.fromHex(span.getSpanId()),
			parent,
			span.getName(),
			SpanTimestamp.ofEpochNanos(span.getStartEpochNanos()),
			SpanTimestamp.ofEpochNanos(span.getEndEpochNanos()),
			kind(span.getKind()),
			toMapValue(span.getAttributes()),
			timedEvents(span.getEvents()));
	}

	static Map<String, Object> resourceAttributes(Resource resource) {
		return plainMap(resource.getAttributes());
	}

	static MapValue toMapValue(Attributes attributes) {
		return RawValue.mapOf(plainMap(attributes));
	}

	static SpanKind kind(io.opentelemetry.api.trace.SpanKind kind) {
		if (kind == null) {
			return SpanKind.UNSPECIFIED;
		}
		return switch (kind) {
			case INTERNAL -> SpanKind.INTERNAL;
			case SERVER -> SpanKind.SERVER;
			case CLIENT -> SpanKind.CLIENT;
			case PRODUCER -> SpanKind.PRODUCER;
			case CONSUMER -> SpanKind.CONSUMER;
		};
	}

	private static List<TimedEvent> timedEvents(List<EventData> events) {
		return events.stream()
			.map(e -> new TimedEvent(
				SpanTimestamp.ofEpochNanos(e.getEpochNanos()),
				e.getName(),
				toMapValue(e.getAttributes())))
			.toList();
	}

	private static Map<String, Object> plainMap(Attributes attributes) {
		Map<String, Object> result = new LinkedHashMap<>();
		attributes.forEach((key, value) -> result.put(key.getKey(), value));
		return result;
	}
}

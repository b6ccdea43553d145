package works.combex.event;

import works.combex.attributes.RawValue.MapValue;

/**
 * A timestamped annotation recorded inside a span.
 * Carried on {@link SpanRecord} for completeness; not exported as a separate wire event.
 */
public record TimedEvent(
	SpanTimestamp time,
	String name,
	MapValue attributes
) { }

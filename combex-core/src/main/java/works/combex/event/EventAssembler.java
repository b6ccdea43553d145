package works.combex.event;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.combex.attributes.Attribute;
import works.combex.attributes.AttributeCleaner;
import works.combex.attributes.CleanAttributes;
import works.combex.attributes.CleanValue;
import works.combex.attributes.CleanValue.LongValue;
import works.combex.attributes.ValueTrimmer;
import works.combex.event.AttributeNameMap.DerivedKey;

import static works.combex.event.AttributeNameMap.DerivedKey.DURATION_MS;
import static works.combex.event.AttributeNameMap.DerivedKey.NAME;
import static works.combex.event.AttributeNameMap.DerivedKey.PARENT_SPAN_ID;
import static works.combex.event.AttributeNameMap.DerivedKey.SPAN_ID;
import static works.combex.event.AttributeNameMap.DerivedKey.SPAN_TYPE;
import static works.combex.event.AttributeNameMap.DerivedKey.TRACE_ID;

/**
 * Builds wire {@link Event}s from {@link SpanRecord}s.
 *
 * <p>
 * Attribute precedence, highest first:
 * derived span metadata (duration, name, identifiers), then the span's own attributes,
 * then resource attributes. Derived metadata overwrites user attributes
 * that happen to use the same names.
 */
public final class EventAssembler {
	private final AttributeCleaner cleaner;
	private final ValueTrimmer trimmer;
	private final AttributeNameMap attributeNameMap;
	private final String samplerateKey;

	/**
	 * @param samplerateKey if not null, the attribute to remove from each event
	 *                      and use as its sample rate
	 */
	public EventAssembler(AttributeCleaner cleaner, ValueTrimmer trimmer, AttributeNameMap attributeNameMap, String samplerateKey) {
		this.cleaner = cleaner;
		this.trimmer = trimmer;
		this.attributeNameMap = attributeNameMap;
		this.samplerateKey = samplerateKey;
	}

	/**
	 * @param resourceAttributes already clean attributes describing the emitting service
	 * @return the events representing {@code span}; currently always exactly one
	 */
	public List<Event> assemble(SpanRecord span, CleanAttributes resourceAttributes) {
		CleanAttributes data = derivedAttributes(span)
			.merge(cleaner.clean(span.attributes())
				.merge(resourceAttributes));
		data = trimmer.trim(data);

		// Wire value is 1 either way; unset leaves the decision to samplers
		int samplerate = Event.SAMPLERATE_UNSET;
		if (samplerateKey != null) {
			Optional<CleanValue> rate = data.get(samplerateKey);
			if (rate.isPresent()) {
				data = data.without(samplerateKey);
				samplerate = samplerateFrom(rate.get(), span);
			}
		}

		String time = Event.formatTime(span.start().epochMicros());
		return List.of(new Event(time, data, samplerate));
	}

	private CleanAttributes derivedAttributes(SpanRecord span) {
		List<Attribute> result = new ArrayList<>();
		double durationMs = (span.end().epochMicros() - span.start().epochMicros()) / 1000.0;
		add(result, DURATION_MS, CleanValue.of(durationMs));
		add(result, NAME, CleanValue.of(span.name()));
		if (span.parentSpanId() != null) {
			add(result, PARENT_SPAN_ID, CleanValue.of(span.parentSpanId().toHex()));
		}
		add(result, SPAN_ID, CleanValue.of(span.spanId().toHex()));
		add(result, TRACE_ID, CleanValue.of(span.traceId().toHex()));
		span.kind().wireName().ifPresent(kind -> add(result, SPAN_TYPE, CleanValue.of(kind)));
		return CleanAttributes.sort(result);
	}

	private void add(List<Attribute> result, DerivedKey key, CleanValue value) {
		attributeNameMap.targetFor(key)
			.ifPresent(name -> result.add(new Attribute(name, value)));
	}

	private int samplerateFrom(CleanValue value, SpanRecord span) {
		if (value instanceof LongValue l && l.value() > 0 && l.value() <= Integer.MAX_VALUE) {
			return (int) l.value();
		} else {
			LOGGER.warn("Span {} has invalid sample rate attribute \"{}\": {}; using 1", span.spanId(), samplerateKey, value);
			return 1;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EventAssembler.class);
}

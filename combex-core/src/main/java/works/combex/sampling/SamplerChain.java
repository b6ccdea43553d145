package works.combex.sampling;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.combex.event.Event;
import works.combex.sampling.SampleResult.Keep;
import works.combex.sampling.SampleResult.Rate;
import works.combex.sampling.SampleResult.Replace;

/**
 * Applies a sequence of {@link Sampler}s. Each sampler sees the events
 * as left by the one before it.
 *
 * <p>
 * A sampler that throws, returns null, returns a non-positive rate,
 * or returns a null replacement is misbehaving: the event passes through
 * unchanged and a warning is logged.
 */
public final class SamplerChain {
	private final List<Sampler> samplers;

	public SamplerChain(List<Sampler> samplers) {
		this.samplers = List.copyOf(samplers);
	}

	public static SamplerChain empty() {
		return EMPTY;
	}

	public boolean isEmpty() {
		return samplers.isEmpty();
	}

	public List<Event> apply(List<Event> events) {
		List<Event> current = events;
		for (Sampler sampler: samplers) {
			List<Event> next = new ArrayList<>(current.size());
			for (Event event: current) {
				next.add(applyOne(sampler, event));
			}
			current = next;
		}
		return current;
	}

	private static Event applyOne(Sampler sampler, Event event) {
		SampleResult result;
		try {
			result = sampler.sample(event);
		} catch (RuntimeException e) {
			LOGGER.warn("Sampler {} threw; leaving event unchanged", sampler.getClass().getName(), e);
			return event;
		}
		if (result instanceof Keep) {
			return event;
		} else if (result instanceof Rate r && r.rate() > 0) {
			return event.withSamplerate(r.rate());
		} else if (result instanceof Replace r && r.event() != null) {
			return r.event();
		} else {
			LOGGER.warn("Unexpected result from sampler {}: {}; leaving event unchanged", sampler.getClass().getName(), result);
			return event;
		}
	}

	private static final SamplerChain EMPTY = new SamplerChain(List.of());
	private static final Logger LOGGER = LoggerFactory.getLogger(SamplerChain.class);
}

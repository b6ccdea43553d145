package works.combex.sampling;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.combex.attributes.Attribute;
import works.combex.attributes.CleanAttributes;
import works.combex.event.Event;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SamplerChainTest {
	static final Event UNDECIDED = new Event("2019-05-17T09:55:12.622658Z", CleanAttributes.of(Attribute.of("k", "v")));
	static final Event DECIDED = UNDECIDED.withSamplerate(3);

	@Test
	void empty_isIdentity() {
		List<Event> events = List.of(UNDECIDED, DECIDED);
		assertEquals(events, SamplerChain.empty().apply(events));
	}

	@Test
	void fixedRate_onlyFillsUndecided() {
		List<Event> actual = new SamplerChain(List.of(new FixedRateSampler(10))).apply(List.of(UNDECIDED, DECIDED));
		assertEquals(List.of(UNDECIDED.withSamplerate(10), DECIDED), actual);
	}

	@Test
	void fixedRate_allOverridesEverything() {
		List<Event> actual = new SamplerChain(List.of(new FixedRateSampler(10, true))).apply(List.of(UNDECIDED, DECIDED));
		assertEquals(List.of(UNDECIDED.withSamplerate(10), DECIDED.withSamplerate(10)), actual);
	}

	@Test
	void samplers_foldInOrder() {
		Sampler doubler = e -> SampleResult.rate(e.effectiveSamplerate() * 2);
		List<Event> actual = new SamplerChain(List.of(new FixedRateSampler(5), doubler, doubler)).apply(List.of(UNDECIDED));
		assertEquals(List.of(UNDECIDED.withSamplerate(20)), actual);
	}

	@Test
	void replacement_isUsedVerbatim() {
		Event replacement = new Event(UNDECIDED.time(), CleanAttributes.of(Attribute.of("replaced", true)), 7);
		Sampler replacer = e -> SampleResult.replace(replacement);
		assertEquals(List.of(replacement), new SamplerChain(List.of(replacer)).apply(List.of(UNDECIDED)));
	}

	@Test
	void misbehavingSamplers_leaveEventsUnchanged() {
		Sampler thrower = e -> { throw new IllegalStateException("Oops"); };
		Sampler nullReturner = e -> null;
		Sampler negativeRate = e -> SampleResult.rate(-2);
		Sampler nullReplacement = e -> SampleResult.replace(null);
		List<Event> actual = new SamplerChain(List.of(thrower, nullReturner, negativeRate, nullReplacement))
			.apply(List.of(UNDECIDED, DECIDED));
		assertEquals(List.of(UNDECIDED, DECIDED), actual);
	}
}

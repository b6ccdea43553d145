package works.combex.sampling;

import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import works.combex.attributes.Attribute;
import works.combex.attributes.CleanAttributes;
import works.combex.event.Event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeterministicSamplerTest {
	final DeterministicSampler sampler = new DeterministicSampler("trace.trace_id");

	@Test
	void knownTraceIds() {
		assertTrue(DeterministicSampler.shouldKeep("00000000000000000000000000000001", 2));
		assertFalse(DeterministicSampler.shouldKeep("00000000000000000000000000000002", 2));
		assertFalse(DeterministicSampler.shouldKeep("00000000000000000000000000000001", 10));
		assertTrue(DeterministicSampler.shouldKeep("0af7651916cd43dd8448eb211c80319c", 10));
	}

	@Test
	void rateOne_keepsEverything() {
		assertTrue(IntStream.range(0, 100)
			.mapToObj(DeterministicSamplerTest::traceId)
			.allMatch(id -> DeterministicSampler.shouldKeep(id, 1)));
	}

	@Test
	void keptFraction_matchesRate() {
		long kept = IntStream.range(0, 10_000)
			.mapToObj(DeterministicSamplerTest::traceId)
			.filter(id -> DeterministicSampler.shouldKeep(id, 4))
			.count();
		assertEquals(2522, kept);
	}

	@Test
	void filter_usesEventTraceIdAndSamplerate() {
		Event kept = event("00000000000000000000000000000001", 2);
		Event dropped = event("00000000000000000000000000000002", 2);
		Event unsampled = event("00000000000000000000000000000002", 1);
		Event noTraceId = new Event(Event.now(), CleanAttributes.empty(), 2);
		assertEquals(List.of(kept, unsampled, noTraceId), sampler.filter(List.of(kept, dropped, unsampled, noTraceId)));
	}

	private static Event event(String traceId, int samplerate) {
		return new Event(Event.now(), CleanAttributes.of(Attribute.of("trace.trace_id", traceId)), samplerate);
	}

	private static String traceId(int i) {
		return String.format("%032x", i);
	}
}

package works.combex.sampling;

import works.combex.event.Event;

/**
 * What a {@link Sampler} decided about one event.
 */
public sealed interface SampleResult {
	/**
	 * Leave the event as it is.
	 */
	record Keep() implements SampleResult {}

	/**
	 * Give the event this sample rate, which should be positive.
	 */
	record Rate(int rate) implements SampleResult {}

	/**
	 * Use this event in place of the original.
	 */
	record Replace(Event event) implements SampleResult {}

	static SampleResult keep() { return KEEP; }
	static SampleResult rate(int rate) { return new Rate(rate); }
	static SampleResult replace(Event event) { return new Replace(event); }

	Keep KEEP = new Keep();
}

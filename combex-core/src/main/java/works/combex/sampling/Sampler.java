package works.combex.sampling;

import works.combex.event.Event;

/**
 * Makes a sampling decision for each event on its way out.
 *
 * <p>
 * Unlike a trace-level sampler, this sees individual events, and it records
 * the sample rate on each survivor so aggregates can be scaled back up downstream.
 *
 * <p>
 * Samplers shipped for general use should not change the rate of an event that
 * {@link Event#hasSamplerate already has one}, unless doing so is their documented purpose.
 * Samplers may be stateful, eg. adjusting their rate to the event rate they observe.
 */
public interface Sampler {
	SampleResult sample(Event event);
}

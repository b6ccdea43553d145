package works.combex.sampling;

import works.combex.event.Event;

/**
 * Assigns a fixed sample rate to events that have none.
 *
 * @param rate the sample rate to assign
 * @param all if true, overrides events that already have a rate too
 */
public record FixedRateSampler(int rate, boolean all) implements Sampler {
	public FixedRateSampler {
		if (rate <= 0) {
			throw new IllegalArgumentException("Sample rate must be positive: " + rate);
		}
	}

	public FixedRateSampler(int rate) {
		this(rate, false);
	}

	@Override
	public SampleResult sample(Event event) {
		if (!event.hasSamplerate() || all) {
			return SampleResult.rate(rate);
		} else {
			return SampleResult.keep();
		}
	}
}

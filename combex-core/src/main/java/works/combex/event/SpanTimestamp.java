package works.combex.event;

import java.time.Instant;

import static java.lang.Math.floorDiv;

/**
 * A point in time as tracing runtimes tend to record it:
 * a monotonic clock reading plus the offset that converts it to wall-clock time.
 * Both in nanoseconds.
 */
public record SpanTimestamp(long monotonicNanos, long offsetNanos) {
	public static SpanTimestamp ofEpochNanos(long epochNanos) {
		return new SpanTimestamp(epochNanos, 0);
	}

	public static SpanTimestamp of(Instant instant) {
		return ofEpochNanos(instant.getEpochSecond() * 1_000_000_000L + instant.getNano());
	}

	public long epochMicros() {
		return floorDiv(monotonicNanos + offsetNanos, 1_000L);
	}
}

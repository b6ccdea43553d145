package works.combex.sampling;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Optional;
import works.combex.attributes.CleanValue;
import works.combex.attributes.CleanValue.StringValue;
import works.combex.event.Event;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Keeps or drops events according to their sample rate, consistently per trace.
 *
 * <p>
 * An event with rate {@code n > 1} survives if a hash of its trace identifier,
 * modulo 2<sup>64</sup>-1, falls below (2<sup>64</sup>-1)/{@code n}.
 * The same trace ID at the same rate always gets the same answer,
 * so every service dropping spans this way drops the same traces.
 */
public final class DeterministicSampler {
	private final String traceIdKey;

	/**
	 * @param traceIdKey the event data key holding the trace identifier
	 */
	public DeterministicSampler(String traceIdKey) {
		this.traceIdKey = traceIdKey;
	}

	/**
	 * Events without a trace identifier are kept.
	 */
	public List<Event> filter(List<Event> events) {
		return events.stream()
			.filter(this::shouldKeep)
			.toList();
	}

	public boolean shouldKeep(Event event) {
		int rate = event.effectiveSamplerate();
		if (rate <= 1) {
			return true;
		}
		Optional<CleanValue> traceId = event.data().get(traceIdKey);
		if (traceId.isPresent() && traceId.get() instanceof StringValue s) {
			return shouldKeep(s.value(), rate);
		} else {
			return true;
		}
	}

	public static boolean shouldKeep(String traceId, int rate) {
		if (rate <= 1) {
			return true;
		}
		long hash = hash(traceId);
		if (hash == MODULUS) {
			hash = 0;
		}
		return Long.compareUnsigned(hash, Long.divideUnsigned(MODULUS, rate)) < 0;
	}

	/**
	 * @return the first eight bytes of the SHA-1 digest, as an unsigned 64-bit value
	 */
	static long hash(String traceId) {
		byte[] digest = sha1().digest(traceId.getBytes(UTF_8));
		long result = 0;
		for (int i = 0; i < Long.BYTES; i++) {
			result = (result << 8) | (digest[i] & 0xFF);
		}
		return result;
	}

	private static MessageDigest sha1() {
		try {
			return MessageDigest.getInstance("SHA-1");
		} catch (NoSuchAlgorithmException e) {
			throw new AssertionError("Every JDK has SHA-1", e);
		}
	}

	/**
	 * 2<sup>64</sup>-1, as an unsigned long.
	 */
	private static final long MODULUS = -1L;
}

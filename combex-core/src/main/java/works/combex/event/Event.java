package works.combex.event;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import works.combex.attributes.CleanAttributes;

import static java.lang.Math.floorDiv;
import static java.lang.Math.floorMod;
import static java.util.Objects.requireNonNull;

/**
 * One record for the batch events API.
 *
 * @param time ISO 8601 UTC with microseconds, eg. {@code "2019-05-17T09:55:12.622658Z"}
 * @param data the flattened attributes
 * @param samplerate {@code n} meaning this event stands for {@code n} like it;
 *                   {@link #SAMPLERATE_UNSET} until someone decides
 */
public record Event(
	String time,
	CleanAttributes data,
	int samplerate
) {
	public static final int SAMPLERATE_UNSET = 0;

	public Event {
		requireNonNull(time);
		requireNonNull(data);
		if (samplerate < 0) {
			throw new IllegalArgumentException("Sample rate must not be negative: " + samplerate);
		}
	}

	public Event(String time, CleanAttributes data) {
		this(time, data, SAMPLERATE_UNSET);
	}

	public boolean hasSamplerate() {
		return samplerate != SAMPLERATE_UNSET;
	}

	/**
	 * @return the sample rate as sent on the wire: 1 if never decided
	 */
	public int effectiveSamplerate() {
		return hasSamplerate() ? samplerate : 1;
	}

	public Event withSamplerate(int newSamplerate) {
		if (newSamplerate <= 0) {
			throw new IllegalArgumentException("Sample rate must be positive: " + newSamplerate);
		}
		return new Event(time, data, newSamplerate);
	}

	public Event withData(CleanAttributes newData) {
		return new Event(time, newData, samplerate);
	}

	/**
	 * @return the JSON-ready shape: {@code {"time":..., "samplerate":..., "data":{...}}}
	 */
	public Map<String, Object> toWire() {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("time", time);
		result.put("samplerate", effectiveSamplerate());
		result.put("data", data.toMap());
		return result;
	}

	/**
	 * The current UTC time in wire format. Handy when creating events by hand.
	 */
	public static String now() {
		Instant now = Instant.now();
		return formatTime(now.getEpochSecond() * 1_000_000L + now.getNano() / 1_000);
	}

	public static String formatTime(long epochMicros) {
		Instant instant = Instant.ofEpochSecond(floorDiv(epochMicros, 1_000_000L), floorMod(epochMicros, 1_000_000L) * 1_000L);
		return TIME_FORMAT.format(instant);
	}

	private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter
		.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'")
		.withZone(ZoneOffset.UTC);
}

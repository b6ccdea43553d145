package works.combex.batch;

import java.io.ByteArrayOutputStream;
import java.util.List;

/**
 * Pre-encoded events that will be sent together as one JSON array.
 * Never empty.
 */
public record Batch(List<byte[]> events) {
	public Batch {
		events = List.copyOf(events);
		if (events.isEmpty()) {
			throw new IllegalArgumentException("Batch must contain at least one event");
		}
	}

	public int size() {
		return events.size();
	}

	/**
	 * @return the byte length of {@link #body()}: the brackets plus each event and its separator
	 */
	public long encodedLength() {
		long result = 1;
		for (byte[] event : events) {
			result += event.length + 1;
		}
		return result;
	}

	/**
	 * @return the events joined into a JSON array
	 */
	public byte[] body() {
		ByteArrayOutputStream out = new ByteArrayOutputStream((int) encodedLength());
		out.write('[');
		for (int i = 0; i < events.size(); i++) {
			if (i > 0) {
				out.write(',');
			}
			out.writeBytes(events.get(i));
		}
		out.write(']');
		return out.toByteArray();
	}
}

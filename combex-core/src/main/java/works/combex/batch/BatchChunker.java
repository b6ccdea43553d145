package works.combex.batch;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Packs encoded events, in order, into {@link Batch}es that respect the ingestion limits.
 *
 * <p>
 * An event longer than {@code eventSizeLimit} bytes is dropped with a warning.
 * Every other event lands in exactly one batch, and no batch's
 * {@link Batch#encodedLength() encoded length} exceeds {@code batchSizeLimit}.
 */
public final class BatchChunker {
	public static final int DEFAULT_EVENT_SIZE_LIMIT = 102_400;
	public static final int DEFAULT_BATCH_SIZE_LIMIT = 5_242_880;

	private final int eventSizeLimit;
	private final int batchSizeLimit;
	private final int maxEventsPerBatch;

	/**
	 * @param maxEventsPerBatch caps the event count per batch; use {@link Integer#MAX_VALUE} for no cap
	 */
	public BatchChunker(int eventSizeLimit, int batchSizeLimit, int maxEventsPerBatch) {
		if (eventSizeLimit <= 0 || maxEventsPerBatch <= 0) {
			throw new IllegalArgumentException("Limits must be positive");
		}
		// A lone event must fit between the brackets
		if ((long) eventSizeLimit + 2 > batchSizeLimit) {
			throw new IllegalArgumentException("Event size limit " + eventSizeLimit + " does not fit in batch size limit " + batchSizeLimit);
		}
		this.eventSizeLimit = eventSizeLimit;
		this.batchSizeLimit = batchSizeLimit;
		this.maxEventsPerBatch = maxEventsPerBatch;
	}

	public static BatchChunker withDefaultLimits() {
		return new BatchChunker(DEFAULT_EVENT_SIZE_LIMIT, DEFAULT_BATCH_SIZE_LIMIT, Integer.MAX_VALUE);
	}

	public List<Batch> chunk(List<byte[]> encodedEvents) {
		List<Batch> result = new ArrayList<>();
		List<byte[]> current = new ArrayList<>();
		long currentLength = 1; // "["
		for (byte[] event : encodedEvents) {
			if (event.length > eventSizeLimit) {
				LOGGER.warn("Dropping event of {} bytes; limit is {}", event.length, eventSizeLimit);
				continue;
			}
			boolean full = currentLength + event.length + 1 > batchSizeLimit
				|| current.size() >= maxEventsPerBatch;
			if (full && !current.isEmpty()) {
				result.add(new Batch(current));
				current = new ArrayList<>();
				currentLength = 1;
			}
			current.add(event);
			currentLength += event.length + 1;
		}
		if (!current.isEmpty()) {
			result.add(new Batch(current));
		}
		LOGGER.trace("Chunked {} events into {} batches", encodedEvents.size(), result.size());
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BatchChunker.class);
}

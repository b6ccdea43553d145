package works.combex.delivery;

import java.io.IOException;
import java.math.BigInteger;
import java.net.URI;
import java.net.URLEncoder;
import java.util.List;
import java.util.Map;
import works.combex.ExportOutcome;
import works.combex.batch.Batch;
import works.combex.exceptions.CodecException;
import works.combex.json.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static works.combex.ExportOutcome.FAILED_NOT_RETRYABLE;
import static works.combex.ExportOutcome.FAILED_RETRYABLE;
import static works.combex.ExportOutcome.OK;

/**
 * POSTs {@link Batch}es to the batch events API and classifies each reply as an {@link ExportOutcome}.
 *
 * <p>
 * Never retries and never throws for delivery problems; anything unexpected is
 * logged as a warning and reflected in the returned outcome.
 */
public final class BatchSender {
	public static final String TEAM_HEADER = "X-Honeycomb-Team";

	private final HttpBackend backend;
	private final JsonCodec codec;
	private final URI url;
	private final List<Header> headers;
	private final HttpOptions options;

	public BatchSender(HttpBackend backend, JsonCodec codec, String apiEndpoint, String dataset, String writeKey, String userAgent, HttpOptions options) {
		this.backend = requireNonNull(backend);
		this.codec = requireNonNull(codec);
		this.url = batchUrl(apiEndpoint, dataset);
		this.headers = List.of(
			Header.of("Content-Type", "application/json"),
			Header.of("User-Agent", userAgent),
			Header.of(TEAM_HEADER, writeKey == null ? "" : writeKey));
		this.options = requireNonNull(options);
	}

	/**
	 * @return {@code {apiEndpoint}/1/batch/{dataset}}, with the dataset percent-encoded as a path segment
	 */
	public static URI batchUrl(String apiEndpoint, String dataset) {
		String base = apiEndpoint.endsWith("/")
			? apiEndpoint.substring(0, apiEndpoint.length() - 1)
			: apiEndpoint;
		String segment = URLEncoder.encode(dataset, UTF_8).replace("+", "%20");
		return URI.create(base + "/1/batch/" + segment);
	}

	public URI url() {
		return url;
	}

	public ExportOutcome send(Batch batch) {
		HttpReply reply;
		try {
			reply = backend.request("POST", url, headers, batch.body(), options);
		} catch (IOException | RuntimeException e) {
			LOGGER.warn("Unable to send batch of {} events to {}", batch.size(), url, e);
			return FAILED_RETRYABLE;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			LOGGER.warn("Interrupted sending batch of {} events to {}", batch.size(), url);
			return FAILED_RETRYABLE;
		}
		return classify(reply, batch.size());
	}

	ExportOutcome classify(HttpReply reply, int eventCount) {
		int status = reply.status();
		if (status == 204) {
			return OK;
		} else if (status == 200) {
			return classifyItems(reply.body(), eventCount);
		} else if (status == 401) {
			LOGGER.warn("Batch rejected with status 401; check the write key");
			return FAILED_NOT_RETRYABLE;
		} else if (status >= 500) {
			LOGGER.warn("Batch failed with status {}; may be retried", status);
			return FAILED_RETRYABLE;
		} else {
			LOGGER.warn("Batch rejected with unexpected status {}", status);
			return FAILED_NOT_RETRYABLE;
		}
	}

	private ExportOutcome classifyItems(byte[] body, int eventCount) {
		Object decoded;
		try {
			decoded = codec.decode(body);
		} catch (CodecException e) {
			LOGGER.warn("Unable to decode batch reply", e);
			return FAILED_RETRYABLE;
		}
		if (!(decoded instanceof List<?> items)) {
			LOGGER.warn("Expected a JSON array in batch reply; got {}", decoded);
			return FAILED_RETRYABLE;
		}
		if (items.size() != eventCount) {
			LOGGER.debug("Batch reply has {} items for {} events", items.size(), eventCount);
		}
		for (int i = 0; i < items.size(); i++) {
			Object status = (items.get(i) instanceof Map<?, ?> item) ? item.get("status") : null;
			if (isStatus(status, 202)) {
				continue;
			}
			if (isStatus(status, 400)) {
				LOGGER.warn("Event {} of batch rejected with status 400: {}", i, items.get(i));
				return FAILED_NOT_RETRYABLE;
			} else {
				LOGGER.warn("Event {} of batch got unexpected reply: {}", i, items.get(i));
				return FAILED_RETRYABLE;
			}
		}
		return OK;
	}

	/**
	 * Only integral JSON numbers count; {@code 202.5} or {@code 202} plus 2^32 are not 202.
	 */
	private static boolean isStatus(Object status, int expected) {
		if (status instanceof Integer || status instanceof Long || status instanceof Short || status instanceof Byte) {
			return ((Number) status).longValue() == expected;
		} else if (status instanceof BigInteger big) {
			return big.equals(BigInteger.valueOf(expected));
		} else {
			return false;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BatchSender.class);
}

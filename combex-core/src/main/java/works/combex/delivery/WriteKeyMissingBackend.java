package works.combex.delivery;

import java.net.URI;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stands in for the real backend when no write key is configured.
 * Sends nothing and reports every request as accepted.
 */
public final class WriteKeyMissingBackend implements HttpBackend {
	public static WriteKeyMissingBackend instance() {
		return INSTANCE;
	}

	private WriteKeyMissingBackend() { }

	@Override
	public HttpReply request(String method, URI url, List<Header> headers, byte[] body, HttpOptions options) {
		LOGGER.debug("No write key; discarding {} bytes for {}", body.length, url);
		return HttpReply.of(204);
	}

	private static final WriteKeyMissingBackend INSTANCE = new WriteKeyMissingBackend();
	private static final Logger LOGGER = LoggerFactory.getLogger(WriteKeyMissingBackend.class);
}

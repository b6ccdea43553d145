package works.combex.delivery;

import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;
import works.combex.exceptions.CodecException;
import works.combex.json.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Logs each request instead of sending it, and reports that it was accepted.
 * Useful for seeing what would be sent.
 */
public final class ConsoleBackend implements HttpBackend {
	private final JsonCodec codec;

	public ConsoleBackend(JsonCodec codec) {
		this.codec = codec;
	}

	@Override
	public HttpReply request(String method, URI url, List<Header> headers, byte[] body, HttpOptions options) {
		String headerText = headers.stream()
			.map(h -> h.name() + ": " + (h.hasName(BatchSender.TEAM_HEADER) ? "<redacted>" : h.value()))
			.collect(Collectors.joining("\n"));
		LOGGER.info("{} {}\n{}\n{}", method, url, headerText, pretty(body));
		return HttpReply.of(204);
	}

	private String pretty(byte[] body) {
		try {
			return new String(codec.encodePretty(codec.decode(body)), UTF_8);
		} catch (CodecException e) {
			LOGGER.debug("Body is not valid JSON; logging it as-is", e);
			return new String(body, UTF_8);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ConsoleBackend.class);
}

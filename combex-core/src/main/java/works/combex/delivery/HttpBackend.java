package works.combex.delivery;

import java.io.IOException;
import java.net.URI;
import java.util.List;

/**
 * The HTTP capability the exporter needs. Implementations report every reply they get,
 * whatever its status; only failures to get a reply at all are exceptions.
 */
public interface HttpBackend {
	HttpReply request(String method, URI url, List<Header> headers, byte[] body, HttpOptions options) throws IOException, InterruptedException;
}

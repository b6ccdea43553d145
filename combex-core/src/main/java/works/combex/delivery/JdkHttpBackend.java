package works.combex.delivery;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link HttpBackend} using {@link HttpClient}.
 * One client is kept per connect timeout, since that's fixed when the client is built.
 *
 * <p>
 * Redirects are not followed. A 3xx reply is returned as-is, so the batch counts as
 * rejected instead of being re-sent somewhere else without its body.
 */
public final class JdkHttpBackend implements HttpBackend {
	private final Map<Duration, HttpClient> clients = new ConcurrentHashMap<>();

	@Override
	public HttpReply request(String method, URI url, List<Header> headers, byte[] body, HttpOptions options) throws IOException, InterruptedException {
		HttpRequest.Builder builder = HttpRequest.newBuilder(url)
			.timeout(options.receiveTimeout())
			.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
		headers.forEach(h -> builder.header(h.name(), h.value()));
		HttpResponse<byte[]> response = clientFor(options)
			.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
		List<Header> replyHeaders = new ArrayList<>();
		response.headers().map().forEach((name, values) ->
			values.forEach(value -> replyHeaders.add(new Header(name, value))));
		return new HttpReply(response.statusCode(), replyHeaders, response.body());
	}

	private HttpClient clientFor(HttpOptions options) {
		return clients.computeIfAbsent(options.connectTimeout(), timeout -> HttpClient.newBuilder()
			.connectTimeout(timeout)
			.followRedirects(HttpClient.Redirect.NEVER)
			.build());
	}
}

package works.combex.delivery;

import java.util.List;

public record HttpReply(
	int status,
	List<Header> headers,
	byte[] body
) {
	public HttpReply {
		headers = List.copyOf(headers);
		body = body == null ? EMPTY_BODY : body;
	}

	public static HttpReply of(int status) {
		return new HttpReply(status, List.of(), EMPTY_BODY);
	}

	public static HttpReply of(int status, byte[] body) {
		return new HttpReply(status, List.of(), body);
	}

	private static final byte[] EMPTY_BODY = new byte[0];
}

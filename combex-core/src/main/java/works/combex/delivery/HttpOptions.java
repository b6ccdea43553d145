package works.combex.delivery;

import java.time.Duration;
import lombok.With;

import static java.util.Objects.requireNonNull;

@With
public record HttpOptions(
	Duration receiveTimeout,
	Duration connectTimeout
) {
	public HttpOptions {
		requireNonNull(receiveTimeout);
		requireNonNull(connectTimeout);
		if (receiveTimeout.isNegative() || receiveTimeout.isZero() || connectTimeout.isNegative() || connectTimeout.isZero()) {
			throw new IllegalArgumentException("Timeouts must be positive");
		}
	}

	public static HttpOptions defaultOptions() {
		return new HttpOptions(Duration.ofSeconds(30), Duration.ofSeconds(10));
	}
}

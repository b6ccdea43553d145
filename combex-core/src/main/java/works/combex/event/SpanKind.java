package works.combex.event;

import java.util.Locale;
import java.util.Optional;

public enum SpanKind {
	UNSPECIFIED,
	INTERNAL,
	SERVER,
	CLIENT,
	PRODUCER,
	CONSUMER,
	;

	/**
	 * @return the lower-case kind name used on the wire, or empty for {@link #UNSPECIFIED}
	 */
	public Optional<String> wireName() {
		if (this == UNSPECIFIED) {
			return Optional.empty();
		} else {
			return Optional.of(name().toLowerCase(Locale.ROOT));
		}
	}
}

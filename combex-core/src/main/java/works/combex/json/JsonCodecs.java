package works.combex.json;

import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class JsonCodecs {
	private JsonCodecs() { }

	/**
	 * A provider that can't be loaded, or whose library is missing from the classpath,
	 * counts as absent.
	 *
	 * @return a codec from the first {@link JsonCodecProvider} on the classpath
	 * with the given name, or empty if there is none
	 */
	public static Optional<JsonCodec> find(String name) {
		try {
			for (JsonCodecProvider provider : ServiceLoader.load(JsonCodecProvider.class)) {
				if (provider.name().equals(name)) {
					LOGGER.debug("Using JSON codec \"{}\" from {}", name, provider.getClass().getName());
					return Optional.of(provider.create());
				}
			}
		} catch (ServiceConfigurationError | LinkageError e) {
			LOGGER.warn("Unable to load JSON codec \"{}\"", name, e);
		}
		return Optional.empty();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonCodecs.class);
}

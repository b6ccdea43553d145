package works.combex.delivery;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import works.combex.json.JsonCodec;

/**
 * The HTTP backends that can be chosen by name in configuration.
 */
public final class HttpBackends {
	public static final String JDK = "jdk";
	public static final String CONSOLE = "console";

	private HttpBackends() { }

	public static Optional<HttpBackend> find(String name, JsonCodec codec) {
		return Optional.ofNullable(BACKENDS.get(name))
			.map(factory -> factory.apply(codec));
	}

	private static final Map<String, Function<JsonCodec, HttpBackend>> BACKENDS = Map.of(
		JDK, codec -> new JdkHttpBackend(),
		CONSOLE, ConsoleBackend::new
	);
}

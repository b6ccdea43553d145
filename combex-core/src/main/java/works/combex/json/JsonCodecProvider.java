package works.combex.json;

/**
 * Makes a {@link JsonCodec} available by name.
 * Implementations are discovered with {@link java.util.ServiceLoader},
 * so a module only needs to be on the classpath to be usable.
 */
public interface JsonCodecProvider {
	String name();

	JsonCodec create();
}

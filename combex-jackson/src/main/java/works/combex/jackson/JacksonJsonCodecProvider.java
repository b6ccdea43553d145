package works.combex.jackson;

import works.combex.json.JsonCodec;
import works.combex.json.JsonCodecProvider;

/**
 * Registers {@link JacksonJsonCodec} under the name {@value #NAME}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
	public static final String NAME = "jackson";

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public JsonCodec create() {
		return new JacksonJsonCodec();
	}
}

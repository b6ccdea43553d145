package works.combex.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import works.combex.exceptions.CodecException;
import works.combex.json.JsonCodec;

import static works.combex.jackson.JacksonCodecConfiguration.NonFiniteNumbers.NULL;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 * Decoding produces {@link java.util.LinkedHashMap}s, {@link java.util.ArrayList}s and boxed scalars.
 */
public final class JacksonJsonCodec implements JsonCodec {
	private final ObjectMapper mapper;

	public JacksonJsonCodec() {
		this(JacksonCodecConfiguration.defaultConfiguration());
	}

	public JacksonJsonCodec(JacksonCodecConfiguration config) {
		JsonMapper.Builder builder = JsonMapper.builder()
			.enable(JsonWriteFeature.WRITE_NAN_AS_STRINGS);
		if (config.nonFiniteNumbers() == NULL) {
			builder.addModule(new SimpleModule("combex-non-finite")
				.addSerializer(Double.class, new NonFiniteAsNull())
				.addSerializer(double.class, new NonFiniteAsNull()));
		}
		this.mapper = builder.build();
	}

	@Override
	public byte[] encode(Object value) throws CodecException {
		try {
			return mapper.writeValueAsBytes(value);
		} catch (JsonProcessingException e) {
			throw new CodecException("Unable to encode " + value.getClass().getSimpleName(), e);
		}
	}

	@Override
	public Object decode(byte[] json) throws CodecException {
		try {
			return mapper.readValue(json, Object.class);
		} catch (IOException e) {
			throw new CodecException("Unable to decode JSON", e);
		}
	}

	@Override
	public byte[] encodePretty(Object value) throws CodecException {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
		} catch (JsonProcessingException e) {
			throw new CodecException("Unable to encode " + value.getClass().getSimpleName(), e);
		}
	}

	private static final class NonFiniteAsNull extends StdSerializer<Double> {
		NonFiniteAsNull() {
			super(Double.class);
		}

		@Override
		public void serialize(Double value, JsonGenerator gen, SerializerProvider provider) throws IOException {
			if (Double.isFinite(value)) {
				gen.writeNumber(value);
			} else {
				gen.writeNull();
			}
		}
	}
}

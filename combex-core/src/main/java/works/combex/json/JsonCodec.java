package works.combex.json;

import works.combex.exceptions.CodecException;

/**
 * Converts between JSON text and plain Java values:
 * {@link java.util.Map}s with {@link String} keys, {@link java.util.List}s,
 * {@link String}s, {@link Number}s, {@link Boolean}s and null.
 */
public interface JsonCodec {
	byte[] encode(Object value) throws CodecException;

	Object decode(byte[] json) throws CodecException;

	/**
	 * Like {@link #encode} but indented for human readers, if the codec supports that.
	 */
	default byte[] encodePretty(Object value) throws CodecException {
		return encode(value);
	}
}

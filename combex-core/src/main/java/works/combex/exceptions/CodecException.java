package works.combex.exceptions;

/**
 * A {@link works.combex.json.JsonCodec JsonCodec} could not encode or decode a value.
 */
public class CodecException extends RuntimeException {
	public CodecException(String message) { super(message); }
	public CodecException(Throwable cause) { super(cause); }
	public CodecException(String message, Throwable cause) { super(message, cause); }
}

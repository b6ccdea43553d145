package works.combex.jackson;

public record JacksonCodecConfiguration(
	NonFiniteNumbers nonFiniteNumbers
) {
	public static JacksonCodecConfiguration defaultConfiguration() {
		return new JacksonCodecConfiguration(NonFiniteNumbers.STRING);
	}

	/**
	 * How to encode {@code NaN} and the infinities, which JSON can't represent as numbers.
	 */
	public enum NonFiniteNumbers {
		/**
		 * {@code "NaN"}, {@code "Infinity"}, {@code "-Infinity"}.
		 * The attribute survives ingestion, though as a string.
		 */
		STRING,

		/**
		 * {@code null}, which ingestion treats as an absent attribute.
		 */
		NULL,
	}
}

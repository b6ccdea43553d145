package works.combex.exceptions;

/**
 * Indicates that a configuration setting is missing, unrecognized, or invalid.
 * Thrown when the configuration is applied, rather than when it is first used.
 */
public class ConfigurationException extends IllegalArgumentException {
	private final String key;

	public ConfigurationException(String key, String message) {
		super("Configuration \"" + key + "\": " + message);
		this.key = key;
	}

	public ConfigurationException(String key, String message, Throwable cause) {
		super("Configuration \"" + key + "\": " + message, cause);
		this.key = key;
	}

	/**
	 * @return the offending configuration key
	 */
	public String key() {
		return key;
	}
}

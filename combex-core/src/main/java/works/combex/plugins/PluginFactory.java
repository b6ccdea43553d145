package works.combex.plugins;

public interface PluginFactory<T> {
	/**
	 * @throws works.combex.exceptions.ConfigurationException if the options are unusable
	 */
	T create(PluginOptions options);
}

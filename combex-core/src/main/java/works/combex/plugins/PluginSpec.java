package works.combex.plugins;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Names a pluggable component and its options, to be resolved through a {@link PluginRegistry}.
 *
 * @param type the name the component's factory is {@link PluginRegistry#register registered} under
 */
public record PluginSpec(
	String type,
	Map<String, Object> options
) {
	public PluginSpec {
		requireNonNull(type);
		options = Map.copyOf(options);
	}

	public static PluginSpec of(String type) {
		return new PluginSpec(type, Map.of());
	}

	public static PluginSpec of(String type, Map<String, Object> options) {
		return new PluginSpec(type, options);
	}
}

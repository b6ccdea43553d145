package works.combex.plugins;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import works.combex.attributes.AttributeCleaner;
import works.combex.decorators.Decorator;
import works.combex.decorators.StaticFieldsDecorator;
import works.combex.exceptions.ConfigurationException;
import works.combex.sampling.FixedRateSampler;
import works.combex.sampling.Sampler;

/**
 * Maps type names to factories, so configuration can name a component
 * instead of referring to a class.
 *
 * <p>
 * Built in:
 * <ul>
 *     <li>sampler {@code fixed}: options {@code rate} (required) and {@code all}; see {@link FixedRateSampler}</li>
 *     <li>decorator {@code static}: option {@code fields}, a map; see {@link StaticFieldsDecorator}</li>
 * </ul>
 */
public final class PluginRegistry<T> {
	private final String kind;
	private final Map<String, PluginFactory<? extends T>> factories = new ConcurrentHashMap<>();

	public PluginRegistry(String kind) {
		this.kind = kind;
	}

	public static PluginRegistry<Sampler> samplers() {
		return SAMPLERS;
	}

	public static PluginRegistry<Decorator> decorators() {
		return DECORATORS;
	}

	public PluginRegistry<T> register(String type, PluginFactory<? extends T> factory) {
		PluginFactory<? extends T> old = factories.putIfAbsent(type, factory);
		if (old != null) {
			throw new IllegalArgumentException("Duplicate " + kind + " type \"" + type + "\"");
		}
		return this;
	}

	/**
	 * @param configKey where {@code spec} came from, for error messages; eg. {@code "samplers[0]"}
	 */
	public T resolve(PluginSpec spec, String configKey) {
		PluginFactory<? extends T> factory = factories.get(spec.type());
		if (factory == null) {
			throw new ConfigurationException(configKey + ".type", "unknown " + kind + " \"" + spec.type() + "\"; expected one of " + new TreeSet<>(factories.keySet()));
		}
		try {
			return factory.create(new PluginOptions(configKey, spec.options()));
		} catch (ConfigurationException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new ConfigurationException(configKey, "unable to create " + kind + " \"" + spec.type() + "\"", e);
		}
	}

	/**
	 * @param configKey the configuration key of the list, eg. {@code "samplers"}
	 */
	public List<T> resolveAll(List<PluginSpec> specs, String configKey) {
		List<T> result = new ArrayList<>(specs.size());
		for (int i = 0; i < specs.size(); i++) {
			result.add(resolve(specs.get(i), configKey + "[" + i + "]"));
		}
		return result;
	}

	private static final PluginRegistry<Sampler> SAMPLERS = new PluginRegistry<Sampler>("sampler")
		.register("fixed", options -> {
			options.rejectUnknown(Set.of("rate", "all"));
			return new FixedRateSampler(options.requirePositiveInt("rate"), options.getBoolean("all", false));
		});

	private static final PluginRegistry<Decorator> DECORATORS = new PluginRegistry<Decorator>("decorator")
		.register("static", options -> {
			options.rejectUnknown(Set.of("fields"));
			return new StaticFieldsDecorator(AttributeCleaner.dropping().clean(options.getMap("fields")));
		});
}

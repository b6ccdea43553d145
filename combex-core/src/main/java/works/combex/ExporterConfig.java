package works.combex;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.With;
import works.combex.attributes.UnsupportedValuePolicy;
import works.combex.attributes.ValueTrimmer;
import works.combex.batch.BatchChunker;
import works.combex.delivery.HttpBackends;
import works.combex.delivery.HttpOptions;
import works.combex.event.AttributeNameMap;
import works.combex.event.AttributeNameMap.DerivedKey;
import works.combex.exceptions.ConfigurationException;
import works.combex.plugins.PluginSpec;

import static java.util.Objects.requireNonNull;

/**
 * Everything an {@link EventExporter} needs to know, fixed when the exporter is initialized.
 *
 * <p>
 * Start from {@link #defaultConfig()} and use the withers, or apply flat string-keyed
 * settings with {@link #fromMap}. Either way, invalid values are rejected immediately
 * with a {@link ConfigurationException} naming the setting.
 *
 * @param writeKey null means nothing is actually sent; every batch is reported as accepted
 * @param samplerateKey if not null, the span attribute that holds each event's sample rate
 * @param batchSize the most events sent in one batch by {@link EventExporter#report}
 * @param jsonCodec the {@link works.combex.json.JsonCodecProvider#name() name} of the JSON codec
 * @param httpBackend the name of a built-in {@link HttpBackends HTTP backend}
 */
@With
public record ExporterConfig(
	String apiEndpoint,
	String dataset,
	String writeKey,
	AttributeNameMap attributeNameMap,
	String samplerateKey,
	int eventSizeLimit,
	int batchSizeLimit,
	int valueSizeLimit,
	int batchSize,
	UnsupportedValuePolicy unsupportedValues,
	List<PluginSpec> samplers,
	List<PluginSpec> decorators,
	boolean deterministicSampling,
	String httpBackend,
	HttpOptions httpOptions,
	String jsonCodec
) {
	public static final String API_ENDPOINT = "api-endpoint";
	public static final String DATASET = "dataset";
	public static final String WRITE_KEY = "write-key";
	public static final String SAMPLERATE_KEY = "samplerate-key";
	public static final String EVENT_SIZE_LIMIT = "event-size-limit";
	public static final String BATCH_SIZE_LIMIT = "batch-size-limit";
	public static final String VALUE_SIZE_LIMIT = "value-size-limit";
	public static final String BATCH_SIZE = "batch-size";
	public static final String UNSUPPORTED_VALUES = "unsupported-values";
	public static final String DETERMINISTIC_SAMPLING = "deterministic-sampling";
	public static final String HTTP_BACKEND = "http-backend";
	public static final String HTTP_RECEIVE_TIMEOUT_MS = "http-receive-timeout-ms";
	public static final String HTTP_CONNECT_TIMEOUT_MS = "http-connect-timeout-ms";
	public static final String JSON_CODEC = "json-codec";
	public static final String ATTRIBUTE_MAP_PREFIX = "attribute-map.";

	public ExporterConfig {
		require(API_ENDPOINT, apiEndpoint);
		require(DATASET, dataset);
		require("attribute-map", attributeNameMap);
		require(UNSUPPORTED_VALUES, unsupportedValues);
		require(HTTP_BACKEND, httpBackend);
		require("http-options", httpOptions);
		require(JSON_CODEC, jsonCodec);
		samplers = List.copyOf(requireNonNull(samplers));
		decorators = List.copyOf(requireNonNull(decorators));

		try {
			URI uri = new URI(apiEndpoint);
			if (uri.getScheme() == null || uri.getHost() == null) {
				throw new ConfigurationException(API_ENDPOINT, "expected an absolute URL; got \"" + apiEndpoint + "\"");
			}
		} catch (URISyntaxException e) {
			throw new ConfigurationException(API_ENDPOINT, "malformed URL \"" + apiEndpoint + "\"", e);
		}
		if (dataset.isEmpty()) {
			throw new ConfigurationException(DATASET, "must not be empty");
		}
		if (samplerateKey != null && samplerateKey.isEmpty()) {
			throw new ConfigurationException(SAMPLERATE_KEY, "must not be empty");
		}
		requirePositive(EVENT_SIZE_LIMIT, eventSizeLimit);
		requirePositive(BATCH_SIZE_LIMIT, batchSizeLimit);
		requirePositive(BATCH_SIZE, batchSize);
		if ((long) eventSizeLimit + 2 > batchSizeLimit) {
			throw new ConfigurationException(EVENT_SIZE_LIMIT, "event size limit " + eventSizeLimit + " does not fit in batch size limit " + batchSizeLimit);
		}
		if (valueSizeLimit < ValueTrimmer.MAX_ELLIPSIS) {
			throw new ConfigurationException(VALUE_SIZE_LIMIT, "must be at least " + ValueTrimmer.MAX_ELLIPSIS + "; got " + valueSizeLimit);
		}
	}

	public static ExporterConfig defaultConfig() {
		return new ExporterConfig(
			"https://api.honeycomb.io",
			"opentelemetry",
			null,
			AttributeNameMap.defaults(),
			null,
			BatchChunker.DEFAULT_EVENT_SIZE_LIMIT,
			BatchChunker.DEFAULT_BATCH_SIZE_LIMIT,
			ValueTrimmer.DEFAULT_VALUE_LIMIT,
			100,
			UnsupportedValuePolicy.DROP,
			List.of(),
			List.of(),
			false,
			HttpBackends.JDK,
			HttpOptions.defaultOptions(),
			"jackson");
	}

	/**
	 * @return {@link #defaultConfig()} with the given settings applied
	 */
	public static ExporterConfig fromMap(Map<String, ?> settings) {
		return defaultConfig().withSettings(settings);
	}

	/**
	 * @param settings flat settings such as might come from a properties file;
	 *                 values may be strings or already have the right type
	 * @return this configuration with the given settings applied
	 * @throws ConfigurationException for an unknown key or an unusable value
	 */
	public ExporterConfig withSettings(Map<String, ?> settings) {
		ExporterConfig result = this;
		int newEventSizeLimit = eventSizeLimit;
		int newBatchSizeLimit = batchSizeLimit;
		for (Map.Entry<String, ?> entry : settings.entrySet()) {
			switch (entry.getKey()) {
				// These constrain each other, so they're applied together
				case EVENT_SIZE_LIMIT -> newEventSizeLimit = positiveInt(EVENT_SIZE_LIMIT, entry.getValue());
				case BATCH_SIZE_LIMIT -> newBatchSizeLimit = positiveInt(BATCH_SIZE_LIMIT, entry.getValue());
				default -> result = result.withSetting(entry.getKey(), entry.getValue());
			}
		}
		return result.withSizeLimits(newEventSizeLimit, newBatchSizeLimit);
	}

	public ExporterConfig withSizeLimits(int newEventSizeLimit, int newBatchSizeLimit) {
		return new ExporterConfig(
			apiEndpoint,
			dataset,
			writeKey,
			attributeNameMap,
			samplerateKey,
			newEventSizeLimit,
			newBatchSizeLimit,
			valueSizeLimit,
			batchSize,
			unsupportedValues,
			samplers,
			decorators,
			deterministicSampling,
			httpBackend,
			httpOptions,
			jsonCodec);
	}

	private ExporterConfig withSetting(String key, Object value) {
		if (key.startsWith(ATTRIBUTE_MAP_PREFIX)) {
			String derivedName = key.substring(ATTRIBUTE_MAP_PREFIX.length());
			DerivedKey derivedKey = DerivedKey.fromConfigName(derivedName)
				.orElseThrow(() -> new ConfigurationException(key, "unknown derived attribute \"" + derivedName + "\""));
			return withAttributeNameMap(attributeNameMap.with(derivedKey, optionalString(value)));
		}
		return switch (key) {
			case API_ENDPOINT -> withApiEndpoint(string(key, value));
			case DATASET -> withDataset(string(key, value));
			case WRITE_KEY -> withWriteKey(optionalString(value));
			case SAMPLERATE_KEY -> withSamplerateKey(optionalString(value));
			case VALUE_SIZE_LIMIT -> withValueSizeLimit(positiveInt(key, value));
			case BATCH_SIZE -> withBatchSize(positiveInt(key, value));
			case UNSUPPORTED_VALUES -> withUnsupportedValues(policy(key, value));
			case DETERMINISTIC_SAMPLING -> withDeterministicSampling(bool(key, value));
			case HTTP_BACKEND -> withHttpBackend(string(key, value));
			case HTTP_RECEIVE_TIMEOUT_MS -> withHttpOptions(httpOptions.withReceiveTimeout(Duration.ofMillis(positiveInt(key, value))));
			case HTTP_CONNECT_TIMEOUT_MS -> withHttpOptions(httpOptions.withConnectTimeout(Duration.ofMillis(positiveInt(key, value))));
			case JSON_CODEC -> withJsonCodec(string(key, value));
			default -> throw new ConfigurationException(key, "unknown setting");
		};
	}

	private static void require(String key, Object value) {
		if (value == null) {
			throw new ConfigurationException(key, "required");
		}
	}

	private static void requirePositive(String key, int value) {
		if (value <= 0) {
			throw new ConfigurationException(key, "must be positive; got " + value);
		}
	}

	private static String string(String key, Object value) {
		if (value == null) {
			throw new ConfigurationException(key, "required");
		}
		return value.toString().trim();
	}

	private static String optionalString(Object value) {
		if (value == null) {
			return null;
		}
		String result = value.toString().trim();
		return result.isEmpty() ? null : result;
	}

	private static int positiveInt(String key, Object value) {
		long result;
		if (value instanceof Integer || value instanceof Long || value instanceof Short) {
			result = ((Number) value).longValue();
		} else {
			String text = string(key, value);
			try {
				result = Long.parseLong(text);
			} catch (NumberFormatException e) {
				throw new ConfigurationException(key, "expected a positive integer; got \"" + text + "\"", e);
			}
		}
		if (result <= 0 || result > Integer.MAX_VALUE) {
			throw new ConfigurationException(key, "expected a positive integer; got " + result);
		}
		return (int) result;
	}

	private static boolean bool(String key, Object value) {
		if (value instanceof Boolean b) {
			return b;
		}
		String text = string(key, value).toLowerCase(Locale.ROOT);
		return switch (text) {
			case "true" -> true;
			case "false" -> false;
			default -> throw new ConfigurationException(key, "expected true or false; got \"" + text + "\"");
		};
	}

	private static UnsupportedValuePolicy policy(String key, Object value) {
		if (value instanceof UnsupportedValuePolicy p) {
			return p;
		}
		String text = string(key, value);
		try {
			return UnsupportedValuePolicy.valueOf(text.toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new ConfigurationException(key, "expected one of " + List.of(UnsupportedValuePolicy.values()) + "; got \"" + text + "\"", e);
		}
	}
}

package works.combex;

import java.time.Duration;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.combex.attributes.UnsupportedValuePolicy;
import works.combex.event.AttributeNameMap.DerivedKey;
import works.combex.exceptions.ConfigurationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExporterConfigTest {
	@Test
	void defaults() {
		ExporterConfig config = ExporterConfig.defaultConfig();
		assertEquals("https://api.honeycomb.io", config.apiEndpoint());
		assertEquals("opentelemetry", config.dataset());
		assertNull(config.writeKey());
		assertNull(config.samplerateKey());
		assertEquals(102_400, config.eventSizeLimit());
		assertEquals(5_242_880, config.batchSizeLimit());
		assertEquals(49_127, config.valueSizeLimit());
		assertEquals(100, config.batchSize());
		assertEquals(UnsupportedValuePolicy.DROP, config.unsupportedValues());
		assertEquals("trace.parent_id", config.attributeNameMap().parentSpanId());
		assertEquals(Duration.ofSeconds(30), config.httpOptions().receiveTimeout());
		assertEquals(Duration.ofSeconds(10), config.httpOptions().connectTimeout());
		assertEquals("jdk", config.httpBackend());
		assertEquals("jackson", config.jsonCodec());
	}

	@Test
	void fromMap_appliesSettings() {
		ExporterConfig config = ExporterConfig.fromMap(Map.ofEntries(
			Map.entry("api-endpoint", "http://localhost:8080"),
			Map.entry("dataset", "my-dataset"),
			Map.entry("write-key", "secret"),
			Map.entry("samplerate-key", "sample.rate"),
			Map.entry("event-size-limit", "1000"),
			Map.entry("batch-size-limit", 5000),
			Map.entry("value-size-limit", "500"),
			Map.entry("batch-size", "7"),
			Map.entry("unsupported-values", "inspect"),
			Map.entry("deterministic-sampling", "true"),
			Map.entry("http-backend", "console"),
			Map.entry("http-receive-timeout-ms", "1500"),
			Map.entry("http-connect-timeout-ms", 250),
			Map.entry("json-codec", "canned"),
			Map.entry("attribute-map.trace_id", "traceId"),
			Map.entry("attribute-map.span_type", "")
		));
		assertEquals("http://localhost:8080", config.apiEndpoint());
		assertEquals("my-dataset", config.dataset());
		assertEquals("secret", config.writeKey());
		assertEquals("sample.rate", config.samplerateKey());
		assertEquals(1000, config.eventSizeLimit());
		assertEquals(5000, config.batchSizeLimit());
		assertEquals(500, config.valueSizeLimit());
		assertEquals(7, config.batchSize());
		assertEquals(UnsupportedValuePolicy.INSPECT, config.unsupportedValues());
		assertTrue(config.deterministicSampling());
		assertEquals("console", config.httpBackend());
		assertEquals(Duration.ofMillis(1500), config.httpOptions().receiveTimeout());
		assertEquals(Duration.ofMillis(250), config.httpOptions().connectTimeout());
		assertEquals("canned", config.jsonCodec());
		assertEquals("traceId", config.attributeNameMap().targetFor(DerivedKey.TRACE_ID).orElseThrow());
		assertTrue(config.attributeNameMap().targetFor(DerivedKey.SPAN_TYPE).isEmpty());
	}

	@ParameterizedTest
	@MethodSource("badSettings")
	void fromMap_badSetting_namesKey(String key, Object value) {
		ConfigurationException e = assertThrows(ConfigurationException.class, () ->
			ExporterConfig.fromMap(Map.of(key, value)));
		assertEquals(key, e.key());
		assertTrue(e.getMessage().contains(key), e.getMessage());
	}

	static Stream<Arguments> badSettings() {
		return Stream.of(
			Arguments.of("no-such-setting", "x"),
			Arguments.of("attribute-map.no_such_key", "x"),
			Arguments.of("api-endpoint", "not a url"),
			Arguments.of("api-endpoint", "/relative"),
			Arguments.of("dataset", ""),
			Arguments.of("event-size-limit", "lots"),
			Arguments.of("event-size-limit", "0"),
			Arguments.of("event-size-limit", "5242879"),
			Arguments.of("batch-size-limit", -1),
			Arguments.of("value-size-limit", "6"),
			Arguments.of("batch-size", "1.5"),
			Arguments.of("unsupported-values", "explode"),
			Arguments.of("deterministic-sampling", "sometimes"),
			Arguments.of("http-receive-timeout-ms", "0")
		);
	}

	@Test
	void batchLimitTooSmallForEvents_namesEventLimit() {
		ConfigurationException e = assertThrows(ConfigurationException.class, () ->
			ExporterConfig.defaultConfig().withBatchSizeLimit(1000));
		assertEquals("event-size-limit", e.key());
	}
}

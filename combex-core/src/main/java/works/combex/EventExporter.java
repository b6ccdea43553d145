package works.combex;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import works.combex.attributes.AttributeCleaner;
import works.combex.attributes.CleanAttributes;
import works.combex.attributes.ValueTrimmer;
import works.combex.batch.Batch;
import works.combex.batch.BatchChunker;
import works.combex.decorators.DecoratorChain;
import works.combex.delivery.BatchSender;
import works.combex.delivery.HttpBackend;
import works.combex.delivery.HttpBackends;
import works.combex.delivery.WriteKeyMissingBackend;
import works.combex.event.AttributeNameMap.DerivedKey;
import works.combex.event.Event;
import works.combex.event.EventAssembler;
import works.combex.event.SpanRecord;
import works.combex.exceptions.CodecException;
import works.combex.json.JsonCodec;
import works.combex.json.JsonCodecs;
import works.combex.logging.MdcKeys;
import works.combex.logging.MdcScope;
import works.combex.plugins.PluginRegistry;
import works.combex.sampling.DeterministicSampler;
import works.combex.sampling.SamplerChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static works.combex.ExportOutcome.FAILED_NOT_RETRYABLE;
import static works.combex.ExportOutcome.OK;

/**
 * Turns spans into events and delivers them in batches.
 *
 * <p>
 * Each call to {@link #export} or {@link #report} is one export cycle:
 * it runs synchronously on the caller's thread, sends batches one after another,
 * and returns a single {@link ExportOutcome}. Nothing is retried here;
 * that's up to the caller. Problems with individual events or batches are logged
 * and reflected in the outcome rather than thrown.
 *
 * <p>
 * Safe to call from multiple threads, though callers normally don't overlap cycles.
 */
public final class EventExporter {
	private final ExporterConfig config;
	private final JsonCodec codec;
	private final AttributeCleaner cleaner;
	private final EventAssembler assembler;
	private final DecoratorChain decorators;
	private final SamplerChain samplers;
	private final Optional<DeterministicSampler> deterministicSampler;
	private final BatchChunker spanChunker;
	private final BatchChunker reportChunker;
	private final BatchSender sender;
	private final AtomicLong cycleCounter = new AtomicLong();
	private volatile boolean isShutdown = false;

	/**
	 * Uses the given capabilities instead of looking them up by name.
	 * If {@link ExporterConfig#writeKey()} is null, {@code backend} is replaced by
	 * {@link WriteKeyMissingBackend}.
	 *
	 * @throws works.combex.exceptions.ConfigurationException if a sampler or decorator can't be resolved
	 */
	public EventExporter(ExporterConfig config, JsonCodec codec, HttpBackend backend) {
		this.config = config;
		this.codec = codec;
		this.cleaner = new AttributeCleaner(config.unsupportedValues());
		this.assembler = new EventAssembler(
			cleaner,
			new ValueTrimmer(config.valueSizeLimit()),
			config.attributeNameMap(),
			config.samplerateKey());
		this.decorators = new DecoratorChain(PluginRegistry.decorators().resolveAll(config.decorators(), "decorators"));
		this.samplers = new SamplerChain(PluginRegistry.samplers().resolveAll(config.samplers(), "samplers"));
		if (config.deterministicSampling()) {
			this.deterministicSampler = config.attributeNameMap().targetFor(DerivedKey.TRACE_ID).map(DeterministicSampler::new);
			if (deterministicSampler.isEmpty()) {
				LOGGER.warn("Deterministic sampling has no effect when the trace ID attribute is suppressed");
			}
		} else {
			this.deterministicSampler = Optional.empty();
		}
		this.spanChunker = new BatchChunker(config.eventSizeLimit(), config.batchSizeLimit(), Integer.MAX_VALUE);
		this.reportChunker = new BatchChunker(config.eventSizeLimit(), config.batchSizeLimit(), config.batchSize());
		HttpBackend effectiveBackend;
		if (config.writeKey() == null) {
			LOGGER.info("No write key configured; events for dataset \"{}\" will not be sent", config.dataset());
			effectiveBackend = WriteKeyMissingBackend.instance();
		} else {
			effectiveBackend = backend;
		}
		this.sender = new BatchSender(
			effectiveBackend,
			codec,
			config.apiEndpoint(),
			config.dataset(),
			config.writeKey(),
			Combex.userAgent(),
			config.httpOptions());
	}

	/**
	 * Looks up the configured JSON codec and HTTP backend.
	 *
	 * @return empty if either is unavailable, meaning the exporter is disabled
	 * and spans should be discarded
	 * @throws works.combex.exceptions.ConfigurationException if the configuration can't be applied
	 */
	public static Optional<EventExporter> initialize(ExporterConfig config) {
		Optional<JsonCodec> codec = JsonCodecs.find(config.jsonCodec());
		if (codec.isEmpty()) {
			LOGGER.warn("JSON codec \"{}\" is not available; exporter disabled", config.jsonCodec());
			return Optional.empty();
		}
		Optional<HttpBackend> backend = HttpBackends.find(config.httpBackend(), codec.get());
		if (backend.isEmpty()) {
			LOGGER.warn("HTTP backend \"{}\" is not available; exporter disabled", config.httpBackend());
			return Optional.empty();
		}
		return Optional.of(new EventExporter(config, codec.get(), backend.get()));
	}

	public ExporterConfig config() {
		return config;
	}

	/**
	 * @param resourceAttributes describe the service that produced the spans;
	 *                           cleaned the same way as span attributes
	 */
	public ExportOutcome export(List<SpanRecord> spans, Map<?, ?> resourceAttributes) {
		return export(spans, cleaner.clean(resourceAttributes));
	}

	public ExportOutcome export(List<SpanRecord> spans, CleanAttributes resourceAttributes) {
		if (spans.isEmpty()) {
			return OK;
		}
		try (var __ = cycleScope()) {
			if (isShutdown) {
				LOGGER.warn("Exporter is shut down; dropping {} spans", spans.size());
				return FAILED_NOT_RETRYABLE;
			}
			List<Event> events = new ArrayList<>(spans.size());
			for (SpanRecord span : spans) {
				events.addAll(assembler.assemble(span, resourceAttributes));
			}
			LOGGER.debug("Exporting {} spans", spans.size());
			return deliver(sample(events), spanChunker);
		}
	}

	/**
	 * Delivers events that were assembled elsewhere, after running them through
	 * the configured decorators and samplers.
	 * Batches hold at most {@link ExporterConfig#batchSize()} events.
	 */
	public ExportOutcome report(List<Event> events) {
		if (events.isEmpty()) {
			return OK;
		}
		try (var __ = cycleScope()) {
			if (isShutdown) {
				LOGGER.warn("Exporter is shut down; dropping {} events", events.size());
				return FAILED_NOT_RETRYABLE;
			}
			LOGGER.debug("Reporting {} events", events.size());
			return deliver(sample(decorators.apply(events)), reportChunker);
		}
	}

	/**
	 * After this, export and report send nothing.
	 */
	public void shutdown() {
		isShutdown = true;
	}

	private List<Event> sample(List<Event> events) {
		List<Event> sampled = samplers.apply(events);
		return deterministicSampler
			.map(s -> s.filter(sampled))
			.orElse(sampled);
	}

	private ExportOutcome deliver(List<Event> events, BatchChunker chunker) {
		List<byte[]> encoded = new ArrayList<>(events.size());
		for (Event event : events) {
			try {
				encoded.add(codec.encode(event.toWire()));
			} catch (CodecException e) {
				LOGGER.warn("Dropping event that could not be encoded", e);
			}
		}
		// Batches are independent, so a failed one doesn't stop the rest
		List<ExportOutcome> outcomes = new ArrayList<>();
		for (Batch batch : chunker.chunk(encoded)) {
			outcomes.add(sender.send(batch));
		}
		return ExportOutcome.firstFailure(outcomes);
	}

	private MdcScope cycleScope() {
		return MdcScope.of(MdcKeys.DATASET, config.dataset())
			.and(MdcKeys.EXPORT_CYCLE, Long.toString(cycleCounter.incrementAndGet()));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EventExporter.class);
}

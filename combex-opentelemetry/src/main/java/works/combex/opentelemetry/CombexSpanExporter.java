package works.combex.opentelemetry;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import works.combex.EventExporter;
import works.combex.ExportOutcome;
import works.combex.ExporterConfig;
import works.combex.event.SpanRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plugs an {@link EventExporter} into the OpenTelemetry SDK, typically behind a
 * {@link io.opentelemetry.sdk.trace.export.BatchSpanProcessor BatchSpanProcessor},
 * which owns scheduling and retries.
 *
 * <p>
 * Spans are grouped by {@link Resource}, and each group is exported with its
 * resource's attributes. Any failed group fails the whole call.
 * If the exporter could not be initialized, spans are accepted and discarded.
 */
public final class CombexSpanExporter implements SpanExporter {
	private final Optional<EventExporter> exporter;

	/**
	 * @param exporter empty to discard every span
	 */
	public CombexSpanExporter(Optional<EventExporter> exporter) {
		this.exporter = exporter;
	}

	/**
	 * @throws works.combex.exceptions.ConfigurationException if {@code config} can't be applied
	 */
	public static CombexSpanExporter create(ExporterConfig config) {
		return new CombexSpanExporter(EventExporter.initialize(config));
	}

	public static CombexSpanExporter of(EventExporter exporter) {
		return new CombexSpanExporter(Optional.of(exporter));
	}

	public boolean isEnabled() {
		return exporter.isPresent();
	}

	@Override
	public CompletableResultCode export(Collection<SpanData> spans) {
		if (exporter.isEmpty()) {
			LOGGER.trace("Exporter disabled; discarding {} spans", spans.size());
			return CompletableResultCode.ofSuccess();
		}
		Map<Resource, List<SpanRecord>> byResource = new LinkedHashMap<>();
		for (SpanData span : spans) {
			byResource
				.computeIfAbsent(span.getResource(), r -> new ArrayList<>())
				.add(SpanDataAdapter.toSpanRecord(span));
		}
		List<ExportOutcome> outcomes = new ArrayList<>(byResource.size());
		byResource.forEach((resource, records) ->
			outcomes.add(exporter.get().export(records, SpanDataAdapter.resourceAttributes(resource))));
		ExportOutcome outcome = ExportOutcome.firstFailure(outcomes);
		if (outcome.isOk()) {
			return CompletableResultCode.ofSuccess();
		} else {
			LOGGER.warn("Export of {} spans failed: {}", spans.size(), outcome);
			return CompletableResultCode.ofFailure();
		}
	}

	@Override
	public CompletableResultCode flush() {
		return CompletableResultCode.ofSuccess();
	}

	@Override
	public CompletableResultCode shutdown() {
		exporter.ifPresent(EventExporter::shutdown);
		return CompletableResultCode.ofSuccess();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CombexSpanExporter.class);
}

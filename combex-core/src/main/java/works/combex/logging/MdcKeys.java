package works.combex.logging;

/**
 * Keys to use for SLF4J's Mapped Diagnostic Context.
 */
public final class MdcKeys {
	/**
	 * The dataset an exporter is sending to.
	 */
	public static final String DATASET = "combex.dataset";

	/**
	 * Sequence number of the export or report call, counted per exporter from 1.
	 * Together with {@link #DATASET} it ties log lines about drops and delivery failures to one cycle;
	 * two exporters with the same dataset can produce the same pair.
	 */
	public static final String EXPORT_CYCLE = "combex.exportCycle";
}

package works.combex;

import java.util.stream.Stream;

/**
 * The verdict of sending one batch, or of a whole export cycle.
 */
public enum ExportOutcome {
	OK,

	/**
	 * Sending the same events again later could plausibly succeed.
	 */
	FAILED_RETRYABLE,

	/**
	 * Sending the same events again will fail the same way; most likely a configuration problem.
	 */
	FAILED_NOT_RETRYABLE;

	public boolean isOk() {
		return this == OK;
	}

	/**
	 * Reduces several outcomes to one: the first that isn't {@link #OK},
	 * or {@link #OK} if there is none.
	 */
	public static ExportOutcome firstFailure(Stream<ExportOutcome> outcomes) {
		return outcomes
			.filter(o -> o != OK)
			.findFirst()
			.orElse(OK);
	}

	public static ExportOutcome firstFailure(Iterable<ExportOutcome> outcomes) {
		for (ExportOutcome outcome : outcomes) {
			if (outcome != OK) {
				return outcome;
			}
		}
		return OK;
	}
}

package org.javai.tutoreval.judge;

import java.util.List;

/**
 * Thrown when no strategy of the judge parse cascade could recover ratings.
 */
public class UnparseableJudgeOutputException extends RuntimeException {

	private static final int EXCERPT_LENGTH = 200;

	private final List<String> strategyFailures;
	private final String excerpt;

	public UnparseableJudgeOutputException(List<String> strategyFailures, String rawText) {
		super(buildMessage(strategyFailures));
		this.strategyFailures = List.copyOf(strategyFailures);
		this.excerpt = excerptOf(rawText);
	}

	/**
	 * One reason per attempted strategy, in cascade order.
	 */
	public List<String> strategyFailures() {
		return strategyFailures;
	}

	public String excerpt() {
		return excerpt;
	}

	private static String buildMessage(List<String> failures) {
		return "Judge output could not be parsed by any of " + failures.size() + " strategies: "
				+ String.join("; ", failures);
	}

	private static String excerptOf(String raw) {
		if (raw == null) {
			return "";
		}
		return raw.length() <= EXCERPT_LENGTH ? raw : raw.substring(0, EXCERPT_LENGTH) + "...";
	}
}

package org.javai.tutoreval.judge;

/**
 * Strict parse after removing trailing commas and escaping raw control characters in strings.
 */
class CleanupStrategy implements JudgeParseStrategy {

	@Override
	public String name() {
		return "cleanup";
	}

	@Override
	public StrategyResult attempt(String rawText) {
		return JsonText.braceSpan(rawText)
				.map(span -> JudgeRatingSetReader.parseAndRead(JudgeRatingSetReader.STRICT_MAPPER, JsonText.cleanup(span)))
				.orElseGet(() -> StrategyResult.failure("no braced span"));
	}
}

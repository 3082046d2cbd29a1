package org.javai.tutoreval.judge;

/**
 * Strict parse of the text between the first opening and the last closing brace.
 */
class BraceSpanStrategy implements JudgeParseStrategy {

	@Override
	public String name() {
		return "brace-span";
	}

	@Override
	public StrategyResult attempt(String rawText) {
		return JsonText.braceSpan(rawText)
				.map(span -> JudgeRatingSetReader.parseAndRead(JudgeRatingSetReader.STRICT_MAPPER, span))
				.orElseGet(() -> StrategyResult.failure("no braced span"));
	}
}

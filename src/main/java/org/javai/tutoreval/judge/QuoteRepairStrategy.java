package org.javai.tutoreval.judge;

/**
 * Strict parse after cleanup and escaping of stray double quotes inside string values, the most common
 * judge mistake ({@code "reasoning": "uses the "scaffold" idea"}).
 */
class QuoteRepairStrategy implements JudgeParseStrategy {

	@Override
	public String name() {
		return "quote-repair";
	}

	@Override
	public StrategyResult attempt(String rawText) {
		return JsonText.braceSpan(rawText)
				.map(span -> JudgeRatingSetReader.parseAndRead(JudgeRatingSetReader.STRICT_MAPPER,
						JsonText.repairQuotes(JsonText.cleanup(span))))
				.orElseGet(() -> StrategyResult.failure("no braced span"));
	}
}

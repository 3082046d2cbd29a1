package org.javai.tutoreval.judge;

import java.util.Optional;

/**
 * Parse with Jackson's lenient read features: comments, single quotes, unquoted names, trailing commas,
 * missing values and non-numeric numbers. Unbalanced brackets are not closed.
 */
class LenientStrategy implements JudgeParseStrategy {

	@Override
	public String name() {
		return "lenient";
	}

	@Override
	public StrategyResult attempt(String rawText) {
		Optional<String> span = JsonText.braceSpan(rawText);
		if (span.isEmpty()) {
			return StrategyResult.failure("no braced span");
		}
		StrategyResult asIs = JudgeRatingSetReader.parseAndRead(JudgeRatingSetReader.LENIENT_MAPPER, span.get());
		if (asIs instanceof StrategyResult.Success) {
			return asIs;
		}
		return JudgeRatingSetReader.parseAndRead(JudgeRatingSetReader.LENIENT_MAPPER, JsonText.repairQuotes(span.get()));
	}
}

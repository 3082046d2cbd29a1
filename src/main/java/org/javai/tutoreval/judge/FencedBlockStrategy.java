package org.javai.tutoreval.judge;

/**
 * Strict parse of the first fenced code block.
 */
class FencedBlockStrategy implements JudgeParseStrategy {

	@Override
	public String name() {
		return "fenced-block";
	}

	@Override
	public StrategyResult attempt(String rawText) {
		return JsonText.fencedBlock(rawText)
				.map(block -> JudgeRatingSetReader.parseAndRead(JudgeRatingSetReader.STRICT_MAPPER, block))
				.orElseGet(() -> StrategyResult.failure("no fenced code block"));
	}
}

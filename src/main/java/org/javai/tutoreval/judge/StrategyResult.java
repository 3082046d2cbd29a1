package org.javai.tutoreval.judge;

/**
 * Result of one parse strategy applied to judge output.
 */
public sealed interface StrategyResult {

	record Success(JudgeRatingSet ratings) implements StrategyResult {
	}

	record Failure(String reason) implements StrategyResult {
	}

	static StrategyResult failure(String reason) {
		return new Failure(reason);
	}
}

package org.javai.tutoreval.judge;

/**
 * One step of the judge parse cascade. Strategies are pure: the same text always yields the same result.
 */
public interface JudgeParseStrategy {

	/**
	 * Short label used in failure reports and logs.
	 */
	String name();

	StrategyResult attempt(String rawText);
}

package org.javai.tutoreval.interaction;

/**
 * How a turn whose deliberation ran out of rounds without approval counts in analysis.
 */
public enum ExhaustionPolicy {
	/** Same weight as any other turn. */
	PARITY,
	/** Weighted by {@link EvaluationConfig#exhaustedTurnWeight()}. */
	DOWNWEIGHT
}

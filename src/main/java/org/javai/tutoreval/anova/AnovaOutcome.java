package org.javai.tutoreval.anova;

/**
 * Either a computed table or the reason no table could be computed.
 */
public sealed interface AnovaOutcome {

	record Computed(AnovaResult result) implements AnovaOutcome {
	}

	record Failed(String error) implements AnovaOutcome {
	}
}

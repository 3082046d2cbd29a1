package org.javai.tutoreval.judge;

import java.util.List;
import java.util.Objects;

/**
 * Everything the judge sees when rating one tutor message.
 *
 * @param transcript earlier dialogue, one labelled line per entry; empty for single-turn runs
 */
public record JudgeRequest(
		String scenarioName,
		String scenarioDescription,
		String expectedBehavior,
		String learnerContext,
		String tutorMessage,
		String transcript,
		List<String> requiredElements,
		List<String> forbiddenElements) {

	public JudgeRequest {
		Objects.requireNonNull(tutorMessage, "tutorMessage must not be null");
		scenarioName = scenarioName != null ? scenarioName : "";
		scenarioDescription = scenarioDescription != null ? scenarioDescription : "";
		expectedBehavior = expectedBehavior != null ? expectedBehavior : "";
		learnerContext = learnerContext != null ? learnerContext : "";
		transcript = transcript != null ? transcript : "";
		requiredElements = requiredElements != null ? List.copyOf(requiredElements) : List.of();
		forbiddenElements = forbiddenElements != null ? List.copyOf(forbiddenElements) : List.of();
	}
}

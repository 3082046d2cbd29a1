package org.javai.tutoreval.judge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JudgePromptBuilderTest {

	private final JudgePromptBuilder builder = new JudgePromptBuilder(List.of(
			new RubricDimension("relevance", "Relevance", "Fits the learner's situation", "base", 0.5,
					Map.of(5, "Directly addresses the question", 1, "Off topic")),
			RubricDimension.of("tone", "base", 0.5)));

	@Test
	void includesRubricScenarioAndMessage() {
		String prompt = builder.build(new JudgeRequest("Struggling learner", "Failed quiz twice", "Encourage",
				"Lecture 2 quiz: 2 failures", "Let's revisit the quiz together.", "", List.of("quiz"), List.of()));

		assertThat(prompt)
				.contains("**Relevance** (relevance)")
				.contains("  1: Off topic")
				.contains("**Scenario**: Struggling learner")
				.contains("Lecture 2 quiz: 2 failures")
				.contains("Let's revisit the quiz together.")
				.contains("- quiz")
				.contains("- None specified")
				.contains("\"tone\": {\"score\": 4")
				.doesNotContain("CONVERSATION SO FAR");
	}

	@Test
	void includesTranscriptForMultiTurnDialogue() {
		String prompt = builder.build(new JudgeRequest(null, null, null, null, "Good thinking.",
				"Learner: I'm stuck\nTutor: Where exactly?", null, null));

		assertThat(prompt)
				.contains("## CONVERSATION SO FAR")
				.contains("Tutor: Where exactly?")
				.contains("No context provided");
	}

	@Test
	void requiresAtLeastOneDimension() {
		assertThatThrownBy(() -> new JudgePromptBuilder(List.of())).isInstanceOf(IllegalArgumentException.class);
	}
}

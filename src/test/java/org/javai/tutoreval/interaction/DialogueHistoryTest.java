package org.javai.tutoreval.interaction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class DialogueHistoryTest {

	private final DialogueHistory history = new DialogueHistory();

	@Test
	void alternatesStartingWithTheLearner() {
		history.appendLearner(0, "I'm stuck");
		history.appendTutor(0, "Where exactly?");
		history.appendLearner(1, "Step two");

		assertThat(history.hasPendingLearnerMessage()).isTrue();
		assertThat(history.render()).isEqualTo("Learner: I'm stuck\nTutor: Where exactly?\nLearner: Step two");
	}

	@Test
	void tutorCannotSpeakFirst() {
		assertThatThrownBy(() -> history.appendTutor(0, "Hello"))
				.isInstanceOf(IllegalStateException.class);
		assertThat(history.isEmpty()).isTrue();
	}

	@Test
	void learnerCannotSpeakTwiceInARow() {
		history.appendLearner(0, "first");

		assertThatThrownBy(() -> history.appendLearner(1, "second"))
				.isInstanceOf(IllegalStateException.class);
	}

	@Test
	void exchangesPairLearnerLinesWithAnswers() {
		history.appendLearner(0, "q1");
		history.appendTutor(0, "a1");
		history.appendLearner(1, "q2");

		assertThat(history.exchanges()).containsExactly(
				new DialogueHistory.Exchange(0, "q1", "a1"),
				new DialogueHistory.Exchange(1, "q2", null));
	}

	@Test
	void entriesAreASnapshot() {
		history.appendLearner(0, "q1");

		assertThatThrownBy(() -> history.entries().clear()).isInstanceOf(UnsupportedOperationException.class);
	}
}

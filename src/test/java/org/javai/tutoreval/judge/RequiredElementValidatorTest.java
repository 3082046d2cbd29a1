package org.javai.tutoreval.judge;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class RequiredElementValidatorTest {

	private final RequiredElementValidator validator = new RequiredElementValidator();

	@Test
	void matchesCaseInsensitively() {
		ValidationBlock block = validator.validate("Try Lecture 3 next.", List.of("lecture 3"), List.of("ANSWER"));

		assertThat(block.passes()).isTrue();
	}

	@Test
	void reportsMissingAndForbiddenElements() {
		ValidationBlock block = validator.validate("The answer is 42.", List.of("lecture 3", "42"),
				List.of("the answer is"));

		assertThat(block.passesRequired()).isFalse();
		assertThat(block.requiredMissing()).containsExactly("lecture 3");
		assertThat(block.passesForbidden()).isFalse();
		assertThat(block.forbiddenFound()).containsExactly("the answer is");
	}

	@Test
	void forbiddenElementsAreOnlyCheckedInUserFacingText() {
		String reasoning = "I must not simply give the answer. ";
		String message = "What happens if you try x = 2?";

		ValidationBlock block = validator.validate(reasoning + message, message, List.of("give the answer"),
				List.of("give the answer"));

		assertThat(block.passes()).isTrue();
	}

	@Test
	void blankAndNullElementsAreIgnored() {
		ValidationBlock block = validator.validate("anything", List.of(" "), null);

		assertThat(block.passes()).isTrue();
		assertThat(block.requiredMissing()).isEmpty();
	}
}

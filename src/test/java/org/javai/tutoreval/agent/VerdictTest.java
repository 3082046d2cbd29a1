package org.javai.tutoreval.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class VerdictTest {

	@ParameterizedTest
	@CsvSource({
			"approve, APPROVE",
			"Approved, APPROVE",
			"accept, APPROVE",
			"REJECT, REJECT",
			"revise: tighten wording, REVISE",
			"Enhance, ENHANCE",
			"reframe, REFRAME"
	})
	void readsVerdictsFromModelText(String text, Verdict expected) {
		assertThat(Verdict.fromText(text)).isEqualTo(expected);
	}

	@Test
	void onlyApproveIsApproval() {
		assertThat(Verdict.APPROVE.isApproval()).isTrue();
		assertThat(Verdict.REFRAME.isApproval()).isFalse();
	}

	@Test
	void unknownVerdictIsRejected() {
		assertThatThrownBy(() -> Verdict.fromText("maybe")).isInstanceOf(IllegalArgumentException.class);
	}
}

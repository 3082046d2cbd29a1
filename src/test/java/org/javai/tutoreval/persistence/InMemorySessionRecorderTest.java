package org.javai.tutoreval.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.javai.tutoreval.agent.AgentInvocationException;
import org.javai.tutoreval.agent.AgentRole;
import org.javai.tutoreval.cell.ExecutionPlan;
import org.javai.tutoreval.cell.ModelBinding;
import org.javai.tutoreval.interaction.DialogueSession;
import org.javai.tutoreval.interaction.Turn;
import org.javai.tutoreval.interaction.TurnFailure;
import org.javai.tutoreval.judge.DimensionRating;
import org.javai.tutoreval.judge.JudgeOutcome;
import org.javai.tutoreval.judge.JudgeRatingSet;
import org.javai.tutoreval.scoring.CompositeScoreBundle;
import org.junit.jupiter.api.Test;

class InMemorySessionRecorderTest {

	private final InMemorySessionRecorder recorder = new InMemorySessionRecorder();
	private final DialogueSession session = new DialogueSession(
			ExecutionPlan.fallback("custom", new ModelBinding(null, "nemotron")), "s1", 4);

	@Test
	void keepsTurnsAndFailuresPerSession() {
		Turn turn = new Turn(0, "q", "a", null, null,
				new JudgeOutcome.FullParse(JudgeRatingSet.of(Map.of("tone", DimensionRating.of(3))), 2),
				new CompositeScoreBundle(Map.of(), 50), null, null, false, 1.0);
		TurnFailure failure = new TurnFailure(1, AgentRole.JUDGE, AgentInvocationException.Kind.TIMEOUT, "slow");

		recorder.recordTurn(session, turn);
		recorder.recordFailure(session, failure);

		assertThat(recorder.turnsOf("custom/s1#4")).containsExactly(turn);
		assertThat(recorder.failuresOf("custom/s1#4")).containsExactly(failure);
		assertThat(recorder.turnsOf("other/s1#0")).isEmpty();
	}

	@Test
	void acceptsOnlySealedSessions() {
		assertThatThrownBy(() -> recorder.sealSession(session)).isInstanceOf(IllegalStateException.class);

		session.seal();
		recorder.sealSession(session);

		assertThat(recorder.sealedSessions()).containsExactly(session);
	}
}

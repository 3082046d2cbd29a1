package org.javai.tutoreval.agent;

import java.util.List;
import java.util.Objects;

/**
 * Everything a tutor-side agent sees for one invocation.
 *
 * <p>A context with a {@code priorDraft} asks for a revision of that draft in light of {@code feedback}.</p>
 *
 * @param scenarioId scenario under test
 * @param learnerContext curriculum / learner situation text for the scenario
 * @param promptVariant prompt variant the plan selected
 * @param history flattened conversation so far, oldest first
 * @param priorDraft draft to revise, or {@code null} for a first draft
 * @param feedback critic rationale the revision should address, or {@code null}
 * @param feedbackVerdict verdict that triggered the revision, or {@code null}
 */
public record AgentContext(
		String scenarioId,
		String learnerContext,
		String promptVariant,
		List<DialogueEntry> history,
		String priorDraft,
		String feedback,
		Verdict feedbackVerdict
) {

	public AgentContext {
		Objects.requireNonNull(scenarioId, "scenarioId must not be null");
		history = history != null ? List.copyOf(history) : List.of();
	}

	public static AgentContext initial(String scenarioId, String learnerContext, String promptVariant,
			List<DialogueEntry> history) {
		return new AgentContext(scenarioId, learnerContext, promptVariant, history, null, null, null);
	}

	public AgentContext forRevision(String draft, Critique critique) {
		return new AgentContext(scenarioId, learnerContext, promptVariant, history,
				draft, critique.rationale(), critique.verdict());
	}

	public boolean isRevision() {
		return priorDraft != null;
	}
}

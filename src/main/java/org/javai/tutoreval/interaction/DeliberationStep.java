package org.javai.tutoreval.interaction;

import java.util.Objects;
import org.javai.tutoreval.agent.AgentRole;
import org.javai.tutoreval.agent.Verdict;

/**
 * One entry of a deliberation trace.
 *
 * @param round deliberation round, 0 for the initial draft
 * @param verdict critic verdict for {@link DeliberationAction#REVIEW} steps, otherwise {@code null}
 * @param text draft content for generate/revise steps, critic rationale for review steps
 */
public record DeliberationStep(int round, AgentRole actor, DeliberationAction action, Verdict verdict, String text) {

	public DeliberationStep {
		Objects.requireNonNull(actor, "actor must not be null");
		Objects.requireNonNull(action, "action must not be null");
		if ((action == DeliberationAction.REVIEW) != (verdict != null)) {
			throw new IllegalArgumentException("exactly the review steps carry a verdict");
		}
		text = text != null ? text : "";
	}

	static DeliberationStep draft(String content) {
		return new DeliberationStep(0, AgentRole.TUTOR, DeliberationAction.GENERATE, null, content);
	}

	static DeliberationStep review(int round, Verdict verdict, String rationale) {
		return new DeliberationStep(round, AgentRole.CRITIC, DeliberationAction.REVIEW, verdict, rationale);
	}

	static DeliberationStep revision(int round, String content) {
		return new DeliberationStep(round, AgentRole.TUTOR, DeliberationAction.REVISE, null, content);
	}
}

package org.javai.tutoreval.interaction;

import java.util.List;

/**
 * Result of the draft/review/revise loop for one tutor turn.
 *
 * @param acceptedContent the message that goes to the learner and the judge
 * @param roundsUsed review rounds consumed
 * @param approved whether the critic approved the accepted content
 * @param exhausted whether the round budget ran out without approval
 */
public record DeliberationOutcome(
		String acceptedContent,
		List<DeliberationStep> trace,
		int roundsUsed,
		boolean approved,
		boolean exhausted) {

	public DeliberationOutcome {
		trace = List.copyOf(trace);
	}
}

package org.javai.tutoreval.agent;

import java.util.List;

/**
 * Simulated learner for multi-turn scenarios.
 */
@FunctionalInterface
public interface LearnerCollaborator {

	/**
	 * Produces the learner's next message. An empty history asks for the opening message.
	 *
	 * @param history flattened conversation so far, oldest first, ending with the tutor's latest line
	 */
	LearnerReply respond(List<DialogueEntry> history);
}

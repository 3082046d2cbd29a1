package org.javai.tutoreval.agent;

/**
 * Speaker of a line in the learner/tutor conversation.
 */
public enum DialogueRole {
	TUTOR("Tutor"),
	LEARNER("Learner");

	private final String label;

	DialogueRole(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}
}

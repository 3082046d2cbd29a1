package org.javai.tutoreval.agent;

import java.util.Objects;

/**
 * One line of conversation history as handed to agents.
 *
 * @param turnIndex dialogue turn the line belongs to (0 is the learner's opening message)
 * @param role who said it
 * @param content what was said
 */
public record DialogueEntry(int turnIndex, DialogueRole role, String content) {

	public DialogueEntry {
		Objects.requireNonNull(role, "role must not be null");
		Objects.requireNonNull(content, "content must not be null");
		if (turnIndex < 0) {
			throw new IllegalArgumentException("turnIndex must be >= 0");
		}
	}

	public static DialogueEntry tutor(int turnIndex, String content) {
		return new DialogueEntry(turnIndex, DialogueRole.TUTOR, content);
	}

	public static DialogueEntry learner(int turnIndex, String content) {
		return new DialogueEntry(turnIndex, DialogueRole.LEARNER, content);
	}

	/**
	 * Renders the entry as {@code Tutor: ...} or {@code Learner: ...}.
	 */
	public String labelled() {
		return role.label() + ": " + content;
	}
}

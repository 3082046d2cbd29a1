package org.javai.tutoreval.interaction;

import java.util.ArrayList;
import java.util.List;
import org.javai.tutoreval.agent.DialogueEntry;
import org.javai.tutoreval.agent.DialogueRole;

/**
 * Append-only conversation record, strictly alternating learner and tutor and starting with the learner.
 *
 * <p>Agents receive the history flattened: one labelled entry per line, oldest first. Nothing is merged
 * or dropped, so {@link #exchanges()} can always pair the lines back up.</p>
 */
public class DialogueHistory {

	/**
	 * A learner message and the tutor's answer to it; {@code tutor} is {@code null} while unanswered.
	 */
	public record Exchange(int turnIndex, String learner, String tutor) {
	}

	private final List<DialogueEntry> entries = new ArrayList<>();

	public void appendLearner(int turnIndex, String message) {
		if (hasPendingLearnerMessage()) {
			throw new IllegalStateException("learner already has an unanswered message");
		}
		entries.add(DialogueEntry.learner(turnIndex, message));
	}

	public void appendTutor(int turnIndex, String message) {
		if (!hasPendingLearnerMessage()) {
			throw new IllegalStateException("tutor can only answer a pending learner message");
		}
		entries.add(DialogueEntry.tutor(turnIndex, message));
	}

	public boolean hasPendingLearnerMessage() {
		return !entries.isEmpty() && entries.get(entries.size() - 1).role() == DialogueRole.LEARNER;
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public List<DialogueEntry> entries() {
		return List.copyOf(entries);
	}

	public String render() {
		return render(entries);
	}

	public static String render(List<DialogueEntry> entries) {
		StringBuilder sb = new StringBuilder();
		for (DialogueEntry entry : entries) {
			if (!sb.isEmpty()) {
				sb.append('\n');
			}
			sb.append(entry.labelled());
		}
		return sb.toString();
	}

	public List<Exchange> exchanges() {
		List<Exchange> exchanges = new ArrayList<>();
		for (int i = 0; i < entries.size(); i += 2) {
			DialogueEntry learner = entries.get(i);
			String tutor = i + 1 < entries.size() ? entries.get(i + 1).content() : null;
			exchanges.add(new Exchange(learner.turnIndex(), learner.content(), tutor));
		}
		return exchanges;
	}
}

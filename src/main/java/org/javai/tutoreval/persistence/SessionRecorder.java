package org.javai.tutoreval.persistence;

import org.javai.tutoreval.interaction.DialogueSession;
import org.javai.tutoreval.interaction.Turn;
import org.javai.tutoreval.interaction.TurnFailure;

/**
 * Receives session progress as it happens. Calls for one session arrive in order from a single thread;
 * calls for different sessions may arrive concurrently.
 */
public interface SessionRecorder {

	void recordTurn(DialogueSession session, Turn turn);

	void recordFailure(DialogueSession session, TurnFailure failure);

	/**
	 * Called once, after the session has been sealed.
	 */
	void sealSession(DialogueSession session);

	/**
	 * A recorder that keeps nothing.
	 */
	static SessionRecorder none() {
		return new SessionRecorder() {
			@Override
			public void recordTurn(DialogueSession session, Turn turn) {
			}

			@Override
			public void recordFailure(DialogueSession session, TurnFailure failure) {
			}

			@Override
			public void sealSession(DialogueSession session) {
			}
		};
	}
}

package org.javai.tutoreval.persistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.tutoreval.interaction.DialogueSession;
import org.javai.tutoreval.interaction.Turn;
import org.javai.tutoreval.interaction.TurnFailure;

/**
 * Thread-safe recorder that keeps everything in memory, keyed by {@code cell/scenario#replicate}.
 */
public class InMemorySessionRecorder implements SessionRecorder {

	private final Map<String, List<Turn>> turns = new ConcurrentHashMap<>();
	private final Map<String, List<TurnFailure>> failures = new ConcurrentHashMap<>();
	private final List<DialogueSession> sealed = new ArrayList<>();

	public static String keyOf(DialogueSession session) {
		return session.cellName() + "/" + session.scenarioId() + "#" + session.replicate();
	}

	@Override
	public void recordTurn(DialogueSession session, Turn turn) {
		turns.computeIfAbsent(keyOf(session), k -> new ArrayList<>()).add(turn);
	}

	@Override
	public void recordFailure(DialogueSession session, TurnFailure failure) {
		failures.computeIfAbsent(keyOf(session), k -> new ArrayList<>()).add(failure);
	}

	@Override
	public synchronized void sealSession(DialogueSession session) {
		if (!session.isSealed()) {
			throw new IllegalStateException("session " + keyOf(session) + " must be sealed before it is recorded as sealed");
		}
		sealed.add(session);
	}

	public List<Turn> turnsOf(String key) {
		return List.copyOf(turns.getOrDefault(key, List.of()));
	}

	public List<TurnFailure> failuresOf(String key) {
		return List.copyOf(failures.getOrDefault(key, List.of()));
	}

	public synchronized List<DialogueSession> sealedSessions() {
		return List.copyOf(sealed);
	}
}

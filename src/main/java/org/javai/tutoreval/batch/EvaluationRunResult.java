package org.javai.tutoreval.batch;

import java.time.Duration;
import java.util.List;
import org.javai.tutoreval.interaction.DialogueSession;
import org.javai.tutoreval.interaction.SessionStatus;

/**
 * Everything a batch produced, in job submission order.
 */
public record EvaluationRunResult(List<DialogueSession> sessions, List<JobFailure> failures, Duration elapsed) {

	public EvaluationRunResult {
		sessions = List.copyOf(sessions);
		failures = List.copyOf(failures);
	}

	public long countWithStatus(SessionStatus status) {
		return sessions.stream().filter(s -> s.status() == status).count();
	}

	public int jobCount() {
		return sessions.size() + failures.size();
	}
}

package org.javai.tutoreval.interaction;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.tutoreval.cell.ExecutionPlan;

/**
 * The turns and failures of one (cell, scenario, replicate) run.
 *
 * <p>Append-only while open. {@link #seal()} fixes the {@link SessionStatus}; after that the session is
 * read-only. Usage metrics only ever grow, and include the cost of aborted turns.</p>
 */
public class DialogueSession {

	private final ExecutionPlan plan;
	private final String scenarioId;
	private final int replicate;
	private final List<Turn> turns = new ArrayList<>();
	private final List<TurnFailure> failures = new ArrayList<>();
	private final MetricsAccumulator metrics = new MetricsAccumulator();
	private SessionStatus status;

	public DialogueSession(ExecutionPlan plan, String scenarioId, int replicate) {
		this.plan = Objects.requireNonNull(plan, "plan must not be null");
		this.scenarioId = Objects.requireNonNull(scenarioId, "scenarioId must not be null");
		this.replicate = replicate;
	}

	public synchronized void addTurn(Turn turn) {
		requireOpen();
		turns.add(Objects.requireNonNull(turn, "turn must not be null"));
	}

	public synchronized void addFailure(TurnFailure failure) {
		requireOpen();
		failures.add(Objects.requireNonNull(failure, "failure must not be null"));
	}

	public synchronized void addMetrics(InvocationMetrics turnMetrics) {
		requireOpen();
		metrics.addAll(turnMetrics);
	}

	/**
	 * Closes the session. No completed turn means {@link SessionStatus#FAILED}; completed turns alongside
	 * failures mean {@link SessionStatus#PARTIAL_FAILURE}.
	 */
	public synchronized SessionStatus seal() {
		requireOpen();
		if (turns.isEmpty()) {
			status = SessionStatus.FAILED;
		} else if (!failures.isEmpty()) {
			status = SessionStatus.PARTIAL_FAILURE;
		} else {
			status = SessionStatus.COMPLETED;
		}
		return status;
	}

	public synchronized boolean isSealed() {
		return status != null;
	}

	/**
	 * @return the final status, {@code null} while the session is open
	 */
	public synchronized SessionStatus status() {
		return status;
	}

	public ExecutionPlan plan() {
		return plan;
	}

	public String cellName() {
		return plan.cellName();
	}

	public String scenarioId() {
		return scenarioId;
	}

	public int replicate() {
		return replicate;
	}

	public synchronized List<Turn> turns() {
		return List.copyOf(turns);
	}

	public synchronized List<TurnFailure> failures() {
		return List.copyOf(failures);
	}

	public InvocationMetrics metrics() {
		return metrics.snapshot();
	}

	private void requireOpen() {
		if (status != null) {
			throw new IllegalStateException("session " + cellName() + "/" + scenarioId + "#" + replicate + " is sealed");
		}
	}
}

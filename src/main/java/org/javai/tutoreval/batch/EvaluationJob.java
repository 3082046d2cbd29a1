package org.javai.tutoreval.batch;

import java.util.Objects;
import org.javai.tutoreval.cell.ExecutionPlan;
import org.javai.tutoreval.interaction.Scenario;

/**
 * One session to run: a cell's plan applied to a scenario, for one replicate.
 *
 * @param turnBudget tutor turns for multi-turn scenarios, 0 for the scenario's own budget
 */
public record EvaluationJob(ExecutionPlan plan, Scenario scenario, int turnBudget, int replicate) {

	public EvaluationJob {
		Objects.requireNonNull(plan, "plan must not be null");
		Objects.requireNonNull(scenario, "scenario must not be null");
		if (replicate < 0) {
			throw new IllegalArgumentException("replicate must be >= 0");
		}
	}

	public String describe() {
		return plan.cellName() + "/" + scenario.id() + "#" + replicate;
	}
}

package org.javai.tutoreval.agent;

/**
 * Supplies the simulated learner for a learner architecture ("unified", "ego_superego", ...).
 */
@FunctionalInterface
public interface LearnerCollaboratorFactory {

	LearnerCollaborator learnerFor(String architecture, String scenarioId);
}

package org.javai.tutoreval.agent;

import org.javai.tutoreval.cell.ModelBinding;

/**
 * Supplies the collaborator bound to a given model.
 */
@FunctionalInterface
public interface AgentCollaboratorFactory {

	AgentCollaborator collaboratorFor(ModelBinding binding);
}

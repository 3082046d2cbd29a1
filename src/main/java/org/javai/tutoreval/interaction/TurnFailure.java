package org.javai.tutoreval.interaction;

import java.util.Objects;
import org.javai.tutoreval.agent.AgentInvocationException;
import org.javai.tutoreval.agent.AgentRole;

/**
 * A turn that was aborted because a collaborator failed or timed out.
 */
public record TurnFailure(int index, AgentRole role, AgentInvocationException.Kind kind, String message) {

	public TurnFailure {
		Objects.requireNonNull(role, "role must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
		message = message != null ? message : "";
	}

	public static TurnFailure of(int index, AgentInvocationException e) {
		return new TurnFailure(index, e.role(), e.kind(), e.getMessage());
	}
}

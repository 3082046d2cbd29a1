package org.javai.tutoreval.agent;

/**
 * A collaborator call that did not produce a usable answer: connectivity errors, provider errors,
 * malformed agent output or a timeout.
 */
public class AgentInvocationException extends RuntimeException {

	/**
	 * Why the invocation failed.
	 */
	public enum Kind {
		FAILURE,
		TIMEOUT
	}

	private final AgentRole role;
	private final Kind kind;

	public AgentInvocationException(AgentRole role, Kind kind, String message) {
		super(message);
		this.role = role;
		this.kind = kind;
	}

	public AgentInvocationException(AgentRole role, Kind kind, String message, Throwable cause) {
		super(message, cause);
		this.role = role;
		this.kind = kind;
	}

	public static AgentInvocationException failure(AgentRole role, String message, Throwable cause) {
		return new AgentInvocationException(role, Kind.FAILURE, message, cause);
	}

	public AgentRole role() {
		return role;
	}

	public Kind kind() {
		return kind;
	}

	public boolean isTimeout() {
		return kind == Kind.TIMEOUT;
	}
}

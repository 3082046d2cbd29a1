package org.javai.tutoreval.agent;

/**
 * Narrow contract to a tutor-side agent. How the agent prompts its model is not this library's concern.
 *
 * <p>Either method may fail by throwing; implementations should throw {@link AgentInvocationException}
 * but any runtime exception is treated as an invocation failure.</p>
 */
public interface AgentCollaborator {

	/**
	 * Drafts a tutor message, or revises {@link AgentContext#priorDraft()} when the context asks for it.
	 */
	Generation generate(AgentContext context);

	/**
	 * Reviews a candidate tutor message.
	 */
	Critique critique(String candidateContent, AgentContext context);
}

package org.javai.tutoreval.agent;

/**
 * The parties that consume tokens during a dialogue session.
 */
public enum AgentRole {
	/** Drafts and revises tutor messages. */
	TUTOR,
	/** Reviews tutor drafts inside the deliberation loop. */
	CRITIC,
	/** Simulated learner. */
	LEARNER,
	/** Rubric judge rating the accepted tutor message. */
	JUDGE
}

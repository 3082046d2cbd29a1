package org.javai.tutoreval.interaction;

/**
 * What a session does after a turn is aborted by a collaborator failure.
 */
public enum FailurePolicy {
	/** Stop the session; the remaining turns are not attempted. */
	SKIP_REMAINING,
	/** Carry on with the next turn. */
	CONTINUE
}

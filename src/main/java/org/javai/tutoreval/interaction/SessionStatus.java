package org.javai.tutoreval.interaction;

public enum SessionStatus {
	COMPLETED,
	PARTIAL_FAILURE,
	FAILED
}

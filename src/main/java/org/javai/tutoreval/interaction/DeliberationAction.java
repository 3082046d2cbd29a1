package org.javai.tutoreval.interaction;

public enum DeliberationAction {
	GENERATE,
	REVIEW,
	REVISE
}

package org.javai.tutoreval.scoring;

/**
 * Thrown when a rubric definition cannot be read or is inconsistent.
 */
public class RubricConfigException extends RuntimeException {

	public RubricConfigException(String message) {
		super(message);
	}

	public RubricConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}

package org.javai.tutoreval.anova;

/**
 * Thrown when a score table cannot be analysed: missing or empty cells, unknown cell keys, non-finite
 * scores, or too few observations for an error term.
 */
public class AnovaInputException extends RuntimeException {

	public AnovaInputException(String message) {
		super(message);
	}
}

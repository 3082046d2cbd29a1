package org.javai.tutoreval.batch;

/**
 * A job that ended with an unexpected exception rather than a sealed session.
 */
public record JobFailure(EvaluationJob job, String error) {
}

package org.javai.tutoreval.judge;

/**
 * The judge model. Implementations return the raw text; interpreting it is the job of
 * {@link JudgeResponseParser}. A failed call is reported as an
 * {@link org.javai.tutoreval.agent.AgentInvocationException} with role {@code JUDGE}.
 */
public interface JudgeClient {

	JudgeResponse judge(JudgeRequest request);
}

package org.javai.tutoreval.agent;

/**
 * Token counts reported by one model invocation.
 *
 * @param inputTokens prompt tokens
 * @param outputTokens completion tokens
 */
public record TokenUsage(long inputTokens, long outputTokens) {

	public static final TokenUsage NONE = new TokenUsage(0, 0);

	public TokenUsage {
		if (inputTokens < 0 || outputTokens < 0) {
			throw new IllegalArgumentException("token counts must be >= 0");
		}
	}

	public TokenUsage plus(TokenUsage other) {
		if (other == null) {
			return this;
		}
		return new TokenUsage(inputTokens + other.inputTokens, outputTokens + other.outputTokens);
	}

	public long totalTokens() {
		return inputTokens + outputTokens;
	}
}

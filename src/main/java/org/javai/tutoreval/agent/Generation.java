package org.javai.tutoreval.agent;

import java.time.Duration;

/**
 * A candidate produced by {@link AgentCollaborator#generate}.
 */
public record Generation(String content, TokenUsage usage, Duration latency) {

	public Generation {
		if (content == null) {
			throw new IllegalArgumentException("content must not be null");
		}
		usage = usage != null ? usage : TokenUsage.NONE;
		latency = latency != null ? latency : Duration.ZERO;
	}
}

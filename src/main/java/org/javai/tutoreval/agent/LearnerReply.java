package org.javai.tutoreval.agent;

import java.time.Duration;

/**
 * What the simulated learner said, with its cost.
 */
public record LearnerReply(String message, TokenUsage usage, Duration latency) {

	public LearnerReply {
		if (message == null) {
			throw new IllegalArgumentException("message must not be null");
		}
		usage = usage != null ? usage : TokenUsage.NONE;
		latency = latency != null ? latency : Duration.ZERO;
	}
}

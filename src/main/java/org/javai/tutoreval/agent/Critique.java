package org.javai.tutoreval.agent;

import java.time.Duration;

/**
 * A review produced by {@link AgentCollaborator#critique}.
 */
public record Critique(Verdict verdict, String rationale, TokenUsage usage, Duration latency) {

	public Critique {
		if (verdict == null) {
			throw new IllegalArgumentException("verdict must not be null");
		}
		rationale = rationale != null ? rationale : "";
		usage = usage != null ? usage : TokenUsage.NONE;
		latency = latency != null ? latency : Duration.ZERO;
	}
}

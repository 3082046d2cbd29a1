package org.javai.tutoreval.interaction;

import java.time.Duration;
import org.javai.tutoreval.agent.TokenUsage;

/**
 * Totals for one agent role.
 */
public record RoleMetrics(int invocations, TokenUsage usage, Duration latency) {

	public static final RoleMetrics EMPTY = new RoleMetrics(0, TokenUsage.NONE, Duration.ZERO);

	public RoleMetrics plus(TokenUsage callUsage, Duration callLatency) {
		return new RoleMetrics(invocations + 1, usage.plus(callUsage), latency.plus(callLatency));
	}

	public RoleMetrics plus(RoleMetrics other) {
		return new RoleMetrics(invocations + other.invocations, usage.plus(other.usage), latency.plus(other.latency));
	}
}

package org.javai.tutoreval.interaction;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.javai.tutoreval.agent.AgentRole;
import org.javai.tutoreval.agent.TokenUsage;

/**
 * Immutable snapshot of model usage, broken down by agent role.
 */
public record InvocationMetrics(Map<AgentRole, RoleMetrics> byRole) {

	public static final InvocationMetrics EMPTY = new InvocationMetrics(Map.of());

	public InvocationMetrics {
		Map<AgentRole, RoleMetrics> copy = new EnumMap<>(AgentRole.class);
		copy.putAll(byRole);
		byRole = Collections.unmodifiableMap(copy);
	}

	public RoleMetrics forRole(AgentRole role) {
		return byRole.getOrDefault(role, RoleMetrics.EMPTY);
	}

	public int invocations() {
		return byRole.values().stream().mapToInt(RoleMetrics::invocations).sum();
	}

	public TokenUsage usage() {
		return byRole.values().stream().map(RoleMetrics::usage).reduce(TokenUsage.NONE, TokenUsage::plus);
	}

	public long inputTokens() {
		return usage().inputTokens();
	}

	public long outputTokens() {
		return usage().outputTokens();
	}

	public Duration latency() {
		return byRole.values().stream().map(RoleMetrics::latency).reduce(Duration.ZERO, Duration::plus);
	}
}

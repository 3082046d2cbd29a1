package org.javai.tutoreval.interaction;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.javai.tutoreval.agent.AgentRole;
import org.javai.tutoreval.agent.TokenUsage;

/**
 * Running, add-only usage totals. There is no reset.
 */
public class MetricsAccumulator {

	private final Map<AgentRole, RoleMetrics> byRole = new EnumMap<>(AgentRole.class);

	public synchronized void record(AgentRole role, TokenUsage usage, Duration latency) {
		byRole.merge(role, RoleMetrics.EMPTY.plus(usage, latency), RoleMetrics::plus);
	}

	public synchronized void addAll(InvocationMetrics metrics) {
		metrics.byRole().forEach((role, totals) -> byRole.merge(role, totals, RoleMetrics::plus));
	}

	public synchronized InvocationMetrics snapshot() {
		return new InvocationMetrics(byRole);
	}
}

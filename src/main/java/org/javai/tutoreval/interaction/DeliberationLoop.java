package org.javai.tutoreval.interaction;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import org.javai.tutoreval.agent.AgentCollaborator;
import org.javai.tutoreval.agent.AgentContext;
import org.javai.tutoreval.agent.AgentRole;
import org.javai.tutoreval.agent.Critique;
import org.javai.tutoreval.agent.Generation;
import org.javai.tutoreval.agent.TimeLimitedInvoker;
import org.javai.tutoreval.agent.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Draft, then up to {@code maxRounds} rounds of critic review. Approval ends the loop; any other verdict
 * triggers a revision that consumes the round. When the budget runs out the latest revision is accepted
 * as is and the outcome is flagged exhausted.
 */
public class DeliberationLoop {

	private static final Logger logger = LoggerFactory.getLogger(DeliberationLoop.class);

	private final TimeLimitedInvoker invoker;

	public DeliberationLoop(TimeLimitedInvoker invoker) {
		this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
	}

	/**
	 * @param critic reviewer, may be {@code null} when {@code maxRounds} is 0
	 * @throws org.javai.tutoreval.agent.AgentInvocationException when any call fails or times out
	 */
	public DeliberationOutcome run(AgentCollaborator tutor, AgentCollaborator critic, AgentContext context,
			int maxRounds, Duration timeout, MetricsAccumulator metrics) {
		Objects.requireNonNull(tutor, "tutor must not be null");
		if (maxRounds > 0 && critic == null) {
			throw new IllegalArgumentException("deliberation with " + maxRounds + " rounds needs a critic");
		}
		List<DeliberationStep> trace = new ArrayList<>();
		Generation draft = timed(AgentRole.TUTOR, timeout, metrics, () -> tutor.generate(context), Generation::usage);
		String current = draft.content();
		trace.add(DeliberationStep.draft(current));

		for (int round = 1; round <= maxRounds; round++) {
			String candidate = current;
			Critique critique = timed(AgentRole.CRITIC, timeout, metrics, () -> critic.critique(candidate, context),
					Critique::usage);
			trace.add(DeliberationStep.review(round, critique.verdict(), critique.rationale()));
			if (critique.verdict().isApproval()) {
				return new DeliberationOutcome(current, trace, round, true, false);
			}
			AgentContext revisionContext = context.forRevision(current, critique);
			Generation revision = timed(AgentRole.TUTOR, timeout, metrics, () -> tutor.generate(revisionContext),
					Generation::usage);
			current = revision.content();
			trace.add(DeliberationStep.revision(round, current));
		}
		boolean exhausted = maxRounds > 0;
		if (exhausted) {
			logger.debug("Deliberation for {} used all {} rounds without approval; accepting latest revision",
					context.scenarioId(), maxRounds);
		}
		return new DeliberationOutcome(current, trace, maxRounds, false, exhausted);
	}

	private <T> T timed(AgentRole role, Duration timeout, MetricsAccumulator metrics, Supplier<T> call,
			Function<T, TokenUsage> usage) {
		long started = System.nanoTime();
		T result = invoker.invoke(role, timeout, call);
		metrics.record(role, usage.apply(result), Duration.ofNanos(System.nanoTime() - started));
		return result;
	}
}

package org.javai.tutoreval.interaction;

import java.time.Duration;
import java.util.Objects;

/**
 * Run-wide settings threaded through the orchestrator and batch runner.
 *
 * <pre>{@code
 * EvaluationConfig config = EvaluationConfig.builder()
 *         .callTimeout(Duration.ofSeconds(90))
 *         .failurePolicy(FailurePolicy.CONTINUE)
 *         .maxConcurrency(8)
 *         .build();
 * }</pre>
 *
 * @param callTimeout per-call limit for every collaborator; zero disables the limit
 * @param failurePolicy what a session does after an aborted turn
 * @param exhaustionPolicy how turns with exhausted deliberation are weighted
 * @param exhaustedTurnWeight weight used by {@link ExhaustionPolicy#DOWNWEIGHT}, in [0, 1]
 * @param validateElements whether accepted tutor messages get the rule-based element check
 * @param includeRescuedTurns whether rescue-parsed turns count towards session scores
 * @param maxConcurrency number of sessions run in parallel by the batch runner
 */
public record EvaluationConfig(
		Duration callTimeout,
		FailurePolicy failurePolicy,
		ExhaustionPolicy exhaustionPolicy,
		double exhaustedTurnWeight,
		boolean validateElements,
		boolean includeRescuedTurns,
		int maxConcurrency
) {

	public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(120);
	public static final double DEFAULT_EXHAUSTED_TURN_WEIGHT = 0.5;
	public static final int DEFAULT_MAX_CONCURRENCY = 4;

	public EvaluationConfig {
		Objects.requireNonNull(failurePolicy, "failurePolicy must not be null");
		Objects.requireNonNull(exhaustionPolicy, "exhaustionPolicy must not be null");
		callTimeout = callTimeout != null ? callTimeout : Duration.ZERO;
		if (callTimeout.isNegative()) {
			throw new IllegalArgumentException("callTimeout must not be negative");
		}
		if (!(exhaustedTurnWeight >= 0 && exhaustedTurnWeight <= 1)) {
			throw new IllegalArgumentException("exhaustedTurnWeight must be between 0 and 1");
		}
		if (maxConcurrency < 1) {
			throw new IllegalArgumentException("maxConcurrency must be at least 1");
		}
	}

	public static EvaluationConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Analysis weight of a turn given whether its deliberation was exhausted.
	 */
	public double turnWeight(boolean deliberationExhausted) {
		if (deliberationExhausted && exhaustionPolicy == ExhaustionPolicy.DOWNWEIGHT) {
			return exhaustedTurnWeight;
		}
		return 1.0;
	}

	public static class Builder {
		private Duration callTimeout = DEFAULT_CALL_TIMEOUT;
		private FailurePolicy failurePolicy = FailurePolicy.SKIP_REMAINING;
		private ExhaustionPolicy exhaustionPolicy = ExhaustionPolicy.PARITY;
		private double exhaustedTurnWeight = DEFAULT_EXHAUSTED_TURN_WEIGHT;
		private boolean validateElements = true;
		private boolean includeRescuedTurns = true;
		private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;

		private Builder() {}

		public Builder callTimeout(Duration callTimeout) {
			this.callTimeout = callTimeout;
			return this;
		}

		public Builder failurePolicy(FailurePolicy failurePolicy) {
			this.failurePolicy = failurePolicy;
			return this;
		}

		public Builder exhaustionPolicy(ExhaustionPolicy exhaustionPolicy) {
			this.exhaustionPolicy = exhaustionPolicy;
			return this;
		}

		/**
		 * Sets {@link ExhaustionPolicy#DOWNWEIGHT} with the given weight.
		 */
		public Builder downweightExhaustedTurns(double weight) {
			this.exhaustionPolicy = ExhaustionPolicy.DOWNWEIGHT;
			this.exhaustedTurnWeight = weight;
			return this;
		}

		public Builder validateElements(boolean validateElements) {
			this.validateElements = validateElements;
			return this;
		}

		public Builder includeRescuedTurns(boolean includeRescuedTurns) {
			this.includeRescuedTurns = includeRescuedTurns;
			return this;
		}

		public Builder maxConcurrency(int maxConcurrency) {
			this.maxConcurrency = maxConcurrency;
			return this;
		}

		public EvaluationConfig build() {
			return new EvaluationConfig(callTimeout, failurePolicy, exhaustionPolicy, exhaustedTurnWeight,
					validateElements, includeRescuedTurns, maxConcurrency);
		}
	}
}

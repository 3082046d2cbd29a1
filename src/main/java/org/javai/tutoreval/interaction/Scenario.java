package org.javai.tutoreval.interaction;

import java.util.ArrayList;
import java.util.List;

/**
 * A learning situation the tutor is evaluated on.
 *
 * @param openingMessage the learner's first message; {@code null} lets the simulated learner open
 * @param multiTurn whether the learner keeps replying after the tutor's first message
 * @param turnBudget default number of tutor turns for multi-turn runs
 */
public record Scenario(
		String id,
		String name,
		String description,
		String learnerContext,
		String expectedBehavior,
		List<String> requiredElements,
		List<String> forbiddenElements,
		String openingMessage,
		boolean multiTurn,
		int turnBudget) {

	public static final int DEFAULT_TURN_BUDGET = 3;

	public Scenario {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("id must not be blank");
		}
		if (turnBudget < 1) {
			throw new IllegalArgumentException("turnBudget must be at least 1");
		}
		name = name != null ? name : id;
		description = description != null ? description : "";
		learnerContext = learnerContext != null ? learnerContext : "";
		expectedBehavior = expectedBehavior != null ? expectedBehavior : "";
		requiredElements = requiredElements != null ? List.copyOf(requiredElements) : List.of();
		forbiddenElements = forbiddenElements != null ? List.copyOf(forbiddenElements) : List.of();
	}

	public boolean hasOpeningMessage() {
		return openingMessage != null && !openingMessage.isBlank();
	}

	public static Builder builder(String id) {
		return new Builder(id);
	}

	public static class Builder {
		private final String id;
		private String name;
		private String description;
		private String learnerContext;
		private String expectedBehavior;
		private final List<String> requiredElements = new ArrayList<>();
		private final List<String> forbiddenElements = new ArrayList<>();
		private String openingMessage;
		private boolean multiTurn;
		private int turnBudget = DEFAULT_TURN_BUDGET;

		private Builder(String id) {
			this.id = id;
		}

		public Builder name(String name) {
			this.name = name;
			return this;
		}

		public Builder description(String description) {
			this.description = description;
			return this;
		}

		public Builder learnerContext(String learnerContext) {
			this.learnerContext = learnerContext;
			return this;
		}

		public Builder expectedBehavior(String expectedBehavior) {
			this.expectedBehavior = expectedBehavior;
			return this;
		}

		public Builder requiredElements(String... elements) {
			requiredElements.addAll(List.of(elements));
			return this;
		}

		public Builder forbiddenElements(String... elements) {
			forbiddenElements.addAll(List.of(elements));
			return this;
		}

		public Builder openingMessage(String openingMessage) {
			this.openingMessage = openingMessage;
			return this;
		}

		public Builder multiTurn(int turnBudget) {
			this.multiTurn = true;
			this.turnBudget = turnBudget;
			return this;
		}

		public Scenario build() {
			return new Scenario(id, name, description, learnerContext, expectedBehavior, requiredElements,
					forbiddenElements, openingMessage, multiTurn, turnBudget);
		}
	}
}

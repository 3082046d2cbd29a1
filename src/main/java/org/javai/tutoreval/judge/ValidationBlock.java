package org.javai.tutoreval.judge;

import java.util.List;

/**
 * Outcome of the required/forbidden element checks, either reported by the judge or computed by
 * {@link RequiredElementValidator}.
 */
public record ValidationBlock(
		boolean passesRequired,
		List<String> requiredMissing,
		boolean passesForbidden,
		List<String> forbiddenFound) {

	public static final ValidationBlock PASSING = new ValidationBlock(true, List.of(), true, List.of());

	public ValidationBlock {
		requiredMissing = requiredMissing != null ? List.copyOf(requiredMissing) : List.of();
		forbiddenFound = forbiddenFound != null ? List.copyOf(forbiddenFound) : List.of();
	}

	public boolean passes() {
		return passesRequired && passesForbidden;
	}
}

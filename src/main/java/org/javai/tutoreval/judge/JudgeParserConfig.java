package org.javai.tutoreval.judge;

import java.util.List;

/**
 * Settings for {@link JudgeResponseParser}.
 *
 * @param dimensions rubric dimensions the rescue strategy looks for
 * @param rescueThreshold minimum number of dimensions a rescue must recover
 */
public record JudgeParserConfig(List<String> dimensions, int rescueThreshold) {

	public static final int DEFAULT_RESCUE_THRESHOLD = 3;

	public static final List<String> DEFAULT_DIMENSIONS = List.of(
			"relevance",
			"specificity",
			"pedagogical",
			"personalization",
			"actionability",
			"tone",
			"mutual_recognition",
			"dialectical_responsiveness",
			"memory_integration",
			"transformative_potential");

	public JudgeParserConfig {
		if (dimensions == null || dimensions.isEmpty()) {
			throw new IllegalArgumentException("dimensions must not be empty");
		}
		if (rescueThreshold < 1) {
			throw new IllegalArgumentException("rescueThreshold must be at least 1");
		}
		dimensions = List.copyOf(dimensions);
	}

	public static JudgeParserConfig defaults() {
		return new JudgeParserConfig(DEFAULT_DIMENSIONS, DEFAULT_RESCUE_THRESHOLD);
	}

	public JudgeParserConfig withRescueThreshold(int threshold) {
		return new JudgeParserConfig(dimensions, threshold);
	}
}

package org.javai.tutoreval.judge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed judge verdict: per-dimension ratings plus the judge's optional validation block, overall score
 * and summary. Dimension order follows the judge's output.
 */
public record JudgeRatingSet(
		Map<String, DimensionRating> scores,
		ValidationBlock validation,
		Double overallScore,
		String summary) {

	public JudgeRatingSet {
		if (scores == null || scores.isEmpty()) {
			throw new IllegalArgumentException("a rating set needs at least one dimension score");
		}
		scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
		summary = summary != null ? summary : "";
	}

	public static JudgeRatingSet of(Map<String, DimensionRating> scores) {
		return new JudgeRatingSet(scores, null, null, null);
	}

	public Optional<DimensionRating> rating(String dimension) {
		return Optional.ofNullable(scores.get(dimension));
	}

	public Optional<ValidationBlock> validationBlock() {
		return Optional.ofNullable(validation);
	}

	public int dimensionCount() {
		return scores.size();
	}
}

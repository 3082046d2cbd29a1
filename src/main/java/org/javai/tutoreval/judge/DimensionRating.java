package org.javai.tutoreval.judge;

/**
 * A judge's score for one rubric dimension.
 *
 * @param score integral score on the 1-5 scale
 * @param rationale judge's reasoning, empty when none was given
 * @param quote supporting quote from the tutor message, {@code null} when none was given
 */
public record DimensionRating(int score, String rationale, String quote) {

	public static final int MIN_SCORE = 1;
	public static final int MAX_SCORE = 5;

	public DimensionRating {
		if (score < MIN_SCORE || score > MAX_SCORE) {
			throw new IllegalArgumentException("score must be between 1 and 5, was " + score);
		}
		rationale = rationale != null ? rationale : "";
	}

	public static DimensionRating of(int score) {
		return new DimensionRating(score, "", null);
	}
}

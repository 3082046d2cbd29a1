package org.javai.tutoreval.judge;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of interpreting one judge response.
 *
 * <p>{@link FullParse} carries the cascade strategy that succeeded (1-5). {@link PartialRescue} marks
 * ratings recovered by pattern matching and is kept distinguishable downstream. {@link Unparseable}
 * carries no ratings at all, so no score can be derived from it.</p>
 */
public sealed interface JudgeOutcome {

	record FullParse(JudgeRatingSet ratings, int strategy) implements JudgeOutcome {
		public FullParse {
			Objects.requireNonNull(ratings, "ratings must not be null");
		}
	}

	record PartialRescue(JudgeRatingSet ratings) implements JudgeOutcome {
		public PartialRescue {
			Objects.requireNonNull(ratings, "ratings must not be null");
		}
	}

	record Unparseable(UnparseableJudgeOutputException error) implements JudgeOutcome {
		public Unparseable {
			Objects.requireNonNull(error, "error must not be null");
		}
	}

	default Optional<JudgeRatingSet> ratingSet() {
		if (this instanceof FullParse full) {
			return Optional.of(full.ratings());
		}
		if (this instanceof PartialRescue rescue) {
			return Optional.of(rescue.ratings());
		}
		return Optional.empty();
	}

	default boolean isRescued() {
		return this instanceof PartialRescue;
	}

	default boolean isParsed() {
		return !(this instanceof Unparseable);
	}
}

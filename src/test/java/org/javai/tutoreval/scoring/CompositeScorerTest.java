package org.javai.tutoreval.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.tutoreval.judge.DimensionRating;
import org.javai.tutoreval.judge.JudgeRatingSet;
import org.javai.tutoreval.judge.RubricDimension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CompositeScorerTest {

	private static final Rubric RUBRIC = new Rubric(List.of(
			RubricDimension.of("relevance", "base", 0.3),
			RubricDimension.of("tone", "base", 0.1),
			RubricDimension.of("mutual_recognition", "recognition", 0.2)), Map.of());

	private final CompositeScorer scorer = new CompositeScorer(RUBRIC);

	@Nested
	@DisplayName("Scale")
	class Scale {

		@Test
		@DisplayName("all fives score 100 and all ones score 0")
		void bounds() {
			assertThat(scorer.score(ratings(5, 5, 5)).overall()).isEqualTo(100.0);
			assertThat(scorer.score(ratings(1, 1, 1)).overall()).isEqualTo(0.0);
		}

		@Test
		@DisplayName("the composite is the weighted distance above the floor")
		void weighted() {
			// base: (0.3*3 + 0.1*1) / (0.4*4) = 62.5
			CompositeScoreBundle bundle = scorer.score(ratings(4, 2, 1));

			assertThat(bundle.group("base")).isCloseTo(62.5, within(1e-9));
			assertThat(bundle.group("recognition")).isEqualTo(0.0);
			// overall: (0.9 + 0.1 + 0) / (0.6*4) = 41.67
			assertThat(bundle.overall()).isCloseTo(100.0 / 2.4, within(1e-9));
		}
	}

	@Nested
	@DisplayName("Missing dimensions")
	class Missing {

		@Test
		@DisplayName("weights are renormalized over what was rated")
		void renormalized() {
			JudgeRatingSet partial = JudgeRatingSet.of(Map.of("relevance", DimensionRating.of(5)));

			CompositeScoreBundle bundle = scorer.score(partial);

			assertThat(bundle.group("base")).isEqualTo(100.0);
			assertThat(bundle.overall()).isEqualTo(100.0);
		}

		@Test
		@DisplayName("a group with nothing rated scores 0")
		void emptyGroup() {
			JudgeRatingSet baseOnly = JudgeRatingSet.of(Map.of("tone", DimensionRating.of(3)));

			assertThat(scorer.score(baseOnly).group("recognition")).isEqualTo(0.0);
		}

		@Test
		@DisplayName("dimensions outside the rubric are ignored")
		void unknownDimension() {
			Map<String, DimensionRating> scores = new LinkedHashMap<>();
			scores.put("relevance", DimensionRating.of(3));
			scores.put("humour", DimensionRating.of(1));

			assertThat(scorer.score(JudgeRatingSet.of(scores)).overall()).isEqualTo(50.0);
		}
	}

	@Test
	@DisplayName("group weights combine only groups with a rated dimension")
	void groupWeights() {
		CompositeScorer weighted = new CompositeScorer(new Rubric(RUBRIC.dimensions(),
				Map.of("base", 0.75, "recognition", 0.25)));

		assertThat(weighted.score(ratings(5, 5, 1)).overall()).isEqualTo(75.0);
		assertThat(weighted.score(JudgeRatingSet.of(Map.of("tone", DimensionRating.of(3)))).overall())
				.isEqualTo(50.0);
	}

	@Test
	@DisplayName("the default rubric scores uniform fours at 75")
	void defaultRubric() {
		CompositeScorer defaults = new CompositeScorer(new RubricLoader().loadDefault());
		Map<String, DimensionRating> scores = new LinkedHashMap<>();
		defaults.rubric().dimensionKeys().forEach(key -> scores.put(key, DimensionRating.of(4)));

		CompositeScoreBundle bundle = defaults.score(JudgeRatingSet.of(scores));

		assertThat(bundle.overall()).isCloseTo(75.0, within(1e-9));
		assertThat(bundle.groups()).containsOnlyKeys("base", "recognition");
	}

	private static JudgeRatingSet ratings(int relevance, int tone, int recognition) {
		Map<String, DimensionRating> scores = new LinkedHashMap<>();
		scores.put("relevance", DimensionRating.of(relevance));
		scores.put("tone", DimensionRating.of(tone));
		scores.put("mutual_recognition", DimensionRating.of(recognition));
		return JudgeRatingSet.of(scores);
	}
}

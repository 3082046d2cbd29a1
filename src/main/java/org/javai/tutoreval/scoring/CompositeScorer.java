package org.javai.tutoreval.scoring;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.tutoreval.judge.DimensionRating;
import org.javai.tutoreval.judge.JudgeRatingSet;
import org.javai.tutoreval.judge.RubricDimension;

/**
 * Folds 1-5 dimension ratings into 0-100 composites.
 *
 * <p>Each composite is {@code 100 * sum(w * (s - 1)) / sum(4 * w)} over the dimensions that are both in
 * scope and rated, so weights are renormalized over what the judge actually scored. A scope with no rated
 * dimension scores 0.</p>
 */
public class CompositeScorer {

	private final Rubric rubric;

	public CompositeScorer(Rubric rubric) {
		this.rubric = Objects.requireNonNull(rubric, "rubric must not be null");
	}

	public Rubric rubric() {
		return rubric;
	}

	public CompositeScoreBundle score(JudgeRatingSet ratings) {
		Objects.requireNonNull(ratings, "ratings must not be null");
		Map<String, Double> groups = new LinkedHashMap<>();
		for (String group : rubric.groups()) {
			groups.put(group, composite(rubric.dimensionsIn(group), ratings));
		}
		double overall = rubric.hasGroupWeights()
				? overGroups(groups, ratings)
				: composite(rubric.dimensions(), ratings);
		return new CompositeScoreBundle(groups, overall);
	}

	private double overGroups(Map<String, Double> groups, JudgeRatingSet ratings) {
		double weighted = 0;
		double totalWeight = 0;
		for (Map.Entry<String, Double> entry : rubric.groupWeights().entrySet()) {
			boolean present = rubric.dimensionsIn(entry.getKey()).stream()
					.anyMatch(d -> ratings.scores().containsKey(d.key()));
			if (present) {
				weighted += entry.getValue() * groups.getOrDefault(entry.getKey(), 0.0);
				totalWeight += entry.getValue();
			}
		}
		return totalWeight > 0 ? weighted / totalWeight : 0.0;
	}

	static double composite(List<RubricDimension> scope, JudgeRatingSet ratings) {
		double numerator = 0;
		double denominator = 0;
		for (RubricDimension dimension : scope) {
			DimensionRating rating = ratings.scores().get(dimension.key());
			if (rating == null) {
				continue;
			}
			numerator += dimension.weight() * (rating.score() - DimensionRating.MIN_SCORE);
			denominator += dimension.weight() * (DimensionRating.MAX_SCORE - DimensionRating.MIN_SCORE);
		}
		return denominator > 0 ? 100.0 * numerator / denominator : 0.0;
	}
}

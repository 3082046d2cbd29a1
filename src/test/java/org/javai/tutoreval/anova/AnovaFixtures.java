package org.javai.tutoreval.anova;

import java.util.function.ToDoubleFunction;

final class AnovaFixtures {

	static final double[] NOISE = {-2, -1, 0, 1, 2};

	private AnovaFixtures() {
	}

	/**
	 * Five scores per cell: the cell's expected value plus {@link #NOISE}.
	 *
	 * @param expected cell expected value from its recognition, tutor and learner levels
	 */
	static FactorialScoreTable balanced(ToDoubleFunction<int[]> expected) {
		FactorialScoreTable.Builder builder = FactorialScoreTable.builder();
		for (int r = 0; r <= 1; r++) {
			for (int t = 0; t <= 1; t++) {
				for (int l = 0; l <= 1; l++) {
					double mean = expected.applyAsDouble(new int[] {r, t, l});
					for (double noise : NOISE) {
						builder.add(r, t, l, mean + noise);
					}
				}
			}
		}
		return builder.build();
	}
}

package org.javai.tutoreval.anova;

/**
 * Means of one factor at its two levels, pooled over the other factors.
 */
public record MarginalMeans(Factor factor, double low, double high) {

	public double level(int level) {
		return level == 0 ? low : high;
	}

	/**
	 * {@code high - low}.
	 */
	public double difference() {
		return high - low;
	}
}

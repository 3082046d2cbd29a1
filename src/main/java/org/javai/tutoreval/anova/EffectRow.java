package org.javai.tutoreval.anova;

/**
 * One source-of-variation row of the ANOVA table.
 *
 * @param f {@code MS / MS_error}; {@code +Infinity} when only the error term is zero
 * @param p upper-tail probability of {@code f}
 * @param partialEtaSquared {@code SS / (SS + SS_error)}, 0 when both are zero
 */
public record EffectRow(Effect effect, double ss, int df, double ms, double f, double p, double partialEtaSquared) {

	public boolean isSignificant(double alpha) {
		return p < alpha;
	}
}

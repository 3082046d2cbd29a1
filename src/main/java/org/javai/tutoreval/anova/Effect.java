package org.javai.tutoreval.anova;

import java.util.EnumSet;
import java.util.Set;

/**
 * Sources of variation in the 2x2x2 design, in table order.
 */
public enum Effect {
	RECOGNITION("Recognition (A)", EnumSet.of(Factor.RECOGNITION)),
	TUTOR("Tutor Architecture (B)", EnumSet.of(Factor.TUTOR)),
	LEARNER("Learner Arch. (C)", EnumSet.of(Factor.LEARNER)),
	RECOGNITION_X_TUTOR("A x B", EnumSet.of(Factor.RECOGNITION, Factor.TUTOR)),
	RECOGNITION_X_LEARNER("A x C", EnumSet.of(Factor.RECOGNITION, Factor.LEARNER)),
	TUTOR_X_LEARNER("B x C", EnumSet.of(Factor.TUTOR, Factor.LEARNER)),
	THREE_WAY("A x B x C", EnumSet.allOf(Factor.class));

	private final String label;
	private final Set<Factor> factors;

	Effect(String label, Set<Factor> factors) {
		this.label = label;
		this.factors = factors;
	}

	public String label() {
		return label;
	}

	public Set<Factor> factors() {
		return EnumSet.copyOf(factors);
	}

	public boolean isMainEffect() {
		return factors.size() == 1;
	}
}

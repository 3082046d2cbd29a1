package org.javai.tutoreval.anova;

/**
 * The three two-level factors of the design, with the labels of their levels.
 */
public enum Factor {
	RECOGNITION("Recognition", "Standard", "Recognition"),
	TUTOR("Tutor", "Single", "Multi-Agent"),
	LEARNER("Learner", "Unified", "Ego/Superego");

	private final String label;
	private final String lowLevel;
	private final String highLevel;

	Factor(String label, String lowLevel, String highLevel) {
		this.label = label;
		this.lowLevel = lowLevel;
		this.highLevel = highLevel;
	}

	public String label() {
		return label;
	}

	public String levelLabel(int level) {
		return level == 0 ? lowLevel : highLevel;
	}

	/**
	 * Level (0 or 1) of this factor in a cell key {@code r?_t?_l?}.
	 */
	int levelIn(String cellKey) {
		return cellKey.charAt(1 + 3 * ordinal()) - '0';
	}
}

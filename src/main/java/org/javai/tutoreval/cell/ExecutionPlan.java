package org.javai.tutoreval.cell;

/**
 * Concrete execution parameters resolved from an experiment cell. Derived once per cell and never mutated.
 *
 * <p>A plan for a cell without a multi-agent tutor carries a {@code null} critique binding, which
 * downstream code reads as "no critique loop".</p>
 *
 * @param cellName identifier the plan was resolved from
 * @param factors factor levels, or {@code null} for the unrecognized-identifier default plan
 * @param tutorModel model that drafts tutor messages
 * @param critiqueModel model that reviews drafts, {@code null} when the tutor is single-agent
 * @param promptVariant prompt variant handed to the tutor (e.g. "standard", "recognition")
 * @param dialogueEnabled whether the internal draft/critique loop runs
 * @param maxRounds deliberation round budget, 0 when dialogue is disabled
 * @param learnerArchitecture learner architecture identifier ("unified" or "ego_superego")
 */
public record ExecutionPlan(
		String cellName,
		CellFactors factors,
		ModelBinding tutorModel,
		ModelBinding critiqueModel,
		String promptVariant,
		boolean dialogueEnabled,
		int maxRounds,
		String learnerArchitecture
) {

	public static final String UNIFIED_LEARNER = "unified";
	public static final String EGO_SUPEREGO_LEARNER = "ego_superego";
	public static final String STANDARD_PROMPT = "standard";
	public static final String RECOGNITION_PROMPT = "recognition";

	public ExecutionPlan {
		if (tutorModel == null) {
			throw new IllegalArgumentException("tutorModel must not be null");
		}
		if (maxRounds < 0) {
			throw new IllegalArgumentException("maxRounds must be >= 0");
		}
		if (dialogueEnabled && (critiqueModel == null || maxRounds == 0)) {
			throw new IllegalArgumentException("dialogue requires a critique model and a positive round budget");
		}
	}

	/**
	 * The explicit fallback for identifiers the registry does not know: single agent, no dialogue, zero rounds.
	 */
	public static ExecutionPlan fallback(String cellName, ModelBinding tutorModel) {
		return new ExecutionPlan(cellName, null, tutorModel, null, STANDARD_PROMPT, false, 0, UNIFIED_LEARNER);
	}

	public boolean hasCritique() {
		return critiqueModel != null;
	}

	/**
	 * @return the cell key, or {@code null} for a fallback plan without factors
	 */
	public String cellKey() {
		return factors != null ? factors.cellKey() : null;
	}
}

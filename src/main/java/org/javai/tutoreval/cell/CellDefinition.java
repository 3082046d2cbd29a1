package org.javai.tutoreval.cell;

import java.util.Objects;

/**
 * A named experiment cell as authored in the cell registry.
 *
 * @param name registry name, e.g. {@code cell_5_recog_single_unified}
 * @param factors factor levels of the cell
 * @param promptVariant optional prompt variant; derived from the recognition factor when {@code null}
 * @param tutorModel optional tutor binding; the configured default is used when {@code null}
 * @param critiqueModel optional critique binding; only consulted when the tutor is multi-agent
 * @param maxRounds optional round budget; only consulted when the tutor is multi-agent
 */
public record CellDefinition(
		String name,
		CellFactors factors,
		String promptVariant,
		ModelBinding tutorModel,
		ModelBinding critiqueModel,
		Integer maxRounds
) {

	public CellDefinition {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(factors, "factors must not be null");
		if (maxRounds != null && maxRounds < 0) {
			throw new IllegalArgumentException("maxRounds must be >= 0 for cell " + name);
		}
	}

	public static CellDefinition of(String name, CellFactors factors) {
		return new CellDefinition(name, factors, null, null, null, null);
	}
}

package org.javai.tutoreval.anova;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Full three-way ANOVA table.
 */
public record AnovaResult(
		int n,
		double grandMean,
		double ssTotal,
		int dfTotal,
		List<EffectRow> effects,
		ErrorRow error,
		Map<Factor, MarginalMeans> marginalMeans,
		Map<String, Double> cellMeans) {

	public AnovaResult {
		effects = List.copyOf(effects);
		Map<Factor, MarginalMeans> means = new EnumMap<>(Factor.class);
		means.putAll(marginalMeans);
		marginalMeans = Collections.unmodifiableMap(means);
		cellMeans = Map.copyOf(cellMeans);
	}

	public EffectRow effect(Effect effect) {
		return effects.stream()
				.filter(row -> row.effect() == effect)
				.findFirst()
				.orElseThrow(() -> new IllegalArgumentException("No row for " + effect));
	}

	public MarginalMeans marginalMeans(Factor factor) {
		return marginalMeans.get(factor);
	}
}

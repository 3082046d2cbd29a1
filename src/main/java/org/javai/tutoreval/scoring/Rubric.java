package org.javai.tutoreval.scoring;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.tutoreval.judge.RubricDimension;

/**
 * Weighted rubric: the scored dimensions, each in exactly one group, plus optional weights for combining
 * group composites into the overall score.
 *
 * @param dimensions dimensions in display order
 * @param groupWeights group name to weight; empty means the overall score is taken over all dimensions
 */
public record Rubric(List<RubricDimension> dimensions, Map<String, Double> groupWeights) {

	public Rubric {
		if (dimensions == null || dimensions.isEmpty()) {
			throw new RubricConfigException("A rubric needs at least one dimension");
		}
		Set<String> keys = new HashSet<>();
		for (RubricDimension dimension : dimensions) {
			if (!keys.add(dimension.key())) {
				throw new RubricConfigException("Duplicate rubric dimension: " + dimension.key());
			}
		}
		dimensions = List.copyOf(dimensions);
		groupWeights = groupWeights != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(groupWeights))
				: Map.of();
		for (Map.Entry<String, Double> entry : groupWeights.entrySet()) {
			if (entry.getValue() == null || !Double.isFinite(entry.getValue()) || entry.getValue() < 0) {
				throw new RubricConfigException("Weight of group '" + entry.getKey() + "' must be a non-negative number");
			}
		}
	}

	/**
	 * Group names in first-appearance order.
	 */
	public Set<String> groups() {
		Set<String> groups = new LinkedHashSet<>();
		dimensions.forEach(d -> groups.add(d.group()));
		return groups;
	}

	public List<RubricDimension> dimensionsIn(String group) {
		return dimensions.stream().filter(d -> d.group().equals(group)).toList();
	}

	public List<String> dimensionKeys() {
		return dimensions.stream().map(RubricDimension::key).toList();
	}

	public boolean hasGroupWeights() {
		return !groupWeights.isEmpty();
	}
}

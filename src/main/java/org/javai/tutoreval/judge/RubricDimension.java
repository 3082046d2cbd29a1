package org.javai.tutoreval.judge;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One scored rubric dimension.
 *
 * @param key identifier used in judge output, e.g. {@code mutual_recognition}
 * @param name display name shown to the judge
 * @param description what the dimension measures
 * @param group scoring group, e.g. {@code base} or {@code recognition}
 * @param weight relative weight within the group, non-negative
 * @param criteria score level to description, shown to the judge
 */
public record RubricDimension(
		String key,
		String name,
		String description,
		String group,
		double weight,
		Map<Integer, String> criteria) {

	public RubricDimension {
		if (key == null || key.isBlank()) {
			throw new IllegalArgumentException("key must not be blank");
		}
		if (group == null || group.isBlank()) {
			throw new IllegalArgumentException("group must not be blank for dimension " + key);
		}
		if (!Double.isFinite(weight) || weight < 0) {
			throw new IllegalArgumentException("weight of " + key + " must be a non-negative number");
		}
		name = name != null ? name : key;
		description = description != null ? description : "";
		criteria = criteria != null ? Collections.unmodifiableMap(new TreeMap<>(criteria)) : Map.of();
	}

	public static RubricDimension of(String key, String group, double weight) {
		return new RubricDimension(key, key, "", group, weight, Map.of());
	}
}

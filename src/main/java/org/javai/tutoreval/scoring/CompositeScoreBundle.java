package org.javai.tutoreval.scoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Composite scores on the 0-100 scale: one per rubric group plus the overall score.
 */
public record CompositeScoreBundle(Map<String, Double> groups, double overall) {

	public CompositeScoreBundle {
		groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
	}

	/**
	 * Composite of the named group, 0 when the group is unknown.
	 */
	public double group(String name) {
		return groups.getOrDefault(name, 0.0);
	}
}

package org.javai.tutoreval.anova;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable snapshot of scores grouped by cell key ({@code r0_t1_l0} and so on). Keys and scores are
 * stored as given; {@link ThreeWayAnova} decides whether they are usable.
 */
public final class FactorialScoreTable {

	private final Map<String, List<Double>> cells;

	private FactorialScoreTable(Map<String, List<Double>> cells) {
		Map<String, List<Double>> copy = new TreeMap<>();
		cells.forEach((key, scores) -> copy.put(key, scores != null
				? Collections.unmodifiableList(new ArrayList<>(scores))
				: null));
		this.cells = Collections.unmodifiableMap(copy);
	}

	public static FactorialScoreTable of(Map<String, ? extends List<Double>> cells) {
		return new FactorialScoreTable(new TreeMap<>(cells));
	}

	public static Builder builder() {
		return new Builder();
	}

	public static String cellKey(int recognition, int tutor, int learner) {
		return "r" + recognition + "_t" + tutor + "_l" + learner;
	}

	public Set<String> cellKeys() {
		return cells.keySet();
	}

	/**
	 * Scores of one cell, empty when the cell is absent.
	 */
	public List<Double> scores(String cellKey) {
		List<Double> scores = cells.get(cellKey);
		return scores != null ? scores : List.of();
	}

	public boolean contains(String cellKey) {
		return cells.containsKey(cellKey);
	}

	public int size() {
		return cells.values().stream().mapToInt(s -> s != null ? s.size() : 0).sum();
	}

	Map<String, List<Double>> asMap() {
		return cells;
	}

	public static class Builder {
		private final Map<String, List<Double>> cells = new TreeMap<>();

		private Builder() {}

		public Builder add(String cellKey, double score) {
			cells.computeIfAbsent(cellKey, k -> new ArrayList<>()).add(score);
			return this;
		}

		public Builder add(int recognition, int tutor, int learner, double score) {
			return add(cellKey(recognition, tutor, learner), score);
		}

		public Builder addAll(String cellKey, List<Double> scores) {
			cells.computeIfAbsent(cellKey, k -> new ArrayList<>()).addAll(scores);
			return this;
		}

		public FactorialScoreTable build() {
			return new FactorialScoreTable(cells);
		}
	}
}

package org.javai.tutoreval.anova;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Fixed-effects three-way ANOVA for the 2x2x2 factorial design.
 *
 * <p>Main effects come from marginal means, two-way interactions from the deviation of two-factor cell
 * means from their additive expectation, and the three-way interaction from what remains of the
 * between-cells sum of squares (floored at zero). Every effect has one degree of freedom; the error term
 * pools within-cell variation over {@code N - 8} degrees of freedom. Unbalanced cells are allowed.</p>
 */
public class ThreeWayAnova {

	private static final Pattern CELL_KEY = Pattern.compile("^r[01]_t[01]_l[01]$");
	private static final int CELLS = 8;

	/**
	 * @throws AnovaInputException when the table cannot be analysed
	 */
	public AnovaResult compute(FactorialScoreTable table) {
		validate(table);

		Map<String, CellStats> cells = new LinkedHashMap<>();
		for (String key : allCellKeys()) {
			cells.put(key, CellStats.of(table.scores(key)));
		}
		int n = cells.values().stream().mapToInt(CellStats::n).sum();
		double sum = cells.values().stream().mapToDouble(CellStats::sum).sum();
		boolean constant = isConstant(table);
		double grandMean = constant ? cells.values().iterator().next().first() : sum / n;

		Map<Factor, MarginalMeans> marginals = new EnumMap<>(Factor.class);
		for (Factor factor : Factor.values()) {
			marginals.put(factor, new MarginalMeans(factor,
					pooledMean(cells, Map.of(factor, 0), grandMean, constant),
					pooledMean(cells, Map.of(factor, 1), grandMean, constant)));
		}
		Map<String, Double> cellMeans = new LinkedHashMap<>();
		cells.forEach((key, stats) -> cellMeans.put(key, constant ? grandMean : stats.mean()));

		int dfError = n - CELLS;
		Map<Effect, Double> ss = new EnumMap<>(Effect.class);
		double ssError = 0;
		double ssTotal = 0;
		if (constant) {
			for (Effect effect : Effect.values()) {
				ss.put(effect, 0.0);
			}
		} else {
			for (Effect effect : Effect.values()) {
				if (effect.isMainEffect()) {
					ss.put(effect, mainEffectSs(cells, effect.factors().iterator().next(), marginals, grandMean));
				} else if (effect != Effect.THREE_WAY) {
					ss.put(effect, twoWaySs(cells, effect, marginals, grandMean));
				}
			}
			double ssCells = 0;
			for (CellStats stats : cells.values()) {
				ssCells += stats.n() * square(stats.mean() - grandMean);
				ssError += stats.withinSs();
			}
			double explained = ss.values().stream().mapToDouble(Double::doubleValue).sum();
			ss.put(Effect.THREE_WAY, Math.max(0.0, ssCells - explained));
			for (List<Double> scores : table.asMap().values()) {
				for (double score : scores) {
					ssTotal += square(score - grandMean);
				}
			}
		}

		double msError = ssError / dfError;
		List<EffectRow> rows = new ArrayList<>();
		for (Effect effect : Effect.values()) {
			double effectSs = ss.get(effect);
			double ms = effectSs;
			double f = fRatio(ms, msError);
			rows.add(new EffectRow(effect, effectSs, 1, ms, f, FDistribution.upperTail(f, 1, dfError),
					partialEtaSquared(effectSs, ssError)));
		}
		return new AnovaResult(n, grandMean, ssTotal, n - 1, rows, new ErrorRow(ssError, dfError, msError),
				marginals, cellMeans);
	}

	/**
	 * Like {@link #compute} but reports unusable input as {@link AnovaOutcome.Failed}.
	 */
	public AnovaOutcome tryCompute(FactorialScoreTable table) {
		try {
			return new AnovaOutcome.Computed(compute(table));
		} catch (AnovaInputException e) {
			return new AnovaOutcome.Failed(e.getMessage());
		}
	}

	static List<String> allCellKeys() {
		List<String> keys = new ArrayList<>(CELLS);
		for (int r = 0; r <= 1; r++) {
			for (int t = 0; t <= 1; t++) {
				for (int l = 0; l <= 1; l++) {
					keys.add(FactorialScoreTable.cellKey(r, t, l));
				}
			}
		}
		return keys;
	}

	private static void validate(FactorialScoreTable table) {
		if (table == null || table.cellKeys().isEmpty()) {
			throw new AnovaInputException("No data available for ANOVA");
		}
		for (String key : table.cellKeys()) {
			if (!CELL_KEY.matcher(key).matches()) {
				throw new AnovaInputException("Unknown cell key '" + key + "'");
			}
		}
		for (String key : allCellKeys()) {
			if (!table.contains(key)) {
				throw new AnovaInputException("Missing cell " + key);
			}
			List<Double> scores = table.asMap().get(key);
			if (scores == null || scores.isEmpty()) {
				throw new AnovaInputException("Empty cell " + key);
			}
			for (Double score : scores) {
				if (score == null || !Double.isFinite(score)) {
					throw new AnovaInputException("Non-finite score " + score + " in cell " + key);
				}
			}
		}
		int n = table.size();
		if (n - CELLS < 1) {
			throw new AnovaInputException("Need at least " + (CELLS + 1) + " scores for an error term, got " + n);
		}
	}

	private static boolean isConstant(FactorialScoreTable table) {
		Double first = null;
		for (List<Double> scores : table.asMap().values()) {
			for (Double score : scores) {
				if (first == null) {
					first = score;
				} else if (Double.compare(first, score) != 0) {
					return false;
				}
			}
		}
		return true;
	}

	private static double pooledMean(Map<String, CellStats> cells, Map<Factor, Integer> levels, double grandMean,
			boolean constant) {
		if (constant) {
			return grandMean;
		}
		double sum = 0;
		int n = 0;
		for (Map.Entry<String, CellStats> cell : cells.entrySet()) {
			if (matches(cell.getKey(), levels)) {
				sum += cell.getValue().sum();
				n += cell.getValue().n();
			}
		}
		return n > 0 ? sum / n : grandMean;
	}

	private static int pooledCount(Map<String, CellStats> cells, Map<Factor, Integer> levels) {
		int n = 0;
		for (Map.Entry<String, CellStats> cell : cells.entrySet()) {
			if (matches(cell.getKey(), levels)) {
				n += cell.getValue().n();
			}
		}
		return n;
	}

	private static boolean matches(String cellKey, Map<Factor, Integer> levels) {
		for (Map.Entry<Factor, Integer> level : levels.entrySet()) {
			if (level.getKey().levelIn(cellKey) != level.getValue()) {
				return false;
			}
		}
		return true;
	}

	private static double mainEffectSs(Map<String, CellStats> cells, Factor factor, Map<Factor, MarginalMeans> marginals,
			double grandMean) {
		double ss = 0;
		for (int level = 0; level <= 1; level++) {
			ss += pooledCount(cells, Map.of(factor, level)) * square(marginals.get(factor).level(level) - grandMean);
		}
		return ss;
	}

	private static double twoWaySs(Map<String, CellStats> cells, Effect effect, Map<Factor, MarginalMeans> marginals,
			double grandMean) {
		List<Factor> pair = new ArrayList<>(effect.factors());
		Factor first = pair.get(0);
		Factor second = pair.get(1);
		double ss = 0;
		for (int a = 0; a <= 1; a++) {
			for (int b = 0; b <= 1; b++) {
				Map<Factor, Integer> levels = Map.of(first, a, second, b);
				double observed = pooledMean(cells, levels, grandMean, false);
				double expected = marginals.get(first).level(a) + marginals.get(second).level(b) - grandMean;
				ss += pooledCount(cells, levels) * square(observed - expected);
			}
		}
		return ss;
	}

	private static double fRatio(double ms, double msError) {
		if (msError == 0) {
			return ms == 0 ? 0.0 : Double.POSITIVE_INFINITY;
		}
		return ms / msError;
	}

	private static double partialEtaSquared(double ss, double ssError) {
		double denominator = ss + ssError;
		return denominator > 0 ? ss / denominator : 0.0;
	}

	private static double square(double value) {
		return value * value;
	}

	private record CellStats(int n, double sum, double mean, double withinSs, double first) {

		static CellStats of(List<Double> scores) {
			double sum = 0;
			for (double score : scores) {
				sum += score;
			}
			double mean = sum / scores.size();
			double within = 0;
			for (double score : scores) {
				within += square(score - mean);
			}
			return new CellStats(scores.size(), sum, mean, within, scores.get(0));
		}
	}
}

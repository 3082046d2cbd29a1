package org.javai.tutoreval.anova;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders an {@link AnovaResult} as a fixed-width text report. Rows with {@code p < .05} are marked
 * {@code ***}, rows with {@code p < .10} are marked {@code *}.
 */
public class AnovaReportRenderer {

	public static final double SIGNIFICANT = 0.05;
	public static final double MARGINAL = 0.10;

	private static final int WIDTH = 70;
	private static final String HEAVY_RULE = "=".repeat(WIDTH);
	private static final String RULE = "-".repeat(WIDTH);
	private static final String TABLE_RULE = "  " + "-".repeat(WIDTH - 4);

	private final String scoreLabel;

	public AnovaReportRenderer() {
		this(null);
	}

	/**
	 * @param scoreLabel what the scores measure, e.g. "Overall Score"; used in the title
	 */
	public AnovaReportRenderer(String scoreLabel) {
		this.scoreLabel = scoreLabel;
	}

	/**
	 * Renders either outcome; never throws.
	 */
	public String render(AnovaOutcome outcome) {
		if (outcome instanceof AnovaOutcome.Computed computed) {
			return render(computed.result());
		}
		if (outcome instanceof AnovaOutcome.Failed failed) {
			return "ANOVA Error: " + failed.error();
		}
		return "ANOVA Error: no result";
	}

	public String render(AnovaResult result) {
		List<String> lines = new ArrayList<>();
		String title = scoreLabel != null && !scoreLabel.isBlank()
				? "THREE-WAY ANOVA: " + scoreLabel.toUpperCase(Locale.ROOT)
				: "THREE-WAY ANOVA: 2x2x2 FACTORIAL ANALYSIS";

		lines.add("");
		lines.add(HEAVY_RULE);
		lines.add("  " + title);
		lines.add(HEAVY_RULE);
		lines.add(format("  Grand Mean: %.2f  |  N = %d", result.grandMean(), result.n()));
		lines.add("");

		lines.add(RULE);
		lines.add("  MARGINAL MEANS");
		lines.add(RULE);
		for (Factor factor : Factor.values()) {
			MarginalMeans means = result.marginalMeans(factor);
			lines.add(format("  %-14s %s = %.2f,  %s = %.2f", factor.label() + ":",
					factor.levelLabel(0), means.low(), factor.levelLabel(1), means.high()));
		}
		lines.add("");

		lines.add(RULE);
		lines.add("  ANOVA TABLE");
		lines.add(RULE);
		lines.add("  Source                    SS       df       MS        F        p       eta2");
		lines.add(TABLE_RULE);
		for (EffectRow row : result.effects()) {
			lines.add(row(row));
			if (row.effect() == Effect.LEARNER || row.effect() == Effect.THREE_WAY) {
				lines.add(TABLE_RULE);
			}
		}
		ErrorRow error = result.error();
		lines.add(format("  %-22s  %8.2f  %6d  %8.2f", "Error", error.ss(), error.df(), error.ms()));
		lines.add("");
		lines.add("  Significance: *** p < .05, * p < .10");
		lines.add("");

		lines.add(RULE);
		lines.add("  INTERPRETATION");
		lines.add(RULE);
		lines.add(mainEffectLine("Recognition prompts", result.effect(Effect.RECOGNITION)));
		addEffectSize(lines, result, Effect.RECOGNITION, Factor.RECOGNITION);
		lines.add(mainEffectLine("Multi-agent tutor", result.effect(Effect.TUTOR)));
		addEffectSize(lines, result, Effect.TUTOR, Factor.TUTOR);
		lines.add(mainEffectLine("Multi-agent learner", result.effect(Effect.LEARNER)));
		addEffectSize(lines, result, Effect.LEARNER, Factor.LEARNER);
		lines.add("");
		for (EffectRow row : result.effects()) {
			if (!row.effect().isMainEffect() && row.isSignificant(SIGNIFICANT)) {
				lines.add(format("  * %s interaction: SIGNIFICANT (F = %.2f, p %s)",
						interactionLabel(row.effect()), row.f(), pForSentence(row.p())));
			}
		}
		lines.add("");
		lines.add(HEAVY_RULE);
		return String.join("\n", lines);
	}

	private String row(EffectRow row) {
		String p = row.p() < 0.001 ? "< .001" : format("%.3f", row.p());
		String marker = row.p() < SIGNIFICANT ? "***" : row.p() < MARGINAL ? "*" : "";
		return format("  %-22s  %8.2f  %6d  %8.2f  %8.3f  %8s  %6.3f  %s",
				row.effect().label(), row.ss(), row.df(), row.ms(), row.f(), p, row.partialEtaSquared(), marker)
				.stripTrailing();
	}

	private String mainEffectLine(String label, EffectRow row) {
		if (row.isSignificant(SIGNIFICANT)) {
			return format("  * %s: SIGNIFICANT (F = %.2f, p %s)", label, row.f(), pForSentence(row.p()));
		}
		return format("  - %s: not significant (F = %.2f, p %s)", label, row.f(), pForSentence(row.p()));
	}

	private void addEffectSize(List<String> lines, AnovaResult result, Effect effect, Factor factor) {
		EffectRow row = result.effect(effect);
		if (row.isSignificant(SIGNIFICANT)) {
			double difference = result.marginalMeans(factor).difference();
			lines.add(format("    Effect: %s%.2f points, eta2 = %.3f", difference >= 0 ? "+" : "", difference,
					row.partialEtaSquared()));
		}
	}

	private static String interactionLabel(Effect effect) {
		return switch (effect) {
			case RECOGNITION_X_TUTOR -> "Recognition x Tutor";
			case RECOGNITION_X_LEARNER -> "Recognition x Learner";
			case TUTOR_X_LEARNER -> "Tutor x Learner";
			case THREE_WAY -> "Three-way";
			default -> effect.label();
		};
	}

	private static String pForSentence(double p) {
		if (p < 0.001) {
			return "< .001";
		}
		String formatted = format("%.3f", p);
		return "= " + (formatted.startsWith("0") ? formatted.substring(1) : formatted);
	}

	private static String format(String pattern, Object... args) {
		return String.format(Locale.ROOT, pattern, args);
	}
}

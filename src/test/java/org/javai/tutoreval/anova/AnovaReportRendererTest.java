package org.javai.tutoreval.anova;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnovaReportRendererTest {

	private AnovaResult recognitionOnly;

	@BeforeEach
	void setUp() {
		recognitionOnly = new ThreeWayAnova().compute(AnovaFixtures.balanced(c -> 50 + 20 * c[0]));
	}

	@Test
	void headerCarriesGrandMeanAndSize() {
		List<String> lines = new AnovaReportRenderer().render(recognitionOnly).lines().toList();

		assertThat(lines).contains(
				"  THREE-WAY ANOVA: 2x2x2 FACTORIAL ANALYSIS",
				"  Grand Mean: 60.00  |  N = 40",
				"  Recognition:   Standard = 50.00,  Recognition = 70.00",
				"  Significance: *** p < .05, * p < .10");
	}

	@Test
	void scoreLabelBecomesTheTitle() {
		String report = new AnovaReportRenderer("Overall Score").render(recognitionOnly);

		assertThat(report).contains("  THREE-WAY ANOVA: OVERALL SCORE");
	}

	@Test
	void tableMarksSignificantRows() {
		List<String> lines = new AnovaReportRenderer().render(recognitionOnly).lines().toList();

		assertThat(lines).filteredOn(line -> line.startsWith("  Recognition (A)")).singleElement().asString()
				.contains("4000.00")
				.contains("< .001")
				.endsWith("***");
		assertThat(lines).filteredOn(line -> line.startsWith("  Tutor Architecture (B)")).singleElement().asString()
				.contains("1.000")
				.doesNotContain("*");
		assertThat(lines).anyMatch(line -> line.matches("  Error\\s+80\\.00\\s+32\\s+2\\.50"));
	}

	@Test
	void interpretationNamesSignificantAndNonSignificantEffects() {
		String report = new AnovaReportRenderer().render(recognitionOnly);

		assertThat(report)
				.contains("  * Recognition prompts: SIGNIFICANT (F = 1600.00, p < .001)")
				.contains("    Effect: +20.00 points, eta2 = 0.980")
				.contains("  - Multi-agent tutor: not significant (F = 0.00, p = 1.000)")
				.doesNotContain("interaction: SIGNIFICANT");
	}

	@Test
	void significantInteractionsAreCalledOut() {
		AnovaResult result = new ThreeWayAnova().compute(
				AnovaFixtures.balanced(c -> c[0] == 1 && c[1] == 1 ? 60 : 50));

		assertThat(new AnovaReportRenderer().render(result))
				.contains("  * Recognition x Tutor interaction: SIGNIFICANT (F = 100.00, p < .001)");
	}

	@Test
	void failedOutcomeRendersTheError() {
		AnovaOutcome failed = new ThreeWayAnova().tryCompute(FactorialScoreTable.builder().build());

		assertThat(new AnovaReportRenderer().render(failed)).isEqualTo("ANOVA Error: No data available for ANOVA");
	}
}

package org.javai.tutoreval.anova;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ThreeWayAnovaTest {

	private final ThreeWayAnova anova = new ThreeWayAnova();

	@Nested
	@DisplayName("Effects")
	class Effects {

		@Test
		@DisplayName("a pure recognition effect shows up only in its own row")
		void recognitionOnly() {
			AnovaResult result = anova.compute(AnovaFixtures.balanced(c -> 50 + 20 * c[0]));

			assertThat(result.n()).isEqualTo(40);
			assertThat(result.grandMean()).isEqualTo(60.0);
			assertThat(result.ssTotal()).isEqualTo(4080.0);
			assertThat(result.dfTotal()).isEqualTo(39);

			EffectRow recognition = result.effect(Effect.RECOGNITION);
			assertThat(recognition.ss()).isEqualTo(4000.0);
			assertThat(recognition.f()).isEqualTo(1600.0);
			assertThat(recognition.p()).isLessThan(0.001);
			assertThat(recognition.partialEtaSquared()).isCloseTo(4000.0 / 4080.0, within(1e-12));

			for (Effect effect : Effect.values()) {
				if (effect != Effect.RECOGNITION) {
					EffectRow row = result.effect(effect);
					assertThat(row.ss()).as(effect.label()).isZero();
					assertThat(row.f()).as(effect.label()).isZero();
					assertThat(row.p()).as(effect.label()).isEqualTo(1.0);
				}
			}
			assertThat(result.error().ss()).isEqualTo(80.0);
			assertThat(result.error().df()).isEqualTo(32);
			assertThat(result.error().ms()).isEqualTo(2.5);
			assertThat(result.marginalMeans(Factor.RECOGNITION).difference()).isEqualTo(20.0);
			assertThat(result.cellMeans()).containsEntry("r1_t0_l1", 70.0);
		}

		@Test
		@DisplayName("a boost confined to recognition with multi-agent tutor is an interaction")
		void recognitionByTutor() {
			AnovaResult result = anova.compute(AnovaFixtures.balanced(c -> c[0] == 1 && c[1] == 1 ? 60 : 50));

			assertThat(result.effect(Effect.RECOGNITION).ss()).isCloseTo(250.0, within(1e-9));
			assertThat(result.effect(Effect.TUTOR).ss()).isCloseTo(250.0, within(1e-9));
			assertThat(result.effect(Effect.RECOGNITION_X_TUTOR).ss()).isCloseTo(250.0, within(1e-9));
			assertThat(result.effect(Effect.RECOGNITION_X_TUTOR).isSignificant(0.05)).isTrue();
			assertThat(result.effect(Effect.LEARNER).ss()).isCloseTo(0.0, within(1e-9));
			assertThat(result.effect(Effect.THREE_WAY).ss()).isCloseTo(0.0, within(1e-9));
		}

		@Test
		@DisplayName("shifting every score leaves the sums of squares unchanged")
		void shiftInvariant() {
			AnovaResult base = anova.compute(AnovaFixtures.balanced(c -> 40 + 5 * c[1] + 3 * c[0] * c[2]));
			AnovaResult shifted = anova.compute(AnovaFixtures.balanced(c -> 140 + 5 * c[1] + 3 * c[0] * c[2]));

			assertThat(shifted.grandMean()).isCloseTo(base.grandMean() + 100, within(1e-9));
			for (Effect effect : Effect.values()) {
				assertThat(shifted.effect(effect).ss()).isCloseTo(base.effect(effect).ss(), within(1e-6));
			}
		}

		@Test
		@DisplayName("identical scores yield exactly zero everywhere")
		void constant() {
			FactorialScoreTable.Builder builder = FactorialScoreTable.builder();
			for (String key : ThreeWayAnova.allCellKeys()) {
				builder.addAll(key, List.of(70.0, 70.0, 70.0));
			}

			AnovaResult result = anova.compute(builder.build());

			assertThat(result.grandMean()).isEqualTo(70.0);
			assertThat(result.ssTotal()).isZero();
			assertThat(result.error().ss()).isZero();
			assertThat(result.effects()).allSatisfy(row -> {
				assertThat(row.ss()).isZero();
				assertThat(row.f()).isZero();
				assertThat(row.p()).isEqualTo(1.0);
				assertThat(row.partialEtaSquared()).isZero();
			});
		}

		@Test
		@DisplayName("a perfect fit without noise has an infinite F")
		void noNoise() {
			FactorialScoreTable.Builder builder = FactorialScoreTable.builder();
			for (String key : ThreeWayAnova.allCellKeys()) {
				builder.addAll(key, List.of(key.startsWith("r1") ? 80.0 : 60.0, key.startsWith("r1") ? 80.0 : 60.0));
			}

			EffectRow recognition = anova.compute(builder.build()).effect(Effect.RECOGNITION);

			assertThat(recognition.f()).isInfinite();
			assertThat(recognition.p()).isZero();
		}

		@Test
		@DisplayName("unbalanced cells are accepted")
		void unbalanced() {
			FactorialScoreTable.Builder builder = FactorialScoreTable.builder();
			for (String key : ThreeWayAnova.allCellKeys()) {
				builder.add(key, key.startsWith("r1") ? 70 : 50);
			}
			builder.add("r0_t0_l0", 52).add("r1_t1_l1", 69).add("r1_t1_l1", 72);

			AnovaResult result = anova.compute(builder.build());

			assertThat(result.n()).isEqualTo(11);
			assertThat(result.error().df()).isEqualTo(3);
			assertThat(result.effect(Effect.RECOGNITION).isSignificant(0.05)).isTrue();
		}
	}

	@Nested
	@DisplayName("Input errors")
	class InputErrors {

		@Test
		@DisplayName("an empty table has no data")
		void empty() {
			assertThatThrownBy(() -> anova.compute(FactorialScoreTable.builder().build()))
					.isInstanceOf(AnovaInputException.class)
					.hasMessage("No data available for ANOVA");
		}

		@Test
		@DisplayName("every one of the eight cells is required")
		void missingCell() {
			Map<String, List<Double>> cells = fullTable();
			cells.remove("r1_t0_l1");

			assertThatThrownBy(() -> anova.compute(FactorialScoreTable.of(cells)))
					.isInstanceOf(AnovaInputException.class)
					.hasMessage("Missing cell r1_t0_l1");
		}

		@Test
		@DisplayName("an empty cell is rejected")
		void emptyCell() {
			Map<String, List<Double>> cells = fullTable();
			cells.put("r0_t1_l0", List.of());

			assertThatThrownBy(() -> anova.compute(FactorialScoreTable.of(cells)))
					.hasMessage("Empty cell r0_t1_l0");
		}

		@Test
		@DisplayName("non-finite scores are rejected")
		void nonFinite() {
			Map<String, List<Double>> cells = fullTable();
			cells.put("r0_t0_l0", Arrays.asList(50.0, Double.NaN));

			assertThatThrownBy(() -> anova.compute(FactorialScoreTable.of(cells)))
					.hasMessageContaining("Non-finite score NaN in cell r0_t0_l0");
		}

		@Test
		@DisplayName("cell keys outside the design are rejected")
		void unknownKey() {
			Map<String, List<Double>> cells = fullTable();
			cells.put("r2_t0_l0", List.of(1.0));

			assertThatThrownBy(() -> anova.compute(FactorialScoreTable.of(cells)))
					.hasMessage("Unknown cell key 'r2_t0_l0'");
		}

		@Test
		@DisplayName("one score per cell leaves no error term")
		void noErrorTerm() {
			Map<String, List<Double>> cells = new HashMap<>();
			ThreeWayAnova.allCellKeys().forEach(key -> cells.put(key, List.of(50.0)));

			assertThatThrownBy(() -> anova.compute(FactorialScoreTable.of(cells)))
					.hasMessage("Need at least 9 scores for an error term, got 8");
		}

		@Test
		@DisplayName("tryCompute reports errors as a failed outcome")
		void tryCompute() {
			AnovaOutcome outcome = anova.tryCompute(null);

			assertThat(outcome).isEqualTo(new AnovaOutcome.Failed("No data available for ANOVA"));
		}

		private Map<String, List<Double>> fullTable() {
			Map<String, List<Double>> cells = new HashMap<>();
			ThreeWayAnova.allCellKeys().forEach(key -> cells.put(key, new ArrayList<>(List.of(50.0, 51.0))));
			return cells;
		}
	}
}

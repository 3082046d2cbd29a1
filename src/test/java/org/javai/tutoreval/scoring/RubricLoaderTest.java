package org.javai.tutoreval.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RubricLoaderTest {

	private final RubricLoader loader = new RubricLoader();

	@Test
	void defaultRubricHasBaseAndRecognitionDimensions() {
		Rubric rubric = loader.loadDefault();

		assertThat(rubric.dimensionKeys()).hasSize(10).startsWith("relevance", "specificity", "pedagogical");
		assertThat(rubric.groups()).containsExactly("base", "recognition");
		assertThat(rubric.hasGroupWeights()).isFalse();
		assertThat(rubric.dimensions().get(0).criteria()).containsKeys(1, 3, 5);
	}

	@Test
	void readsGroupWeightsAndDefaultsNames() {
		Rubric rubric = loader.loadString("""
				group_weights:
				  base: 0.6
				  recognition: 0.4
				dimensions:
				  relevance:
				    group: base
				    weight: 1
				  mutual_recognition:
				    group: recognition
				    weight: 0.5
				""");

		assertThat(rubric.groupWeights()).containsEntry("base", 0.6).containsEntry("recognition", 0.4);
		assertThat(rubric.dimensions().get(0).name()).isEqualTo("relevance");
		assertThat(rubric.dimensionsIn("recognition")).hasSize(1);
	}

	@Test
	void loadsFromAFile(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("rubric.yaml");
		Files.writeString(file, "dimensions:\n  tone:\n    group: base\n    weight: 0.1\n");

		assertThat(loader.load(file).dimensionKeys()).containsExactly("tone");
	}

	@Test
	void rejectsDimensionWithoutGroup() {
		assertThatThrownBy(() -> loader.loadString("dimensions:\n  tone:\n    weight: 0.1\n"))
				.isInstanceOf(RubricConfigException.class)
				.hasMessageContaining("tone");
	}

	@Test
	void rejectsNegativeWeight() {
		assertThatThrownBy(() -> loader.loadString("dimensions:\n  tone:\n    group: base\n    weight: -1\n"))
				.isInstanceOf(RubricConfigException.class)
				.hasMessageContaining("Invalid dimension 'tone'");
	}

	@Test
	void rejectsEmptyRubric() {
		assertThatThrownBy(() -> loader.loadString("dimensions: {}\n"))
				.isInstanceOf(RubricConfigException.class)
				.hasMessageContaining("no dimensions");
	}

	@Test
	void missingFileIsAConfigError(@TempDir Path dir) {
		assertThatThrownBy(() -> loader.load(dir.resolve("absent.yaml")))
				.isInstanceOf(RubricConfigException.class)
				.hasMessageContaining("absent.yaml");
	}
}

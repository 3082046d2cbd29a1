package org.javai.tutoreval.judge;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class JsonTextTest {

	@Test
	void fencedBlockIgnoresTextAroundTheFence() {
		assertThat(JsonText.fencedBlock("before\n```json\n{\"a\": 1}\n```\nafter")).contains("{\"a\": 1}");
		assertThat(JsonText.fencedBlock("```\n{\"a\": 1}```")).contains("{\"a\": 1}");
		assertThat(JsonText.fencedBlock("no fence here")).isEmpty();
	}

	@Test
	void braceSpanRunsFromFirstOpenToLastClose() {
		assertThat(JsonText.braceSpan("Score: {\"a\": {\"b\": 1}} done")).contains("{\"a\": {\"b\": 1}}");
		assertThat(JsonText.braceSpan("} backwards {")).isEmpty();
	}

	@Test
	void cleanupLeavesCommasInsideStringsAlone() {
		String json = "{\"a\": \"x, }\", \"b\": [1, 2,],}";

		assertThat(JsonText.cleanup(json)).isEqualTo("{\"a\": \"x, }\", \"b\": [1, 2]}");
	}

	@Test
	void cleanupEscapesRawNewlinesInStrings() {
		assertThat(JsonText.cleanup("{\"a\": \"line one\nline two\"}")).isEqualTo("{\"a\": \"line one\\nline two\"}");
	}

	@Test
	void repairQuotesKeepsStructuralQuotes() {
		String json = "{\"a\": \"say \"hi\" now\", \"b\": \"ok\"}";

		assertThat(JsonText.repairQuotes(json)).isEqualTo("{\"a\": \"say \\\"hi\\\" now\", \"b\": \"ok\"}");
	}
}

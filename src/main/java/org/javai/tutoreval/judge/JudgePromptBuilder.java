package org.javai.tutoreval.judge;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the rubric prompt sent to the judge model.
 */
public class JudgePromptBuilder {

	private static final String TEMPLATE = """
			Evaluate the following AI tutor message against the pedagogical rubric.

			## EVALUATION RUBRIC

			Score each dimension from 1-5:
			- 1: Completely fails this criterion
			- 2: Weak, significant issues
			- 3: Adequate, meets basic expectations
			- 4: Good, exceeds expectations
			- 5: Excellent, exemplary

			%s

			## SCENARIO CONTEXT

			**Scenario**: %s
			**Description**: %s
			**Expected Behavior**: %s

			**Learner Context**:
			%s
			%s
			## MESSAGE TO EVALUATE

			%s

			## VALIDATION REQUIREMENTS

			Required elements (must include):
			%s

			Forbidden elements (must NOT include):
			%s

			## YOUR TASK

			For each dimension give a score (1-5), brief reasoning and a short direct quote from the message
			("N/A" if none). Report whether the required and forbidden element checks pass, an overall score
			(0-100) and a one-sentence summary.

			CRITICAL JSON RULES:
			- Never use unescaped double quotes inside JSON string values. Use single quotes or rephrase.
			- Keep "reasoning" values under 25 words and "quote" values under 15 words.

			Respond with ONLY a JSON object in this exact format:
			```json
			{
			  "scores": {
			%s
			  },
			  "validation": {
			    "passes_required": true,
			    "required_missing": [],
			    "passes_forbidden": true,
			    "forbidden_found": []
			  },
			  "overall_score": 80,
			  "summary": "Brief overall assessment"
			}
			```""";

	private final List<RubricDimension> dimensions;

	public JudgePromptBuilder(List<RubricDimension> dimensions) {
		if (dimensions == null || dimensions.isEmpty()) {
			throw new IllegalArgumentException("dimensions must not be empty");
		}
		this.dimensions = List.copyOf(dimensions);
	}

	public String build(JudgeRequest request) {
		String transcript = request.transcript().isBlank()
				? ""
				: "\n## CONVERSATION SO FAR\n\n" + request.transcript() + "\n";
		return TEMPLATE.formatted(
				dimensionCriteria(),
				request.scenarioName(),
				request.scenarioDescription(),
				request.expectedBehavior(),
				request.learnerContext().isBlank() ? "No context provided" : request.learnerContext(),
				transcript,
				request.tutorMessage(),
				bulletList(request.requiredElements()),
				bulletList(request.forbiddenElements()),
				scoreExample());
	}

	private String dimensionCriteria() {
		return dimensions.stream()
				.map(this::describe)
				.collect(Collectors.joining("\n\n"));
	}

	private String describe(RubricDimension dimension) {
		StringBuilder sb = new StringBuilder();
		sb.append("**").append(dimension.name()).append("** (").append(dimension.key()).append(")\n");
		if (!dimension.description().isBlank()) {
			sb.append(dimension.description()).append('\n');
		}
		if (!dimension.criteria().isEmpty()) {
			sb.append("Criteria:");
			for (Map.Entry<Integer, String> level : dimension.criteria().entrySet()) {
				sb.append("\n  ").append(level.getKey()).append(": ").append(level.getValue());
			}
		}
		return sb.toString().stripTrailing();
	}

	private String scoreExample() {
		return dimensions.stream()
				.map(d -> String.format(Locale.ROOT, "    \"%s\": {\"score\": 4, \"reasoning\": \"...\", \"quote\": \"...\"}", d.key()))
				.collect(Collectors.joining(",\n"));
	}

	private static String bulletList(List<String> items) {
		if (items.isEmpty()) {
			return "- None specified";
		}
		return items.stream().map(item -> "- " + item).collect(Collectors.joining("\n"));
	}
}

package org.javai.tutoreval.judge;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Turns a parsed judge JSON tree into a {@link JudgeRatingSet}.
 */
final class JudgeRatingSetReader {

	static final ObjectMapper STRICT_MAPPER = JsonMapper.builder().build();

	static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
			.enable(JsonReadFeature.ALLOW_JAVA_COMMENTS,
					JsonReadFeature.ALLOW_YAML_COMMENTS,
					JsonReadFeature.ALLOW_SINGLE_QUOTES,
					JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES,
					JsonReadFeature.ALLOW_TRAILING_COMMA,
					JsonReadFeature.ALLOW_MISSING_VALUES,
					JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS,
					JsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER,
					JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS,
					JsonReadFeature.ALLOW_LEADING_ZEROS_FOR_NUMBERS)
			.build();

	private static final Map<String, String> DIMENSION_ALIASES = Map.of(
			"pedagogical_soundness", "pedagogical");

	private JudgeRatingSetReader() {
	}

	static String canonicalDimension(String name) {
		String key = name.trim().toLowerCase(Locale.ROOT);
		return DIMENSION_ALIASES.getOrDefault(key, key);
	}

	static StrategyResult parseAndRead(ObjectMapper mapper, String json) {
		JsonNode root;
		try {
			root = mapper.readTree(json);
		} catch (Exception e) {
			return StrategyResult.failure("invalid JSON: " + firstLine(e.getMessage()));
		}
		return read(root);
	}

	static StrategyResult read(JsonNode root) {
		if (root == null || !root.isObject()) {
			return StrategyResult.failure("top-level value is not an object");
		}
		JsonNode scoresNode = root.get("scores");
		if (scoresNode == null || !scoresNode.isObject()) {
			return StrategyResult.failure("no 'scores' object");
		}
		Map<String, DimensionRating> scores = new LinkedHashMap<>();
		for (Map.Entry<String, JsonNode> field : scoresNode.properties()) {
			DimensionRating rating = ratingOf(field.getValue());
			if (rating != null) {
				scores.putIfAbsent(canonicalDimension(field.getKey()), rating);
			}
		}
		if (scores.isEmpty()) {
			return StrategyResult.failure("'scores' holds no usable 1-5 dimension score");
		}
		return new StrategyResult.Success(new JudgeRatingSet(
				scores,
				validationOf(root.get("validation")),
				overallOf(root.get("overall_score")),
				textOf(root.get("summary"))));
	}

	private static DimensionRating ratingOf(JsonNode node) {
		if (node == null) {
			return null;
		}
		if (node.isObject()) {
			OptionalInt score = integralScore(node.get("score"));
			if (score.isEmpty()) {
				return null;
			}
			String rationale = textOf(node.has("reasoning") ? node.get("reasoning") : node.get("rationale"));
			return new DimensionRating(score.getAsInt(), rationale, textOf(node.get("quote")));
		}
		OptionalInt score = integralScore(node);
		return score.isPresent() ? DimensionRating.of(score.getAsInt()) : null;
	}

	private static OptionalInt integralScore(JsonNode node) {
		if (node == null || node.isNull()) {
			return OptionalInt.empty();
		}
		double value;
		if (node.isNumber()) {
			value = node.doubleValue();
		} else if (node.isTextual()) {
			try {
				value = Double.parseDouble(node.asText().trim());
			} catch (NumberFormatException e) {
				return OptionalInt.empty();
			}
		} else {
			return OptionalInt.empty();
		}
		if (Double.isNaN(value) || value != Math.rint(value)
				|| value < DimensionRating.MIN_SCORE || value > DimensionRating.MAX_SCORE) {
			return OptionalInt.empty();
		}
		return OptionalInt.of((int) value);
	}

	private static ValidationBlock validationOf(JsonNode node) {
		if (node == null || !node.isObject()) {
			return null;
		}
		return new ValidationBlock(
				node.path("passes_required").asBoolean(true),
				stringList(node.get("required_missing")),
				node.path("passes_forbidden").asBoolean(true),
				stringList(node.get("forbidden_found")));
	}

	private static Double overallOf(JsonNode node) {
		if (node == null || !node.isNumber() || !Double.isFinite(node.doubleValue())) {
			return null;
		}
		return node.doubleValue();
	}

	private static List<String> stringList(JsonNode node) {
		List<String> values = new ArrayList<>();
		if (node != null && node.isArray()) {
			node.forEach(item -> values.add(item.asText()));
		}
		return values;
	}

	private static String textOf(JsonNode node) {
		return node == null || node.isNull() ? null : node.asText();
	}

	private static String firstLine(String message) {
		if (message == null) {
			return "unknown error";
		}
		int newline = message.indexOf('\n');
		return newline < 0 ? message : message.substring(0, newline);
	}
}

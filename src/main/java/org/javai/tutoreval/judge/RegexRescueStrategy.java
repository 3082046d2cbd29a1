package org.javai.tutoreval.judge;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last resort: pulls {@code "<dimension>": {"score": n}} pairs out of text that no parser accepts, for
 * example output truncated mid-object. Succeeds only when at least the configured number of dimensions
 * is recovered.
 */
class RegexRescueStrategy implements JudgeParseStrategy {

	private static final Pattern OVERALL_PATTERN = Pattern.compile("\"overall_score\"\\s*:\\s*(\\d+(?:\\.\\d+)?)");
	private static final Pattern SUMMARY_PATTERN = Pattern.compile("\"summary\"\\s*:\\s*\"((?:[^\"\\\\]|\\\\.)*)\"");

	private final Map<String, Pattern> dimensionPatterns = new LinkedHashMap<>();
	private final int threshold;

	RegexRescueStrategy(List<String> dimensions, int threshold) {
		this.threshold = threshold;
		for (String dimension : dimensions) {
			dimensionPatterns.put(dimension, scorePattern(dimension));
		}
	}

	@Override
	public String name() {
		return "regex-rescue";
	}

	@Override
	public StrategyResult attempt(String rawText) {
		Map<String, DimensionRating> scores = new LinkedHashMap<>();
		for (Map.Entry<String, Pattern> entry : dimensionPatterns.entrySet()) {
			Matcher matcher = entry.getValue().matcher(rawText);
			if (matcher.find()) {
				scores.put(entry.getKey(), DimensionRating.of(Integer.parseInt(matcher.group(1))));
			}
		}
		if (scores.size() < threshold) {
			return StrategyResult.failure("recovered " + scores.size() + " dimension scores, need " + threshold);
		}
		Matcher overall = OVERALL_PATTERN.matcher(rawText);
		Matcher summary = SUMMARY_PATTERN.matcher(rawText);
		return new StrategyResult.Success(new JudgeRatingSet(
				scores,
				null,
				overall.find() ? Double.valueOf(overall.group(1)) : null,
				summary.find() ? summary.group(1) : null));
	}

	private static Pattern scorePattern(String dimension) {
		String names = Pattern.quote(dimension);
		if (dimension.equals("pedagogical")) {
			names = "pedagogical(?:_soundness)?";
		}
		return Pattern.compile("\"(?:" + names + ")\"\\s*:\\s*(?:\\{\\s*\"?score\"?\\s*:\\s*)?\"?([1-5])\\b",
				Pattern.CASE_INSENSITIVE);
	}
}

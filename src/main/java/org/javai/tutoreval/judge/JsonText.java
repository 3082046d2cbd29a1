package org.javai.tutoreval.judge;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text surgery on almost-JSON judge output. Every method is pure.
 */
final class JsonText {

	private static final Pattern FENCED_BLOCK_PATTERN = Pattern.compile("```(?:json|JSON)?\\s*\\n?(.*?)```", Pattern.DOTALL);

	private JsonText() {
	}

	/**
	 * Content of the first fenced code block, if any.
	 */
	static Optional<String> fencedBlock(String text) {
		Matcher matcher = FENCED_BLOCK_PATTERN.matcher(text);
		if (matcher.find()) {
			String content = matcher.group(1).trim();
			return content.isEmpty() ? Optional.empty() : Optional.of(content);
		}
		return Optional.empty();
	}

	/**
	 * Span from the first opening brace to the last closing brace, searched inside the fenced block when
	 * there is one.
	 */
	static Optional<String> braceSpan(String text) {
		String candidate = fencedBlock(text).orElse(text);
		int start = candidate.indexOf('{');
		int end = candidate.lastIndexOf('}');
		if (start < 0 || end <= start) {
			return Optional.empty();
		}
		return Optional.of(candidate.substring(start, end + 1));
	}

	/**
	 * Drops commas that directly precede a closing bracket, escapes raw control characters inside
	 * string literals and blanks out the ones between tokens.
	 */
	static String cleanup(String json) {
		StringBuilder out = new StringBuilder(json.length());
		boolean inString = false;
		boolean escaped = false;
		for (int i = 0; i < json.length(); i++) {
			char c = json.charAt(i);
			if (inString) {
				if (escaped) {
					escaped = false;
					out.append(c);
				} else if (c == '\\') {
					escaped = true;
					out.append(c);
				} else if (c == '"') {
					inString = false;
					out.append(c);
				} else if (c < 0x20) {
					out.append(escapeControl(c));
				} else {
					out.append(c);
				}
				continue;
			}
			if (c == '"') {
				inString = true;
				out.append(c);
			} else if (c == ',' && closesNext(json, i + 1)) {
				// trailing comma
			} else if (c < 0x20 && !Character.isWhitespace(c)) {
				out.append(' ');
			} else {
				out.append(c);
			}
		}
		return out.toString();
	}

	/**
	 * Escapes double quotes that appear inside a string literal. A quote closes the literal only when the
	 * next non-blank character is a colon, comma, closing bracket or the end of input.
	 */
	static String repairQuotes(String json) {
		StringBuilder out = new StringBuilder(json.length() + 16);
		boolean inString = false;
		boolean escaped = false;
		for (int i = 0; i < json.length(); i++) {
			char c = json.charAt(i);
			if (!inString) {
				if (c == '"') {
					inString = true;
				}
				out.append(c);
				continue;
			}
			if (escaped) {
				escaped = false;
				out.append(c);
			} else if (c == '\\') {
				escaped = true;
				out.append(c);
			} else if (c == '"') {
				if (isStructuralBoundary(json, i + 1)) {
					inString = false;
					out.append(c);
				} else {
					out.append("\\\"");
				}
			} else {
				out.append(c);
			}
		}
		return out.toString();
	}

	private static boolean closesNext(String json, int from) {
		int next = skipBlank(json, from);
		return next < json.length() && (json.charAt(next) == '}' || json.charAt(next) == ']');
	}

	private static boolean isStructuralBoundary(String json, int from) {
		int next = skipBlank(json, from);
		if (next >= json.length()) {
			return true;
		}
		char c = json.charAt(next);
		return c == ':' || c == ',' || c == '}' || c == ']';
	}

	private static int skipBlank(String json, int from) {
		int i = from;
		while (i < json.length() && Character.isWhitespace(json.charAt(i))) {
			i++;
		}
		return i;
	}

	private static String escapeControl(char c) {
		return switch (c) {
			case '\n' -> "\\n";
			case '\r' -> "\\r";
			case '\t' -> "\\t";
			case '\b' -> "\\b";
			case '\f' -> "\\f";
			default -> String.format("\\u%04x", (int) c);
		};
	}
}

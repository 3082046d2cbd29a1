package org.javai.tutoreval.agent;

import java.util.Locale;

/**
 * A critic's decision on a tutor draft. Anything but {@link #APPROVE} asks for another revision.
 */
public enum Verdict {
	APPROVE,
	REJECT,
	REVISE,
	ENHANCE,
	REFRAME;

	public boolean isApproval() {
		return this == APPROVE;
	}

	/**
	 * Reads a verdict from model output such as {@code "approved"} or {@code "Reframe"}.
	 *
	 * @throws IllegalArgumentException if the text names no known verdict
	 */
	public static Verdict fromText(String text) {
		if (text == null || text.isBlank()) {
			throw new IllegalArgumentException("verdict text must not be blank");
		}
		String normalized = text.trim().toLowerCase(Locale.ROOT);
		for (Verdict verdict : values()) {
			String name = verdict.name().toLowerCase(Locale.ROOT);
			if (normalized.startsWith(name)) {
				return verdict;
			}
		}
		if (normalized.startsWith("approv") || normalized.startsWith("accept")) {
			return APPROVE;
		}
		throw new IllegalArgumentException("Unknown verdict: '" + text + "'");
	}
}

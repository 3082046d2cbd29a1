package org.javai.tutoreval.judge;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rule-based check of a tutor message against a scenario's required and forbidden elements.
 *
 * <p>Matching is case-insensitive substring containment. Required elements may appear anywhere in the
 * full output; forbidden elements are only looked for in the user-facing text, since internal reasoning
 * may legitimately mention them.</p>
 */
public class RequiredElementValidator {

	public ValidationBlock validate(String text, List<String> required, List<String> forbidden) {
		return validate(text, text, required, forbidden);
	}

	public ValidationBlock validate(String fullText, String userFacingText, List<String> required,
			List<String> forbidden) {
		String full = normalize(fullText);
		String userFacing = normalize(userFacingText);

		List<String> missing = new ArrayList<>();
		for (String element : required != null ? required : List.<String>of()) {
			if (element != null && !element.isBlank() && !full.contains(normalize(element))) {
				missing.add(element);
			}
		}
		List<String> found = new ArrayList<>();
		for (String element : forbidden != null ? forbidden : List.<String>of()) {
			if (element != null && !element.isBlank() && userFacing.contains(normalize(element))) {
				found.add(element);
			}
		}
		return new ValidationBlock(missing.isEmpty(), missing, found.isEmpty(), found);
	}

	private static String normalize(String text) {
		return text == null ? "" : text.toLowerCase(Locale.ROOT);
	}
}

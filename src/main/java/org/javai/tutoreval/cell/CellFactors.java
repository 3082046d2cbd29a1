package org.javai.tutoreval.cell;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One combination of the three orthogonal, two-level experiment factors.
 *
 * <p>The canonical cell key encodes the levels as {@code r{0|1}_t{0|1}_l{0|1}}:
 * recognition prompts, multi-agent tutor, multi-agent learner.</p>
 *
 * @param recognition recognition-enhanced prompt variant instead of the standard one
 * @param multiAgentTutor tutor drafts are reviewed by a critique agent
 * @param multiAgentLearner the simulated learner deliberates internally before replying
 */
public record CellFactors(
		boolean recognition,
		boolean multiAgentTutor,
		boolean multiAgentLearner
) {

	private static final Pattern CELL_KEY = Pattern.compile("^r([01])_t([01])_l([01])$");

	public static CellFactors of(int recognition, int multiAgentTutor, int multiAgentLearner) {
		return new CellFactors(recognition == 1, multiAgentTutor == 1, multiAgentLearner == 1);
	}

	/**
	 * @return true if the value has the shape of a canonical cell key
	 */
	public static boolean isCellKey(String value) {
		return value != null && CELL_KEY.matcher(value).matches();
	}

	/**
	 * Parses a canonical cell key such as {@code r1_t0_l1}.
	 *
	 * @throws IllegalArgumentException if the key is not canonical
	 */
	public static CellFactors fromCellKey(String cellKey) {
		if (cellKey == null) {
			throw new IllegalArgumentException("cellKey must not be null");
		}
		Matcher matcher = CELL_KEY.matcher(cellKey);
		if (!matcher.matches()) {
			throw new IllegalArgumentException("Not a cell key: '" + cellKey + "' (expected r{0|1}_t{0|1}_l{0|1})");
		}
		return of(
				Integer.parseInt(matcher.group(1)),
				Integer.parseInt(matcher.group(2)),
				Integer.parseInt(matcher.group(3)));
	}

	/**
	 * All eight cells of the full factorial cross, in key order.
	 */
	public static List<CellFactors> fullCross() {
		return List.of(
				of(0, 0, 0), of(0, 0, 1), of(0, 1, 0), of(0, 1, 1),
				of(1, 0, 0), of(1, 0, 1), of(1, 1, 0), of(1, 1, 1));
	}

	public String cellKey() {
		return "r" + bit(recognition) + "_t" + bit(multiAgentTutor) + "_l" + bit(multiAgentLearner);
	}

	private static int bit(boolean level) {
		return level ? 1 : 0;
	}
}

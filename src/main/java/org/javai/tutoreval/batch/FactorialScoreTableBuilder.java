package org.javai.tutoreval.batch;

import java.util.List;
import java.util.OptionalDouble;
import org.javai.tutoreval.anova.FactorialScoreTable;
import org.javai.tutoreval.cell.CellFactors;
import org.javai.tutoreval.interaction.DialogueSession;
import org.javai.tutoreval.interaction.EvaluationConfig;
import org.javai.tutoreval.interaction.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the ANOVA input from sealed sessions: one score per session, filed under the session's cell
 * key.
 *
 * <p>A session's score is the weighted mean of its turns' overall composites. Turns without ratings never
 * count; rescue-parsed turns count unless excluded. Sessions with no usable turn, or whose plan has no
 * factors (unrecognized cells), contribute nothing.</p>
 */
public class FactorialScoreTableBuilder {

	private static final Logger logger = LoggerFactory.getLogger(FactorialScoreTableBuilder.class);

	private final boolean includeRescuedTurns;

	public FactorialScoreTableBuilder(boolean includeRescuedTurns) {
		this.includeRescuedTurns = includeRescuedTurns;
	}

	public FactorialScoreTableBuilder(EvaluationConfig config) {
		this(config.includeRescuedTurns());
	}

	public FactorialScoreTable build(List<DialogueSession> sessions) {
		FactorialScoreTable.Builder table = FactorialScoreTable.builder();
		for (DialogueSession session : sessions) {
			CellFactors factors = session.plan().factors();
			if (factors == null) {
				logger.debug("Skipping session {}/{}: cell has no factors", session.cellName(), session.scenarioId());
				continue;
			}
			OptionalDouble score = sessionScore(session);
			if (score.isEmpty()) {
				logger.debug("Skipping session {}/{}#{}: no scored turns", session.cellName(), session.scenarioId(),
						session.replicate());
				continue;
			}
			table.add(factors.cellKey(), score.getAsDouble());
		}
		return table.build();
	}

	public OptionalDouble sessionScore(DialogueSession session) {
		double weighted = 0;
		double totalWeight = 0;
		for (Turn turn : session.turns()) {
			if (turn.scores() == null || (turn.isRescued() && !includeRescuedTurns)) {
				continue;
			}
			weighted += turn.weight() * turn.scores().overall();
			totalWeight += turn.weight();
		}
		return totalWeight > 0 ? OptionalDouble.of(weighted / totalWeight) : OptionalDouble.empty();
	}
}

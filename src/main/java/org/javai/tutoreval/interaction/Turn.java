package org.javai.tutoreval.interaction;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.tutoreval.judge.JudgeOutcome;
import org.javai.tutoreval.judge.ValidationBlock;
import org.javai.tutoreval.scoring.CompositeScoreBundle;

/**
 * One completed tutor turn.
 *
 * @param index turn position, 0 for the turn answering the learner's opening message
 * @param learnerMessage the learner message this turn answered, {@code null} when there was none
 * @param tutorContent the accepted tutor message
 * @param deliberation draft/review/revise trace, a single generate step without deliberation
 * @param learnerReply the learner's reply to this turn, {@code null} for the last turn or single-turn runs
 * @param judgeOutcome how the judge's output was interpreted
 * @param scores composites, {@code null} unless the judge output yielded ratings
 * @param ruleValidation rule-based element check, {@code null} when disabled
 * @param metrics usage of every invocation made for this turn
 * @param deliberationExhausted whether deliberation ran out of rounds without approval
 * @param weight analysis weight of this turn
 */
public record Turn(
		int index,
		String learnerMessage,
		String tutorContent,
		List<DeliberationStep> deliberation,
		String learnerReply,
		JudgeOutcome judgeOutcome,
		CompositeScoreBundle scores,
		ValidationBlock ruleValidation,
		InvocationMetrics metrics,
		boolean deliberationExhausted,
		double weight) {

	public Turn {
		Objects.requireNonNull(tutorContent, "tutorContent must not be null");
		Objects.requireNonNull(judgeOutcome, "judgeOutcome must not be null");
		if (scores != null && !judgeOutcome.isParsed()) {
			throw new IllegalArgumentException("an unparseable judge outcome cannot carry scores");
		}
		if (!(weight >= 0)) {
			throw new IllegalArgumentException("weight must be >= 0");
		}
		deliberation = deliberation != null ? List.copyOf(deliberation) : List.of();
		metrics = metrics != null ? metrics : InvocationMetrics.EMPTY;
	}

	public Optional<CompositeScoreBundle> composite() {
		return Optional.ofNullable(scores);
	}

	public boolean isRescued() {
		return judgeOutcome.isRescued();
	}
}

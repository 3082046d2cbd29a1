package org.javai.tutoreval.judge;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers rubric ratings from raw judge text with an ordered, first-success-wins cascade:
 * <ol>
 *   <li>fenced code block, strict</li>
 *   <li>first-brace to last-brace span, strict</li>
 *   <li>trailing-comma and control-character cleanup, strict</li>
 *   <li>stray quote repair, strict</li>
 *   <li>lenient structural parse</li>
 *   <li>regex rescue of dimension scores</li>
 * </ol>
 * Strategies 1-5 yield {@link JudgeOutcome.FullParse}; strategy 6 yields {@link JudgeOutcome.PartialRescue}.
 * The parser never invents a score.
 */
public class JudgeResponseParser {

	public static final int RESCUE_STRATEGY = 6;

	private static final Logger logger = LoggerFactory.getLogger(JudgeResponseParser.class);

	private final List<JudgeParseStrategy> strategies;

	public JudgeResponseParser() {
		this(JudgeParserConfig.defaults());
	}

	public JudgeResponseParser(JudgeParserConfig config) {
		Objects.requireNonNull(config, "config must not be null");
		this.strategies = List.of(
				new FencedBlockStrategy(),
				new BraceSpanStrategy(),
				new CleanupStrategy(),
				new QuoteRepairStrategy(),
				new LenientStrategy(),
				new RegexRescueStrategy(config.dimensions(), config.rescueThreshold()));
	}

	/**
	 * @return a {@link JudgeOutcome.FullParse} or {@link JudgeOutcome.PartialRescue}
	 * @throws UnparseableJudgeOutputException when every strategy fails
	 */
	public JudgeOutcome parse(String rawText) {
		if (rawText == null || rawText.isBlank()) {
			throw new UnparseableJudgeOutputException(List.of("empty judge response"), rawText);
		}
		List<String> failures = new ArrayList<>();
		for (int i = 0; i < strategies.size(); i++) {
			JudgeParseStrategy strategy = strategies.get(i);
			StrategyResult result = strategy.attempt(rawText);
			if (result instanceof StrategyResult.Success success) {
				int number = i + 1;
				if (number > 1) {
					logger.debug("Judge output parsed by strategy {} ({}) after: {}", number, strategy.name(), failures);
				}
				return number == RESCUE_STRATEGY
						? new JudgeOutcome.PartialRescue(success.ratings())
						: new JudgeOutcome.FullParse(success.ratings(), number);
			}
			failures.add(strategy.name() + ": " + ((StrategyResult.Failure) result).reason());
		}
		throw new UnparseableJudgeOutputException(failures, rawText);
	}

	/**
	 * Same as {@link #parse(String)} but reports total failure as {@link JudgeOutcome.Unparseable}.
	 */
	public JudgeOutcome evaluate(String rawText) {
		try {
			return parse(rawText);
		} catch (UnparseableJudgeOutputException e) {
			logger.warn("Unparseable judge output: {}", e.getMessage());
			return new JudgeOutcome.Unparseable(e);
		}
	}
}

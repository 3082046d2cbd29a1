package org.javai.tutoreval.batch;

import java.time.Duration;
import java.util.Locale;
import java.util.OptionalDouble;
import org.javai.tutoreval.interaction.DialogueSession;
import org.javai.tutoreval.interaction.InvocationMetrics;
import org.javai.tutoreval.interaction.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Batch progress logging: one line per job, one summary per batch.
 */
public class EvaluationLogger {

	private final Logger logger;

	public EvaluationLogger(Class<?> owner) {
		this.logger = LoggerFactory.getLogger(owner);
	}

	public void logBatchStarted(int jobs, int concurrency) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info("Evaluation batch starting: jobs={} concurrency={}", jobs, concurrency);
	}

	public void logSessionResult(EvaluationJob job, DialogueSession session, Duration elapsed) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		InvocationMetrics metrics = session.metrics();
		logger.info(
				"[{}] scenario='{}' status={} turns={} failures={} meanScore={} tokens(in={}, out={}) calls={} {} ms",
				job.describe(),
				summarize(job.scenario().name()),
				session.status(),
				session.turns().size(),
				session.failures().size(),
				formatScore(meanOverall(session)),
				metrics.inputTokens(),
				metrics.outputTokens(),
				metrics.invocations(),
				toMillis(elapsed));
	}

	public void logJobFailure(EvaluationJob job, Throwable e, Duration elapsed) {
		if (!logger.isErrorEnabled()) {
			return;
		}
		logger.error("[{}] job failed after {} ms: {}", job.describe(), toMillis(elapsed), e.toString(), e);
	}

	public void logBatchSummary(EvaluationRunResult result) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info("Evaluation batch finished: jobs={} completed={} partial={} failed={} jobFailures={} {} ms",
				result.jobCount(),
				result.countWithStatus(SessionStatus.COMPLETED),
				result.countWithStatus(SessionStatus.PARTIAL_FAILURE),
				result.countWithStatus(SessionStatus.FAILED),
				result.failures().size(),
				toMillis(result.elapsed()));
	}

	public void debug(String format, Object... args) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		logger.debug(format, args);
	}

	private static Double meanOverall(DialogueSession session) {
		OptionalDouble mean = session.turns().stream()
				.filter(t -> t.scores() != null)
				.mapToDouble(t -> t.scores().overall())
				.average();
		return mean.isPresent() ? mean.getAsDouble() : null;
	}

	private static long toMillis(Duration duration) {
		return duration == null ? -1 : duration.toMillis();
	}

	private static String formatScore(Double value) {
		if (value == null || value.isNaN()) {
			return "n/a";
		}
		return String.format(Locale.ROOT, "%.2f", value);
	}

	private static String summarize(String text) {
		if (text == null || text.isBlank()) {
			return "";
		}
		String normalized = text.replaceAll("\\s+", " ").trim();
		int maxLength = 64;
		return normalized.length() <= maxLength ? normalized : normalized.substring(0, maxLength - 3) + "...";
	}
}

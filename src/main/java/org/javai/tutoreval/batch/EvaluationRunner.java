package org.javai.tutoreval.batch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.tutoreval.anova.FactorialScoreTable;
import org.javai.tutoreval.cell.CellResolver;
import org.javai.tutoreval.cell.ExecutionPlan;
import org.javai.tutoreval.interaction.DialogueSession;
import org.javai.tutoreval.interaction.EvaluationConfig;
import org.javai.tutoreval.interaction.InteractionOrchestrator;
import org.javai.tutoreval.interaction.Scenario;

/**
 * Runs evaluation jobs on a fixed pool of {@link EvaluationConfig#maxConcurrency()} workers. Each job is
 * one session; a job that throws is logged and reported as a {@link JobFailure} while the rest of the
 * batch carries on.
 */
public class EvaluationRunner {

	private final EvaluationLogger log = new EvaluationLogger(EvaluationRunner.class);

	private final InteractionOrchestrator orchestrator;
	private final EvaluationConfig config;

	public EvaluationRunner(InteractionOrchestrator orchestrator, EvaluationConfig config) {
		this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	/**
	 * Crosses cells, scenarios and replicates into jobs, cell-major.
	 */
	public static List<EvaluationJob> jobs(CellResolver resolver, List<String> cells, List<Scenario> scenarios,
			int replicates, int turnBudget) {
		List<EvaluationJob> jobs = new ArrayList<>();
		for (String cell : cells) {
			ExecutionPlan plan = resolver.resolve(cell);
			for (Scenario scenario : scenarios) {
				for (int replicate = 0; replicate < replicates; replicate++) {
					jobs.add(new EvaluationJob(plan, scenario, turnBudget, replicate));
				}
			}
		}
		return jobs;
	}

	public EvaluationRunResult run(List<EvaluationJob> jobs) {
		long started = System.nanoTime();
		int workers = Math.max(1, Math.min(config.maxConcurrency(), jobs.size()));
		log.logBatchStarted(jobs.size(), workers);

		List<DialogueSession> sessions = new ArrayList<>();
		List<JobFailure> failures = new ArrayList<>();
		ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads());
		try {
			List<Future<JobOutcome>> futures = new ArrayList<>();
			for (EvaluationJob job : jobs) {
				log.debug("[{}] queued", job.describe());
				futures.add(pool.submit(() -> runJob(job)));
			}
			for (int i = 0; i < futures.size(); i++) {
				JobOutcome outcome = await(jobs.get(i), futures.get(i));
				if (outcome.session() != null) {
					sessions.add(outcome.session());
				} else {
					failures.add(outcome.failure());
				}
			}
		} finally {
			pool.shutdownNow();
		}

		EvaluationRunResult result = new EvaluationRunResult(sessions, failures,
				Duration.ofNanos(System.nanoTime() - started));
		log.logBatchSummary(result);
		return result;
	}

	/**
	 * ANOVA input for a finished batch, honouring {@link EvaluationConfig#includeRescuedTurns()}.
	 */
	public FactorialScoreTable scoreTable(EvaluationRunResult result) {
		FactorialScoreTable table = new FactorialScoreTableBuilder(config).build(result.sessions());
		log.debug("Score table built: sessions={} scores={} includeRescued={}", result.sessions().size(),
				table.size(), config.includeRescuedTurns());
		return table;
	}

	private JobOutcome runJob(EvaluationJob job) {
		long started = System.nanoTime();
		try {
			DialogueSession session = orchestrator.run(job.plan(), job.scenario(), job.turnBudget(), job.replicate(),
					config);
			log.logSessionResult(job, session, Duration.ofNanos(System.nanoTime() - started));
			return new JobOutcome(session, null);
		} catch (RuntimeException e) {
			log.logJobFailure(job, e, Duration.ofNanos(System.nanoTime() - started));
			return new JobOutcome(null, new JobFailure(job, e.toString()));
		}
	}

	private JobOutcome await(EvaluationJob job, Future<JobOutcome> future) {
		try {
			return future.get();
		} catch (ExecutionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			log.logJobFailure(job, cause, Duration.ZERO);
			return new JobOutcome(null, new JobFailure(job, cause.toString()));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			future.cancel(true);
			return new JobOutcome(null, new JobFailure(job, "interrupted before completion"));
		}
	}

	private static ThreadFactory workerThreads() {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "tutor-eval-worker-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	private record JobOutcome(DialogueSession session, JobFailure failure) {
	}
}

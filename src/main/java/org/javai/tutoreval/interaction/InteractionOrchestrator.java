package org.javai.tutoreval.interaction;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.tutoreval.agent.AgentCollaborator;
import org.javai.tutoreval.agent.AgentCollaboratorFactory;
import org.javai.tutoreval.agent.AgentContext;
import org.javai.tutoreval.agent.AgentInvocationException;
import org.javai.tutoreval.agent.AgentRole;
import org.javai.tutoreval.agent.DialogueEntry;
import org.javai.tutoreval.agent.DialogueRole;
import org.javai.tutoreval.agent.LearnerCollaborator;
import org.javai.tutoreval.agent.LearnerCollaboratorFactory;
import org.javai.tutoreval.agent.LearnerReply;
import org.javai.tutoreval.agent.TimeLimitedInvoker;
import org.javai.tutoreval.cell.ExecutionPlan;
import org.javai.tutoreval.judge.JudgeClient;
import org.javai.tutoreval.judge.JudgeOutcome;
import org.javai.tutoreval.judge.JudgeRequest;
import org.javai.tutoreval.judge.JudgeResponse;
import org.javai.tutoreval.judge.JudgeResponseParser;
import org.javai.tutoreval.judge.RequiredElementValidator;
import org.javai.tutoreval.judge.ValidationBlock;
import org.javai.tutoreval.persistence.SessionRecorder;
import org.javai.tutoreval.scoring.CompositeScoreBundle;
import org.javai.tutoreval.scoring.CompositeScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one {@link DialogueSession}: per turn the tutor answers (deliberating with its critic when the
 * plan asks for it), the judge rates the accepted message and, in multi-turn runs, the learner replies.
 *
 * <p>A collaborator failure aborts the whole turn, learner reply included, so the history handed to
 * agents stays strictly alternating. Judge text that cannot be parsed is not a failure: the turn is
 * recorded without a score.</p>
 */
public class InteractionOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(InteractionOrchestrator.class);

	private final AgentCollaboratorFactory agents;
	private final LearnerCollaboratorFactory learners;
	private final JudgeClient judge;
	private final JudgeResponseParser parser;
	private final CompositeScorer scorer;
	private final SessionRecorder recorder;
	private final TimeLimitedInvoker invoker;
	private final DeliberationLoop deliberation;
	private final RequiredElementValidator elementValidator = new RequiredElementValidator();

	public InteractionOrchestrator(
			AgentCollaboratorFactory agents,
			LearnerCollaboratorFactory learners,
			JudgeClient judge,
			JudgeResponseParser parser,
			CompositeScorer scorer,
			SessionRecorder recorder,
			TimeLimitedInvoker invoker) {
		this.agents = Objects.requireNonNull(agents, "agents must not be null");
		this.learners = Objects.requireNonNull(learners, "learners must not be null");
		this.judge = Objects.requireNonNull(judge, "judge must not be null");
		this.parser = Objects.requireNonNull(parser, "parser must not be null");
		this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
		this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
		this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
		this.deliberation = new DeliberationLoop(invoker);
	}

	/**
	 * Runs a session to completion and returns it sealed.
	 *
	 * @param turnBudget tutor turns for multi-turn scenarios; 0 or less uses the scenario's own budget.
	 *                   Single-turn scenarios always run exactly one turn.
	 */
	public DialogueSession run(ExecutionPlan plan, Scenario scenario, int turnBudget, int replicate,
			EvaluationConfig config) {
		Objects.requireNonNull(plan, "plan must not be null");
		Objects.requireNonNull(scenario, "scenario must not be null");
		Objects.requireNonNull(config, "config must not be null");

		DialogueSession session = new DialogueSession(plan, scenario.id(), replicate);
		int turns = scenario.multiTurn() ? (turnBudget > 0 ? turnBudget : scenario.turnBudget()) : 1;
		SessionParticipants participants = participants(plan, scenario);

		DialogueHistory history = new DialogueHistory();
		if (scenario.hasOpeningMessage()) {
			history.appendLearner(0, scenario.openingMessage());
		}

		logger.debug("Session {}/{}#{} starting: {} turn(s), deliberation={}, rounds={}",
				plan.cellName(), scenario.id(), replicate, turns, plan.dialogueEnabled(), plan.maxRounds());

		for (int index = 0; index < turns; index++) {
			MetricsAccumulator turnMetrics = new MetricsAccumulator();
			try {
				Turn turn = runTurn(index, index < turns - 1, plan, scenario, participants, history, config, turnMetrics);
				session.addMetrics(turnMetrics.snapshot());
				session.addTurn(turn);
				recorder.recordTurn(session, turn);
			} catch (AgentInvocationException e) {
				session.addMetrics(turnMetrics.snapshot());
				TurnFailure failure = TurnFailure.of(index, e);
				session.addFailure(failure);
				recorder.recordFailure(session, failure);
				logger.warn("Turn {} of {}/{}#{} aborted: {} {} ({})", index, plan.cellName(), scenario.id(),
						replicate, e.role(), e.kind(), e.getMessage());
				if (config.failurePolicy() == FailurePolicy.SKIP_REMAINING) {
					break;
				}
			}
		}

		SessionStatus status = session.seal();
		recorder.sealSession(session);
		logger.debug("Session {}/{}#{} sealed: {} ({} turns, {} failures)", plan.cellName(), scenario.id(),
				replicate, status, session.turns().size(), session.failures().size());
		return session;
	}

	private Turn runTurn(int index, boolean replyExpected, ExecutionPlan plan, Scenario scenario,
			SessionParticipants participants, DialogueHistory history, EvaluationConfig config,
			MetricsAccumulator metrics) {
		Duration timeout = config.callTimeout();
		List<DialogueEntry> entries = new ArrayList<>(history.entries());

		// Without a pending learner line the learner speaks first, as part of this turn
		String learnerOpening = null;
		if (scenario.multiTurn() && !history.hasPendingLearnerMessage()) {
			learnerOpening = learnerSays(participants.learner(), entries, timeout, metrics);
			entries.add(DialogueEntry.learner(index, learnerOpening));
		}
		String learnerMessage = lastLearnerLine(entries);

		AgentContext context = AgentContext.initial(scenario.id(), scenario.learnerContext(), plan.promptVariant(),
				entries);
		int rounds = plan.dialogueEnabled() ? plan.maxRounds() : 0;
		DeliberationOutcome outcome = deliberation.run(participants.tutor(), participants.critic(), context, rounds,
				timeout, metrics);
		String accepted = outcome.acceptedContent();

		JudgeRequest request = new JudgeRequest(scenario.name(), scenario.description(), scenario.expectedBehavior(),
				scenario.learnerContext(), accepted, DialogueHistory.render(entries), scenario.requiredElements(),
				scenario.forbiddenElements());
		long judgeStarted = System.nanoTime();
		JudgeResponse response = invoker.invoke(AgentRole.JUDGE, timeout, () -> judge.judge(request));
		metrics.record(AgentRole.JUDGE, response.usage(), Duration.ofNanos(System.nanoTime() - judgeStarted));

		JudgeOutcome judgeOutcome = parser.evaluate(response.text());
		CompositeScoreBundle scores = judgeOutcome.ratingSet().map(scorer::score).orElse(null);
		ValidationBlock ruleValidation = config.validateElements()
				? elementValidator.validate(accepted, scenario.requiredElements(), scenario.forbiddenElements())
				: null;

		String learnerReply = null;
		if (scenario.multiTurn() && replyExpected) {
			List<DialogueEntry> withTutor = new ArrayList<>(entries);
			withTutor.add(DialogueEntry.tutor(index, accepted));
			learnerReply = learnerSays(participants.learner(), withTutor, timeout, metrics);
		}

		// Commit only once every call of the turn has succeeded
		if (learnerOpening != null) {
			history.appendLearner(index, learnerOpening);
		}
		if (history.hasPendingLearnerMessage()) {
			history.appendTutor(index, accepted);
		}
		if (learnerReply != null) {
			history.appendLearner(index + 1, learnerReply);
		}

		return new Turn(
				index,
				learnerMessage,
				accepted,
				outcome.trace(),
				learnerReply,
				judgeOutcome,
				scores,
				ruleValidation,
				metrics.snapshot(),
				outcome.exhausted(),
				config.turnWeight(outcome.exhausted()));
	}

	private String learnerSays(LearnerCollaborator learner, List<DialogueEntry> entries, Duration timeout,
			MetricsAccumulator metrics) {
		long started = System.nanoTime();
		LearnerReply reply = invoker.invoke(AgentRole.LEARNER, timeout, () -> learner.respond(List.copyOf(entries)));
		metrics.record(AgentRole.LEARNER, reply.usage(), Duration.ofNanos(System.nanoTime() - started));
		return reply.message();
	}

	private static String lastLearnerLine(List<DialogueEntry> entries) {
		if (entries.isEmpty()) {
			return null;
		}
		DialogueEntry last = entries.get(entries.size() - 1);
		return last.role() == DialogueRole.LEARNER ? last.content() : null;
	}

	private SessionParticipants participants(ExecutionPlan plan, Scenario scenario) {
		AgentCollaborator tutor = agents.collaboratorFor(plan.tutorModel());
		AgentCollaborator critic = plan.dialogueEnabled() && plan.hasCritique()
				? agents.collaboratorFor(plan.critiqueModel())
				: null;
		LearnerCollaborator learner = scenario.multiTurn()
				? learners.learnerFor(plan.learnerArchitecture(), scenario.id())
				: null;
		return new SessionParticipants(tutor, critic, learner);
	}

	private record SessionParticipants(AgentCollaborator tutor, AgentCollaborator critic, LearnerCollaborator learner) {
	}
}

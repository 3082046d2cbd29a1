package org.javai.tutoreval.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link AgentCollaborator} backed by a Spring AI {@link ChatClient}.
 *
 * <p>The same class serves both sides of the deliberation loop: the tutor model drafts through
 * {@link #generate}, the critique model reviews through {@link #critique}. Critiques are requested as a
 * small JSON object; output that names no verdict is reported as an invocation failure.</p>
 */
public class ChatClientAgentCollaborator implements AgentCollaborator {

	private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
	private static final Pattern JSON_OBJECT = Pattern.compile("\\{.*\\}", Pattern.DOTALL);

	static final String TUTOR_SYSTEM_PROMPT = """
			You are a patient, attentive tutor. Respond to the learner with a single message that moves their
			understanding forward. Prompt variant: %s.""";

	static final String CRITIC_SYSTEM_PROMPT = """
			You review a tutor's draft message before the learner sees it. Answer with ONLY a JSON object:
			{"verdict": "approve|reject|revise|enhance|reframe", "rationale": "<one or two sentences>"}""";

	private final ChatClient chatClient;

	public ChatClientAgentCollaborator(ChatClient chatClient) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
	}

	@Override
	public Generation generate(AgentContext context) {
		String system = String.format(TUTOR_SYSTEM_PROMPT,
				context.promptVariant() != null ? context.promptVariant() : "standard");
		ChatClientSupport.Exchange exchange = ChatClientSupport.call(chatClient, AgentRole.TUTOR, system,
				generationPrompt(context));
		return new Generation(exchange.text().trim(), exchange.usage(), exchange.latency());
	}

	@Override
	public Critique critique(String candidateContent, AgentContext context) {
		String user = """
				Learner context:
				%s

				Conversation so far:
				%s

				Draft tutor message:
				%s
				""".formatted(nullToEmpty(context.learnerContext()), ChatClientSupport.transcript(context.history()),
				candidateContent);
		ChatClientSupport.Exchange exchange = ChatClientSupport.call(chatClient, AgentRole.CRITIC,
				CRITIC_SYSTEM_PROMPT, user);
		JsonNode review = readReview(exchange.text());
		try {
			Verdict verdict = Verdict.fromText(review.path("verdict").asText(null));
			return new Critique(verdict, review.path("rationale").asText(""), exchange.usage(), exchange.latency());
		} catch (IllegalArgumentException e) {
			throw AgentInvocationException.failure(AgentRole.CRITIC, "Critic named no verdict: " + e.getMessage(), e);
		}
	}

	private String generationPrompt(AgentContext context) {
		StringBuilder sb = new StringBuilder();
		sb.append("Learner context:\n").append(nullToEmpty(context.learnerContext())).append("\n\n");
		sb.append("Conversation so far:\n").append(ChatClientSupport.transcript(context.history())).append("\n\n");
		if (context.isRevision()) {
			sb.append("Your previous draft:\n").append(context.priorDraft()).append("\n\n");
			sb.append("A reviewer asked you to ").append(context.feedbackVerdict().name().toLowerCase(Locale.ROOT))
					.append(" it: ").append(nullToEmpty(context.feedback())).append("\n\n");
			sb.append("Write the improved tutor message only.");
		} else {
			sb.append("Write the tutor's next message only.");
		}
		return sb.toString();
	}

	private JsonNode readReview(String text) {
		Matcher matcher = JSON_OBJECT.matcher(text);
		if (!matcher.find()) {
			throw new AgentInvocationException(AgentRole.CRITIC, AgentInvocationException.Kind.FAILURE,
					"Critic output contains no JSON object");
		}
		try {
			return JSON_MAPPER.readTree(matcher.group());
		} catch (Exception e) {
			throw AgentInvocationException.failure(AgentRole.CRITIC, "Critic output is not valid JSON", e);
		}
	}

	private static String nullToEmpty(String value) {
		return value == null ? "" : value;
	}
}

package org.javai.tutoreval.agent;

import java.time.Duration;
import java.util.List;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;

/**
 * Shared plumbing for the Spring AI backed collaborators.
 */
public final class ChatClientSupport {

	private ChatClientSupport() {
	}

	/**
	 * Text, token usage and wall-clock latency of a single chat call.
	 */
	public record Exchange(String text, TokenUsage usage, Duration latency) {
	}

	public static Exchange call(ChatClient chatClient, AgentRole role, String systemPrompt, String userPrompt) {
		long started = System.nanoTime();
		ChatResponse response;
		try {
			response = chatClient.prompt()
					.system(systemPrompt)
					.user(userPrompt)
					.call()
					.chatResponse();
		} catch (RuntimeException e) {
			throw AgentInvocationException.failure(role, role + " model call failed: " + e.getMessage(), e);
		}
		Duration latency = Duration.ofNanos(System.nanoTime() - started);

		if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
			throw new AgentInvocationException(role, AgentInvocationException.Kind.FAILURE,
					role + " model returned no output");
		}
		String text = response.getResult().getOutput().getText();
		if (text == null || text.isBlank()) {
			throw new AgentInvocationException(role, AgentInvocationException.Kind.FAILURE,
					role + " model returned an empty response");
		}
		return new Exchange(text, usageOf(response), latency);
	}

	public static TokenUsage usageOf(ChatResponse response) {
		if (response.getMetadata() == null) {
			return TokenUsage.NONE;
		}
		Usage usage = response.getMetadata().getUsage();
		if (usage == null) {
			return TokenUsage.NONE;
		}
		return new TokenUsage(nonNegative(usage.getPromptTokens()), nonNegative(usage.getCompletionTokens()));
	}

	public static String transcript(List<DialogueEntry> history) {
		if (history.isEmpty()) {
			return "(no conversation yet)";
		}
		StringBuilder sb = new StringBuilder();
		for (DialogueEntry entry : history) {
			sb.append(entry.labelled()).append('\n');
		}
		return sb.toString().stripTrailing();
	}

	private static long nonNegative(Integer value) {
		return value == null || value < 0 ? 0 : value;
	}
}

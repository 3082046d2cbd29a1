package org.javai.tutoreval.judge;

import java.util.Objects;
import org.javai.tutoreval.agent.AgentRole;
import org.javai.tutoreval.agent.ChatClientSupport;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link JudgeClient} backed by a Spring AI {@link ChatClient}.
 */
public class ChatClientJudgeClient implements JudgeClient {

	static final String SYSTEM_PROMPT = "You are an expert evaluator of AI tutoring systems. Respond with JSON only.";

	private final ChatClient chatClient;
	private final JudgePromptBuilder promptBuilder;

	public ChatClientJudgeClient(ChatClient chatClient, JudgePromptBuilder promptBuilder) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder must not be null");
	}

	@Override
	public JudgeResponse judge(JudgeRequest request) {
		ChatClientSupport.Exchange exchange = ChatClientSupport.call(chatClient, AgentRole.JUDGE, SYSTEM_PROMPT,
				promptBuilder.build(request));
		return new JudgeResponse(exchange.text(), exchange.usage(), exchange.latency());
	}
}

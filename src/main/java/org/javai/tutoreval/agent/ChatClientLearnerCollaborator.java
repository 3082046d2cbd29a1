package org.javai.tutoreval.agent;

import java.util.List;
import java.util.Objects;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link LearnerCollaborator} backed by a Spring AI {@link ChatClient}, playing a learner persona.
 */
public class ChatClientLearnerCollaborator implements LearnerCollaborator {

	private final ChatClient chatClient;
	private final String persona;

	public ChatClientLearnerCollaborator(ChatClient chatClient, String persona) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.persona = persona != null ? persona : "a curious learner working through new material";
	}

	@Override
	public LearnerReply respond(List<DialogueEntry> history) {
		String system = "You are " + persona + ". Stay in character and reply as the learner, in one message.";
		String user = history.isEmpty()
				? "Open the conversation with your tutor: say what you are working on and where you are stuck."
				: "Conversation so far:\n" + ChatClientSupport.transcript(history) + "\n\nReply to the tutor.";
		ChatClientSupport.Exchange exchange = ChatClientSupport.call(chatClient, AgentRole.LEARNER, system, user);
		return new LearnerReply(exchange.text().trim(), exchange.usage(), exchange.latency());
	}
}

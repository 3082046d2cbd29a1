package org.javai.tutoreval.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatResponse;

class ChatClientCollaboratorsTest {

	private ChatClient chatClient;

	@BeforeEach
	void setUp() {
		chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
	}

	@Test
	void generateReturnsTextAndTokenUsage() {
		respondWith("  Let's look at your second step.  ");
		ChatClientAgentCollaborator tutor = new ChatClientAgentCollaborator(chatClient);

		Generation generation = tutor.generate(AgentContext.initial("s1", "fractions", "recognition", List.of()));

		assertThat(generation.content()).isEqualTo("Let's look at your second step.");
		assertThat(generation.usage()).isEqualTo(new TokenUsage(10, 20));
	}

	@Test
	void critiqueReadsTheVerdictFromJson() {
		respondWith("Sure.\n{\"verdict\": \"revise\", \"rationale\": \"Too much telling.\"}");
		ChatClientAgentCollaborator critic = new ChatClientAgentCollaborator(chatClient);

		Critique critique = critic.critique("draft", AgentContext.initial("s1", "", "standard", List.of()));

		assertThat(critique.verdict()).isEqualTo(Verdict.REVISE);
		assertThat(critique.rationale()).isEqualTo("Too much telling.");
	}

	@Test
	void critiqueWithoutVerdictIsAnInvocationFailure() {
		respondWith("I think it is fine.");
		ChatClientAgentCollaborator critic = new ChatClientAgentCollaborator(chatClient);

		assertThatThrownBy(() -> critic.critique("draft", AgentContext.initial("s1", "", "standard", List.of())))
				.isInstanceOfSatisfying(AgentInvocationException.class,
						e -> assertThat(e.role()).isEqualTo(AgentRole.CRITIC));
	}

	@Test
	void learnerOpensTheConversationWhenHistoryIsEmpty() {
		respondWith("I'm stuck on question 3.");
		ChatClientLearnerCollaborator learner = new ChatClientLearnerCollaborator(chatClient, null);

		LearnerReply reply = learner.respond(List.of());

		assertThat(reply.message()).isEqualTo("I'm stuck on question 3.");
		assertThat(reply.usage().totalTokens()).isEqualTo(30);
	}

	@Test
	void providerErrorIsWrappedWithTheRole() {
		when(chatClient.prompt().system(anyString()).user(anyString()).call().chatResponse())
				.thenThrow(new RuntimeException("429 Too Many Requests"));
		ChatClientLearnerCollaborator learner = new ChatClientLearnerCollaborator(chatClient, "a nervous student");

		assertThatThrownBy(() -> learner.respond(List.of(DialogueEntry.learner(0, "hi"), DialogueEntry.tutor(0, "hello"))))
				.isInstanceOfSatisfying(AgentInvocationException.class, e -> {
					assertThat(e.role()).isEqualTo(AgentRole.LEARNER);
					assertThat(e).hasMessageContaining("429");
				});
	}

	@Test
	void missingUsageMetadataCountsAsNoTokens() {
		ChatResponse response = new ChatResponse(List.of(
				new org.springframework.ai.chat.model.Generation(new AssistantMessage("fine"))));
		when(chatClient.prompt().system(anyString()).user(anyString()).call().chatResponse()).thenReturn(response);

		Generation generation = new ChatClientAgentCollaborator(chatClient)
				.generate(AgentContext.initial("s1", "", "standard", List.of()));

		assertThat(generation.usage()).isEqualTo(TokenUsage.NONE);
	}

	private void respondWith(String text) {
		ChatResponse response = new ChatResponse(
				List.of(new org.springframework.ai.chat.model.Generation(new AssistantMessage(text))),
				ChatResponseMetadata.builder().usage(new DefaultUsage(10, 20)).build());
		when(chatClient.prompt().system(anyString()).user(anyString()).call().chatResponse()).thenReturn(response);
	}
}

package org.javai.tutoreval.testsupport;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.javai.tutoreval.agent.TokenUsage;
import org.javai.tutoreval.judge.JudgeClient;
import org.javai.tutoreval.judge.JudgeRequest;
import org.javai.tutoreval.judge.JudgeResponse;

/**
 * Deterministic judge double. Unscripted calls answer with every dimension scored 4.
 */
public class ScriptedJudgeClient implements JudgeClient {

	public static final TokenUsage USAGE = new TokenUsage(500, 200);

	private final Deque<Object> responses = new ArrayDeque<>();
	private final List<JudgeRequest> requests = new ArrayList<>();

	public ScriptedJudgeClient responds(String... texts) {
		responses.addAll(List.of(texts));
		return this;
	}

	public ScriptedJudgeClient failNext(RuntimeException failure) {
		responses.add(failure);
		return this;
	}

	@Override
	public synchronized JudgeResponse judge(JudgeRequest request) {
		requests.add(request);
		Object next = responses.poll();
		if (next instanceof RuntimeException failure) {
			throw failure;
		}
		String text = next != null ? (String) next : JudgeTexts.uniform(4);
		return new JudgeResponse(text, USAGE, Duration.ofMillis(7));
	}

	public synchronized List<JudgeRequest> requests() {
		return List.copyOf(requests);
	}
}

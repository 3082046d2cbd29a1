package org.javai.tutoreval.judge;

import java.time.Duration;
import org.javai.tutoreval.agent.TokenUsage;

/**
 * Raw judge text plus the cost of producing it.
 */
public record JudgeResponse(String text, TokenUsage usage, Duration latency) {

	public JudgeResponse {
		text = text != null ? text : "";
		usage = usage != null ? usage : TokenUsage.NONE;
		latency = latency != null ? latency : Duration.ZERO;
	}
}

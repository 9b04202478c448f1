package com.crewmind.core.llm;

import com.crewmind.core.model.ModelConfig;

import java.util.List;

/**
 * A completion request: system prompt, transcript so far, and the agent's model binding.
 */
public record ModelRequest(String systemPrompt, List<ChatTurn> transcript, ModelConfig config) {

    public ModelRequest {
        transcript = List.copyOf(transcript);
    }
}

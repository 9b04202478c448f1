package com.crewmind.core.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the model asked for in one round: a tool call or a final answer.
 *
 * @param toolId     requested tool, null for a final answer
 * @param parameters tool parameters, empty for a final answer
 * @param content    the model's raw reply
 */
public record AgentAction(String toolId, Map<String, Object> parameters, String content) {

    public static AgentAction finalAnswer(String content) {
        return new AgentAction(null, Map.of(), content);
    }

    public static AgentAction toolCall(String toolId, Map<String, Object> parameters, String content) {
        return new AgentAction(toolId,
                parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters)), content);
    }

    public boolean isToolCall() {
        return toolId != null;
    }
}

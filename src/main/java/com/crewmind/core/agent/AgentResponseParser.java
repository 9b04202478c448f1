package com.crewmind.core.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recognises tool requests of the form
 * {@code {"action":"tool","tool":"<id>","parameters":{...}}}, optionally wrapped in a
 * markdown code fence. Every other reply is a final answer.
 */
public class AgentResponseParser {

    private static final Logger log = LoggerFactory.getLogger(AgentResponseParser.class);

    private final ObjectMapper objectMapper;

    public AgentResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AgentAction parse(String reply) {
        if (reply == null) {
            return AgentAction.finalAnswer("");
        }
        String cleaned = stripCodeFence(reply);
        if (!cleaned.startsWith("{") || !cleaned.endsWith("}")) {
            return AgentAction.finalAnswer(reply);
        }
        try {
            JsonNode node = objectMapper.readTree(cleaned);
            if (!"tool".equalsIgnoreCase(node.path("action").asText())
                    || !node.path("tool").isTextual()
                    || node.path("tool").asText().isBlank()) {
                return AgentAction.finalAnswer(reply);
            }
            Map<String, Object> params = new LinkedHashMap<>();
            JsonNode paramNode = node.path("parameters");
            if (paramNode.isObject()) {
                params = objectMapper.convertValue(paramNode, objectMapper.getTypeFactory()
                        .constructMapType(LinkedHashMap.class, String.class, Object.class));
            }
            return AgentAction.toolCall(node.get("tool").asText().trim(), params, reply);
        } catch (Exception e) {
            log.debug("Reply looked like JSON but did not parse: {}", e.getMessage());
            return AgentAction.finalAnswer(reply);
        }
    }

    static String stripCodeFence(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```")) {
            int firstNewline = cleaned.indexOf('\n');
            cleaned = firstNewline >= 0 ? cleaned.substring(firstNewline + 1) : cleaned.substring(3);
            if (cleaned.endsWith("```")) {
                cleaned = cleaned.substring(0, cleaned.length() - 3);
            }
        }
        return cleaned.trim();
    }
}

package com.crewmind.core.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentResponseParserTest {

    private final AgentResponseParser parser = new AgentResponseParser(new ObjectMapper());

    @Test
    @DisplayName("tool request JSON becomes a tool call")
    void toolCall() {
        var action = parser.parse("{\"action\":\"tool\",\"tool\":\"web_search\",\"parameters\":{\"query\":\"cabo\",\"limit\":3}}");

        assertTrue(action.isToolCall());
        assertEquals("web_search", action.toolId());
        assertEquals(Map.of("query", "cabo", "limit", 3), action.parameters());
    }

    @Test
    @DisplayName("fenced tool request is recognised")
    void fencedToolCall() {
        var action = parser.parse("```json\n{\"action\": \"tool\", \"tool\": \"fetch_url\", \"parameters\": {\"url\": \"https://a.b\"}}\n```");
        assertEquals("fetch_url", action.toolId());
    }

    @Test
    @DisplayName("null parameter values are kept")
    void nullParameter() {
        var action = parser.parse("{\"action\":\"tool\",\"tool\":\"web_search\",\"parameters\":{\"query\":\"x\",\"region\":null}}");
        assertTrue(action.isToolCall());
        assertTrue(action.parameters().containsKey("region"));
    }

    @Test
    @DisplayName("anything else is a final answer carrying the original text")
    void finalAnswers() {
        assertFalse(parser.parse("The answer is 42").isToolCall());
        assertFalse(parser.parse("{\"gap_name\": \"Wellness\"}").isToolCall());
        assertFalse(parser.parse("{\"action\": \"tool\"}").isToolCall());
        assertFalse(parser.parse("{\"action\": \"tool\", \"tool\": ").isToolCall());

        String json = "{\"gap_name\": \"Wellness\"}";
        assertEquals(json, parser.parse(json).content());
        assertEquals("", parser.parse(null).content());
    }

    @Test
    void stripCodeFence() {
        assertEquals("{\"a\":1}", AgentResponseParser.stripCodeFence("```json\n{\"a\":1}\n```"));
        assertEquals("plain", AgentResponseParser.stripCodeFence("  plain  "));
    }
}

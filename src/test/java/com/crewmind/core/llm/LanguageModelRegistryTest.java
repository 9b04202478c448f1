package com.crewmind.core.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LanguageModelRegistryTest {

    @Test
    @DisplayName("finds models by provider regardless of case")
    void caseInsensitive() {
        var openai = new ScriptedLanguageModel("OpenAI");
        var registry = new LanguageModelRegistry(List.of(openai, new ScriptedLanguageModel("ollama")));

        assertSame(openai, registry.find("openai").orElseThrow());
        assertTrue(registry.contains("OLLAMA"));
        assertEquals(Set.of("openai", "ollama"), registry.providers());
    }

    @Test
    @DisplayName("unknown or null provider is absent")
    void absent() {
        var registry = new LanguageModelRegistry(List.of());
        assertTrue(registry.find("openai").isEmpty());
        assertTrue(registry.find(null).isEmpty());
        assertFalse(registry.contains("anything"));
    }
}

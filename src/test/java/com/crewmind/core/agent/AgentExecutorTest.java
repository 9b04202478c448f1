package com.crewmind.core.agent;

import com.crewmind.core.cache.CaffeineResponseCache;
import com.crewmind.core.engine.PipelineConfigurationException;
import com.crewmind.core.llm.ChatTurn;
import com.crewmind.core.llm.LanguageModelRegistry;
import com.crewmind.core.llm.ScriptedLanguageModel;
import com.crewmind.core.metrics.CrewmindMetrics;
import com.crewmind.core.model.AgentSpec;
import com.crewmind.core.model.ModelConfig;
import com.crewmind.core.ratelimit.RateLimiter;
import com.crewmind.core.tool.FakeTool;
import com.crewmind.core.tool.ToolCatalog;
import com.crewmind.core.tool.ToolGateway;
import com.crewmind.core.tool.ToolInvocationException;
import com.crewmind.core.tool.ToolInvoker;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AgentExecutorTest {

    private static final String SEARCH_CALL =
            "{\"action\": \"tool\", \"tool\": \"web_search\", \"parameters\": {\"query\": \"cabo wellness\"}}";

    private ScriptedLanguageModel model;
    private FakeTool search;
    private FakeTool readFile;
    private ToolInvoker invoker;
    private RateLimiter rateLimiter;
    private AgentExecutor executor;

    @BeforeEach
    void setUp() {
        model = new ScriptedLanguageModel();
        search = new FakeTool("web_search", params -> "3 results for " + params.get("query"));
        readFile = new FakeTool("read_file", "file contents");
        invoker = new ToolInvoker(1, Duration.ZERO, 1.0, Duration.ofSeconds(5), millis -> { });
        rateLimiter = mock(RateLimiter.class);
        when(rateLimiter.acquire(anyString())).thenReturn(Duration.ZERO);
        var catalog = ToolCatalog.of(search, readFile);
        var metrics = new CrewmindMetrics(new SimpleMeterRegistry());
        var gateway = new ToolGateway(catalog, rateLimiter,
                new CaffeineResponseCache(Duration.ofHours(1), 100), invoker, metrics);
        executor = new AgentExecutor(new LanguageModelRegistry(List.of(model)), gateway, rateLimiter, invoker,
                new AgentPromptBuilder(catalog), new AgentResponseParser(new ObjectMapper()), metrics);
    }

    @AfterEach
    void tearDown() {
        invoker.close();
    }

    private static AgentSpec researcher(int maxIterations) {
        return new AgentSpec("researcher", "Market Research Specialist", "Find market gaps", "Veteran analyst",
                Set.of("web_search"), new ModelConfig("openai", "gpt-4o-mini", 0.2, null), maxIterations);
    }

    @Test
    @DisplayName("plain answer ends the loop after one model call")
    void finalAnswerWithoutTools() {
        model.on("Research", "The gap is wellness concierge services.");

        var outcome = executor.execute(researcher(3), "Research the market", 5);

        assertEquals("The gap is wellness concierge services.", outcome.rawOutput());
        assertEquals(1, outcome.modelCalls());
        assertEquals(0, outcome.rounds());
        assertEquals(0, outcome.toolCalls());
        assertFalse(outcome.budgetExceeded());
        assertTrue(outcome.warnings().isEmpty());
    }

    @Test
    @DisplayName("tool request is executed and its result fed back to the model")
    void toolRoundTrip() {
        model.on("Research", SEARCH_CALL, "Final: wellness concierge");

        var outcome = executor.execute(researcher(3), "Research the market", 5);

        assertEquals("Final: wellness concierge", outcome.rawOutput());
        assertEquals(1, outcome.toolCalls());
        assertEquals(1, outcome.rounds());
        assertEquals(2, outcome.modelCalls());
        assertEquals(1, search.invocations());

        var second = model.requests().get(1).transcript();
        assertEquals(3, second.size());
        assertEquals(ChatTurn.Role.ASSISTANT, second.get(1).role());
        assertTrue(second.get(2).content().startsWith("Tool result (web_search):"));
        assertTrue(second.get(2).content().contains("3 results for cabo wellness"));
    }

    @Test
    @DisplayName("disallowed tool is refused in the transcript and consumes a round")
    void disallowedTool() {
        model.on("Research",
                "{\"action\": \"tool\", \"tool\": \"read_file\", \"parameters\": {\"path\": \"secrets.txt\"}}",
                "Answer without files");

        var outcome = executor.execute(researcher(3), "Research the market", 5);

        assertEquals("Answer without files", outcome.rawOutput());
        assertEquals(1, outcome.rounds());
        assertEquals(0, outcome.toolCalls());
        assertEquals(0, readFile.invocations());
        var lastTurn = model.requests().get(1).transcript().get(2);
        assertTrue(lastTurn.content().startsWith("Tool error:"));
        assertTrue(lastTurn.content().contains("read_file"));
    }

    @Test
    @DisplayName("exhausted budget returns a partial answer with a warning")
    void budgetExhausted() {
        model.on("Research", SEARCH_CALL, SEARCH_CALL, SEARCH_CALL, "Partial findings so far");

        var outcome = executor.execute(researcher(2), "Research the market", 5);

        assertTrue(outcome.budgetExceeded());
        assertEquals("Partial findings so far", outcome.rawOutput());
        assertEquals(2, outcome.rounds());
        assertEquals(4, outcome.modelCalls());
        assertEquals(1, outcome.toolCalls());
        assertEquals(1, outcome.cacheHits());
        assertEquals(1, outcome.warnings().size());
        assertTrue(outcome.warnings().get(0).startsWith(AgentOutcome.ITERATION_BUDGET_EXCEEDED));
    }

    @Test
    @DisplayName("agent without its own budget uses the run default")
    void runDefaultBudget() {
        model.on("Research", SEARCH_CALL, SEARCH_CALL, "done");

        var outcome = executor.execute(researcher(0), "Research the market", 1);

        assertTrue(outcome.budgetExceeded());
        assertEquals(1, outcome.rounds());
        assertEquals("done", outcome.rawOutput());
    }

    @Test
    @DisplayName("model calls acquire the rate limiter")
    void modelCallsAreRateLimited() {
        model.on("Research", SEARCH_CALL, "done");

        executor.execute(researcher(3), "Research the market", 5);

        verify(rateLimiter, times(2)).acquire("model:openai");
        verify(rateLimiter, times(1)).acquire("web_search");
    }

    @Test
    @DisplayName("tool failure after retries propagates")
    void toolFailurePropagates() {
        search.failNext(new IOException("search API down"));
        model.on("Research", SEARCH_CALL);

        var ex = assertThrows(ToolInvocationException.class,
                () -> executor.execute(researcher(3), "Research the market", 5));
        assertTrue(ex.getMessage().contains("search API down"));
    }

    @Test
    @DisplayName("unregistered provider is a configuration error")
    void unknownProvider() {
        var agent = new AgentSpec("x", "Role", "Goal", null, Set.of(),
                new ModelConfig("anthropic", "claude", null, null), 1);

        assertThrows(PipelineConfigurationException.class, () -> executor.execute(agent, "hi", 5));
        verify(rateLimiter, never()).acquire(anyString());
    }
}

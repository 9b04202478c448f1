package com.crewmind.core.health;

import com.crewmind.config.CrewmindProperties;
import com.crewmind.core.llm.LanguageModel;
import com.crewmind.core.llm.LanguageModelRegistry;
import com.crewmind.core.llm.ScriptedLanguageModel;
import com.crewmind.core.tool.FakeTool;
import com.crewmind.core.tool.ToolCatalog;
import com.crewmind.mcp.McpClientManager;
import io.modelcontextprotocol.client.McpSyncClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    @TempDir
    Path tempDir;

    private CrewmindProperties properties;
    private McpClientManager mcp;

    @BeforeEach
    void setUp() {
        properties = new CrewmindProperties();
        properties.getOutput().setDirectory(tempDir.resolve("output").toString());
        mcp = mock(McpClientManager.class);
    }

    private HealthCheckService service(List<String> providers, String apiKey, FakeTool... tools) {
        var models = new LanguageModelRegistry(providers.stream()
                .<LanguageModel>map(ScriptedLanguageModel::new).toList());
        return new HealthCheckService(models, ToolCatalog.of(tools), mcp, properties, apiKey);
    }

    @Nested
    @DisplayName("models")
    class Models {

        @Test
        @DisplayName("DOWN when no model is registered")
        void none() {
            assertEquals(HealthStatus.Status.DOWN, service(List.of(), "k").checkModels().status());
        }

        @Test
        @DisplayName("DEGRADED when the OpenAI key is the placeholder")
        void placeholderKey() {
            var status = service(List.of("openai"), "not-set").checkModels();
            assertEquals(HealthStatus.Status.DEGRADED, status.status());
            assertEquals("openai", status.metadata().get("providers"));
        }

        @Test
        @DisplayName("UP with a key")
        void up() {
            assertEquals(HealthStatus.Status.UP, service(List.of("openai"), "sk-test").checkModels().status());
        }
    }

    @Nested
    @DisplayName("search")
    class Search {

        @Test
        @DisplayName("DOWN without the web_search tool, DEGRADED without a key, UP with one")
        void levels() {
            assertEquals(HealthStatus.Status.DOWN, service(List.of("openai"), "k").checkSearch().status());

            var withTool = service(List.of("openai"), "k", new FakeTool("web_search", "r"));
            assertEquals(HealthStatus.Status.DEGRADED, withTool.checkSearch().status());

            properties.getSearch().setApiKey("serper-key");
            assertEquals(HealthStatus.Status.UP, withTool.checkSearch().status());
        }
    }

    @Nested
    @DisplayName("mcp")
    class Mcp {

        @Test
        @DisplayName("UP when nothing is configured")
        void notConfigured() {
            when(mcp.isConfigured()).thenReturn(false);
            assertEquals(HealthStatus.Status.UP, service(List.of("openai"), "k").checkMcp().status());
            verify(mcp, never()).getClients();
        }

        @Test
        @DisplayName("DEGRADED when one configured server does not answer ping")
        void oneDown() {
            McpSyncClient ok = mock(McpSyncClient.class);
            McpSyncClient dead = mock(McpSyncClient.class);
            doThrow(new IllegalStateException("timeout")).when(dead).ping();
            var clients = new LinkedHashMap<String, McpSyncClient>();
            clients.put("a", ok);
            clients.put("b", dead);
            when(mcp.isConfigured()).thenReturn(true);
            when(mcp.getClients()).thenReturn(clients);

            var status = service(List.of("openai"), "k").checkMcp();
            assertEquals(HealthStatus.Status.DEGRADED, status.status());
            assertEquals("1 of 2 MCP server(s) not responding", status.detail());
        }

        @Test
        @DisplayName("DOWN when configured but no server connected")
        void noneReachable() {
            when(mcp.isConfigured()).thenReturn(true);
            when(mcp.getClients()).thenReturn(new LinkedHashMap<>());
            assertEquals(HealthStatus.Status.DOWN, service(List.of("openai"), "k").checkMcp().status());
        }
    }

    @Nested
    @DisplayName("output directory")
    class Output {

        @Test
        @DisplayName("creates the directory and reports UP")
        void creates() {
            var status = service(List.of("openai"), "k").checkOutputDirectory();
            assertEquals(HealthStatus.Status.UP, status.status());
            assertTrue(Files.isDirectory(tempDir.resolve("output")));
        }

        @Test
        @DisplayName("DOWN when the path is a file")
        void blockedByFile() throws Exception {
            Path file = Files.writeString(tempDir.resolve("file"), "x");
            properties.getOutput().setDirectory(file.toString());
            assertEquals(HealthStatus.Status.DOWN, service(List.of("openai"), "k").checkOutputDirectory().status());
        }
    }

    @Test
    @DisplayName("checkAll reports every component")
    void checkAll() {
        when(mcp.isConfigured()).thenReturn(false);
        var components = service(List.of("openai"), "k").checkAll().stream().map(HealthStatus::component).toList();
        assertEquals(List.of("models", "search", "mcp", "output"), components);
    }
}

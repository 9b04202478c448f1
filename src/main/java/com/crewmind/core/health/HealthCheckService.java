package com.crewmind.core.health;

import com.crewmind.config.CrewmindProperties;
import com.crewmind.core.llm.LanguageModelRegistry;
import com.crewmind.core.tool.ToolCatalog;
import com.crewmind.core.tool.builtin.WebSearchTool;
import com.crewmind.mcp.McpClientManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);
    private static final String KEY_NOT_SET = "not-set";

    private final LanguageModelRegistry models;
    private final ToolCatalog toolCatalog;
    private final McpClientManager mcpClientManager;
    private final CrewmindProperties properties;
    private final String openAiApiKey;

    public HealthCheckService(LanguageModelRegistry models, ToolCatalog toolCatalog,
                              McpClientManager mcpClientManager, CrewmindProperties properties,
                              @Value("${spring.ai.openai.api-key:}") String openAiApiKey) {
        this.models = models;
        this.toolCatalog = toolCatalog;
        this.mcpClientManager = mcpClientManager;
        this.properties = properties;
        this.openAiApiKey = openAiApiKey;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkModels());
        results.add(checkSearch());
        results.add(checkMcp());
        results.add(checkOutputDirectory());
        return results;
    }

    HealthStatus checkModels() {
        if (models.providers().isEmpty()) {
            return new HealthStatus("models", HealthStatus.Status.DOWN, "No language model registered", Map.of());
        }
        var meta = Map.of("providers", String.join(",", models.providers()));
        if (models.contains("openai") && (openAiApiKey == null || openAiApiKey.isBlank()
                || KEY_NOT_SET.equals(openAiApiKey))) {
            return new HealthStatus("models", HealthStatus.Status.DEGRADED,
                    "OpenAI provider registered but OPENAI_API_KEY is not set", meta);
        }
        return new HealthStatus("models", HealthStatus.Status.UP,
                "Providers available: " + models.providers(), meta);
    }

    HealthStatus checkSearch() {
        if (!toolCatalog.contains(WebSearchTool.ID)) {
            return new HealthStatus("search", HealthStatus.Status.DOWN, "web_search tool not registered", Map.of());
        }
        if (!properties.getSearch().hasApiKey()) {
            return new HealthStatus("search", HealthStatus.Status.DEGRADED,
                    "crewmind.search.api-key is not set; web_search calls will fail", Map.of());
        }
        return new HealthStatus("search", HealthStatus.Status.UP,
                "Search API at " + properties.getSearch().getApiUrl(), Map.of());
    }

    HealthStatus checkMcp() {
        if (!mcpClientManager.isConfigured()) {
            return new HealthStatus("mcp", HealthStatus.Status.UP, "No MCP servers configured", Map.of());
        }
        var clients = mcpClientManager.getClients();
        int down = 0;
        for (var entry : clients.entrySet()) {
            try {
                entry.getValue().ping();
            } catch (Exception e) {
                log.warn("MCP server '{}' ping failed: {}", entry.getKey(), e.getMessage());
                down++;
            }
        }
        if (clients.isEmpty()) {
            return new HealthStatus("mcp", HealthStatus.Status.DOWN, "No MCP server reachable", Map.of());
        }
        if (down > 0) {
            return new HealthStatus("mcp", HealthStatus.Status.DEGRADED,
                    down + " of " + clients.size() + " MCP server(s) not responding", Map.of());
        }
        return new HealthStatus("mcp", HealthStatus.Status.UP,
                clients.size() + " MCP server(s) connected", Map.of());
    }

    HealthStatus checkOutputDirectory() {
        Path dir = Path.of(properties.getOutput().getDirectory());
        try {
            Files.createDirectories(dir);
            if (Files.isWritable(dir)) {
                return new HealthStatus("output", HealthStatus.Status.UP,
                        "Reports written to " + dir.toAbsolutePath(), Map.of());
            }
            return new HealthStatus("output", HealthStatus.Status.DOWN, dir + " is not writable", Map.of());
        } catch (Exception e) {
            log.warn("Output directory check failed: {}", e.getMessage());
            return new HealthStatus("output", HealthStatus.Status.DOWN,
                    "Cannot create " + dir + ": " + e.getMessage(), Map.of());
        }
    }
}

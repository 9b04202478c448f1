package com.crewmind.mcp;

import com.crewmind.core.tool.Tool;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A tool advertised by a remote MCP server, exposed as {@code mcp.<server>.<tool>}.
 */
public class McpTool implements Tool {

    private final String serverName;
    private final McpSyncClient client;
    private final String toolName;
    private final String description;
    private final String parameterHint;

    public McpTool(String serverName, McpSyncClient client, McpSchema.Tool definition) {
        this.serverName = serverName;
        this.client = client;
        this.toolName = definition.name();
        this.description = definition.description() != null ? definition.description() : definition.name();
        this.parameterHint = hintFrom(definition.inputSchema());
    }

    public static String toolId(String serverName, String toolName) {
        return "mcp." + serverName + "." + toolName;
    }

    @Override
    public String id() {
        return toolId(serverName, toolName);
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public String parameterHint() {
        return parameterHint;
    }

    @Override
    public String invoke(Map<String, Object> parameters) throws IOException {
        var result = client.callTool(new McpSchema.CallToolRequest(toolName, new LinkedHashMap<>(parameters)));
        String text = result.content() == null ? "" : result.content().stream()
                .filter(McpSchema.TextContent.class::isInstance)
                .map(c -> ((McpSchema.TextContent) c).text())
                .collect(Collectors.joining("\n"));
        if (Boolean.TRUE.equals(result.isError())) {
            throw new IOException("MCP tool " + id() + " reported an error: " + text);
        }
        return text;
    }

    private static String hintFrom(McpSchema.JsonSchema schema) {
        if (schema == null || schema.properties() == null || schema.properties().isEmpty()) {
            return "{}";
        }
        return schema.properties().keySet().stream()
                .map(name -> "\"" + name + "\": ...")
                .collect(Collectors.joining(", ", "{", "}"));
    }
}

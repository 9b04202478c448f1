package com.crewmind.mcp;

import com.crewmind.core.tool.Tool;
import com.crewmind.core.tool.ToolSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Discovers the tools of every connected MCP server and hands them to the tool catalog.
 */
@Component
public class McpToolProvider implements ToolSource {

    private static final Logger log = LoggerFactory.getLogger(McpToolProvider.class);

    private final McpClientManager clientManager;

    public McpToolProvider(McpClientManager clientManager) {
        this.clientManager = clientManager;
    }

    @Override
    public String name() {
        return "mcp";
    }

    @Override
    public List<Tool> discover() {
        if (!clientManager.isConfigured()) {
            return List.of();
        }
        var tools = new ArrayList<Tool>();
        for (var entry : clientManager.getClients().entrySet()) {
            String server = entry.getKey();
            try {
                var listed = entry.getValue().listTools();
                if (listed.tools() == null) continue;
                for (var definition : listed.tools()) {
                    tools.add(new McpTool(server, entry.getValue(), definition));
                }
                log.info("MCP server '{}' advertises {} tool(s)", server, listed.tools().size());
            } catch (Exception e) {
                log.warn("Failed to list tools of MCP server '{}': {}", server, e.getMessage());
            }
        }
        return tools;
    }
}

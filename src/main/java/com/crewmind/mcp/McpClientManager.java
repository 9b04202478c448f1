package com.crewmind.mcp;

import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owns one MCP sync client per configured server.
 * <p>
 * Clients are created on first use; a server that cannot be reached is logged
 * and left out, so the rest of the catalog still works.
 */
@Component
public class McpClientManager {

    private static final Logger log = LoggerFactory.getLogger(McpClientManager.class);

    private final McpProperties props;
    private final Map<String, McpSyncClient> clients = new LinkedHashMap<>();
    private boolean connected;

    public McpClientManager(McpProperties props) {
        this.props = props;
    }

    /**
     * Connects to every configured server (once) and returns the live clients keyed by server name.
     */
    public synchronized Map<String, McpSyncClient> getClients() {
        if (!connected) {
            connected = true;
            if (!props.isConfigured()) {
                log.info("MCP servers disabled or not configured");
            } else {
                for (var entry : props.getServers().entrySet()) {
                    var client = connect(entry.getKey(), entry.getValue());
                    if (client != null) {
                        clients.put(entry.getKey(), client);
                    }
                }
            }
        }
        return Collections.unmodifiableMap(clients);
    }

    public boolean isConfigured() {
        return props.isConfigured();
    }

    McpSyncClient connect(String serverName, McpProperties.ServerConfig config) {
        if (!config.hasUrl()) return null;
        try {
            var transportBuilder = HttpClientStreamableHttpTransport.builder(config.getUrl());
            if (config.hasToken()) {
                transportBuilder.customizeRequest(req ->
                        req.header("Authorization", "Bearer " + config.getToken()));
            }
            var client = McpClient.sync(transportBuilder.build())
                    .requestTimeout(props.getRequestTimeout())
                    .build();
            client.initialize();
            log.info("MCP server '{}' connected at {}", serverName, config.getUrl());
            return client;
        } catch (Exception e) {
            log.warn("MCP server '{}' unavailable: {}", serverName, e.getMessage());
            return null;
        }
    }

    @PreDestroy
    synchronized void shutdown() {
        for (var entry : clients.entrySet()) {
            try {
                entry.getValue().close();
                log.info("MCP client disconnected (server: {})", entry.getKey());
            } catch (Exception e) {
                log.debug("Error closing MCP client '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        clients.clear();
    }
}

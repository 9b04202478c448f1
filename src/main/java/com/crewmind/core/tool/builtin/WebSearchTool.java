package com.crewmind.core.tool.builtin;

import com.crewmind.config.CrewmindProperties;
import com.crewmind.core.tool.Tool;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Web search against a Serper-compatible API (POST JSON with an {@code X-API-KEY} header).
 * Returns one block per organic result: title, link and snippet.
 */
public class WebSearchTool implements Tool {

    public static final String ID = "web_search";

    private final CrewmindProperties.Search props;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WebSearchTool(CrewmindProperties.Search props, ObjectMapper objectMapper) {
        this(props, objectMapper, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    WebSearchTool(CrewmindProperties.Search props, ObjectMapper objectMapper, HttpClient httpClient) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Search the web and return the top results with title, link and snippet";
    }

    @Override
    public String parameterHint() {
        return "{\"query\": \"search terms\"}";
    }

    @Override
    public String invoke(Map<String, Object> parameters) throws IOException, InterruptedException {
        Object query = parameters.get("query");
        if (query == null || query.toString().isBlank()) {
            throw new IllegalArgumentException("web_search requires a 'query' parameter");
        }
        if (!props.hasApiKey()) {
            throw new IllegalStateException("crewmind.search.api-key is not configured");
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("q", query.toString());
        body.put("num", props.getResultCount());

        var request = HttpRequest.newBuilder(URI.create(props.getApiUrl()))
                .header("X-API-KEY", props.getApiKey())
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(30))
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
        var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() >= 400) {
            throw new IOException("Search API returned HTTP " + response.statusCode());
        }
        return format(objectMapper.readTree(response.body()));
    }

    String format(JsonNode root) {
        var organic = root.path("organic");
        if (!organic.isArray() || organic.isEmpty()) {
            return "No results found.";
        }
        var sb = new StringBuilder();
        int n = 0;
        for (JsonNode item : organic) {
            if (n++ >= props.getResultCount()) break;
            sb.append("Title: ").append(item.path("title").asText("")).append('\n')
              .append("Link: ").append(item.path("link").asText("")).append('\n')
              .append("Snippet: ").append(item.path("snippet").asText("")).append("\n\n");
        }
        return sb.toString().trim();
    }
}

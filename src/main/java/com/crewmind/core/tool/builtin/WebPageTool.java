package com.crewmind.core.tool.builtin;

import com.crewmind.config.CrewmindProperties;
import com.crewmind.core.tool.Tool;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Fetches a web page and returns its visible text, truncated.
 */
public class WebPageTool implements Tool {

    public static final String ID = "fetch_url";

    private static final Pattern SCRIPT_OR_STYLE =
            Pattern.compile("(?is)<(script|style|noscript)[^>]*>.*?</\\1>");
    private static final Pattern TAG = Pattern.compile("(?s)<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final CrewmindProperties.Fetch props;
    private final HttpClient httpClient;

    public WebPageTool(CrewmindProperties.Fetch props) {
        this(props, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    WebPageTool(CrewmindProperties.Fetch props, HttpClient httpClient) {
        this.props = props;
        this.httpClient = httpClient;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Fetch a web page by URL and return its text content";
    }

    @Override
    public String parameterHint() {
        return "{\"url\": \"https://...\"}";
    }

    @Override
    public String invoke(Map<String, Object> parameters) throws IOException, InterruptedException {
        Object url = parameters.get("url");
        if (url == null || url.toString().isBlank()) {
            throw new IllegalArgumentException("fetch_url requires a 'url' parameter");
        }
        URI uri = URI.create(url.toString().trim());
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException("fetch_url only supports http and https URLs");
        }
        var request = HttpRequest.newBuilder(uri)
                .timeout(props.getTimeout())
                .header("User-Agent", "crewmind/0.1")
                .GET()
                .build();
        var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() >= 400) {
            throw new IOException("GET " + uri + " returned HTTP " + response.statusCode());
        }
        return truncate(extractText(response.body()), props.getMaxChars());
    }

    static String extractText(String html) {
        String text = SCRIPT_OR_STYLE.matcher(html).replaceAll(" ");
        text = TAG.matcher(text).replaceAll(" ");
        text = text.replace("&nbsp;", " ").replace("&amp;", "&")
                .replace("&lt;", "<").replace("&gt;", ">").replace("&quot;", "\"");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    static String truncate(String text, int maxChars) {
        if (text.length() <= maxChars) return text;
        return text.substring(0, maxChars) + " [truncated]";
    }
}

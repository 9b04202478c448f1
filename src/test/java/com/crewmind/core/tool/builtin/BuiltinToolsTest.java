package com.crewmind.core.tool.builtin;

import com.crewmind.config.CrewmindProperties;
import com.crewmind.core.security.PathRestrictionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class BuiltinToolsTest {

    @Nested
    @DisplayName("read_file")
    class ReadFile {

        @TempDir
        Path baseDir;

        private FileReadTool tool(int maxChars) {
            var files = new CrewmindProperties.Files();
            files.setBaseDir(baseDir.toString());
            files.setReadable(List.of("**/*.md"));
            return new FileReadTool(new PathRestrictionService(files), maxChars);
        }

        @Test
        @DisplayName("reads an allowed file and truncates long content")
        void readsAndTruncates() throws Exception {
            Files.writeString(baseDir.resolve("notes.md"), "Cabo spa demand is rising");

            assertEquals("Cabo spa demand is rising", tool(100).invoke(Map.of("path", "notes.md")));
            assertEquals("Cabo [truncated]", tool(4).invoke(Map.of("path", "notes.md")));
        }

        @Test
        @DisplayName("missing file is an IOException, disallowed path a SecurityException")
        void errors() {
            assertThrows(IOException.class, () -> tool(100).invoke(Map.of("path", "absent.md")));
            assertThrows(SecurityException.class, () -> tool(100).invoke(Map.of("path", "../escape.md")));
            assertThrows(SecurityException.class, () -> tool(100).invoke(Map.of()));
        }
    }

    @Nested
    @DisplayName("fetch_url")
    class FetchUrl {

        private final WebPageTool tool = new WebPageTool(new CrewmindProperties.Fetch());

        @Test
        @DisplayName("strips scripts, styles, tags and entities")
        void extractsText() {
            String html = """
                    <html><head><style>body { color: red }</style><script>var x = 1;</script></head>
                    <body><h1>Cabo&nbsp;Wellness</h1><p>Spa &amp; yoga   retreats</p></body></html>""";
            assertEquals("Cabo Wellness Spa & yoga retreats", WebPageTool.extractText(html));
        }

        @Test
        @DisplayName("rejects missing and non-http urls without a network call")
        void rejectsBadUrls() {
            assertThrows(IllegalArgumentException.class, () -> tool.invoke(Map.of()));
            assertThrows(IllegalArgumentException.class, () -> tool.invoke(Map.of("url", "file:///etc/passwd")));
        }
    }

    @Nested
    @DisplayName("web_search")
    class WebSearch {

        private final ObjectMapper objectMapper = new ObjectMapper();

        private WebSearchTool tool(String apiKey, int resultCount) {
            var props = new CrewmindProperties.Search();
            props.setApiKey(apiKey);
            props.setResultCount(resultCount);
            return new WebSearchTool(props, objectMapper);
        }

        @Test
        @DisplayName("formats organic results up to the configured count")
        void formats() throws IOException {
            var root = objectMapper.readTree("""
                    {"organic": [
                      {"title": "Cabo spas", "link": "https://a.example", "snippet": "Top spas"},
                      {"title": "Yoga retreats", "link": "https://b.example", "snippet": "Retreat guide"}
                    ]}""");

            assertEquals("Title: Cabo spas\nLink: https://a.example\nSnippet: Top spas", tool("k", 1).format(root));
        }

        @Test
        @DisplayName("posts the query with the API key header")
        @SuppressWarnings("unchecked")
        void postsQuery() throws Exception {
            HttpClient http = mock(HttpClient.class);
            HttpResponse<String> response = mock(HttpResponse.class);
            when(response.statusCode()).thenReturn(200);
            when(response.body()).thenReturn("{\"organic\": [{\"title\": \"T\", \"link\": \"L\", \"snippet\": \"S\"}]}");
            when(http.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(response);
            var props = new CrewmindProperties.Search();
            props.setApiKey("secret");

            String out = new WebSearchTool(props, objectMapper, http).invoke(Map.of("query", "cabo wellness"));

            assertEquals("Title: T\nLink: L\nSnippet: S", out);
            ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
            verify(http).send(request.capture(), any(HttpResponse.BodyHandler.class));
            assertEquals("secret", request.getValue().headers().firstValue("X-API-KEY").orElseThrow());
            assertEquals("POST", request.getValue().method());
        }

        @Test
        @DisplayName("HTTP error status is an IOException")
        @SuppressWarnings("unchecked")
        void httpError() throws Exception {
            HttpClient http = mock(HttpClient.class);
            HttpResponse<String> response = mock(HttpResponse.class);
            when(response.statusCode()).thenReturn(503);
            when(http.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(response);
            var props = new CrewmindProperties.Search();
            props.setApiKey("secret");

            var tool = new WebSearchTool(props, objectMapper, http);
            assertThrows(IOException.class, () -> tool.invoke(Map.of("query", "cabo")));
        }

        @Test
        @DisplayName("empty result set has a readable message")
        void noResults() throws IOException {
            assertEquals("No results found.", tool("k", 5).format(objectMapper.readTree("{}")));
        }

        @Test
        @DisplayName("requires a query and an API key")
        void preconditions() {
            assertThrows(IllegalArgumentException.class, () -> tool("k", 5).invoke(Map.of("query", " ")));
            assertThrows(IllegalStateException.class, () -> tool("", 5).invoke(Map.of("query", "cabo")));
        }
    }
}

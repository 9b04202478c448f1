package com.crewmind.config;

import com.crewmind.core.model.FailurePolicy;
import com.crewmind.core.model.RunConfig;
import com.crewmind.core.model.SchemaFailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine-wide settings bound from {@code crewmind.*}.
 * Values in a pipeline definition's {@code run:} block override the {@link Engine} defaults.
 */
@Component
@ConfigurationProperties(prefix = "crewmind")
public class CrewmindProperties {

    private Engine engine = new Engine();
    private RateLimit rateLimit = new RateLimit();
    private Cache cache = new Cache();
    private Tools tools = new Tools();
    private Model model = new Model();
    private Search search = new Search();
    private Fetch fetch = new Fetch();
    private Files files = new Files();
    private Output output = new Output();

    public Engine getEngine() { return engine; }
    public void setEngine(Engine engine) { this.engine = engine; }
    public RateLimit getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimit rateLimit) { this.rateLimit = rateLimit; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Tools getTools() { return tools; }
    public void setTools(Tools tools) { this.tools = tools; }
    public Model getModel() { return model; }
    public void setModel(Model model) { this.model = model; }
    public Search getSearch() { return search; }
    public void setSearch(Search search) { this.search = search; }
    public Fetch getFetch() { return fetch; }
    public void setFetch(Fetch fetch) { this.fetch = fetch; }
    public Files getFiles() { return files; }
    public void setFiles(Files files) { this.files = files; }
    public Output getOutput() { return output; }
    public void setOutput(Output output) { this.output = output; }

    /**
     * Builds the default {@link RunConfig} from the engine settings.
     */
    public RunConfig toRunConfig() {
        return new RunConfig(engine.getFailurePolicy(), engine.getMaxWorkers(), engine.getMaxIterations(),
                engine.getSchemaFailurePolicy(), engine.getMaxSchemaRetries());
    }

    public static class Engine {
        private FailurePolicy failurePolicy = FailurePolicy.SKIP_DOWNSTREAM;
        private int maxWorkers = 1;
        private int maxIterations = 5;
        private SchemaFailurePolicy schemaFailurePolicy = SchemaFailurePolicy.REPROMPT_THEN_DEGRADE;
        private int maxSchemaRetries = 1;

        public FailurePolicy getFailurePolicy() { return failurePolicy; }
        public void setFailurePolicy(FailurePolicy failurePolicy) { this.failurePolicy = failurePolicy; }
        public int getMaxWorkers() { return maxWorkers; }
        public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }
        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public SchemaFailurePolicy getSchemaFailurePolicy() { return schemaFailurePolicy; }
        public void setSchemaFailurePolicy(SchemaFailurePolicy p) { this.schemaFailurePolicy = p; }
        public int getMaxSchemaRetries() { return maxSchemaRetries; }
        public void setMaxSchemaRetries(int maxSchemaRetries) { this.maxSchemaRetries = maxSchemaRetries; }
    }

    public static class RateLimit {
        /** Grants allowed per window. */
        private int maxCalls = 10;
        private Duration window = Duration.ofMinutes(1);
        private Duration maxWait = Duration.ofMinutes(2);

        public int getMaxCalls() { return maxCalls; }
        public void setMaxCalls(int maxCalls) { this.maxCalls = maxCalls; }
        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
        public Duration getMaxWait() { return maxWait; }
        public void setMaxWait(Duration maxWait) { this.maxWait = maxWait; }
    }

    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(1);
        private long maxEntries = 10_000;
        /** Optional JSON snapshot loaded at startup and rewritten after each run. */
        private String snapshotFile = "";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
        public long getMaxEntries() { return maxEntries; }
        public void setMaxEntries(long maxEntries) { this.maxEntries = maxEntries; }
        public String getSnapshotFile() { return snapshotFile; }
        public void setSnapshotFile(String snapshotFile) { this.snapshotFile = snapshotFile; }

        public boolean hasSnapshotFile() {
            return snapshotFile != null && !snapshotFile.isBlank();
        }
    }

    public static class Tools {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
        private Duration callTimeout = Duration.ofSeconds(30);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
        public Duration getCallTimeout() { return callTimeout; }
        public void setCallTimeout(Duration callTimeout) { this.callTimeout = callTimeout; }
    }

    public static class Model {
        private String defaultProvider = "openai";
        private String defaultModel = "gpt-4o-mini";
        private Double temperature = 0.7;

        public String getDefaultProvider() { return defaultProvider; }
        public void setDefaultProvider(String defaultProvider) { this.defaultProvider = defaultProvider; }
        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
        public Double getTemperature() { return temperature; }
        public void setTemperature(Double temperature) { this.temperature = temperature; }
    }

    public static class Search {
        private String apiUrl = "https://google.serper.dev/search";
        private String apiKey = "";
        private int resultCount = 5;

        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public int getResultCount() { return resultCount; }
        public void setResultCount(int resultCount) { this.resultCount = resultCount; }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public static class Fetch {
        private int maxChars = 8_000;
        private Duration timeout = Duration.ofSeconds(20);

        public int getMaxChars() { return maxChars; }
        public void setMaxChars(int maxChars) { this.maxChars = maxChars; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Files {
        private String baseDir = ".";
        private List<String> readable = new ArrayList<>(List.of("**/*.md", "**/*.txt", "**/*.json", "**/*.csv"));
        private int maxChars = 20_000;

        public String getBaseDir() { return baseDir; }
        public void setBaseDir(String baseDir) { this.baseDir = baseDir; }
        public List<String> getReadable() { return readable; }
        public void setReadable(List<String> readable) { this.readable = readable; }
        public int getMaxChars() { return maxChars; }
        public void setMaxChars(int maxChars) { this.maxChars = maxChars; }
    }

    public static class Output {
        private String directory = "output";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }
}

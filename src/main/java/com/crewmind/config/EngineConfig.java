package com.crewmind.config;

import com.crewmind.core.agent.AgentExecutor;
import com.crewmind.core.agent.AgentPromptBuilder;
import com.crewmind.core.agent.AgentResponseParser;
import com.crewmind.core.cache.CacheSnapshotStore;
import com.crewmind.core.cache.CaffeineResponseCache;
import com.crewmind.core.cache.ResponseCache;
import com.crewmind.core.definition.PipelineDefinitionLoader;
import com.crewmind.core.engine.InstructionRenderer;
import com.crewmind.core.engine.PipelineOrchestrator;
import com.crewmind.core.engine.PipelineValidator;
import com.crewmind.core.engine.TaskRunner;
import com.crewmind.core.events.EventBus;
import com.crewmind.core.llm.LanguageModel;
import com.crewmind.core.llm.LanguageModelRegistry;
import com.crewmind.core.llm.SpringAiLanguageModel;
import com.crewmind.core.metrics.CrewmindMetrics;
import com.crewmind.core.persistence.RunHistoryService;
import com.crewmind.core.persistence.RunReportWriter;
import com.crewmind.core.ratelimit.RateLimiter;
import com.crewmind.core.ratelimit.SlidingWindowRateLimiter;
import com.crewmind.core.scheduler.DependencyGraphValidator;
import com.crewmind.core.scheduler.TaskScheduler;
import com.crewmind.core.schema.SchemaValidator;
import com.crewmind.core.security.PathRestrictionService;
import com.crewmind.core.tool.Tool;
import com.crewmind.core.tool.ToolCatalog;
import com.crewmind.core.tool.ToolGateway;
import com.crewmind.core.tool.ToolInvoker;
import com.crewmind.core.tool.ToolSource;
import com.crewmind.core.tool.builtin.FileReadTool;
import com.crewmind.core.tool.builtin.WebPageTool;
import com.crewmind.core.tool.builtin.WebSearchTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the engine. The rate limiter and response cache are created once here and
 * handed to every component that needs them.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimiter rateLimiter(CrewmindProperties props) {
        var rl = props.getRateLimit();
        log.info("Rate limit: {} call(s) per {}, max wait {}", rl.getMaxCalls(), rl.getWindow(), rl.getMaxWait());
        return new SlidingWindowRateLimiter(rl.getMaxCalls(), rl.getWindow(), rl.getMaxWait());
    }

    @Bean
    public CacheSnapshotStore cacheSnapshotStore(ObjectMapper objectMapper) {
        return new CacheSnapshotStore(objectMapper);
    }

    @Bean
    public ResponseCache responseCache(CrewmindProperties props, CacheSnapshotStore snapshotStore) {
        var cacheProps = props.getCache();
        // a zero ttl makes every entry expire immediately, which turns caching off
        var ttl = cacheProps.isEnabled() ? cacheProps.getTtl() : Duration.ZERO;
        var cache = new CaffeineResponseCache(ttl, cacheProps.getMaxEntries());
        if (cacheProps.isEnabled() && cacheProps.hasSnapshotFile()) {
            snapshotStore.load(cache, Path.of(cacheProps.getSnapshotFile()));
        }
        return cache;
    }

    @Bean(destroyMethod = "close")
    public ToolInvoker toolInvoker(CrewmindProperties props) {
        var t = props.getTools();
        return new ToolInvoker(t.getMaxAttempts(), t.getInitialBackoff(), t.getBackoffMultiplier(), t.getCallTimeout());
    }

    @Bean
    public PathRestrictionService pathRestrictionService(CrewmindProperties props) {
        return new PathRestrictionService(props.getFiles());
    }

    @Bean
    public WebSearchTool webSearchTool(CrewmindProperties props, ObjectMapper objectMapper) {
        return new WebSearchTool(props.getSearch(), objectMapper);
    }

    @Bean
    public WebPageTool webPageTool(CrewmindProperties props) {
        return new WebPageTool(props.getFetch());
    }

    @Bean
    public FileReadTool fileReadTool(PathRestrictionService pathRestrictionService, CrewmindProperties props) {
        return new FileReadTool(pathRestrictionService, props.getFiles().getMaxChars());
    }

    @Bean
    public ToolCatalog toolCatalog(List<Tool> tools, List<ToolSource> sources) {
        return new ToolCatalog(tools, sources);
    }

    @Bean
    public ToolGateway toolGateway(ToolCatalog catalog, RateLimiter rateLimiter, ResponseCache cache,
                                   ToolInvoker invoker, CrewmindMetrics metrics) {
        return new ToolGateway(catalog, rateLimiter, cache, invoker, metrics);
    }

    @Bean
    public LanguageModelRegistry languageModelRegistry(ObjectProvider<ChatClient.Builder> chatClientBuilder,
                                                       CrewmindProperties props) {
        var models = new ArrayList<LanguageModel>();
        var builder = chatClientBuilder.getIfAvailable();
        if (builder != null) {
            var m = props.getModel();
            models.add(new SpringAiLanguageModel("openai", builder.build(), m.getDefaultModel(), m.getTemperature()));
        } else {
            log.warn("No Spring AI ChatClient available; no language model registered");
        }
        return new LanguageModelRegistry(models);
    }

    @Bean
    public AgentPromptBuilder agentPromptBuilder(ToolCatalog catalog) {
        return new AgentPromptBuilder(catalog);
    }

    @Bean
    public AgentResponseParser agentResponseParser(ObjectMapper objectMapper) {
        return new AgentResponseParser(objectMapper);
    }

    @Bean
    public AgentExecutor agentExecutor(LanguageModelRegistry models, ToolGateway gateway, RateLimiter rateLimiter,
                                       ToolInvoker invoker, AgentPromptBuilder promptBuilder,
                                       AgentResponseParser responseParser, CrewmindMetrics metrics) {
        return new AgentExecutor(models, gateway, rateLimiter, invoker, promptBuilder, responseParser, metrics);
    }

    @Bean
    public SchemaValidator schemaValidator(ObjectMapper objectMapper) {
        return new SchemaValidator(objectMapper);
    }

    @Bean
    public InstructionRenderer instructionRenderer(ObjectMapper objectMapper) {
        return new InstructionRenderer(objectMapper);
    }

    @Bean
    public TaskRunner taskRunner(AgentExecutor agentExecutor, AgentPromptBuilder promptBuilder,
                                 InstructionRenderer renderer, SchemaValidator schemaValidator,
                                 CrewmindMetrics metrics, Clock clock) {
        return new TaskRunner(agentExecutor, promptBuilder, renderer, schemaValidator, metrics, clock);
    }

    @Bean
    public PipelineValidator pipelineValidator(DependencyGraphValidator graphValidator, ToolCatalog catalog,
                                               LanguageModelRegistry models) {
        return new PipelineValidator(graphValidator, catalog, models);
    }

    @Bean
    public RunReportWriter runReportWriter(CrewmindProperties props, ObjectMapper objectMapper) {
        return new RunReportWriter(Path.of(props.getOutput().getDirectory()), objectMapper);
    }

    @Bean
    public RunHistoryService runHistoryService(CrewmindProperties props, ObjectMapper objectMapper) {
        return new RunHistoryService(Path.of(props.getOutput().getDirectory()), objectMapper);
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(PipelineValidator validator, TaskScheduler scheduler,
                                                     TaskRunner taskRunner, RunReportWriter reportWriter,
                                                     EventBus eventBus, CrewmindMetrics metrics, Clock clock) {
        return new PipelineOrchestrator(validator, scheduler, taskRunner, reportWriter, eventBus, metrics, clock);
    }

    @Bean
    public PipelineDefinitionLoader pipelineDefinitionLoader(ObjectMapper objectMapper, CrewmindProperties props) {
        return new PipelineDefinitionLoader(objectMapper, props.getModel().getDefaultProvider(),
                props.getModel().getDefaultModel());
    }
}

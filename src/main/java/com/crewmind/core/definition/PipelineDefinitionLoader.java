package com.crewmind.core.definition;

import com.crewmind.core.engine.PipelineConfigurationException;
import com.crewmind.core.model.AgentSpec;
import com.crewmind.core.model.FailurePolicy;
import com.crewmind.core.model.FieldSpec;
import com.crewmind.core.model.FieldType;
import com.crewmind.core.model.ModelConfig;
import com.crewmind.core.model.OutputSchema;
import com.crewmind.core.model.PipelineDefinition;
import com.crewmind.core.model.RunConfig;
import com.crewmind.core.model.SchemaFailurePolicy;
import com.crewmind.core.model.TaskSpec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Reads a pipeline definition (agents, tasks and optional {@code run:} overrides)
 * from a YAML or JSON file. Keys may be written in kebab-case or camelCase.
 *
 * <pre>
 * name: market-research
 * run:
 *   failure-policy: skip-downstream
 *   max-workers: 2
 * agents:
 *   researcher:
 *     role: Market Research Specialist
 *     goal: Find market gaps
 *     tools: [web_search]
 *     model: { provider: openai, name: gpt-4o-mini }
 * tasks:
 *   - id: research
 *     agent: researcher
 *     instruction: Research the market
 *     output-schema:
 *       - { name: gap_name, type: string, required: true }
 * </pre>
 */
public class PipelineDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(PipelineDefinitionLoader.class);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ObjectMapper jsonMapper;
    private final String defaultProvider;
    private final String defaultModel;

    public PipelineDefinitionLoader(ObjectMapper jsonMapper, String defaultProvider, String defaultModel) {
        this.jsonMapper = jsonMapper;
        this.defaultProvider = defaultProvider;
        this.defaultModel = defaultModel;
    }

    public LoadedPipeline load(Path file, RunConfig defaults) {
        if (!Files.isRegularFile(file)) {
            throw new PipelineConfigurationException("Pipeline file not found: " + file);
        }
        JsonNode root;
        try {
            String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
            root = name.endsWith(".json") ? jsonMapper.readTree(file.toFile()) : yamlMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new PipelineConfigurationException("Cannot parse " + file + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PipelineConfigurationException(file + " does not contain a pipeline definition");
        }
        var definition = parse(root);
        var runConfig = runConfig(field(root, "run"), defaults);
        log.info("Loaded pipeline '{}' from {}: {} agent(s), {} task(s)",
                definition.name(), file, definition.agents().size(), definition.tasks().size());
        return new LoadedPipeline(file, definition, runConfig);
    }

    PipelineDefinition parse(JsonNode root) {
        var agents = new LinkedHashMap<String, AgentSpec>();
        JsonNode agentsNode = field(root, "agents");
        if (agentsNode != null && agentsNode.isObject()) {
            agentsNode.fields().forEachRemaining(e -> agents.put(e.getKey(), agent(e.getKey(), e.getValue())));
        } else if (agentsNode != null && agentsNode.isArray()) {
            for (JsonNode node : agentsNode) {
                String id = requireText(node, "id", "agent");
                if (agents.put(id, agent(id, node)) != null) {
                    throw new PipelineConfigurationException("Duplicate agent id: " + id);
                }
            }
        }

        var tasks = new ArrayList<TaskSpec>();
        JsonNode tasksNode = field(root, "tasks");
        if (tasksNode == null || !tasksNode.isArray()) {
            throw new PipelineConfigurationException("Pipeline must declare a 'tasks' list");
        }
        for (JsonNode node : tasksNode) {
            tasks.add(task(node));
        }
        return new PipelineDefinition(text(root, "name"), agents, tasks);
    }

    private AgentSpec agent(String id, JsonNode node) {
        var tools = new LinkedHashSet<String>();
        JsonNode toolsNode = field(node, "tools", "allowedTools");
        if (toolsNode != null && toolsNode.isArray()) {
            toolsNode.forEach(t -> tools.add(t.asText()));
        }
        return new AgentSpec(id,
                requireText(node, "role", "agent '" + id + "'"),
                requireText(node, "goal", "agent '" + id + "'"),
                text(node, "backstory"),
                tools,
                model(field(node, "model", "llm")),
                intValue(node, 0, "maxIterations", "maxIter"));
    }

    private ModelConfig model(JsonNode node) {
        if (node == null || node.isNull()) {
            return new ModelConfig(defaultProvider, defaultModel, null, null);
        }
        if (node.isTextual()) {
            // "openai/gpt-4o" or just "gpt-4o"
            String value = node.asText();
            int slash = value.indexOf('/');
            return slash > 0
                    ? new ModelConfig(value.substring(0, slash), value.substring(slash + 1), null, null)
                    : new ModelConfig(defaultProvider, value, null, null);
        }
        String provider = text(node, "provider");
        String name = text(node, "name", "model");
        JsonNode temperature = field(node, "temperature");
        JsonNode maxTokens = field(node, "maxTokens", "maxOutputTokens");
        return new ModelConfig(
                provider == null ? defaultProvider : provider,
                name == null ? defaultModel : name,
                temperature == null ? null : temperature.asDouble(),
                maxTokens == null ? null : maxTokens.asInt());
    }

    private TaskSpec task(JsonNode node) {
        String id = requireText(node, "id", "task");
        var deps = new ArrayList<String>();
        JsonNode depsNode = field(node, "dependsOn", "dependencies", "context");
        if (depsNode != null && depsNode.isArray()) {
            depsNode.forEach(d -> deps.add(d.asText()));
        } else if (depsNode != null && depsNode.isTextual()) {
            deps.add(depsNode.asText());
        }
        JsonNode allowSkipped = field(node, "allowSkippedDependencies");
        return new TaskSpec(id,
                requireText(node, "agent", "task '" + id + "'"),
                text(node, "description"),
                text(node, "instruction"),
                text(node, "expectedOutput"),
                deps,
                schema(id, field(node, "outputSchema")),
                allowSkipped != null && allowSkipped.asBoolean());
    }

    private OutputSchema schema(String taskId, JsonNode node) {
        if (node == null || node.isNull()) {
            return OutputSchema.EMPTY;
        }
        var fields = new ArrayList<FieldSpec>();
        if (node.isArray()) {
            for (JsonNode f : node) {
                fields.add(fieldSpec(taskId, requireText(f, "name", "output field of task '" + taskId + "'"), f));
            }
        } else if (node.isObject()) {
            // compact form: { gap_name: string, size: {type: number, required: false} }
            node.fields().forEachRemaining(e -> fields.add(fieldSpec(taskId, e.getKey(), e.getValue())));
        }
        try {
            return new OutputSchema(fields);
        } catch (IllegalArgumentException e) {
            throw new PipelineConfigurationException("Task '" + taskId + "': " + e.getMessage(), e);
        }
    }

    private FieldSpec fieldSpec(String taskId, String name, JsonNode node) {
        String typeName = node.isTextual() ? node.asText() : text(node, "type");
        FieldType type = typeName == null ? FieldType.STRING : parseEnum(FieldType.class, typeName,
                "type of field '" + name + "' in task '" + taskId + "'");
        JsonNode required = node.isObject() ? field(node, "required") : null;
        return new FieldSpec(name, type, required == null || required.asBoolean(),
                node.isObject() ? text(node, "description") : null);
    }

    private RunConfig runConfig(JsonNode node, RunConfig defaults) {
        if (node == null || !node.isObject()) {
            return defaults;
        }
        String failurePolicy = text(node, "failurePolicy");
        String schemaPolicy = text(node, "schemaFailurePolicy");
        return new RunConfig(
                failurePolicy == null ? defaults.failurePolicy()
                        : parseEnum(FailurePolicy.class, failurePolicy, "run.failure-policy"),
                intValue(node, defaults.maxWorkers(), "maxWorkers"),
                intValue(node, defaults.maxIterations(), "maxIterations"),
                schemaPolicy == null ? defaults.schemaFailurePolicy()
                        : parseEnum(SchemaFailurePolicy.class, schemaPolicy, "run.schema-failure-policy"),
                intValue(node, defaults.maxSchemaRetries(), "maxSchemaRetries"));
    }

    static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String what) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new PipelineConfigurationException("Invalid " + what + ": '" + value + "'", e);
        }
    }

    /** Looks a key up by its camelCase name, its kebab-case and snake_case forms, then aliases. */
    private static JsonNode field(JsonNode node, String... names) {
        for (String name : names) {
            for (String candidate : List.of(name, kebab(name), kebab(name).replace('-', '_'))) {
                JsonNode value = node.get(candidate);
                if (value != null && !value.isNull()) return value;
            }
        }
        return null;
    }

    private static String kebab(String camel) {
        return camel.replaceAll("([a-z0-9])([A-Z])", "$1-$2").toLowerCase(Locale.ROOT);
    }

    private static String text(JsonNode node, String... names) {
        JsonNode value = field(node, names);
        return value == null ? null : value.asText();
    }

    private static String requireText(JsonNode node, String name, String owner) {
        String value = text(node, name);
        if (value == null || value.isBlank()) {
            throw new PipelineConfigurationException("Missing '" + name + "' for " + owner);
        }
        return value;
    }

    private static int intValue(JsonNode node, int fallback, String... names) {
        JsonNode value = field(node, names);
        return value == null ? fallback : value.asInt(fallback);
    }
}

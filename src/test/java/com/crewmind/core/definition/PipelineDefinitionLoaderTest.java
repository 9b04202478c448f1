package com.crewmind.core.definition;

import com.crewmind.core.engine.PipelineConfigurationException;
import com.crewmind.core.model.FailurePolicy;
import com.crewmind.core.model.FieldSpec;
import com.crewmind.core.model.FieldType;
import com.crewmind.core.model.RunConfig;
import com.crewmind.core.model.SchemaFailurePolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PipelineDefinitionLoaderTest {

    private final PipelineDefinitionLoader loader =
            new PipelineDefinitionLoader(new ObjectMapper(), "openai", "gpt-4o-mini");

    @TempDir
    Path dir;

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }

    @Nested
    @DisplayName("bundled example")
    class Example {

        @Test
        @DisplayName("loads agents, tasks, schemas and run overrides")
        void loadsExample() {
            var loaded = loader.load(Path.of("src/main/resources/pipelines/example-pipeline.yaml"), RunConfig.defaults());
            var def = loaded.definition();

            assertEquals("tourism-market-research", def.name());
            assertEquals(List.of("researcher", "analyst", "strategist"), List.copyOf(def.agents().keySet()));
            assertEquals(Set.of("web_search", "fetch_url"), def.agents().get("researcher").allowedTools());
            assertEquals(6, def.agents().get("researcher").maxIterations());
            assertEquals(0.4, def.agents().get("strategist").model().temperature());
            assertEquals("gpt-4o-mini", def.agents().get("analyst").model().model());

            var analysis = def.tasks().get(1);
            assertEquals(List.of("research"), analysis.dependencies());
            assertEquals(List.of("pain_points", "unmet_needs", "demand_score"),
                    analysis.outputSchema().fields().stream().map(FieldSpec::name).toList());
            assertEquals(FieldType.INTEGER, analysis.outputSchema().fields().get(2).type());
            assertEquals(6, def.tasks().get(0).outputSchema().fields().size());

            assertEquals(FailurePolicy.SKIP_DOWNSTREAM, loaded.runConfig().failurePolicy());
            assertEquals(2, loaded.runConfig().maxWorkers());
        }
    }

    @Nested
    @DisplayName("formats and aliases")
    class Formats {

        @Test
        @DisplayName("reads JSON with camelCase keys, agent list and model shorthand")
        void json() throws IOException {
            var file = write("p.json", """
                    {"name": "json-pipe",
                     "agents": [{"id": "w", "role": "Writer", "goal": "Write", "llm": "ollama/llama3",
                                 "allowedTools": ["read_file"], "maxIter": 2}],
                     "tasks": [{"id": "a", "agent": "w", "instruction": "Write it",
                                "expectedOutput": "A paragraph", "allowSkippedDependencies": true,
                                "outputSchema": [{"name": "body", "type": "string", "required": false}]}]}""");

            var def = loader.load(file, RunConfig.defaults()).definition();
            var agent = def.agents().get("w");
            assertEquals("ollama", agent.model().provider());
            assertEquals("llama3", agent.model().model());
            assertEquals(2, agent.maxIterations());
            var task = def.tasks().get(0);
            assertEquals("A paragraph", task.expectedOutput());
            assertTrue(task.allowSkippedDependencies());
            assertFalse(task.outputSchema().fields().get(0).required());
        }

        @Test
        @DisplayName("accepts crew-style 'context' as dependencies and a single string")
        void contextAlias() throws IOException {
            var file = write("p.yml", """
                    agents:
                      w: { role: R, goal: G }
                    tasks:
                      - { id: a, agent: w, description: First }
                      - { id: b, agent: w, description: Second, context: a }
                    """);

            var def = loader.load(file, RunConfig.defaults()).definition();
            assertEquals(List.of("a"), def.tasks().get(1).dependencies());
            assertEquals("First", def.tasks().get(0).instructionTemplate());
            assertEquals("openai", def.agents().get("w").model().provider());
        }

        @Test
        @DisplayName("run block overrides only the keys it sets")
        void runOverrides() throws IOException {
            var file = write("p.yaml", """
                    run:
                      failure-policy: abort
                      schema-failure-policy: fail
                    agents:
                      w: { role: R, goal: G }
                    tasks:
                      - { id: a, agent: w, instruction: Go }
                    """);
            var defaults = new RunConfig(FailurePolicy.SKIP_DOWNSTREAM, 3, 7, SchemaFailurePolicy.DEGRADE, 2);

            var config = loader.load(file, defaults).runConfig();
            assertEquals(FailurePolicy.ABORT, config.failurePolicy());
            assertEquals(SchemaFailurePolicy.FAIL, config.schemaFailurePolicy());
            assertEquals(3, config.maxWorkers());
            assertEquals(7, config.maxIterations());
            assertEquals(2, config.maxSchemaRetries());
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        @DisplayName("missing file")
        void missingFile() {
            var ex = assertThrows(PipelineConfigurationException.class,
                    () -> loader.load(dir.resolve("nope.yaml"), RunConfig.defaults()));
            assertTrue(ex.getMessage().startsWith("Pipeline file not found"));
        }

        @Test
        @DisplayName("unparseable content")
        void unparseable() throws IOException {
            var file = write("bad.json", "{tasks: [");
            assertThrows(PipelineConfigurationException.class, () -> loader.load(file, RunConfig.defaults()));
        }

        @Test
        @DisplayName("no tasks list")
        void noTasks() throws IOException {
            var file = write("empty.yaml", "name: nothing\n");
            var ex = assertThrows(PipelineConfigurationException.class, () -> loader.load(file, RunConfig.defaults()));
            assertEquals("Pipeline must declare a 'tasks' list", ex.getMessage());
        }

        @Test
        @DisplayName("agent without a role")
        void agentWithoutRole() throws IOException {
            var file = write("p.yaml", """
                    agents:
                      w: { goal: G }
                    tasks:
                      - { id: a, agent: w, instruction: Go }
                    """);
            var ex = assertThrows(PipelineConfigurationException.class, () -> loader.load(file, RunConfig.defaults()));
            assertEquals("Missing 'role' for agent 'w'", ex.getMessage());
        }

        @Test
        @DisplayName("unknown field type and policy names")
        void badEnums() throws IOException {
            var badType = write("t.yaml", """
                    agents:
                      w: { role: R, goal: G }
                    tasks:
                      - id: a
                        agent: w
                        instruction: Go
                        output-schema: { size: decimal }
                    """);
            assertThrows(PipelineConfigurationException.class, () -> loader.load(badType, RunConfig.defaults()));

            var badPolicy = write("r.yaml", """
                    run: { failure-policy: retry-forever }
                    agents:
                      w: { role: R, goal: G }
                    tasks:
                      - { id: a, agent: w, instruction: Go }
                    """);
            var ex = assertThrows(PipelineConfigurationException.class,
                    () -> loader.load(badPolicy, RunConfig.defaults()));
            assertTrue(ex.getMessage().contains("run.failure-policy"));
        }

        @Test
        @DisplayName("duplicate schema field names")
        void duplicateFields() throws IOException {
            var file = write("d.yaml", """
                    agents:
                      w: { role: R, goal: G }
                    tasks:
                      - id: a
                        agent: w
                        instruction: Go
                        output-schema:
                          - { name: x, type: string }
                          - { name: x, type: integer }
                    """);
            var ex = assertThrows(PipelineConfigurationException.class, () -> loader.load(file, RunConfig.defaults()));
            assertTrue(ex.getMessage().startsWith("Task 'a': "));
        }
    }
}

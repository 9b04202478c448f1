package com.crewmind.core.engine;

import com.crewmind.core.llm.LanguageModelRegistry;
import com.crewmind.core.model.PipelineDefinition;
import com.crewmind.core.scheduler.DependencyGraphValidator;
import com.crewmind.core.tool.ToolCatalog;

import java.util.HashSet;
import java.util.List;
import java.util.TreeSet;

/**
 * Checks a pipeline definition before anything runs: graph shape, agent references,
 * placeholder references, tool availability and model providers.
 */
public class PipelineValidator {

    private final DependencyGraphValidator graphValidator;
    private final ToolCatalog toolCatalog;
    private final LanguageModelRegistry models;

    public PipelineValidator(DependencyGraphValidator graphValidator, ToolCatalog toolCatalog,
                             LanguageModelRegistry models) {
        this.graphValidator = graphValidator;
        this.toolCatalog = toolCatalog;
        this.models = models;
    }

    /**
     * @return task ids in execution order
     * @throws PipelineConfigurationException on the first problem found
     */
    public List<String> validate(PipelineDefinition definition) {
        if (definition.tasks().isEmpty()) {
            throw new PipelineConfigurationException("Pipeline '" + definition.name() + "' has no tasks");
        }
        List<String> order = graphValidator.validate(definition.tasks());

        for (var agent : definition.agents().values()) {
            if (agent.model() == null || !models.contains(agent.model().provider())) {
                throw new PipelineConfigurationException("Agent '" + agent.id() + "' uses model provider '"
                        + (agent.model() == null ? null : agent.model().provider())
                        + "' but only " + models.providers() + " are available");
            }
            var missing = new TreeSet<String>();
            for (var toolId : agent.allowedTools()) {
                if (!toolCatalog.contains(toolId)) missing.add(toolId);
            }
            if (!missing.isEmpty()) {
                throw new PipelineConfigurationException("Agent '" + agent.id() + "' allows unknown tool(s) " + missing);
            }
        }

        for (var task : definition.tasks()) {
            if (!definition.agents().containsKey(task.agentId())) {
                throw new PipelineConfigurationException("Task '" + task.id() + "' uses unknown agent '"
                        + task.agentId() + "'");
            }
            var deps = new HashSet<>(task.dependencies());
            for (var ref : InstructionRenderer.referencedTasks(task.instructionTemplate())) {
                if (!deps.contains(ref)) {
                    throw new PipelineConfigurationException("Task '" + task.id() + "' references {{" + ref
                            + "}} but does not depend on it");
                }
            }
        }
        return order;
    }
}

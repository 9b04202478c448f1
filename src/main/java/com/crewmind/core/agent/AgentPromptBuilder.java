package com.crewmind.core.agent;

import com.crewmind.core.model.AgentSpec;
import com.crewmind.core.model.FieldSpec;
import com.crewmind.core.model.OutputSchema;
import com.crewmind.core.model.TaskSpec;
import com.crewmind.core.schema.SchemaViolationException;
import com.crewmind.core.tool.ToolCatalog;

/**
 * Builds the prompts an agent sees: the persona system prompt with the tool
 * protocol, the task message, and the messages that feed tool results back.
 */
public class AgentPromptBuilder {

    private final ToolCatalog catalog;

    public AgentPromptBuilder(ToolCatalog catalog) {
        this.catalog = catalog;
    }

    public String systemPrompt(AgentSpec agent) {
        var sb = new StringBuilder();
        sb.append("You are ").append(agent.role()).append(".\n");
        if (agent.backstory() != null && !agent.backstory().isBlank()) {
            sb.append(agent.backstory().trim()).append("\n");
        }
        sb.append("\nYour goal: ").append(agent.goal()).append("\n\n");

        if (agent.allowedTools().isEmpty()) {
            sb.append("You have no tools. Answer from your own knowledge.\n");
            return sb.toString();
        }

        sb.append("You can use these tools:\n");
        agent.allowedTools().stream().sorted().forEach(id -> catalog.find(id).ifPresent(tool ->
                sb.append("- ").append(tool.id()).append(": ").append(tool.description())
                  .append(". Parameters: ").append(tool.parameterHint()).append("\n")));
        sb.append("""

                To use a tool, reply with only this JSON object and nothing else:
                {"action": "tool", "tool": "<tool id>", "parameters": {...}}
                Request one tool at a time; its result will be sent back to you.
                When you have what you need, reply with your final answer instead of a tool request.
                """);
        return sb.toString();
    }

    public String taskMessage(TaskSpec task, String renderedInstruction) {
        var sb = new StringBuilder(renderedInstruction.trim()).append("\n");
        if (!task.expectedOutput().isBlank()) {
            sb.append("\nExpected output: ").append(task.expectedOutput().trim()).append("\n");
        }
        OutputSchema schema = task.outputSchema();
        if (!schema.isEmpty()) {
            sb.append("\nFormat your final answer as a JSON object with these fields:\n");
            for (FieldSpec field : schema.fields()) {
                sb.append("- ").append(field.name()).append(" (").append(field.type().name().toLowerCase())
                  .append(field.required() ? ", required" : ", optional").append(")");
                if (field.description() != null && !field.description().isBlank()) {
                    sb.append(": ").append(field.description());
                }
                sb.append("\n");
            }
        }
        return sb.toString();
    }

    public String toolResultMessage(String toolId, String output) {
        return "Tool result (" + toolId + "):\n" + output;
    }

    public String toolErrorMessage(String message) {
        return "Tool error: " + message + "\nChoose an allowed tool or give your final answer.";
    }

    public String budgetExhaustedMessage() {
        return "You have used all your tool calls. Give your final answer now without requesting tools.";
    }

    public String schemaCorrectionMessage(SchemaViolationException violation) {
        var sb = new StringBuilder("Your answer did not match the required format:\n");
        violation.getViolations().forEach(v ->
                sb.append("- ").append(v.field()).append(": ").append(v.problem()).append("\n"));
        sb.append("Reply again with a single JSON object containing all required fields.");
        return sb.toString();
    }
}

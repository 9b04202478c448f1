package com.crewmind.core.engine;

import com.crewmind.core.model.TaskSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {{taskId}}} and {@code {{taskId.field}}} placeholders from dependency
 * outputs. Whole outputs and non-string fields are written as JSON with sorted keys.
 * Dependencies not referenced by any placeholder are appended in a context section.
 */
public class InstructionRenderer {

    private static final Logger log = LoggerFactory.getLogger(InstructionRenderer.class);

    static final Pattern PLACEHOLDER =
            Pattern.compile("\\{\\{\\s*([A-Za-z0-9_\\-]+)(?:\\.([A-Za-z0-9_\\-]+))?\\s*}}");

    private final ObjectMapper canonical;

    public InstructionRenderer(ObjectMapper objectMapper) {
        this.canonical = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    /** Task ids referenced by placeholders in {@code template}. */
    public static Set<String> referencedTasks(String template) {
        var ids = new LinkedHashSet<String>();
        if (template == null) return ids;
        Matcher m = PLACEHOLDER.matcher(template);
        while (m.find()) {
            ids.add(m.group(1));
        }
        return ids;
    }

    public String render(TaskSpec task, Map<String, Map<String, Object>> context) {
        String template = task.instructionTemplate();
        Set<String> referenced = referencedTasks(template);

        Matcher m = PLACEHOLDER.matcher(template);
        var sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(resolve(task.id(), m.group(1), m.group(2), context)));
        }
        m.appendTail(sb);

        var unreferenced = context.keySet().stream().filter(id -> !referenced.contains(id)).toList();
        if (!unreferenced.isEmpty()) {
            sb.append("\n\nContext from previous tasks:");
            for (var id : unreferenced) {
                sb.append("\n\n### ").append(id).append('\n').append(toJson(context.get(id)));
            }
        }
        return sb.toString();
    }

    private String resolve(String taskId, String depId, String field, Map<String, Map<String, Object>> context) {
        var output = context.get(depId);
        if (output == null) {
            log.warn("Task '{}' references '{}' which has no committed output", taskId, depId);
            return "";
        }
        if (field == null) {
            return toJson(output);
        }
        Object value = output.get(field);
        if (value == null) {
            log.warn("Task '{}' references missing field '{}.{}'", taskId, depId, field);
            return "";
        }
        return value instanceof String s ? s : toJson(value);
    }

    String toJson(Object value) {
        try {
            return canonical.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Context value is not serializable: " + e.getMessage(), e);
        }
    }
}

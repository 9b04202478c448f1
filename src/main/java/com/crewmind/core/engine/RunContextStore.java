package com.crewmind.core.engine;

import com.crewmind.core.model.TaskSpec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-run store of committed task outputs keyed by task id.
 * A task sees only the outputs of its declared dependencies.
 */
public class RunContextStore {

    private final Map<String, Map<String, Object>> outputs = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException when the task already committed an output
     */
    public void commit(String taskId, Map<String, Object> output) {
        var copy = Collections.unmodifiableMap(new LinkedHashMap<>(output));
        if (outputs.putIfAbsent(taskId, copy) != null) {
            throw new IllegalStateException("Output of task '" + taskId + "' already committed");
        }
    }

    /** Outputs of {@code task}'s dependencies, in declaration order; skipped dependencies are absent. */
    public Map<String, Map<String, Object>> viewFor(TaskSpec task) {
        var view = new LinkedHashMap<String, Map<String, Object>>();
        for (var dep : task.dependencies()) {
            var output = outputs.get(dep);
            if (output != null) {
                view.put(dep, output);
            }
        }
        return Collections.unmodifiableMap(view);
    }

    public boolean contains(String taskId) {
        return outputs.containsKey(taskId);
    }
}

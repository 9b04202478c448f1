package com.crewmind.core.scheduler;

import com.crewmind.core.model.TaskSpec;
import com.crewmind.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes which pending tasks may be dispatched next, based on the terminal
 * states of their dependencies and the number of free worker slots.
 */
@Component
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    /**
     * Compute the next wave of task ids eligible for dispatch.
     *
     * @param tasks    all tasks of the pipeline, in declaration order
     * @param statuses current status of every task
     * @param limit    free worker slots
     * @return eligible task ids in declaration order; empty when nothing can start yet
     */
    public List<String> computeNextWave(List<TaskSpec> tasks, Map<String, TaskStatus> statuses, int limit) {
        var wave = new ArrayList<String>();
        for (var task : tasks) {
            if (wave.size() >= limit) break;
            if (statuses.get(task.id()) != TaskStatus.PENDING) {
                continue;
            }
            if (!allDependenciesSatisfied(task, statuses)) {
                log.debug("  {} [{}] deps unsatisfied: {}", task.id(), task.agentId(), task.dependencies());
                continue;
            }
            wave.add(task.id());
        }
        if (!wave.isEmpty()) {
            log.debug("Next wave (limit {}): {}", limit, wave);
        }
        return wave;
    }

    /**
     * Finds pending tasks that can never start because a dependency ended in a
     * state the task does not accept.
     *
     * @return task id → reason, in declaration order
     */
    public Map<String, String> findBlocked(List<TaskSpec> tasks, Map<String, TaskStatus> statuses) {
        var blocked = new LinkedHashMap<String, String>();
        for (var task : tasks) {
            if (statuses.get(task.id()) != TaskStatus.PENDING) continue;
            for (var dep : task.dependencies()) {
                var depStatus = statuses.get(dep);
                if (depStatus == TaskStatus.FAILED) {
                    blocked.put(task.id(), "dependency '" + dep + "' failed");
                    break;
                }
                if (depStatus == TaskStatus.SKIPPED && !task.allowSkippedDependencies()) {
                    blocked.put(task.id(), "dependency '" + dep + "' was skipped");
                    break;
                }
            }
        }
        return blocked;
    }

    private boolean allDependenciesSatisfied(TaskSpec task, Map<String, TaskStatus> statuses) {
        for (var dep : task.dependencies()) {
            var depStatus = statuses.get(dep);
            if (depStatus == TaskStatus.SUCCEEDED) continue;
            if (depStatus == TaskStatus.SKIPPED && task.allowSkippedDependencies()) continue;
            return false;
        }
        return true;
    }
}

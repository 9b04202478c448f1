package com.crewmind.core.scheduler;

import com.crewmind.core.engine.PipelineConfigurationException;
import com.crewmind.core.model.TaskSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Checks that the task graph is a DAG over known task ids and produces a
 * topological order that keeps declaration order among independent tasks.
 */
@Component
public class DependencyGraphValidator {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphValidator.class);

    /**
     * @return task ids in a valid execution order
     * @throws PipelineConfigurationException   on blank or duplicate task ids
     * @throws UnknownDependencyException       when a dependency names a missing task
     * @throws CyclicDependencyException        when the graph has a cycle
     */
    public List<String> validate(List<TaskSpec> tasks) {
        var taskMap = new LinkedHashMap<String, TaskSpec>();
        for (var task : tasks) {
            if (task.id() == null || task.id().isBlank()) {
                throw new PipelineConfigurationException("Task with blank id");
            }
            if (taskMap.put(task.id(), task) != null) {
                throw new PipelineConfigurationException("Duplicate task id: " + task.id());
            }
        }

        var indegree = new HashMap<String, Integer>();
        var downstream = new HashMap<String, List<String>>();
        for (var id : taskMap.keySet()) {
            indegree.put(id, 0);
            downstream.put(id, new ArrayList<>());
        }

        for (var task : taskMap.values()) {
            for (var dep : new LinkedHashSet<>(task.dependencies())) {
                if (!taskMap.containsKey(dep)) {
                    throw new UnknownDependencyException(task.id(), dep);
                }
                if (dep.equals(task.id())) {
                    throw new CyclicDependencyException(List.of(task.id()));
                }
                indegree.merge(task.id(), 1, Integer::sum);
                downstream.get(dep).add(task.id());
            }
        }

        // Kahn's algorithm; the ready queue is re-sorted by declaration index so that
        // a plain chain comes out in declaration order.
        var declarationIndex = new HashMap<String, Integer>();
        int i = 0;
        for (var id : taskMap.keySet()) {
            declarationIndex.put(id, i++);
        }
        var ready = new ArrayDeque<String>();
        for (var id : taskMap.keySet()) {
            if (indegree.get(id) == 0) ready.add(id);
        }

        var order = new ArrayList<String>();
        while (!ready.isEmpty()) {
            String id = ready.removeFirst();
            order.add(id);
            var released = new ArrayList<String>();
            for (var next : downstream.get(id)) {
                if (indegree.merge(next, -1, Integer::sum) == 0) {
                    released.add(next);
                }
            }
            released.sort((a, b) -> Integer.compare(declarationIndex.get(a), declarationIndex.get(b)));
            ready.addAll(released);
        }

        if (order.size() < taskMap.size()) {
            var cyclic = taskMap.keySet().stream()
                    .filter(id -> indegree.get(id) > 0)
                    .toList();
            log.warn("Dependency cycle detected among {}", cyclic);
            throw new CyclicDependencyException(cyclic);
        }

        log.debug("Execution order: {}", order);
        return order;
    }
}

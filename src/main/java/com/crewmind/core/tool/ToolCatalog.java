package com.crewmind.core.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of every tool available to agents, keyed by tool id.
 * Built-in tools are registered directly; {@link ToolSource}s are asked once at construction.
 */
public class ToolCatalog {

    private static final Logger log = LoggerFactory.getLogger(ToolCatalog.class);

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();

    public ToolCatalog(List<Tool> builtins, List<ToolSource> sources) {
        builtins.forEach(this::register);
        for (var source : sources) {
            try {
                var discovered = source.discover();
                discovered.forEach(this::register);
                log.info("Tool source '{}' contributed {} tool(s)", source.name(), discovered.size());
            } catch (RuntimeException e) {
                log.warn("Tool source '{}' discovery failed: {}", source.name(), e.getMessage());
            }
        }
        log.info("Tool catalog ready: {}", new TreeMap<>(tools).keySet());
    }

    public static ToolCatalog of(Tool... tools) {
        return new ToolCatalog(List.of(tools), List.of());
    }

    public void register(Tool tool) {
        var previous = tools.put(tool.id(), tool);
        if (previous != null && previous != tool) {
            log.warn("Tool '{}' registered twice; keeping the latest", tool.id());
        }
    }

    public Optional<Tool> find(String toolId) {
        return toolId == null ? Optional.empty() : Optional.ofNullable(tools.get(toolId));
    }

    public boolean contains(String toolId) {
        return toolId != null && tools.containsKey(toolId);
    }

    public Collection<Tool> all() {
        return Collections.unmodifiableCollection(new TreeMap<>(tools).values());
    }
}

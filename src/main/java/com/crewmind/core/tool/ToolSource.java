package com.crewmind.core.tool;

import java.util.List;

/**
 * Contributes dynamically discovered tools (e.g. from remote MCP servers) to the {@link ToolCatalog}.
 */
public interface ToolSource {

    String name();

    List<Tool> discover();
}

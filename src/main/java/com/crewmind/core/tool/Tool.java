package com.crewmind.core.tool;

import java.util.Map;

/**
 * An external capability an agent can invoke with a flat parameter map.
 */
public interface Tool {

    /** Unique id agents use to request the tool, e.g. {@code web_search}. */
    String id();

    /** One-line description shown to the model. */
    String description();

    /** Example parameter object shown to the model, e.g. {@code {"query": "..."}}. */
    default String parameterHint() {
        return "{}";
    }

    /**
     * Performs the call.
     *
     * @return response text handed back to the agent
     * @throws Exception any failure; the invoker retries and wraps it
     */
    String invoke(Map<String, Object> parameters) throws Exception;
}

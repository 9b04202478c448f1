package com.crewmind.core.model;

import java.io.Serializable;

/**
 * Language model binding for an agent.
 *
 * @param provider        provider name resolved through the language model registry (e.g. "openai")
 * @param model           model name passed to the provider; blank means the provider default
 * @param temperature     sampling temperature, null for the provider default
 * @param maxOutputTokens upper bound on completion size, null for the provider default
 */
public record ModelConfig(
    String provider,
    String model,
    Double temperature,
    Integer maxOutputTokens
) implements Serializable {

    public static ModelConfig defaults(String provider) {
        return new ModelConfig(provider, "", null, null);
    }
}

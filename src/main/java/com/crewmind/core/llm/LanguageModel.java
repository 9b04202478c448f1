package com.crewmind.core.llm;

/**
 * Port to a chat-completion provider. Implementations are stateless and thread-safe.
 */
public interface LanguageModel {

    /** Provider name agents refer to in their model binding, e.g. {@code openai}. */
    String provider();

    /**
     * @return the completion text, never blank
     * @throws LlmEmptyResponseException when the provider returns no content
     */
    String complete(ModelRequest request);
}

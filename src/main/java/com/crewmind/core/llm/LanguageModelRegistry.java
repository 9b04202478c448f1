package com.crewmind.core.llm;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Looks up {@link LanguageModel}s by provider name (case-insensitive).
 */
public class LanguageModelRegistry {

    private final Map<String, LanguageModel> models = new TreeMap<>();

    public LanguageModelRegistry(List<LanguageModel> languageModels) {
        for (var model : languageModels) {
            models.put(model.provider().toLowerCase(Locale.ROOT), model);
        }
    }

    public Optional<LanguageModel> find(String provider) {
        if (provider == null) return Optional.empty();
        return Optional.ofNullable(models.get(provider.toLowerCase(Locale.ROOT)));
    }

    public boolean contains(String provider) {
        return find(provider).isPresent();
    }

    public Set<String> providers() {
        return Collections.unmodifiableSet(models.keySet());
    }
}

package com.phillippitts.wordassist.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Provider section of the configuration: active provider, per-provider state and fallback order.
 *
 * @param provider      active provider id
 * @param models        per-provider state keyed by provider id, in registry order
 * @param fallbackOrder providers to try after the active one
 */
public record AiConfig(String provider, Map<String, ModelState> models, List<String> fallbackOrder) {

    public AiConfig {
        Objects.requireNonNull(provider, "provider must not be null");
        models = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(models, "models")));
        fallbackOrder = List.copyOf(Objects.requireNonNull(fallbackOrder, "fallbackOrder"));
    }

    public Optional<ModelState> model(String providerId) {
        return Optional.ofNullable(models.get(providerId));
    }

    public AiConfig withProvider(String newProvider) {
        return new AiConfig(newProvider, models, fallbackOrder);
    }

    public AiConfig withFallbackOrder(List<String> newOrder) {
        return new AiConfig(provider, models, newOrder);
    }

    /** Returns a copy with the state of one provider replaced (or added). */
    public AiConfig withModel(String providerId, ModelState state) {
        Map<String, ModelState> copy = new LinkedHashMap<>(models);
        copy.put(providerId, state);
        return new AiConfig(provider, copy, fallbackOrder);
    }
}

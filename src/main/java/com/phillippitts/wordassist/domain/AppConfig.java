package com.phillippitts.wordassist.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the persisted configuration blob.
 *
 * <p>Only {@code aiConfig} is interpreted here. Every other top-level section (prompt templates,
 * note-taking settings, UI preferences) is kept in {@code sections} as plain JSON-compatible
 * values (maps, lists, strings, numbers, booleans) and written back unmodified.
 *
 * @param version  schema version of the blob
 * @param aiConfig provider configuration
 * @param sections pass-through sections keyed by top-level name
 */
public record AppConfig(String version, AiConfig aiConfig, Map<String, Object> sections) {

    public AppConfig {
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(aiConfig, "aiConfig must not be null");
        sections = sections == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(sections));
    }

    public AppConfig withAiConfig(AiConfig newAiConfig) {
        return new AppConfig(version, newAiConfig, sections);
    }

    public AppConfig withVersion(String newVersion) {
        return new AppConfig(newVersion, aiConfig, sections);
    }

    public AppConfig withSection(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(sections);
        copy.put(name, value);
        return new AppConfig(version, aiConfig, copy);
    }
}

package com.phillippitts.wordassist.service.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.wordassist.domain.AiConfig;
import com.phillippitts.wordassist.domain.AppConfig;
import com.phillippitts.wordassist.domain.ModelState;
import com.phillippitts.wordassist.service.provider.ProviderDescriptor;
import com.phillippitts.wordassist.service.provider.ProviderRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds default configs, migrates stored documents to the current schema and normalizes
 * configs before they are persisted or handed to callers.
 *
 * <p>Migration starts from a fresh default config and overlays the stored values field by field.
 * Legacy provider ids are canonicalized first; ids unknown to the registry are dropped. Migrating
 * an already-current document only re-stamps the version, so migration is idempotent.
 */
@Component
public class ConfigMigrator {

    /** Schema version written by this code. */
    public static final String CURRENT_VERSION = "3.0";

    private final ProviderRegistry registry;
    private final ConfigCodec codec;

    public ConfigMigrator(ProviderRegistry registry, ConfigCodec codec) {
        this.registry = Objects.requireNonNull(registry);
        this.codec = Objects.requireNonNull(codec);
    }

    /**
     * Config used when storage is empty: default provider, one fresh state per provider,
     * registry fallback order, no pass-through sections.
     */
    public AppConfig defaultConfig() {
        Map<String, ModelState> models = new LinkedHashMap<>();
        for (ProviderDescriptor descriptor : registry.getAll()) {
            models.put(descriptor.id(), ModelState.initial(descriptor.defaultApiUrl()));
        }
        AiConfig ai = new AiConfig(registry.defaultProviderId(), models, registry.defaultFallbackOrder());
        return new AppConfig(CURRENT_VERSION, ai, Map.of());
    }

    /** Whether the stored document was written by another schema version. */
    public boolean needsMigration(ObjectNode root) {
        return !CURRENT_VERSION.equals(root.path(ConfigCodec.VERSION).asText(""));
    }

    /**
     * Migrates a stored document of any version to the current schema. API keys are copied as
     * stored (still encrypted).
     *
     * @param root stored document
     * @return config in the current schema
     */
    public AppConfig migrate(ObjectNode root) {
        AppConfig defaults = defaultConfig();
        JsonNode oldAi = root.path(ConfigCodec.AI_CONFIG);

        Map<String, ModelState> models = new LinkedHashMap<>(defaults.aiConfig().models());
        JsonNode oldModels = oldAi.path(ConfigCodec.MODELS);
        // Exact ids are applied after aliases so that "google" wins over a leftover "gemini"
        mergeModels(models, oldModels, true);
        mergeModels(models, oldModels, false);

        String provider = canonicalProvider(oldAi.path(ConfigCodec.PROVIDER).asText(""));
        List<String> order = normalizeOrder(codec.readTextArray(oldAi.path(ConfigCodec.FALLBACK_ORDER)));

        return new AppConfig(CURRENT_VERSION, new AiConfig(provider, models, order), codec.readSections(root));
    }

    /**
     * Enforces the config invariants: canonical known active provider, exactly one state per
     * registered provider (in registry order), and a complete deduplicated fallback order.
     *
     * @param config config to normalize
     * @return normalized copy stamped with the current version
     */
    public AppConfig normalize(AppConfig config) {
        AiConfig ai = config.aiConfig();
        Map<String, ModelState> models = new LinkedHashMap<>();
        for (ProviderDescriptor descriptor : registry.getAll()) {
            ModelState state = ai.models().get(descriptor.id());
            if (state == null) {
                state = aliasedState(ai.models(), descriptor.id());
            }
            if (state == null) {
                state = ModelState.initial(descriptor.defaultApiUrl());
            } else if (state.apiUrl().isBlank()) {
                state = state.withApiUrl(descriptor.defaultApiUrl());
            }
            models.put(descriptor.id(), state);
        }
        AiConfig normalized = new AiConfig(canonicalProvider(ai.provider()), models, normalizeOrder(ai.fallbackOrder()));
        return new AppConfig(CURRENT_VERSION, normalized, config.sections());
    }

    /**
     * Canonicalizes ids, drops unknown ones and duplicates (first occurrence wins), then appends
     * every missing registry id in registry order.
     */
    public List<String> normalizeOrder(List<String> ids) {
        Set<String> ordered = new LinkedHashSet<>();
        for (String id : ids) {
            registry.find(id).ifPresent(descriptor -> ordered.add(descriptor.id()));
        }
        ordered.addAll(registry.defaultFallbackOrder());
        return new ArrayList<>(ordered);
    }

    private String canonicalProvider(String id) {
        return registry.find(id).map(ProviderDescriptor::id).orElse(registry.defaultProviderId());
    }

    private void mergeModels(Map<String, ModelState> target, JsonNode oldModels, boolean aliasesOnly) {
        if (!oldModels.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> entries = oldModels.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String storedId = entry.getKey();
            String canonical = registry.canonicalize(storedId);
            boolean isAlias = !canonical.equals(storedId);
            if (isAlias != aliasesOnly || !target.containsKey(canonical)) {
                continue;
            }
            target.put(canonical, codec.mergeModelState(target.get(canonical), entry.getValue()));
        }
    }

    private ModelState aliasedState(Map<String, ModelState> models, String canonicalId) {
        for (Map.Entry<String, ModelState> entry : models.entrySet()) {
            if (registry.canonicalize(entry.getKey()).equals(canonicalId)) {
                return entry.getValue();
            }
        }
        return null;
    }
}

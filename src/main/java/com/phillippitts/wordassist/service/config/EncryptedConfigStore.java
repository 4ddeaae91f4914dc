package com.phillippitts.wordassist.service.config;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.wordassist.domain.AiConfig;
import com.phillippitts.wordassist.domain.AppConfig;
import com.phillippitts.wordassist.domain.ModelState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Versioned configuration store with per-provider encrypted API keys.
 *
 * <p>{@code load}: read blob, migrate when the version differs (and write the migrated blob back),
 * decrypt each provider's key. {@code save}: normalize, encrypt each key, write. Plaintext keys are
 * never written; a key that cannot be decrypted is returned as "".
 */
@Component
public class EncryptedConfigStore {

    private static final Logger LOG = LogManager.getLogger(EncryptedConfigStore.class);

    private final ConfigBlobStore blobStore;
    private final ConfigCodec codec;
    private final ConfigMigrator migrator;
    private final ApiKeyCipher cipher;

    public EncryptedConfigStore(ConfigBlobStore blobStore, ConfigCodec codec,
                                ConfigMigrator migrator, ApiKeyCipher cipher) {
        this.blobStore = Objects.requireNonNull(blobStore);
        this.codec = Objects.requireNonNull(codec);
        this.migrator = Objects.requireNonNull(migrator);
        this.cipher = Objects.requireNonNull(cipher);
    }

    /**
     * Loads the configuration with plaintext API keys.
     *
     * <p>An empty store is initialized with {@link #getDefaultConfig()}. A blob that is not a JSON
     * object is logged and replaced by the defaults in memory; it is overwritten on the next save.
     *
     * @return normalized configuration in the current schema
     */
    public AppConfig load() {
        Optional<String> blob = blobStore.read();
        if (blob.isEmpty()) {
            AppConfig defaults = getDefaultConfig();
            blobStore.write(codec.encode(defaults));
            LOG.info("Created default configuration at {}", blobStore.describe());
            return defaults;
        }

        Optional<ObjectNode> root = codec.parse(blob.get());
        if (root.isEmpty()) {
            LOG.error("Ignoring unreadable configuration at {}; using defaults", blobStore.describe());
            return getDefaultConfig();
        }

        AppConfig stored = migrator.migrate(root.get());
        if (migrator.needsMigration(root.get())) {
            blobStore.write(codec.encode(stored));
            LOG.info("Migrated configuration from version {} to {}",
                    root.get().path(ConfigCodec.VERSION).asText("none"), ConfigMigrator.CURRENT_VERSION);
        }
        return transformKeys(stored, this::decryptOrEmpty);
    }

    /**
     * Normalizes and persists a configuration holding plaintext API keys.
     *
     * @param config configuration to save
     * @return the normalized configuration, with plaintext keys, as now persisted
     */
    public AppConfig save(AppConfig config) {
        AppConfig normalized = migrator.normalize(config);
        blobStore.write(codec.encode(transformKeys(normalized, cipher::encrypt)));
        return normalized;
    }

    public AppConfig getDefaultConfig() {
        return migrator.defaultConfig();
    }

    private String decryptOrEmpty(String ciphertext, String providerId) {
        String plaintext = cipher.decrypt(ciphertext, providerId);
        if (plaintext == null) {
            LOG.warn("Stored API key for provider {} is unreadable; treating it as not configured", providerId);
            return "";
        }
        return plaintext;
    }

    private static AppConfig transformKeys(AppConfig config, BiFunction<String, String, String> transform) {
        AiConfig ai = config.aiConfig();
        Map<String, ModelState> models = new LinkedHashMap<>();
        ai.models().forEach((id, state) -> models.put(id, state.withApiKey(transform.apply(state.apiKey(), id))));
        return config.withAiConfig(new AiConfig(ai.provider(), models, ai.fallbackOrder()));
    }
}

package com.phillippitts.wordassist.service.provider;

import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one AI provider, defined at startup and never mutated.
 *
 * @param id              canonical provider id
 * @param label           display label, also used in error messages
 * @param mode            wire-format family
 * @param defaultModel    model used when the user has no override
 * @param testModel       model used when neither an override nor a default is available
 * @param supportedModels models offered for selection
 * @param baseUrl         API base URL without trailing slash
 * @param encryptionSalt  16-byte PBKDF2 salt for this provider's API key
 * @param hostPermissions network origins the provider needs
 * @param retryPolicy     retry policy for calls to this provider
 * @param healthCheck     probe used by connection tests
 */
public record ProviderDescriptor(
        String id,
        String label,
        CompatibilityMode mode,
        String defaultModel,
        String testModel,
        List<String> supportedModels,
        String baseUrl,
        byte[] encryptionSalt,
        List<String> hostPermissions,
        RetryPolicy retryPolicy,
        HealthCheck healthCheck
) {

    public static final int SALT_LENGTH = 16;

    public ProviderDescriptor {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(encryptionSalt, "encryptionSalt must not be null");
        if (encryptionSalt.length != SALT_LENGTH) {
            throw new IllegalArgumentException(
                    "Salt for provider " + id + " must be " + SALT_LENGTH + " bytes, got: " + encryptionSalt.length);
        }
        encryptionSalt = encryptionSalt.clone();
        supportedModels = List.copyOf(supportedModels);
        hostPermissions = List.copyOf(hostPermissions);
        Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        Objects.requireNonNull(healthCheck, "healthCheck must not be null");
    }

    /** Returns a copy; the salt itself is never exposed. */
    @Override
    public byte[] encryptionSalt() {
        return encryptionSalt.clone();
    }

    /** API URL stored in a fresh model state, e.g. {@code {baseUrl}/models} for Google. */
    public String defaultApiUrl() {
        return baseUrl + mode.wireFormat().apiUrlSuffix();
    }
}

package com.phillippitts.wordassist.service.config;

import com.phillippitts.wordassist.config.properties.ConfigStoreProperties;
import com.phillippitts.wordassist.exception.ApiKeyCryptoException;
import com.phillippitts.wordassist.service.provider.ProviderDescriptor;
import com.phillippitts.wordassist.service.provider.ProviderRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Encrypts API keys at rest with a key derived per provider.
 *
 * <p>Key derivation: PBKDF2WithHmacSHA256 over the configured passphrase and the provider's
 * 16-byte salt, 100,000 iterations, 256-bit AES key. Encryption: AES/GCM/NoPadding with a random
 * 12-byte IV and a 128-bit tag. Stored form: {@code base64(iv || ciphertext)}.
 *
 * <p>Because salts differ per provider, a key encrypted for one provider does not decrypt under
 * another. Provider ids are canonicalized first, so legacy aliases share the canonical salt.
 *
 * <p>Derived keys and decrypted values are memoized in this instance; the bean is a singleton.
 */
@Component
public class ApiKeyCipher {

    private static final Logger LOG = LogManager.getLogger(ApiKeyCipher.class);

    static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";
    static final int KDF_ITERATIONS = 100_000;
    static final int KEY_BITS = 256;
    static final String CIPHER_ALGORITHM = "AES/GCM/NoPadding";
    static final int IV_LENGTH = 12;
    static final int TAG_BITS = 128;

    private static final int MAX_MEMOIZED = 64;

    private final ProviderRegistry registry;
    private final char[] passphrase;
    private final SecureRandom random = new SecureRandom();
    private final Map<String, SecretKey> derivedKeys = new ConcurrentHashMap<>();
    private final Map<String, String> decrypted = new ConcurrentHashMap<>();

    public ApiKeyCipher(ProviderRegistry registry, ConfigStoreProperties props) {
        this.registry = Objects.requireNonNull(registry);
        this.passphrase = props.getPassphrase().toCharArray();
    }

    /**
     * Encrypts a plaintext key for a provider.
     *
     * @param plaintext  API key; null or empty yields ""
     * @param providerId provider id or legacy alias
     * @return base64 of IV followed by ciphertext
     * @throws ApiKeyCryptoException if the provider is unknown or the JCE rejects the operation
     */
    public String encrypt(String plaintext, String providerId) {
        if (plaintext == null || plaintext.isEmpty()) {
            return "";
        }
        try {
            byte[] iv = new byte[IV_LENGTH];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, keyFor(providerId), new GCMParameterSpec(TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            byte[] out = ByteBuffer.allocate(iv.length + sealed.length).put(iv).put(sealed).array();
            return Base64.getEncoder().encodeToString(out);
        } catch (GeneralSecurityException e) {
            throw new ApiKeyCryptoException("Failed to encrypt API key", providerId, e);
        }
    }

    /**
     * Decrypts a stored key for a provider. Never throws.
     *
     * @param ciphertext stored value; null or blank yields ""
     * @param providerId provider id or legacy alias
     * @return plaintext key, or null when the value is corrupt, was encrypted for another
     *         provider, or the provider is unknown
     */
    public String decrypt(String ciphertext, String providerId) {
        if (ciphertext == null || ciphertext.isBlank()) {
            return "";
        }
        String memoKey = registry.canonicalize(providerId) + ':' + ciphertext;
        String memo = decrypted.get(memoKey);
        if (memo != null) {
            return memo;
        }
        try {
            byte[] raw = Base64.getDecoder().decode(ciphertext.trim());
            if (raw.length <= IV_LENGTH) {
                LOG.warn("Stored API key for provider {} is too short to be valid", providerId);
                return null;
            }
            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, keyFor(providerId), new GCMParameterSpec(TAG_BITS, raw, 0, IV_LENGTH));
            byte[] plain = cipher.doFinal(raw, IV_LENGTH, raw.length - IV_LENGTH);
            String result = new String(plain, StandardCharsets.UTF_8);
            remember(memoKey, result);
            return result;
        } catch (IllegalArgumentException | GeneralSecurityException | ApiKeyCryptoException e) {
            LOG.warn("Could not decrypt API key for provider {}: {}", providerId, e.getClass().getSimpleName());
            return null;
        }
    }

    private SecretKey keyFor(String providerId) {
        String canonical = registry.canonicalize(providerId);
        ProviderDescriptor descriptor = registry.find(canonical)
                .orElseThrow(() -> new ApiKeyCryptoException("No encryption salt for provider", providerId, null));
        return derivedKeys.computeIfAbsent(canonical, id -> derive(descriptor));
    }

    private SecretKey derive(ProviderDescriptor descriptor) {
        PBEKeySpec spec = new PBEKeySpec(passphrase, descriptor.encryptionSalt(), KDF_ITERATIONS, KEY_BITS);
        try {
            byte[] keyBytes = SecretKeyFactory.getInstance(KDF_ALGORITHM).generateSecret(spec).getEncoded();
            return new SecretKeySpec(keyBytes, "AES");
        } catch (GeneralSecurityException e) {
            throw new ApiKeyCryptoException("Key derivation failed", descriptor.id(), e);
        } finally {
            spec.clearPassword();
        }
    }

    private void remember(String memoKey, String plaintext) {
        if (decrypted.size() >= MAX_MEMOIZED) {
            decrypted.clear();
        }
        decrypted.put(memoKey, plaintext);
    }
}

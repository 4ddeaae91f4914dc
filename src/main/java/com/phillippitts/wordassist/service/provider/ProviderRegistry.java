package com.phillippitts.wordassist.service.provider;

import com.phillippitts.wordassist.config.properties.OrchestrationProperties;
import com.phillippitts.wordassist.exception.ProviderConfigurationException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Static catalog of the supported AI providers.
 *
 * <p>Registry order ({@code google}, {@code openai}, {@code anthropic}, then the OpenAI-compatible
 * {@code groq}, {@code deepseek}, {@code zhipu}, {@code qwen} and {@code moonshot}) is the built-in
 * fallback order.
 * Historical provider ids are mapped to canonical ids through a fixed alias table so that configs
 * and ciphertexts written by older versions keep working.
 */
@Component
public class ProviderRegistry {

    /** Origin of the local note-taking bridge, always required alongside provider origins. */
    public static final String LOCAL_BRIDGE_PERMISSION = "http://127.0.0.1:8765/*";

    private static final byte[] GOOGLE_SALT = salt(
            18, 24, 193, 131, 8, 11, 20, 153, 22, 163, 3, 19, 84, 134, 103, 174);
    private static final byte[] OPENAI_SALT = salt(
            45, 67, 89, 12, 34, 56, 78, 90, 123, 145, 167, 189, 211, 233, 255, 21);
    private static final byte[] ANTHROPIC_SALT = salt(
            98, 76, 54, 32, 10, 87, 65, 43, 21, 99, 77, 55, 33, 11, 89, 67);
    private static final byte[] GROQ_SALT = salt(
            99, 88, 77, 66, 55, 44, 33, 22, 11, 21, 31, 41, 51, 61, 71, 81);
    private static final byte[] DEEPSEEK_SALT = salt(
            56, 12, 89, 34, 45, 67, 78, 90, 11, 22, 33, 44, 55, 66, 77, 88);
    private static final byte[] ZHIPU_SALT = salt(
            180, 247, 26, 199, 88, 28, 151, 70, 118, 55, 169, 193, 25, 248, 252, 199);
    private static final byte[] QWEN_SALT = salt(
            11, 22, 33, 44, 55, 66, 77, 88, 99, 10, 20, 30, 40, 50, 60, 70);
    private static final byte[] MOONSHOT_SALT = salt(
            13, 24, 35, 46, 57, 68, 79, 80, 91, 12, 23, 34, 45, 56, 67, 78);

    private static final Map<String, String> ALIASES = Map.of(
            "gemini", ProviderIds.GOOGLE,
            "claude", ProviderIds.ANTHROPIC,
            "chatgpt", ProviderIds.OPENAI,
            "gpt", ProviderIds.OPENAI);

    private final Map<String, ProviderDescriptor> providers;

    public ProviderRegistry(OrchestrationProperties props) {
        OrchestrationProperties.Retry retry = props.getRetry();
        RetryPolicy retryPolicy = new RetryPolicy(
                retry.getMaxAttempts(), retry.getBaseDelayMs(), retry.getBackoffFactor());

        Map<String, ProviderDescriptor> ordered = new LinkedHashMap<>();
        register(ordered, new ProviderDescriptor(
                ProviderIds.GOOGLE,
                "Google Gemini",
                CompatibilityMode.GOOGLE_GENERATIVE,
                "gemini-3-flash-preview",
                "gemini-2.5-flash",
                List.of("gemini-3-pro-preview", "gemini-3-flash-preview", "gemini-2.5-flash"),
                "https://generativelanguage.googleapis.com/v1beta",
                GOOGLE_SALT,
                List.of("https://generativelanguage.googleapis.com/*"),
                retryPolicy,
                HealthCheck.DEFAULT));
        register(ordered, new ProviderDescriptor(
                ProviderIds.OPENAI,
                "OpenAI GPT",
                CompatibilityMode.OPENAI_LIKE,
                "gpt-5.2",
                "gpt-5-mini",
                List.of("gpt-5.2", "gpt-5-mini", "o3-mini"),
                "https://api.openai.com/v1",
                OPENAI_SALT,
                List.of("https://api.openai.com/*"),
                retryPolicy,
                HealthCheck.DEFAULT));
        register(ordered, new ProviderDescriptor(
                ProviderIds.ANTHROPIC,
                "Anthropic Claude",
                CompatibilityMode.ANTHROPIC_MESSAGES,
                "claude-opus-4-6",
                "claude-haiku-4-5",
                List.of("claude-opus-4-6", "claude-sonnet-4-5", "claude-haiku-4-5"),
                "https://api.anthropic.com/v1",
                ANTHROPIC_SALT,
                List.of("https://api.anthropic.com/*"),
                retryPolicy,
                HealthCheck.DEFAULT));
        register(ordered, openAiCompatible(ProviderIds.GROQ, "Groq",
                "llama-3.3-70b-versatile", "llama-3.1-8b-instant",
                List.of("llama-3.3-70b-versatile", "llama-3.1-8b-instant", "mixtral-8x7b-32768", "gemma2-9b-it"),
                "https://api.groq.com/openai/v1", GROQ_SALT, "https://api.groq.com/*", retryPolicy));
        register(ordered, openAiCompatible(ProviderIds.DEEPSEEK, "DeepSeek",
                "deepseek-chat", "deepseek-chat",
                List.of("deepseek-chat", "deepseek-reasoner"),
                "https://api.deepseek.com", DEEPSEEK_SALT, "https://api.deepseek.com/*", retryPolicy));
        register(ordered, openAiCompatible(ProviderIds.ZHIPU, "Zhipu AI",
                "glm-4", "glm-4-flash",
                List.of("glm-4", "glm-4-flash", "glm-4-air", "glm-4-plus"),
                "https://open.bigmodel.cn/api/paas/v4", ZHIPU_SALT, "https://open.bigmodel.cn/*", retryPolicy));
        register(ordered, openAiCompatible(ProviderIds.QWEN, "Alibaba Qwen",
                "qwen-max", "qwen-turbo",
                List.of("qwen-max", "qwen-plus", "qwen-turbo", "qwen-long"),
                "https://dashscope.aliyuncs.com/compatible-mode/v1", QWEN_SALT, "https://dashscope.aliyuncs.com/*",
                retryPolicy));
        register(ordered, openAiCompatible(ProviderIds.MOONSHOT, "Moonshot AI",
                "kimi-k2.5", "moonshot-v1-8k",
                List.of("kimi-k2.5", "moonshot-v1-8k", "moonshot-v1-32k", "moonshot-v1-128k"),
                "https://api.moonshot.cn/v1", MOONSHOT_SALT, "https://api.moonshot.cn/*", retryPolicy));
        this.providers = Collections.unmodifiableMap(ordered);
    }

    public List<ProviderDescriptor> getAll() {
        return List.copyOf(providers.values());
    }

    /**
     * Looks up a provider by id or legacy alias.
     *
     * @param id provider id, case-insensitive; may be null
     * @return descriptor, or empty if unknown
     */
    public Optional<ProviderDescriptor> find(String id) {
        return Optional.ofNullable(providers.get(canonicalize(id)));
    }

    /**
     * Like {@link #find(String)} but fails for unknown ids.
     *
     * @throws ProviderConfigurationException if the id is not registered
     */
    public ProviderDescriptor require(String id) {
        return find(id).orElseThrow(() -> new ProviderConfigurationException("Unknown AI provider", id));
    }

    public String defaultProviderId() {
        return ProviderIds.GOOGLE;
    }

    /** Provider ids in registry order. */
    public List<String> defaultFallbackOrder() {
        return List.copyOf(providers.keySet());
    }

    /**
     * Maps legacy ids (e.g. {@code gemini}) to canonical ids. Unknown ids are returned lower-cased
     * and trimmed; null becomes "".
     */
    public String canonicalize(String id) {
        if (id == null) {
            return "";
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(normalized, normalized);
    }

    /**
     * Sorted union of the local bridge origin and every provider's host permissions.
     */
    public SortedSet<String> allHostPermissions() {
        SortedSet<String> permissions = new TreeSet<>();
        permissions.add(LOCAL_BRIDGE_PERMISSION);
        for (ProviderDescriptor descriptor : providers.values()) {
            permissions.addAll(descriptor.hostPermissions());
        }
        return Collections.unmodifiableSortedSet(permissions);
    }

    /**
     * Derives the base URL override from a stored API URL.
     *
     * <p>A blank URL, or one equal to the provider's default API URL, means "no override". Otherwise the
     * provider's API URL suffix ({@code /models}, {@code /messages}) is removed when present, so that
     * {@code https://proxy.example/v1beta/models} overrides the base {@code https://proxy.example/v1beta}.
     *
     * @param descriptor   provider
     * @param storedApiUrl API URL from the model state, may be null
     * @return override base URL, or empty when the default should be used
     */
    public Optional<String> resolveOverrideBaseUrl(ProviderDescriptor descriptor, String storedApiUrl) {
        if (storedApiUrl == null || storedApiUrl.isBlank()) {
            return Optional.empty();
        }
        String url = stripTrailingSlashes(storedApiUrl.trim());
        if (url.equals(descriptor.defaultApiUrl()) || url.equals(descriptor.baseUrl())) {
            return Optional.empty();
        }
        String suffix = descriptor.mode().wireFormat().apiUrlSuffix();
        if (!suffix.isEmpty() && url.endsWith(suffix)) {
            url = url.substring(0, url.length() - suffix.length());
        }
        return url.isEmpty() ? Optional.empty() : Optional.of(url);
    }

    static String stripTrailingSlashes(String url) {
        int end = url.length();
        while (end > 0 && url.charAt(end - 1) == '/') {
            end--;
        }
        return url.substring(0, end);
    }

    private static ProviderDescriptor openAiCompatible(String id, String label, String defaultModel,
                                                       String testModel, List<String> supportedModels,
                                                       String baseUrl, byte[] salt, String hostPermission,
                                                       RetryPolicy retryPolicy) {
        return new ProviderDescriptor(id, label, CompatibilityMode.OPENAI_LIKE, defaultModel, testModel,
                supportedModels, baseUrl, salt, List.of(hostPermission), retryPolicy, HealthCheck.DEFAULT);
    }

    private static void register(Map<String, ProviderDescriptor> target, ProviderDescriptor descriptor) {
        if (target.putIfAbsent(descriptor.id(), descriptor) != null) {
            throw new IllegalStateException("Duplicate provider id: " + descriptor.id());
        }
    }

    private static byte[] salt(int... values) {
        byte[] bytes = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            bytes[i] = (byte) values[i];
        }
        return bytes;
    }
}

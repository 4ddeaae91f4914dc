package com.phillippitts.wordassist.service.provider;

/**
 * Canonical ids of the built-in providers.
 */
public final class ProviderIds {

    public static final String GOOGLE = "google";
    public static final String OPENAI = "openai";
    public static final String ANTHROPIC = "anthropic";
    public static final String GROQ = "groq";
    public static final String DEEPSEEK = "deepseek";
    public static final String ZHIPU = "zhipu";
    public static final String QWEN = "qwen";
    public static final String MOONSHOT = "moonshot";

    private ProviderIds() {
        // Constants class
    }
}

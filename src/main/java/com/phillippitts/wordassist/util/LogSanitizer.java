package com.phillippitts.wordassist.util;

/** Utility for privacy-safe logging of prompt and response previews. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Masks an API key for logs, keeping only the last four characters.
     *
     * @param apiKey plaintext key, may be null
     * @return masked form such as {@code ****abcd}, or "" for blank input
     */
    public static String maskKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return "";
        }
        if (apiKey.length() <= 4) {
            return "****";
        }
        return "****" + apiKey.substring(apiKey.length() - 4);
    }
}

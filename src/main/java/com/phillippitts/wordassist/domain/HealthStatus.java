package com.phillippitts.wordassist.domain;

import java.util.Locale;

/**
 * Cached verdict of the most recent call to a provider.
 */
public enum HealthStatus {
    UNKNOWN("unknown"),
    HEALTHY("healthy"),
    ERROR("error");

    private final String value;

    HealthStatus(String value) {
        this.value = value;
    }

    /** Serialized form used in the configuration blob. */
    public String value() {
        return value;
    }

    /**
     * Parses a stored value. Anything other than the three known values is coerced to {@link #UNKNOWN}.
     *
     * @param raw stored value, may be null
     * @return parsed status, never null
     */
    public static HealthStatus fromValue(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (HealthStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}

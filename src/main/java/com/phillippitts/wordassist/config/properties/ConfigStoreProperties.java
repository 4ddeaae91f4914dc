package com.phillippitts.wordassist.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the encrypted provider configuration blob.
 */
@ConfigurationProperties(prefix = "wordassist.config")
@Validated
public class ConfigStoreProperties {

    /** Location of the JSON configuration blob. */
    @NotBlank(message = "Config path must not be blank")
    private String path = System.getProperty("user.home") + "/.wordassist/config.json";

    /** Fixed passphrase the per-provider AES keys are derived from. */
    @NotBlank(message = "Passphrase must not be blank")
    private String passphrase = "wordassist-provider-keys";

    /** Poll the blob for changes written by other processes. */
    private boolean watchEnabled = false;

    /** Poll interval of the change watcher, in milliseconds. */
    @Positive(message = "Watch interval must be positive")
    private long watchIntervalMs = 2000;

    /** Quiet period a changed blob must stay unchanged before a reload is triggered. */
    @PositiveOrZero(message = "Debounce must not be negative")
    private long debounceMs = 500;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getPassphrase() {
        return passphrase;
    }

    public void setPassphrase(String passphrase) {
        this.passphrase = passphrase;
    }

    public boolean isWatchEnabled() {
        return watchEnabled;
    }

    public void setWatchEnabled(boolean watchEnabled) {
        this.watchEnabled = watchEnabled;
    }

    public long getWatchIntervalMs() {
        return watchIntervalMs;
    }

    public void setWatchIntervalMs(long watchIntervalMs) {
        this.watchIntervalMs = watchIntervalMs;
    }

    public long getDebounceMs() {
        return debounceMs;
    }

    public void setDebounceMs(long debounceMs) {
        this.debounceMs = debounceMs;
    }
}

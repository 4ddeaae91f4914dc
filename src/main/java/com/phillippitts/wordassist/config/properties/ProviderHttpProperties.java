package com.phillippitts.wordassist.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Transport timeouts for provider HTTP calls. Orchestration itself applies no timeout;
 * a stuck call is bounded only by these values.
 */
@Validated
@ConfigurationProperties(prefix = "wordassist.http")
public class ProviderHttpProperties {

    @NotNull
    private final Duration connectTimeout;

    @NotNull
    private final Duration readTimeout;

    @ConstructorBinding
    public ProviderHttpProperties(Duration connectTimeout, Duration readTimeout) {
        this.connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
        this.readTimeout = readTimeout == null ? Duration.ofSeconds(60) : readTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }
}

package com.phillippitts.wordassist.service.health;

import com.phillippitts.wordassist.domain.AppConfig;
import com.phillippitts.wordassist.domain.ModelState;
import com.phillippitts.wordassist.exception.WordAssistException;
import com.phillippitts.wordassist.service.config.ConfigService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.UnaryOperator;

/**
 * Persists the outcome of provider calls into each provider's {@link ModelState}.
 *
 * <p>Writes go through {@link ConfigService#update}. A failed write is logged and does not affect
 * the call that produced the outcome.
 */
@Component
public class ProviderHealthRecorder {

    private static final Logger LOG = LogManager.getLogger(ProviderHealthRecorder.class);

    private final ConfigService configService;
    private final LongSupplier clock;

    @Autowired
    public ProviderHealthRecorder(ConfigService configService) {
        this(configService, System::currentTimeMillis);
    }

    ProviderHealthRecorder(ConfigService configService, LongSupplier clock) {
        this.configService = Objects.requireNonNull(configService);
        this.clock = Objects.requireNonNull(clock);
    }

    public void recordSuccess(String providerId) {
        long now = clock.getAsLong();
        persist(providerId, state -> state.markHealthy(now));
    }

    public void recordFailure(String providerId, String errorMessage) {
        long now = clock.getAsLong();
        String message = errorMessage == null ? "" : errorMessage;
        persist(providerId, state -> state.markFailed(message, now));
    }

    private void persist(String providerId, UnaryOperator<ModelState> change) {
        try {
            configService.update(config -> apply(config, providerId, change));
        } catch (WordAssistException e) {
            LOG.warn("Could not persist health of provider {}: {}", providerId, e.getMessage());
        }
    }

    private static AppConfig apply(AppConfig config, String providerId, UnaryOperator<ModelState> change) {
        return config.aiConfig().model(providerId)
                .map(state -> config.withAiConfig(config.aiConfig().withModel(providerId, change.apply(state))))
                .orElse(config);
    }
}

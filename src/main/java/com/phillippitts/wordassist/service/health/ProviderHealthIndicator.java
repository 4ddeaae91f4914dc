package com.phillippitts.wordassist.service.health;

import com.phillippitts.wordassist.domain.AiConfig;
import com.phillippitts.wordassist.domain.HealthStatus;
import com.phillippitts.wordassist.domain.ModelState;
import com.phillippitts.wordassist.service.config.ConfigService;
import com.phillippitts.wordassist.service.provider.ProviderDescriptor;
import com.phillippitts.wordassist.service.provider.ProviderRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator built from the persisted per-provider health.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: the active provider's last check succeeded</li>
 *   <li>DEGRADED: the active provider is not healthy but another provider is</li>
 *   <li>UNKNOWN: no provider has been checked yet</li>
 *   <li>DOWN: every checked provider is in error</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ProviderHealthIndicator implements HealthIndicator {

    private final ConfigService configService;
    private final ProviderRegistry registry;

    public ProviderHealthIndicator(ConfigService configService, ProviderRegistry registry) {
        this.configService = configService;
        this.registry = registry;
    }

    @Override
    public Health health() {
        AiConfig ai = configService.current().aiConfig();
        String active = registry.canonicalize(ai.provider());

        Map<String, String> details = new LinkedHashMap<>();
        boolean activeHealthy = false;
        boolean anyHealthy = false;
        boolean anyChecked = false;
        for (ProviderDescriptor descriptor : registry.getAll()) {
            HealthStatus status = ai.model(descriptor.id())
                    .map(ModelState::healthStatus)
                    .orElse(HealthStatus.UNKNOWN);
            details.put(descriptor.id(), describe(ai.model(descriptor.id()).orElse(null), status));
            if (status == HealthStatus.HEALTHY) {
                anyHealthy = true;
                activeHealthy |= descriptor.id().equals(active);
            }
            anyChecked |= status != HealthStatus.UNKNOWN;
        }

        Health.Builder builder = new Health.Builder();
        if (activeHealthy) {
            builder.up().withDetail("status", "Active provider operational");
        } else if (anyHealthy) {
            builder.status("DEGRADED").withDetail("status", "Active provider unavailable, fallback healthy");
        } else if (!anyChecked) {
            builder.unknown().withDetail("status", "No provider checked yet");
        } else {
            builder.down().withDetail("status", "No healthy provider");
        }
        return builder.withDetail("activeProvider", active)
                .withDetails(details)
                .build();
    }

    private static String describe(ModelState state, HealthStatus status) {
        if (state == null || !state.hasApiKey()) {
            return "not configured";
        }
        if (status == HealthStatus.ERROR && !state.lastErrorMessage().isEmpty()) {
            return "error: " + state.lastErrorMessage();
        }
        return status.value();
    }
}

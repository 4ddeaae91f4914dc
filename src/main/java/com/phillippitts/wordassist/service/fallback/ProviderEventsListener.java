package com.phillippitts.wordassist.service.fallback;

import com.phillippitts.wordassist.service.fallback.event.AllProvidersFailedEvent;
import com.phillippitts.wordassist.service.fallback.event.ProviderFallbackEvent;
import com.phillippitts.wordassist.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Logs provider fallback events succinctly (no prompt text, no keys). */
@Component
class ProviderEventsListener {
    private static final Logger LOG = LogManager.getLogger(ProviderEventsListener.class);

    @EventListener
    void onFallback(ProviderFallbackEvent e) {
        LOG.warn("Provider fallback: provider={}, kind={}, reason={}",
                e.providerId(), e.kind(), LogSanitizer.truncate(e.reason(), 200));
    }

    @EventListener
    void onAllFailed(AllProvidersFailedEvent e) {
        LOG.error("All providers failed: attempted={}, reason={}", e.attempted(), LogSanitizer.truncate(e.reason(), 200));
    }
}

package com.phillippitts.wordassist.service.config;

import com.phillippitts.wordassist.config.properties.ConfigStoreProperties;
import com.phillippitts.wordassist.service.config.event.ConfigChangedExternallyEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Polls the configuration blob and publishes {@link ConfigChangedExternallyEvent} once a new
 * modification stamp has stayed unchanged for the debounce window.
 */
@Component
@ConditionalOnProperty(prefix = "wordassist.config", name = "watch-enabled", havingValue = "true")
public class ConfigChangeWatcher {

    private static final Logger LOG = LogManager.getLogger(ConfigChangeWatcher.class);

    private final ConfigBlobStore blobStore;
    private final ApplicationEventPublisher publisher;
    private final long debounceMs;
    private final LongSupplier clock;

    private long publishedStamp;
    private long pendingStamp;
    private long pendingSince;

    @Autowired
    public ConfigChangeWatcher(ConfigBlobStore blobStore, ApplicationEventPublisher publisher,
                               ConfigStoreProperties props) {
        this(blobStore, publisher, props.getDebounceMs(), System::currentTimeMillis);
    }

    ConfigChangeWatcher(ConfigBlobStore blobStore, ApplicationEventPublisher publisher,
                        long debounceMs, LongSupplier clock) {
        this.blobStore = Objects.requireNonNull(blobStore);
        this.publisher = Objects.requireNonNull(publisher);
        this.debounceMs = debounceMs;
        this.clock = Objects.requireNonNull(clock);
        this.publishedStamp = blobStore.modificationStamp();
        this.pendingStamp = publishedStamp;
    }

    @Scheduled(fixedDelayString = "${wordassist.config.watch-interval-ms:2000}")
    public synchronized void poll() {
        long stamp = blobStore.modificationStamp();
        long now = clock.getAsLong();
        if (stamp != pendingStamp) {
            pendingStamp = stamp;
            pendingSince = now;
        }
        if (stamp == publishedStamp || now - pendingSince < debounceMs) {
            return;
        }
        publishedStamp = stamp;
        LOG.debug("Configuration blob {} changed (stamp={})", blobStore.describe(), stamp);
        publisher.publishEvent(new ConfigChangedExternallyEvent(stamp, Instant.now()));
    }
}

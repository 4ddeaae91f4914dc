package com.phillippitts.wordassist.service.config;

import com.phillippitts.wordassist.domain.AppConfig;
import com.phillippitts.wordassist.service.config.event.ConfigChangedExternallyEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Cached access to the configuration with read-modify-write updates.
 *
 * <p>Every update reloads the latest persisted config, applies the change and writes the whole
 * blob back. Updates from this process are serialized; writers in other processes are not
 * coordinated (last writer wins). Subscribers are notified after every save and after a reload
 * triggered by an external change.
 */
@Service
public class ConfigService {

    private static final Logger LOG = LogManager.getLogger(ConfigService.class);

    private final EncryptedConfigStore store;
    private final ConfigBlobStore blobStore;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final List<Consumer<AppConfig>> listeners = new CopyOnWriteArrayList<>();

    private volatile AppConfig cached;
    private volatile long ownWriteStamp = Long.MIN_VALUE;

    public ConfigService(EncryptedConfigStore store, ConfigBlobStore blobStore) {
        this.store = Objects.requireNonNull(store);
        this.blobStore = Objects.requireNonNull(blobStore);
    }

    /**
     * @return the cached config, loading it on first use
     */
    public AppConfig current() {
        AppConfig config = cached;
        return config != null ? config : reload();
    }

    /** Reloads from storage, replacing the cache. */
    public AppConfig reload() {
        writeLock.lock();
        try {
            AppConfig loaded = store.load();
            ownWriteStamp = blobStore.modificationStamp();
            cached = loaded;
            return loaded;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Saves a full config (user-initiated save).
     *
     * @param config config with plaintext keys
     * @return the normalized config as persisted
     */
    public AppConfig save(AppConfig config) {
        AppConfig saved;
        writeLock.lock();
        try {
            saved = persist(config);
        } finally {
            writeLock.unlock();
        }
        notifyListeners(saved);
        return saved;
    }

    /**
     * Read-modify-write: applies {@code change} to the latest persisted config and saves the result.
     *
     * @param change function from the latest config to the new config
     * @return the normalized config as persisted
     */
    public AppConfig update(UnaryOperator<AppConfig> change) {
        AppConfig saved;
        writeLock.lock();
        try {
            AppConfig latest = store.load();
            saved = persist(change.apply(latest));
        } finally {
            writeLock.unlock();
        }
        notifyListeners(saved);
        return saved;
    }

    /**
     * Registers a listener for config changes.
     *
     * @param listener receives the new config
     * @return handle that removes the listener
     */
    public Runnable subscribe(Consumer<AppConfig> listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Reads a pass-through value by dot path, e.g. {@code promptTemplates.custom}.
     *
     * @param dotPath path of map keys below the top-level sections
     * @return the value, or empty if any segment is missing
     */
    public Optional<Object> get(String dotPath) {
        Object node = current().sections();
        for (String segment : dotPath.split("\\.")) {
            if (!(node instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            node = map.get(segment);
        }
        return Optional.ofNullable(node);
    }

    @EventListener
    public void onExternalChange(ConfigChangedExternallyEvent event) {
        if (event.stamp() == ownWriteStamp) {
            LOG.debug("Ignoring change notification for our own write");
            return;
        }
        LOG.info("Configuration changed outside this process; reloading");
        notifyListeners(reload());
    }

    private AppConfig persist(AppConfig config) {
        AppConfig saved = store.save(config);
        ownWriteStamp = blobStore.modificationStamp();
        cached = saved;
        return saved;
    }

    private void notifyListeners(AppConfig config) {
        for (Consumer<AppConfig> listener : listeners) {
            try {
                listener.accept(config);
            } catch (RuntimeException e) {
                LOG.warn("Config listener failed: {}", e.toString());
            }
        }
    }
}

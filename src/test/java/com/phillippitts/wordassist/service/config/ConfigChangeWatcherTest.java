package com.phillippitts.wordassist.service.config;

import com.phillippitts.wordassist.service.config.event.ConfigChangedExternallyEvent;
import com.phillippitts.wordassist.testutil.EventCapturingPublisher;
import com.phillippitts.wordassist.testutil.InMemoryConfigBlobStore;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigChangeWatcherTest {

    private final InMemoryConfigBlobStore blobStore = new InMemoryConfigBlobStore("{}");
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final AtomicLong now = new AtomicLong(10_000);
    private final ConfigChangeWatcher watcher = new ConfigChangeWatcher(blobStore, publisher, 500, now::get);

    @Test
    void unchangedBlobPublishesNothing() {
        watcher.poll();
        now.addAndGet(5_000);
        watcher.poll();

        assertThat(publisher.all()).isEmpty();
    }

    @Test
    void publishesOnceAfterChangeSettles() {
        blobStore.overwriteExternally("{\"a\":1}");

        watcher.poll();
        now.addAndGet(499);
        watcher.poll();
        assertThat(publisher.all()).isEmpty();

        now.addAndGet(1);
        watcher.poll();
        now.addAndGet(1_000);
        watcher.poll();

        assertThat(publisher.eventsOfType(ConfigChangedExternallyEvent.class))
                .singleElement()
                .extracting(ConfigChangedExternallyEvent::stamp)
                .isEqualTo(blobStore.modificationStamp());
    }

    @Test
    void burstOfWritesRestartsDebounce() {
        blobStore.overwriteExternally("{\"a\":1}");
        watcher.poll();
        now.addAndGet(400);
        blobStore.overwriteExternally("{\"a\":2}");
        watcher.poll();
        now.addAndGet(400);
        watcher.poll();

        assertThat(publisher.all()).isEmpty();

        now.addAndGet(100);
        watcher.poll();

        assertThat(publisher.eventsOfType(ConfigChangedExternallyEvent.class)).hasSize(1);
    }
}

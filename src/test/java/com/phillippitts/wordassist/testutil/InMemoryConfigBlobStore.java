package com.phillippitts.wordassist.testutil;

import com.phillippitts.wordassist.service.config.ConfigBlobStore;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Config blob kept in memory. The modification stamp increases on every write, including
 * writes made through {@link #overwriteExternally(String)}.
 */
public class InMemoryConfigBlobStore implements ConfigBlobStore {

    private volatile String blob;
    private volatile long stamp;
    private final AtomicInteger writes = new AtomicInteger();

    public InMemoryConfigBlobStore() {
    }

    public InMemoryConfigBlobStore(String initialBlob) {
        this.blob = initialBlob;
        this.stamp = initialBlob == null ? 0 : 1;
    }

    @Override
    public Optional<String> read() {
        return Optional.ofNullable(blob);
    }

    @Override
    public synchronized void write(String newBlob) {
        blob = newBlob;
        stamp++;
        writes.incrementAndGet();
    }

    @Override
    public long modificationStamp() {
        return stamp;
    }

    @Override
    public String describe() {
        return "in-memory";
    }

    /** Simulates another process replacing the blob. Not counted in {@link #writeCount()}. */
    public synchronized void overwriteExternally(String newBlob) {
        blob = newBlob;
        stamp++;
    }

    public String blob() {
        return blob;
    }

    public int writeCount() {
        return writes.get();
    }
}

package com.phillippitts.wordassist.service.execution;

/**
 * Waits between retry attempts. Injected so tests can record delays instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;
}

package com.guno.salesintel.core;

/**
 * Blocking pause between retries and batches. Swapped for a no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}

package com.nchat.connectors.retry;

/**
 * Blocks the calling thread between attempts. Replaced in tests so retries run instantly.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}

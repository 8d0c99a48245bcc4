package com.williamcallahan.llmgateway.service;

import java.time.Duration;

/**
 * Blocking pause between retry attempts; replaced in tests to avoid real waits.
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeps on the calling thread. */
    Sleeper THREAD_SLEEP = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}

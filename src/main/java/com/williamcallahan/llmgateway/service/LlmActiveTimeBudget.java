package com.williamcallahan.llmgateway.service;

import java.time.Clock;
import java.time.Duration;

/**
 * Wall-clock budget that only counts time spent inside gateway calls.
 *
 * <p>Overlapping calls are counted once: the window opens on the first start and closes when
 * the last active call stops.</p>
 */
public class LlmActiveTimeBudget implements LlmActiveWindowListener {
    private final Duration limit;
    private final Clock clock;

    private long accumulatedMillis;
    private long windowStartedAtMillis;
    private int activeCalls;

    /**
     * Creates a budget.
     *
     * @param limit active-time limit, or null for unlimited
     * @param clock time source
     */
    public LlmActiveTimeBudget(Duration limit, Clock clock) {
        this.limit = limit;
        this.clock = clock;
    }

    public LlmActiveTimeBudget(Duration limit) {
        this(limit, Clock.systemUTC());
    }

    @Override
    public synchronized void windowStarted(String runId, String traceId) {
        if (activeCalls++ == 0) {
            windowStartedAtMillis = clock.millis();
        }
    }

    @Override
    public synchronized void windowStopped(String runId, String traceId) {
        if (activeCalls == 0) {
            return;
        }
        if (--activeCalls == 0) {
            accumulatedMillis += clock.millis() - windowStartedAtMillis;
        }
    }

    /** Returns the configured limit, or null when unlimited. */
    public Duration limit() {
        return limit;
    }

    /** Returns the accumulated active time, including the currently open window. */
    public synchronized long activeMillis() {
        long total = accumulatedMillis;
        if (activeCalls > 0) {
            total += clock.millis() - windowStartedAtMillis;
        }
        return total;
    }

    /**
     * Returns the remaining active time in seconds, or null when unlimited.
     */
    public Double remainingSeconds() {
        if (limit == null) {
            return null;
        }
        return Math.max((limit.toMillis() - activeMillis()) / 1000.0, 0.0);
    }

    /** Returns whether the active time has reached the limit. */
    public boolean exceeded() {
        return limit != null && activeMillis() >= limit.toMillis();
    }
}

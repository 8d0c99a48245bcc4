package com.williamcallahan.llmgateway.service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

/**
 * Hands out per-run attempt sequence numbers used to name audit records.
 *
 * <p>Numbers start at 1 and are unique per run even when calls on the same run overlap.</p>
 */
@Component
public class RunAttemptSequencer {
    private final Map<String, AtomicInteger> sequences = new ConcurrentHashMap<>();

    /**
     * Increments and returns the run's attempt sequence.
     *
     * @param runId run identifier
     * @return next sequence number
     */
    public int next(String runId) {
        return sequences.computeIfAbsent(runId, ignored -> new AtomicInteger()).incrementAndGet();
    }

    /**
     * Returns the last issued sequence number, zero when none.
     */
    public int current(String runId) {
        AtomicInteger sequence = sequences.get(runId);
        return sequence == null ? 0 : sequence.get();
    }
}

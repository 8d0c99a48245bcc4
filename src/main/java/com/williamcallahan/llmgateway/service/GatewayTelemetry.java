package com.williamcallahan.llmgateway.service;

import com.williamcallahan.llmgateway.domain.llm.ProviderHandle;
import java.util.List;

/**
 * Spans and counters recorded by the gateway. Implementations must tolerate concurrent use
 * from many simultaneous calls.
 */
public interface GatewayTelemetry {

    /**
     * Opens the parent span for one logical call.
     *
     * @param runId caller's run identifier
     * @param traceId caller's trace identifier
     * @param chainLabels chain as {@code provider:model} labels
     * @return open span
     */
    TelemetrySpan startCallSpan(String runId, String traceId, List<String> chainLabels);

    /**
     * Opens a child span for one provider chain entry.
     *
     * @param parent call span
     * @param handle chain entry
     * @param model model actually requested
     * @return open span
     */
    TelemetrySpan startProviderSpan(TelemetrySpan parent, ProviderHandle handle, String model);

    /** Adds to the token counter; {@code kind} is {@code prompt} or {@code completion}. */
    void recordTokens(String provider, String model, String kind, long tokens);

    /** Counts one failed attempt. */
    void recordFailure(String provider, String model, String category);

    /** Counts one move from a failed chain entry to the next. */
    void recordFallback(ProviderHandle from, ProviderHandle to, String category);

    /** Counts one stream cut short by a budget cap. */
    void recordBudgetAbort(String provider, String model, String reason);

    /** Adjusts the live event-subscriber count by {@code delta}. */
    void recordEventSubscribers(int delta);
}

package com.williamcallahan.llmgateway.domain.llm;

/**
 * Usage counters reported by a provider alongside a stream event. Any field may be absent.
 *
 * <p>Values are cumulative for the attempt: a reported {@code completionTokens} replaces the
 * gateway's running estimate rather than adding to it.</p>
 *
 * @param promptTokens prompt tokens, when reported
 * @param completionTokens completion tokens so far, when reported
 * @param costUsd cost so far in USD, when reported
 */
public record UsageReport(Integer promptTokens, Integer completionTokens, Double costUsd) {

    private static final UsageReport NONE = new UsageReport(null, null, null);

    /** Returns a report with no counters. */
    public static UsageReport none() {
        return NONE;
    }

    public static UsageReport completionTokens(int completionTokens) {
        return new UsageReport(null, completionTokens, null);
    }

    public static UsageReport cost(double costUsd) {
        return new UsageReport(null, null, costUsd);
    }
}

package com.williamcallahan.llmgateway.service;

import java.util.Set;

/**
 * Stable category strings attached to gateway failures and {@code error} events.
 */
public final class LlmErrorCategories {

    public static final String PROVIDER_ERROR = "provider_error";
    public static final String PROVIDER_UNAVAILABLE = "provider_unavailable";
    public static final String QUOTA_EXCEEDED = "quota_exceeded";
    public static final String RATE_LIMIT = "rate_limit";
    public static final String TIMEOUT = "timeout";
    public static final String SERVER_ERROR = "server_error";
    public static final String TRANSIENT = "transient";
    public static final String API_ERROR = "api_error";
    public static final String CAP_EXCEEDED = "cap_exceeded";
    public static final String BUDGET_EXHAUSTED = "budget_exhausted";
    public static final String ALL_PROVIDERS_EXHAUSTED = "all_providers_exhausted";
    public static final String UNKNOWN = "unknown";

    /** Categories that allow moving on to the next chain entry even when not retryable. */
    public static final Set<String> FAILOVER_CATEGORIES = Set.of(
            PROVIDER_ERROR,
            PROVIDER_UNAVAILABLE,
            QUOTA_EXCEEDED,
            RATE_LIMIT,
            TIMEOUT,
            SERVER_ERROR,
            TRANSIENT,
            API_ERROR);

    private LlmErrorCategories() {
    }
}

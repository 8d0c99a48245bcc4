package com.williamcallahan.llmgateway.service;

/**
 * Event {@code type} values emitted by the gateway. Every payload also carries
 * {@code event: "llm"} and the {@code runId}.
 */
public final class LlmEventTypes {

    public static final String ENVELOPE = "llm";

    public static final String PROVIDER_SELECTED = "provider_selected";
    public static final String STARTING = "starting";
    public static final String TOKEN = "token";
    public static final String COMPLETE = "complete";
    public static final String ERROR = "error";
    public static final String PROVIDER_FAILED = "provider_failed";
    public static final String PROVIDER_SUCCEEDED = "provider_succeeded";
    public static final String PROVIDER_FAILOVER = "provider_failover";
    public static final String BUDGET_EXHAUSTED = "budget_exhausted";
    public static final String CANCELED = "canceled";

    private LlmEventTypes() {
    }
}

package com.williamcallahan.llmgateway.service;

import java.util.List;

/**
 * Terminal failure raised once every provider chain entry has failed.
 */
public class AllProvidersExhaustedException extends LlmProviderException {
    private final List<String> attemptedProviders;

    /**
     * Creates the exhaustion failure.
     *
     * @param attemptedProviders {@code provider:model} labels in chain order
     * @param lastFailure failure of the final chain entry
     */
    public AllProvidersExhaustedException(List<String> attemptedProviders, Throwable lastFailure) {
        super("All LLM providers failed: " + String.join(", ", attemptedProviders),
                false, LlmErrorCategories.ALL_PROVIDERS_EXHAUSTED, false, lastFailure);
        this.attemptedProviders = List.copyOf(attemptedProviders);
    }

    /** Returns the attempted {@code provider:model} labels in chain order. */
    public List<String> getAttemptedProviders() {
        return attemptedProviders;
    }
}

package com.williamcallahan.llmgateway.service;

/**
 * Retry and failover decisions over a classified provider failure.
 *
 * <p>Violations short-circuit both decisions so that hard policy boundaries always surface
 * unchanged to the caller.</p>
 */
public final class LlmFailoverPolicy {

    private LlmFailoverPolicy() {
    }

    /**
     * Determines whether the same provider should be invoked again.
     *
     * @param failure classified failure
     * @param attemptNumber 1-based attempt that just failed
     * @param maxRetries configured retry budget
     * @return true when the failure is transient and the retry budget allows another attempt
     */
    public static boolean shouldRetry(LlmProviderException failure, int attemptNumber, int maxRetries) {
        if (failure == null || failure.isViolation()) {
            return false;
        }
        return failure.isRetryable() && attemptNumber <= maxRetries;
    }

    /**
     * Determines whether a failure allows moving to the next chain entry.
     *
     * @param failure classified failure
     * @return true for non-violation failures that are retryable or in a failover category
     */
    public static boolean shouldFailover(LlmProviderException failure) {
        if (failure == null || failure.isViolation()) {
            return false;
        }
        return failure.isRetryable() || LlmErrorCategories.FAILOVER_CATEGORIES.contains(failure.getCategory());
    }
}

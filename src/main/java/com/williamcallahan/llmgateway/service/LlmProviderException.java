package com.williamcallahan.llmgateway.service;

/**
 * Failure of a provider call, classified for the retry and failover policy.
 *
 * <p>{@code retryable} means the same provider may succeed on re-attempt. {@code violation}
 * marks a hard policy boundary: such failures are never retried and never failed over.</p>
 */
public class LlmProviderException extends RuntimeException {
    private final boolean retryable;
    private final String category;
    private final boolean violation;

    /**
     * Creates a non-retryable failure with the {@code unknown} category.
     */
    public LlmProviderException(String message) {
        this(message, false, LlmErrorCategories.UNKNOWN, false, null);
    }

    public LlmProviderException(String message, boolean retryable, String category, boolean violation) {
        this(message, retryable, category, violation, null);
    }

    /**
     * Creates a classified failure.
     *
     * @param message human-readable description
     * @param retryable whether the same provider may be re-invoked
     * @param category failure category
     * @param violation whether a hard policy boundary was hit
     * @param cause underlying failure, when wrapping
     */
    public LlmProviderException(String message, boolean retryable, String category, boolean violation, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
        this.category = category == null || category.isBlank() ? LlmErrorCategories.UNKNOWN : category;
        this.violation = violation;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getCategory() {
        return category;
    }

    public boolean isViolation() {
        return violation;
    }
}

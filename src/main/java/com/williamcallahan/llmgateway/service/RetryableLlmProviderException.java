package com.williamcallahan.llmgateway.service;

/**
 * Transient provider failure such as a timeout, a 5xx response or a rate limit.
 */
public class RetryableLlmProviderException extends LlmProviderException {

    public RetryableLlmProviderException(String message) {
        this(message, LlmErrorCategories.TRANSIENT);
    }

    public RetryableLlmProviderException(String message, String category) {
        super(message, true, category, false, null);
    }

    public RetryableLlmProviderException(String message, String category, Throwable cause) {
        super(message, true, category, false, cause);
    }
}

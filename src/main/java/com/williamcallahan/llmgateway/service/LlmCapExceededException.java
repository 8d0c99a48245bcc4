package com.williamcallahan.llmgateway.service;

/**
 * A configured hard limit was hit. Never retried, never failed over.
 */
public class LlmCapExceededException extends LlmProviderException {

    public LlmCapExceededException(String message) {
        this(message, LlmErrorCategories.CAP_EXCEEDED);
    }

    public LlmCapExceededException(String message, String category) {
        super(message, false, category, true, null);
    }
}

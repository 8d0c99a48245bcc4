package com.williamcallahan.llmgateway.service;

/**
 * Cancel action supplied by a provider stream adapter.
 */
@FunctionalInterface
public interface StreamCancellation {
    /**
     * Stops the underlying provider call.
     *
     * @throws Exception when the provider could not be told to stop
     */
    void cancel() throws Exception;
}

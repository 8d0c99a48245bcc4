package com.williamcallahan.llmgateway.service;

/**
 * Signals that no provider chain could be resolved for a call.
 */
public final class ProviderChainConfigurationException extends IllegalStateException {

    public ProviderChainConfigurationException(String message) {
        super(message);
    }
}

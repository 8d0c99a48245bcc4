package com.williamcallahan.llmgateway.service;

import com.williamcallahan.llmgateway.domain.llm.ProviderHandle;
import java.util.List;

/**
 * Builds the ordered provider chain for one call.
 */
@FunctionalInterface
public interface ProviderChainResolver {

    /**
     * Resolves the chain.
     *
     * @param providerHint {@code provider:model}, {@code provider}, {@code model} or null
     * @return read-only ordered chain; empty when nothing is configured
     */
    List<ProviderHandle> resolve(String providerHint);
}

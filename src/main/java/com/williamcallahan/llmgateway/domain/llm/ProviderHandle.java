package com.williamcallahan.llmgateway.domain.llm;

import java.util.Objects;

/**
 * One candidate in a provider chain.
 *
 * @param provider provider name used to look up the stream adapter
 * @param model model name the entry was configured with (may be null)
 * @param chainIndex 0-based position in the chain
 */
public record ProviderHandle(String provider, String model, int chainIndex) {
    public ProviderHandle {
        Objects.requireNonNull(provider, "provider");
        if (provider.isBlank()) {
            throw new IllegalArgumentException("provider cannot be blank");
        }
        if (chainIndex < 0) {
            throw new IllegalArgumentException("chainIndex must not be negative");
        }
    }

    /** Returns the {@code provider:model} label used in events, spans and exhaustion errors. */
    public String label() {
        return provider + ":" + (model == null ? "" : model);
    }
}

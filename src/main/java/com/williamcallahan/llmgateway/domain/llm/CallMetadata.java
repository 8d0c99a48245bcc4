package com.williamcallahan.llmgateway.domain.llm;

import java.util.Objects;

/**
 * Correlation data handed to a provider stream adapter.
 *
 * @param runId caller's run identifier
 * @param traceId caller's trace identifier, may be null
 * @param attemptNumber 1-based attempt against the current chain entry
 */
public record CallMetadata(String runId, String traceId, int attemptNumber) {
    public CallMetadata {
        Objects.requireNonNull(runId, "runId");
    }
}

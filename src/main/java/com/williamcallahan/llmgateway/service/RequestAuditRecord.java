package com.williamcallahan.llmgateway.service;

import java.time.Instant;
import java.util.Map;

/**
 * Redacted snapshot of an outbound request. Never carries prompt text, instructions or
 * credential values, only their hashes.
 *
 * @param traceId caller's trace identifier
 * @param runId caller's run identifier
 * @param provider provider about to be called
 * @param model model about to be requested
 * @param params redacted call parameters
 * @param promptHash tagged prompt hash
 * @param instructionsHash tagged instructions hash, or null
 * @param contextHash caller-supplied context bundle hash, or null
 * @param createdAt record creation time
 */
public record RequestAuditRecord(
        String traceId,
        String runId,
        String provider,
        String model,
        Map<String, Object> params,
        String promptHash,
        String instructionsHash,
        String contextHash,
        Instant createdAt) {

    /** Builds the artifact path {@code artifacts/llm/{runId}/{sequence:04d}/request.json}. */
    public static String artifactPath(String runId, int sequence) {
        return String.format("artifacts/llm/%s/%04d/request.json", runId, sequence);
    }
}

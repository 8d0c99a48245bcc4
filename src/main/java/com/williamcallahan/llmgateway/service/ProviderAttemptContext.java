package com.williamcallahan.llmgateway.service;

import com.williamcallahan.llmgateway.domain.llm.CallParameters;
import com.williamcallahan.llmgateway.domain.llm.ProviderHandle;
import java.util.Map;
import java.util.Objects;

/**
 * Everything fixed for one chain entry while its attempts run.
 */
record ProviderAttemptContext(
        String runId,
        String traceId,
        String prompt,
        String contextHash,
        CancellationToken cancelToken,
        ProviderHandle handle,
        int chainLength,
        CallParameters parameters,
        Map<String, Object> redactedParameters,
        String paramsHash,
        String promptHash,
        String instructionsHash) {
    ProviderAttemptContext {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(cancelToken, "cancelToken");
    }

    String provider() {
        return handle.provider();
    }

    String model() {
        return parameters.model();
    }

    int chainIndex() {
        return handle.chainIndex();
    }

    boolean hasNextProvider() {
        return handle.chainIndex() + 1 < chainLength;
    }
}

package com.williamcallahan.llmgateway.service;

import com.williamcallahan.llmgateway.domain.llm.CallMetadata;
import com.williamcallahan.llmgateway.domain.llm.CallParameters;
import com.williamcallahan.llmgateway.domain.llm.ProviderHandle;

/**
 * Vendor adapter that opens a streaming completion for one provider.
 *
 * <p>Implementations should throw {@link LlmProviderException} (or a subclass) for classified
 * failures; any other exception is treated as a {@code provider_error}.</p>
 */
@FunctionalInterface
public interface ProviderStreamFactory {

    /**
     * Opens a stream.
     *
     * @param prompt prompt text
     * @param parameters resolved call parameters
     * @param handle selected chain entry
     * @param metadata correlation data for this attempt
     * @return open stream
     * @throws Exception when the stream could not be opened
     */
    ProviderStream openStream(String prompt, CallParameters parameters, ProviderHandle handle, CallMetadata metadata)
            throws Exception;
}

package com.williamcallahan.llmgateway.service;

import java.io.IOException;

/**
 * Blob sink for per-run artifacts such as request audit records.
 */
public interface ArtifactStore {

    /** Content type used for JSON artifacts. */
    String APPLICATION_JSON = "application/json";

    /**
     * Stores one artifact.
     *
     * @param runId run the artifact belongs to
     * @param path relative artifact path
     * @param data artifact bytes
     * @param contentType MIME type of {@code data}
     * @return URI of the stored artifact
     * @throws IOException when the artifact could not be written
     */
    String put(String runId, String path, byte[] data, String contentType) throws IOException;
}

package com.williamcallahan.llmgateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists one redacted request record per provider attempt, before the provider is called.
 */
public class RequestAuditService {
    private static final Logger log = LoggerFactory.getLogger(RequestAuditService.class);

    private final ArtifactStore artifactStore;
    private final RunAttemptSequencer sequencer;
    private final ObjectWriter recordWriter;

    /**
     * Creates the audit writer.
     *
     * @param artifactStore destination for request records
     * @param sequencer per-run attempt sequence
     */
    public RequestAuditService(ArtifactStore artifactStore, RunAttemptSequencer sequencer) {
        this.artifactStore = artifactStore;
        this.sequencer = sequencer;
        this.recordWriter = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build()
                .writerWithDefaultPrettyPrinter();
    }

    /**
     * Allocates the next attempt sequence for the run and writes the record under it.
     *
     * @param auditRecord redacted record
     * @return URI of the stored record
     * @throws UncheckedIOException when the record cannot be written
     */
    public String persist(RequestAuditRecord auditRecord) {
        int sequence = sequencer.next(auditRecord.runId());
        String artifactPath = RequestAuditRecord.artifactPath(auditRecord.runId(), sequence);
        try {
            byte[] data = recordWriter.writeValueAsBytes(auditRecord);
            String uri = artifactStore.put(auditRecord.runId(), artifactPath, data, ArtifactStore.APPLICATION_JSON);
            log.debug("[LLM] Persisted request record runId={} sequence={} uri={}",
                    auditRecord.runId(), sequence, uri);
            return uri;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request audit record", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist request audit record " + artifactPath, e);
        }
    }
}

package com.williamcallahan.llmgateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.williamcallahan.llmgateway.config.AppProperties;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Default event sink: serializes gateway events to JSON and publishes them on the run's fan-out.
 *
 * <p>Events for runs nobody is listening to are dropped.</p>
 */
@Component
public class LlmEventStreams implements LlmEventEmitter {
    private static final Logger log = LoggerFactory.getLogger(LlmEventStreams.class);

    private final ObjectWriter jsonWriter;
    private final GatewayTelemetry telemetry;
    private final int maxBufferSize;
    private final Map<String, LlmEventFanout> fanouts = new ConcurrentHashMap<>();

    /**
     * Creates the registry wired to the application's ObjectMapper.
     *
     * @param objectMapper JSON mapper for event payloads
     * @param telemetry subscriber count recorder
     * @param appProperties event buffering settings
     */
    public LlmEventStreams(ObjectMapper objectMapper, GatewayTelemetry telemetry, AppProperties appProperties) {
        this.jsonWriter = objectMapper.writer();
        this.telemetry = telemetry;
        this.maxBufferSize = appProperties.getEvents().getMaxBufferSize();
    }

    @Override
    public void emit(LlmEvent event) {
        LlmEventFanout fanout = fanouts.get(event.runId());
        if (fanout == null) {
            log.debug("[LLM] No event stream for runId={}, dropping {}", event.runId(), event.type());
            return;
        }
        fanout.publish(serialize(event.toPayload()));
    }

    /**
     * Subscribes to a run's events, opening its fan-out if the run has not started yet.
     *
     * @param runId run to follow
     * @return serialized events
     */
    public Flux<String> subscribe(String runId) {
        return fanouts.computeIfAbsent(runId, ignored -> new LlmEventFanout(maxBufferSize, telemetry))
                .subscribe();
    }

    /**
     * Ends a run's event stream: subscribers complete and the fan-out is discarded.
     *
     * @param runId finished run
     */
    public void complete(String runId) {
        LlmEventFanout fanout = fanouts.remove(runId);
        if (fanout != null) {
            fanout.close();
        }
    }

    /** Returns whether a run currently has an open event stream. */
    public boolean hasStream(String runId) {
        return fanouts.containsKey(runId);
    }

    private String serialize(Map<String, Object> payload) {
        try {
            return jsonWriter.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize LLM event", e);
        }
    }
}

package com.williamcallahan.llmgateway.web;

import com.williamcallahan.llmgateway.config.AppProperties;
import com.williamcallahan.llmgateway.service.LlmEventStreams;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * Live gateway lifecycle events for one run, as Server-Sent Events.
 */
@RestController
@RequestMapping("/api/llm/runs")
public class LlmEventStreamController {
    private static final Logger log = LoggerFactory.getLogger(LlmEventStreamController.class);

    private final LlmEventStreams eventStreams;
    private final SseSupport sseSupport;
    private final Duration heartbeatInterval;

    /**
     * Creates the controller.
     *
     * @param eventStreams per-run event fan-outs
     * @param sseSupport SSE framing helpers
     * @param appProperties heartbeat interval
     */
    public LlmEventStreamController(
            LlmEventStreams eventStreams, SseSupport sseSupport, AppProperties appProperties) {
        this.eventStreams = eventStreams;
        this.sseSupport = sseSupport;
        this.heartbeatInterval = Duration.ofSeconds(appProperties.getEvents().getHeartbeatSeconds());
    }

    /**
     * Follows a run's events from now on. Events emitted before subscribing are not replayed.
     *
     * @param runId run to follow
     * @param response servlet response, for proxy headers
     * @return SSE stream of {@code llm} events interleaved with keepalive comments
     */
    @GetMapping(value = "/{runId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> events(@PathVariable String runId, HttpServletResponse response) {
        sseSupport.configureStreamingHeaders(response);
        log.debug("[LLM] Event subscriber attached runId={}", runId);

        Flux<String> payloads = eventStreams.subscribe(runId).publish().refCount(2);
        return Flux.merge(sseSupport.llmEvents(payloads), sseSupport.heartbeats(payloads, heartbeatInterval));
    }

    /**
     * Closes a run's event stream; current subscribers complete.
     *
     * @param runId run to close
     * @return 204 when a stream was open, 404 otherwise
     */
    @DeleteMapping("/{runId}/events")
    public ResponseEntity<Void> close(@PathVariable String runId) {
        if (!eventStreams.hasStream(runId)) {
            return ResponseEntity.notFound().build();
        }
        eventStreams.complete(runId);
        log.info("[LLM] Event stream closed runId={}", runId);
        return ResponseEntity.noContent().build();
    }
}

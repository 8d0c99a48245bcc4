package com.williamcallahan.llmgateway.web;

import static com.williamcallahan.llmgateway.web.SseConstants.COMMENT_KEEPALIVE;
import static com.williamcallahan.llmgateway.web.SseConstants.EVENT_LLM;
import static com.williamcallahan.llmgateway.web.SseConstants.HEADER_ACCEL_BUFFERING;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Duration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Shared SSE helpers: streaming headers, event framing and heartbeats.
 */
@Component
public class SseSupport {

    private static final Counter DROPPED_HEARTBEAT_COUNTER =
            Metrics.counter("llm.sse.backpressure.dropped_heartbeats");

    /**
     * Configures HTTP response headers for SSE streaming through proxies.
     *
     * @param response the servlet response to configure
     */
    public void configureStreamingHeaders(HttpServletResponse response) {
        response.addHeader(HEADER_ACCEL_BUFFERING, "no");
        response.addHeader(HttpHeaders.CACHE_CONTROL, "no-cache, no-transform");
    }

    /**
     * Frames serialized gateway events as {@code event: llm} SSE messages.
     *
     * @param payloads JSON event payloads
     * @return SSE events
     */
    public Flux<ServerSentEvent<String>> llmEvents(Flux<String> payloads) {
        return payloads.map(json -> ServerSentEvent.<String>builder().event(EVENT_LLM).data(json).build());
    }

    /**
     * Creates a heartbeat Flux that emits SSE comments until {@code terminateOn} completes.
     *
     * @param terminateOn stream whose termination stops the heartbeats
     * @param interval time between heartbeats
     * @return Flux of SSE comment events for keepalive
     */
    public Flux<ServerSentEvent<String>> heartbeats(Flux<?> terminateOn, Duration interval) {
        return Flux.interval(interval)
                .onBackpressureDrop(ignoredTick -> DROPPED_HEARTBEAT_COUNTER.increment())
                .takeUntilOther(terminateOn.ignoreElements())
                .map(tick -> ServerSentEvent.<String>builder()
                        .comment(COMMENT_KEEPALIVE)
                        .build());
    }
}

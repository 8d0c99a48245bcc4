package com.williamcallahan.llmgateway.web;

/**
 * SSE event naming and header values shared by the event stream endpoints.
 *
 * @see LlmEventStreamController
 */
public final class SseConstants {

    /** SSE event name carried by every gateway lifecycle event. */
    public static final String EVENT_LLM = "llm";

    /** SSE comment content for keepalive heartbeats. */
    public static final String COMMENT_KEEPALIVE = "keepalive";

    /** Response header that turns off proxy buffering in Nginx. */
    public static final String HEADER_ACCEL_BUFFERING = "X-Accel-Buffering";

    private SseConstants() {
        // Non-instantiable utility class
    }
}

package com.williamcallahan.llmgateway.service;

/**
 * Notified when a gateway call starts and stops, so callers can account LLM-active time.
 */
public interface LlmActiveWindowListener {

    /** Listener that ignores every notification. */
    LlmActiveWindowListener NONE = new LlmActiveWindowListener() {
        @Override
        public void windowStarted(String runId, String traceId) {
        }

        @Override
        public void windowStopped(String runId, String traceId) {
        }
    };

    void windowStarted(String runId, String traceId);

    void windowStopped(String runId, String traceId);
}

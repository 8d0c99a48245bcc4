package com.williamcallahan.llmgateway.service;

/**
 * An open span around a gateway call or a provider chain entry.
 */
public interface TelemetrySpan {

    /** Attaches a tag to the span. Null values are ignored. */
    void setAttribute(String key, Object value);

    /** Records a failure against the span without ending it. */
    void recordError(Throwable failure);

    /** Ends the span. Calling it more than once has no further effect. */
    void end();
}

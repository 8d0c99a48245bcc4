package com.williamcallahan.llmgateway.service;

import java.util.Objects;

/**
 * Groups the sinks that observe every gateway call: live events, request audit and telemetry.
 *
 * @param events lifecycle event sink
 * @param audit request audit writer
 * @param telemetry span and counter recorder
 */
public record GatewayObservers(LlmEventEmitter events, RequestAuditService audit, GatewayTelemetry telemetry) {
    public GatewayObservers {
        Objects.requireNonNull(events, "events");
        Objects.requireNonNull(audit, "audit");
        Objects.requireNonNull(telemetry, "telemetry");
    }
}

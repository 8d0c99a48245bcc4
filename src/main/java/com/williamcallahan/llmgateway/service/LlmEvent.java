package com.williamcallahan.llmgateway.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One lifecycle event, flattened into a JSON-serializable payload.
 *
 * @param type event type, see {@link LlmEventTypes}
 * @param runId run the event belongs to
 * @param fields type-specific fields in emission order
 */
public record LlmEvent(String type, String runId, Map<String, Object> fields) {
    public LlmEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(runId, "runId");
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /** Creates a builder for an event of the given type. */
    public static Builder builder(String type, String runId) {
        return new Builder(type, runId);
    }

    /**
     * Returns the wire payload: {@code event}, {@code type} and {@code runId} followed by the
     * type-specific fields.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", LlmEventTypes.ENVELOPE);
        payload.put("type", type);
        payload.put("runId", runId);
        payload.putAll(fields);
        return payload;
    }

    /** Reads one field, or null when absent. */
    public Object field(String name) {
        return fields.get(name);
    }

    /**
     * Accumulates fields in insertion order. Null values are kept so that optional fields such as
     * {@code instructionsHash} appear explicitly in the payload.
     */
    public static final class Builder {
        private final String type;
        private final String runId;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder(String type, String runId) {
            this.type = type;
            this.runId = runId;
        }

        public Builder put(String name, Object value) {
            fields.put(name, value);
            return this;
        }

        /** Adds a field only when the value is non-null. */
        public Builder putIfPresent(String name, Object value) {
            if (value != null) {
                fields.put(name, value);
            }
            return this;
        }

        public LlmEvent build() {
            return new LlmEvent(type, runId, fields);
        }
    }
}

package com.williamcallahan.llmgateway.service;

import com.williamcallahan.llmgateway.domain.llm.ProviderHandle;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-backed gateway telemetry: Observation spans and low-cardinality counters.
 */
public class MicrometerGatewayTelemetry implements GatewayTelemetry {

    static final String TOKENS_COUNTER = "llm.tokens.total";
    static final String FAILURES_COUNTER = "llm.failures.total";
    static final String FALLBACK_COUNTER = "llm.provider.fallback.total";
    static final String BUDGET_ABORT_COUNTER = "llm.budget.abort.total";
    static final String SSE_CONSUMERS_GAUGE = "llm.sse.consumers";

    private static final int MAX_TAG_LENGTH = 64;

    private final MeterRegistry meterRegistry;
    private final ObservationRegistry observationRegistry;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final AtomicInteger eventSubscribers = new AtomicInteger();

    /**
     * Creates telemetry bound to the given registries.
     *
     * @param meterRegistry counter registry
     * @param observationRegistry span registry
     */
    public MicrometerGatewayTelemetry(MeterRegistry meterRegistry, ObservationRegistry observationRegistry) {
        this.meterRegistry = meterRegistry;
        this.observationRegistry = observationRegistry;
        meterRegistry.gauge(SSE_CONSUMERS_GAUGE, eventSubscribers);
    }

    @Override
    public TelemetrySpan startCallSpan(String runId, String traceId, List<String> chainLabels) {
        Observation observation = Observation.createNotStarted("llm.call", observationRegistry)
                .highCardinalityKeyValue("run_id", String.valueOf(runId))
                .highCardinalityKeyValue("trace_id", String.valueOf(traceId))
                .highCardinalityKeyValue("llm.chain", String.join(",", chainLabels))
                .start();
        return new ObservationSpan(observation);
    }

    @Override
    public TelemetrySpan startProviderSpan(TelemetrySpan parent, ProviderHandle handle, String model) {
        Observation observation = Observation.createNotStarted("llm.provider", observationRegistry)
                .lowCardinalityKeyValue("llm.provider", safeTag(handle.provider()))
                .lowCardinalityKeyValue("llm.model", safeTag(model))
                .highCardinalityKeyValue("llm.chain_index", Integer.toString(handle.chainIndex()));
        if (parent instanceof ObservationSpan parentSpan) {
            observation.parentObservation(parentSpan.observation);
        }
        return new ObservationSpan(observation.start());
    }

    @Override
    public void recordTokens(String provider, String model, String kind, long tokens) {
        if (tokens <= 0) {
            return;
        }
        counter(TOKENS_COUNTER, "provider", provider, "model", model, "kind", kind).increment(tokens);
    }

    @Override
    public void recordFailure(String provider, String model, String category) {
        counter(FAILURES_COUNTER, "provider", provider, "model", model, "category", category).increment();
    }

    @Override
    public void recordFallback(ProviderHandle from, ProviderHandle to, String category) {
        counter(FALLBACK_COUNTER,
                "from_provider", from.provider(),
                "from_model", from.model(),
                "to_provider", to.provider(),
                "to_model", to.model(),
                "category", category).increment();
    }

    @Override
    public void recordBudgetAbort(String provider, String model, String reason) {
        counter(BUDGET_ABORT_COUNTER, "provider", provider, "model", model, "reason", reason).increment();
    }

    @Override
    public void recordEventSubscribers(int delta) {
        eventSubscribers.addAndGet(delta);
    }

    private Counter counter(String name, String... tagPairs) {
        String[] safeTags = new String[tagPairs.length];
        StringBuilder cacheKey = new StringBuilder(name);
        for (int index = 0; index < tagPairs.length; index += 2) {
            safeTags[index] = tagPairs[index];
            safeTags[index + 1] = safeTag(tagPairs[index + 1]);
            cacheKey.append('|').append(safeTags[index]).append('=').append(safeTags[index + 1]);
        }
        return counters.computeIfAbsent(cacheKey.toString(),
                ignored -> Counter.builder(name).tags(safeTags).register(meterRegistry));
    }

    private static String safeTag(String raw) {
        if (raw == null) {
            return "none";
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return "none";
        }
        if (trimmed.length() > MAX_TAG_LENGTH) {
            trimmed = trimmed.substring(0, MAX_TAG_LENGTH);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    private static final class ObservationSpan implements TelemetrySpan {
        private final Observation observation;
        private final AtomicBoolean ended = new AtomicBoolean(false);

        private ObservationSpan(Observation observation) {
            this.observation = observation;
        }

        @Override
        public void setAttribute(String key, Object value) {
            if (value != null) {
                observation.highCardinalityKeyValue(key, String.valueOf(value));
            }
        }

        @Override
        public void recordError(Throwable failure) {
            observation.error(failure);
        }

        @Override
        public void end() {
            if (ended.compareAndSet(false, true)) {
                observation.stop();
            }
        }
    }
}

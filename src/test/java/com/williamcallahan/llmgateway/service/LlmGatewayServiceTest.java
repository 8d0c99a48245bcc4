package com.williamcallahan.llmgateway.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.llmgateway.domain.llm.CallMetadata;
import com.williamcallahan.llmgateway.domain.llm.CallParameters;
import com.williamcallahan.llmgateway.domain.llm.CallSummary;
import com.williamcallahan.llmgateway.domain.llm.ProviderEvent;
import com.williamcallahan.llmgateway.domain.llm.ProviderHandle;
import com.williamcallahan.llmgateway.domain.llm.ProviderUsage;
import com.williamcallahan.llmgateway.domain.llm.UsageReport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

/**
 * Verifies retry, failover, budget, cancellation and audit behavior of the gateway loop.
 */
class LlmGatewayServiceTest {

    private static final ProviderHandle ALPHA = new ProviderHandle("alpha", "a-1", 0);
    private static final ProviderHandle BETA = new ProviderHandle("beta", "b-1", 1);
    private static final ProviderHandle GAMMA = new ProviderHandle("gamma", "g-1", 2);

    private final RecordingEventEmitter events = new RecordingEventEmitter();
    private final InMemoryArtifactStore artifacts = new InMemoryArtifactStore();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final ProviderStreamRegistry registry = new ProviderStreamRegistry();
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    @Test
    void successfulCallEmitsLifecycleAndReturnsSummary() {
        registry.register("alpha", (prompt, params, handle, metadata) -> stream(
                ProviderEvent.token("Hello"), ProviderEvent.token(" world"), ProviderEvent.complete("stop")));

        CallSummary summary = gateway(List.of(ALPHA), 2, null, null)
                .run("run-1", "trace-1", "say hi", CallParameters.empty(), null, CancellationToken.create());

        assertEquals("alpha", summary.provider());
        assertEquals("a-1", summary.model());
        assertEquals(2, summary.tokensPrompt());
        assertEquals(2, summary.tokensCompletion());
        assertEquals(CallSummary.FINISH_STOP, summary.finishReason());
        assertEquals("Hello world", summary.text());
        assertNull(summary.error());
        assertEquals(List.of(
                        LlmEventTypes.PROVIDER_SELECTED,
                        LlmEventTypes.STARTING,
                        LlmEventTypes.TOKEN,
                        LlmEventTypes.TOKEN,
                        LlmEventTypes.COMPLETE,
                        LlmEventTypes.PROVIDER_SUCCEEDED),
                events.types());
        assertEquals(1, events.ofType(LlmEventTypes.TOKEN).get(1).field("idx"));
        assertTrue(artifacts.contains("artifacts/llm/run-1/0001/request.json"));
        assertEquals(2.0, meterRegistry.get("llm.tokens.total").tag("kind", "completion").counter().count());
    }

    @Test
    void retriesRetryableFailureOnSameProviderWithBackoff() {
        AtomicInteger calls = new AtomicInteger();
        registry.register("alpha", (prompt, params, handle, metadata) -> {
            if (calls.incrementAndGet() == 1) {
                throw new RetryableLlmProviderException("rate limited", LlmErrorCategories.RATE_LIMIT);
            }
            assertEquals(2, metadata.attemptNumber());
            return stream(ProviderEvent.token("ok"), ProviderEvent.complete("stop"));
        });

        CallSummary summary = gateway(List.of(ALPHA), 2, null, null)
                .run("run-2", "trace-2", "prompt", CallParameters.empty(), null, null);

        assertEquals(CallSummary.FINISH_STOP, summary.finishReason());
        assertEquals(2, calls.get());
        assertEquals(List.of(Duration.ofMillis(100)), sleeps);
        assertEquals(2, events.ofType(LlmEventTypes.STARTING).size());
        assertEquals(1, events.ofType(LlmEventTypes.PROVIDER_SELECTED).size());
        assertEquals(LlmErrorCategories.RATE_LIMIT, events.single(LlmEventTypes.ERROR).field("category"));
        assertTrue(events.ofType(LlmEventTypes.PROVIDER_FAILED).isEmpty());
        assertTrue(artifacts.contains("artifacts/llm/run-2/0001/request.json"));
        assertTrue(artifacts.contains("artifacts/llm/run-2/0002/request.json"));
        assertEquals(1.0, meterRegistry.get("llm.failures.total").counter().count());
    }

    @Test
    void backoffDoublesBetweenRetries() {
        AtomicInteger calls = new AtomicInteger();
        registry.register("alpha", (prompt, params, handle, metadata) -> {
            if (calls.incrementAndGet() < 3) {
                throw new RetryableLlmProviderException("timeout", LlmErrorCategories.TIMEOUT);
            }
            return stream(ProviderEvent.complete("stop"));
        });

        gateway(List.of(ALPHA), 2, null, null).run("run-3", null, "prompt", null, null, null);

        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    void violationIsNeitherRetriedNorFailedOver() {
        AtomicInteger betaCalls = new AtomicInteger();
        registry.register("alpha", (prompt, params, handle, metadata) -> {
            throw new LlmCapExceededException("context window exceeded");
        });
        registry.register("beta", (prompt, params, handle, metadata) -> {
            betaCalls.incrementAndGet();
            return stream(ProviderEvent.complete("stop"));
        });

        LlmGatewayService gateway = gateway(List.of(ALPHA, BETA), 3, null, null);

        LlmCapExceededException failure = assertThrows(LlmCapExceededException.class,
                () -> gateway.run("run-4", "trace-4", "prompt", null, null, null));
        assertTrue(failure.isViolation());
        assertEquals(0, betaCalls.get());
        assertTrue(sleeps.isEmpty());
        assertEquals(1, events.ofType(LlmEventTypes.STARTING).size());
        assertEquals(true, events.single(LlmEventTypes.ERROR).field("violation"));
        assertTrue(events.ofType(LlmEventTypes.PROVIDER_FAILOVER).isEmpty());
    }

    @Test
    void failsOverToNextProviderOnceRetriesAreSpent() {
        AtomicInteger alphaCalls = new AtomicInteger();
        registry.register("alpha", (prompt, params, handle, metadata) -> {
            alphaCalls.incrementAndGet();
            throw new RetryableLlmProviderException("upstream 503", LlmErrorCategories.SERVER_ERROR);
        });
        registry.register("beta", (prompt, params, handle, metadata) ->
                stream(ProviderEvent.token("fallback"), ProviderEvent.complete("stop")));

        CallSummary summary = gateway(List.of(ALPHA, BETA), 1, null, null)
                .run("run-5", "trace-5", "prompt", null, null, null);

        assertEquals("beta", summary.provider());
        assertEquals("b-1", summary.model());
        assertEquals(2, alphaCalls.get());
        LlmEvent failover = events.single(LlmEventTypes.PROVIDER_FAILOVER);
        assertEquals("alpha", failover.field("fromProvider"));
        assertEquals("beta", failover.field("toProvider"));
        assertEquals("b-1", failover.field("toModel"));
        assertEquals(LlmErrorCategories.SERVER_ERROR, failover.field("category"));
        assertEquals(1, events.ofType(LlmEventTypes.PROVIDER_FAILED).size());
        assertEquals(1.0, meterRegistry.get("llm.provider.fallback.total").counter().count());
        assertEquals(3, artifacts.size());
    }

    @Test
    void chainOfThreeSelectsEachEntryOnceAndFailsOverTwice() {
        registry.register("alpha", (prompt, params, handle, metadata) -> {
            throw new LlmProviderException("quota", false, LlmErrorCategories.QUOTA_EXCEEDED, false);
        });
        registry.register("beta", (prompt, params, handle, metadata) -> {
            throw new RetryableLlmProviderException("slow", LlmErrorCategories.TIMEOUT);
        });
        registry.register("gamma", (prompt, params, handle, metadata) -> stream(ProviderEvent.complete("stop")));

        CallSummary summary = gateway(List.of(ALPHA, BETA, GAMMA), 0, null, null)
                .run("run-25", "trace-25", "prompt", null, null, null);

        assertEquals("gamma", summary.provider());
        assertEquals(3, events.ofType(LlmEventTypes.PROVIDER_SELECTED).size());
        assertEquals(3, events.ofType(LlmEventTypes.STARTING).size());
        assertEquals(2, events.ofType(LlmEventTypes.PROVIDER_FAILOVER).size());
        assertEquals(1, events.ofType(LlmEventTypes.PROVIDER_SUCCEEDED).size());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void exhaustedChainListsEveryAttemptedProvider() {
        for (String provider : List.of("alpha", "beta", "gamma")) {
            registry.register(provider, (prompt, params, handle, metadata) -> {
                throw new RetryableLlmProviderException(provider + " down");
            });
        }

        LlmGatewayService gateway = gateway(List.of(ALPHA, BETA, GAMMA), 0, null, null);

        AllProvidersExhaustedException failure = assertThrows(AllProvidersExhaustedException.class,
                () -> gateway.run("run-6", "trace-6", "prompt", null, null, null));
        assertEquals(List.of("alpha:a-1", "beta:b-1", "gamma:g-1"), failure.getAttemptedProviders());
        assertInstanceOf(RetryableLlmProviderException.class, failure.getCause());
        assertEquals("gamma down", failure.getCause().getMessage());
        assertEquals(2, events.ofType(LlmEventTypes.PROVIDER_FAILOVER).size());
        assertEquals(3, events.ofType(LlmEventTypes.PROVIDER_FAILED).size());
    }

    @Test
    void failureOutsideFailoverCategoriesIsRethrownUnchanged() {
        LlmProviderException invalidRequest =
                new LlmProviderException("bad request", false, "invalid_request", false);
        registry.register("alpha", (prompt, params, handle, metadata) -> {
            throw invalidRequest;
        });
        registry.register("beta", (prompt, params, handle, metadata) -> stream(ProviderEvent.complete("stop")));

        LlmGatewayService gateway = gateway(List.of(ALPHA, BETA), 2, null, null);

        LlmProviderException failure = assertThrows(LlmProviderException.class,
                () -> gateway.run("run-7", "trace-7", "prompt", null, null, null));
        assertSame(invalidRequest, failure);
        assertTrue(events.ofType(LlmEventTypes.PROVIDER_FAILOVER).isEmpty());
    }

    @Test
    void tokenCapCancelsProviderAndStopsTokenEvents() {
        AtomicBoolean canceled = new AtomicBoolean();
        registry.register("alpha", (prompt, params, handle, metadata) -> ProviderStream.of(
                List.<ProviderEvent>of(
                        ProviderEvent.token("one"),
                        ProviderEvent.token("two"),
                        ProviderEvent.token("three"),
                        ProviderEvent.token("four"),
                        ProviderEvent.complete("stop")).iterator(),
                () -> canceled.set(true),
                null));

        CallSummary summary = gateway(List.of(ALPHA), 2, 2, null)
                .run("run-8", "trace-8", "prompt", null, null, null);

        assertTrue(canceled.get());
        assertTrue(summary.budgetExhausted());
        assertEquals(CallSummary.FINISH_STOP_ON_BUDGET, summary.finishReason());
        assertEquals(CallSummary.ERROR_BUDGET_EXHAUSTED, summary.error());
        assertEquals(2, summary.tokensCompletion());
        assertEquals(2, events.ofType(LlmEventTypes.TOKEN).size());
        assertEquals("token_cap", events.single(LlmEventTypes.BUDGET_EXHAUSTED).field("reason"));
        assertEquals(true, events.single(LlmEventTypes.COMPLETE).field("budgetExhausted"));
        List<String> types = events.types();
        assertEquals(List.of(
                        LlmEventTypes.ERROR,
                        LlmEventTypes.BUDGET_EXHAUSTED,
                        LlmEventTypes.COMPLETE,
                        LlmEventTypes.PROVIDER_SUCCEEDED),
                types.subList(types.size() - 4, types.size()));
        assertEquals(1.0, meterRegistry.get("llm.budget.abort.total").counter().count());
    }

    @Test
    void perCallMaxTokensTightensGlobalCap() {
        registry.register("alpha", (prompt, params, handle, metadata) -> stream(
                ProviderEvent.token("one"), ProviderEvent.token("two"), ProviderEvent.complete("stop")));

        CallSummary summary = gateway(List.of(ALPHA), 2, 10, null).run(
                "run-9", "trace-9", "prompt", CallParameters.builder().maxTokens(1).build(), null, null);

        assertEquals(CallSummary.FINISH_STOP_ON_BUDGET, summary.finishReason());
        assertEquals(1, summary.tokensCompletion());
        assertEquals(1, events.ofType(LlmEventTypes.TOKEN).size());
    }

    @Test
    void costCapUsesReportedCost() {
        registry.register("alpha", (prompt, params, handle, metadata) -> stream(
                ProviderEvent.token("cheap", UsageReport.cost(0.02)),
                ProviderEvent.token("pricey", UsageReport.cost(0.06)),
                ProviderEvent.token("never", UsageReport.cost(0.09)),
                ProviderEvent.complete("stop")));

        CallSummary summary = gateway(List.of(ALPHA), 2, null, 0.05)
                .run("run-10", "trace-10", "prompt", null, null, null);

        assertEquals(CallSummary.FINISH_STOP_ON_BUDGET, summary.finishReason());
        assertEquals(0.06, summary.costUsd());
        assertEquals("cost_cap", events.single(LlmEventTypes.BUDGET_EXHAUSTED).field("reason"));
        assertEquals(2, events.ofType(LlmEventTypes.TOKEN).size());
    }

    @Test
    void reportedUsageReplacesEstimatesAndIsWrittenBackToStream() {
        ProviderUsage usage = ProviderUsage.ofPromptTokens(42);
        registry.register("alpha", (prompt, params, handle, metadata) -> ProviderStream.of(
                List.<ProviderEvent>of(
                        ProviderEvent.token("a b c"),
                        ProviderEvent.token("d", UsageReport.completionTokens(7)),
                        ProviderEvent.complete("length", new UsageReport(null, 9, 0.01))).iterator(),
                null,
                usage));

        CallSummary summary = gateway(List.of(ALPHA), 2, null, null)
                .run("run-11", "trace-11", "prompt words here", null, null, null);

        assertEquals(42, summary.tokensPrompt());
        assertEquals(9, summary.tokensCompletion());
        assertEquals("length", summary.finishReason());
        assertEquals(0.01, summary.costUsd());
        assertEquals(9, usage.completionTokens());
        assertEquals(0.01, usage.costUsd());
        assertEquals(9.0, meterRegistry.get("llm.tokens.total").tag("kind", "completion").counter().count());
    }

    @Test
    void cancellationBeforeFirstEventReturnsCanceledSummary() {
        AtomicBoolean providerCanceled = new AtomicBoolean();
        registry.register("alpha", (prompt, params, handle, metadata) -> ProviderStream.of(
                List.<ProviderEvent>of(ProviderEvent.token("late"), ProviderEvent.complete("stop")).iterator(),
                () -> providerCanceled.set(true),
                null));
        CancellationToken cancelToken = CancellationToken.create();
        cancelToken.cancel();

        CallSummary summary = gateway(List.of(ALPHA), 2, null, null)
                .run("run-12", "trace-12", "prompt", null, null, cancelToken);

        assertEquals(CallSummary.FINISH_CANCELED, summary.finishReason());
        assertEquals(0, summary.tokensCompletion());
        assertTrue(providerCanceled.get());
        assertTrue(events.ofType(LlmEventTypes.TOKEN).isEmpty());
        assertEquals("cancel_token", events.single(LlmEventTypes.CANCELED).field("reason"));
        assertTrue(events.ofType(LlmEventTypes.PROVIDER_SUCCEEDED).isEmpty());
    }

    @Test
    void cancellationMidStreamStopsBeforeNextEvent() {
        CancellationToken cancelToken = CancellationToken.create();
        List<ProviderEvent> scripted = List.of(
                ProviderEvent.token("first"), ProviderEvent.token("second"), ProviderEvent.complete("stop"));
        registry.register("alpha", (prompt, params, handle, metadata) -> ProviderStream.of(
                cancelAfterFirst(scripted.iterator(), cancelToken), null, null));

        CallSummary summary = gateway(List.of(ALPHA), 2, null, null)
                .run("run-13", "trace-13", "prompt", null, null, cancelToken);

        assertEquals(CallSummary.FINISH_CANCELED, summary.finishReason());
        assertEquals("first", summary.text());
        assertEquals(1, events.ofType(LlmEventTypes.TOKEN).size());
    }

    @Test
    void missingAdapterFailsOverAsProviderUnavailable() {
        registry.register("beta", (prompt, params, handle, metadata) -> stream(ProviderEvent.complete("stop")));

        CallSummary summary = gateway(List.of(ALPHA, BETA), 2, null, null)
                .run("run-14", "trace-14", "prompt", null, null, null);

        assertEquals("beta", summary.provider());
        LlmEvent error = events.single(LlmEventTypes.ERROR);
        assertEquals(LlmErrorCategories.PROVIDER_UNAVAILABLE, error.field("category"));
        assertEquals(false, error.field("retryable"));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void inBandErrorEventIsClassifiedAndRetried() {
        AtomicInteger calls = new AtomicInteger();
        registry.register("alpha", (prompt, params, handle, metadata) -> calls.incrementAndGet() == 1
                ? stream(ProviderEvent.token("partial"),
                        ProviderEvent.error("overloaded", true, LlmErrorCategories.SERVER_ERROR, false))
                : stream(ProviderEvent.token("whole"), ProviderEvent.complete("stop")));

        CallSummary summary = gateway(List.of(ALPHA), 2, null, null)
                .run("run-15", "trace-15", "prompt", null, null, null);

        assertEquals("whole", summary.text());
        assertEquals(2, calls.get());
        assertEquals("overloaded", events.single(LlmEventTypes.ERROR).field("message"));
    }

    @Test
    void adapterIterationFailureBecomesProviderError() {
        registry.register("alpha", (prompt, params, handle, metadata) -> ProviderStream.of(
                new Iterator<ProviderEvent>() {
                    @Override
                    public boolean hasNext() {
                        return true;
                    }

                    @Override
                    public ProviderEvent next() {
                        throw new IllegalStateException("socket reset");
                    }
                },
                null,
                null));
        registry.register("beta", (prompt, params, handle, metadata) -> stream(ProviderEvent.complete("stop")));

        CallSummary summary = gateway(List.of(ALPHA, BETA), 2, null, null)
                .run("run-16", "trace-16", "prompt", null, null, null);

        assertEquals("beta", summary.provider());
        assertEquals(LlmErrorCategories.PROVIDER_ERROR, events.single(LlmEventTypes.ERROR).field("category"));
    }

    @Test
    void streamEndingWithoutCompleteFinishesAsStop() {
        registry.register("alpha", (prompt, params, handle, metadata) -> stream(ProviderEvent.token("tail")));

        CallSummary summary = gateway(List.of(ALPHA), 2, null, null)
                .run("run-17", "trace-17", "prompt", null, null, null);

        assertEquals(CallSummary.FINISH_STOP, summary.finishReason());
        assertEquals(CallSummary.FINISH_STOP, events.single(LlmEventTypes.COMPLETE).field("finishReason"));
    }

    @Test
    void auditRecordIsRedactedAndWrittenBeforeProviderIsCalled() throws Exception {
        AtomicInteger recordsAtInvocation = new AtomicInteger(-1);
        registry.register("alpha", (prompt, params, handle, metadata) -> {
            recordsAtInvocation.set(artifacts.size());
            return stream(ProviderEvent.complete("stop"));
        });
        CallParameters parameters = CallParameters.builder()
                .temperature(0.2)
                .extra("api_key", "sk-live-123")
                .extra("system", "Answer tersely")
                .build();

        gateway(List.of(ALPHA), 2, null, null)
                .run("run-18", "trace-18", "secret prompt text", parameters, "sha256:ctx", null);

        assertEquals(1, recordsAtInvocation.get());
        String json = artifacts.read("artifacts/llm/run-18/0001/request.json");
        assertFalse(json.contains("sk-live-123"));
        assertFalse(json.contains("secret prompt text"));
        assertFalse(json.contains("Answer tersely"));

        JsonNode auditRecord = new ObjectMapper().readTree(json);
        ContentHasher hasher = new ContentHasher();
        assertEquals("trace-18", auditRecord.get("traceId").asText());
        assertEquals("alpha", auditRecord.get("provider").asText());
        assertEquals("a-1", auditRecord.get("model").asText());
        assertEquals("***", auditRecord.get("params").get("extra").get("api_key").asText());
        assertEquals(hasher.hashPrompt("secret prompt text"), auditRecord.get("promptHash").asText());
        assertEquals(hasher.hashText("Answer tersely"), auditRecord.get("instructionsHash").asText());
        assertEquals("sha256:ctx", auditRecord.get("contextHash").asText());

        LlmEvent starting = events.single(LlmEventTypes.STARTING);
        assertEquals(auditRecord.get("promptHash").asText(), starting.field("promptHash"));
        assertTrue(((String) starting.field("paramsHash")).startsWith(ContentHasher.ALGORITHM_TAG));
    }

    @Test
    void artifactFailureAbortsBeforeProviderIsCalled() {
        AtomicInteger calls = new AtomicInteger();
        registry.register("alpha", (prompt, params, handle, metadata) -> {
            calls.incrementAndGet();
            return stream(ProviderEvent.complete("stop"));
        });
        artifacts.failWrites();

        LlmGatewayService gateway = gateway(List.of(ALPHA), 2, null, null);

        assertThrows(UncheckedIOException.class, () -> gateway.run("run-19", "trace-19", "prompt", null, null, null));
        assertEquals(0, calls.get());
    }

    @Test
    void emptyChainIsAConfigurationError() {
        LlmGatewayService gateway = gateway(List.of(), 2, null, null);

        assertThrows(ProviderChainConfigurationException.class,
                () -> gateway.run("run-20", "trace-20", "prompt", null, null, null));
    }

    @Test
    void activeWindowIsClosedEvenWhenTheCallFails() {
        List<String> windowSignals = new ArrayList<>();
        LlmActiveWindowListener listener = new LlmActiveWindowListener() {
            @Override
            public void windowStarted(String runId, String traceId) {
                windowSignals.add("start:" + runId);
            }

            @Override
            public void windowStopped(String runId, String traceId) {
                windowSignals.add("stop:" + runId);
            }
        };
        registry.register("alpha", (prompt, params, handle, metadata) -> {
            throw new LlmCapExceededException("too long");
        });
        LlmGatewayService gateway = new LlmGatewayService(
                hint -> List.of(ALPHA), registry, observers(), new ContentHasher(), new WordCountTokenEstimator(),
                new GatewaySettings(0, new RetryBackoff(0, 0), null, null), sleeps::add, listener);

        assertThrows(LlmCapExceededException.class, () -> gateway.run("run-21", "t", "p", null, null, null));
        assertEquals(List.of("start:run-21", "stop:run-21"), windowSignals);
    }

    @Test
    void callerModelOverridesChainModel() {
        List<String> requestedModels = new CopyOnWriteArrayList<>();
        registry.register("alpha", (prompt, params, handle, metadata) -> {
            requestedModels.add(params.model());
            return stream(ProviderEvent.complete("stop"));
        });

        CallSummary summary = gateway(List.of(ALPHA), 2, null, null).run(
                "run-22", "trace-22", "prompt", CallParameters.builder().model("a-2").build(), null, null);

        assertEquals(List.of("a-2"), requestedModels);
        assertEquals("a-2", summary.model());
    }

    @Test
    void runAsyncEmitsSummary() {
        registry.register("alpha", (prompt, params, handle, metadata) ->
                stream(ProviderEvent.token("async"), ProviderEvent.complete("stop")));

        StepVerifier.create(gateway(List.of(ALPHA), 2, null, null)
                        .runAsync("run-23", "trace-23", "prompt", null, null, null))
                .assertNext(summary -> assertEquals("async", summary.text()))
                .verifyComplete();
    }

    @Test
    void registerProviderReplacesExistingAdapter() {
        LlmGatewayService gateway = gateway(List.of(ALPHA), 0, null, null);
        gateway.registerProvider("alpha", (prompt, params, handle, metadata) ->
                stream(ProviderEvent.token("old"), ProviderEvent.complete("stop")));
        gateway.registerProvider("ALPHA", (prompt, params, handle, metadata) ->
                stream(ProviderEvent.token("new"), ProviderEvent.complete("stop")));

        CallSummary summary = gateway.run("run-24", "trace-24", "prompt", null, null, null);

        assertEquals("new", summary.text());
    }

    @Test
    void failedEntrySpanRecordsErrorAndEveryOpenedSpanIsEnded() {
        GatewayTelemetry telemetry = mock(GatewayTelemetry.class);
        TelemetrySpan callSpan = mock(TelemetrySpan.class);
        TelemetrySpan alphaSpan = mock(TelemetrySpan.class);
        TelemetrySpan betaSpan = mock(TelemetrySpan.class);
        when(telemetry.startCallSpan(anyString(), anyString(), anyList())).thenReturn(callSpan);
        when(telemetry.startProviderSpan(callSpan, ALPHA, "a-1")).thenReturn(alphaSpan);
        when(telemetry.startProviderSpan(callSpan, BETA, "b-1")).thenReturn(betaSpan);
        registry.register("alpha", (prompt, params, handle, metadata) -> {
            throw new LlmProviderException("upstream 500", false, LlmErrorCategories.PROVIDER_ERROR, false);
        });
        registry.register("beta", (prompt, params, handle, metadata) ->
                stream(ProviderEvent.token("ok"), ProviderEvent.complete("stop")));

        LlmGatewayService gateway = new LlmGatewayService(
                hint -> List.of(ALPHA, BETA),
                registry,
                new GatewayObservers(events, new RequestAuditService(artifacts, new RunAttemptSequencer()), telemetry),
                new ContentHasher(),
                new WordCountTokenEstimator(),
                new GatewaySettings(0, new RetryBackoff(100, 0), null, null),
                sleeps::add,
                LlmActiveWindowListener.NONE);

        CallSummary summary = gateway.run("run-25", "trace-25", "prompt", null, null, null);

        assertEquals("beta", summary.provider());
        verify(alphaSpan).recordError(any(LlmProviderException.class));
        verify(alphaSpan).end();
        verify(betaSpan).setAttribute("llm.finish_reason", CallSummary.FINISH_STOP);
        verify(betaSpan).setAttribute("llm.completion_tokens", 1);
        verify(betaSpan).end();
        verify(callSpan).setAttribute(eq("llm.provider"), eq("beta"));
        verify(callSpan, times(1)).end();
        verify(telemetry).recordFallback(ALPHA, BETA, LlmErrorCategories.PROVIDER_ERROR);
    }

    @Test
    void missingTraceIdStillReachesTheProvider() {
        List<CallMetadata> seen = new CopyOnWriteArrayList<>();
        registry.register("alpha", (prompt, params, handle, metadata) -> {
            seen.add(metadata);
            return stream(ProviderEvent.token("ok"), ProviderEvent.complete("stop"));
        });

        CallSummary summary = gateway(List.of(ALPHA), 0, null, null)
                .run("run-26", null, "prompt", null, null, null);

        assertEquals(CallSummary.FINISH_STOP, summary.finishReason());
        assertEquals(1, seen.size());
        assertEquals("run-26", seen.get(0).runId());
        assertNull(seen.get(0).traceId());
        assertTrue(events.ofType(LlmEventTypes.PROVIDER_FAILOVER).isEmpty());
    }

    @Test
    void fluxBackedStreamIsReleasedAfterItsCompleteEvent() {
        AtomicBoolean upstreamReleased = new AtomicBoolean();
        AtomicBoolean providerCanceled = new AtomicBoolean();
        registry.register("alpha", (prompt, params, handle, metadata) -> ProviderStream.fromFlux(
                Flux.<ProviderEvent>concat(
                                Flux.<ProviderEvent>just(ProviderEvent.token("hi"), ProviderEvent.complete("stop")),
                                Flux.never())
                        .doOnCancel(() -> upstreamReleased.set(true)),
                () -> providerCanceled.set(true),
                null));

        CallSummary summary = gateway(List.of(ALPHA), 0, null, null)
                .run("run-27", "trace-27", "prompt", null, null, null);

        assertEquals(CallSummary.FINISH_STOP, summary.finishReason());
        assertTrue(upstreamReleased.get());
        assertFalse(providerCanceled.get());
    }

    @Test
    void fluxBackedStreamIsReleasedAfterAnInBandError() {
        AtomicBoolean upstreamReleased = new AtomicBoolean();
        registry.register("alpha", (prompt, params, handle, metadata) -> ProviderStream.fromFlux(
                Flux.<ProviderEvent>concat(
                                Flux.<ProviderEvent>just(ProviderEvent.error(
                                        "overloaded", false, LlmErrorCategories.PROVIDER_ERROR, false)),
                                Flux.<ProviderEvent>never())
                        .doOnCancel(() -> upstreamReleased.set(true)),
                null,
                null));

        LlmGatewayService gateway = gateway(List.of(ALPHA), 0, null, null);

        assertThrows(AllProvidersExhaustedException.class,
                () -> gateway.run("run-28", "trace-28", "prompt", null, null, null));
        assertTrue(upstreamReleased.get());
    }

    private LlmGatewayService gateway(List<ProviderHandle> chain, int retryMax, Integer tokensCap, Double costCap) {
        return new LlmGatewayService(
                hint -> chain,
                registry,
                observers(),
                new ContentHasher(),
                new WordCountTokenEstimator(),
                new GatewaySettings(retryMax, new RetryBackoff(100, 0), tokensCap, costCap),
                sleeps::add,
                LlmActiveWindowListener.NONE);
    }

    private GatewayObservers observers() {
        return new GatewayObservers(
                events,
                new RequestAuditService(artifacts, new RunAttemptSequencer()),
                new MicrometerGatewayTelemetry(meterRegistry, ObservationRegistry.NOOP));
    }

    private static ProviderStream stream(ProviderEvent... scripted) {
        return ProviderStream.of(List.of(scripted));
    }

    private static Iterator<ProviderEvent> cancelAfterFirst(Iterator<ProviderEvent> delegate, CancellationToken token) {
        return new Iterator<>() {
            private boolean first = true;

            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public ProviderEvent next() {
                if (!delegate.hasNext()) {
                    throw new NoSuchElementException();
                }
                ProviderEvent event = delegate.next();
                if (first) {
                    first = false;
                    token.cancel();
                }
                return event;
            }
        };
    }
}

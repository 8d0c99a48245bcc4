package com.williamcallahan.llmgateway.service;

import com.williamcallahan.llmgateway.domain.llm.CallMetadata;
import com.williamcallahan.llmgateway.domain.llm.CallParameters;
import com.williamcallahan.llmgateway.domain.llm.CallSummary;
import com.williamcallahan.llmgateway.domain.llm.ProviderEvent;
import com.williamcallahan.llmgateway.domain.llm.ProviderHandle;
import com.williamcallahan.llmgateway.domain.llm.ProviderUsage;
import com.williamcallahan.llmgateway.domain.llm.UsageReport;
import com.williamcallahan.llmgateway.support.ParameterRedactor;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Executes one logical LLM call against an ordered provider chain.
 *
 * <p>Each chain entry is attempted up to {@code retryMax + 1} times. Retryable failures back off
 * and re-invoke the same provider; failures that are failover-eligible move to the next entry.
 * Violations surface immediately. Every attempt is preceded by a redacted audit record, and the
 * streamed events are checked against token and cost caps and the caller's cancel token.</p>
 *
 * <p>Instances are thread-safe; each call keeps its state on the calling thread.</p>
 */
public class LlmGatewayService {
    private static final Logger log = LoggerFactory.getLogger(LlmGatewayService.class);

    static final String TOKENS_PROMPT = "prompt";
    static final String TOKENS_COMPLETION = "completion";
    static final String CANCEL_REASON_TOKEN = "cancel_token";

    private final ProviderChainResolver chainResolver;
    private final ProviderStreamRegistry providers;
    private final GatewayObservers observers;
    private final ContentHasher hasher;
    private final TokenEstimator tokenEstimator;
    private final GatewaySettings settings;
    private final Sleeper sleeper;
    private final LlmActiveWindowListener activeWindowListener;

    /**
     * Creates the gateway.
     *
     * @param chainResolver turns a provider hint into the ordered chain
     * @param providers registered stream adapters
     * @param observers event, audit and telemetry sinks
     * @param hasher prompt and parameter hashing
     * @param tokenEstimator estimator used when providers do not report usage
     * @param settings retry and budget settings
     * @param sleeper backoff pause
     * @param activeWindowListener notified when a call starts and stops
     */
    public LlmGatewayService(
            ProviderChainResolver chainResolver,
            ProviderStreamRegistry providers,
            GatewayObservers observers,
            ContentHasher hasher,
            TokenEstimator tokenEstimator,
            GatewaySettings settings,
            Sleeper sleeper,
            LlmActiveWindowListener activeWindowListener) {
        this.chainResolver = Objects.requireNonNull(chainResolver, "chainResolver");
        this.providers = Objects.requireNonNull(providers, "providers");
        this.observers = Objects.requireNonNull(observers, "observers");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.tokenEstimator = Objects.requireNonNull(tokenEstimator, "tokenEstimator");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.activeWindowListener = activeWindowListener == null ? LlmActiveWindowListener.NONE : activeWindowListener;
    }

    /**
     * Registers or replaces the stream adapter for a provider name.
     *
     * @param providerName provider name, case-insensitive
     * @param factory stream adapter
     */
    public void registerProvider(String providerName, ProviderStreamFactory factory) {
        providers.register(providerName, factory);
    }

    /**
     * Runs one call to completion on the calling thread.
     *
     * @param runId caller's run identifier
     * @param traceId caller's trace identifier
     * @param prompt prompt text
     * @param parameters call parameters; provider and model act as a chain hint
     * @param contextHash hash of the caller's context bundle, may be null
     * @param cancelToken caller's cancel token, may be null
     * @return summary of the successful, budget-limited or canceled call
     * @throws ProviderChainConfigurationException when the chain resolves to no entries
     * @throws AllProvidersExhaustedException when every chain entry failed over
     * @throws LlmProviderException when a failure is not failover-eligible
     */
    public CallSummary run(
            String runId,
            String traceId,
            String prompt,
            CallParameters parameters,
            String contextHash,
            CancellationToken cancelToken) {
        Objects.requireNonNull(runId, "runId");
        activeWindowListener.windowStarted(runId, traceId);
        try {
            return runChain(
                    runId,
                    traceId,
                    prompt == null ? "" : prompt,
                    parameters == null ? CallParameters.empty() : parameters,
                    contextHash,
                    cancelToken == null ? CancellationToken.create() : cancelToken);
        } finally {
            activeWindowListener.windowStopped(runId, traceId);
        }
    }

    /**
     * Runs one call on the bounded elastic scheduler, since provider streams block while pulled.
     *
     * @return mono emitting the call summary or the call's failure
     */
    public Mono<CallSummary> runAsync(
            String runId,
            String traceId,
            String prompt,
            CallParameters parameters,
            String contextHash,
            CancellationToken cancelToken) {
        return Mono.fromCallable(() -> run(runId, traceId, prompt, parameters, contextHash, cancelToken))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private CallSummary runChain(
            String runId,
            String traceId,
            String prompt,
            CallParameters requested,
            String contextHash,
            CancellationToken cancelToken) {
        String providerHint = requested.providerHint();
        List<ProviderHandle> chain = chainResolver.resolve(providerHint);
        if (chain == null || chain.isEmpty()) {
            throw new ProviderChainConfigurationException(
                    "No LLM providers configured for hint '" + providerHint + "'");
        }
        List<String> chainLabels = chain.stream().map(ProviderHandle::label).toList();
        log.info("[LLM] Starting call runId={} traceId={} chain={}", runId, traceId, chainLabels);

        TelemetrySpan callSpan = observers.telemetry().startCallSpan(runId, traceId, chainLabels);
        List<String> attemptedProviders = new ArrayList<>();
        LlmProviderException lastFailure = null;
        try {
            for (ProviderHandle handle : chain) {
                ProviderAttemptContext context =
                        prepareContext(runId, traceId, prompt, contextHash, cancelToken, handle, chain.size(), requested);
                attemptedProviders.add(handle.label());

                AttemptOutcome outcome = runChainEntry(context, callSpan);
                if (outcome instanceof AttemptOutcome.Success success) {
                    callSpan.setAttribute("llm.provider", handle.provider());
                    callSpan.setAttribute("llm.finish_reason", success.summary().finishReason());
                    return success.summary();
                }

                LlmProviderException failure = failureOf(outcome);
                lastFailure = failure;
                if (!LlmFailoverPolicy.shouldFailover(failure)) {
                    callSpan.recordError(failure);
                    throw failure;
                }
                if (context.hasNextProvider()) {
                    ProviderHandle next = chain.get(handle.chainIndex() + 1);
                    announceFailover(context, next, requested.forHandle(next).model(), failure, outcome.attempt());
                }
            }
            AllProvidersExhaustedException exhausted =
                    new AllProvidersExhaustedException(attemptedProviders, lastFailure);
            log.error("[LLM] All providers exhausted runId={} attempted={}", runId, attemptedProviders);
            callSpan.recordError(exhausted);
            throw exhausted;
        } finally {
            callSpan.end();
        }
    }

    private ProviderAttemptContext prepareContext(
            String runId,
            String traceId,
            String prompt,
            String contextHash,
            CancellationToken cancelToken,
            ProviderHandle handle,
            int chainLength,
            CallParameters requested) {
        CallParameters effective = requested.forHandle(handle);
        Map<String, Object> redacted = ParameterRedactor.redact(effective.toMap());
        return new ProviderAttemptContext(
                runId,
                traceId,
                prompt,
                contextHash,
                cancelToken,
                handle,
                chainLength,
                effective,
                redacted,
                hasher.hashParameters(redacted),
                hasher.hashPrompt(prompt),
                hasher.hashText(effective.instructions()));
    }

    private AttemptOutcome runChainEntry(ProviderAttemptContext context, TelemetrySpan callSpan) {
        emit(LlmEvent.builder(LlmEventTypes.PROVIDER_SELECTED, context.runId())
                .put("provider", context.provider())
                .put("model", context.model())
                .put("paramsHash", context.paramsHash())
                .put("promptHash", context.promptHash())
                .put("instructionsHash", context.instructionsHash())
                .put("chainIndex", context.chainIndex())
                .put("chainLength", context.chainLength())
                .build());
        log.info("[LLM] Provider selected runId={} provider={} model={} chainIndex={}/{}",
                context.runId(), context.provider(), context.model(),
                context.chainIndex() + 1, context.chainLength());

        TelemetrySpan providerSpan =
                observers.telemetry().startProviderSpan(callSpan, context.handle(), context.model());
        try {
            int attempt = 0;
            while (true) {
                attempt++;
                audit(context);
                AttemptOutcome outcome = executeAttempt(context, attempt, providerSpan);
                if (outcome instanceof AttemptOutcome.Success success) {
                    if (!CallSummary.FINISH_CANCELED.equals(success.summary().finishReason())) {
                        emitProviderSucceeded(context, success);
                    }
                    return outcome;
                }

                LlmProviderException failure = failureOf(outcome);
                recordAttemptFailure(context, failure, attempt, providerSpan);
                if (outcome instanceof AttemptOutcome.RetryableFailure
                        && LlmFailoverPolicy.shouldRetry(failure, attempt, settings.retryMax())) {
                    Duration delay = settings.backoff().delayFor(attempt - 1);
                    log.info("[LLM] Retrying provider={} runId={} attempt={}/{} after {}ms",
                            context.provider(), context.runId(), attempt + 1, settings.retryMax() + 1,
                            delay.toMillis());
                    pause(delay);
                    continue;
                }

                emit(LlmEvent.builder(LlmEventTypes.PROVIDER_FAILED, context.runId())
                        .put("provider", context.provider())
                        .put("model", context.model())
                        .put("chainIndex", context.chainIndex())
                        .put("attempt", attempt)
                        .put("category", failure.getCategory())
                        .put("message", failure.getMessage())
                        .put("violation", failure.isViolation())
                        .build());
                return outcome;
            }
        } finally {
            providerSpan.end();
        }
    }

    private void audit(ProviderAttemptContext context) {
        RequestAuditRecord auditRecord = new RequestAuditRecord(
                context.traceId(),
                context.runId(),
                context.provider(),
                context.model(),
                context.redactedParameters(),
                context.promptHash(),
                context.instructionsHash(),
                context.contextHash(),
                Instant.now());
        observers.audit().persist(auditRecord);
    }

    private AttemptOutcome executeAttempt(ProviderAttemptContext context, int attempt, TelemetrySpan providerSpan) {
        emit(LlmEvent.builder(LlmEventTypes.STARTING, context.runId())
                .put("provider", context.provider())
                .put("model", context.model())
                .put("paramsHash", context.paramsHash())
                .put("promptHash", context.promptHash())
                .put("instructionsHash", context.instructionsHash())
                .put("chainIndex", context.chainIndex())
                .put("chainLength", context.chainLength())
                .put("attempt", attempt)
                .put("violation", false)
                .build());
        providerSpan.setAttribute("llm.attempt", attempt);

        Optional<ProviderStreamFactory> factory = providers.find(context.provider());
        if (factory.isEmpty()) {
            return AttemptOutcome.failure(new LlmProviderException(
                    "No stream adapter registered for provider '" + context.provider() + "'",
                    false, LlmErrorCategories.PROVIDER_UNAVAILABLE, false), attempt);
        }

        CallMetadata metadata = new CallMetadata(context.runId(), context.traceId(), attempt);
        ProviderStream stream;
        try {
            stream = factory.get().openStream(context.prompt(), context.parameters(), context.handle(), metadata);
        } catch (LlmProviderException providerFailure) {
            return AttemptOutcome.failure(providerFailure, attempt);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            return AttemptOutcome.failure(asProviderError(interrupted), attempt);
        } catch (Exception openFailure) {
            return AttemptOutcome.failure(asProviderError(openFailure), attempt);
        }
        if (stream == null) {
            return AttemptOutcome.failure(new LlmProviderException(
                    "Provider '" + context.provider() + "' returned no stream",
                    false, LlmErrorCategories.PROVIDER_ERROR, false), attempt);
        }
        try {
            return consume(context, stream, attempt, providerSpan);
        } finally {
            stream.close();
        }
    }

    private AttemptOutcome consume(
            ProviderAttemptContext context, ProviderStream stream, int attempt, TelemetrySpan providerSpan) {
        ProviderUsage usage = stream.usage();
        StreamTally tally = new StreamTally(usage);
        if (tally.promptTokens <= 0) {
            tally.promptTokens = tokenEstimator.estimate(context.prompt());
            usage.setPromptTokens(tally.promptTokens);
        }
        observers.telemetry().recordTokens(context.provider(), context.model(), TOKENS_PROMPT, tally.promptTokens);

        BudgetEnforcer budget = BudgetEnforcer.forCall(
                settings.tokensCap(), context.parameters().maxTokens(), settings.costCapUsd());
        StringBuilder text = new StringBuilder();
        int tokenIndex = 0;
        String finishReason = null;

        while (true) {
            if (context.cancelToken().isCanceled()) {
                return cancel(context, stream, tally, text, attempt, providerSpan);
            }

            Optional<ProviderEvent> next;
            try {
                next = stream.next();
            } catch (LlmProviderException providerFailure) {
                stream.cancel();
                return AttemptOutcome.failure(providerFailure, attempt);
            } catch (RuntimeException iterationFailure) {
                stream.cancel();
                return AttemptOutcome.failure(asProviderError(iterationFailure), attempt);
            }
            if (next.isEmpty()) {
                break;
            }

            ProviderEvent event = next.get();
            if (event instanceof ProviderEvent.Token token) {
                text.append(token.delta());
                emit(LlmEvent.builder(LlmEventTypes.TOKEN, context.runId())
                        .put("delta", token.delta())
                        .put("idx", tokenIndex++)
                        .build());
                int added = tally.applyTokenUsage(token.usage(), Math.max(1, tokenEstimator.estimate(token.delta())));
                observers.telemetry().recordTokens(context.provider(), context.model(), TOKENS_COMPLETION, added);
                tally.writeTo(usage);
                log.debug("[LLM] Token runId={} provider={} index={} completionTokens={}",
                        context.runId(), context.provider(), tokenIndex - 1, tally.completionTokens);

                Optional<BudgetEnforcer.BudgetBreach> breach =
                        budget.check(tally.completionTokens, tally.costUsd());
                if (breach.isPresent()) {
                    return abortOnBudget(context, stream, tally, text, breach.get(), attempt, providerSpan);
                }
            } else if (event instanceof ProviderEvent.Complete complete) {
                finishReason = complete.finishReason();
                int added = tally.applyCompleteUsage(complete.usage());
                if (added > 0) {
                    observers.telemetry().recordTokens(
                            context.provider(), context.model(), TOKENS_COMPLETION, added);
                }
                tally.writeTo(usage);
                break;
            } else if (event instanceof ProviderEvent.Error error) {
                return AttemptOutcome.failure(new LlmProviderException(
                        error.message(), error.retryable(), error.category(), error.violation()), attempt);
            }
        }

        String resolvedFinish = finishReason == null || finishReason.isBlank() ? CallSummary.FINISH_STOP : finishReason;
        emit(completeEvent(context, tally, resolvedFinish, false));
        recordUsage(providerSpan, tally, resolvedFinish);
        log.info("[LLM] Completed runId={} provider={} finishReason={} promptTokens={} completionTokens={}",
                context.runId(), context.provider(), resolvedFinish, tally.promptTokens, tally.completionTokens);
        return new AttemptOutcome.Success(summary(context, tally, resolvedFinish, null, text), attempt);
    }

    private AttemptOutcome cancel(
            ProviderAttemptContext context,
            ProviderStream stream,
            StreamTally tally,
            StringBuilder text,
            int attempt,
            TelemetrySpan providerSpan) {
        stream.cancel();
        emit(LlmEvent.builder(LlmEventTypes.CANCELED, context.runId())
                .put("provider", context.provider())
                .put("model", context.model())
                .put("reason", CANCEL_REASON_TOKEN)
                .build());
        recordUsage(providerSpan, tally, CallSummary.FINISH_CANCELED);
        log.info("[LLM] Call canceled runId={} provider={} completionTokens={}",
                context.runId(), context.provider(), tally.completionTokens);
        return new AttemptOutcome.Success(summary(context, tally, CallSummary.FINISH_CANCELED, null, text), attempt);
    }

    private AttemptOutcome abortOnBudget(
            ProviderAttemptContext context,
            ProviderStream stream,
            StreamTally tally,
            StringBuilder text,
            BudgetEnforcer.BudgetBreach breach,
            int attempt,
            TelemetrySpan providerSpan) {
        stream.cancel();
        emit(LlmEvent.builder(LlmEventTypes.ERROR, context.runId())
                .put("category", LlmErrorCategories.BUDGET_EXHAUSTED)
                .put("message", "Budget exhausted: " + breach.reason())
                .put("retryable", false)
                .put("attempt", attempt)
                .put("violation", false)
                .build());
        emit(LlmEvent.builder(LlmEventTypes.BUDGET_EXHAUSTED, context.runId())
                .put("provider", context.provider())
                .put("model", context.model())
                .put("reason", breach.reason())
                .put("chainIndex", context.chainIndex())
                .put("tokensPrompt", tally.promptTokens)
                .put("tokensCompletion", tally.completionTokens)
                .put("costUsd", tally.costUsd())
                .build());
        observers.telemetry().recordBudgetAbort(context.provider(), context.model(), breach.reason());
        log.warn("[LLM] Budget exhausted runId={} provider={} reason={} completionTokens={} costUsd={}",
                context.runId(), context.provider(), breach.reason(), tally.completionTokens, tally.costUsd());

        emit(completeEvent(context, tally, CallSummary.FINISH_STOP_ON_BUDGET, true));
        recordUsage(providerSpan, tally, CallSummary.FINISH_STOP_ON_BUDGET);
        return new AttemptOutcome.Success(
                summary(context, tally, CallSummary.FINISH_STOP_ON_BUDGET, CallSummary.ERROR_BUDGET_EXHAUSTED, text),
                attempt);
    }

    private LlmEvent completeEvent(ProviderAttemptContext context, StreamTally tally, String finishReason,
            boolean budgetExhausted) {
        LlmEvent.Builder builder = LlmEvent.builder(LlmEventTypes.COMPLETE, context.runId())
                .put("finishReason", finishReason)
                .put("tokensPrompt", tally.promptTokens)
                .put("tokensCompletion", tally.completionTokens)
                .putIfPresent("costUsd", tally.reportedCostUsd);
        if (budgetExhausted) {
            builder.put("budgetExhausted", true);
        }
        return builder.build();
    }

    private void emitProviderSucceeded(ProviderAttemptContext context, AttemptOutcome.Success success) {
        CallSummary summary = success.summary();
        emit(LlmEvent.builder(LlmEventTypes.PROVIDER_SUCCEEDED, context.runId())
                .put("provider", context.provider())
                .put("model", context.model())
                .put("chainIndex", context.chainIndex())
                .put("attempt", success.attempt())
                .put("finishReason", summary.finishReason())
                .put("tokensPrompt", summary.tokensPrompt())
                .put("tokensCompletion", summary.tokensCompletion())
                .putIfPresent("costUsd", summary.costUsd())
                .build());
    }

    private void recordAttemptFailure(
            ProviderAttemptContext context, LlmProviderException failure, int attempt, TelemetrySpan providerSpan) {
        emit(LlmEvent.builder(LlmEventTypes.ERROR, context.runId())
                .put("category", failure.getCategory())
                .put("message", failure.getMessage())
                .put("retryable", failure.isRetryable())
                .put("attempt", attempt)
                .put("violation", failure.isViolation())
                .build());
        observers.telemetry().recordFailure(context.provider(), context.model(), failure.getCategory());
        providerSpan.recordError(failure);
        log.warn("[LLM] Attempt failed runId={} provider={} attempt={} category={} retryable={} violation={}: {}",
                context.runId(), context.provider(), attempt, failure.getCategory(),
                failure.isRetryable(), failure.isViolation(), failure.getMessage());
    }

    private void announceFailover(
            ProviderAttemptContext context,
            ProviderHandle next,
            String nextModel,
            LlmProviderException failure,
            int attempt) {
        emit(LlmEvent.builder(LlmEventTypes.PROVIDER_FAILOVER, context.runId())
                .put("fromProvider", context.provider())
                .put("fromModel", context.model())
                .put("toProvider", next.provider())
                .put("toModel", nextModel)
                .put("attempt", attempt)
                .put("chainIndex", context.chainIndex())
                .put("category", failure.getCategory())
                .build());
        observers.telemetry().recordFallback(context.handle(), next, failure.getCategory());
        log.warn("[LLM] Failing over runId={} from={} to={} category={}",
                context.runId(), context.handle().label(), next.label(), failure.getCategory());
    }

    private static void recordUsage(TelemetrySpan providerSpan, StreamTally tally, String finishReason) {
        providerSpan.setAttribute("llm.finish_reason", finishReason);
        providerSpan.setAttribute("llm.prompt_tokens", tally.promptTokens);
        providerSpan.setAttribute("llm.completion_tokens", tally.completionTokens);
        providerSpan.setAttribute("llm.cost_usd", tally.reportedCostUsd);
    }

    private void pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry interrupted", interrupted);
        }
    }

    private void emit(LlmEvent event) {
        observers.events().emit(event);
    }

    private static CallSummary summary(
            ProviderAttemptContext context, StreamTally tally, String finishReason, String error, StringBuilder text) {
        return new CallSummary(
                context.provider(),
                context.model(),
                tally.promptTokens,
                tally.completionTokens,
                finishReason,
                tally.reportedCostUsd,
                error,
                text.toString());
    }

    private static LlmProviderException failureOf(AttemptOutcome outcome) {
        if (outcome instanceof AttemptOutcome.RetryableFailure retryable) {
            return retryable.failure();
        }
        if (outcome instanceof AttemptOutcome.TerminalFailure terminal) {
            return terminal.failure();
        }
        throw new IllegalArgumentException("Outcome is not a failure: " + outcome);
    }

    private static LlmProviderException asProviderError(Exception failure) {
        String message = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
        return new LlmProviderException(message, false, LlmErrorCategories.PROVIDER_ERROR, false, failure);
    }

    /**
     * Running token and cost totals for one attempt.
     */
    private static final class StreamTally {
        private int promptTokens;
        private int completionTokens;
        private Double reportedCostUsd;

        private StreamTally(ProviderUsage seed) {
            this.promptTokens = seed.promptTokens() == null ? 0 : seed.promptTokens();
            this.completionTokens = seed.completionTokens() == null ? 0 : seed.completionTokens();
            this.reportedCostUsd = seed.costUsd();
        }

        /**
         * Applies usage from a token event. Reported completion counts replace the running total;
         * otherwise the delta's estimate is added.
         *
         * @return tokens added to the running total
         */
        private int applyTokenUsage(UsageReport report, int estimatedDelta) {
            int before = completionTokens;
            if (report.completionTokens() != null) {
                completionTokens = report.completionTokens();
            } else {
                completionTokens += estimatedDelta;
            }
            if (report.promptTokens() != null) {
                promptTokens = report.promptTokens();
            }
            if (report.costUsd() != null) {
                reportedCostUsd = report.costUsd();
            }
            return Math.max(0, completionTokens - before);
        }

        /** Applies final usage from a complete event; returns tokens added. */
        private int applyCompleteUsage(UsageReport report) {
            int before = completionTokens;
            if (report.completionTokens() != null) {
                completionTokens = report.completionTokens();
            }
            if (report.promptTokens() != null) {
                promptTokens = report.promptTokens();
            }
            if (report.costUsd() != null) {
                reportedCostUsd = report.costUsd();
            }
            return Math.max(0, completionTokens - before);
        }

        private double costUsd() {
            return reportedCostUsd == null ? 0.0 : reportedCostUsd;
        }

        private void writeTo(ProviderUsage usage) {
            usage.setPromptTokens(promptTokens);
            usage.setCompletionTokens(completionTokens);
            usage.setCostUsd(reportedCostUsd);
        }
    }
}
